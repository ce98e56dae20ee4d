package com.decisionledger.signal.vision;

import com.decisionledger.signal.EvaluationInput;
import com.decisionledger.signal.EvaluationSignal;
import com.decisionledger.signal.RiskLevel;
import com.decisionledger.signal.SignalOutcome;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VisionSignalProducerTest {

    private static final byte[] IMAGE = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};

    @Test
    void noImage_isNotAttempted() {
        VisionSignalProducer producer = new VisionSignalProducer((image, timeout) -> {
            throw new AssertionError("detector must not be called");
        }, RiskLevel.HIGH);

        SignalOutcome outcome = producer.produce(EvaluationInput.text("text only", null, null), null, Duration.ofSeconds(1));

        SignalOutcome.NoSignal none = assertInstanceOf(SignalOutcome.NoSignal.class, outcome);
        assertTrue(none.evidence().isEmpty());
    }

    @Test
    void faces_produceConfiguredRiskLevel() {
        VisionSignalProducer producer = new VisionSignalProducer(
            (image, timeout) -> new FaceDetection(2, List.of(List.of(1, 2, 30, 30), List.of(50, 60, 30, 30)), null),
            RiskLevel.HIGH);

        SignalOutcome outcome = producer.produce(withImage(), null, Duration.ofSeconds(1));

        EvaluationSignal signal = assertInstanceOf(SignalOutcome.Produced.class, outcome).signal();
        assertEquals(RiskLevel.HIGH, signal.riskLevel());
        assertEquals(Set.of(VisionSignalProducer.FACE_DETECTION_TAG), signal.tags());
        assertEquals(0.7, signal.confidence(), 1e-9);
    }

    @Test
    void confidence_isCapped() {
        VisionSignalProducer producer = new VisionSignalProducer(
            (image, timeout) -> new FaceDetection(12, List.of(), null), RiskLevel.UNACCEPTABLE);

        EvaluationSignal signal = ((SignalOutcome.Produced) producer.produce(withImage(), null, Duration.ofSeconds(1))).signal();

        assertEquals(0.9, signal.confidence(), 1e-9);
    }

    @Test
    void zeroFaces_isNoSignalWithEvidence() {
        VisionSignalProducer producer = new VisionSignalProducer(
            (image, timeout) -> new FaceDetection(0, List.of(), null), RiskLevel.HIGH);

        SignalOutcome outcome = producer.produce(withImage(), null, Duration.ofSeconds(1));

        SignalOutcome.NoSignal none = assertInstanceOf(SignalOutcome.NoSignal.class, outcome);
        assertEquals(0, none.evidence().get("faces_detected"));
    }

    @Test
    void detectorErrors_areFailedOutcomes() {
        VisionSignalProducer throwing = new VisionSignalProducer((image, timeout) -> {
            throw new IllegalStateException("connection refused");
        }, RiskLevel.HIGH);
        VisionSignalProducer reporting = new VisionSignalProducer(
            (image, timeout) -> new FaceDetection(0, List.of(), "Invalid image format"), RiskLevel.HIGH);

        assertInstanceOf(SignalOutcome.Failed.class, throwing.produce(withImage(), null, Duration.ofSeconds(1)));
        SignalOutcome.Failed failed = assertInstanceOf(SignalOutcome.Failed.class,
            reporting.produce(withImage(), null, Duration.ofSeconds(1)));
        assertEquals("Invalid image format", failed.reason());
    }

    private static EvaluationInput withImage() {
        return new EvaluationInput("photo", IMAGE, "app", "alice", null);
    }
}
