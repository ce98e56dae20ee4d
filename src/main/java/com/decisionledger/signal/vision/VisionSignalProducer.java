package com.decisionledger.signal.vision;

import com.decisionledger.policy.PolicyPack;
import com.decisionledger.signal.EvaluationInput;
import com.decisionledger.signal.EvaluationSignal;
import com.decisionledger.signal.RiskLevel;
import com.decisionledger.signal.SignalOutcome;
import com.decisionledger.signal.SignalProducer;
import com.decisionledger.signal.SignalSource;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

public class VisionSignalProducer implements SignalProducer {

    public static final String FACE_DETECTION_TAG = "FaceDetection";

    private final FaceDetector detector;
    private final RiskLevel faceRiskLevel;

    public VisionSignalProducer(FaceDetector detector, RiskLevel faceRiskLevel) {
        this.detector = Objects.requireNonNull(detector, "detector is required");
        this.faceRiskLevel = Objects.requireNonNull(faceRiskLevel, "face risk level is required");
    }

    @Override
    public SignalSource source() {
        return SignalSource.VISION;
    }

    @Override
    public SignalOutcome produce(EvaluationInput input, PolicyPack activePack, Duration timeout) {
        Optional<byte[]> image = input.imageData();
        if (image.isEmpty()) {
            // nothing to look at: not attempted
            return SignalOutcome.none(SignalSource.VISION);
        }

        FaceDetection detection;
        try {
            detection = detector.detect(image.get(), timeout);
        } catch (RuntimeException ex) {
            return SignalOutcome.failed(SignalSource.VISION, "face detection failed: " + ex.getMessage());
        }
        if (detection.error() != null && !detection.error().isBlank()) {
            return SignalOutcome.failed(SignalSource.VISION, detection.error());
        }

        int faces = detection.facesDetected();
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("faces_detected", faces);
        raw.put("face_locations", detection.faceLocations());
        raw.put("image_bytes", image.get().length);
        if (faces <= 0) {
            return new SignalOutcome.NoSignal(SignalSource.VISION, raw);
        }

        double confidence = Math.min(0.9, 0.3 + 0.2 * faces);
        String rationale = "Detected " + faces + (faces == 1 ? " face" : " faces") + " in submitted image";
        return SignalOutcome.produced(new EvaluationSignal(
            SignalSource.VISION, faceRiskLevel, Set.of(FACE_DETECTION_TAG), confidence, rationale, raw));
    }
}
