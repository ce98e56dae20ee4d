package com.decisionledger.signal.classifier;

import com.decisionledger.merge.DecisionMergeEngine;
import com.decisionledger.merge.MergeSettings;
import com.decisionledger.merge.PolicyDecision;
import com.decisionledger.signal.Decision;
import com.decisionledger.signal.EvaluationInput;
import com.decisionledger.signal.EvaluationSignal;
import com.decisionledger.signal.RiskLevel;
import com.decisionledger.signal.SignalOutcome;
import com.decisionledger.signal.SignalSource;
import com.decisionledger.signal.pattern.PatternSignalProducer;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HttpClassifierSignalProducerTest {

    private static final EvaluationInput INPUT = EvaluationInput.text("automated credit scoring ai", "app", "alice");

    @Test
    void verdict_isMappedToClassifierSignal() {
        String body = "{\"risk_level\":\"high\",\"decision\":\"flag\",\"policy_tags\":[\"HighRiskAI\"],"
            + "\"confidence_score\":0.82,\"explanation\":\"Annex III credit scoring\","
            + "\"eu_ai_act_articles\":[\"Annex III\"],\"compliance_requirements\":[\"Risk management\"],"
            + "\"evidence\":{},\"model\":\"ignored\"}";
        HttpClassifierSignalProducer producer = producer(respond(HttpStatus.OK, body), true);

        SignalOutcome outcome = producer.produce(INPUT, null, Duration.ofSeconds(2));

        EvaluationSignal signal = assertInstanceOf(SignalOutcome.Produced.class, outcome).signal();
        assertEquals(RiskLevel.HIGH, signal.riskLevel());
        assertEquals(Set.of("HighRiskAI"), signal.tags());
        assertEquals(0.82, signal.confidence(), 1e-9);
        assertEquals("Annex III credit scoring", signal.rationale());
    }

    @Test
    void serverError_isFailed() {
        HttpClassifierSignalProducer producer = producer(respond(HttpStatus.SERVICE_UNAVAILABLE, "{}"), true);

        SignalOutcome.Failed failed = assertInstanceOf(SignalOutcome.Failed.class,
            producer.produce(INPUT, null, Duration.ofSeconds(2)));
        assertTrue(failed.reason().contains("503"));
    }

    @Test
    void slowClassifier_isFailedAfterTimeout() {
        ExchangeFunction never = request -> Mono.never();
        HttpClassifierSignalProducer producer = producer(never, true);

        assertInstanceOf(SignalOutcome.Failed.class, producer.produce(INPUT, null, Duration.ofMillis(100)));
    }

    @Test
    void unknownRiskLevel_isFailed() {
        HttpClassifierSignalProducer producer = producer(
            respond(HttpStatus.OK, "{\"risk_level\":\"catastrophic\",\"confidence_score\":0.5}"), true);

        assertInstanceOf(SignalOutcome.Failed.class, producer.produce(INPUT, null, Duration.ofSeconds(2)));
    }

    @Test
    void verdictWithoutConfidence_isFailed_andRuleBasedSignalsDecide() {
        HttpClassifierSignalProducer producer = producer(respond(HttpStatus.OK, "{\"risk_level\":\"limited\"}"), true);

        SignalOutcome classifier = producer.produce(INPUT, null, Duration.ofSeconds(2));
        SignalOutcome.Failed failed = assertInstanceOf(SignalOutcome.Failed.class, classifier);
        assertEquals(SignalSource.CLASSIFIER, failed.source());
        assertEquals("verdict without confidence_score", failed.reason());

        SignalOutcome pattern = new PatternSignalProducer().produce(INPUT, null, Duration.ofSeconds(2));
        PolicyDecision decision = DecisionMergeEngine.standard(MergeSettings.defaults())
            .mergeOutcomes(List.of(pattern, classifier), "pack-test")
            .decision();

        assertEquals(RiskLevel.HIGH, decision.riskLevel());
        assertEquals(Decision.FLAG, decision.decision());
        assertTrue(decision.policyTags().contains("HighRiskAI"));
    }

    @Test
    void disabled_makesNoCall() {
        AtomicInteger calls = new AtomicInteger();
        ExchangeFunction counting = request -> {
            calls.incrementAndGet();
            return Mono.empty();
        };
        HttpClassifierSignalProducer producer = producer(counting, false);

        assertInstanceOf(SignalOutcome.NoSignal.class, producer.produce(INPUT, null, Duration.ofSeconds(2)));
        assertEquals(0, calls.get());
    }

    private static HttpClassifierSignalProducer producer(ExchangeFunction exchange, boolean enabled) {
        WebClient client = WebClient.builder().exchangeFunction(exchange).baseUrl("http://classifier.test").build();
        return new HttpClassifierSignalProducer(client, "/classify", enabled);
    }

    private static ExchangeFunction respond(HttpStatus status, String body) {
        return request -> Mono.just(ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
    }
}
