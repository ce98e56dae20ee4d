package com.decisionledger.signal.classifier;

import com.decisionledger.policy.PolicyPack;
import com.decisionledger.signal.ClassifierSignalProducer;
import com.decisionledger.signal.EvaluationInput;
import com.decisionledger.signal.EvaluationSignal;
import com.decisionledger.signal.RiskLevel;
import com.decisionledger.signal.SignalOutcome;
import com.decisionledger.signal.SignalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;

/**
 * Calls the external compliance classifier over HTTP.
 *
 * Transport errors, non-2xx responses, timeouts and unreadable verdicts all
 * come back as {@link SignalOutcome.Failed}; a disabled client reports
 * {@link SignalOutcome.NoSignal} without making a call.
 */
public class HttpClassifierSignalProducer implements ClassifierSignalProducer {

    private static final Logger log = LoggerFactory.getLogger(HttpClassifierSignalProducer.class);

    private final WebClient webClient;
    private final String path;
    private final boolean enabled;

    public HttpClassifierSignalProducer(WebClient webClient, String path, boolean enabled) {
        this.webClient = Objects.requireNonNull(webClient, "webClient is required");
        this.path = path == null || path.isBlank() ? "/classify" : path;
        this.enabled = enabled;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public SignalOutcome produce(EvaluationInput input, PolicyPack activePack, Duration timeout) {
        if (!enabled) {
            return SignalOutcome.none(SignalSource.CLASSIFIER);
        }

        ClassifierRequest request = new ClassifierRequest(input.text(), input.inputType(), context(input, activePack));
        Call call = webClient.post()
            .uri(path)
            .bodyValue(request)
            .exchangeToMono(resp -> {
                HttpStatusCode status = resp.statusCode();
                if (status.is2xxSuccessful()) {
                    return resp.bodyToMono(ClassifierVerdict.class).map(Call::ok);
                }
                return resp.releaseBody().then(Mono.just(Call.failed("classifier responded " + status.value())));
            })
            .timeout(timeout)
            .onErrorResume(e -> Mono.just(Call.failed("classifier call failed: " + e.getMessage())))
            .blockOptional()
            .orElse(Call.failed("classifier returned an empty body"));

        if (call.verdict() == null) {
            return SignalOutcome.failed(SignalSource.CLASSIFIER, call.error());
        }
        return toOutcome(call.verdict());
    }

    private SignalOutcome toOutcome(ClassifierVerdict verdict) {
        RiskLevel riskLevel;
        try {
            riskLevel = RiskLevel.fromValue(verdict.riskLevel());
        } catch (IllegalArgumentException ex) {
            return SignalOutcome.failed(SignalSource.CLASSIFIER, "unreadable verdict: " + ex.getMessage());
        }
        if (riskLevel == null) {
            return SignalOutcome.failed(SignalSource.CLASSIFIER, "verdict without risk_level");
        }
        if (verdict.confidenceScore() == null) {
            return SignalOutcome.failed(SignalSource.CLASSIFIER, "verdict without confidence_score");
        }
        double confidence = verdict.confidenceScore();
        if (!Double.isFinite(confidence)) {
            return SignalOutcome.failed(SignalSource.CLASSIFIER, "verdict confidence is not a number");
        }

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("suggested_decision", verdict.decision());
        raw.put("eu_ai_act_articles", verdict.euAiActArticles());
        raw.put("compliance_requirements", verdict.complianceRequirements());
        raw.put("evidence", verdict.evidence());

        log.debug("Classifier verdict risk_level={} confidence={}", riskLevel.getValue(), confidence);
        return SignalOutcome.produced(new EvaluationSignal(
            SignalSource.CLASSIFIER,
            riskLevel,
            verdict.policyTags() == null ? null : new LinkedHashSet<>(verdict.policyTags()),
            confidence,
            verdict.explanation(),
            raw));
    }

    private String context(EvaluationInput input, PolicyPack activePack) {
        String pack = activePack == null ? PolicyPack.FALLBACK_VERSION : activePack.version();
        return "client_id=" + input.clientId() + "; policy_version=" + pack;
    }

    private record Call(ClassifierVerdict verdict, String error) {

        static Call ok(ClassifierVerdict verdict) {
            return new Call(verdict, null);
        }

        static Call failed(String error) {
            return new Call(null, error);
        }
    }
}
