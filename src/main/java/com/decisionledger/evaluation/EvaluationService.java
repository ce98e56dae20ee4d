package com.decisionledger.evaluation;

import com.decisionledger.ledger.AuditBundle;
import com.decisionledger.ledger.AuditEvent;
import com.decisionledger.ledger.AuditEventFilter;
import com.decisionledger.ledger.AuditLedger;
import com.decisionledger.ledger.AuditOverride;
import com.decisionledger.merge.DecisionMergeEngine;
import com.decisionledger.merge.MergedEvaluation;
import com.decisionledger.policy.PolicyPack;
import com.decisionledger.policy.PolicyPackRegistry;
import com.decisionledger.signal.EvaluationInput;
import com.decisionledger.signal.SignalCollector;
import com.decisionledger.signal.SignalOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for evaluations and audit access.
 *
 * An evaluation reads the active pack once, collects signals, merges them
 * and records the result. A decision is only returned after it has been
 * recorded.
 */
@Service
public class EvaluationService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

    private final PolicyPackRegistry policyPacks;
    private final SignalCollector collector;
    private final DecisionMergeEngine mergeEngine;
    private final AuditLedger ledger;

    public EvaluationService(PolicyPackRegistry policyPacks,
                             SignalCollector collector,
                             DecisionMergeEngine mergeEngine,
                             AuditLedger ledger) {
        this.policyPacks = policyPacks;
        this.collector = collector;
        this.mergeEngine = mergeEngine;
        this.ledger = ledger;
    }

    public EvaluationResult evaluate(EvaluationInput input) {
        Objects.requireNonNull(input, "input is required");

        PolicyPack activePack = policyPacks.activePack().orElse(null);
        String policyVersion = activePack == null ? PolicyPack.FALLBACK_VERSION : activePack.version();

        List<SignalOutcome> outcomes = collector.collect(input, activePack);
        MergedEvaluation merged = mergeEngine.mergeOutcomes(outcomes, policyVersion);

        if (Thread.currentThread().isInterrupted()) {
            log.warn("Evaluation cancelled before recording for client_id={} user={}", input.clientId(), input.user());
            throw new EvaluationCancelledException("evaluation cancelled before the decision was recorded");
        }

        AuditEvent event = ledger.record(merged.decision(), input, merged.evidence());
        log.info("Evaluation decided {} for client_id={} event_id={}",
            merged.decision().decision().getValue(), input.clientId(), event.eventId());
        return new EvaluationResult(merged.decision(), event.eventId());
    }

    public AuditEvent getEvent(String eventId) {
        return ledger.get(eventId);
    }

    public List<AuditEvent> listEvents(AuditEventFilter filter) {
        return ledger.list(filter);
    }

    public List<AuditOverride> listOverrides(String eventId) {
        return ledger.overridesFor(eventId);
    }

    public AuditOverride createOverride(String eventId, OverrideRequest request) {
        Objects.requireNonNull(request, "override request is required");
        return ledger.override(eventId, request.operator(), request.reason(), request.newDecision(), request.duration());
    }

    public AuditBundle exportBundle(String eventId) {
        return ledger.exportBundle(eventId);
    }
}
