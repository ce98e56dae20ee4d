package com.decisionledger.api;

import com.decisionledger.evaluation.EvaluationService;
import com.decisionledger.evaluation.OverrideRequest;
import com.decisionledger.evidence.EvidenceSideband;
import com.decisionledger.ledger.AuditBundle;
import com.decisionledger.ledger.AuditBundleVerifier;
import com.decisionledger.ledger.AuditEvent;
import com.decisionledger.ledger.AuditEventFilter;
import com.decisionledger.ledger.AuditEventNotFoundException;
import com.decisionledger.ledger.AuditOverride;
import com.decisionledger.ledger.BundleVerificationReport;
import com.decisionledger.projection.EffectiveDecision;
import com.decisionledger.projection.EffectiveDecisionProjection;
import com.decisionledger.signal.Decision;
import com.decisionledger.signal.RiskLevel;
import com.decisionledger.signal.SignalSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    private final EvaluationService evaluationService;
    private final EffectiveDecisionProjection projection;
    private final AuditBundleVerifier verifier;
    private final EvidenceSideband evidence;

    public AuditController(EvaluationService evaluationService,
                           EffectiveDecisionProjection projection,
                           AuditBundleVerifier verifier,
                           EvidenceSideband evidence) {
        this.evaluationService = evaluationService;
        this.projection = projection;
        this.verifier = verifier;
        this.evidence = evidence;
    }

    @GetMapping("/events")
    public List<AuditEvent> listEvents(@RequestParam(required = false) String decision,
                                       @RequestParam(value = "risk_level", required = false) String riskLevel,
                                       @RequestParam(required = false) String user,
                                       @RequestParam(defaultValue = "100") int limit,
                                       @RequestParam(defaultValue = "0") int offset) {
        AuditEventFilter filter = new AuditEventFilter(
            Optional.ofNullable(decision).map(Decision::fromValue),
            Optional.ofNullable(riskLevel).map(RiskLevel::fromValue),
            Optional.ofNullable(user),
            limit,
            offset);
        return evaluationService.listEvents(filter);
    }

    @GetMapping("/events/{eventId}")
    public AuditEvent getEvent(@PathVariable String eventId) {
        return evaluationService.getEvent(eventId);
    }

    @PostMapping("/events/{eventId}/override")
    @ResponseStatus(HttpStatus.CREATED)
    public AuditOverride createOverride(@PathVariable String eventId, @RequestBody OverrideRequest request) {
        return evaluationService.createOverride(eventId, request);
    }

    @GetMapping("/events/{eventId}/overrides")
    public List<AuditOverride> listOverrides(@PathVariable String eventId) {
        return evaluationService.listOverrides(eventId);
    }

    @GetMapping("/events/{eventId}/effective")
    public EffectiveDecision effectiveDecision(@PathVariable String eventId) {
        return projection.getProjection(eventId)
            .orElseThrow(() -> new AuditEventNotFoundException(eventId));
    }

    /** Raw evidence document for one signal source, if it was stored. */
    @GetMapping("/events/{eventId}/evidence/{source}")
    public ResponseEntity<Map<String, Object>> evidence(@PathVariable String eventId, @PathVariable String source) {
        AuditEvent event = evaluationService.getEvent(eventId);
        String key = EvidenceSideband.keyFor(event.eventId(), SignalSource.fromValue(source));
        if (!event.evidenceRefs().contains(key)) {
            return ResponseEntity.notFound().build();
        }
        return evidence.get(key)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/export/{eventId}")
    public AuditBundle export(@PathVariable String eventId) {
        return evaluationService.exportBundle(eventId);
    }

    /** Offline-style check of a bundle exported earlier. */
    @PostMapping("/verify")
    public BundleVerificationReport verify(@RequestBody AuditBundle bundle) {
        if (bundle.auditEvent() == null) {
            throw new IllegalArgumentException("audit_event is required");
        }
        return verifier.verify(bundle);
    }
}
