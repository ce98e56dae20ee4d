package com.decisionledger.ledger;

import com.decisionledger.evidence.EvidenceBundle;
import com.decisionledger.evidence.EvidenceEntry;
import com.decisionledger.evidence.EvidenceSideband;
import com.decisionledger.evidence.EvidenceWriteResult;
import com.decisionledger.merge.PolicyDecision;
import com.decisionledger.signal.Decision;
import com.decisionledger.signal.EvaluationInput;
import com.decisionledger.signing.Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tamper-evident, append-only record of decisions and their overrides.
 *
 * Every record is signed over its signable subset before the single store
 * insert, so nothing unsigned is ever visible. Reads verify signatures on
 * the way out.
 */
public class AuditLedger {

    private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);

    public static final String EVIDENCE_FAILURE_PREFIX = "evidence_storage_failed:";

    private final AuditStore store;
    private final Signer signer;
    private final AuditBundleVerifier verifier;
    private final EvidenceSideband evidence;
    private final Clock clock;

    public AuditLedger(AuditStore store, Signer signer, EvidenceSideband evidence, Clock clock) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.signer = Objects.requireNonNull(signer, "signer is required");
        this.verifier = new AuditBundleVerifier(signer);
        this.evidence = Objects.requireNonNull(evidence, "evidence sideband is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Record one decision. The raw input is hashed here and then dropped.
     *
     * @throws LedgerWriteException when the event could not be persisted
     */
    public AuditEvent record(PolicyDecision decision, EvaluationInput input, EvidenceBundle bundle) {
        Objects.requireNonNull(decision, "decision is required");
        Objects.requireNonNull(input, "input is required");
        EvidenceBundle evidenceBundle = bundle == null ? EvidenceBundle.empty() : bundle;

        Instant now = now();
        String eventId = RecordIds.eventId(now);
        List<String> evidenceRefs = storeEvidence(eventId, evidenceBundle);

        AuditEvent unsigned = new AuditEvent(
            eventId,
            now,
            InputDigests.sha256Hex(input.text()),
            input.user(),
            input.clientId(),
            input.inputType(),
            decision.decision(),
            decision.riskLevel(),
            decision.policyTags(),
            decision.policyVersion(),
            decision.confidenceScore(),
            decision.explanation(),
            evidenceRefs,
            null);
        AuditEvent signed = withSignature(unsigned, signer.signFields(SignablePayloads.forEvent(unsigned)));

        try {
            store.appendEvent(signed);
        } catch (RuntimeException ex) {
            log.error("Decision could not be recorded event_id={}: {}", eventId, ex.getMessage());
            throw new LedgerWriteException("decision could not be recorded", ex);
        }

        log.info("Recorded audit event event_id={} decision={} risk_level={} policy_version={}",
            eventId, signed.decision().getValue(), signed.riskLevel().getValue(), signed.policyVersion());
        return signed;
    }

    public AuditOverride override(String originalEventId, String operator, String reason,
                                  String newDecision, Integer duration) {
        if (reason == null || reason.isBlank()) {
            throw rejected("reason is required");
        }
        if (operator == null || operator.isBlank()) {
            throw rejected("operator is required");
        }
        Decision decision;
        try {
            decision = Decision.fromValue(newDecision);
        } catch (IllegalArgumentException ex) {
            throw rejected("unknown new_decision: " + newDecision);
        }
        if (decision == null) {
            throw rejected("new_decision is required");
        }
        if (duration != null && duration <= 0) {
            throw rejected("duration must be positive minutes: " + duration);
        }
        if (originalEventId == null || !store.existsByEventId(originalEventId)) {
            throw new AuditEventNotFoundException(originalEventId);
        }

        Instant now = now();
        AuditOverride unsigned = new AuditOverride(
            RecordIds.overrideId(now), originalEventId, now, operator, reason, decision, duration, null);
        AuditOverride signed = new AuditOverride(
            unsigned.overrideId(), unsigned.originalEventId(), unsigned.timestamp(), unsigned.operator(),
            unsigned.reason(), unsigned.newDecision(), unsigned.duration(),
            signer.signFields(SignablePayloads.forOverride(unsigned)));

        try {
            store.appendOverride(signed);
        } catch (RuntimeException ex) {
            log.error("Override could not be recorded for event_id={}: {}", originalEventId, ex.getMessage());
            throw new LedgerWriteException("override could not be recorded", ex);
        }

        log.info("Recorded override override_id={} event_id={} new_decision={} operator={}",
            signed.overrideId(), originalEventId, decision.getValue(), operator);
        return signed;
    }

    public AuditEvent get(String eventId) {
        AuditEvent event = store.findEvent(eventId)
            .orElseThrow(() -> new AuditEventNotFoundException(eventId));
        requireIntact(event);
        return event;
    }

    public Optional<AuditEvent> find(String eventId) {
        return store.findEvent(eventId).map(event -> {
            requireIntact(event);
            return event;
        });
    }

    public List<AuditEvent> list(AuditEventFilter filter) {
        List<AuditEvent> events = store.queryEvents(filter == null ? AuditEventFilter.all() : filter);
        events.forEach(this::requireIntact);
        return events;
    }

    public List<AuditOverride> overridesFor(String eventId) {
        List<AuditOverride> overrides = store.overridesFor(eventId);
        overrides.forEach(this::requireIntact);
        return overrides;
    }

    /**
     * Self-contained export of an event with all its overrides, oldest first.
     * Every signature is re-verified; nothing is re-signed.
     */
    public AuditBundle exportBundle(String eventId) {
        AuditEvent event = store.findEvent(eventId)
            .orElseThrow(() -> new AuditEventNotFoundException(eventId));
        List<AuditOverride> overrides = store.overridesFor(eventId);

        ExportMetadata metadata = new ExportMetadata(
            now(),
            ExportMetadata.BUNDLE_SCHEMA_VERSION,
            Signer.ALGORITHM_TAG,
            ExportMetadata.COMPLIANCE_FRAMEWORK,
            SignablePayloads.EVENT_FIELDS,
            SignablePayloads.OVERRIDE_FIELDS);
        AuditBundle bundle = new AuditBundle(event, overrides, metadata);

        BundleVerificationReport report = verifier.verify(bundle);
        if (!report.ok()) {
            BundleVerificationReport.Issue first = report.issues().get(0);
            log.error("Export of event_id={} failed verification: {} issue(s), first on {}",
                eventId, report.issues().size(), first.recordId());
            throw new IntegrityViolationException(first.recordId(), first.problem());
        }
        log.info("Exported audit bundle event_id={} overrides={}", eventId, overrides.size());
        return bundle;
    }

    public LedgerStatistics statistics() {
        return new LedgerStatistics(
            store.countEvents(Optional.empty()),
            store.countEvents(Optional.of(Decision.BLOCK)),
            store.countEvents(Optional.of(Decision.FLAG)),
            store.countEvents(Optional.of(Decision.ALLOW)),
            store.countOverrides());
    }

    private List<String> storeEvidence(String eventId, EvidenceBundle bundle) {
        List<String> refs = new ArrayList<>();
        for (EvidenceEntry entry : bundle.entries()) {
            if (entry.isEmpty()) {
                continue;
            }
            String key = EvidenceSideband.keyFor(eventId, entry.source());
            EvidenceWriteResult result = evidence.put(key, entry.document());
            if (result.stored()) {
                refs.add(key);
            } else {
                log.warn("Evidence for event_id={} source={} not stored: {}",
                    eventId, entry.source().getValue(), result.error());
                refs.add(EVIDENCE_FAILURE_PREFIX + entry.source().getValue());
            }
        }
        return refs;
    }

    private void requireIntact(AuditEvent event) {
        if (!verifier.verify(event)) {
            log.error("Signature mismatch on audit event event_id={}", event.eventId());
            throw new IntegrityViolationException(event.eventId(), "audit event signature mismatch");
        }
    }

    private void requireIntact(AuditOverride override) {
        if (!verifier.verify(override)) {
            log.error("Signature mismatch on override override_id={}", override.overrideId());
            throw new IntegrityViolationException(override.overrideId(), "override signature mismatch");
        }
    }

    private InvalidOverrideRequestException rejected(String message) {
        log.warn("Override request rejected: {}", message);
        return new InvalidOverrideRequestException(message);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private static AuditEvent withSignature(AuditEvent e, String signature) {
        return new AuditEvent(e.eventId(), e.timestamp(), e.inputHash(), e.user(), e.clientId(), e.inputType(),
            e.decision(), e.riskLevel(), e.policyTags(), e.policyVersion(), e.confidenceScore(),
            e.explanation(), e.evidenceRefs(), signature);
    }
}
