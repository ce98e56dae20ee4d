package com.decisionledger.ledger;

import com.decisionledger.signal.Decision;
import com.decisionledger.signal.RiskLevel;
import com.decisionledger.signing.Canonicalizer;
import com.decisionledger.signing.Signer;
import com.decisionledger.signing.SigningKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditBundleVerifierTest {

    private static final Instant AT = Instant.parse("2026-02-01T10:00:00Z");

    private Signer signer;
    private AuditBundleVerifier verifier;

    @BeforeEach
    void setUp() {
        signer = new Signer(SigningKey.fromSecret("verifier-test-secret-0123"), new Canonicalizer());
        verifier = new AuditBundleVerifier(signer);
    }

    @Test
    void intactBundle_isOk() {
        AuditEvent event = signedEvent("evt-20260201-abcdefgh", "explanation");
        AuditOverride override = signedOverride("ovr-20260201-12345678", event.eventId());

        BundleVerificationReport report = verifier.verify(new AuditBundle(event, List.of(override), null));

        assertTrue(report.ok());
        assertEquals(2, report.recordsChecked());
        assertEquals(2, report.recordsValid());
    }

    @Test
    void unsignedFields_mayChangeWithoutBreakingVerification() {
        AuditEvent event = signedEvent("evt-20260201-abcdefgh", "original explanation");
        AuditEvent edited = new AuditEvent(event.eventId(), event.timestamp(), event.inputHash(), event.user(),
            event.clientId(), "image", event.decision(), event.riskLevel(), event.policyTags(),
            event.policyVersion(), 3, "rewritten", List.of("evidence_storage_failed:vision"), event.signature());

        assertTrue(verifier.verify(edited));
    }

    @Test
    void tamperedOverride_isReported() {
        AuditEvent event = signedEvent("evt-20260201-abcdefgh", "x");
        AuditOverride override = signedOverride("ovr-20260201-12345678", event.eventId());
        AuditOverride tampered = new AuditOverride(override.overrideId(), override.originalEventId(),
            override.timestamp(), override.operator(), "different reason", override.newDecision(),
            override.duration(), override.signature());

        BundleVerificationReport report = verifier.verify(new AuditBundle(event, List.of(tampered), null));

        assertFalse(report.ok());
        assertEquals(1, report.recordsValid());
        assertEquals("ovr-20260201-12345678", report.issues().get(0).recordId());
    }

    @Test
    void overrideForAnotherEvent_isReported() {
        AuditEvent event = signedEvent("evt-20260201-abcdefgh", "x");
        AuditOverride foreign = signedOverride("ovr-20260201-12345678", "evt-20260201-zzzzzzzz");

        BundleVerificationReport report = verifier.verify(new AuditBundle(event, List.of(foreign), null));

        assertFalse(report.ok());
        assertTrue(report.issues().get(0).problem().contains("evt-20260201-zzzzzzzz"));
    }

    private AuditEvent signedEvent(String id, String explanation) {
        AuditEvent unsigned = new AuditEvent(id, AT, InputDigests.sha256Hex("input"), "alice", "app-1", "text",
            Decision.FLAG, RiskLevel.HIGH, List.of("HighRiskAI"), "pack-1", 80, explanation, List.of(), null);
        String signature = signer.signFields(SignablePayloads.forEvent(unsigned));
        return new AuditEvent(id, AT, unsigned.inputHash(), "alice", "app-1", "text", Decision.FLAG,
            RiskLevel.HIGH, List.of("HighRiskAI"), "pack-1", 80, explanation, List.of(), signature);
    }

    private AuditOverride signedOverride(String id, String eventId) {
        AuditOverride unsigned = new AuditOverride(id, eventId, AT, "ops", "reviewed", Decision.ALLOW, null, null);
        return new AuditOverride(id, eventId, AT, "ops", "reviewed", Decision.ALLOW, null,
            signer.signFields(SignablePayloads.forOverride(unsigned)));
    }
}
