package com.decisionledger.ledger;

import com.decisionledger.signing.Signer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks every signature in an {@link AuditBundle} and that each override
 * points back at the bundled event.
 */
public class AuditBundleVerifier {

    private final Signer signer;

    public AuditBundleVerifier(Signer signer) {
        this.signer = Objects.requireNonNull(signer, "signer is required");
    }

    public boolean verify(AuditEvent event) {
        return event.signature() != null
            && signer.verifyFields(SignablePayloads.forEvent(event), event.signature());
    }

    public boolean verify(AuditOverride override) {
        return override.signature() != null
            && signer.verifyFields(SignablePayloads.forOverride(override), override.signature());
    }

    public BundleVerificationReport verify(AuditBundle bundle) {
        AuditEvent event = bundle.auditEvent();
        List<BundleVerificationReport.Issue> issues = new ArrayList<>();
        int valid = 0;

        if (verify(event)) {
            valid++;
        } else {
            issues.add(new BundleVerificationReport.Issue(event.eventId(), "audit_event", "signature mismatch"));
        }

        for (AuditOverride override : bundle.overrides()) {
            boolean signatureOk = verify(override);
            boolean linked = event.eventId().equals(override.originalEventId());
            if (signatureOk && linked) {
                valid++;
            }
            if (!signatureOk) {
                issues.add(new BundleVerificationReport.Issue(override.overrideId(), "override", "signature mismatch"));
            }
            if (!linked) {
                issues.add(new BundleVerificationReport.Issue(override.overrideId(), "override",
                    "references " + override.originalEventId() + " instead of " + event.eventId()));
            }
        }

        return new BundleVerificationReport(event.eventId(), 1 + bundle.overrides().size(), valid, issues);
    }
}
