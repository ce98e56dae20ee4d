package com.decisionledger.ledger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The exact field subsets covered by record signatures. Anything outside
 * these lists (confidence, explanation, evidence refs, input type) is
 * descriptive and may be absent from an export without breaking verification.
 */
public final class SignablePayloads {

    public static final List<String> EVENT_FIELDS = List.of(
        "event_id", "timestamp", "input_hash", "user", "client_id",
        "decision", "policy_tags", "risk_level", "policy_version");

    public static final List<String> OVERRIDE_FIELDS = List.of(
        "override_id", "original_event_id", "timestamp", "operator",
        "new_decision", "reason", "duration");

    private SignablePayloads() {
    }

    public static Map<String, Object> forEvent(AuditEvent event) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event_id", event.eventId());
        fields.put("timestamp", event.timestamp());
        fields.put("input_hash", event.inputHash());
        fields.put("user", event.user());
        fields.put("client_id", event.clientId());
        fields.put("decision", event.decision());
        fields.put("policy_tags", event.policyTags());
        fields.put("risk_level", event.riskLevel());
        fields.put("policy_version", event.policyVersion());
        return fields;
    }

    public static Map<String, Object> forOverride(AuditOverride override) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("override_id", override.overrideId());
        fields.put("original_event_id", override.originalEventId());
        fields.put("timestamp", override.timestamp());
        fields.put("operator", override.operator());
        fields.put("new_decision", override.newDecision());
        fields.put("reason", override.reason());
        fields.put("duration", override.duration());
        return fields;
    }
}
