package com.decisionledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Self-contained export of one event and every override attached to it,
 * verifiable offline by anyone holding the signing key.
 */
public record AuditBundle(
    @JsonProperty("audit_event") AuditEvent auditEvent,
    @JsonProperty("overrides") List<AuditOverride> overrides,
    @JsonProperty("export_metadata") ExportMetadata exportMetadata
) {

    public AuditBundle {
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }
}
