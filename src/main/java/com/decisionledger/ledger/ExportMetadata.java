package com.decisionledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record ExportMetadata(
    @JsonProperty("exported_at") Instant exportedAt,
    @JsonProperty("bundle_schema_version") String bundleSchemaVersion,
    @JsonProperty("signature_algorithm") String signatureAlgorithm,
    @JsonProperty("compliance_framework") String complianceFramework,
    @JsonProperty("signed_event_fields") List<String> signedEventFields,
    @JsonProperty("signed_override_fields") List<String> signedOverrideFields
) {

    public static final String BUNDLE_SCHEMA_VERSION = "1.0";
    public static final String COMPLIANCE_FRAMEWORK = "EU AI Act";
}
