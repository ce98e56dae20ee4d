package com.decisionledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BundleVerificationReport(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("records_checked") int recordsChecked,
    @JsonProperty("records_valid") int recordsValid,
    @JsonProperty("issues") List<Issue> issues
) {

    public BundleVerificationReport {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    @JsonProperty("ok")
    public boolean ok() {
        return issues.isEmpty();
    }

    public record Issue(
        @JsonProperty("record_id") String recordId,
        @JsonProperty("record_type") String recordType,
        @JsonProperty("problem") String problem
    ) {}
}
