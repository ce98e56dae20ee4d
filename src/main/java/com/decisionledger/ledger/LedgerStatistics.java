package com.decisionledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LedgerStatistics(
    @JsonProperty("total_events") long totalEvents,
    @JsonProperty("blocked_events") long blockedEvents,
    @JsonProperty("flagged_events") long flaggedEvents,
    @JsonProperty("allowed_events") long allowedEvents,
    @JsonProperty("total_overrides") long totalOverrides
) {}
