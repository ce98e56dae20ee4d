package com.decisionledger.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EvaluateRequest(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("user") String user,
    @JsonProperty("input_type") String inputType,
    @JsonProperty("input") String input
) {}
