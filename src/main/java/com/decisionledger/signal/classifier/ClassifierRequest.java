package com.decisionledger.signal.classifier;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ClassifierRequest(
    @JsonProperty("content") String content,
    @JsonProperty("content_type") String contentType,
    @JsonProperty("context") String context
) {}
