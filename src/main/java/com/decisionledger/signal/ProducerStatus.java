package com.decisionledger.signal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Configuration-level view of one signal producer. Remote producers carry
 * their endpoint and call timeout; the pattern producer runs in-process.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProducerStatus(
    @JsonProperty("source") SignalSource source,
    @JsonProperty("enabled") boolean enabled,
    @JsonProperty("remote") boolean remote,
    @JsonProperty("base_url") String baseUrl,
    @JsonProperty("path") String path,
    @JsonProperty("timeout_ms") Long timeoutMs
) {

    public static ProducerStatus local(SignalSource source) {
        return new ProducerStatus(source, true, false, null, null, null);
    }
}
