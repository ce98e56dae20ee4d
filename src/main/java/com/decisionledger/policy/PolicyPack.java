package com.decisionledger.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A named, versioned set of policy tags. Read-only to the core.
 */
public record PolicyPack(
    @JsonProperty("name") String name,
    @JsonProperty("version") String version,
    @JsonProperty("description") String description,
    @JsonProperty("is_active") boolean active,
    @JsonProperty("tags") List<PolicyTag> tags
) {

    /** Version stamped on decisions when no pack is active. */
    public static final String FALLBACK_VERSION = "fallback";

    public PolicyPack {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(version, "version is required");
        description = description == null ? "" : description;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public PolicyPack withActive(boolean isActive) {
        return new PolicyPack(name, version, description, isActive, tags);
    }
}
