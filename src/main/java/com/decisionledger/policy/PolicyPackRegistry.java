package com.decisionledger.policy;

import java.util.List;
import java.util.Optional;

/**
 * Source of policy packs. Activation may change at any time, so callers
 * read {@link #activePack()} once per evaluation instead of caching it.
 */
public interface PolicyPackRegistry {

    Optional<PolicyPack> activePack();

    List<PolicyPack> packs();

    /**
     * Makes the pack with the given version the single active one.
     *
     * @throws IllegalArgumentException if no pack has that version
     */
    PolicyPack activate(String version);

    default String activeVersion() {
        return activePack().map(PolicyPack::version).orElse(PolicyPack.FALLBACK_VERSION);
    }
}
