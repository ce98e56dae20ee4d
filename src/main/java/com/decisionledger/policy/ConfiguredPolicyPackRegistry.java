package com.decisionledger.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry over packs supplied at startup. Exactly one pack (or none) is
 * active; the active version is swapped atomically.
 */
public class ConfiguredPolicyPackRegistry implements PolicyPackRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredPolicyPackRegistry.class);

    private final Map<String, PolicyPack> packsByVersion;
    private final List<String> orderedVersions;
    private final AtomicReference<String> activeVersion;

    public ConfiguredPolicyPackRegistry(List<PolicyPack> packs) {
        Map<String, PolicyPack> byVersion = new LinkedHashMap<>();
        String firstActive = null;
        for (PolicyPack pack : packs) {
            if (byVersion.putIfAbsent(pack.version(), pack.withActive(false)) != null) {
                throw new IllegalArgumentException("duplicate policy pack version: " + pack.version());
            }
            if (pack.active()) {
                if (firstActive != null) {
                    throw new IllegalArgumentException(
                        "at most one policy pack may be active, found " + firstActive + " and " + pack.version());
                }
                firstActive = pack.version();
            }
        }
        this.packsByVersion = Map.copyOf(byVersion);
        // Map.copyOf loses insertion order; keep it for listing
        this.orderedVersions = List.copyOf(byVersion.keySet());
        this.activeVersion = new AtomicReference<>(firstActive);
    }

    @Override
    public Optional<PolicyPack> activePack() {
        String version = activeVersion.get();
        if (version == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(packsByVersion.get(version)).map(p -> p.withActive(true));
    }

    @Override
    public List<PolicyPack> packs() {
        String active = activeVersion.get();
        List<PolicyPack> result = new ArrayList<>(orderedVersions.size());
        for (String version : orderedVersions) {
            result.add(packsByVersion.get(version).withActive(version.equals(active)));
        }
        return result;
    }

    @Override
    public PolicyPack activate(String version) {
        PolicyPack pack = packsByVersion.get(version);
        if (pack == null) {
            throw new IllegalArgumentException("unknown policy pack version: " + version);
        }
        String previous = activeVersion.getAndSet(version);
        log.info("Activated policy pack {} (previously {})", version, previous);
        return pack.withActive(true);
    }
}
