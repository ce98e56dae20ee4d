package com.decisionledger.api;

import com.decisionledger.policy.PolicyPack;
import com.decisionledger.policy.PolicyPackRegistry;
import com.decisionledger.policy.PolicyTag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/policies")
public class PolicyController {

    private final PolicyPackRegistry registry;

    public PolicyController(PolicyPackRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/packs")
    public List<PolicyPack> packs() {
        return registry.packs();
    }

    /** Tags of the active pack; empty when running on the fallback catalog. */
    @GetMapping("/tags")
    public List<PolicyTag> tags() {
        return registry.activePack().map(PolicyPack::tags).orElse(List.of());
    }

    @PostMapping("/packs/{version}/activate")
    public PolicyPack activate(@PathVariable String version) {
        return registry.activate(version);
    }
}
