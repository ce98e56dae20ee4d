package com.decisionledger.api;

import com.decisionledger.config.ProducerStatusReport;
import com.decisionledger.ledger.AuditLedger;
import com.decisionledger.ledger.LedgerStatistics;
import com.decisionledger.policy.PolicyPack;
import com.decisionledger.policy.PolicyPackRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final AuditLedger ledger;
    private final PolicyPackRegistry registry;
    private final ProducerStatusReport producerStatus;

    public AdminController(AuditLedger ledger, PolicyPackRegistry registry, ProducerStatusReport producerStatus) {
        this.ledger = ledger;
        this.registry = registry;
        this.producerStatus = producerStatus;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", "admin");
        body.put("active_policy_version", registry.activeVersion());
        return body;
    }

    /** Producer configuration, including whether the classifier is in charge of decisions. */
    @GetMapping("/producers")
    public Map<String, Object> producers() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("classifier_authoritative", producerStatus.classifierAuthoritative());
        body.put("producers", producerStatus.producers());
        return body;
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        LedgerStatistics statistics = ledger.statistics();
        List<PolicyPack> packs = registry.packs();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("audit", statistics);
        body.put("policy_packs", packs.size());
        body.put("active_packs", packs.stream().filter(PolicyPack::active).count());
        body.put("policy_tags", packs.stream().mapToInt(p -> p.tags().size()).sum());
        body.put("active_policy_version", registry.activeVersion());
        return body;
    }
}
