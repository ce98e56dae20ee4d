package com.decisionledger.config;

import com.decisionledger.evidence.EvidenceSideband;
import com.decisionledger.evidence.EvidenceStore;
import com.decisionledger.evidence.FileSystemEvidenceStore;
import com.decisionledger.evidence.InMemoryEvidenceStore;
import com.decisionledger.ledger.AuditBundleVerifier;
import com.decisionledger.ledger.AuditLedger;
import com.decisionledger.ledger.AuditStore;
import com.decisionledger.ledger.InMemoryAuditStore;
import com.decisionledger.merge.DecisionMergeEngine;
import com.decisionledger.merge.MergeSettings;
import com.decisionledger.policy.ConfiguredPolicyPackRegistry;
import com.decisionledger.policy.PolicyPack;
import com.decisionledger.policy.PolicyPackRegistry;
import com.decisionledger.policy.PolicyTag;
import com.decisionledger.projection.EffectiveDecisionProjection;
import com.decisionledger.signal.SignalCollector;
import com.decisionledger.signal.SignalProducer;
import com.decisionledger.signal.SignalSource;
import com.decisionledger.signal.classifier.HttpClassifierSignalProducer;
import com.decisionledger.signal.pattern.PatternSignalProducer;
import com.decisionledger.signal.vision.HttpFaceDetector;
import com.decisionledger.signal.vision.VisionSignalProducer;
import com.decisionledger.signing.Canonicalizer;
import com.decisionledger.signing.Signer;
import com.decisionledger.signing.SigningKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(ComplianceProperties.class)
public class ComplianceConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ComplianceConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SigningKey signingKey(ComplianceProperties properties) {
        return SigningKey.fromSecret(properties.getSigning().getSecret());
    }

    @Bean
    public Signer signer(SigningKey signingKey) {
        return new Signer(signingKey, new Canonicalizer());
    }

    @Bean
    public AuditBundleVerifier auditBundleVerifier(Signer signer) {
        return new AuditBundleVerifier(signer);
    }

    /**
     * Classifier first, then the rule-based fallback over pattern and
     * vision signals.
     */
    @Bean
    public DecisionMergeEngine decisionMergeEngine(ComplianceProperties properties) {
        ComplianceProperties.Merge merge = properties.getMerge();
        return DecisionMergeEngine.standard(new MergeSettings(merge.getCleanConfidence(), merge.getCleanExplanation()));
    }

    @Bean
    public PolicyPackRegistry policyPackRegistry(ComplianceProperties properties) {
        List<PolicyPack> packs = new ArrayList<>();
        for (ComplianceProperties.Pack pack : properties.getPolicy().getPacks()) {
            List<PolicyTag> tags = pack.getTags().stream()
                .map(t -> new PolicyTag(t.getName(), t.getDescription(), t.getRiskLevel(), t.getPatterns(), t.getAction()))
                .toList();
            packs.add(new PolicyPack(pack.getName(), pack.getVersion(), pack.getDescription(), pack.isActive(), tags));
        }
        ConfiguredPolicyPackRegistry registry = new ConfiguredPolicyPackRegistry(packs);
        log.info("Loaded {} policy pack(s), active version {}", packs.size(), registry.activeVersion());
        return registry;
    }

    @Bean
    public EvidenceStore evidenceStore(ComplianceProperties properties, ObjectMapper objectMapper) {
        ComplianceProperties.Evidence evidence = properties.getEvidence();
        if (evidence.getStore() == ComplianceProperties.Evidence.StoreType.FILESYSTEM) {
            log.info("Evidence stored on disk under {}", evidence.getRootDir());
            return new FileSystemEvidenceStore(Path.of(evidence.getRootDir()), objectMapper);
        }
        return new InMemoryEvidenceStore();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService evidenceWriterExecutor(ComplianceProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "evidence-writer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ComplianceProperties.Evidence evidence = properties.getEvidence();
        return new ThreadPoolExecutor(evidence.getWriterThreads(), evidence.getWriterThreads(),
            0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(evidence.getWriterQueueCapacity()),
            threads, new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public EvidenceSideband evidenceSideband(EvidenceStore evidenceStore,
                                             ExecutorService evidenceWriterExecutor,
                                             ComplianceProperties properties) {
        return new EvidenceSideband(evidenceStore, evidenceWriterExecutor, properties.getEvidence().getPutTimeout());
    }

    @Bean
    public AuditStore auditStore() {
        return new InMemoryAuditStore();
    }

    @Bean
    public AuditLedger auditLedger(AuditStore auditStore, Signer signer, EvidenceSideband evidenceSideband, Clock clock) {
        return new AuditLedger(auditStore, signer, evidenceSideband, clock);
    }

    @Bean
    public EffectiveDecisionProjection effectiveDecisionProjection(AuditLedger auditLedger, Clock clock) {
        return new EffectiveDecisionProjection(auditLedger, clock);
    }

    @Bean
    public ProducerStatusReport producerStatusReport(ComplianceProperties properties) {
        return new ProducerStatusReport(properties);
    }

    @Bean
    public SignalCollector signalCollector(ComplianceProperties properties) {
        ComplianceProperties.Classifier classifier = properties.getClassifier();
        ComplianceProperties.Vision vision = properties.getVision();

        List<SignalProducer> producers = new ArrayList<>();
        producers.add(new PatternSignalProducer());
        if (vision.isEnabled()) {
            producers.add(new VisionSignalProducer(
                new HttpFaceDetector(webClient(vision.getBaseUrl()), vision.getPath()),
                vision.getFaceRiskLevel()));
        }
        producers.add(new HttpClassifierSignalProducer(
            webClient(classifier.getBaseUrl()), classifier.getPath(), classifier.isEnabled()));

        Map<SignalSource, Duration> timeouts = new EnumMap<>(SignalSource.class);
        timeouts.put(SignalSource.CLASSIFIER, classifier.getTimeout());
        timeouts.put(SignalSource.VISION, vision.getTimeout());

        log.info("Signal producers: pattern, vision={}, classifier={}", vision.isEnabled(), classifier.isEnabled());
        return new SignalCollector(producers, classifier.getTimeout(), timeouts);
    }

    private static WebClient webClient(String baseUrl) {
        return WebClient.builder()
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }
}
