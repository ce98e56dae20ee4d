package com.decisionledger.config;

import com.decisionledger.signal.Decision;
import com.decisionledger.signal.RiskLevel;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from {@code compliance.*}.
 */
@ConfigurationProperties(prefix = "compliance")
@Validated
public class ComplianceProperties {

    @Valid
    private Signing signing = new Signing();

    @Valid
    private Merge merge = new Merge();

    @Valid
    private Classifier classifier = new Classifier();

    @Valid
    private Vision vision = new Vision();

    @Valid
    private Evidence evidence = new Evidence();

    @Valid
    private Policy policy = new Policy();

    public Signing getSigning() {
        return signing;
    }

    public void setSigning(Signing signing) {
        this.signing = signing;
    }

    public Merge getMerge() {
        return merge;
    }

    public void setMerge(Merge merge) {
        this.merge = merge;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public void setClassifier(Classifier classifier) {
        this.classifier = classifier;
    }

    public Vision getVision() {
        return vision;
    }

    public void setVision(Vision vision) {
        this.vision = vision;
    }

    public Evidence getEvidence() {
        return evidence;
    }

    public void setEvidence(Evidence evidence) {
        this.evidence = evidence;
    }

    public Policy getPolicy() {
        return policy;
    }

    public void setPolicy(Policy policy) {
        this.policy = policy;
    }

    public static class Signing {

        /** HMAC secret shared with anyone who verifies exports. */
        @NotBlank
        private String secret;

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }
    }

    public static class Merge {

        @Min(10)
        @Max(20)
        private int cleanConfidence = 15;

        private String cleanExplanation = "No policy violations detected";

        public int getCleanConfidence() {
            return cleanConfidence;
        }

        public void setCleanConfidence(int cleanConfidence) {
            this.cleanConfidence = cleanConfidence;
        }

        public String getCleanExplanation() {
            return cleanExplanation;
        }

        public void setCleanExplanation(String cleanExplanation) {
            this.cleanExplanation = cleanExplanation;
        }
    }

    public static class Classifier {

        private boolean enabled = false;

        private String baseUrl = "http://localhost:8090";

        private String path = "/classify";

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Vision {

        private boolean enabled = false;

        private String baseUrl = "http://localhost:8091";

        private String path = "/detect/faces";

        /** Risk level reported when at least one face is found. */
        @NotNull
        private RiskLevel faceRiskLevel = RiskLevel.HIGH;

        @NotNull
        private Duration timeout = Duration.ofSeconds(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public RiskLevel getFaceRiskLevel() {
            return faceRiskLevel;
        }

        public void setFaceRiskLevel(RiskLevel faceRiskLevel) {
            this.faceRiskLevel = faceRiskLevel;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Evidence {

        public enum StoreType {
            MEMORY,
            FILESYSTEM
        }

        @NotNull
        private StoreType store = StoreType.MEMORY;

        private String rootDir = "./evidence-data";

        @NotNull
        private Duration putTimeout = Duration.ofSeconds(2);

        @Min(1)
        private int writerThreads = 2;

        @Min(1)
        private int writerQueueCapacity = 16;

        public StoreType getStore() {
            return store;
        }

        public void setStore(StoreType store) {
            this.store = store;
        }

        public String getRootDir() {
            return rootDir;
        }

        public void setRootDir(String rootDir) {
            this.rootDir = rootDir;
        }

        public Duration getPutTimeout() {
            return putTimeout;
        }

        public void setPutTimeout(Duration putTimeout) {
            this.putTimeout = putTimeout;
        }

        public int getWriterThreads() {
            return writerThreads;
        }

        public void setWriterThreads(int writerThreads) {
            this.writerThreads = writerThreads;
        }

        public int getWriterQueueCapacity() {
            return writerQueueCapacity;
        }

        public void setWriterQueueCapacity(int writerQueueCapacity) {
            this.writerQueueCapacity = writerQueueCapacity;
        }
    }

    public static class Policy {

        @Valid
        private List<Pack> packs = new ArrayList<>();

        public List<Pack> getPacks() {
            return packs;
        }

        public void setPacks(List<Pack> packs) {
            this.packs = packs;
        }
    }

    public static class Pack {

        @NotBlank
        private String name;

        @NotBlank
        private String version;

        private String description = "";

        private boolean active = false;

        @Valid
        private List<Tag> tags = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }

        public List<Tag> getTags() {
            return tags;
        }

        public void setTags(List<Tag> tags) {
            this.tags = tags;
        }
    }

    public static class Tag {

        @NotBlank
        private String name;

        private String description = "";

        @NotNull
        private RiskLevel riskLevel;

        private List<String> patterns = new ArrayList<>();

        /** Defaults to the risk level's own decision. */
        private Decision action;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public RiskLevel getRiskLevel() {
            return riskLevel;
        }

        public void setRiskLevel(RiskLevel riskLevel) {
            this.riskLevel = riskLevel;
        }

        public List<String> getPatterns() {
            return patterns;
        }

        public void setPatterns(List<String> patterns) {
            this.patterns = patterns;
        }

        public Decision getAction() {
            return action;
        }

        public void setAction(Decision action) {
            this.action = action;
        }
    }
}
