package com.decisionledger.signal.classifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Structured verdict returned by the external classifier.
 * {@code confidenceScore} is on a 0..1 scale.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassifierVerdict(
    @JsonProperty("risk_level") String riskLevel,
    @JsonProperty("decision") String decision,
    @JsonProperty("policy_tags") List<String> policyTags,
    @JsonProperty("confidence_score") Double confidenceScore,
    @JsonProperty("explanation") String explanation,
    @JsonProperty("eu_ai_act_articles") List<String> euAiActArticles,
    @JsonProperty("compliance_requirements") List<String> complianceRequirements,
    @JsonProperty("evidence") Map<String, Object> evidence
) {}
