package com.decisionledger.signal.pattern;

import com.decisionledger.signal.RiskLevel;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Built-in EU AI Act phrase catalog, grouped by the risk level a match implies.
 */
public final class PatternCatalog {

    public static final String PROHIBITED_BIOMETRIC = "ProhibitedBiometric";
    public static final String HIGH_RISK_AI = "HighRiskAI";
    public static final String LIMITED_RISK_AI = "LimitedRiskAI";

    private static final List<String> BIOMETRIC = List.of(
        "\\b(?:facial|face)\\s+(?:recognition|identification|detection|analysis)\\b",
        "\\b(?:biometric|biometrics)\\s+(?:identification|authentication|verification)\\b",
        "\\b(?:iris|retina)\\s+(?:scan|recognition|identification)\\b",
        "\\b(?:fingerprint|finger\\s+print)\\s+(?:scan|recognition|identification)\\b",
        "\\b(?:voice|speech)\\s+(?:recognition|identification|biometrics)\\b",
        "\\b(?:gait|walking)\\s+(?:recognition|identification|analysis)\\b",
        "\\b(?:dna|genetic)\\s+(?:identification|profiling|analysis)\\b",
        "\\b(?:real.?time|live)\\s+(?:biometric|facial|face)\\s+(?:identification|recognition)\\b",
        "\\b(?:remote|distance)\\s+(?:biometric|facial|face)\\s+(?:identification|recognition)\\b",
        "\\b(?:untargeted|mass|bulk)\\s+(?:scraping|collection|gathering)\\s+(?:of\\s+)?(?:faces|facial|biometric)\\b",
        "\\b(?:build|create|construct)\\s+(?:facial|face|biometric)\\s+(?:database|db|repository)\\b",
        "\\b(?:social\\s+media|facebook|instagram|twitter)\\s+(?:face|facial)\\s+(?:scraping|collection)\\b");

    private static final List<String> HIGH_RISK = List.of(
        "\\b(?:cv|cv\\s+screening|resume\\s+screening|recruitment)\\s+(?:ai|artificial\\s+intelligence|automated)\\b",
        "\\b(?:credit\\s+scoring|loan\\s+assessment|financial\\s+risk)\\s+(?:ai|artificial\\s+intelligence|automated)\\b",
        "\\b(?:criminal\\s+risk|criminal\\s+assessment|recidivism)\\s+(?:ai|artificial\\s+intelligence|automated)\\b",
        "\\b(?:healthcare|medical|clinical)\\s+(?:diagnosis|assessment|decision)\\s+(?:ai|artificial\\s+intelligence|automated)\\b",
        "\\b(?:education|academic)\\s+(?:assessment|grading|evaluation)\\s+(?:ai|artificial\\s+intelligence|automated)\\b");

    private static final List<String> LIMITED_RISK = List.of(
        "\\b(?:chatbot|chat\\s+bot|conversational\\s+ai)\\b",
        "\\b(?:deepfake|deep\\s+fake|synthetic\\s+media)\\b",
        "\\b(?:emotion\\s+recognition|emotion\\s+detection|sentiment\\s+analysis)\\b",
        "\\b(?:content\\s+moderation|content\\s+filtering)\\b",
        "\\b(?:recommendation|recommender)\\s+(?:system|engine)\\b");

    private static final List<Group> BUILT_IN = List.of(
        Group.of(RiskLevel.UNACCEPTABLE, PROHIBITED_BIOMETRIC, 0.9, BIOMETRIC),
        Group.of(RiskLevel.HIGH, HIGH_RISK_AI, 0.8, HIGH_RISK),
        Group.of(RiskLevel.LIMITED, LIMITED_RISK_AI, 0.7, LIMITED_RISK));

    private PatternCatalog() {
    }

    public static List<Group> builtIn() {
        return BUILT_IN;
    }

    /** Confidence assigned to a match at the given level. */
    public static double confidenceFor(RiskLevel level) {
        switch (level) {
            case UNACCEPTABLE:
                return 0.9;
            case HIGH:
                return 0.8;
            case LIMITED:
                return 0.7;
            default:
                return 0.6;
        }
    }

    public record Group(RiskLevel riskLevel, String tag, double confidence, List<Pattern> patterns) {

        public Group {
            Objects.requireNonNull(riskLevel, "risk level is required");
            Objects.requireNonNull(tag, "tag is required");
            patterns = List.copyOf(patterns);
        }

        static Group of(RiskLevel riskLevel, String tag, double confidence, List<String> regexes) {
            return new Group(riskLevel, tag, confidence, regexes.stream()
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList());
        }
    }
}
