package com.decisionledger.signal.pattern;

import com.decisionledger.policy.PolicyPack;
import com.decisionledger.policy.PolicyTag;
import com.decisionledger.signal.EvaluationInput;
import com.decisionledger.signal.EvaluationSignal;
import com.decisionledger.signal.RiskLevel;
import com.decisionledger.signal.SignalOutcome;
import com.decisionledger.signal.SignalProducer;
import com.decisionledger.signal.SignalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Regex detector over the input text.
 *
 * Matches the built-in catalog plus the active pack's tag patterns. Emits a
 * single signal at the highest matched level, carrying the tags matched at
 * that level; every match (any level) goes to the raw evidence.
 */
public class PatternSignalProducer implements SignalProducer {

    private static final Logger log = LoggerFactory.getLogger(PatternSignalProducer.class);

    private final List<PatternCatalog.Group> catalog;
    private final Map<String, Optional<Pattern>> packPatterns = new ConcurrentHashMap<>();

    public PatternSignalProducer() {
        this(PatternCatalog.builtIn());
    }

    public PatternSignalProducer(List<PatternCatalog.Group> catalog) {
        this.catalog = List.copyOf(catalog);
    }

    @Override
    public SignalSource source() {
        return SignalSource.PATTERN;
    }

    @Override
    public SignalOutcome produce(EvaluationInput input, PolicyPack activePack, Duration timeout) {
        String text = input.text();
        if (text.isBlank()) {
            return SignalOutcome.none(SignalSource.PATTERN);
        }

        List<Match> matches = new ArrayList<>();
        for (PatternCatalog.Group group : catalog) {
            for (Pattern pattern : group.patterns()) {
                collect(matches, pattern, text, group.riskLevel(), group.tag(), group.confidence());
            }
        }
        if (activePack != null) {
            for (PolicyTag tag : activePack.tags()) {
                for (String regex : tag.patterns()) {
                    compiled(regex).ifPresent(pattern -> collect(matches, pattern, text, tag.riskLevel(),
                        tag.name(), PatternCatalog.confidenceFor(tag.riskLevel())));
                }
            }
        }

        if (matches.isEmpty()) {
            return SignalOutcome.none(SignalSource.PATTERN);
        }

        RiskLevel top = matches.stream()
            .map(Match::riskLevel)
            .max((a, b) -> Integer.compare(a.severity(), b.severity()))
            .orElse(RiskLevel.MINIMAL);

        Set<String> tags = new LinkedHashSet<>();
        Set<String> phrases = new LinkedHashSet<>();
        double confidence = 0.0;
        for (Match match : matches) {
            if (match.riskLevel() == top) {
                tags.add(match.tag());
                phrases.add(match.text().toLowerCase());
                confidence = Math.max(confidence, match.confidence());
            }
        }

        String rationale = "Detected " + top.getValue() + " risk pattern(s): " + String.join(", ", phrases);
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("match_count", matches.size());
        raw.put("matches", matches.stream().map(Match::toEvidence).toList());

        return SignalOutcome.produced(new EvaluationSignal(
            SignalSource.PATTERN, top, tags, confidence, rationale, raw));
    }

    private void collect(List<Match> out, Pattern pattern, String text, RiskLevel level, String tag, double confidence) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            out.add(new Match(level, tag, pattern.pattern(), matcher.group(), matcher.start(), matcher.end(), confidence));
        }
    }

    private Optional<Pattern> compiled(String regex) {
        return packPatterns.computeIfAbsent(regex, r -> {
            try {
                return Optional.of(Pattern.compile(r, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException ex) {
                log.warn("Ignoring invalid policy tag pattern '{}': {}", r, ex.getDescription());
                return Optional.empty();
            }
        });
    }

    private record Match(RiskLevel riskLevel, String tag, String pattern, String text,
                         int start, int end, double confidence) {

        Map<String, Object> toEvidence() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("risk_level", riskLevel.getValue());
            m.put("tag", tag);
            m.put("pattern", pattern);
            m.put("match", text);
            m.put("start", start);
            m.put("end", end);
            m.put("confidence", confidence);
            return m;
        }
    }
}
