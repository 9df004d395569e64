package com.soarsentinel.core.detection;

import com.soarsentinel.core.config.DetectionRule;
import com.soarsentinel.core.model.Anomaly;
import com.soarsentinel.core.model.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern detector.
 *
 * <p>
 * Scans string values of the payload against a list of case-insensitive
 * regular expressions (SQL injection signatures by default). Nested maps are
 * walked and addressed by dotted path. When {@code fields} is configured only
 * those paths are scanned. Fires at most once per event, listing every
 * matching field in the evidence. This is a <strong>stateless</strong>
 * detector.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternDetector extends RuleDetector {

    private static final Logger LOG = LoggerFactory.getLogger(PatternDetector.class);

    /** Matched values are truncated to this many characters in evidence. */
    static final int MAX_EVIDENCE_LENGTH = 100;

    private final List<Pattern> patterns;
    private final List<String> fields;

    public PatternDetector(DetectionRule config) {
        super(config, 0.85);
        Objects.requireNonNull(config.getPatterns(), "Patterns must not be null");
        if (config.getPatterns().isEmpty()) {
            throw new IllegalArgumentException("Pattern rule '" + rule.id() + "' has no patterns");
        }
        this.patterns = config.getPatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
        this.fields = List.copyOf(config.getFields());
    }

    @Override
    public Optional<Anomaly> evaluate(TelemetryEvent event) {
        Objects.requireNonNull(event, "Event must not be null");

        Map<String, String> candidates = event.stringValues();
        if (!fields.isEmpty()) {
            candidates.keySet().retainAll(fields);
        }

        List<Map<String, Object>> matches = new ArrayList<>();
        for (Map.Entry<String, String> entry : candidates.entrySet()) {
            for (Pattern pattern : patterns) {
                Matcher m = pattern.matcher(entry.getValue());
                if (m.find()) {
                    Map<String, Object> match = new LinkedHashMap<>();
                    match.put("field", entry.getKey());
                    match.put("value", truncate(entry.getValue()));
                    match.put("matched", m.group());
                    match.put("pattern", pattern.pattern());
                    matches.add(match);
                    break;
                }
            }
        }

        if (matches.isEmpty()) {
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired for {}: {} field(s) matched", rule.id(), event.getSourceId(), matches.size());

        Map<String, Object> evidence = evidence(event);
        evidence.put("matched_fields", matches);

        return Optional.of(anomaly(event, rule.defaultSeverity(), confidence,
                String.format("%s: pattern detected in %d field(s)", rule.displayName(), matches.size()),
                evidence));
    }

    private static String truncate(String value) {
        return value.length() <= MAX_EVIDENCE_LENGTH ? value : value.substring(0, MAX_EVIDENCE_LENGTH);
    }
}
