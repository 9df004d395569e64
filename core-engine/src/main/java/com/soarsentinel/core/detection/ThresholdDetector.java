package com.soarsentinel.core.detection;

import com.soarsentinel.core.config.DetectionRule;
import com.soarsentinel.core.model.Anomaly;
import com.soarsentinel.core.model.Severity;
import com.soarsentinel.core.model.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Threshold detector.
 *
 * <p>
 * Fires when a numeric payload field exceeds the configured threshold. When a
 * {@code criticalThreshold} is configured, values above it are reported as
 * critical regardless of the rule's default severity. Confidence grows
 * linearly with the relative excess over the threshold, capped at
 * {@value #MAX_CONFIDENCE}. This is a <strong>stateless</strong> detector.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdDetector extends RuleDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdDetector.class);

    static final double MAX_CONFIDENCE = 0.99;

    private final String field;
    private final double threshold;
    private final Double criticalThreshold;

    /**
     * @param config the rule configuration
     * @throws NullPointerException if {@code config} or its field is {@code null}
     */
    public ThresholdDetector(DetectionRule config) {
        super(config, 0.80);
        this.field = Objects.requireNonNull(config.getField(),
                "Field must not be null for threshold rule '" + rule.id() + "'");
        this.threshold = config.getThreshold();
        this.criticalThreshold = config.getCriticalThreshold();
    }

    @Override
    public Optional<Anomaly> evaluate(TelemetryEvent event) {
        Objects.requireNonNull(event, "Event must not be null");

        Optional<Double> value = event.payloadNumber(field);

        if (value.isEmpty() || value.get().isNaN()) {
            LOG.trace("Rule [{}]: field '{}' not present or not numeric, skipping", rule.id(), field);
            return Optional.empty();
        }

        double v = value.get();
        if (v <= threshold) {
            return Optional.empty();
        }

        Severity severity = criticalThreshold != null && v > criticalThreshold
                ? Severity.CRITICAL
                : rule.defaultSeverity();
        double excess = Math.min(1.0, (v - threshold) / threshold);
        double scaled = Math.min(MAX_CONFIDENCE, confidence + (1.0 - confidence) * excess);

        LOG.debug("Rule [{}] fired: {}={} > threshold={} severity={}", rule.id(), field, v, threshold, severity);

        Map<String, Object> evidence = evidence(event);
        evidence.put("metric", field);
        evidence.put("value", v);
        evidence.put("threshold", threshold);
        if (criticalThreshold != null) {
            evidence.put("critical_threshold", criticalThreshold);
        }

        return Optional.of(anomaly(event, severity, scaled,
                String.format("%s: %s=%.1f exceeds %.1f threshold on %s",
                        rule.displayName(), field, v, threshold, event.getService()),
                evidence));
    }
}
