package com.soarsentinel.core.detection;

import com.soarsentinel.core.config.DetectionRule;
import com.soarsentinel.core.model.ThreatRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Creates {@link AnomalyDetector} instances from {@link DetectionRule}
 * configurations.
 *
 * <p>
 * The detector family is taken from the rule catalogue, not from free text:
 * a configuration can only tune a rule that {@link ThreatRule} already binds
 * to a detector.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create a detector for the given rule.
     *
     * @param config the rule configuration; must not be {@code null}
     * @return an appropriate {@link AnomalyDetector} instance
     * @throws NullPointerException     if {@code config} is {@code null}
     * @throws IllegalStateException    if the rule is not in the catalogue
     * @throws IllegalArgumentException if the rule has no built-in detector
     */
    public static AnomalyDetector create(DetectionRule config) {
        Objects.requireNonNull(config, "DetectionRule must not be null");
        ThreatRule rule = config.requireThreatRule();

        return switch (rule.kind()) {
            case PATTERN -> new PatternDetector(config);
            case RATE -> new RateSpikeDetector(config);
            case DISTINCT -> new DistinctValueDetector(config);
            case THRESHOLD -> new ThresholdDetector(config);
            case CREDENTIAL -> new CredentialDetector(config);
            case EXTERNAL -> throw new IllegalArgumentException(
                    "Rule '" + rule.id() + "' has no built-in detector");
        };
    }

    /**
     * Create detectors for every rule in the supplied list.
     *
     * @param rules list of rule configurations; must not be {@code null}
     * @return unmodifiable list of detectors (one per rule)
     */
    public static List<AnomalyDetector> createAll(List<DetectionRule> rules) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        LOG.info("Creating {} detector(s) from configuration", rules.size());
        return rules.stream()
                .map(DetectorFactory::create)
                .toList();
    }
}
