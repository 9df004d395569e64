package com.soarsentinel.core.detection;

import com.soarsentinel.core.config.RulesConfig;
import com.soarsentinel.core.metrics.SentinelMetrics;
import com.soarsentinel.core.model.Anomaly;
import com.soarsentinel.core.model.TelemetryEvent;
import com.soarsentinel.core.model.ThreatRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates a telemetry event against every configured detector.
 *
 * <p>
 * Each detector runs independently, so one event may yield several
 * anomalies; the engine never deduplicates. A detector that throws is logged
 * and skipped so one faulty rule cannot hide the findings of the others.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent use: stateless detectors share nothing and the window
 * detectors serialize per source internally.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEngine.class);

    private final List<AnomalyDetector> detectors;
    private final Clock clock;
    private final SentinelMetrics metrics;

    public RuleEngine(List<AnomalyDetector> detectors, Clock clock, SentinelMetrics metrics) {
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors must not be null"));
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Build an engine with one detector per enabled rule in {@code config}.
     */
    public static RuleEngine fromConfig(RulesConfig config, Clock clock, SentinelMetrics metrics) {
        Objects.requireNonNull(config, "RulesConfig must not be null");
        RuleEngine engine = new RuleEngine(DetectorFactory.createAll(config.enabledRules()), clock, metrics);
        LOG.info("Rule engine ready with rules {}", engine.rules().stream().map(ThreatRule::id).toList());
        return engine;
    }

    /**
     * Run every detector against {@code event}.
     *
     * @param event the event; stamped with the engine clock if not yet received
     * @return anomalies in detector order, possibly empty, never {@code null}
     */
    public List<Anomaly> evaluate(TelemetryEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        TelemetryEvent stamped = event.getReceivedAt() != null ? event : event.withReceivedAt(clock.instant());

        List<Anomaly> anomalies = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            try {
                Optional<Anomaly> anomaly = detector.evaluate(stamped);
                if (anomaly.isPresent()) {
                    anomalies.add(anomaly.get());
                    metrics.incrementAnomaliesDetected(detector.getRule().id());
                    LOG.debug("Anomaly detected: rule={} source={} severity={}",
                            detector.getRule().id(), stamped.getSourceId(), anomaly.get().getSeverity().id());
                }
            } catch (RuntimeException e) {
                LOG.error("Detector [{}] threw an exception, continuing with next detector",
                        detector.getRule().id(), e);
            }
        }

        metrics.incrementEventsProcessed();
        return anomalies;
    }

    /**
     * @return the catalogue rules this engine evaluates, in evaluation order
     */
    public List<ThreatRule> rules() {
        return detectors.stream().map(AnomalyDetector::getRule).toList();
    }
}
