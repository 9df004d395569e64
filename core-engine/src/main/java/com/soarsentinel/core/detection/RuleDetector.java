package com.soarsentinel.core.detection;

import com.soarsentinel.core.config.DetectionRule;
import com.soarsentinel.core.model.Anomaly;
import com.soarsentinel.core.model.Severity;
import com.soarsentinel.core.model.TelemetryEvent;
import com.soarsentinel.core.model.ThreatRule;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Shared plumbing for the built-in detectors: binds the configuration to its
 * catalogue entry and builds anomalies with the common evidence fields.
 *
 * @since 1.0.0
 */
abstract class RuleDetector implements AnomalyDetector {

    protected final ThreatRule rule;
    protected final double confidence;

    protected RuleDetector(DetectionRule config, double defaultConfidence) {
        Objects.requireNonNull(config, "DetectionRule must not be null");
        this.rule = config.requireThreatRule();
        this.confidence = config.confidenceOr(defaultConfidence);
    }

    @Override
    public ThreatRule getRule() {
        return rule;
    }

    /**
     * @return the event receive time, or now when the event was never stamped
     */
    protected static Instant observedAt(TelemetryEvent event) {
        return event.getReceivedAt() != null ? event.getReceivedAt() : Instant.now();
    }

    /**
     * Start an evidence map pre-filled with the event's source and service.
     */
    protected static Map<String, Object> evidence(TelemetryEvent event) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("source_ip", event.getSourceId());
        evidence.put("service", event.getService());
        return evidence;
    }

    protected Anomaly anomaly(TelemetryEvent event, Severity severity, double confidence,
            String description, Map<String, Object> evidence) {
        return Anomaly.builder()
                .rule(rule)
                .severity(severity)
                .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                .description(description)
                .evidence(evidence)
                .sourceId(event.getSourceId())
                .service(event.getService())
                .sourceEventId(event.getEventId())
                .detectedAt(observedAt(event))
                .build();
    }
}
