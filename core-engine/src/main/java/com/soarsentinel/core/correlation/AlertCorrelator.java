package com.soarsentinel.core.correlation;

import com.soarsentinel.core.metrics.SentinelMetrics;
import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.Anomaly;
import com.soarsentinel.core.model.Severity;
import com.soarsentinel.core.model.TelemetryEvent;
import com.soarsentinel.core.model.ThreatRule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns anomalies into alerts, suppressing repeats of the same rule from the
 * same source within the cooldown window.
 *
 * <h3>Suppression</h3>
 * <p>
 * The suppression key is {@code rule_id|source_id}. The first anomaly for a
 * key creates an alert and starts the cooldown; later anomalies for that key
 * are dropped until the cooldown elapses. Different rules from one source,
 * or one rule from different sources, never suppress each other.
 * </p>
 *
 * <h3>Alert book</h3>
 * <p>
 * Created alerts are kept in a bounded {@link AlertBook} and can be listed,
 * acknowledged and dismissed. Dismissing an alert does not touch the action
 * history of the response side.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertCorrelator {

    private static final Logger LOG = LoggerFactory.getLogger(AlertCorrelator.class);

    private final CooldownCache cooldowns;
    private final AlertBook book;
    private final Clock clock;
    private final SentinelMetrics metrics;

    public AlertCorrelator(CooldownCache cooldowns, AlertBook book, Clock clock, SentinelMetrics metrics) {
        this.cooldowns = Objects.requireNonNull(cooldowns, "cooldowns must not be null");
        this.book = Objects.requireNonNull(book, "book must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public AlertCorrelator(Duration cooldown, int alertCapacity, Clock clock, SentinelMetrics metrics) {
        this(new CooldownCache(cooldown), new AlertBook(alertCapacity), clock, metrics);
    }

    /**
     * Build the suppression key for one anomaly.
     */
    public static String suppressionKey(String ruleId, String sourceId) {
        return ruleId + "|" + sourceId;
    }

    /**
     * Correlate one anomaly.
     *
     * @param anomaly validated anomaly
     * @return the created alert, or a suppression result
     */
    public Correlation correlate(Anomaly anomaly) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        String sourceId = anomaly.effectiveSourceId();
        String key = suppressionKey(anomaly.getRuleId(), sourceId);
        Instant now = clock.instant();

        if (!cooldowns.tryAcquire(key, now)) {
            Duration retryAfter = cooldowns.remaining(key, now);
            metrics.incrementAlertsSuppressed();
            LOG.debug("Suppressed anomaly {} for key '{}' (retry after {} ms)",
                    anomaly.getAnomalyId(), key, retryAfter.toMillis());
            return Correlation.suppressed(key, retryAfter);
        }

        Alert alert = toAlert(anomaly, sourceId, now);
        book.add(alert).ifPresent(evicted ->
                LOG.debug("Alert book full, evicted alert {}", evicted.getAlertId()));
        metrics.incrementAlertsCreated();
        LOG.info("Alert created: id={}, rule={}, severity={}, source={}",
                alert.getAlertId(), alert.getRuleId(), alert.getSeverity().id(), sourceId);
        return Correlation.created(alert, key);
    }

    // ---------------------------------------------------------------
    // Alert lifecycle
    // ---------------------------------------------------------------

    public Optional<Alert> find(String alertId) {
        return book.get(alertId);
    }

    public Optional<Alert> acknowledge(String alertId) {
        Optional<Alert> alert = book.acknowledge(alertId, clock.instant());
        alert.ifPresent(a -> LOG.info("Alert acknowledged: {}", alertId));
        return alert;
    }

    public int acknowledgeAll() {
        int count = book.acknowledgeAll(clock.instant());
        LOG.info("Acknowledged {} alert(s)", count);
        return count;
    }

    /**
     * Remove an alert from the book.
     *
     * @return {@code true} if the alert existed
     */
    public boolean dismiss(String alertId) {
        boolean removed = book.remove(alertId).isPresent();
        if (removed) {
            LOG.info("Alert dismissed: {}", alertId);
        }
        return removed;
    }

    public int clearAcknowledged() {
        int removed = book.removeAcknowledged();
        LOG.info("Cleared {} acknowledged alert(s)", removed);
        return removed;
    }

    public List<Alert> list(AlertFilter filter) {
        return book.list(Objects.requireNonNull(filter, "filter must not be null"));
    }

    public AlertStats stats() {
        return book.stats();
    }

    /**
     * Drop every alert and cooldown entry.
     */
    public void reset() {
        book.clear();
        cooldowns.clear();
    }

    CooldownCache cooldowns() {
        return cooldowns;
    }

    // ---------------------------------------------------------------
    // Internal helpers
    // ---------------------------------------------------------------

    private Alert toAlert(Anomaly anomaly, String sourceId, Instant now) {
        ThreatRule rule = ThreatRule.resolve(anomaly.getRuleId());
        Severity severity = anomaly.getSeverity() != null ? anomaly.getSeverity() : rule.defaultSeverity();

        Map<String, Object> evidence = new LinkedHashMap<>();
        if (anomaly.getEvidence() != null) {
            evidence.putAll(anomaly.getEvidence());
        }
        evidence.putIfAbsent("source_ip", sourceId);
        evidence.put("confidence", anomaly.getConfidence());

        String service = anomaly.getService();
        if (service == null || service.isBlank()) {
            Object fromEvidence = evidence.get("service");
            service = fromEvidence != null ? fromEvidence.toString() : TelemetryEvent.UNKNOWN;
        }

        String description = anomaly.getDescription() != null && !anomaly.getDescription().isBlank()
                ? anomaly.getDescription()
                : rule.description();
        String recommendation = anomaly.getRecommendation() != null && !anomaly.getRecommendation().isBlank()
                ? anomaly.getRecommendation()
                : rule.recommendation();

        return Alert.builder()
                .alertId(UUID.randomUUID().toString())
                .title(rule.title())
                .description(description)
                .severity(severity)
                .sourceId(sourceId)
                .service(service)
                .createdAt(now)
                .evidence(evidence)
                .recommendation(recommendation)
                .ruleId(anomaly.getRuleId())
                .anomalyId(anomaly.getAnomalyId())
                .build();
    }
}
