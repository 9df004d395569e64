package com.soarsentinel.core.metrics;

import com.soarsentinel.core.model.ActionStatus;
import com.soarsentinel.core.model.ActionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the detect, correlate and respond stages.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code soar.events.processed}: events evaluated by the rule engine</li>
 * <li>{@code soar.anomalies.detected}: rule firings, tagged {@code rule}</li>
 * <li>{@code soar.alerts.created}: alerts minted by the correlator</li>
 * <li>{@code soar.alerts.suppressed}: anomalies dropped inside a cooldown</li>
 * <li>{@code soar.actions}: recorded actions, tagged {@code type} and
 * {@code status}</li>
 * <li>{@code soar.event.latency}: end-to-end time per event</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class SentinelMetrics {

    private final MeterRegistry registry;
    private final Counter eventsProcessed;
    private final Counter alertsCreated;
    private final Counter alertsSuppressed;
    private final Timer eventLatency;

    /**
     * Metrics backed by a private in-memory registry.
     */
    public SentinelMetrics() {
        this(new SimpleMeterRegistry());
    }

    public SentinelMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");
        this.eventsProcessed = registry.counter("soar.events.processed");
        this.alertsCreated = registry.counter("soar.alerts.created");
        this.alertsSuppressed = registry.counter("soar.alerts.suppressed");
        this.eventLatency = Timer.builder("soar.event.latency")
                .description("Time from event receipt to the last recorded action")
                .register(registry);
    }

    public void incrementEventsProcessed() {
        eventsProcessed.increment();
    }

    public void incrementAnomaliesDetected(String ruleId) {
        registry.counter("soar.anomalies.detected", "rule", ruleId).increment();
    }

    public void incrementAlertsCreated() {
        alertsCreated.increment();
    }

    public void incrementAlertsSuppressed() {
        alertsSuppressed.increment();
    }

    public void recordAction(ActionType type, ActionStatus status) {
        registry.counter("soar.actions", "type", type.id(), "status", status.id()).increment();
    }

    public void recordLatency(long nanos) {
        eventLatency.record(Duration.ofNanos(nanos));
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Flatten every counter and timer into a name-to-value map. Tagged meters
     * are keyed as {@code name{tag=value,...}}.
     *
     * @return ordered snapshot suitable for JSON rendering
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Meter meter : registry.getMeters()) {
            String key = key(meter);
            if (meter instanceof Counter c) {
                out.put(key, c.count());
            } else if (meter instanceof Timer t) {
                Map<String, Object> timer = new LinkedHashMap<>();
                timer.put("count", t.count());
                timer.put("mean_ms", t.mean(TimeUnit.MILLISECONDS));
                timer.put("max_ms", t.max(TimeUnit.MILLISECONDS));
                out.put(key, timer);
            }
        }
        return out;
    }

    private static String key(Meter meter) {
        Meter.Id id = meter.getId();
        if (id.getTags().isEmpty()) {
            return id.getName();
        }
        StringBuilder sb = new StringBuilder(id.getName()).append('{');
        id.getTags().forEach(tag -> sb.append(tag.getKey()).append('=').append(tag.getValue()).append(','));
        sb.setLength(sb.length() - 1);
        return sb.append('}').toString();
    }
}
