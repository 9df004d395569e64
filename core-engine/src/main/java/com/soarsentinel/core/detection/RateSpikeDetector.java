package com.soarsentinel.core.detection;

import com.soarsentinel.core.config.DetectionRule;
import com.soarsentinel.core.model.Anomaly;
import com.soarsentinel.core.model.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Rate detector.
 *
 * <p>
 * Counts matching events per source inside a sliding window (in seconds) and
 * fires when the count exceeds the configured threshold. Used for request
 * floods ({@code rate_spike}) and, with an event-type and payload filter, for
 * failed logins ({@code brute_force}).
 * </p>
 *
 * <h3>Implementation</h3>
 * <p>
 * Each source owns a deque of event timestamps (epoch millis), pruned to the
 * window on every access. The detector is edge-triggered: it fires once when
 * the count crosses the threshold and re-arms only after the window has
 * drained back to the threshold or below, so a sustained flood yields one
 * anomaly rather than one per event.
 * </p>
 *
 * @since 1.0.0
 */
public class RateSpikeDetector extends RuleDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RateSpikeDetector.class);

    private final int windowSeconds;
    private final double threshold;
    private final String eventType;
    private final String matchField;
    private final String matchValue;

    private final SourceWindows<CountWindow> windows = new SourceWindows<>(CountWindow::new);

    /**
     * @param config the rule configuration
     * @throws NullPointerException     if {@code config} is {@code null}
     * @throws IllegalArgumentException if {@code windowSeconds} or
     *                                  {@code threshold} are invalid
     */
    public RateSpikeDetector(DetectionRule config) {
        super(config, 0.75);
        this.windowSeconds = config.getWindowSeconds();
        this.threshold = config.getThreshold();
        this.eventType = config.getEventType();
        this.matchField = config.getMatchField();
        this.matchValue = config.getMatchValue();

        if (windowSeconds <= 0) {
            throw new IllegalArgumentException(
                    "windowSeconds must be > 0 for rule '" + rule.id() + "', got: " + windowSeconds);
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException(
                    "threshold must be > 0 for rule '" + rule.id() + "', got: " + threshold);
        }
    }

    @Override
    public Optional<Anomaly> evaluate(TelemetryEvent event) {
        Objects.requireNonNull(event, "Event must not be null");

        String source = event.getSourceId();
        if (source == null || source.isBlank() || !counts(event)) {
            return Optional.empty();
        }

        long now = observedAt(event).toEpochMilli();
        long windowMillis = windowSeconds * 1_000L;

        int crossedAt = windows.update(source, w -> w.record(now, windowMillis, threshold));
        windows.maybeSweep(w -> w.isIdle(now, windowMillis));

        if (crossedAt < 0) {
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired for {}: count={} > threshold={}", rule.id(), source, crossedAt, threshold);

        Map<String, Object> evidence = evidence(event);
        evidence.put("request_count", crossedAt);
        evidence.put("window_seconds", windowSeconds);
        evidence.put("threshold", threshold);
        if (matchField != null) {
            event.payloadString("username").ifPresent(u -> evidence.put("username", u));
        }

        return Optional.of(anomaly(event, rule.defaultSeverity(), confidence,
                String.format("%s: %d events in %d seconds (threshold: %.0f)",
                        rule.displayName(), crossedAt, windowSeconds, threshold),
                evidence));
    }

    private boolean counts(TelemetryEvent event) {
        if (eventType != null && !eventType.equals(event.getEventType())) {
            return false;
        }
        if (matchField == null) {
            return true;
        }
        Optional<String> actual = event.payloadString(matchField);
        return actual.isPresent() && actual.get().equalsIgnoreCase(matchValue);
    }

    /**
     * @return number of sources currently tracked
     */
    int trackedSources() {
        return windows.size();
    }

    /**
     * Timestamps for one source plus the edge-trigger flag.
     */
    static final class CountWindow {
        private final Deque<Long> timestamps = new ArrayDeque<>();
        private boolean armed = true;

        /**
         * Record an event and report a threshold crossing.
         *
         * @return the window count if this event crossed the threshold, -1 otherwise
         */
        int record(long now, long windowMillis, double threshold) {
            prune(now, windowMillis);
            timestamps.addLast(now);
            int count = timestamps.size();
            if (count <= threshold) {
                armed = true;
                return -1;
            }
            if (armed) {
                armed = false;
                return count;
            }
            return -1;
        }

        boolean isIdle(long now, long windowMillis) {
            prune(now, windowMillis);
            return timestamps.isEmpty();
        }

        private void prune(long now, long windowMillis) {
            long windowStart = now - windowMillis;
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= windowStart) {
                timestamps.pollFirst();
            }
        }
    }
}
