package com.soarsentinel.core.detection;

import com.soarsentinel.core.config.DetectionRule;
import com.soarsentinel.core.model.Anomaly;
import com.soarsentinel.core.model.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Distinct-value detector.
 *
 * <p>
 * Tracks, per source, how many distinct values of one payload field were seen
 * inside a sliding window and fires when that number exceeds the threshold.
 * With {@code field: dest_port} this is a port-scan rule. Edge-triggered in
 * the same way as {@link RateSpikeDetector}.
 * </p>
 *
 * @since 1.0.0
 */
public class DistinctValueDetector extends RuleDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DistinctValueDetector.class);

    private final String field;
    private final int windowSeconds;
    private final double threshold;
    private final String eventType;

    private final SourceWindows<DistinctWindow> windows = new SourceWindows<>(DistinctWindow::new);

    public DistinctValueDetector(DetectionRule config) {
        super(config, 0.80);
        this.field = Objects.requireNonNull(config.getField(),
                "Field must not be null for distinct rule '" + rule.id() + "'");
        this.windowSeconds = config.getWindowSeconds();
        this.threshold = config.getThreshold();
        this.eventType = config.getEventType();

        if (windowSeconds <= 0 || threshold <= 0) {
            throw new IllegalArgumentException("windowSeconds and threshold must be > 0 for rule '"
                    + rule.id() + "'");
        }
    }

    @Override
    public Optional<Anomaly> evaluate(TelemetryEvent event) {
        Objects.requireNonNull(event, "Event must not be null");

        String source = event.getSourceId();
        if (source == null || source.isBlank()
                || (eventType != null && !eventType.equals(event.getEventType()))) {
            return Optional.empty();
        }
        Optional<String> value = event.payloadString(field);
        if (value.isEmpty() || value.get().isBlank()) {
            LOG.trace("Rule [{}]: field '{}' not present, skipping", rule.id(), field);
            return Optional.empty();
        }

        long now = observedAt(event).toEpochMilli();
        long windowMillis = windowSeconds * 1_000L;

        int crossedAt = windows.update(source, w -> w.record(now, windowMillis, value.get(), threshold));
        windows.maybeSweep(w -> w.isIdle(now, windowMillis));

        if (crossedAt < 0) {
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired for {}: {} distinct '{}' values", rule.id(), source, crossedAt, field);

        Map<String, Object> evidence = evidence(event);
        evidence.put("field", field);
        evidence.put("distinct_values", crossedAt);
        evidence.put("window_seconds", windowSeconds);
        evidence.put("threshold", threshold);

        return Optional.of(anomaly(event, rule.defaultSeverity(), confidence,
                String.format("%s: %d distinct %s values in %d seconds (threshold: %.0f)",
                        rule.displayName(), crossedAt, field, windowSeconds, threshold),
                evidence));
    }

    /**
     * Observations for one source: a time-ordered deque plus a multiset of values.
     */
    static final class DistinctWindow {
        private final Deque<Observation> observations = new ArrayDeque<>();
        private final Map<String, Integer> counts = new HashMap<>();
        private boolean armed = true;

        int record(long now, long windowMillis, String value, double threshold) {
            prune(now, windowMillis);
            observations.addLast(new Observation(now, value));
            counts.merge(value, 1, Integer::sum);
            int distinct = counts.size();
            if (distinct <= threshold) {
                armed = true;
                return -1;
            }
            if (armed) {
                armed = false;
                return distinct;
            }
            return -1;
        }

        boolean isIdle(long now, long windowMillis) {
            prune(now, windowMillis);
            return observations.isEmpty();
        }

        private void prune(long now, long windowMillis) {
            long windowStart = now - windowMillis;
            while (!observations.isEmpty() && observations.peekFirst().at() <= windowStart) {
                Observation old = observations.pollFirst();
                counts.computeIfPresent(old.value(), (k, c) -> c > 1 ? c - 1 : null);
            }
        }
    }

    private static final class Observation {
        private final long at;
        private final String value;

        Observation(long at, String value) {
            this.at = at;
            this.value = value;
        }

        long at() {
            return at;
        }

        String value() {
            return value;
        }
    }
}
