package com.soarsentinel.core.correlation;

import com.soarsentinel.core.model.Alert;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded, insertion-ordered store of correlated alerts.
 *
 * <p>
 * When full, adding an alert evicts the oldest acknowledged alert, or the
 * oldest alert overall if none is acknowledged. All methods synchronize on the
 * book; it holds at most a few hundred entries.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertBook {

    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final LinkedHashMap<String, Alert> alerts = new LinkedHashMap<>();

    public AlertBook(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Add an alert, evicting one entry first if the book is full.
     *
     * @return the evicted alert, if any
     */
    public synchronized Optional<Alert> add(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        Alert evicted = null;
        if (!alerts.containsKey(alert.getAlertId()) && alerts.size() >= capacity) {
            evicted = evictOne();
        }
        alerts.put(alert.getAlertId(), alert);
        return Optional.ofNullable(evicted);
    }

    public synchronized Optional<Alert> get(String alertId) {
        return Optional.ofNullable(alerts.get(alertId));
    }

    /**
     * @return the alert after acknowledgement, or empty if the id is unknown
     */
    public synchronized Optional<Alert> acknowledge(String alertId, Instant at) {
        Alert alert = alerts.get(alertId);
        if (alert == null) {
            return Optional.empty();
        }
        alert.acknowledge(at);
        return Optional.of(alert);
    }

    public synchronized int acknowledgeAll(Instant at) {
        int count = 0;
        for (Alert alert : alerts.values()) {
            if (alert.acknowledge(at)) {
                count++;
            }
        }
        return count;
    }

    public synchronized Optional<Alert> remove(String alertId) {
        return Optional.ofNullable(alerts.remove(alertId));
    }

    public synchronized int removeAcknowledged() {
        int before = alerts.size();
        alerts.values().removeIf(Alert::isAcknowledged);
        return before - alerts.size();
    }

    /**
     * @return matching alerts, newest first
     */
    public synchronized List<Alert> list(AlertFilter filter) {
        List<Alert> result = new ArrayList<>();
        for (Alert alert : alerts.values()) {
            if (filter.test(alert)) {
                result.add(alert);
            }
        }
        Collections.reverse(result);
        return result;
    }

    public synchronized AlertStats stats() {
        int active = 0;
        int critical = 0;
        int high = 0;
        int medium = 0;
        int low = 0;
        for (Alert alert : alerts.values()) {
            if (alert.isAcknowledged()) {
                continue;
            }
            active++;
            switch (alert.getSeverity()) {
                case CRITICAL -> critical++;
                case HIGH -> high++;
                case LOW -> low++;
                default -> medium++;
            }
        }
        return new AlertStats(alerts.size(), active, critical, high, medium, low);
    }

    public synchronized int size() {
        return alerts.size();
    }

    public synchronized void clear() {
        alerts.clear();
    }

    public int getCapacity() {
        return capacity;
    }

    private Alert evictOne() {
        for (Iterator<Map.Entry<String, Alert>> it = alerts.entrySet().iterator(); it.hasNext(); ) {
            Alert candidate = it.next().getValue();
            if (candidate.isAcknowledged()) {
                it.remove();
                return candidate;
            }
        }
        Iterator<Alert> oldest = alerts.values().iterator();
        Alert evicted = oldest.next();
        oldest.remove();
        return evicted;
    }
}
