package com.soarsentinel.core.correlation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counts over the alert book. Severity counters only include unacknowledged alerts.
 *
 * @since 1.0.0
 */
public final class AlertStats {

    private final int total;
    private final int active;
    private final int critical;
    private final int high;
    private final int medium;
    private final int low;

    public AlertStats(int total, int active, int critical, int high, int medium, int low) {
        this.total = total;
        this.active = active;
        this.critical = critical;
        this.high = high;
        this.medium = medium;
        this.low = low;
    }

    @JsonProperty("total")
    public int getTotal() {
        return total;
    }

    @JsonProperty("active")
    public int getActive() {
        return active;
    }

    @JsonProperty("critical")
    public int getCritical() {
        return critical;
    }

    @JsonProperty("high")
    public int getHigh() {
        return high;
    }

    @JsonProperty("medium")
    public int getMedium() {
        return medium;
    }

    @JsonProperty("low")
    public int getLow() {
        return low;
    }

    @Override
    public String toString() {
        return "AlertStats{total=" + total + ", active=" + active + ", critical=" + critical
                + ", high=" + high + ", medium=" + medium + ", low=" + low + '}';
    }
}
