package com.soarsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity attached to anomalies and alerts.
 *
 * <p>
 * Detectors may report {@link #WARNING}; alerts only carry the four alert
 * levels, so {@link #toAlertLevel()} folds {@code WARNING} into
 * {@link #MEDIUM}.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW("low"),
    MEDIUM("medium"),
    WARNING("warning"),
    HIGH("high"),
    CRITICAL("critical");

    private final String id;

    Severity(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * @return the level used on alerts: one of critical, high, medium, low
     */
    public Severity toAlertLevel() {
        return this == WARNING ? MEDIUM : this;
    }

    /**
     * Parse a wire id, case-insensitively.
     *
     * @param value wire id such as {@code "critical"}
     * @return the matching severity
     * @throws IllegalArgumentException if the value is not a known severity
     */
    @JsonCreator
    public static Severity fromId(String value) {
        if (value != null) {
            String normalised = value.trim().toLowerCase(Locale.ROOT);
            for (Severity s : values()) {
                if (s.id.equals(normalised)) {
                    return s;
                }
            }
        }
        throw new IllegalArgumentException("Unknown severity: '" + value
                + "'. Supported: critical, high, warning, medium, low");
    }
}
