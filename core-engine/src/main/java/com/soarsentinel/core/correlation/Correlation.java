package com.soarsentinel.core.correlation;

import com.soarsentinel.core.model.Alert;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of correlating one anomaly: either a fresh alert or a deliberate
 * suppression. Suppression is an expected result, not an error.
 *
 * @since 1.0.0
 */
public final class Correlation {

    private final Alert alert;
    private final String suppressionKey;
    private final Duration retryAfter;

    private Correlation(Alert alert, String suppressionKey, Duration retryAfter) {
        this.alert = alert;
        this.suppressionKey = suppressionKey;
        this.retryAfter = retryAfter;
    }

    static Correlation created(Alert alert, String suppressionKey) {
        return new Correlation(Objects.requireNonNull(alert, "alert must not be null"),
                suppressionKey, Duration.ZERO);
    }

    static Correlation suppressed(String suppressionKey, Duration retryAfter) {
        return new Correlation(null, suppressionKey, retryAfter);
    }

    public boolean isSuppressed() {
        return alert == null;
    }

    /**
     * @return the created alert, or empty when suppressed
     */
    public Optional<Alert> getAlert() {
        return Optional.ofNullable(alert);
    }

    public String getSuppressionKey() {
        return suppressionKey;
    }

    /**
     * @return remaining cooldown for a suppressed anomaly, zero otherwise
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    @Override
    public String toString() {
        return isSuppressed()
                ? "Correlation{suppressed key='" + suppressionKey + "', retryAfter=" + retryAfter + '}'
                : "Correlation{alert=" + alert.getAlertId() + '}';
    }
}
