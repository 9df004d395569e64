package com.soarsentinel.core.detection;

import com.soarsentinel.core.config.DetectionRule;
import com.soarsentinel.core.model.Anomaly;
import com.soarsentinel.core.model.Severity;
import com.soarsentinel.core.model.TelemetryEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RateSpikeDetector}.
 */
class RateSpikeDetectorTest {

    private static final Instant BASE = Instant.parse("2024-05-01T10:00:00Z");

    private RateSpikeDetector detector;

    @BeforeEach
    void setUp() {
        DetectionRule rule = new DetectionRule();
        rule.setName("rate_spike");
        rule.setType("rate");
        rule.setWindowSeconds(60);
        rule.setThreshold(100);
        detector = new RateSpikeDetector(rule);
    }

    @Test
    @DisplayName("Should NOT fire while the count stays at or below the threshold")
    void shouldNotFireAtThreshold() {
        for (int i = 0; i < 100; i++) {
            assertThat(detector.evaluate(event("10.0.0.1", BASE.plusMillis(i * 100L)))).isEmpty();
        }
    }

    @Test
    @DisplayName("150 events in 60 seconds yield exactly one anomaly")
    void sustainedFloodFiresOnce() {
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            detector.evaluate(event("10.0.0.1", BASE.plusMillis(i * 300L))).ifPresent(anomalies::add);
        }

        assertThat(anomalies).hasSize(1);
        Anomaly anomaly = anomalies.get(0);
        assertThat(anomaly.getRuleId()).isEqualTo("rate_spike");
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(anomaly.getConfidence()).isEqualTo(0.75);
        assertThat(anomaly.getEvidence())
                .containsEntry("request_count", 101)
                .containsEntry("window_seconds", 60)
                .containsEntry("source_ip", "10.0.0.1");
    }

    @Test
    @DisplayName("Should re-arm after the window drains")
    void shouldRearmAfterWindowDrains() {
        int fired = 0;
        for (int i = 0; i < 101; i++) {
            if (detector.evaluate(event("10.0.0.1", BASE.plusMillis(i))).isPresent()) {
                fired++;
            }
        }
        Instant later = BASE.plusSeconds(120);
        for (int i = 0; i < 101; i++) {
            if (detector.evaluate(event("10.0.0.1", later.plusMillis(i))).isPresent()) {
                fired++;
            }
        }
        assertThat(fired).isEqualTo(2);
    }

    @Test
    @DisplayName("Should count each source independently")
    void shouldCountSourcesIndependently() {
        for (int i = 0; i < 100; i++) {
            detector.evaluate(event("10.0.0.1", BASE.plusMillis(i)));
        }
        assertThat(detector.evaluate(event("10.0.0.2", BASE.plusMillis(200)))).isEmpty();
        assertThat(detector.evaluate(event("10.0.0.1", BASE.plusMillis(200)))).isPresent();
        assertThat(detector.trackedSources()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should evict timestamps outside the window")
    void shouldEvictOldTimestamps() {
        for (int i = 0; i < 100; i++) {
            detector.evaluate(event("10.0.0.1", BASE));
        }
        Optional<Anomaly> late = detector.evaluate(event("10.0.0.1", BASE.plusSeconds(61)));
        assertThat(late).isEmpty();
    }

    @Test
    @DisplayName("Brute force variant only counts failed auth attempts")
    void bruteForceFilter() {
        DetectionRule rule = new DetectionRule();
        rule.setName("brute_force");
        rule.setType("rate");
        rule.setWindowSeconds(300);
        rule.setThreshold(4);
        rule.setEventType("auth_attempt");
        rule.setMatchField("success");
        rule.setMatchValue("false");
        RateSpikeDetector bruteForce = new RateSpikeDetector(rule);

        for (int i = 0; i < 10; i++) {
            assertThat(bruteForce.evaluate(authAttempt(true, BASE.plusSeconds(i)))).isEmpty();
        }
        for (int i = 0; i < 4; i++) {
            assertThat(bruteForce.evaluate(authAttempt(false, BASE.plusSeconds(20 + i)))).isEmpty();
        }
        Optional<Anomaly> fifth = bruteForce.evaluate(authAttempt(false, BASE.plusSeconds(30)));

        assertThat(fifth).isPresent();
        assertThat(fifth.get().getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(fifth.get().getEvidence()).containsEntry("username", "admin");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static TelemetryEvent event(String source, Instant at) {
        return TelemetryEvent.builder()
                .sourceId(source)
                .service("api-gateway")
                .eventType("http_request")
                .receivedAt(at)
                .build();
    }

    private static TelemetryEvent authAttempt(boolean success, Instant at) {
        return TelemetryEvent.builder()
                .sourceId("198.51.100.7")
                .service("auth-service")
                .eventType("auth_attempt")
                .payload("success", success)
                .payload("username", "admin")
                .receivedAt(at)
                .build();
    }
}
