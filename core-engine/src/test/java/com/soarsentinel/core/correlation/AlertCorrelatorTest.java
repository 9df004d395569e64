package com.soarsentinel.core.correlation;

import com.soarsentinel.core.metrics.SentinelMetrics;
import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.Anomaly;
import com.soarsentinel.core.model.Severity;
import com.soarsentinel.core.model.ThreatRule;
import com.soarsentinel.core.model.ValidationException;
import com.soarsentinel.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertCorrelator}.
 */
class AlertCorrelatorTest {

    private MutableClock clock;
    private SentinelMetrics metrics;
    private AlertCorrelator correlator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        metrics = new SentinelMetrics();
        correlator = new AlertCorrelator(Duration.ofSeconds(30), 3, clock, metrics);
    }

    @Test
    @DisplayName("First anomaly creates an alert from the rule template")
    void createsAlertFromTemplate() {
        Correlation correlation = correlator.correlate(anomaly(ThreatRule.SQL_INJECTION, "203.0.113.5"));

        assertThat(correlation.isSuppressed()).isFalse();
        Alert alert = correlation.getAlert().orElseThrow();
        assertThat(alert.getTitle()).isEqualTo("SQL Injection Attempt Detected");
        assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(alert.getSourceId()).isEqualTo("203.0.113.5");
        assertThat(alert.getCreatedAt()).isEqualTo(clock.instant());
        assertThat(alert.getRuleId()).isEqualTo("sql_injection");
        assertThat(alert.isAcknowledged()).isFalse();
        assertThat(correlation.getSuppressionKey()).isEqualTo("sql_injection|203.0.113.5");
    }

    @Test
    @DisplayName("Same rule and source within the cooldown is suppressed")
    void suppressesWithinCooldown() {
        correlator.correlate(anomaly(ThreatRule.PORT_SCAN, "10.0.0.9"));
        clock.advanceSeconds(10);

        Correlation second = correlator.correlate(anomaly(ThreatRule.PORT_SCAN, "10.0.0.9"));

        assertThat(second.isSuppressed()).isTrue();
        assertThat(second.getAlert()).isEmpty();
        assertThat(second.getRetryAfter()).isEqualTo(Duration.ofSeconds(20));
        assertThat(correlator.list(AlertFilter.ALL)).hasSize(1);
        assertThat(metrics.snapshot()).containsEntry("soar.alerts.suppressed", 1.0);
    }

    @Test
    @DisplayName("Cooldown is scoped to the rule and source pair")
    void cooldownScopedToRuleAndSource() {
        correlator.correlate(anomaly(ThreatRule.PORT_SCAN, "10.0.0.9"));

        assertThat(correlator.correlate(anomaly(ThreatRule.BRUTE_FORCE, "10.0.0.9")).isSuppressed()).isFalse();
        assertThat(correlator.correlate(anomaly(ThreatRule.PORT_SCAN, "10.0.0.10")).isSuppressed()).isFalse();
    }

    @Test
    @DisplayName("A new alert is created once the cooldown has elapsed")
    void createsAgainAfterCooldown() {
        correlator.correlate(anomaly(ThreatRule.PORT_SCAN, "10.0.0.9"));
        clock.advanceSeconds(30);

        assertThat(correlator.correlate(anomaly(ThreatRule.PORT_SCAN, "10.0.0.9")).isSuppressed()).isFalse();
    }

    @Test
    @DisplayName("Warning severity is presented as medium")
    void warningMapsToMedium() {
        Alert alert = correlator.correlate(anomaly(ThreatRule.HIGH_CPU, "host-1")).getAlert().orElseThrow();
        assertThat(alert.getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    @DisplayName("Unknown rule ids get the generic template")
    void unknownRuleUsesGenericTemplate() {
        Anomaly anomaly = Anomaly.builder()
                .ruleId("zero_day")
                .severity(Severity.HIGH)
                .evidence(Map.of("source_ip", "192.0.2.1"))
                .detectedAt(clock.instant())
                .build();

        Alert alert = correlator.correlate(anomaly).getAlert().orElseThrow();

        assertThat(alert.getTitle()).isEqualTo("Security Anomaly Detected");
        assertThat(alert.getSourceId()).isEqualTo("192.0.2.1");
        assertThat(alert.getRuleId()).isEqualTo("zero_day");
    }

    @Test
    @DisplayName("Full book evicts the oldest acknowledged alert first")
    void evictsAcknowledgedFirst() {
        Alert first = create(ThreatRule.PORT_SCAN, "a");
        Alert second = create(ThreatRule.PORT_SCAN, "b");
        Alert third = create(ThreatRule.PORT_SCAN, "c");
        correlator.acknowledge(second.getAlertId());

        Alert fourth = create(ThreatRule.PORT_SCAN, "d");

        assertThat(correlator.list(AlertFilter.ALL))
                .containsExactly(fourth, third, first);
    }

    @Test
    @DisplayName("Full book without acknowledged alerts evicts the oldest")
    void evictsOldestOtherwise() {
        Alert first = create(ThreatRule.PORT_SCAN, "a");
        create(ThreatRule.PORT_SCAN, "b");
        create(ThreatRule.PORT_SCAN, "c");
        create(ThreatRule.PORT_SCAN, "d");

        assertThat(correlator.find(first.getAlertId())).isEmpty();
        assertThat(correlator.list(AlertFilter.ALL)).hasSize(3);
    }

    @Test
    @DisplayName("Lifecycle operations update filters and stats")
    void lifecycle() {
        Alert critical = create(ThreatRule.SQL_INJECTION, "a");
        create(ThreatRule.PORT_SCAN, "b");
        create(ThreatRule.HIGH_CPU, "c");

        assertThat(correlator.acknowledge(critical.getAlertId())).isPresent();
        assertThat(critical.getAcknowledgedAt()).isEqualTo(clock.instant());

        AlertStats stats = correlator.stats();
        assertThat(stats.getTotal()).isEqualTo(3);
        assertThat(stats.getActive()).isEqualTo(2);
        assertThat(stats.getCritical()).isZero();
        assertThat(stats.getHigh()).isEqualTo(1);
        assertThat(stats.getMedium()).isEqualTo(1);

        assertThat(correlator.list(AlertFilter.ACKNOWLEDGED)).containsExactly(critical);
        assertThat(correlator.list(AlertFilter.ACTIVE)).hasSize(2);

        assertThat(correlator.clearAcknowledged()).isEqualTo(1);
        assertThat(correlator.acknowledgeAll()).isEqualTo(2);
        assertThat(correlator.stats().getActive()).isZero();
    }

    @Test
    @DisplayName("Dismiss removes the alert and reports unknown ids")
    void dismiss() {
        Alert alert = create(ThreatRule.PORT_SCAN, "a");

        assertThat(correlator.dismiss(alert.getAlertId())).isTrue();
        assertThat(correlator.dismiss(alert.getAlertId())).isFalse();
        assertThat(correlator.acknowledge("missing")).isEmpty();
    }

    @Test
    @DisplayName("Filter parsing rejects unknown values")
    void parsesFilter() {
        assertThat(AlertFilter.parse(null).name()).isEqualTo("ALL");
        assertThat(AlertFilter.parse("Active").name()).isEqualTo("ACTIVE");
        assertThatThrownBy(() -> AlertFilter.parse("pending"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("pending");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Alert create(ThreatRule rule, String source) {
        return correlator.correlate(anomaly(rule, source)).getAlert().orElseThrow();
    }

    private Anomaly anomaly(ThreatRule rule, String source) {
        return Anomaly.builder()
                .rule(rule)
                .severity(rule.defaultSeverity())
                .confidence(0.9)
                .sourceId(source)
                .service("web")
                .detectedAt(clock.instant())
                .build();
    }
}
