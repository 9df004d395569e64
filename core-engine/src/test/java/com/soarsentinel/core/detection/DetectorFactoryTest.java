package com.soarsentinel.core.detection;

import com.soarsentinel.core.config.DetectionRule;
import com.soarsentinel.core.config.RulesLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Should create RateSpikeDetector for rate rules")
    void shouldCreateRateDetector() {
        DetectionRule rule = rule("rate_spike", "rate");
        rule.setWindowSeconds(60);
        rule.setThreshold(100);
        assertThat(DetectorFactory.create(rule)).isInstanceOf(RateSpikeDetector.class);
    }

    @Test
    @DisplayName("Should create ThresholdDetector for threshold rules")
    void shouldCreateThresholdDetector() {
        DetectionRule rule = rule("high_cpu", "threshold");
        rule.setField("cpu");
        rule.setThreshold(85);
        assertThat(DetectorFactory.create(rule)).isInstanceOf(ThresholdDetector.class);
    }

    @Test
    @DisplayName("Should create PatternDetector for pattern rules")
    void shouldCreatePatternDetector() {
        DetectionRule rule = rule("sql_injection", "pattern");
        rule.setPatterns(List.of("union\\s+select"));
        assertThat(DetectorFactory.create(rule)).isInstanceOf(PatternDetector.class);
    }

    @Test
    @DisplayName("Should create DistinctValueDetector for distinct rules")
    void shouldCreateDistinctDetector() {
        DetectionRule rule = rule("port_scan", "distinct");
        rule.setField("dest_port");
        rule.setWindowSeconds(60);
        rule.setThreshold(15);
        assertThat(DetectorFactory.create(rule)).isInstanceOf(DistinctValueDetector.class);
    }

    @Test
    @DisplayName("Should create CredentialDetector for credential rules")
    void shouldCreateCredentialDetector() {
        assertThat(DetectorFactory.create(rule("unauthorized_access", "credential")))
                .isInstanceOf(CredentialDetector.class);
    }

    @Test
    @DisplayName("Should throw for rules without a built-in detector")
    void shouldThrowForExternalRule() {
        assertThatThrownBy(() -> DetectorFactory.create(rule("ddos", "rate")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no built-in detector");
    }

    @Test
    @DisplayName("Should throw for unknown rule names")
    void shouldThrowForUnknownRule() {
        assertThatThrownBy(() -> DetectorFactory.create(rule("magic", "rate")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("magic");
    }

    @Test
    @DisplayName("Should create one detector per configured rule")
    void shouldCreateAllFromDefaults() {
        List<DetectionRule> rules = RulesLoader.fromClasspath(RulesLoader.DEFAULT_RESOURCE).enabledRules();
        assertThat(DetectorFactory.createAll(rules)).hasSameSizeAs(rules);
    }

    @Test
    @DisplayName("Should throw on null rule")
    void shouldThrowOnNull() {
        assertThatNullPointerException().isThrownBy(() -> DetectorFactory.create(null));
    }

    // ------------------------------------------------------------------
    // Helper
    // ------------------------------------------------------------------

    private static DetectionRule rule(String name, String type) {
        DetectionRule rule = new DetectionRule();
        rule.setName(name);
        rule.setType(type);
        return rule;
    }
}
