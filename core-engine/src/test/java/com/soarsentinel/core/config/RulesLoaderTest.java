package com.soarsentinel.core.config;

import com.soarsentinel.core.model.RuleKind;
import com.soarsentinel.core.model.ThreatRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RulesLoader}.
 */
class RulesLoaderTest {

    @Test
    @DisplayName("Should load test rules from classpath")
    void shouldLoadFromClasspath() {
        RulesConfig config = RulesLoader.fromClasspath("test-rules.yml");

        assertThat(config.getRules()).hasSize(2);
        assertThat(config.getRules().get(0).getName()).isEqualTo("rate_spike");
        assertThat(config.getRules().get(0).getType()).isEqualTo("rate");
        assertThat(config.getRules().get(1).getName()).isEqualTo("high_cpu");
        assertThat(config.getRules().get(1).getCriticalThreshold()).isEqualTo(95.0);
        assertThat(config.getRules().get(1).getConfidence()).isEqualTo(0.9);
    }

    @Test
    @DisplayName("Default rules file configures every rule that has a detector")
    void defaultRulesCoverCatalogue() {
        RulesConfig config = RulesLoader.fromClasspath(RulesLoader.DEFAULT_RESOURCE);

        List<ThreatRule> expected = Arrays.stream(ThreatRule.values())
                .filter(r -> r.kind() != RuleKind.EXTERNAL)
                .toList();
        assertThat(config.enabledRules())
                .extracting(DetectionRule::requireThreatRule)
                .containsExactlyInAnyOrderElementsOf(expected);
    }

    @Test
    @DisplayName("Default brute force rule counts failed auth attempts")
    void defaultBruteForceRule() {
        DetectionRule rule = RulesLoader.fromClasspath(RulesLoader.DEFAULT_RESOURCE).getRules().stream()
                .filter(r -> r.getName().equals("brute_force"))
                .findFirst()
                .orElseThrow();

        assertThat(rule.getEventType()).isEqualTo("auth_attempt");
        assertThat(rule.getMatchField()).isEqualTo("success");
        assertThat(rule.getMatchValue()).isEqualTo("false");
        assertThat(rule.getWindowSeconds()).isEqualTo(300);
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> RulesLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> RulesLoader.fromFile("/nonexistent/rules.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject rules outside the catalogue")
    void shouldRejectUnknownRule() {
        String yaml = """
                rules:
                  - name: crypto_mining
                    type: threshold
                    field: cpu
                    threshold: 10
                """;

        assertThatThrownBy(() -> RulesLoader.fromString(yaml))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("crypto_mining");
    }

    @Test
    @DisplayName("Should reject a rule whose type does not match its detector")
    void shouldRejectMismatchedType() {
        String yaml = """
                rules:
                  - name: port_scan
                    type: rate
                    windowSeconds: 60
                    threshold: 15
                """;

        assertThatThrownBy(() -> RulesLoader.fromString(yaml))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must have type 'distinct'");
    }

    @Test
    @DisplayName("Should reject rules that only exist as templates")
    void shouldRejectExternalRule() {
        String yaml = """
                rules:
                  - name: malware
                    type: pattern
                    patterns: ['x']
                """;

        assertThatThrownBy(() -> RulesLoader.fromString(yaml))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no built-in detector");
    }

    @Test
    @DisplayName("Should collect every problem into one error")
    void shouldCollectAllErrors() {
        String yaml = """
                rules:
                  - name: sql_injection
                    type: pattern
                    patterns: ['(unclosed']
                  - name: rate_spike
                    type: rate
                    windowSeconds: 0
                    threshold: 10
                  - name: rate_spike
                    type: rate
                    windowSeconds: 10
                    threshold: 10
                """;

        assertThatThrownBy(() -> RulesLoader.fromString(yaml))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("invalid pattern")
                .hasMessageContaining("windowSeconds")
                .hasMessageContaining("more than once");
    }

    @Test
    @DisplayName("Empty document yields an empty configuration")
    void emptyDocument() {
        assertThat(RulesLoader.fromString("rules: []").getRules()).isEmpty();
    }

    @Test
    @DisplayName("Malformed YAML is reported as a configuration error")
    void malformedYaml() {
        assertThatThrownBy(() -> RulesLoader.fromString("rules:\n  - name: [unclosed"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Malformed rule files name the file in the error")
    void malformedFileNamesOrigin(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.yml");
        Files.writeString(file, "rules:\n  - name: [unclosed", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> RulesLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed rules")
                .hasMessageContaining(file.toString());
    }

    @Test
    @DisplayName("A copied rules file loads the same rules as the classpath resource")
    void fileAndClasspathAgree(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("rules.yml");
        try (InputStream in = RulesLoader.class.getClassLoader().getResourceAsStream(RulesLoader.DEFAULT_RESOURCE)) {
            assertThat(in).isNotNull();
            Files.copy(in, file);
        }

        List<String> fromFile = RulesLoader.fromFile(file.toString()).getRules().stream()
                .map(DetectionRule::getName).toList();
        List<String> fromClasspath = RulesLoader.fromClasspath(RulesLoader.DEFAULT_RESOURCE).getRules().stream()
                .map(DetectionRule::getName).toList();

        assertThat(fromFile).isNotEmpty().containsExactlyElementsOf(fromClasspath);
    }
}
