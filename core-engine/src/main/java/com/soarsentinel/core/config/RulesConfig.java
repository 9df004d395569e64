package com.soarsentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the detection rules YAML file.
 *
 * <p>
 * Expected structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - name: rate_spike
 *     type: rate
 *     windowSeconds: 60
 *     threshold: 100
 * </pre>
 *
 * <p>
 * A catalogue rule that is not listed is simply not evaluated. Each rule may
 * appear at most once.
 * </p>
 *
 * @since 1.0.0
 */
public class RulesConfig {

    private List<DetectionRule> rules = new ArrayList<>();

    /**
     * @return unmodifiable list of configured rules, in file order
     */
    public List<DetectionRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     *
     * @param rules the detection rules
     */
    public void setRules(List<DetectionRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * @return the rules whose {@code enabled} flag is set
     */
    public List<DetectionRule> enabledRules() {
        return rules.stream().filter(DetectionRule::isEnabled).toList();
    }

    /**
     * Validate every rule and reject duplicate names. All problems are
     * collected and reported in a single exception.
     *
     * @throws IllegalStateException if one or more rules are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < rules.size(); i++) {
            DetectionRule rule = Objects.requireNonNull(rules.get(i),
                    "Rule at index " + i + " is null");
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (rule.getName() != null && !seen.add(rule.getName())) {
                errors.add("Rule '" + rule.getName() + "' is defined more than once");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rules configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "RulesConfig{rules=" + rules + '}';
    }
}
