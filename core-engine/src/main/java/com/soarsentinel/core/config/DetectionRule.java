package com.soarsentinel.core.config;

import com.soarsentinel.core.model.RuleKind;
import com.soarsentinel.core.model.ThreatRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Parameters for one catalogue rule, loaded from configuration.
 *
 * <p>
 * The {@code name} must be the id of a {@link ThreatRule} that has a built-in
 * detector, and {@code type} must match that rule's {@link RuleKind}. The
 * catalogue decides what a rule is; this class only tunes it.
 * </p>
 *
 * <p>
 * Supported rule types:
 * </p>
 * <ul>
 * <li>{@code pattern}: regular expressions over payload strings</li>
 * <li>{@code rate}: events per source within a sliding window</li>
 * <li>{@code distinct}: distinct values of a payload field per source within
 * a sliding window</li>
 * <li>{@code threshold}: static threshold on a numeric payload field</li>
 * <li>{@code credential}: protected access without a credential marker</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class DetectionRule {

    /** Catalogue id, e.g. {@code sql_injection}. */
    private String name;

    /** Detector type; must equal the catalogue kind of {@link #name}. */
    private String type;

    /** Set to {@code false} to keep a rule in the file but not evaluate it. */
    private boolean enabled = true;

    /** Confidence reported when the rule fires; 0 means the detector default. */
    private double confidence;

    // --- pattern ---
    /** Payload paths to scan; empty means every string value. */
    private List<String> fields = new ArrayList<>();

    /** Case-insensitive regular expressions. */
    private List<String> patterns = new ArrayList<>();

    // --- rate / distinct ---
    private int windowSeconds;

    /** Fires when the windowed count exceeds this value; also the numeric threshold. */
    private double threshold;

    /** Only events of this type are counted; {@code null} counts all. */
    private String eventType;

    /** Payload field that must equal {@link #matchValue} for an event to count. */
    private String matchField;

    private String matchValue;

    // --- threshold / distinct ---
    /** Numeric (threshold) or distinct-value (distinct) payload field. */
    private String field;

    /** Above this value a threshold rule reports critical severity. */
    private Double criticalThreshold;

    // --- credential ---
    /** Payload keys whose presence counts as a credential. */
    private List<String> credentialFields = new ArrayList<>();

    /** Payload flag that marks a protected resource. */
    private String protectedFlag = "requires_auth";

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that the rule names a catalogue entry, the declared type
     * matches it, and every parameter the type needs is present and legal.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Rule 'type' is required");
        }

        Optional<ThreatRule> catalogued = threatRule();
        if (name != null && !name.isBlank()) {
            if (catalogued.isEmpty()) {
                errors.add("Unknown rule '" + name + "'. It is not part of the rule catalogue");
            } else if (catalogued.get().kind() == RuleKind.EXTERNAL) {
                errors.add("Rule '" + name + "' has no built-in detector");
            } else if (type != null && !catalogued.get().kind().configName().equals(type)) {
                errors.add("Rule '" + name + "' must have type '"
                        + catalogued.get().kind().configName() + "', got '" + type + "'");
            }
        }

        if (confidence < 0 || confidence > 1) {
            errors.add("Rule '" + name + "' requires 'confidence' within [0, 1]");
        }

        if (type != null) {
            switch (type) {
                case "pattern" -> {
                    if (patterns == null || patterns.isEmpty()) {
                        errors.add("Pattern rule '" + name + "' requires at least one entry in 'patterns'");
                    } else {
                        for (String p : patterns) {
                            try {
                                Pattern.compile(p, Pattern.CASE_INSENSITIVE);
                            } catch (PatternSyntaxException e) {
                                errors.add("Pattern rule '" + name + "' has an invalid pattern '"
                                        + p + "': " + e.getDescription());
                            }
                        }
                    }
                }
                case "rate" -> requireWindow(errors, "Rate");
                case "distinct" -> {
                    requireWindow(errors, "Distinct");
                    if (field == null || field.isBlank()) {
                        errors.add("Distinct rule '" + name + "' requires 'field'");
                    }
                }
                case "threshold" -> {
                    if (field == null || field.isBlank()) {
                        errors.add("Threshold rule '" + name + "' requires 'field'");
                    }
                    if (threshold <= 0) {
                        errors.add("Threshold rule '" + name + "' requires 'threshold' > 0");
                    }
                    if (criticalThreshold != null && criticalThreshold <= threshold) {
                        errors.add("Threshold rule '" + name
                                + "' requires 'criticalThreshold' > 'threshold'");
                    }
                }
                case "credential" -> {
                    if (protectedFlag == null || protectedFlag.isBlank()) {
                        errors.add("Credential rule '" + name + "' requires 'protectedFlag'");
                    }
                }
                default -> errors.add("Unknown rule type: '" + type
                        + "'. Supported: pattern, rate, distinct, threshold, credential");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionRule: " + String.join("; ", errors));
        }
    }

    private void requireWindow(List<String> errors, String label) {
        if (windowSeconds <= 0) {
            errors.add(label + " rule '" + name + "' requires 'windowSeconds' > 0");
        }
        if (threshold <= 0) {
            errors.add(label + " rule '" + name + "' requires 'threshold' > 0");
        }
    }

    /**
     * @return the catalogue entry this configuration tunes, if the name is known
     */
    public Optional<ThreatRule> threatRule() {
        return ThreatRule.lookup(name);
    }

    /**
     * Return the catalogue entry, failing if the name is unknown. Call after
     * {@link #validate()}.
     *
     * @return the catalogue entry
     * @throws IllegalStateException if the name is not in the catalogue
     */
    public ThreatRule requireThreatRule() {
        return threatRule().orElseThrow(() -> new IllegalStateException(
                "Rule '" + name + "' is not part of the rule catalogue"));
    }

    /**
     * @param fallback detector default
     * @return the configured confidence, or {@code fallback} when unset
     */
    public double confidenceOr(double fallback) {
        return confidence > 0 ? confidence : fallback;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name != null ? name.trim().toLowerCase(Locale.ROOT) : null;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the rule type, normalised to lowercase.
     *
     * @param type rule type string
     */
    public void setType(String type) {
        this.type = type != null ? type.trim().toLowerCase(Locale.ROOT) : null;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public List<String> getFields() {
        return fields;
    }

    public void setFields(List<String> fields) {
        this.fields = fields != null ? new ArrayList<>(fields) : new ArrayList<>();
    }

    public List<String> getPatterns() {
        return patterns;
    }

    public void setPatterns(List<String> patterns) {
        this.patterns = patterns != null ? new ArrayList<>(patterns) : new ArrayList<>();
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType != null ? eventType.trim().toLowerCase(Locale.ROOT) : null;
    }

    public String getMatchField() {
        return matchField;
    }

    public void setMatchField(String matchField) {
        this.matchField = matchField;
    }

    public String getMatchValue() {
        return matchValue;
    }

    public void setMatchValue(String matchValue) {
        this.matchValue = matchValue;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public Double getCriticalThreshold() {
        return criticalThreshold;
    }

    public void setCriticalThreshold(Double criticalThreshold) {
        this.criticalThreshold = criticalThreshold;
    }

    public List<String> getCredentialFields() {
        return credentialFields;
    }

    public void setCredentialFields(List<String> credentialFields) {
        this.credentialFields = credentialFields != null
                ? new ArrayList<>(credentialFields)
                : new ArrayList<>();
    }

    public String getProtectedFlag() {
        return protectedFlag;
    }

    public void setProtectedFlag(String protectedFlag) {
        this.protectedFlag = protectedFlag;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionRule that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "DetectionRule{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", enabled=" + enabled +
                ", field='" + field + '\'' +
                ", threshold=" + threshold +
                ", criticalThreshold=" + criticalThreshold +
                ", windowSeconds=" + windowSeconds +
                ", eventType='" + eventType + '\'' +
                ", patterns=" + patterns.size() +
                '}';
    }
}
