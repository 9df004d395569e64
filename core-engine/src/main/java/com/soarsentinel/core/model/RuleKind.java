package com.soarsentinel.core.model;

import java.util.Locale;

/**
 * Detector family a {@link ThreatRule} is evaluated with.
 *
 * @since 1.0.0
 */
public enum RuleKind {

    /** Regular expressions over string fields of the payload. */
    PATTERN,

    /** Count of matching events per source inside a sliding window. */
    RATE,

    /** Count of distinct values of one payload field per source inside a sliding window. */
    DISTINCT,

    /** Static threshold on a numeric payload field. */
    THRESHOLD,

    /** Access to a protected resource without a credential marker. */
    CREDENTIAL,

    /** No built-in detector; anomalies are submitted from outside the engine. */
    EXTERNAL;

    /**
     * @return the lower-case name used in rule configuration files
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
