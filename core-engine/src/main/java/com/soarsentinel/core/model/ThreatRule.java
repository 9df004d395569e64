package com.soarsentinel.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.soarsentinel.core.model.ActionType.ALERT_ONLY;
import static com.soarsentinel.core.model.ActionType.BLOCK_IP;
import static com.soarsentinel.core.model.ActionType.ISOLATE_SERVICE;
import static com.soarsentinel.core.model.ActionType.THROTTLE_IP;

/**
 * The closed catalogue of threat rules.
 *
 * <p>
 * Every rule identifier is bound here, at compile time, to the detector
 * family that evaluates it, the alert template the correlator renders and the
 * playbook the orchestrator executes. A rule id that is not in this catalogue
 * resolves to {@link #GENERIC}, so no alert can ever lack a playbook.
 * </p>
 *
 * @since 1.0.0
 */
public enum ThreatRule {

    SQL_INJECTION("sql_injection", "SQL Injection Detection", RuleKind.PATTERN,
            "SQL Injection Attempt Detected",
            "SQL injection pattern detected in a request parameter.",
            "Block source IP, review and sanitize input parameters.",
            Severity.CRITICAL,
            List.of(BLOCK_IP, ISOLATE_SERVICE, ALERT_ONLY)),

    RATE_SPIKE("rate_spike", "Request Rate Spike", RuleKind.RATE,
            "Request Rate Spike",
            "Abnormally high request rate from a single source.",
            "Consider rate limiting or blocking this IP.",
            Severity.WARNING,
            List.of(THROTTLE_IP)),

    BRUTE_FORCE("brute_force", "Brute Force Attack", RuleKind.RATE,
            "Brute Force Attack Detected",
            "Repeated failed authentication attempts from a single source.",
            "Block source IP, review account security.",
            Severity.CRITICAL,
            List.of(BLOCK_IP, THROTTLE_IP)),

    PORT_SCAN("port_scan", "Port Scan", RuleKind.DISTINCT,
            "Port Scan Detected",
            "A single source probed many distinct destination ports.",
            "Block source IP and audit exposed services.",
            Severity.HIGH,
            List.of(BLOCK_IP)),

    HIGH_CPU("high_cpu", "High CPU Usage", RuleKind.THRESHOLD,
            "High CPU Usage Detected",
            "CPU utilization exceeded the configured threshold.",
            "Check for runaway processes or consider scaling resources.",
            Severity.WARNING,
            List.of(ALERT_ONLY)),

    HIGH_MEMORY("high_memory", "High Memory Usage", RuleKind.THRESHOLD,
            "Critical Memory Usage",
            "Memory usage exceeded the configured threshold. The service may become unresponsive.",
            "Check for memory leaks, consider restarting the service.",
            Severity.CRITICAL,
            List.of(ISOLATE_SERVICE)),

    HIGH_NETWORK("high_network", "Network Traffic Spike", RuleKind.THRESHOLD,
            "Unusual Network Traffic Spike",
            "Network throughput exceeded the configured threshold.",
            "Investigate the traffic source for data exfiltration or DDoS activity.",
            Severity.WARNING,
            List.of(THROTTLE_IP)),

    DATA_EXFILTRATION("data_exfiltration", "Data Exfiltration", RuleKind.THRESHOLD,
            "Possible Data Exfiltration",
            "Outbound transfer volume exceeded the configured threshold.",
            "Block the destination, isolate the service and review accessed records.",
            Severity.CRITICAL,
            List.of(BLOCK_IP, ISOLATE_SERVICE)),

    UNAUTHORIZED_ACCESS("unauthorized_access", "Unauthorized Access", RuleKind.CREDENTIAL,
            "Unauthorized Access Attempt",
            "A protected resource was accessed without valid credentials.",
            "Block source IP and verify access control on the resource.",
            Severity.HIGH,
            List.of(BLOCK_IP, ALERT_ONLY)),

    DDOS("ddos", "Distributed Denial of Service", RuleKind.EXTERNAL,
            "DDoS Attack Detected",
            "Traffic pattern consistent with a denial-of-service attack.",
            "Rate limit and block offending sources, enable upstream scrubbing.",
            Severity.CRITICAL,
            List.of(THROTTLE_IP, BLOCK_IP)),

    MALWARE("malware", "Malware Activity", RuleKind.EXTERNAL,
            "Malware Activity Detected",
            "Behaviour consistent with malware was observed on a service.",
            "Isolate the affected service and start incident forensics.",
            Severity.CRITICAL,
            List.of(ISOLATE_SERVICE, ALERT_ONLY)),

    PRIVILEGE_ESCALATION("privilege_escalation", "Privilege Escalation", RuleKind.EXTERNAL,
            "Privilege Escalation Attempt",
            "An identity attempted to obtain privileges beyond its role.",
            "Isolate the service, block the source and rotate affected credentials.",
            Severity.CRITICAL,
            List.of(ISOLATE_SERVICE, BLOCK_IP, ALERT_ONLY)),

    GENERIC("generic", "Generic Anomaly", RuleKind.EXTERNAL,
            "Security Anomaly Detected",
            "An anomaly was reported that does not match a known rule.",
            "Review the evidence and escalate for manual triage.",
            Severity.MEDIUM,
            List.of(ALERT_ONLY));

    private final String id;
    private final String displayName;
    private final RuleKind kind;
    private final String title;
    private final String description;
    private final String recommendation;
    private final Severity defaultSeverity;
    private final List<ActionType> playbook;

    ThreatRule(String id, String displayName, RuleKind kind, String title, String description,
            String recommendation, Severity defaultSeverity, List<ActionType> playbook) {
        this.id = id;
        this.displayName = displayName;
        this.kind = kind;
        this.title = title;
        this.description = description;
        this.recommendation = recommendation;
        this.defaultSeverity = defaultSeverity;
        this.playbook = playbook;
    }

    /**
     * Look up a rule by its wire id.
     *
     * @param ruleId rule id such as {@code "sql_injection"}; may be {@code null}
     * @return the rule, or empty when the id is not part of the catalogue
     */
    public static Optional<ThreatRule> lookup(String ruleId) {
        if (ruleId == null || ruleId.isBlank()) {
            return Optional.empty();
        }
        String normalised = ruleId.trim().toLowerCase(Locale.ROOT);
        for (ThreatRule rule : values()) {
            if (rule.id.equals(normalised)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve a rule id, falling back to {@link #GENERIC} for unknown ids.
     *
     * @param ruleId rule id; may be {@code null}
     * @return the matching rule, never {@code null}
     */
    public static ThreatRule resolve(String ruleId) {
        return lookup(ruleId).orElse(GENERIC);
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public RuleKind kind() {
        return kind;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public String recommendation() {
        return recommendation;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    /**
     * @return the ordered, unmodifiable list of actions run for this rule
     */
    public List<ActionType> playbook() {
        return playbook;
    }
}
