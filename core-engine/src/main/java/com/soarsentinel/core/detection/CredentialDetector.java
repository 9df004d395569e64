package com.soarsentinel.core.detection;

import com.soarsentinel.core.config.DetectionRule;
import com.soarsentinel.core.model.Anomaly;
import com.soarsentinel.core.model.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Unauthorized-access detector.
 *
 * <p>
 * Fires when the payload flags a protected resource (by default
 * {@code requires_auth: true}) and none of the credential markers is present,
 * or when the payload explicitly reports {@code authorized: false}. Events
 * that do not mention protection are ignored.
 * </p>
 *
 * @since 1.0.0
 */
public class CredentialDetector extends RuleDetector {

    private static final Logger LOG = LoggerFactory.getLogger(CredentialDetector.class);

    static final List<String> DEFAULT_CREDENTIAL_FIELDS =
            List.of("auth_token", "authorization", "api_key", "session_id");

    private final String protectedFlag;
    private final List<String> credentialFields;

    public CredentialDetector(DetectionRule config) {
        super(config, 0.85);
        this.protectedFlag = Objects.requireNonNull(config.getProtectedFlag(),
                "protectedFlag must not be null for rule '" + rule.id() + "'");
        this.credentialFields = config.getCredentialFields().isEmpty()
                ? DEFAULT_CREDENTIAL_FIELDS
                : List.copyOf(config.getCredentialFields());
    }

    @Override
    public Optional<Anomaly> evaluate(TelemetryEvent event) {
        Objects.requireNonNull(event, "Event must not be null");

        boolean denied = event.payloadBoolean("authorized").map(b -> !b).orElse(false);
        boolean protectedResource = event.payloadBoolean(protectedFlag).orElse(false);
        boolean credentialPresent = credentialFields.stream().anyMatch(event::hasPayloadValue);

        if (!denied && !(protectedResource && !credentialPresent)) {
            return Optional.empty();
        }

        String resource = event.payloadString("path")
                .or(() -> event.payloadString("resource"))
                .orElse(event.getService());

        LOG.debug("Rule [{}] fired for {} on {}", rule.id(), event.getSourceId(), resource);

        Map<String, Object> evidence = evidence(event);
        evidence.put("resource", resource);
        evidence.put("credential_present", credentialPresent);
        evidence.put("reason", denied ? "access explicitly denied" : "no credential marker");

        return Optional.of(anomaly(event, rule.defaultSeverity(), confidence,
                String.format("%s: %s accessed %s without valid credentials",
                        rule.displayName(), event.getSourceId(), resource),
                evidence));
    }
}
