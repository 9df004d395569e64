package com.soarsentinel.server;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration of the response server.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * server is configurable through container env vars or a shell environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServerConfig {

    // ---------------------------------------------------------------
    // HTTP
    // ---------------------------------------------------------------
    private final int port;

    // ---------------------------------------------------------------
    // Correlation
    // ---------------------------------------------------------------
    private final long cooldownSeconds;
    private final int alertCapacity;

    // ---------------------------------------------------------------
    // Response
    // ---------------------------------------------------------------
    private final int actionLogCapacity;
    private final int throttleLimit;
    private final int maxBlocked;
    private final boolean autoRespond;

    // ---------------------------------------------------------------
    // Notifications
    // ---------------------------------------------------------------
    private final String notifierUrl;
    private final long notifierTimeoutMs;

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------
    private final String rulesConfigPath;

    private ServerConfig(Builder b) {
        this.port = b.port;
        this.cooldownSeconds = b.cooldownSeconds;
        this.alertCapacity = b.alertCapacity;
        this.actionLogCapacity = b.actionLogCapacity;
        this.throttleLimit = b.throttleLimit;
        this.maxBlocked = b.maxBlocked;
        this.autoRespond = b.autoRespond;
        this.notifierUrl = b.notifierUrl;
        this.notifierTimeoutMs = b.notifierTimeoutMs;
        this.rulesConfigPath = b.rulesConfigPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServerConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link ServerConfig} from an explicit variable map.
     */
    static ServerConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        try {
            return new Builder()
                    .port(Integer.parseInt(env(env, "SOAR_PORT", "8004")))
                    .cooldownSeconds(Long.parseLong(env(env, "SOAR_COOLDOWN_SECONDS", "30")))
                    .alertCapacity(Integer.parseInt(env(env, "SOAR_ALERT_CAPACITY", "50")))
                    .actionLogCapacity(Integer.parseInt(env(env, "SOAR_ACTION_LOG_CAPACITY", "500")))
                    .throttleLimit(Integer.parseInt(env(env, "SOAR_THROTTLE_LIMIT", "10")))
                    .maxBlocked(Integer.parseInt(env(env, "SOAR_MAX_BLOCKED", "10000")))
                    .autoRespond(parseBoolean("SOAR_AUTO_RESPOND", env(env, "SOAR_AUTO_RESPOND", "true")))
                    .notifierUrl(env(env, "SOAR_NOTIFIER_URL", ""))
                    .notifierTimeoutMs(Long.parseLong(env(env, "SOAR_NOTIFIER_TIMEOUT_MS", "2000")))
                    .rulesConfigPath(env(env, "RULES_CONFIG_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getPort() {
        return port;
    }

    public long getCooldownSeconds() {
        return cooldownSeconds;
    }

    public int getAlertCapacity() {
        return alertCapacity;
    }

    public int getActionLogCapacity() {
        return actionLogCapacity;
    }

    public int getThrottleLimit() {
        return throttleLimit;
    }

    public int getMaxBlocked() {
        return maxBlocked;
    }

    public boolean isAutoRespond() {
        return autoRespond;
    }

    /**
     * @return base URL of the notification receiver; blank when notifications are disabled
     */
    public String getNotifierUrl() {
        return notifierUrl;
    }

    public boolean isNotifierEnabled() {
        return !notifierUrl.isBlank();
    }

    public long getNotifierTimeoutMs() {
        return notifierTimeoutMs;
    }

    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServerConfig}.
     *
     * <p>
     * {@link #build()} validates that all values are within legal ranges
     * (port in [0, 65535] where 0 picks an ephemeral port, positive
     * capacities and limits, an absolute http(s) notifier URL when one is set).
     * </p>
     */
    public static class Builder {
        private int port = 8004;
        private long cooldownSeconds = 30;
        private int alertCapacity = 50;
        private int actionLogCapacity = 500;
        private int throttleLimit = 10;
        private int maxBlocked = 10_000;
        private boolean autoRespond = true;
        private String notifierUrl = "";
        private long notifierTimeoutMs = 2_000;
        private String rulesConfigPath = "";

        public Builder port(int v) {
            this.port = v;
            return this;
        }

        public Builder cooldownSeconds(long v) {
            this.cooldownSeconds = v;
            return this;
        }

        public Builder alertCapacity(int v) {
            this.alertCapacity = v;
            return this;
        }

        public Builder actionLogCapacity(int v) {
            this.actionLogCapacity = v;
            return this;
        }

        public Builder throttleLimit(int v) {
            this.throttleLimit = v;
            return this;
        }

        public Builder maxBlocked(int v) {
            this.maxBlocked = v;
            return this;
        }

        public Builder autoRespond(boolean v) {
            this.autoRespond = v;
            return this;
        }

        public Builder notifierUrl(String v) {
            this.notifierUrl = v;
            return this;
        }

        public Builder notifierTimeoutMs(long v) {
            this.notifierTimeoutMs = v;
            return this;
        }

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServerConfig build() {
            if (port < 0 || port > 65_535) {
                throw new IllegalArgumentException("port must be in [0, 65535], got: " + port);
            }
            requirePositive(cooldownSeconds, "cooldownSeconds");
            requirePositive(alertCapacity, "alertCapacity");
            requirePositive(actionLogCapacity, "actionLogCapacity");
            requirePositive(throttleLimit, "throttleLimit");
            requirePositive(maxBlocked, "maxBlocked");
            requirePositive(notifierTimeoutMs, "notifierTimeoutMs");

            notifierUrl = notifierUrl == null ? "" : notifierUrl.trim();
            if (!notifierUrl.isEmpty()) {
                URI uri;
                try {
                    uri = URI.create(notifierUrl);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("notifierUrl is not a valid URI: " + notifierUrl, e);
                }
                if (!"http".equals(uri.getScheme()) && !"https".equals(uri.getScheme())) {
                    throw new IllegalArgumentException("notifierUrl must be an http(s) URL, got: " + notifierUrl);
                }
            }
            rulesConfigPath = rulesConfigPath == null ? "" : rulesConfigPath.trim();

            return new ServerConfig(this);
        }

        private static void requirePositive(long value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static boolean parseBoolean(String name, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalStateException(name + " must be true or false, got: " + value);
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "port=" + port +
                ", cooldownSeconds=" + cooldownSeconds +
                ", alertCapacity=" + alertCapacity +
                ", actionLogCapacity=" + actionLogCapacity +
                ", throttleLimit=" + throttleLimit +
                ", maxBlocked=" + maxBlocked +
                ", autoRespond=" + autoRespond +
                ", notifierUrl='" + notifierUrl + '\'' +
                ", notifierTimeoutMs=" + notifierTimeoutMs +
                ", rulesConfigPath='" + rulesConfigPath + '\'' +
                '}';
    }
}
