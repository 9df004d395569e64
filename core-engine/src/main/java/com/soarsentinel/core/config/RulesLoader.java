package com.soarsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link RulesConfig} from YAML.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_RULES_PATH} (file system path)</li>
 * <li>{@value #DEFAULT_RESOURCE} on the classpath</li>
 * </ol>
 *
 * <p>
 * Every load validates the result so a misconfigured rule stops the process
 * at startup instead of silently never firing.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RulesLoader.class);

    /** Environment variable that can override the default rules location. */
    public static final String ENV_RULES_PATH = "RULES_CONFIG_PATH";

    /** Classpath resource used when no override is given. */
    public static final String DEFAULT_RESOURCE = "rules.yml";

    private RulesLoader() {
        // utility class, not instantiable
    }

    /**
     * Load rules from {@code path} when it is non-blank, otherwise through
     * the environment / classpath resolution of {@link #load()}.
     *
     * @param path optional file system path
     * @return parsed and validated rules configuration
     */
    public static RulesConfig load(String path) {
        if (path != null && !path.isBlank()) {
            return fromFile(path);
        }
        return load();
    }

    /**
     * Load rules using automatic resolution.
     *
     * @return parsed and validated rules configuration
     * @throws IllegalStateException if rule validation fails
     */
    public static RulesConfig load() {
        String envPath = System.getenv(ENV_RULES_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading rules from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading rules from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load rules from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static RulesConfig fromFile(String path) {
        Objects.requireNonNull(path, "Rules file path must not be null");
        Path file = Path.of(path);
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Rules file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader, "file " + path);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read rules file: " + path, e);
        }
    }

    /**
     * Load rules from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static RulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RulesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            return parse(reader, "classpath resource " + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Parse rules from an in-memory YAML document.
     */
    public static RulesConfig fromString(String yaml) {
        Objects.requireNonNull(yaml, "YAML text must not be null");
        return parse(new StringReader(yaml), "inline document");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Single entry point for every source: SnakeYAML binding, then validation.
     *
     * @param origin human-readable source name for error messages
     */
    private static RulesConfig parse(Reader reader, String origin) {
        RulesConfig config;
        try {
            config = new Yaml(constructor()).load(reader);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed rules in " + origin + ": " + e.getMessage(), e);
        }
        if (config == null || config.getRules().isEmpty()) {
            LOG.warn("No detection rules defined in {}", origin);
            return new RulesConfig();
        }
        config.validate();
        LOG.info("Loaded {} detection rule(s) from {}, {} enabled",
                config.getRules().size(), origin, config.enabledRules().size());
        return config;
    }

    private static Constructor constructor() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Constructor(RulesConfig.class, options);
    }
}
