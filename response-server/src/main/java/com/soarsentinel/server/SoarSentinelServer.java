package com.soarsentinel.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.soarsentinel.core.config.RulesConfig;
import com.soarsentinel.core.config.RulesLoader;
import com.soarsentinel.core.correlation.AlertCorrelator;
import com.soarsentinel.core.defense.DefenseStateStore;
import com.soarsentinel.core.detection.RuleEngine;
import com.soarsentinel.core.metrics.SentinelMetrics;
import com.soarsentinel.core.notify.NoopNotifier;
import com.soarsentinel.core.notify.Notifier;
import com.soarsentinel.core.pipeline.SoarPipeline;
import com.soarsentinel.core.response.ResponseOrchestrator;
import com.soarsentinel.core.response.SourceLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point for the SOAR Sentinel response server.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   HTTP (POST /analyze)
 *     → RuleEngine (every configured detector)
 *     → AlertCorrelator (cooldown suppression, bounded alert book)
 *     → ResponseOrchestrator (playbook against the defense state)
 *     → Notifier (optional outbound webhook)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link ServerConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SoarSentinelServer {

    private static final Logger LOG = LoggerFactory.getLogger(SoarSentinelServer.class);

    static final String VERSION = "1.0.0";

    private SoarSentinelServer() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServerConfig config = ServerConfig.fromEnvironment();
        LOG.info("Starting SOAR Sentinel with config: {}", config);

        // 2. Load detection rules
        RulesConfig rules = RulesLoader.load(config.getRulesConfigPath());
        if (rules.enabledRules().isEmpty()) {
            throw new IllegalStateException("No enabled detection rules. Provide rules via "
                    + RulesLoader.ENV_RULES_PATH + " or a classpath " + RulesLoader.DEFAULT_RESOURCE + " file.");
        }

        // 3. Assemble the pipeline
        ObjectMapper mapper = JsonMapper.create();
        SoarPipeline pipeline = buildPipeline(config, rules, mapper, Clock.systemUTC());

        // 4. Serve the API with a shutdown hook
        ApiServer server = new ApiServer(pipeline, mapper, VERSION);
        server.start(config.getPort());
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "api-shutdown"));
    }

    // ---------------------------------------------------------------
    // Assembly (extracted for testability)
    // ---------------------------------------------------------------

    static SoarPipeline buildPipeline(ServerConfig config, RulesConfig rules, ObjectMapper mapper, Clock clock) {
        SentinelMetrics metrics = new SentinelMetrics();
        SourceLocks locks = new SourceLocks();

        RuleEngine engine = RuleEngine.fromConfig(rules, clock, metrics);
        AlertCorrelator correlator = new AlertCorrelator(
                Duration.ofSeconds(config.getCooldownSeconds()), config.getAlertCapacity(), clock, metrics);
        DefenseStateStore store = new DefenseStateStore(config.getMaxBlocked(), config.getActionLogCapacity());
        ResponseOrchestrator orchestrator =
                new ResponseOrchestrator(store, locks, clock, metrics, config.getThrottleLimit());

        return SoarPipeline.builder()
                .engine(engine)
                .correlator(correlator)
                .orchestrator(orchestrator)
                .locks(locks)
                .notifier(notifier(config, mapper, clock))
                .metrics(metrics)
                .clock(clock)
                .autoRespond(config.isAutoRespond())
                .build();
    }

    private static Notifier notifier(ServerConfig config, ObjectMapper mapper, Clock clock) {
        if (!config.isNotifierEnabled()) {
            LOG.info("Outbound notifier disabled");
            return NoopNotifier.INSTANCE;
        }
        LOG.info("Outbound notifier posting to {}", config.getNotifierUrl());
        return new HttpNotifier(config.getNotifierUrl(), Duration.ofMillis(config.getNotifierTimeoutMs()),
                mapper, clock);
    }
}
