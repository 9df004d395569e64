package com.soarsentinel.core.pipeline;

import com.soarsentinel.core.config.RulesLoader;
import com.soarsentinel.core.correlation.AlertCorrelator;
import com.soarsentinel.core.correlation.AlertFilter;
import com.soarsentinel.core.correlation.Correlation;
import com.soarsentinel.core.defense.DefenseStateStore;
import com.soarsentinel.core.detection.RuleEngine;
import com.soarsentinel.core.metrics.SentinelMetrics;
import com.soarsentinel.core.model.Action;
import com.soarsentinel.core.model.ActionType;
import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.Anomaly;
import com.soarsentinel.core.model.Severity;
import com.soarsentinel.core.model.TelemetryEvent;
import com.soarsentinel.core.model.ValidationException;
import com.soarsentinel.core.notify.NoopNotifier;
import com.soarsentinel.core.notify.Notifier;
import com.soarsentinel.core.response.ResponseOrchestrator;
import com.soarsentinel.core.response.SourceLocks;
import com.soarsentinel.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link SoarPipeline} with the shipped rules.
 */
class SoarPipelineTest {

    private MutableClock clock;
    private DefenseStateStore store;
    private RecordingNotifier notifier;
    private SoarPipeline pipeline;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        store = new DefenseStateStore();
        notifier = new RecordingNotifier();
        pipeline = pipeline(true);
    }

    @Test
    @DisplayName("SQL injection event blocks the source and isolates the service")
    void sqlInjectionEndToEnd() {
        PipelineResult result = pipeline.process(TelemetryEvent.builder()
                .sourceId("203.0.113.5")
                .service("web")
                .payload("query", "SELECT * FROM users WHERE id=1 OR 1=1")
                .build());

        assertThat(result.getAnomaliesDetected()).isEqualTo(1);
        assertThat(result.getAlertsCreated()).isEqualTo(1);
        assertThat(result.getActions()).extracting(Action::getActionType)
                .containsExactly(ActionType.BLOCK_IP, ActionType.ISOLATE_SERVICE, ActionType.ALERT_ONLY);
        assertThat(store.isBlocked("203.0.113.5")).isTrue();
        assertThat(store.isIsolated("web")).isTrue();
        assertThat(notifier.alerts).hasSize(1);
        assertThat(notifier.actionBatches).hasSize(1);
    }

    @Test
    @DisplayName("Repeated attacks inside the cooldown produce one alert")
    void cooldownSuppressesRepeats() {
        TelemetryEvent attack = TelemetryEvent.builder()
                .sourceId("203.0.113.5")
                .payload("query", "1 UNION SELECT password FROM users")
                .build();

        pipeline.process(attack);
        clock.advanceSeconds(5);
        PipelineResult second = pipeline.process(TelemetryEvent.builder()
                .sourceId("203.0.113.5")
                .payload("query", "1 UNION SELECT password FROM users")
                .build());

        assertThat(second.getAnomaliesDetected()).isEqualTo(1);
        assertThat(second.getAlertsCreated()).isZero();
        assertThat(second.getActionsExecuted()).isZero();
        assertThat(pipeline.getCorrelator().stats().getTotal()).isEqualTo(1);
    }

    @Test
    @DisplayName("A flood of 150 requests yields one rate spike alert and one throttle")
    void floodThrottledOnce() {
        int alerts = 0;
        for (int i = 0; i < 150; i++) {
            alerts += pipeline.process(TelemetryEvent.builder().sourceId("198.51.100.3").build()).getAlertsCreated();
            clock.advanceMillis(300);
        }

        assertThat(alerts).isEqualTo(1);
        assertThat(store.throttleLimit("198.51.100.3")).contains(10);
    }

    @Test
    @DisplayName("A client-supplied receive time cannot stall the rate window")
    void clientReceiveTimeIsReplaced() {
        String source = "198.51.100.4";
        pipeline.process(TelemetryEvent.builder()
                .sourceId(source)
                .receivedAt(clock.instant().plusSeconds(3_600))
                .build());

        assertThat(floodDetected(source, 101)).isTrue();
        clock.advanceSeconds(600);
        assertThat(floodDetected(source, 101)).isTrue();
    }

    @Test
    @DisplayName("Concurrent events for one source log actions in alert correlation order")
    void perSourceActionOrderUnderConcurrency() throws Exception {
        SoarPipeline concurrent = pipeline(true, NoopNotifier.INSTANCE);
        List<String> sources = List.of("198.51.100.10", "198.51.100.11", "198.51.100.12", "198.51.100.13");
        List<Map<String, Object>> payloads = List.of(
                Map.<String, Object>of("query", "1 UNION SELECT password FROM users"),
                Map.<String, Object>of("cpu", 99),
                Map.<String, Object>of("memory", 97),
                Map.<String, Object>of("network", 1_500),
                Map.<String, Object>of("bytes_out", 60_000_000),
                Map.<String, Object>of("requires_auth", true));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<PipelineResult>> futures = new ArrayList<>();
        try {
            for (String source : sources) {
                for (Map<String, Object> payload : payloads) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return concurrent.process(TelemetryEvent.builder()
                                .sourceId(source)
                                .service("svc-" + source)
                                .payload(payload)
                                .build());
                    }));
                }
            }
            start.countDown();
            for (Future<PipelineResult> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // Alert book lists newest first; reverse to correlation order
        List<Alert> correlated = new ArrayList<>(concurrent.getCorrelator().list(AlertFilter.ALL));
        Collections.reverse(correlated);
        Map<String, String> sourceByAlert = new HashMap<>();
        Map<String, List<String>> alertOrder = new LinkedHashMap<>();
        for (Alert alert : correlated) {
            sourceByAlert.put(alert.getAlertId(), alert.getSourceId());
            alertOrder.computeIfAbsent(alert.getSourceId(), k -> new ArrayList<>()).add(alert.getAlertId());
        }
        assertThat(correlated).hasSize(sources.size() * payloads.size());

        List<Action> logged = new ArrayList<>(store.recentActions(500));
        Collections.reverse(logged);
        Map<String, List<String>> actionOrder = new HashMap<>();
        for (Action action : logged) {
            List<String> seen = actionOrder.computeIfAbsent(sourceByAlert.get(action.getAlertId()),
                    k -> new ArrayList<>());
            if (seen.isEmpty() || !seen.get(seen.size() - 1).equals(action.getAlertId())) {
                seen.add(action.getAlertId());
            }
        }

        for (String source : sources) {
            assertThat(actionOrder.get(source))
                    .as("action order for %s", source)
                    .containsExactlyElementsOf(alertOrder.get(source));
        }
    }

    @Test
    @DisplayName("Without auto-response only anomalies are reported")
    void detectionOnly() {
        SoarPipeline passive = pipeline(false);

        PipelineResult result = passive.process(TelemetryEvent.builder()
                .sourceId("10.0.0.1")
                .payload("cpu", 99)
                .build());

        assertThat(result.getAnomaliesDetected()).isEqualTo(1);
        assertThat(result.getAlertsCreated()).isZero();
        assertThat(store.actionCount()).isZero();
    }

    @Test
    @DisplayName("Invalid events are rejected before detection")
    void rejectsInvalidEvent() {
        assertThatThrownBy(() -> pipeline.process(TelemetryEvent.builder().build()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Externally created anomalies become alerts and respect the cooldown")
    void createAlert() {
        Anomaly anomaly = new Anomaly();
        anomaly.setRuleId("ddos");
        anomaly.setSeverity(Severity.CRITICAL);
        anomaly.setConfidence(0.97);
        anomaly.setSourceId("192.0.2.200");

        Correlation first = pipeline.createAlert(anomaly);
        Correlation second = pipeline.createAlert(anomaly);

        assertThat(first.getAlert().orElseThrow().getTitle()).isEqualTo("DDoS Attack Detected");
        assertThat(second.isSuppressed()).isTrue();
        assertThat(store.actionCount()).isZero();
    }

    @Test
    @DisplayName("Executing a posted alert runs its playbook")
    void executeAlert() {
        Alert alert = new Alert();
        alert.setAlertId("ext-1");
        alert.setTitle("Malware");
        alert.setSeverity(Severity.CRITICAL);
        alert.setRuleId("malware");
        alert.setService("fileserver");

        List<Action> actions = pipeline.execute(alert);

        assertThat(actions).extracting(Action::getActionType)
                .containsExactly(ActionType.ISOLATE_SERVICE, ActionType.ALERT_ONLY);
        assertThat(alert.getCreatedAt()).isEqualTo(clock.instant());
        assertThat(store.isIsolated("fileserver")).isTrue();
    }

    @Test
    @DisplayName("Executing an alert without required fields fails validation")
    void executeRejectsInvalidAlert() {
        assertThatThrownBy(() -> pipeline.execute(new Alert()))
                .isInstanceOf(ValidationException.class);
    }

    private boolean floodDetected(String source, int events) {
        boolean detected = false;
        for (int i = 0; i < events; i++) {
            PipelineResult result = pipeline.process(TelemetryEvent.builder().sourceId(source).build());
            detected |= result.getAnomalies().stream().anyMatch(a -> "rate_spike".equals(a.getRuleId()));
        }
        return detected;
    }

    private SoarPipeline pipeline(boolean autoRespond) {
        return pipeline(autoRespond, notifier);
    }

    private SoarPipeline pipeline(boolean autoRespond, Notifier notifier) {
        SentinelMetrics metrics = new SentinelMetrics();
        SourceLocks locks = new SourceLocks();
        return SoarPipeline.builder()
                .engine(RuleEngine.fromConfig(RulesLoader.fromClasspath(RulesLoader.DEFAULT_RESOURCE), clock, metrics))
                .correlator(new AlertCorrelator(Duration.ofSeconds(30), 50, clock, metrics))
                .orchestrator(new ResponseOrchestrator(store, locks, clock, metrics, 10))
                .locks(locks)
                .notifier(notifier)
                .metrics(metrics)
                .clock(clock)
                .autoRespond(autoRespond)
                .build();
    }

    private static final class RecordingNotifier implements Notifier {
        private final List<Alert> alerts = new ArrayList<>();
        private final List<List<Action>> actionBatches = new ArrayList<>();

        @Override
        public void alertRaised(Alert alert) {
            alerts.add(alert);
        }

        @Override
        public void actionsExecuted(Alert alert, List<Action> actions) {
            actionBatches.add(actions);
        }
    }
}
