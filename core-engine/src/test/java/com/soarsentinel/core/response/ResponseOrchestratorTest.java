package com.soarsentinel.core.response;

import com.soarsentinel.core.defense.DefenseSnapshot;
import com.soarsentinel.core.defense.DefenseStateStore;
import com.soarsentinel.core.defense.StateCorruptionException;
import com.soarsentinel.core.metrics.SentinelMetrics;
import com.soarsentinel.core.model.Action;
import com.soarsentinel.core.model.ActionStatus;
import com.soarsentinel.core.model.ActionType;
import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.Severity;
import com.soarsentinel.core.model.ThreatRule;
import com.soarsentinel.core.model.ValidationException;
import com.soarsentinel.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ResponseOrchestrator}.
 */
class ResponseOrchestratorTest {

    private MutableClock clock;
    private DefenseStateStore store;
    private SentinelMetrics metrics;
    private ResponseOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        store = new DefenseStateStore(100, 500);
        metrics = new SentinelMetrics();
        orchestrator = new ResponseOrchestrator(store, new SourceLocks(), clock, metrics, 10);
    }

    @ParameterizedTest
    @EnumSource(ThreatRule.class)
    @DisplayName("Every rule's playbook records exactly one action per step")
    void playbookCompleteness(ThreatRule rule) {
        Alert alert = alert(rule.id(), "198.51.100.1", "orders");

        List<Action> actions = orchestrator.respond(alert);

        assertThat(actions).extracting(Action::getActionType).containsExactlyElementsOf(rule.playbook());
        assertThat(actions).allSatisfy(a -> {
            assertThat(a.getAlertId()).isEqualTo(alert.getAlertId());
            assertThat(a.getStatus()).isEqualTo(ActionStatus.SUCCESS);
            assertThat(a.getExecutedAt()).isEqualTo(clock.instant());
        });
        assertThat(store.actionCount()).isEqualTo(rule.playbook().size());
    }

    @Test
    @DisplayName("SQL injection playbook blocks the source and isolates the service")
    void sqlInjectionPlaybook() {
        List<Action> actions = orchestrator.respond(alert("sql_injection", "203.0.113.5", "web"));

        assertThat(actions).extracting(Action::getTarget).containsExactly("203.0.113.5", "web", "203.0.113.5");
        DefenseSnapshot snapshot = store.snapshot();
        assertThat(snapshot.getBlockedIps()).containsExactly("203.0.113.5");
        assertThat(snapshot.getIsolatedServices()).containsExactly("web");
    }

    @Test
    @DisplayName("Unknown rule ids run the generic playbook")
    void unknownRuleRunsGeneric() {
        List<Action> actions = orchestrator.respond(alert("zero_day", "198.51.100.1", "web"));

        assertThat(actions).extracting(Action::getActionType).containsExactly(ActionType.ALERT_ONLY);
        assertThat(store.snapshot().getBlockedIps()).isEmpty();
    }

    @Test
    @DisplayName("Repeated playbooks skip state that is already in place")
    void repeatedPlaybookSkips() {
        orchestrator.respond(alert("brute_force", "198.51.100.1", "auth"));
        List<Action> again = orchestrator.respond(alert("brute_force", "198.51.100.1", "auth"));

        assertThat(again).extracting(Action::getStatus).containsExactly(ActionStatus.SKIPPED, ActionStatus.SKIPPED);
        assertThat(store.actionCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Responding to the same alert twice records its actions once")
    void sameAlertRunsOnce() {
        Alert alert = Alert.builder()
                .alertId("a-1")
                .title("SQL Injection Attempt")
                .severity(Severity.CRITICAL)
                .sourceId("203.0.113.5")
                .service("web")
                .createdAt(clock.instant())
                .ruleId("sql_injection")
                .build();

        List<Action> first = orchestrator.respond(alert);
        clock.advanceSeconds(5);
        List<Action> second = orchestrator.respond(alert);

        assertThat(second).isEqualTo(first);
        assertThat(store.actionCount()).isEqualTo(3);
        assertThat(orchestrator.recentActions(50)).extracting(Action::getActionType)
                .containsExactly(ActionType.ALERT_ONLY, ActionType.ISOLATE_SERVICE, ActionType.BLOCK_IP);
    }

    @Test
    @DisplayName("After a reset an alert may run its playbook again")
    void resetForgetsExecutedAlerts() {
        Alert alert = alert("port_scan", "198.51.100.30", "web");
        orchestrator.respond(alert);
        orchestrator.reset();

        List<Action> again = orchestrator.respond(alert);

        assertThat(again).singleElement()
                .satisfies(a -> assertThat(a.getStatus()).isEqualTo(ActionStatus.SUCCESS));
        assertThat(store.isBlocked("198.51.100.30")).isTrue();
    }

    @Test
    @DisplayName("Missing or unknown targets yield skipped actions")
    void missingTargetSkipped() {
        Alert alert = alert("port_scan", "unknown", null);
        assertThat(orchestrator.respond(alert)).singleElement()
                .satisfies(a -> assertThat(a.getStatus()).isEqualTo(ActionStatus.SKIPPED));

        Alert blank = alert("high_memory", "", null);
        assertThat(orchestrator.respond(blank)).singleElement()
                .satisfies(a -> assertThat(a.getStatus()).isEqualTo(ActionStatus.SKIPPED));
    }

    @Test
    @DisplayName("Targets fall back to the evidence")
    void targetsFromEvidence() {
        Alert alert = Alert.builder()
                .alertId("a-1")
                .title("x")
                .severity(Severity.CRITICAL)
                .createdAt(clock.instant())
                .ruleId("data_exfiltration")
                .evidence(Map.of("source_ip", "192.0.2.9", "service", "vault"))
                .build();

        orchestrator.respond(alert);

        assertThat(store.isBlocked("192.0.2.9")).isTrue();
        assertThat(store.isIsolated("vault")).isTrue();
    }

    @Test
    @DisplayName("A failing step is recorded as failed and the playbook continues")
    void failedStepContinues() {
        DefenseStateStore tiny = new DefenseStateStore(1, 50);
        ResponseOrchestrator constrained = new ResponseOrchestrator(tiny, new SourceLocks(), clock, metrics, 10);
        constrained.block("192.0.2.1");

        List<Action> actions = constrained.respond(alert("data_exfiltration", "192.0.2.2", "vault"));

        assertThat(actions).extracting(Action::getStatus)
                .containsExactly(ActionStatus.FAILED, ActionStatus.SUCCESS);
        assertThat(tiny.isIsolated("vault")).isTrue();
        assertThat(metrics.snapshot()).containsEntry("soar.actions{status=failed,type=block_ip}", 1.0);
    }

    @Test
    @DisplayName("Manual block then unblock restores the previous state")
    void blockRoundTrip() {
        DefenseSnapshot before = store.snapshot();

        Action block = orchestrator.block("192.0.2.50");
        Action unblock = orchestrator.unblock("192.0.2.50");

        assertThat(block.getStatus()).isEqualTo(ActionStatus.SUCCESS);
        assertThat(block.getAlertId()).isNull();
        assertThat(unblock.getActionType()).isEqualTo(ActionType.UNBLOCK_IP);
        assertThat(unblock.getStatus()).isEqualTo(ActionStatus.SUCCESS);
        assertThat(store.snapshot().getBlockedIps()).isEqualTo(before.getBlockedIps());
    }

    @Test
    @DisplayName("Isolate then restore and throttle then remove round-trip")
    void otherRoundTrips() {
        orchestrator.isolate("billing");
        orchestrator.throttle("192.0.2.60", 25);

        assertThat(orchestrator.restore("billing").getStatus()).isEqualTo(ActionStatus.SUCCESS);
        Action removed = orchestrator.removeThrottle("192.0.2.60");
        assertThat(removed.getStatus()).isEqualTo(ActionStatus.SUCCESS);
        assertThat(removed.getDetails()).containsEntry("previous_limit", 25);

        DefenseSnapshot snapshot = store.snapshot();
        assertThat(snapshot.getIsolatedServices()).isEmpty();
        assertThat(snapshot.getThrottledIps()).isEmpty();
    }

    @Test
    @DisplayName("Reversals on absent targets are skipped")
    void reversalOnAbsentTarget() {
        assertThat(orchestrator.unblock("192.0.2.70").getStatus()).isEqualTo(ActionStatus.SKIPPED);
        assertThat(orchestrator.removeThrottle("192.0.2.70").getStatus()).isEqualTo(ActionStatus.SKIPPED);
        assertThat(orchestrator.restore("nothing").getStatus()).isEqualTo(ActionStatus.SKIPPED);
    }

    @Test
    @DisplayName("Operator throttle overrides a stricter playbook limit")
    void operatorThrottleOverrides() {
        orchestrator.respond(alert("rate_spike", "192.0.2.80", "api"));

        Action loosened = orchestrator.throttle("192.0.2.80", 100);
        Action same = orchestrator.throttle("192.0.2.80", 100);

        assertThat(loosened.getStatus()).isEqualTo(ActionStatus.SUCCESS);
        assertThat(loosened.getDetails()).containsEntry("previous_limit", 10).containsEntry("limit", 100);
        assertThat(same.getStatus()).isEqualTo(ActionStatus.SKIPPED);
        assertThat(store.throttleLimit("192.0.2.80")).contains(100);
    }

    @Test
    @DisplayName("Playbook throttle leaves a stricter operator limit alone")
    void playbookKeepsStricterLimit() {
        orchestrator.throttle("192.0.2.81", 2);

        Action action = orchestrator.respond(alert("high_network", "192.0.2.81", "api")).get(0);

        assertThat(action.getStatus()).isEqualTo(ActionStatus.SKIPPED);
        assertThat(store.throttleLimit("192.0.2.81")).contains(2);
    }

    @Test
    @DisplayName("Invalid operator throttle limits are rejected")
    void invalidThrottleLimit() {
        assertThatThrownBy(() -> orchestrator.throttle("192.0.2.1", 0))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Reset clears state and history")
    void reset() {
        orchestrator.block("192.0.2.90");
        orchestrator.reset();

        assertThat(orchestrator.recentActions(50)).isEmpty();
        assertThat(store.snapshot().getBlockedIps()).isEmpty();
    }

    @Test
    @DisplayName("Recent actions come newest first")
    void recentActionsOrder() {
        orchestrator.block("1.1.1.1");
        orchestrator.isolate("svc");

        assertThat(orchestrator.recentActions(50)).extracting(Action::getActionType)
                .containsExactly(ActionType.ISOLATE_SERVICE, ActionType.BLOCK_IP);
    }

    @Test
    @DisplayName("Corruption in the store propagates to the caller")
    void corruptionPropagates() {
        assertThatThrownBy(() -> store.block(null)).isInstanceOf(StateCorruptionException.class);
    }

    private Alert alert(String ruleId, String source, String service) {
        return Alert.builder()
                .alertId(UUID.randomUUID().toString())
                .title("test")
                .severity(Severity.HIGH)
                .sourceId(source)
                .service(service)
                .createdAt(clock.instant())
                .ruleId(ruleId)
                .build();
    }
}
