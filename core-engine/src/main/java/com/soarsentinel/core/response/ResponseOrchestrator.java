package com.soarsentinel.core.response;

import com.soarsentinel.core.defense.DefenseStateException;
import com.soarsentinel.core.defense.DefenseStateStore;
import com.soarsentinel.core.defense.ThrottleChange;
import com.soarsentinel.core.metrics.SentinelMetrics;
import com.soarsentinel.core.model.Action;
import com.soarsentinel.core.model.ActionStatus;
import com.soarsentinel.core.model.ActionType;
import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.TelemetryEvent;
import com.soarsentinel.core.model.ThreatRule;
import com.soarsentinel.core.model.ValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Executes the playbook bound to an alert's rule against the
 * {@link DefenseStateStore}, and exposes the operator entry points that block,
 * throttle or isolate by hand and reverse those measures.
 *
 * <h3>Action semantics</h3>
 * <ul>
 *   <li>{@code block_ip}: inserts, or skips when already blocked.</li>
 *   <li>{@code throttle_ip}: sets the configured limit, or skips when an equal or
 *       stricter limit is in place. Operator throttles replace any different limit.</li>
 *   <li>{@code isolate_service}: inserts, or skips when already isolated.</li>
 *   <li>{@code alert_only}: always succeeds.</li>
 * </ul>
 * <p>
 * A blank or {@code unknown} target yields a skipped action. A
 * {@link DefenseStateException} yields a failed action and the playbook moves on
 * to its next step. Every attempt is recorded exactly once in the action log.
 * </p>
 * <p>
 * A playbook runs once per alert id: responding again to an alert that already
 * ran returns the actions recorded the first time and writes nothing new. The
 * last {@value #EXECUTED_ALERT_CAPACITY} alert ids are remembered.
 * </p>
 *
 * @since 1.0.0
 */
public class ResponseOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseOrchestrator.class);

    public static final int DEFAULT_THROTTLE_LIMIT = 10;
    static final int EXECUTED_ALERT_CAPACITY = 1_000;

    private final DefenseStateStore store;
    private final SourceLocks locks;
    private final Clock clock;
    private final SentinelMetrics metrics;
    private final int throttleLimit;
    private final Map<String, List<Action>> executedAlerts = Collections.synchronizedMap(
            new LinkedHashMap<String, List<Action>>() {
                private static final long serialVersionUID = 1L;

                @Override
                protected boolean removeEldestEntry(Map.Entry<String, List<Action>> eldest) {
                    return size() > EXECUTED_ALERT_CAPACITY;
                }
            });

    public ResponseOrchestrator(DefenseStateStore store, SourceLocks locks, Clock clock,
                                SentinelMetrics metrics, int throttleLimit) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        if (throttleLimit <= 0) {
            throw new IllegalArgumentException("throttleLimit must be > 0, got: " + throttleLimit);
        }
        this.throttleLimit = throttleLimit;
    }

    // ---------------------------------------------------------------
    // Playbooks
    // ---------------------------------------------------------------

    /**
     * Run the playbook of the alert's rule. Unknown rule ids run the generic playbook.
     *
     * @param alert validated alert
     * @return one action per playbook step, in playbook order; for an alert id
     *         that already ran, the actions recorded by that run
     */
    public List<Action> respond(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        ThreatRule rule = ThreatRule.resolve(alert.getRuleId());
        String sourceId = alert.effectiveSourceId();

        ReentrantLock lock = locks.forSource(sourceId);
        lock.lock();
        try {
            List<Action> previous = executedAlerts.get(alert.getAlertId());
            if (previous != null) {
                LOG.debug("Playbook for alert {} already executed, returning {} recorded action(s)",
                        alert.getAlertId(), previous.size());
                return previous;
            }
            List<Action> actions = new ArrayList<>(rule.playbook().size());
            for (ActionType step : rule.playbook()) {
                actions.add(execute(step, alert));
            }
            List<Action> recorded = List.copyOf(actions);
            executedAlerts.put(alert.getAlertId(), recorded);
            LOG.info("Playbook '{}' executed for alert {}: {} action(s)",
                    rule.id(), alert.getAlertId(), recorded.size());
            return recorded;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the playbook that {@link #respond(Alert)} would run for {@code ruleId}
     */
    public List<ActionType> playbookFor(String ruleId) {
        return ThreatRule.resolve(ruleId).playbook();
    }

    private Action execute(ActionType step, Alert alert) {
        String alertId = alert.getAlertId();
        return switch (step) {
            case BLOCK_IP -> block(alert.effectiveSourceId(), alertId);
            case THROTTLE_IP -> throttle(alert.effectiveSourceId(), throttleLimit, false, alertId);
            case ISOLATE_SERVICE -> isolate(alert.effectiveService(), alertId);
            case ALERT_ONLY -> notifyOnly(alert);
            default -> throw new IllegalStateException("Reversal action '" + step.id() + "' in playbook");
        };
    }

    private Action notifyOnly(Alert alert) {
        String target = hasTarget(alert.effectiveSourceId()) ? alert.effectiveSourceId() : alert.getAlertId();
        return record(base(ActionType.ALERT_ONLY, target, alert.getAlertId())
                .status(ActionStatus.SUCCESS)
                .message("Security team notified: " + alert.getTitle())
                .detail("severity", alert.getSeverity().id()));
    }

    // ---------------------------------------------------------------
    // Operator entry points
    // ---------------------------------------------------------------

    public Action block(String ip) {
        return withSourceLock(ip, () -> block(ip, null));
    }

    public Action unblock(String ip) {
        return withSourceLock(ip, () -> {
            if (!hasTarget(ip)) {
                return skipped(ActionType.UNBLOCK_IP, ip, "No source IP to unblock", null);
            }
            boolean removed = store.unblock(ip);
            return record(base(ActionType.UNBLOCK_IP, ip, null)
                    .status(removed ? ActionStatus.SUCCESS : ActionStatus.SKIPPED)
                    .message(removed ? "Unblocked IP " + ip : "IP " + ip + " was not blocked"));
        });
    }

    /**
     * Operator throttle: replaces any different limit, skips only on an equal one.
     */
    public Action throttle(String ip, int limit) {
        if (limit <= 0) {
            throw new ValidationException("limit", "limit must be > 0, got: " + limit);
        }
        return withSourceLock(ip, () -> throttle(ip, limit, true, null));
    }

    public Action removeThrottle(String ip) {
        return withSourceLock(ip, () -> {
            if (!hasTarget(ip)) {
                return skipped(ActionType.REMOVE_THROTTLE, ip, "No source IP to unthrottle", null);
            }
            Optional<Integer> removed = store.removeThrottle(ip);
            Action.Builder builder = base(ActionType.REMOVE_THROTTLE, ip, null);
            if (removed.isPresent()) {
                builder.status(ActionStatus.SUCCESS)
                        .message("Removed throttle on IP " + ip)
                        .detail("previous_limit", removed.get());
            } else {
                builder.status(ActionStatus.SKIPPED).message("IP " + ip + " was not throttled");
            }
            return record(builder);
        });
    }

    public Action isolate(String service) {
        return isolate(service, null);
    }

    public Action restore(String service) {
        if (!hasTarget(service)) {
            return skipped(ActionType.RESTORE_SERVICE, service, "No service to restore", null);
        }
        boolean removed = store.restore(service);
        return record(base(ActionType.RESTORE_SERVICE, service, null)
                .status(removed ? ActionStatus.SUCCESS : ActionStatus.SKIPPED)
                .message(removed ? "Restored service " + service : "Service " + service + " was not isolated"));
    }

    /**
     * Clear blocked, throttled and isolated state together with the action log.
     * Alerts that already ran may run their playbook again afterwards.
     */
    public void reset() {
        store.reset();
        executedAlerts.clear();
    }

    public List<Action> recentActions(int limit) {
        return store.recentActions(limit);
    }

    public DefenseStateStore getStore() {
        return store;
    }

    public int getThrottleLimit() {
        return throttleLimit;
    }

    // ---------------------------------------------------------------
    // Action implementations
    // ---------------------------------------------------------------

    private Action block(String ip, String alertId) {
        if (!hasTarget(ip)) {
            return skipped(ActionType.BLOCK_IP, ip, "No source IP to block", alertId);
        }
        try {
            boolean added = store.block(ip);
            return record(base(ActionType.BLOCK_IP, ip, alertId)
                    .status(added ? ActionStatus.SUCCESS : ActionStatus.SKIPPED)
                    .message(added ? "Blocked IP " + ip : "IP " + ip + " already blocked"));
        } catch (DefenseStateException e) {
            return failed(ActionType.BLOCK_IP, ip, e, alertId);
        }
    }

    private Action throttle(String ip, int limit, boolean override, String alertId) {
        if (!hasTarget(ip)) {
            return skipped(ActionType.THROTTLE_IP, ip, "No source IP to throttle", alertId);
        }
        try {
            ThrottleChange change = store.throttle(ip, limit, override);
            Action.Builder builder = base(ActionType.THROTTLE_IP, ip, alertId)
                    .detail("limit", change.getCurrentLimit());
            if (change.getPreviousLimit() != null) {
                builder.detail("previous_limit", change.getPreviousLimit());
            }
            if (change.isApplied()) {
                builder.status(ActionStatus.SUCCESS)
                        .message("Throttled IP " + ip + " to " + limit + " req/min");
            } else {
                builder.status(ActionStatus.SKIPPED)
                        .message("IP " + ip + " already throttled to " + change.getCurrentLimit() + " req/min");
            }
            return record(builder);
        } catch (DefenseStateException e) {
            return failed(ActionType.THROTTLE_IP, ip, e, alertId);
        }
    }

    private Action isolate(String service, String alertId) {
        if (!hasTarget(service)) {
            return skipped(ActionType.ISOLATE_SERVICE, service, "No service to isolate", alertId);
        }
        try {
            boolean added = store.isolate(service);
            return record(base(ActionType.ISOLATE_SERVICE, service, alertId)
                    .status(added ? ActionStatus.SUCCESS : ActionStatus.SKIPPED)
                    .message(added ? "Isolated service " + service : "Service " + service + " already isolated"));
        } catch (DefenseStateException e) {
            return failed(ActionType.ISOLATE_SERVICE, service, e, alertId);
        }
    }

    // ---------------------------------------------------------------
    // Internal helpers
    // ---------------------------------------------------------------

    private Action withSourceLock(String ip, Supplier<Action> work) {
        ReentrantLock lock = locks.forSource(ip);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private static boolean hasTarget(String target) {
        return target != null && !target.isBlank() && !TelemetryEvent.UNKNOWN.equalsIgnoreCase(target.trim());
    }

    private Action.Builder base(ActionType type, String target, String alertId) {
        return Action.builder()
                .actionType(type)
                .target(target)
                .alertId(alertId)
                .executedAt(clock.instant());
    }

    private Action skipped(ActionType type, String target, String message, String alertId) {
        return record(base(type, target, alertId).status(ActionStatus.SKIPPED).message(message));
    }

    private Action failed(ActionType type, String target, DefenseStateException e, String alertId) {
        return record(base(type, target, alertId).status(ActionStatus.FAILED).message(e.getMessage()));
    }

    private Action record(Action.Builder builder) {
        Action action = builder.build();
        store.record(action);
        metrics.recordAction(action.getActionType(), action.getStatus());
        if (action.getStatus() == ActionStatus.FAILED) {
            LOG.warn("Action {} on '{}' failed: {}", action.getActionType().id(), action.getTarget(),
                    action.getMessage());
        } else {
            LOG.info("Action {} on '{}': {} ({})", action.getActionType().id(), action.getTarget(),
                    action.getStatus().id(), action.getMessage());
        }
        return action;
    }
}
