package com.soarsentinel.core.notify;

import com.soarsentinel.core.model.Action;
import com.soarsentinel.core.model.Alert;

import java.util.List;

/**
 * Outbound hook for alerts and executed actions, e.g. a dashboard.
 *
 * <p>
 * Implementations must not block the caller for long and must never throw:
 * a delivery failure is logged and dropped.
 * </p>
 *
 * @since 1.0.0
 */
public interface Notifier {

    /**
     * Called once for every alert created by correlation.
     */
    void alertRaised(Alert alert);

    /**
     * Called after a playbook ran for {@code alert}.
     */
    void actionsExecuted(Alert alert, List<Action> actions);
}
