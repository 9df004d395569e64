package com.soarsentinel.core.notify;

import com.soarsentinel.core.model.Action;
import com.soarsentinel.core.model.Alert;

import java.util.List;

/**
 * Notifier used when no outbound endpoint is configured.
 *
 * @since 1.0.0
 */
public final class NoopNotifier implements Notifier {

    public static final NoopNotifier INSTANCE = new NoopNotifier();

    private NoopNotifier() {
    }

    @Override
    public void alertRaised(Alert alert) {
    }

    @Override
    public void actionsExecuted(Alert alert, List<Action> actions) {
    }
}
