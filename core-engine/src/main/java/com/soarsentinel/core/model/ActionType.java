package com.soarsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of defensive action. The first four appear in playbooks; the
 * reversal kinds are only produced by explicit operator calls.
 *
 * @since 1.0.0
 */
public enum ActionType {

    BLOCK_IP("block_ip", false),
    THROTTLE_IP("throttle_ip", false),
    ISOLATE_SERVICE("isolate_service", false),
    ALERT_ONLY("alert_only", false),
    UNBLOCK_IP("unblock_ip", true),
    REMOVE_THROTTLE("remove_throttle", true),
    RESTORE_SERVICE("restore_service", true);

    private final String id;
    private final boolean reversal;

    ActionType(String id, boolean reversal) {
        this.id = id;
        this.reversal = reversal;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public boolean isReversal() {
        return reversal;
    }

    @JsonCreator
    public static ActionType fromId(String value) {
        if (value != null) {
            String normalised = value.trim().toLowerCase(Locale.ROOT);
            for (ActionType t : values()) {
                if (t.id.equals(normalised)) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unknown action type: '" + value + "'");
    }
}
