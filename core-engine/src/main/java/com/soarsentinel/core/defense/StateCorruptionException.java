package com.soarsentinel.core.defense;

/**
 * The defense state store found a state that cannot legally exist, such as
 * a non-positive throttle limit or a blank key. Aborts the current operation.
 *
 * @since 1.0.0
 */
public class StateCorruptionException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public StateCorruptionException(String message) {
        super(message);
    }
}
