package com.soarsentinel.core.detection;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Per-source window state for the rate-based detectors.
 *
 * <p>
 * Every read-modify-write runs inside {@link ConcurrentHashMap#compute}, so
 * updates for one source are serialized while different sources proceed in
 * parallel. Idle windows are dropped by a sweep every
 * {@value #SWEEP_INTERVAL} updates.
 * </p>
 *
 * @param <W> window type
 * @since 1.0.0
 */
final class SourceWindows<W> {

    static final int SWEEP_INTERVAL = 1024;

    private final Map<String, W> windows = new ConcurrentHashMap<>();
    private final Supplier<W> factory;
    private final AtomicLong updates = new AtomicLong();

    SourceWindows(Supplier<W> factory) {
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    /**
     * Apply {@code action} to the window of {@code source}, creating it on first use.
     *
     * @return whatever {@code action} returned
     */
    <R> R update(String source, Function<W, R> action) {
        AtomicReference<R> result = new AtomicReference<>();
        windows.compute(source, (key, window) -> {
            W w = window != null ? window : factory.get();
            result.set(action.apply(w));
            return w;
        });
        return result.get();
    }

    /**
     * Drop windows matching {@code idle} once every {@value #SWEEP_INTERVAL} calls.
     */
    void maybeSweep(Predicate<W> idle) {
        if (updates.incrementAndGet() % SWEEP_INTERVAL != 0) {
            return;
        }
        for (String source : windows.keySet()) {
            windows.computeIfPresent(source, (key, window) -> idle.test(window) ? null : window);
        }
    }

    int size() {
        return windows.size();
    }
}
