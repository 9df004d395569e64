package com.soarsentinel.core.correlation;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TTL cache of suppression entries: key to the instant it last fired.
 *
 * <p>
 * {@link #tryAcquire(String, Instant)} is atomic per key: of two concurrent
 * callers inside one cooldown window exactly one wins. Expired entries are
 * evicted lazily when touched and by a sweep every {@value #SWEEP_INTERVAL}
 * acquisitions.
 * </p>
 *
 * @since 1.0.0
 */
public class CooldownCache {

    static final int SWEEP_INTERVAL = 256;

    private final Duration cooldown;
    private final Map<String, Instant> lastFired = new ConcurrentHashMap<>();
    private final AtomicLong operations = new AtomicLong();

    /**
     * @param cooldown minimum interval between two firings of one key; must be positive
     */
    public CooldownCache(Duration cooldown) {
        Objects.requireNonNull(cooldown, "cooldown must not be null");
        if (cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("cooldown must be > 0, got: " + cooldown);
        }
        this.cooldown = cooldown;
    }

    /**
     * Record a firing for {@code key} unless one happened less than the
     * cooldown ago.
     *
     * @param key suppression key
     * @param now current instant
     * @return {@code true} if the caller may fire (entry refreshed to {@code now}),
     *         {@code false} if the key is still cooling down
     */
    public boolean tryAcquire(String key, Instant now) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(now, "now must not be null");

        boolean[] acquired = new boolean[1];
        lastFired.compute(key, (k, last) -> {
            if (last != null && isCoolingDown(last, now)) {
                return last;
            }
            acquired[0] = true;
            return now;
        });

        if (operations.incrementAndGet() % SWEEP_INTERVAL == 0) {
            evictExpired(now);
        }
        return acquired[0];
    }

    /**
     * @return time left before {@code key} may fire again; {@link Duration#ZERO} if it may fire now
     */
    public Duration remaining(String key, Instant now) {
        Instant last = lastFired.get(key);
        if (last == null || !isCoolingDown(last, now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, last.plus(cooldown));
    }

    /**
     * Remove every entry whose cooldown has elapsed.
     *
     * @return number of entries removed
     */
    public int evictExpired(Instant now) {
        int before = lastFired.size();
        lastFired.entrySet().removeIf(e -> !isCoolingDown(e.getValue(), now));
        return Math.max(0, before - lastFired.size());
    }

    public void clear() {
        lastFired.clear();
    }

    public int size() {
        return lastFired.size();
    }

    public Duration getCooldown() {
        return cooldown;
    }

    private boolean isCoolingDown(Instant last, Instant now) {
        return Duration.between(last, now).compareTo(cooldown) < 0;
    }
}
