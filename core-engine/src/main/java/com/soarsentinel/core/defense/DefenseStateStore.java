package com.soarsentinel.core.defense;

import com.soarsentinel.core.model.Action;
import com.soarsentinel.core.model.ValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owner of all defensive state: blocked sources, throttled sources with their
 * limit, isolated services and the bounded action log.
 *
 * <h3>Concurrency</h3>
 * <p>
 * Every mutation is atomic per key and runs under the shared side of a
 * read/write lock, so mutations on different keys proceed in parallel.
 * {@link #reset()} and {@link #snapshot()} take the exclusive side: no reader
 * ever sees a partially cleared store.
 * </p>
 *
 * <h3>Failure modes</h3>
 * <ul>
 *   <li>{@link DefenseStateException} when a mutation cannot be applied (blocked capacity reached).</li>
 *   <li>{@link StateCorruptionException} when a blank key reaches the store or a stored
 *       throttle limit is not positive.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class DefenseStateStore {

    private static final Logger LOG = LoggerFactory.getLogger(DefenseStateStore.class);

    public static final int DEFAULT_MAX_BLOCKED = 10_000;
    public static final int DEFAULT_ACTION_LOG_CAPACITY = 500;

    private final int maxBlocked;
    private final int actionLogCapacity;

    private final Set<String> blocked = ConcurrentHashMap.newKeySet();
    private final AtomicInteger blockedCount = new AtomicInteger();
    private final Map<String, Integer> throttled = new ConcurrentHashMap<>();
    private final Set<String> isolated = ConcurrentHashMap.newKeySet();
    private final Deque<Action> actionLog = new ArrayDeque<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public DefenseStateStore() {
        this(DEFAULT_MAX_BLOCKED, DEFAULT_ACTION_LOG_CAPACITY);
    }

    public DefenseStateStore(int maxBlocked, int actionLogCapacity) {
        if (maxBlocked <= 0) {
            throw new IllegalArgumentException("maxBlocked must be > 0, got: " + maxBlocked);
        }
        if (actionLogCapacity <= 0) {
            throw new IllegalArgumentException("actionLogCapacity must be > 0, got: " + actionLogCapacity);
        }
        this.maxBlocked = maxBlocked;
        this.actionLogCapacity = actionLogCapacity;
    }

    // ---------------------------------------------------------------
    // Blocked sources
    // ---------------------------------------------------------------

    /**
     * Block a source.
     *
     * @return {@code true} if the source was newly blocked, {@code false} if already blocked
     * @throws DefenseStateException if the blocked set is at capacity
     */
    public boolean block(String ip) {
        String key = requireKey(ip, "ip");
        lock.readLock().lock();
        try {
            if (blocked.contains(key)) {
                return false;
            }
            if (blockedCount.incrementAndGet() > maxBlocked) {
                blockedCount.decrementAndGet();
                throw new DefenseStateException("Blocked source capacity of " + maxBlocked + " reached");
            }
            if (!blocked.add(key)) {
                blockedCount.decrementAndGet();
                return false;
            }
            return true;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return {@code true} if the source was blocked before the call
     */
    public boolean unblock(String ip) {
        String key = requireKey(ip, "ip");
        lock.readLock().lock();
        try {
            if (blocked.remove(key)) {
                blockedCount.decrementAndGet();
                return true;
            }
            return false;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isBlocked(String ip) {
        return ip != null && blocked.contains(ip.trim());
    }

    // ---------------------------------------------------------------
    // Throttled sources
    // ---------------------------------------------------------------

    /**
     * Upsert a throttle limit for a source.
     *
     * <p>
     * With {@code override} unset (playbook use) an existing limit that is equal
     * or stricter is left alone. With {@code override} set (operator use) any
     * different limit is replaced.
     * </p>
     *
     * @param ip     source to throttle
     * @param limit  requests per minute; must be positive
     * @param override replace looser and stricter limits alike
     * @return what changed
     */
    public ThrottleChange throttle(String ip, int limit, boolean override) {
        String key = requireKey(ip, "ip");
        if (limit <= 0) {
            throw new ValidationException("limit", "throttle limit must be > 0, got: " + limit);
        }
        lock.readLock().lock();
        try {
            Integer[] previous = new Integer[1];
            boolean[] applied = new boolean[1];
            int current = throttled.compute(key, (k, existing) -> {
                if (existing != null && existing <= 0) {
                    throw corruption("Throttle limit for '" + k + "' is " + existing);
                }
                previous[0] = existing;
                if (existing == null || (override ? existing != limit : existing > limit)) {
                    applied[0] = true;
                    return limit;
                }
                return existing;
            });
            return new ThrottleChange(previous[0], current, applied[0]);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the limit that was removed, or empty if the source was not throttled
     */
    public Optional<Integer> removeThrottle(String ip) {
        String key = requireKey(ip, "ip");
        lock.readLock().lock();
        try {
            return Optional.ofNullable(throttled.remove(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Integer> throttleLimit(String ip) {
        return ip == null ? Optional.empty() : Optional.ofNullable(throttled.get(ip.trim()));
    }

    // ---------------------------------------------------------------
    // Isolated services
    // ---------------------------------------------------------------

    /**
     * @return {@code true} if the service was newly isolated
     */
    public boolean isolate(String service) {
        String key = requireKey(service, "service");
        lock.readLock().lock();
        try {
            return isolated.add(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return {@code true} if the service was isolated before the call
     */
    public boolean restore(String service) {
        String key = requireKey(service, "service");
        lock.readLock().lock();
        try {
            return isolated.remove(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isIsolated(String service) {
        return service != null && isolated.contains(service.trim());
    }

    // ---------------------------------------------------------------
    // Action log
    // ---------------------------------------------------------------

    /**
     * Append an action to the log, dropping the oldest entry beyond capacity.
     */
    public void record(Action action) {
        Objects.requireNonNull(action, "action must not be null");
        lock.readLock().lock();
        try {
            synchronized (actionLog) {
                actionLog.addLast(action);
                while (actionLog.size() > actionLogCapacity) {
                    actionLog.removeFirst();
                }
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param limit maximum number of entries; must be positive
     * @return most recent actions, newest first
     */
    public List<Action> recentActions(int limit) {
        if (limit <= 0) {
            throw new ValidationException("limit", "limit must be > 0, got: " + limit);
        }
        List<Action> result = new ArrayList<>(Math.min(limit, actionLogCapacity));
        synchronized (actionLog) {
            Iterator<Action> it = actionLog.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
        }
        return result;
    }

    public int actionCount() {
        synchronized (actionLog) {
            return actionLog.size();
        }
    }

    // ---------------------------------------------------------------
    // Whole-store operations
    // ---------------------------------------------------------------

    /**
     * Clear all state and the action log atomically.
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            blocked.clear();
            blockedCount.set(0);
            throttled.clear();
            isolated.clear();
            synchronized (actionLog) {
                actionLog.clear();
            }
            LOG.info("Defense state reset");
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return consistent copy of the current state
     * @throws StateCorruptionException if a stored throttle limit is not positive
     */
    public DefenseSnapshot snapshot() {
        lock.writeLock().lock();
        try {
            Map<String, Integer> throttleCopy = new TreeMap<>(throttled);
            throttleCopy.forEach((ip, limit) -> {
                if (limit == null || limit <= 0) {
                    throw corruption("Throttle limit for '" + ip + "' is " + limit);
                }
            });
            List<String> blockedCopy = new ArrayList<>(blocked);
            blockedCopy.sort(null);
            List<String> isolatedCopy = new ArrayList<>(isolated);
            isolatedCopy.sort(null);
            return new DefenseSnapshot(blockedCopy, throttleCopy, isolatedCopy, actionCount());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getMaxBlocked() {
        return maxBlocked;
    }

    public int getActionLogCapacity() {
        return actionLogCapacity;
    }

    // ---------------------------------------------------------------
    // Internal helpers
    // ---------------------------------------------------------------

    private static String requireKey(String key, String what) {
        if (key == null || key.isBlank()) {
            throw corruption("Blank " + what + " reached the defense state store");
        }
        return key.trim();
    }

    private static StateCorruptionException corruption(String message) {
        LOG.error("State corruption: {}", message);
        return new StateCorruptionException(message);
    }
}
