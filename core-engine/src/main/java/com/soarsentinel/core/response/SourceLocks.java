package com.soarsentinel.core.response;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of striped locks keyed by source id. Work for one source is
 * serialized; different sources usually map to different stripes.
 *
 * @since 1.0.0
 */
public class SourceLocks {

    public static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public SourceLocks() {
        this(DEFAULT_STRIPES);
    }

    public SourceLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be > 0, got: " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * @return the lock guarding {@code sourceId}; {@code null} maps to a fixed stripe
     */
    public ReentrantLock forSource(String sourceId) {
        int hash = sourceId == null ? 0 : sourceId.hashCode();
        return stripes[Math.floorMod(hash ^ (hash >>> 16), stripes.length)];
    }
}
