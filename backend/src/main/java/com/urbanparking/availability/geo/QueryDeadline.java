package com.urbanparking.availability.geo;

import java.time.Duration;

/**
 * Point in time after which a read-only query stops scanning and reports what it has.
 */
public final class QueryDeadline {

    private static final QueryDeadline NONE = new QueryDeadline(0L, true);

    private final long deadlineNanos;
    private final boolean unbounded;

    private QueryDeadline(long deadlineNanos, boolean unbounded) {
        this.deadlineNanos = deadlineNanos;
        this.unbounded = unbounded;
    }

    public static QueryDeadline none() {
        return NONE;
    }

    public static QueryDeadline after(Duration timeout) {
        if (timeout == null) {
            return NONE;
        }
        return new QueryDeadline(System.nanoTime() + timeout.toNanos(), false);
    }

    public boolean isExpired() {
        return !unbounded && System.nanoTime() - deadlineNanos >= 0;
    }
}
