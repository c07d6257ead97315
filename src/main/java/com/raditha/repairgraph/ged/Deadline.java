package com.raditha.repairgraph.ged;

import java.time.Duration;

/**
 * A wall-clock budget. Checking it is a plain time comparison; nothing ever waits on it.
 * An interrupted thread counts as out of time, so a cancelled computation winds down promptly.
 */
final class Deadline {

    private static final Deadline NEVER = new Deadline(0, true, false);

    private final long deadlineNanos;
    private final boolean unbounded;
    private final boolean interruptible;

    private Deadline(long deadlineNanos, boolean unbounded, boolean interruptible) {
        this.deadlineNanos = deadlineNanos;
        this.unbounded = unbounded;
        this.interruptible = interruptible;
    }

    /**
     * @param budget time from now; null or negative for no time limit
     */
    static Deadline after(Duration budget) {
        if (budget == null || budget.isNegative()) {
            return new Deadline(0, true, true);
        }
        return new Deadline(System.nanoTime() + budget.toNanos(), false, true);
    }

    /**
     * A deadline that never expires, not even on interrupt.
     */
    static Deadline none() {
        return NEVER;
    }

    boolean expired() {
        if (interruptible && Thread.currentThread().isInterrupted()) {
            return true;
        }
        return !unbounded && System.nanoTime() - deadlineNanos >= 0;
    }
}
