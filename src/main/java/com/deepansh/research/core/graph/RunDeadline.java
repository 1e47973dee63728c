package com.deepansh.research.core.graph;

import java.time.Duration;

/**
 * Wall-clock budget for one run, shared by every wait the scheduler performs.
 */
public final class RunDeadline {

    private final Duration budget;
    private final long expiresAtNanos;

    private RunDeadline(Duration budget) {
        this.budget = budget;
        this.expiresAtNanos = System.nanoTime() + budget.toNanos();
    }

    public static RunDeadline after(Duration budget) {
        if (budget.isNegative() || budget.isZero()) {
            throw new IllegalArgumentException("Run budget must be positive: " + budget);
        }
        return new RunDeadline(budget);
    }

    public long remainingNanos() {
        return Math.max(0, expiresAtNanos - System.nanoTime());
    }

    public boolean isExpired() {
        return remainingNanos() == 0;
    }

    public Duration budget() {
        return budget;
    }
}
