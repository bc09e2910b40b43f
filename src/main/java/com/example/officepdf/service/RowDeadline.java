package com.example.officepdf.service;

import com.example.officepdf.renderer.GateWaitListener;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Time budget of one row. Time spent queueing at a renderer gate is not charged.
 *
 * A row either expires or commits its output, never both: once {@link #expire()}
 * wins the row must not publish anything, once {@link #commit()} wins the row is
 * allowed to finish.
 */
final class RowDeadline implements GateWaitListener {
    private final Duration budget;
    private final long budgetNanos;
    private long spentNanos;
    private long runningSince;
    private boolean expired;
    private boolean committed;

    RowDeadline(Duration budget) {
        this.budget = budget;
        this.budgetNanos = budget.toNanos();
        this.runningSince = System.nanoTime();
    }

    Duration getBudget() {
        return budget;
    }

    @Override
    public synchronized void waiting() {
        if (runningSince >= 0) {
            spentNanos += System.nanoTime() - runningSince;
            runningSince = -1;
        }
    }

    @Override
    public synchronized void acquired() {
        if (runningSince < 0) {
            runningSince = System.nanoTime();
        }
    }

    synchronized long remainingMillis() {
        long spent = spentNanos + (runningSince >= 0 ? System.nanoTime() - runningSince : 0);
        long left = budgetNanos - spent;
        return left <= 0 ? 0 : Math.max(1, TimeUnit.NANOSECONDS.toMillis(left));
    }

    /**
     * @return false when the row already committed its output
     */
    synchronized boolean expire() {
        if (committed) {
            return false;
        }
        expired = true;
        return true;
    }

    /**
     * @return false when the row already expired
     */
    synchronized boolean commit() {
        if (expired) {
            return false;
        }
        committed = true;
        return true;
    }
}
