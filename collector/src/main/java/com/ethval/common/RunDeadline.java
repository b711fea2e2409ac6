package com.ethval.common;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-level deadline plus cancellation flag, checked between metrics, tiers and batches.
 * Thread-safe; one instance is shared by all metrics of a run.
 */
public class RunDeadline {

    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public RunDeadline(Clock clock, Duration timeout) {
        this.clock = clock;
        this.deadline = timeout == null ? Instant.MAX : clock.instant().plus(timeout);
    }

    /** No deadline; only {@link #cancel()} stops the run. */
    public static RunDeadline unbounded(Clock clock) {
        return new RunDeadline(clock, null);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isExpired() {
        return cancelled.get() || !clock.instant().isBefore(deadline);
    }

    /**
     * @param where short description of the checkpoint, used in the exception message
     * @throws RunCancelledException when cancelled or past the deadline
     */
    public void check(String where) {
        if (cancelled.get()) {
            throw new RunCancelledException("Run cancelled before " + where);
        }
        if (!clock.instant().isBefore(deadline)) {
            throw new RunCancelledException("Run deadline " + deadline + " passed before " + where);
        }
    }
}
