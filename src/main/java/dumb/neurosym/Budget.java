package dumb.neurosym;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deadline plus a cancellation flag, checked cooperatively by long-running passes. Budgets derived with
 * {@link #within} share the flag, so cancelling one cancels all of them.
 */
public final class Budget {

    private final long deadline;
    private final AtomicBoolean cancelled;

    private Budget(long deadline, AtomicBoolean cancelled) {
        this.deadline = deadline;
        this.cancelled = cancelled;
    }

    public static Budget of(Duration timeout) {
        return new Budget(deadlineAfter(timeout), new AtomicBoolean());
    }

    private static long deadlineAfter(Duration timeout) {
        if (timeout.isNegative()) throw new IllegalArgumentException("Negative timeout: " + timeout);
        var nanos = timeout.compareTo(Duration.ofDays(365)) > 0 ? Duration.ofDays(365).toNanos() : timeout.toNanos();
        return System.nanoTime() + nanos;
    }

    /** A budget ending no later than this one and no later than {@code timeout} from now. */
    public Budget within(Duration timeout) {
        var d = deadlineAfter(timeout);
        return new Budget(d - deadline < 0 ? d : deadline, cancelled);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean cancelled() {
        return cancelled.get();
    }

    public boolean expired() {
        return System.nanoTime() - deadline >= 0;
    }

    public boolean exhausted() {
        return cancelled() || expired();
    }

    public Duration remaining() {
        var r = deadline - System.nanoTime();
        return r > 0 ? Duration.ofNanos(r) : Duration.ZERO;
    }
}
