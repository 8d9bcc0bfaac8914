package io.resultgroup;

import java.time.Duration;

/**
 * Immutable group-level unit runtime metrics snapshot.
 */
public final class GroupMetricsSnapshot {

    private final long started;
    private final long succeeded;
    private final long failed;
    private final long droppedErrors;
    private final long totalDurationNanos;
    private final long maxDurationNanos;

    public GroupMetricsSnapshot(
        long started,
        long succeeded,
        long failed,
        long droppedErrors,
        long totalDurationNanos,
        long maxDurationNanos
    ) {
        this.started = started;
        this.succeeded = succeeded;
        this.failed = failed;
        this.droppedErrors = droppedErrors;
        this.totalDurationNanos = totalDurationNanos;
        this.maxDurationNanos = maxDurationNanos;
    }

    public long started() {
        return started;
    }

    public long succeeded() {
        return succeeded;
    }

    /**
     * Units that reported an error, including those whose error was dropped.
     */
    public long failed() {
        return failed;
    }

    public long droppedErrors() {
        return droppedErrors;
    }

    public long completed() {
        return succeeded + failed;
    }

    public Duration totalDuration() {
        return Duration.ofNanos(totalDurationNanos);
    }

    public Duration averageDuration() {
        long completed = completed();
        if (completed == 0L) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(totalDurationNanos / completed);
    }

    public Duration maxDuration() {
        return Duration.ofNanos(maxDurationNanos);
    }

    @Override
    public String toString() {
        return "GroupMetricsSnapshot{started=" + started
            + ", succeeded=" + succeeded
            + ", failed=" + failed
            + ", droppedErrors=" + droppedErrors
            + ", averageDuration=" + averageDuration().toMillis() + " ms"
            + ", maxDuration=" + maxDuration().toMillis() + " ms}";
    }
}
