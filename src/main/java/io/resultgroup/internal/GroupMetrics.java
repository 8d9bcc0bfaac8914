package io.resultgroup.internal;

import io.resultgroup.GroupMetricsSnapshot;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Low-overhead unit metrics recorder for one group.
 */
public final class GroupMetrics {

    private final LongAdder started;
    private final LongAdder succeeded;
    private final LongAdder failed;
    private final LongAdder droppedErrors;
    private final LongAdder totalDurationNanos;
    private final AtomicLong maxDurationNanos;

    public GroupMetrics() {
        this.started = new LongAdder();
        this.succeeded = new LongAdder();
        this.failed = new LongAdder();
        this.droppedErrors = new LongAdder();
        this.totalDurationNanos = new LongAdder();
        this.maxDurationNanos = new AtomicLong(0L);
    }

    public void recordStart() {
        started.increment();
    }

    public void recordSuccess(long durationNanos) {
        succeeded.increment();
        recordDuration(durationNanos);
    }

    public void recordFailure(long durationNanos) {
        failed.increment();
        recordDuration(durationNanos);
    }

    public void recordDroppedError() {
        droppedErrors.increment();
    }

    public GroupMetricsSnapshot snapshot() {
        return new GroupMetricsSnapshot(
            started.sum(),
            succeeded.sum(),
            failed.sum(),
            droppedErrors.sum(),
            totalDurationNanos.sum(),
            maxDurationNanos.get()
        );
    }

    private void recordDuration(long durationNanos) {
        long safeDuration = Math.max(0L, durationNanos);
        totalDurationNanos.add(safeDuration);
        long current = maxDurationNanos.get();
        while (safeDuration > current) {
            if (maxDurationNanos.compareAndSet(current, safeDuration)) {
                return;
            }
            current = maxDurationNanos.get();
        }
    }
}
