package io.resultgroup;

import java.time.Duration;

/**
 * Observability callbacks for unit lifecycle events.
 * Callbacks run on the unit's worker thread and should not block for long.
 * Exceptions thrown by a hook are ignored by the group.
 */
public interface UnitHook {

    default void onStart(UnitInfo info) {
    }

    default void onSuccess(UnitInfo info, Duration duration) {
    }

    /**
     * The unit reported an error, whether or not the group keeps it.
     */
    default void onFailure(UnitInfo info, Throwable error, Duration duration) {
    }

    /**
     * The error threshold was already reached, so this error is not recorded.
     */
    default void onErrorDropped(UnitInfo info, Throwable error) {
    }

    /**
     * The error reported by {@code info} made the recorded error count reach {@code threshold}.
     * Cancellation is triggered right after this callback.
     */
    default void onThresholdReached(UnitInfo info, int threshold) {
    }
}
