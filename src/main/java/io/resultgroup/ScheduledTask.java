package io.resultgroup;

/**
 * Handle for a delayed action registered with {@link DelayScheduler}.
 */
public interface ScheduledTask {

    /**
     * Attempts to cancel the action before it runs.
     */
    boolean cancel();

    /**
     * @return true when the action was cancelled before running.
     */
    boolean isCancelled();

    /**
     * @return true when the action ran or was cancelled.
     */
    boolean isDone();
}
