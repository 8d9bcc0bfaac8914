package io.resultgroup;

import io.resultgroup.internal.DefaultCancellationToken;

import java.time.Duration;

/**
 * Observe side of a cooperative cancellation signal.
 * Implementations must be thread-safe; once cancelled a token stays cancelled.
 */
public interface CancellationToken {

    /**
     * Token that is never cancelled. Use it as the root when no outer cancellation exists.
     */
    static CancellationToken none() {
        return DefaultCancellationToken.NEVER;
    }

    /**
     * @return true when cancellation has been requested.
     */
    boolean isCancelled();

    /**
     * Throws {@link CancelledException} if cancellation has been requested.
     */
    void throwIfCancelled();

    /**
     * Blocks until cancellation is requested or the timeout elapses.
     *
     * @return true when cancellation was observed, false on timeout.
     */
    boolean await(Duration timeout) throws InterruptedException;

    /**
     * Registers a callback run once on cancellation.
     *
     * <p>If the token is already cancelled the callback runs on the calling thread before this method returns.
     */
    Registration onCancel(Runnable callback);

    /**
     * Handle of a callback registered with {@link #onCancel(Runnable)}.
     */
    interface Registration extends AutoCloseable {

        /**
         * Removes the callback. Has no effect once the callback ran.
         */
        @Override
        void close();
    }
}
