package io.resultgroup;

/**
 * Raised when a unit observes cancellation or a wait on the group is interrupted.
 */
public class CancelledException extends RuntimeException {

    public CancelledException(String message) {
        super(message);
    }

    public CancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
