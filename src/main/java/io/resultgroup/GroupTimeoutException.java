package io.resultgroup;

/**
 * Raised when a timed {@link ResultGroup#await(java.time.Duration)} gives up before every unit reported.
 */
public class GroupTimeoutException extends RuntimeException {

    public GroupTimeoutException(String message) {
        super(message);
    }
}
