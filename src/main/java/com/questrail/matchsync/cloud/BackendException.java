package com.questrail.matchsync.cloud;

/**
 * A backend call failed.
 *
 * <p>{@link #status()} is the HTTP status of the failed response, or
 * {@link #NO_STATUS} when no response was received.</p>
 */
public class BackendException extends RuntimeException
{
    public static final int NO_STATUS = -1;

    private final int status;

    public BackendException(int status, String message) {
        super(message);
        this.status = status;
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
        this.status = NO_STATUS;
    }

    public int status() {
        return status;
    }
}
