package io.relaypipes.session;

import io.relaypipes.PipesException;

/**
 * Thrown when the session API is called out of order: a second {@code init}, a report after
 * close, or an asset key the run is not responsible for.
 */
public class UsageException extends PipesException {

    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
