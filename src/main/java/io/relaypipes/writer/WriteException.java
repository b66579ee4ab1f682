package io.relaypipes.writer;

import io.relaypipes.PipesException;

/**
 * Thrown when a message could not be written to its channel (disk full, sink removed, closed stream).
 */
public class WriteException extends PipesException {

    public WriteException(String message) {
        super(message);
    }

    public WriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
