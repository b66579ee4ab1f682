package io.relaypipes.context;

import io.relaypipes.PipesException;

/**
 * Thrown when context JSON is malformed, unreadable or missing required fields.
 */
public class ContextDecodeException extends PipesException {

    public ContextDecodeException(String message) {
        super(message);
    }

    public ContextDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
