package io.relaypipes.params;

import io.relaypipes.PipesException;

/**
 * Thrown when a bootstrap parameter is missing or cannot be decoded.
 */
public class ParamsException extends PipesException {

    public ParamsException(String message) {
        super(message);
    }

    public ParamsException(String message, Throwable cause) {
        super(message, cause);
    }
}
