package io.relaypipes;

/**
 * Root of every failure raised by the Pipes client.
 *
 * <p>Unchecked; callers catch the specific subclass when they have a recovery
 * path and otherwise let it unwind through the session's try-with-resources.
 */
public abstract class PipesException extends RuntimeException {

    protected PipesException(String message) {
        super(message);
    }

    protected PipesException(String message, Throwable cause) {
        super(message, cause);
    }
}
