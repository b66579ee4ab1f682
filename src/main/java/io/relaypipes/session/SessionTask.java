package io.relaypipes.session;

/**
 * User code run inside {@link PipesSession#run(SessionTask)}.
 */
@FunctionalInterface
public interface SessionTask<T> {
    T run(PipesSession session) throws Exception;
}
