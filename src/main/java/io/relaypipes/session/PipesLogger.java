package io.relaypipes.session;

import io.relaypipes.model.LogLevel;

/**
 * Level-named shortcuts for {@link PipesSession#log(LogLevel, String)}.
 */
public final class PipesLogger {
    private final PipesSession session;

    PipesLogger(PipesSession session) {
        this.session = session;
    }

    public void debug(String message) {
        session.log(LogLevel.DEBUG, message);
    }

    public void info(String message) {
        session.log(LogLevel.INFO, message);
    }

    public void warning(String message) {
        session.log(LogLevel.WARNING, message);
    }

    public void error(String message) {
        session.log(LogLevel.ERROR, message);
    }

    public void critical(String message) {
        session.log(LogLevel.CRITICAL, message);
    }
}
