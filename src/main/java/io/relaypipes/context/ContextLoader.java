package io.relaypipes.context;

import io.relaypipes.model.Params;

public interface ContextLoader {
    /**
     * Builds the run context described by {@code params}. Either a complete context is
     * returned or {@link ContextDecodeException} is thrown.
     */
    RunContext loadContext(Params params);
}
