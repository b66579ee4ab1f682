package io.relaypipes.reader;

import io.relaypipes.model.PipesMessage;
import io.relaypipes.model.PipesMethod;

import java.util.List;

/**
 * Messages recovered from a log file.
 *
 * @param messages    the valid prefix, in write order
 * @param skippedTail number of trailing lines dropped because the first of them was not a whole message
 */
public record MessageLog(List<PipesMessage> messages, int skippedTail) {
    public MessageLog {
        messages = List.copyOf(messages);
    }

    /**
     * @return true when the last recovered message is {@code closed}
     */
    public boolean complete() {
        return !messages.isEmpty() && messages.get(messages.size() - 1).method() == PipesMethod.CLOSED;
    }
}
