package io.relaypipes.writer;

import io.relaypipes.model.PipesMessage;

/**
 * Sink for outgoing messages. A channel is owned by exactly one session and used from one thread.
 */
public interface MessageWriterChannel extends AutoCloseable {
    /**
     * Writes {@code message} as one line and returns only once the line has reached the sink.
     *
     * @throws WriteException when the line could not be written
     */
    void writeMessage(PipesMessage message);

    /**
     * Releases the underlying handle. Does not write anything.
     */
    @Override
    void close();
}
