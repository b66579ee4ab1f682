package io.relaypipes.writer;

import io.relaypipes.model.Params;
import io.relaypipes.model.PipesMessage;

/**
 * Opens the channel described by the launcher's messages params.
 */
public interface MessageWriter {
    /**
     * @throws ChannelOpenException when the sink cannot be created or opened for writing
     */
    MessageWriterChannel open(Params params);

    default void write(MessageWriterChannel channel, PipesMessage message) {
        channel.writeMessage(message);
    }

    /**
     * Writes {@code closing} as the final message, then releases the channel even if that write fails.
     */
    default void close(MessageWriterChannel channel, PipesMessage closing) {
        try {
            channel.writeMessage(closing);
        } catch (RuntimeException writeFailure) {
            try {
                channel.close();
            } catch (RuntimeException closeFailure) {
                writeFailure.addSuppressed(closeFailure);
            }
            throw writeFailure;
        }
        channel.close();
    }

    default void close(MessageWriterChannel channel) {
        close(channel, PipesMessage.closed());
    }
}
