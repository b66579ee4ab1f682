package io.relaypipes.writer;

import io.relaypipes.model.PipesMessage;

import java.io.PrintStream;

/**
 * Writes message lines to a process stream (stdout or stderr), flushing after each line.
 */
public final class StreamChannel implements MessageWriterChannel {
    private final String name;
    private final PrintStream stream;

    public StreamChannel(String name, PrintStream stream) {
        this.name = name;
        this.stream = stream;
    }

    public String name() {
        return name;
    }

    @Override
    public void writeMessage(PipesMessage message) {
        stream.print(message.toJsonLine() + "\n");
        stream.flush();
        if (stream.checkError()) {
            throw new WriteException("Failed to write message to " + name);
        }
    }

    @Override
    public void close() {
        // Process streams outlive the session.
        stream.flush();
    }
}
