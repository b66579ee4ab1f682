package io.relaypipes.writer;

import io.relaypipes.model.PipesMessage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends one JSON line per message to a file. Each line goes out in a single write and is
 * forced to storage before {@link #writeMessage} returns, so a reader tailing the file sees
 * whole lines and a killed writer leaves a valid prefix.
 */
public final class AppendFileChannel implements MessageWriterChannel {
    private final Path path;
    private final FileChannel file;
    private boolean released;

    private AppendFileChannel(Path path, FileChannel file) {
        this.path = path;
        this.file = file;
    }

    public static AppendFileChannel open(Path path) {
        try {
            FileChannel file = FileChannel.open(
                    path,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND,
                    StandardOpenOption.WRITE
            );
            return new AppendFileChannel(path, file);
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            throw new ChannelOpenException("Failed to open messages file: " + path, e);
        }
    }

    public Path path() {
        return path;
    }

    @Override
    public void writeMessage(PipesMessage message) {
        if (released) {
            throw new WriteException("messages file already released: " + path);
        }
        ByteBuffer line = ByteBuffer.wrap((message.toJsonLine() + "\n").getBytes(StandardCharsets.UTF_8));
        try {
            while (line.hasRemaining()) {
                file.write(line);
            }
            file.force(false);
        } catch (IOException e) {
            throw new WriteException("Failed to write message to " + path, e);
        }
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        try {
            file.close();
        } catch (IOException e) {
            throw new WriteException("Failed to release messages file: " + path, e);
        }
    }
}
