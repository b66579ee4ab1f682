package io.relaypipes.writer;

import io.relaypipes.model.PipesMessage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Publishes the whole message log on every write by writing a sibling temp file and moving it
 * over the target. Readers only ever observe a complete log.
 */
public final class AtomicReplaceFileChannel implements MessageWriterChannel {
    private final Path path;
    private final Path dir;
    private final StringBuilder content = new StringBuilder();
    private boolean released;

    private AtomicReplaceFileChannel(Path path, Path dir) {
        this.path = path;
        this.dir = dir;
    }

    public static AtomicReplaceFileChannel open(Path path) {
        Path absolute = path.toAbsolutePath();
        Path dir = absolute.getParent();
        if (dir == null || !Files.isDirectory(dir)) {
            throw new ChannelOpenException("Messages directory does not exist: " + dir);
        }
        if (Files.isDirectory(absolute)) {
            throw new ChannelOpenException("Messages path is a directory: " + absolute);
        }
        AtomicReplaceFileChannel channel = new AtomicReplaceFileChannel(absolute, dir);
        try {
            channel.publish();
        } catch (IOException e) {
            throw new ChannelOpenException("Failed to create messages file: " + absolute, e);
        }
        return channel;
    }

    public Path path() {
        return path;
    }

    @Override
    public void writeMessage(PipesMessage message) {
        if (released) {
            throw new WriteException("messages file already released: " + path);
        }
        int mark = content.length();
        content.append(message.toJsonLine()).append('\n');
        try {
            publish();
        } catch (IOException e) {
            content.setLength(mark);
            throw new WriteException("Failed to publish messages file: " + path, e);
        }
    }

    @Override
    public void close() {
        released = true;
    }

    private void publish() throws IOException {
        Path tmp = Files.createTempFile(dir, "." + path.getFileName() + "-", ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.SYNC);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
