package io.relaypipes.writer;

import io.relaypipes.config.PipesConfig;
import io.relaypipes.model.Params;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Opens a channel from messages params:
 *
 * <ul>
 *   <li>{@code {"path": p}} appends to {@code p};</li>
 *   <li>{@code {"path": p, "write_mode": "atomic_replace"}} atomically replaces {@code p} on each write;</li>
 *   <li>{@code {"stdio": "stdout" | "stderr"}} writes to the process stream.</li>
 * </ul>
 */
public final class DefaultMessageWriter implements MessageWriter {
    private static final Logger LOG = LoggerFactory.getLogger(DefaultMessageWriter.class);

    private final PrintStream stdout;
    private final PrintStream stderr;

    public DefaultMessageWriter() {
        this(System.out, System.err);
    }

    public DefaultMessageWriter(PrintStream stdout, PrintStream stderr) {
        this.stdout = stdout;
        this.stderr = stderr;
    }

    @Override
    public MessageWriterChannel open(Params params) {
        if (params == null) {
            throw new ChannelOpenException("messages params are missing");
        }
        if (params.has(PipesConfig.PATH_KEY)) {
            String raw = params.text(PipesConfig.PATH_KEY)
                    .orElseThrow(() -> new ChannelOpenException("messages params 'path' must be a string"));
            Path path = toPath(raw);
            String mode = params.text(PipesConfig.WRITE_MODE_KEY)
                    .orElse(PipesConfig.WRITE_MODE_APPEND)
                    .toLowerCase(Locale.ROOT);
            if (PipesConfig.WRITE_MODE_APPEND.equals(mode)) {
                LOG.debug("Opening append messages channel at {}", path);
                return AppendFileChannel.open(path);
            }
            if (PipesConfig.WRITE_MODE_ATOMIC_REPLACE.equals(mode)) {
                LOG.debug("Opening atomic-replace messages channel at {}", path);
                return AtomicReplaceFileChannel.open(path);
            }
            throw new ChannelOpenException("Unknown messages write_mode: " + mode);
        }
        if (params.has(PipesConfig.STDIO_KEY)) {
            String stream = params.text(PipesConfig.STDIO_KEY)
                    .orElseThrow(() -> new ChannelOpenException("messages params 'stdio' must be a string"))
                    .toLowerCase(Locale.ROOT);
            return switch (stream) {
                case PipesConfig.STDOUT -> new StreamChannel(PipesConfig.STDOUT, stdout);
                case PipesConfig.STDERR -> new StreamChannel(PipesConfig.STDERR, stderr);
                default -> throw new ChannelOpenException("Invalid stream provided for stdio channel: " + stream);
            };
        }
        throw new ChannelOpenException(
                "messages params must contain '" + PipesConfig.PATH_KEY + "' or '" + PipesConfig.STDIO_KEY + "'"
        );
    }

    private static Path toPath(String raw) {
        if (raw.isBlank()) {
            throw new ChannelOpenException("messages path is empty");
        }
        try {
            return Path.of(raw);
        } catch (InvalidPathException e) {
            throw new ChannelOpenException("invalid messages path: " + raw, e);
        }
    }
}
