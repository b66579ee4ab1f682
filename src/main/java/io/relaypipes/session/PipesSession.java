package io.relaypipes.session;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaypipes.context.ContextLoader;
import io.relaypipes.context.DefaultContextLoader;
import io.relaypipes.context.RunContext;
import io.relaypipes.model.AssetCheckSeverity;
import io.relaypipes.model.LogLevel;
import io.relaypipes.model.Params;
import io.relaypipes.model.PipesMessage;
import io.relaypipes.params.EnvParamsLoader;
import io.relaypipes.params.ParamsLoader;
import io.relaypipes.util.Jsons;
import io.relaypipes.writer.DefaultMessageWriter;
import io.relaypipes.writer.MessageWriter;
import io.relaypipes.writer.MessageWriterChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Handle for the single Pipes session of this process.
 *
 * <p>{@link #init()} loads params, builds the {@link RunContext} and opens the message channel;
 * {@link #close()} writes the {@code closed} message and releases the channel. Bind the handle
 * to a try-with-resources block (or use {@link #run(SessionTask)}) so the {@code closed}
 * message is written on every exit path:
 *
 * <pre>{@code
 * try (PipesSession session = PipesSession.init()) {
 *     session.reportAssetMaterialization(null, Map.of("rows", 42), null);
 * }
 * }</pre>
 *
 * <p>Not thread-safe. One session may be open per process at a time.
 */
public final class PipesSession implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(PipesSession.class);
    private static final AtomicBoolean ACTIVE = new AtomicBoolean(false);
    private static final int MAX_CAUSE_DEPTH = 8;

    private final RunContext context;
    private final MessageWriter writer;
    private final MessageWriterChannel channel;
    private final PipesLogger logger;
    private final Set<String> materializedAssets = new HashSet<>();
    private SessionState state = SessionState.OPENED;
    private Throwable reportedException;

    private PipesSession(RunContext context, MessageWriter writer, MessageWriterChannel channel) {
        this.context = context;
        this.writer = writer;
        this.channel = channel;
        this.logger = new PipesLogger(this);
    }

    public static PipesSession init() {
        return init(new EnvParamsLoader(), new DefaultContextLoader(), new DefaultMessageWriter());
    }

    /**
     * Opens the session with the given strategies. Fails with the first error met: params,
     * then context, then channel. On failure nothing stays claimed.
     *
     * @throws UsageException when another session is open in this process
     */
    public static PipesSession init(ParamsLoader paramsLoader, ContextLoader contextLoader, MessageWriter writer) {
        if (!ACTIVE.compareAndSet(false, true)) {
            throw new UsageException("A pipes session is already open in this process");
        }
        try {
            Params contextParams = paramsLoader.loadContextParams();
            Params messagesParams = paramsLoader.loadMessagesParams();
            RunContext context = contextLoader.loadContext(contextParams);
            MessageWriterChannel channel = writer.open(messagesParams);
            LOG.info("Opened pipes session run_id={} assets={}", context.runId(), context.assetKeys());
            return new PipesSession(context, writer, channel);
        } catch (RuntimeException | Error e) {
            ACTIVE.set(false);
            throw e;
        }
    }

    public static <T> T run(SessionTask<T> task) throws Exception {
        return run(new EnvParamsLoader(), new DefaultContextLoader(), new DefaultMessageWriter(), task);
    }

    /**
     * Opens a session, runs {@code task} with it and closes it. A failure thrown by the task
     * is attached to the {@code closed} message and rethrown.
     */
    public static <T> T run(
            ParamsLoader paramsLoader,
            ContextLoader contextLoader,
            MessageWriter writer,
            SessionTask<T> task
    ) throws Exception {
        try (PipesSession session = init(paramsLoader, contextLoader, writer)) {
            try {
                return task.run(session);
            } catch (Throwable t) {
                if (!session.isClosed()) {
                    session.reportException(t);
                }
                throw t;
            }
        }
    }

    /**
     * @return true while some session holds this process's slot
     */
    public static boolean isActive() {
        return ACTIVE.get();
    }

    public RunContext context() {
        return context;
    }

    public PipesLogger logger() {
        return logger;
    }

    public SessionState state() {
        return state;
    }

    public boolean isClosed() {
        return state == SessionState.CLOSED;
    }

    /**
     * Reports that {@code assetKey} was materialized. A null key means the run's only asset.
     *
     * @throws UsageException when closed, when the key cannot be resolved, or when the asset was already reported
     * @throws io.relaypipes.writer.WriteException when the channel write fails
     */
    public void reportAssetMaterialization(String assetKey, Map<String, ?> metadata, String dataVersion) {
        ensureOpen("report_asset_materialization");
        String resolved = resolveAssetKey(assetKey);
        if (materializedAssets.contains(resolved)) {
            throw new UsageException("Asset already materialized in this session: " + resolved);
        }
        PipesMessage message = buildMessage(() -> PipesMessage.assetMaterialization(resolved, metadata, dataVersion));
        writer.write(channel, message);
        materializedAssets.add(resolved);
    }

    public void reportAssetCheck(String checkName, String assetKey, boolean passed, Map<String, ?> metadata) {
        reportAssetCheck(checkName, assetKey, passed, AssetCheckSeverity.ERROR, metadata);
    }

    public void reportAssetCheck(
            String checkName,
            String assetKey,
            boolean passed,
            AssetCheckSeverity severity,
            Map<String, ?> metadata
    ) {
        ensureOpen("report_asset_check");
        if (checkName == null || checkName.isBlank()) {
            throw new UsageException("Asset check name cannot be empty");
        }
        String resolved = resolveAssetKey(assetKey);
        PipesMessage message = buildMessage(() -> PipesMessage.assetCheck(resolved, checkName, passed, severity, metadata));
        writer.write(channel, message);
    }

    public void log(LogLevel level, String text) {
        ensureOpen("log");
        writer.write(channel, PipesMessage.log(level, text));
    }

    /**
     * Records a failure to be carried by the {@code closed} message. The last report wins.
     */
    public void reportException(Throwable failure) {
        ensureOpen("report_exception");
        this.reportedException = failure;
    }

    /**
     * Writes the {@code closed} message and releases the channel. Later calls do nothing.
     *
     * @throws io.relaypipes.writer.WriteException when the {@code closed} message cannot be written;
     *         the session is closed regardless
     */
    @Override
    public void close() {
        if (state == SessionState.CLOSED) {
            return;
        }
        state = SessionState.CLOSED;
        PipesMessage closing = reportedException == null
                ? PipesMessage.closed()
                : PipesMessage.closed(exceptionPayload(reportedException, 0));
        try {
            writer.close(channel, closing);
            LOG.info("Closed pipes session run_id={}", context.runId());
        } catch (RuntimeException e) {
            LOG.warn("Failed to write closed message for run_id={}", context.runId(), e);
            throw e;
        } finally {
            ACTIVE.set(false);
        }
    }

    private void ensureOpen(String operation) {
        if (state == SessionState.CLOSED) {
            throw new UsageException("Cannot " + operation + ": pipes session is closed");
        }
    }

    /**
     * Metadata Jackson cannot serialize surfaces as a usage error before anything is written.
     */
    private static PipesMessage buildMessage(Supplier<PipesMessage> factory) {
        try {
            return factory.get();
        } catch (IllegalArgumentException e) {
            throw new UsageException("Metadata is not JSON-serializable: " + e.getMessage(), e);
        }
    }

    private String resolveAssetKey(String assetKey) {
        if (assetKey == null) {
            if (context.assetKeys().size() == 1) {
                return context.assetKeys().get(0);
            }
            throw new UsageException(context.assetKeys().isEmpty()
                    ? "No asset key given and the run targets no assets"
                    : "No asset key given and the run targets several assets: " + context.assetKeys());
        }
        if (!context.assetKeys().contains(assetKey)) {
            throw new UsageException("Asset key not targeted by this run: " + assetKey);
        }
        return assetKey;
    }

    private static ObjectNode exceptionPayload(Throwable failure, int depth) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("name", failure.getClass().getName());
        node.put("message", failure.getMessage());
        ArrayNode stack = node.putArray("stack");
        for (StackTraceElement element : failure.getStackTrace()) {
            stack.add(element.toString());
        }
        Throwable cause = failure.getCause();
        if (cause != null && cause != failure && depth < MAX_CAUSE_DEPTH) {
            node.set("cause", exceptionPayload(cause, depth + 1));
        } else {
            node.putNull("cause");
        }
        return node;
    }
}
