package io.mcpgate.server.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpgate.server.validation.LogSanitizer;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.jboss.logging.Logger;

/// JSON-RPC transport over a spawned child process's standard streams.
///
/// Messages are framed as one JSON value per line on stdin (outbound) and stdout
/// (inbound). Stderr is drained into the debug log.
///
/// ### Architecture
/// ```
/// +──────────────────+   request line   +──────────────────+
/// │  sendRequest()   │────── stdin ────>│  backend process │
/// │  (future by id)  │                  │                  │
/// │                  │<───── stdout ────│                  │
/// │  reader thread   │  response line   +──────────────────+
/// │  (Future.done)   │
/// +──────────────────+
/// ```
///
/// ### Pending Request Table
/// Each request id is registered once before its line is written, resolved at most once by
/// the reader thread, and removed on resolution, timeout or close. A second response with
/// the same id finds no entry and is logged and dropped.
///
/// ### Thread Safety
/// Thread-safe. Concurrent requests get independent ids; writes are serialized.
/// Submission and result delivery both run on the Mutiny worker pool: event-loop callers
/// never block on the pipe and the reader thread never runs downstream code.
///
/// @see McpClient for the MCP session built on top
/// @see JsonRpc for message formatting
public final class StdioTransport implements McpTransport {

    private static final Logger LOG = Logger.getLogger(StdioTransport.class);

    private final String label;
    private final Process process;
    private final BufferedWriter stdin;
    private final JsonRpc jsonRpc;
    private final Duration requestTimeout;
    private final Duration shutdownGrace;

    private final Map<Long, CompletableFuture<JsonNode>> pendingRequests =
            new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean closeListenersFired = new AtomicBoolean();
    private final AtomicBoolean shutdownRequested = new AtomicBoolean();
    private final Object writeLock = new Object();
    private final List<Consumer<JsonNode>> notificationListeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();

    StdioTransport(
            String label,
            Process process,
            JsonRpc jsonRpc,
            Duration requestTimeout,
            Duration shutdownGrace) {
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.process = Objects.requireNonNull(process, "process must not be null");
        this.jsonRpc = Objects.requireNonNull(jsonRpc, "jsonRpc must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.shutdownGrace = Objects.requireNonNull(shutdownGrace, "shutdownGrace");
        this.stdin =
                new BufferedWriter(
                        new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        startDaemon("mcp-stdout-" + label, this::readLoop);
        startDaemon("mcp-stderr-" + label, this::drainStderr);
    }

    /// Spawns a backend process and attaches a transport to it.
    ///
    /// @param command executable to launch, not null
    /// @param args command arguments, not null
    /// @param env environment variables added to the inherited environment, not null
    /// @param jsonRpc message helper, not null
    /// @param requestTimeout bounded wait for each request, not null
    /// @param shutdownGrace time allowed for a graceful exit before the process is killed
    /// @return connected transport, never null
    /// @throws McpException of kind `SPAWN_FAILED` if the process cannot be started
    public static StdioTransport spawn(
            String command,
            List<String> args,
            Map<String, String> env,
            JsonRpc jsonRpc,
            Duration requestTimeout,
            Duration shutdownGrace) {
        List<String> commandLine = new ArrayList<>(args.size() + 1);
        commandLine.add(command);
        commandLine.addAll(args);

        ProcessBuilder builder = new ProcessBuilder(commandLine);
        builder.environment().putAll(env);

        Process process;
        try {
            process = builder.start();
        } catch (IOException | RuntimeException e) {
            throw McpException.spawnFailed(command, e);
        }

        LOG.infov(
                "Spawned MCP server {0} (pid {1})", LogSanitizer.sanitize(command), process.pid());
        return new StdioTransport(command, process, jsonRpc, requestTimeout, shutdownGrace);
    }

    @Override
    public Uni<JsonNode> sendRequest(String method, JsonNode params) {
        return Uni.createFrom()
                .deferred(() -> submit(method, params))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .emitOn(Infrastructure.getDefaultWorkerPool())
                .map(response -> jsonRpc.parseResult(response, method));
    }

    private Uni<JsonNode> submit(String method, JsonNode params) {
        long requestId = nextId.getAndIncrement();
        CompletableFuture<JsonNode> responseFuture = new CompletableFuture<>();
        pendingRequests.put(requestId, responseFuture);

        // Registered before the closed check so a concurrent close always drains this entry
        if (closed.get()) {
            pendingRequests.remove(requestId);
            return Uni.createFrom().failure(McpException.transportClosed(method));
        }

        try {
            LOG.debugv("Sending MCP request to {0}: method={1}, id={2}", label, method, requestId);
            writeLine(jsonRpc.createRequest(requestId, method, params));
        } catch (McpException e) {
            pendingRequests.remove(requestId);
            return Uni.createFrom().failure(e);
        }

        return Uni.createFrom()
                .completionStage(responseFuture)
                .ifNoItem()
                .after(requestTimeout)
                .failWith(() -> McpException.timeout(method, requestTimeout))
                .onTermination()
                .invoke(() -> pendingRequests.remove(requestId));
    }

    @Override
    public void sendNotification(String method, JsonNode params) throws McpException {
        if (closed.get()) {
            throw McpException.transportClosed(method);
        }
        writeLine(jsonRpc.createNotification(method, params));
        LOG.debugv("Sent notification to {0}: {1}", label, method);
    }

    @Override
    public void onNotification(Consumer<JsonNode> listener) {
        notificationListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    @Override
    public void onClose(Runnable listener) {
        closeListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
        // Whoever removes the listener runs it, so a close racing this call runs it once
        if (closeListenersFired.get() && closeListeners.remove(listener)) {
            runQuietly(listener);
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && process.isAlive();
    }

    @Override
    public OptionalLong pid() {
        try {
            return OptionalLong.of(process.pid());
        } catch (UnsupportedOperationException e) {
            return OptionalLong.empty();
        }
    }

    /// Returns the number of requests awaiting a response.
    ///
    /// @return pending request count
    public int pendingRequestCount() {
        return pendingRequests.size();
    }

    @Override
    public void shutdown() {
        if (!shutdownRequested.compareAndSet(false, true)) {
            return;
        }
        LOG.infov("Shutting down MCP server {0}", label);
        close("shutdown");

        try {
            stdin.close();
        } catch (IOException e) {
            LOG.debugv("Closing stdin of {0} failed: {1}", label, e.getMessage());
        }

        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        process.onExit()
                .completeOnTimeout(process, shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)
                .thenAccept(
                        p -> {
                            if (p.isAlive()) {
                                LOG.warnv("MCP server {0} ignored SIGTERM, killing", label);
                                p.descendants().forEach(ProcessHandle::destroyForcibly);
                                p.destroyForcibly();
                            }
                        });
    }

    private void writeLine(ObjectNode message) {
        String line = message.toString();
        synchronized (writeLock) {
            try {
                stdin.write(line);
                stdin.write('\n');
                stdin.flush();
            } catch (IOException e) {
                throw new McpException(
                        McpException.Kind.TRANSPORT_CLOSED,
                        "Transport closed: failed to write to " + label,
                        e);
            }
        }
    }

    private void readLoop() {
        try (BufferedReader reader =
                new BufferedReader(
                        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    dispatch(line);
                }
            }
        } catch (IOException e) {
            if (!closed.get()) {
                LOG.debugv("Read loop of {0} ended: {1}", label, e.getMessage());
            }
        } finally {
            close("process exited");
        }
    }

    private void dispatch(String line) {
        ObjectNode message;
        try {
            message = jsonRpc.parse(line);
        } catch (McpException e) {
            LOG.debugv(
                    "Ignoring non JSON-RPC output from {0}: {1}",
                    label,
                    LogSanitizer.abbreviate(line, 200));
            return;
        }

        if (jsonRpc.isResponse(message)) {
            completeResponse(message);
        } else if (jsonRpc.isNotification(message)) {
            String method = jsonRpc.extractMethod(message);
            LOG.debugv("Notification from {0}: {1}", label, method);
            for (Consumer<JsonNode> listener : notificationListeners) {
                try {
                    listener.accept(message);
                } catch (RuntimeException e) {
                    LOG.warnv(e, "Notification listener failed for {0}", method);
                }
            }
        } else {
            LOG.debugv(
                    "Ignoring server-initiated request from {0}: {1}",
                    label,
                    jsonRpc.extractMethod(message));
        }
    }

    private void completeResponse(ObjectNode message) {
        JsonNode idNode = message.get("id");
        Long requestId = toRequestId(idNode);
        CompletableFuture<JsonNode> future =
                requestId != null ? pendingRequests.remove(requestId) : null;
        if (future != null) {
            LOG.debugv("Completing request {0} from {1}", requestId, label);
            future.complete(message);
        } else {
            LOG.warnv(
                    "Received response for unknown or already resolved ID from {0}: {1}",
                    label,
                    LogSanitizer.sanitize(String.valueOf(idNode)));
        }
    }

    private static Long toRequestId(JsonNode idNode) {
        if (idNode == null) {
            return null;
        }
        if (idNode.canConvertToLong() && idNode.isIntegralNumber()) {
            return idNode.asLong();
        }
        if (idNode.isTextual()) {
            try {
                return Long.parseLong(idNode.asText());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private void close(String reason) {
        closed.set(true);

        for (Long requestId : List.copyOf(pendingRequests.keySet())) {
            CompletableFuture<JsonNode> future = pendingRequests.remove(requestId);
            if (future != null) {
                future.completeExceptionally(McpException.transportClosed(reason));
            }
        }

        if (closeListenersFired.compareAndSet(false, true)) {
            LOG.infov("Transport to {0} closed: {1}", label, reason);
            for (Runnable listener : closeListeners) {
                if (closeListeners.remove(listener)) {
                    runQuietly(listener);
                }
            }
        }
    }

    private static void runQuietly(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            LOG.warnv(e, "Close listener failed");
        }
    }

    private void drainStderr() {
        try (BufferedReader reader =
                new BufferedReader(
                        new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                LOG.debugv("[{0}] {1}", label, LogSanitizer.sanitize(line));
            }
        } catch (IOException e) {
            LOG.tracev("Stderr of {0} closed: {1}", label, e.getMessage());
        }
    }

    private static void startDaemon(String name, Runnable task) {
        Thread thread = new Thread(task, name);
        thread.setDaemon(true);
        thread.start();
    }
}
