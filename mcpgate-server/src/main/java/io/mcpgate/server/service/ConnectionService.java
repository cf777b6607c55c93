package io.mcpgate.server.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcpgate.core.backend.BackendCatalog;
import io.mcpgate.core.backend.BackendConfig;
import io.mcpgate.core.backend.BackendState;
import io.mcpgate.core.backend.ConnectAttempt;
import io.mcpgate.core.exception.BackendConnectCancelledException;
import io.mcpgate.core.exception.BackendNotFoundException;
import io.mcpgate.core.tool.ToolDescriptor;
import io.mcpgate.core.tool.ToolNames;
import io.mcpgate.core.tool.ToolNames.QualifiedToolName;
import io.mcpgate.server.mcp.CallToolResult;
import io.mcpgate.server.mcp.ConnectionRegistry;
import io.mcpgate.server.mcp.McpClient;
import io.mcpgate.server.mcp.McpClientFactory;
import io.mcpgate.server.validation.LogSanitizer;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/// Connects, disconnects and queries backends.
///
/// Coordinates the two pieces of shared state: the {@link BackendCatalog} (configuration
/// and status) and the {@link ConnectionRegistry} (live clients).
///
/// ### Lock Discipline
/// The catalog is only touched through its own short critical sections. Process spawn and
/// the MCP handshake run with no lock held; the result is committed afterwards. Committing
/// a connection and tearing one down pair a catalog transition with a registry change, so
/// both run under `lifecycleLock`, which never covers I/O or process shutdown.
///
/// ### Connect Flow
/// ```
/// catalog.beginConnect(id)        DISCONNECTED|ERROR -> CONNECTING (validates, issues ticket)
/// factory.connect(config)         spawn + initialize + initialized + tools/list, no lock held
/// catalog.markConnected(attempt)  -> CONNECTED, only if the ticket is still current
/// registry.insert(id, client)     routable from now on
/// ```
/// A failure at any step marks the backend `ERROR` and propagates to the caller. A
/// disconnect or removal while the handshake runs cancels the attempt: the new client is
/// shut down and the caller gets {@link BackendConnectCancelledException}.
///
/// @see io.mcpgate.server.api.BackendResource for the REST surface
@ApplicationScoped
public class ConnectionService {

    private static final Logger LOG = Logger.getLogger(ConnectionService.class);

    private final BackendCatalog catalog;
    private final ConnectionRegistry registry;
    private final McpClientFactory clientFactory;
    private final Object lifecycleLock = new Object();

    @Inject
    public ConnectionService(
            BackendCatalog catalog, ConnectionRegistry registry, McpClientFactory clientFactory) {
        this.catalog = catalog;
        this.registry = registry;
        this.clientFactory = clientFactory;
    }

    /// Connects a configured backend.
    ///
    /// @param id backend identifier, not null
    /// @return Uni emitting the connection summary once the backend is routable
    /// @throws BackendNotFoundException (as failure) if no backend has this id
    public Uni<ConnectionInfo> connect(String id) {
        return Uni.createFrom()
                .item(() -> catalog.beginConnect(id))
                .invoke(attempt -> LOG.infov("Connecting server {0}", LogSanitizer.sanitize(id)))
                .chain(
                        attempt ->
                                clientFactory
                                        .connect(attempt.config())
                                        .onFailure()
                                        .invoke(failure -> recordFailure(attempt, failure))
                                        .map(client -> commit(attempt, client)));
    }

    private ConnectionInfo commit(ConnectAttempt attempt, McpClient client) {
        String id = attempt.id();
        boolean committed;
        try {
            synchronized (lifecycleLock) {
                committed = catalog.markConnected(attempt);
                if (committed) {
                    registry.insert(id, client);
                }
            }
        } catch (RuntimeException e) {
            client.shutdown();
            throw e;
        }
        if (!committed) {
            client.shutdown();
            LOG.infov(
                    "Discarded connection to server {0}: disconnected while connecting",
                    LogSanitizer.sanitize(id));
            throw new BackendConnectCancelledException(id);
        }
        client.onTerminated(() -> handleExit(id, client));
        LOG.infov(
                "Connected to server {0} with {1} tools",
                LogSanitizer.sanitize(id),
                client.tools().size());
        return ConnectionInfo.of(client);
    }

    private void recordFailure(ConnectAttempt attempt, Throwable failure) {
        String id = LogSanitizer.sanitize(attempt.id());
        if (catalog.markError(attempt, failure.getMessage())) {
            LOG.errorv("Failed to connect to server {0}: {1}", id, failure.getMessage());
        } else {
            LOG.debugv("Connect to server {0} failed after it was cancelled", id);
        }
    }

    private void handleExit(String id, McpClient client) {
        synchronized (lifecycleLock) {
            if (!registry.remove(id, client)) {
                return;
            }
            try {
                catalog.markDisconnected(id);
            } catch (BackendNotFoundException e) {
                LOG.debugv("Exited server {0} is no longer configured", LogSanitizer.sanitize(id));
                return;
            }
        }
        LOG.warnv("Server {0} exited, marked disconnected", LogSanitizer.sanitize(id));
    }

    /// Disconnects a backend and terminates its process.
    ///
    /// Idempotent for configured backends that are not connected. Cancels a connect that
    /// is still in progress.
    ///
    /// @param id backend identifier, not null
    /// @throws BackendNotFoundException if no backend has this id
    public void disconnect(String id) {
        requireConfigured(id);
        Optional<McpClient> removed;
        synchronized (lifecycleLock) {
            removed = registry.remove(id);
            catalog.markDisconnected(id);
        }
        removed.ifPresent(McpClient::shutdown);
        LOG.infov("Disconnected server {0}", LogSanitizer.sanitize(id));
    }

    /// Lists configured backends with their status.
    ///
    /// @return backends in configuration order, never null
    public List<BackendState> listBackends() {
        return catalog.list();
    }

    /// Adds a backend to the catalog in `DISCONNECTED` state.
    ///
    /// @param config backend configuration, not null
    /// @throws io.mcpgate.core.exception.BackendConfigurationException if the id is taken
    public void addBackend(BackendConfig config) {
        catalog.add(config);
    }

    /// Replaces the configuration of a backend, keeping its status.
    ///
    /// A live connection keeps running with the configuration it was started with; the
    /// new one applies from the next connect.
    ///
    /// @param id backend identifier from the request path, not null
    /// @param config new configuration, not null, with the same id
    /// @return the updated backend, never null
    /// @throws BackendNotFoundException if no backend has this id
    /// @throws IllegalArgumentException if the configuration carries a different id
    public BackendState updateBackend(String id, BackendConfig config) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (!id.equals(config.id())) {
            throw new IllegalArgumentException(
                    "Server id '" + config.id() + "' does not match path id '" + id + "'");
        }
        catalog.update(config);
        LOG.infov("Updated server {0}", LogSanitizer.sanitize(id));
        return catalog.find(id).orElseThrow(() -> new BackendNotFoundException(id));
    }

    /// Removes a backend, disconnecting it first when connected.
    ///
    /// @param id backend identifier, not null
    /// @throws BackendNotFoundException if no backend has this id
    public void removeBackend(String id) {
        requireConfigured(id);
        Optional<McpClient> removed;
        synchronized (lifecycleLock) {
            removed = registry.remove(id);
            catalog.remove(id);
        }
        removed.ifPresent(McpClient::shutdown);
        LOG.infov("Removed server {0}", LogSanitizer.sanitize(id));
    }

    /// Connects every enabled backend that is not yet connected.
    ///
    /// Failures are recorded per backend and do not stop the others.
    ///
    /// @return Uni emitting the number of backends that connected
    public Uni<Integer> connectEnabled() {
        List<String> ids =
                catalog.list().stream()
                        .filter(state -> state.config().enabled())
                        .filter(state -> !state.status().isActive())
                        .map(BackendState::id)
                        .toList();

        return Multi.createFrom()
                .iterable(ids)
                .onItem()
                .transformToUniAndMerge(
                        id ->
                                connect(id)
                                        .map(info -> 1)
                                        .onFailure()
                                        .recoverWithItem(0))
                .collect()
                .with(Collectors.summingInt(Integer::intValue));
    }

    /// Returns the tools of a connected backend.
    ///
    /// @param id backend identifier, not null
    /// @return tools with their original names, empty if the backend is not connected
    /// @throws BackendNotFoundException if no backend has this id
    public List<ToolDescriptor> listTools(String id) {
        requireConfigured(id);
        return registry.get(id).map(McpClient::tools).orElse(List.of());
    }

    /// Returns the tools of every connected backend, namespaced as `backendName.tool`.
    ///
    /// @return namespaced tools, never null
    public List<ToolDescriptor> listAllTools() {
        return registry.ids().stream()
                .sorted()
                .flatMap(id -> registry.get(id).stream())
                .flatMap(client -> client.tools().stream())
                .map(ToolDescriptor::namespaced)
                .toList();
    }

    /// Calls a tool on a connected backend.
    ///
    /// @param id backend identifier, not null
    /// @param toolName tool name as reported by the backend, not null
    /// @param arguments tool arguments, may be null
    /// @return Uni with the tool result
    /// @throws BackendNotFoundException (as failure) if the backend is not connected
    public Uni<CallToolResult> callTool(String id, String toolName, JsonNode arguments) {
        return registry.get(id)
                .map(client -> client.callTool(toolName, arguments))
                .orElseGet(() -> Uni.createFrom().failure(new BackendNotFoundException(id)));
    }

    /// Calls a tool by its namespaced name (`backendName.tool`).
    ///
    /// @param qualifiedName namespaced tool name, not null
    /// @param arguments tool arguments, may be null
    /// @return Uni with the tool result
    /// @throws IllegalArgumentException (as failure) if the name is not namespaced
    public Uni<CallToolResult> callQualifiedTool(String qualifiedName, JsonNode arguments) {
        QualifiedToolName parsed = ToolNames.parse(qualifiedName).orElse(null);
        if (parsed == null) {
            return Uni.createFrom()
                    .failure(
                            new IllegalArgumentException(
                                    "Tool name must be namespaced as 'serverName.toolName', got: "
                                            + qualifiedName));
        }
        return catalog.findByName(parsed.backendName())
                .map(state -> callTool(state.id(), parsed.toolName(), arguments))
                .orElseGet(
                        () -> {
                            var notFound = new BackendNotFoundException(parsed.backendName());
                            return Uni.createFrom().failure(notFound);
                        });
    }

    /// Returns the connection summary of a backend.
    ///
    /// @param id backend identifier, not null
    /// @return summary of the live connection, or a disconnected summary
    /// @throws BackendNotFoundException if no backend has this id
    public ConnectionInfo connectionInfo(String id) {
        requireConfigured(id);
        return registry.get(id).map(ConnectionInfo::of).orElse(ConnectionInfo.disconnected(id));
    }

    private void requireConfigured(String id) {
        if (catalog.find(id).isEmpty()) {
            throw new BackendNotFoundException(id);
        }
    }

    /// Summary of a backend connection.
    ///
    /// @param backendId backend identifier, not null
    /// @param connected whether a live client exists
    /// @param childPid OS process id of the backend, null if unknown or disconnected
    /// @param toolCount number of discovered tools
    /// @param serverInfo server info declared by the backend, may be null
    public record ConnectionInfo(
            String backendId,
            boolean connected,
            Long childPid,
            int toolCount,
            JsonNode serverInfo) {

        static ConnectionInfo of(McpClient client) {
            OptionalLong pid = client.childProcessId();
            return new ConnectionInfo(
                    client.backendId(),
                    true,
                    pid.isPresent() ? pid.getAsLong() : null,
                    client.tools().size(),
                    client.serverInfo());
        }

        static ConnectionInfo disconnected(String backendId) {
            return new ConnectionInfo(backendId, false, null, 0, null);
        }
    }
}
