package io.mcpgate.server.mcp;

import io.mcpgate.server.validation.LogSanitizer;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;

/// Live MCP connections keyed by backend identifier.
///
/// Single source of truth for "which backends are connected": a key is present only
/// after a full handshake succeeded, and at most one client exists per backend.
///
/// ### Thread Safety
/// Backed by a ConcurrentHashMap, so routing lookups never block behind connect or
/// disconnect. The registry holds no lock of its own and never calls into the backend
/// catalog, which keeps the catalog-before-registry lock order trivially intact.
///
/// ### Dead Connections
/// {@link #get} never hands out a client whose backend process has exited: such an entry
/// is evicted and shut down on lookup.
@ApplicationScoped
public class ConnectionRegistry {

    private static final Logger LOG = Logger.getLogger(ConnectionRegistry.class);

    private final Map<String, McpClient> connections = new ConcurrentHashMap<>();

    /// Registers a new live connection.
    ///
    /// @param id backend identifier, not null
    /// @param client connected client, not null
    /// @throws IllegalStateException if a connection is already registered for `id`
    public void insert(String id, McpClient client) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(client, "client must not be null");
        if (connections.putIfAbsent(id, client) != null) {
            throw new IllegalStateException("Connection already registered for server: " + id);
        }
        LOG.debugv("Registered connection {0}", LogSanitizer.sanitize(id));
    }

    /// Removes a connection. The caller is responsible for shutting it down.
    ///
    /// @param id backend identifier, not null
    /// @return the removed client, or empty if none was registered
    public Optional<McpClient> remove(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(connections.remove(id));
    }

    /// Removes a connection only if it is still the given client.
    ///
    /// @param id backend identifier, not null
    /// @param client expected client, not null
    /// @return true if the entry was removed
    public boolean remove(String id, McpClient client) {
        return connections.remove(id, client);
    }

    /// Looks up a live connection for routing.
    ///
    /// @param id backend identifier, not null
    /// @return the live client, or empty if not connected
    public Optional<McpClient> get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        McpClient client = connections.get(id);
        if (client == null) {
            return Optional.empty();
        }
        if (!client.isAlive()) {
            if (connections.remove(id, client)) {
                LOG.warnv("Evicting dead connection {0}", LogSanitizer.sanitize(id));
                client.shutdown();
            }
            return Optional.empty();
        }
        return Optional.of(client);
    }

    /// Returns whether a live connection exists.
    ///
    /// @param id backend identifier, not null
    /// @return true if connected
    public boolean isConnected(String id) {
        return get(id).isPresent();
    }

    /// Returns the identifiers of all registered connections.
    ///
    /// @return immutable snapshot, never null
    public Set<String> ids() {
        return Set.copyOf(connections.keySet());
    }

    /// Returns the number of registered connections.
    ///
    /// @return connection count
    public int size() {
        return connections.size();
    }

    /// Shuts down every connection and clears the registry.
    @PreDestroy
    public void closeAll() {
        for (String id : Set.copyOf(connections.keySet())) {
            McpClient client = connections.remove(id);
            if (client != null) {
                client.shutdown();
            }
        }
    }
}
