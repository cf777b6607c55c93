package io.mcpgate.server.gateway;

import jakarta.enterprise.context.ApplicationScoped;

/// Whether the gateway is serving, and on which port.
///
/// Written once when the HTTP server has bound, read by anything that needs to hand out
/// gateway URLs.
///
/// @implNote Thread-safe. The state is an immutable snapshot behind a volatile reference.
@ApplicationScoped
public class ProxyRuntimeState {

    private static final String HOST = "127.0.0.1";

    private volatile Snapshot snapshot = new Snapshot(false, 0);

    /// Records the bound port and marks the gateway running.
    ///
    /// @param port bound port, must be positive
    public void markRunning(int port) {
        if (port <= 0) {
            throw new IllegalArgumentException("port must be positive: " + port);
        }
        snapshot = new Snapshot(true, port);
    }

    public boolean isRunning() {
        return snapshot.running();
    }

    public int port() {
        return snapshot.port();
    }

    /// Returns the current state.
    ///
    /// @return immutable snapshot, never null
    public Snapshot snapshot() {
        return snapshot;
    }

    /// Returns the gateway URL of one backend.
    ///
    /// @param backendId backend identifier, not null
    /// @return `http://127.0.0.1:{port}/mcp/{backendId}`
    /// @throws IllegalStateException if the gateway is not running
    public String endpointFor(String backendId) {
        Snapshot current = snapshot;
        if (!current.running()) {
            throw new IllegalStateException("Gateway is not running");
        }
        return "http://" + HOST + ":" + current.port() + "/mcp/" + backendId;
    }

    /// Gateway runtime state.
    ///
    /// @param running whether the gateway has bound its port
    /// @param port bound port, 0 while not running
    public record Snapshot(boolean running, int port) {}
}
