package io.mcpgate.core.backend;

import java.time.Instant;
import java.util.Objects;

/// Snapshot of a backend's configuration together with its connection status.
///
/// @param config backend configuration, not null
/// @param status current lifecycle status, not null
/// @param lastConnected time of the last successful connect, may be null
/// @param lastError message of the last failed connect, may be null
public record BackendState(
        BackendConfig config, BackendStatus status, Instant lastConnected, String lastError) {

    public BackendState {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    static BackendState initial(BackendConfig config) {
        return new BackendState(config, BackendStatus.DISCONNECTED, null, null);
    }

    BackendState withStatus(BackendStatus newStatus) {
        return new BackendState(config, newStatus, lastConnected, lastError);
    }

    BackendState connected(Instant at) {
        return new BackendState(config, BackendStatus.CONNECTED, at, null);
    }

    BackendState failed(String error) {
        return new BackendState(config, BackendStatus.ERROR, lastConnected, error);
    }

    BackendState withConfig(BackendConfig newConfig) {
        return new BackendState(newConfig, status, lastConnected, lastError);
    }

    public String id() {
        return config.id();
    }
}
