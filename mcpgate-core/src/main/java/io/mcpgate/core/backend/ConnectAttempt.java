package io.mcpgate.core.backend;

import java.util.Objects;

/// Ticket handed out by {@link BackendCatalog#beginConnect(String)}.
///
/// Only the holder of the latest ticket for a backend may complete or fail its connect.
/// A disconnect, a removal or a newer connect invalidates older tickets.
///
/// @param config configuration snapshot to connect with, not null
/// @param sequence catalog-wide attempt number
public record ConnectAttempt(BackendConfig config, long sequence) {

    public ConnectAttempt {
        Objects.requireNonNull(config, "config must not be null");
    }

    public String id() {
        return config.id();
    }
}
