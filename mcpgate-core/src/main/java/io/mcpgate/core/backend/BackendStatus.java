package io.mcpgate.core.backend;

/// Connection lifecycle of a configured backend.
///
/// ```
/// DISCONNECTED ──connect──> CONNECTING ──handshake ok──> CONNECTED
///                               │                            │
///                               └──failure──> ERROR          └──disconnect / exit──> DISCONNECTED
/// ```
public enum BackendStatus {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR;

    /// Returns whether a new connect attempt must be refused in this state.
    ///
    /// @return true while connecting or connected
    public boolean isActive() {
        return this == CONNECTING || this == CONNECTED;
    }
}
