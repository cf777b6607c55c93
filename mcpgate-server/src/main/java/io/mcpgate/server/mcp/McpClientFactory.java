package io.mcpgate.server.mcp;

import io.mcpgate.core.backend.BackendConfig;
import io.smallrye.mutiny.Uni;

/// Factory for connected MCP clients.
///
/// Implementations launch or reach the backend described by a {@link BackendConfig} and
/// complete the MCP handshake before emitting the client.
public interface McpClientFactory {

    /// Connects to a backend.
    ///
    /// @param config backend to connect to, not null
    /// @return Uni emitting a client whose handshake has completed
    Uni<McpClient> connect(BackendConfig config);
}
