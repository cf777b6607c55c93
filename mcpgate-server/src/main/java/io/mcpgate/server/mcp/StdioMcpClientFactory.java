package io.mcpgate.server.mcp;

import io.mcpgate.core.backend.BackendConfig;
import io.mcpgate.server.mcp.McpClient.ClientInfo;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// Connects stdio backends by spawning their command and running the MCP handshake.
///
/// ### Configuration
/// - `mcpgate.mcp.request-timeout`: bounded wait per JSON-RPC request (default: 30s)
/// - `mcpgate.mcp.shutdown-grace`: time before a stopping backend is killed (default: 2s)
/// - `mcpgate.mcp.auto-refresh-tools`: refresh tools on `tools/list_changed` (default: true)
/// - `mcpgate.client.name` / `mcpgate.client.version`: identity sent in `initialize`
@ApplicationScoped
public class StdioMcpClientFactory implements McpClientFactory {

    private final JsonRpc jsonRpc;
    private final Duration requestTimeout;
    private final Duration shutdownGrace;
    private final boolean autoRefreshTools;
    private final ClientInfo clientInfo;

    @Inject
    public StdioMcpClientFactory(
            JsonRpc jsonRpc,
            @ConfigProperty(name = "mcpgate.mcp.request-timeout", defaultValue = "30s")
                    Duration requestTimeout,
            @ConfigProperty(name = "mcpgate.mcp.shutdown-grace", defaultValue = "2s")
                    Duration shutdownGrace,
            @ConfigProperty(name = "mcpgate.mcp.auto-refresh-tools", defaultValue = "true")
                    boolean autoRefreshTools,
            @ConfigProperty(name = "mcpgate.client.name", defaultValue = "mcpgate")
                    String clientName,
            @ConfigProperty(name = "mcpgate.client.version", defaultValue = "1.0.0")
                    String clientVersion) {
        this.jsonRpc = jsonRpc;
        this.requestTimeout = requestTimeout;
        this.shutdownGrace = shutdownGrace;
        this.autoRefreshTools = autoRefreshTools;
        this.clientInfo = new ClientInfo(clientName, clientVersion);
    }

    @Override
    public Uni<McpClient> connect(BackendConfig config) {
        return Uni.createFrom()
                .item(
                        () -> {
                            config.requireLaunchable();
                            return StdioTransport.spawn(
                                    config.command(),
                                    config.args(),
                                    config.env(),
                                    jsonRpc,
                                    requestTimeout,
                                    shutdownGrace);
                        })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .chain(
                        transport ->
                                McpClient.connect(
                                        transport,
                                        config.id(),
                                        config.name(),
                                        clientInfo,
                                        autoRefreshTools,
                                        jsonRpc));
    }
}
