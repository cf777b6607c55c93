package io.mcpgate.server.integration;

/// Receives the gateway port once the HTTP server has bound.
///
/// Implementations publish the gateway location to external AI tools, for example by
/// rewriting their MCP client configuration. A failing notifier never stops the gateway.
@FunctionalInterface
public interface IntegrationPortNotifier {

    /// Publishes the bound gateway port.
    ///
    /// @param port bound port, always positive
    /// @throws Exception if the port could not be published
    void portChanged(int port) throws Exception;
}
