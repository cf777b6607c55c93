package io.mcpgate.core.backend;

/// Wire transport used to reach a backend MCP server.
public enum BackendTransport {
    /// Spawned child process speaking newline-delimited JSON-RPC over stdin/stdout.
    STDIO,

    /// Remote MCP server reached over HTTP. Configurable, not yet connectable.
    HTTP
}
