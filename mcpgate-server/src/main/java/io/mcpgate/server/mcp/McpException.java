package io.mcpgate.server.mcp;

import java.io.Serial;
import java.time.Duration;

/// Exception thrown when MCP operations fail.
///
/// Every failure carries a {@link Kind} so callers can react to the category without
/// parsing messages. Transport-level kinds propagate unchanged through {@link McpClient}
/// into the gateway, which turns them into JSON-RPC error envelopes.
public class McpException extends RuntimeException {

    @Serial private static final long serialVersionUID = 5486229795475543465L;

    /// Failure categories.
    public enum Kind {
        /// Backend process could not be started.
        SPAWN_FAILED,
        /// Process exited or the channel was torn down.
        TRANSPORT_CLOSED,
        /// No response within the configured bound.
        TIMEOUT,
        /// Malformed or schema-violating JSON-RPC payload.
        PROTOCOL,
        /// Authorization denied or callback never arrived.
        OAUTH,
        /// Any other I/O failure.
        IO
    }

    private final Kind kind;

    /// Creates an MCP exception with a message.
    ///
    /// @param kind failure category, not null
    /// @param message the error message
    public McpException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /// Creates an MCP exception with a cause.
    ///
    /// @param kind failure category, not null
    /// @param message the error message
    /// @param cause the underlying cause
    public McpException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /// Returns the failure category.
    ///
    /// @return kind, never null
    public Kind getKind() {
        return kind;
    }

    /// Creates an exception for a process that could not be launched.
    ///
    /// @param command the executable
    /// @param cause the underlying cause
    /// @return new exception
    public static McpException spawnFailed(String command, Throwable cause) {
        return new McpException(
                Kind.SPAWN_FAILED, "Failed to spawn MCP server '" + command + "'", cause);
    }

    /// Creates an exception for a closed transport.
    ///
    /// @param detail what was being attempted
    /// @return new exception
    public static McpException transportClosed(String detail) {
        return new McpException(Kind.TRANSPORT_CLOSED, "Transport closed: " + detail);
    }

    /// Creates an exception for a request that got no answer in time.
    ///
    /// @param method the JSON-RPC method
    /// @param timeout the bound that elapsed
    /// @return new exception
    public static McpException timeout(String method, Duration timeout) {
        return new McpException(
                Kind.TIMEOUT, "Request timed out after " + timeout.toMillis() + "ms: " + method);
    }

    /// Creates an exception for an unexpected payload.
    ///
    /// @param message what was wrong
    /// @return new exception
    public static McpException protocol(String message) {
        return new McpException(Kind.PROTOCOL, message);
    }

    /// Creates an exception for a failed authorization attempt.
    ///
    /// @param message what was wrong
    /// @return new exception
    public static McpException oauth(String message) {
        return new McpException(Kind.OAUTH, message);
    }
}
