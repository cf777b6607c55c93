package io.mcpgate.server.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import io.smallrye.mutiny.Uni;
import java.util.OptionalLong;
import java.util.function.Consumer;

/// Duplex JSON-RPC channel to one backend MCP server.
///
/// Implementations correlate responses to requests strictly by id, never by submission
/// order, and fail every outstanding request with
/// {@link McpException.Kind#TRANSPORT_CLOSED} when the channel goes away.
///
/// @see StdioTransport for the child-process implementation
public interface McpTransport {

    /// Sends a request and waits for its response.
    ///
    /// @param method JSON-RPC method, not null
    /// @param params request parameters, may be null
    /// @return Uni with the response's `result` member, failing with {@link McpException}
    Uni<JsonNode> sendRequest(String method, JsonNode params);

    /// Sends a notification; no response is awaited.
    ///
    /// @param method JSON-RPC method, not null
    /// @param params notification parameters, may be null
    /// @throws McpException of kind `TRANSPORT_CLOSED` if the message cannot be written
    void sendNotification(String method, JsonNode params) throws McpException;

    /// Registers a listener for notifications sent by the backend.
    ///
    /// @param listener receives each notification message, not null
    void onNotification(Consumer<JsonNode> listener);

    /// Registers a callback run once when the channel closes for any reason.
    ///
    /// @param listener close callback, not null
    void onClose(Runnable listener);

    /// Returns whether requests can still be sent.
    ///
    /// @return true until shutdown or backend exit
    boolean isOpen();

    /// Returns the OS process id of the backend, if it has one.
    ///
    /// @return process id, or empty if unavailable
    OptionalLong pid();

    /// Closes the channel and fails all outstanding requests. Idempotent.
    void shutdown();
}
