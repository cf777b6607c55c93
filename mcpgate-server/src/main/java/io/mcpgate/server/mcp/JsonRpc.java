package io.mcpgate.server.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Optional;

/// JSON-RPC 2.0 helper for MCP protocol messages.
///
/// Builds and inspects the three message shapes exchanged with backend processes (one
/// message per line) and with gateway callers (one message per HTTP body).
///
/// ### Message Types
/// - **Request**: Has `id`, `method`, optional `params` - expects a response
/// - **Notification**: Has `method`, optional `params`, no `id` - no response expected
/// - **Response**: Has `id`, `result` or `error`
///
/// Ids are carried as {@link JsonNode} so numeric and string ids round-trip unchanged.
///
/// @see StdioTransport for line framing
/// @see <a href="https://www.jsonrpc.org/specification">JSON-RPC 2.0 Spec</a>
@ApplicationScoped
public class JsonRpc {

    public static final String VERSION = "2.0";

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;

    private final ObjectMapper mapper;

    @Inject
    public JsonRpc(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /// Returns the mapper used to build and parse messages.
    ///
    /// @return object mapper, never null
    public ObjectMapper mapper() {
        return mapper;
    }

    /// Creates a JSON-RPC request (expects a response).
    ///
    /// @param id request identifier for response correlation
    /// @param method the method to invoke (e.g., "tools/call")
    /// @param params method parameters, omitted when null
    /// @return request message
    public ObjectNode createRequest(long id, String method, JsonNode params) {
        ObjectNode root = envelope();
        root.put("id", id);
        root.put("method", method);
        if (params != null) {
            root.set("params", params);
        }
        return root;
    }

    /// Creates a JSON-RPC notification (no response expected).
    ///
    /// @param method the method to invoke
    /// @param params method parameters, omitted when null
    /// @return notification message
    public ObjectNode createNotification(String method, JsonNode params) {
        ObjectNode root = envelope();
        root.put("method", method);
        if (params != null) {
            root.set("params", params);
        }
        return root;
    }

    /// Creates a JSON-RPC success response.
    ///
    /// @param id the request ID being responded to, null becomes JSON `null`
    /// @param result the result data
    /// @return response message
    public ObjectNode createResponse(JsonNode id, JsonNode result) {
        ObjectNode root = envelope();
        root.set("id", id != null ? id : NullNode.getInstance());
        root.set("result", result);
        return root;
    }

    /// Creates a JSON-RPC error response.
    ///
    /// @param id the request ID being responded to, null becomes JSON `null`
    /// @param code error code
    /// @param message error message
    /// @return error response message
    public ObjectNode createErrorResponse(JsonNode id, int code, String message) {
        ObjectNode root = envelope();
        root.set("id", id != null ? id : NullNode.getInstance());
        ObjectNode error = root.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return root;
    }

    /// Parses one JSON-RPC message.
    ///
    /// @param json raw message text
    /// @return parsed object node
    /// @throws McpException of kind `PROTOCOL` if the text is not a JSON object
    public ObjectNode parse(String json) throws McpException {
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw McpException.protocol("JSON-RPC message must be an object");
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            throw new McpException(
                    McpException.Kind.PROTOCOL,
                    "Failed to parse JSON-RPC message: " + e.getOriginalMessage(),
                    e);
        }
    }

    /// Extracts the ID from a JSON-RPC message.
    ///
    /// An explicit `"id": null` counts as present; only a missing member is absent.
    ///
    /// @param message the JSON-RPC message
    /// @return the ID node, or empty if the member is missing
    public Optional<JsonNode> extractId(JsonNode message) {
        return Optional.ofNullable(message.get("id"));
    }

    /// Extracts the method from a JSON-RPC message.
    ///
    /// @param message the JSON-RPC message
    /// @return the method name, or empty string if not present
    public String extractMethod(JsonNode message) {
        JsonNode method = message.get("method");
        return method != null && method.isTextual() ? method.asText() : "";
    }

    /// Checks if a message is a JSON-RPC response (has result or error, no method).
    ///
    /// @param message the JSON-RPC message
    /// @return true if this is a response
    public boolean isResponse(JsonNode message) {
        return (message.has("result") || message.has("error")) && !message.has("method");
    }

    /// Checks if a message is a notification (has method, no id).
    ///
    /// @param message the JSON-RPC message
    /// @return true if this is a notification
    public boolean isNotification(JsonNode message) {
        return message.has("method") && !message.has("id");
    }

    /// Extracts the `result` of a response.
    ///
    /// @param response the JSON-RPC response
    /// @param method method the response answers, used in messages
    /// @return the result node, never null
    /// @throws McpException of kind `PROTOCOL` if the response carries an error or no result
    public JsonNode parseResult(JsonNode response, String method) throws McpException {
        JsonNode errorNode = response.get("error");
        if (errorNode != null && !errorNode.isNull()) {
            String message =
                    errorNode.hasNonNull("message")
                            ? errorNode.get("message").asText()
                            : "Unknown error";
            int code = errorNode.has("code") ? errorNode.get("code").asInt() : -1;
            throw McpException.protocol("JSON-RPC error " + code + ": " + message);
        }
        JsonNode resultNode = response.get("result");
        if (resultNode == null || resultNode.isNull()) {
            throw McpException.protocol("No result in " + method + " response");
        }
        return resultNode;
    }

    private ObjectNode envelope() {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", VERSION);
        return root;
    }
}
