package io.mcpgate.server.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpgate.core.backend.BackendCatalog;
import io.mcpgate.core.tool.ToolDescriptor;
import io.mcpgate.server.mcp.ConnectionRegistry;
import io.mcpgate.server.mcp.JsonRpc;
import io.mcpgate.server.mcp.McpClient;
import io.mcpgate.server.validation.LogSanitizer;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// Answers JSON-RPC requests addressed to one backend through the gateway.
///
/// HTTP concerns (origin, notifications, framing) are handled by
/// {@link io.mcpgate.server.api.McpGatewayResource}; this class only maps a request to a
/// JSON-RPC response. Every outcome, including backend failures, is a well-formed JSON-RPC
/// response: the returned Uni never fails.
///
/// ### Methods
/// | Method | Behaviour |
/// |--------|-----------|
/// | `initialize` | answered locally with negotiated version and gateway info |
/// | `ping` | answered locally with `{}` |
/// | `tools/list` | tools of the connected backend, empty list when disconnected |
/// | `tools/call` | forwarded to the backend client |
/// | anything else | `-32601` |
///
/// ### Error Codes
/// - `-32601`: method not found
/// - `-32602`: unknown backend, missing params or tool name, backend not connected
/// - `-32603`: tool call failed
@ApplicationScoped
public class GatewayDispatcher {

    private static final Logger LOG = Logger.getLogger(GatewayDispatcher.class);

    private final BackendResolver resolver;
    private final BackendCatalog catalog;
    private final ConnectionRegistry registry;
    private final JsonRpc jsonRpc;
    private final String serverName;
    private final String serverVersion;

    @Inject
    public GatewayDispatcher(
            BackendResolver resolver,
            BackendCatalog catalog,
            ConnectionRegistry registry,
            JsonRpc jsonRpc,
            @ConfigProperty(name = "mcpgate.gateway.server-name", defaultValue = "mcpgate")
                    String serverName,
            @ConfigProperty(name = "mcpgate.gateway.server-version", defaultValue = "1.0.0")
                    String serverVersion) {
        this.resolver = resolver;
        this.catalog = catalog;
        this.registry = registry;
        this.jsonRpc = jsonRpc;
        this.serverName = serverName;
        this.serverVersion = serverVersion;
    }

    /// Answers one JSON-RPC request.
    ///
    /// @param backendReference backend reference from the request path, may be null
    /// @param request parsed request carrying an `id`, not null
    /// @return Uni with the JSON-RPC response, never failing
    public Uni<ObjectNode> dispatch(String backendReference, ObjectNode request) {
        JsonNode id = request.get("id");
        return Uni.createFrom()
                .deferred(() -> route(backendReference, id, request))
                .onFailure()
                .recoverWithItem(
                        failure -> {
                            LOG.errorv(failure, "Gateway dispatch failed");
                            return jsonRpc.createErrorResponse(
                                    id,
                                    JsonRpc.INTERNAL_ERROR,
                                    "Internal error: " + failure.getMessage());
                        });
    }

    private Uni<ObjectNode> route(String backendReference, JsonNode id, ObjectNode request) {
        String method = jsonRpc.extractMethod(request);
        Optional<String> backendId = resolver.resolve(backendReference);
        if (backendId.isEmpty()) {
            return error(
                    id, JsonRpc.INVALID_PARAMS, "No server found with id: " + backendReference);
        }

        return switch (method) {
            case "initialize" -> Uni.createFrom().item(initialize(id, request.get("params")));
            case "ping" ->
                    Uni.createFrom()
                            .item(jsonRpc.createResponse(id, jsonRpc.mapper().createObjectNode()));
            case "tools/list" -> Uni.createFrom().item(listTools(id, backendId.get()));
            case "tools/call" -> callTool(id, backendId.get(), request.get("params"));
            default -> error(id, JsonRpc.METHOD_NOT_FOUND, "Method not found: " + method);
        };
    }

    private ObjectNode initialize(JsonNode id, JsonNode params) {
        String requested =
                params != null ? params.path("protocolVersion").asText("") : "";

        ObjectNode result = jsonRpc.mapper().createObjectNode();
        result.put("protocolVersion", ProtocolVersions.negotiate(requested));
        result.putObject("capabilities").putObject("tools").put("listChanged", false);
        ObjectNode info = result.putObject("serverInfo");
        info.put("name", serverName);
        info.put("version", serverVersion);
        return jsonRpc.createResponse(id, result);
    }

    private ObjectNode listTools(JsonNode id, String backendId) {
        ObjectMapper mapper = jsonRpc.mapper();
        ObjectNode result = mapper.createObjectNode();
        ArrayNode tools = result.putArray("tools");
        registry.get(backendId)
                .map(McpClient::tools)
                .ifPresent(descriptors -> descriptors.forEach(t -> tools.add(toJson(t))));
        return jsonRpc.createResponse(id, result);
    }

    private Uni<ObjectNode> callTool(JsonNode id, String backendId, JsonNode params) {
        if (params == null || params.isNull()) {
            return error(id, JsonRpc.INVALID_PARAMS, "Missing params for tools/call");
        }
        JsonNode nameNode = params.get("name");
        if (nameNode == null || !nameNode.isTextual()) {
            return error(id, JsonRpc.INVALID_PARAMS, "Missing tool name in params");
        }
        String toolName = nameNode.asText();
        JsonNode arguments =
                params.hasNonNull("arguments")
                        ? params.get("arguments")
                        : jsonRpc.mapper().createObjectNode();

        Optional<McpClient> client = registry.get(backendId);
        if (client.isEmpty()) {
            return error(
                    id,
                    JsonRpc.INVALID_PARAMS,
                    "Server '" + displayName(backendId) + "' is not connected");
        }

        LOG.infov(
                "Proxy tool call: {0}.{1}",
                LogSanitizer.sanitize(backendId),
                LogSanitizer.sanitize(toolName));

        return client.get()
                .callTool(toolName, arguments)
                .map(
                        result -> {
                            LOG.infov(
                                    "Proxy tool result: {0}.{1} -> {2}",
                                    LogSanitizer.sanitize(backendId),
                                    LogSanitizer.sanitize(toolName),
                                    result.failed() ? "error" : "ok");
                            return jsonRpc.createResponse(id, result.toJson(jsonRpc.mapper()));
                        })
                .onFailure()
                .recoverWithItem(
                        failure -> {
                            LOG.errorv(
                                    "Proxy tool call failed: {0}.{1} -> {2}",
                                    LogSanitizer.sanitize(backendId),
                                    LogSanitizer.sanitize(toolName),
                                    failure.getMessage());
                            return jsonRpc.createErrorResponse(
                                    id,
                                    JsonRpc.INTERNAL_ERROR,
                                    "Tool call failed: " + failure.getMessage());
                        });
    }

    private ObjectNode toJson(ToolDescriptor tool) {
        ObjectNode entry = jsonRpc.mapper().createObjectNode();
        entry.put("name", tool.name());
        // Some clients reject explicit nulls, so optional members are omitted
        if (tool.title() != null) {
            entry.put("title", tool.title());
        }
        if (tool.description() != null) {
            entry.put("description", tool.description());
        }
        entry.set("inputSchema", jsonRpc.mapper().valueToTree(tool.inputSchema()));
        return entry;
    }

    private String displayName(String backendId) {
        return catalog.find(backendId).map(state -> state.config().name()).orElse(backendId);
    }

    private Uni<ObjectNode> error(JsonNode id, int code, String message) {
        return Uni.createFrom().item(jsonRpc.createErrorResponse(id, code, message));
    }
}
