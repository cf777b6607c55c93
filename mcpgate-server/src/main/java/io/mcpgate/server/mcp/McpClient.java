package io.mcpgate.server.mcp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpgate.core.tool.ToolDescriptor;
import io.mcpgate.server.validation.LogSanitizer;
import io.smallrye.mutiny.Uni;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jboss.logging.Logger;

/// One MCP session with a backend server, layered on an {@link McpTransport}.
///
/// A client only exists in connected form: {@link #connect} performs the full handshake
/// and the returned Uni emits the client once tools have been discovered.
///
/// ### Handshake
/// 1. `initialize` request with protocol version and client identity; server capabilities
///    and info are captured
/// 2. `notifications/initialized` notification
/// 3. `tools/list` request; the returned descriptors become {@link #tools()}
///
/// Any failing step aborts the connect and shuts the transport down.
///
/// ### Usage
/// {@snippet :
/// McpClient client = McpClient.connect(transport, "files", "filesystem", clientInfo, true, jsonRpc)
///         .await().atMost(Duration.ofSeconds(30));
/// CallToolResult result = client.callTool("read_file", args).await().indefinitely();
/// }
///
/// @implNote Thread-safe. The tool list is replaced atomically on refresh.
/// @see ConnectionRegistry for the set of live clients
public class McpClient {

    private static final Logger LOG = Logger.getLogger(McpClient.class);

    /// Protocol version requested from backends.
    public static final String PROTOCOL_VERSION = "2025-03-26";

    static final String TOOLS_LIST_CHANGED = "notifications/tools/list_changed";

    private static final TypeReference<Map<String, Object>> SCHEMA_TYPE = new TypeReference<>() {};

    private final McpTransport transport;
    private final String backendId;
    private final String backendName;
    private final ClientInfo clientInfo;
    private final JsonRpc jsonRpc;
    private final AtomicBoolean shutdown = new AtomicBoolean();

    private volatile List<ToolDescriptor> tools = List.of();
    private volatile JsonNode serverCapabilities = NullNode.getInstance();
    private volatile JsonNode serverInfo = NullNode.getInstance();

    McpClient(
            McpTransport transport,
            String backendId,
            String backendName,
            ClientInfo clientInfo,
            JsonRpc jsonRpc) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.backendId = Objects.requireNonNull(backendId, "backendId must not be null");
        this.backendName = Objects.requireNonNull(backendName, "backendName must not be null");
        this.clientInfo = Objects.requireNonNull(clientInfo, "clientInfo must not be null");
        this.jsonRpc = Objects.requireNonNull(jsonRpc, "jsonRpc must not be null");
    }

    /// Runs the MCP handshake over an open transport.
    ///
    /// @param transport open transport to the backend, not null
    /// @param backendId owning backend identifier, not null
    /// @param backendName owning backend display name, not null
    /// @param clientInfo identity sent in `initialize`, not null
    /// @param autoRefreshTools whether `tools/list_changed` triggers {@link #refreshTools()}
    /// @param jsonRpc message helper, not null
    /// @return Uni emitting the connected client
    public static Uni<McpClient> connect(
            McpTransport transport,
            String backendId,
            String backendName,
            ClientInfo clientInfo,
            boolean autoRefreshTools,
            JsonRpc jsonRpc) {
        McpClient client = new McpClient(transport, backendId, backendName, clientInfo, jsonRpc);
        return client.initialize()
                .chain(client::refreshTools)
                .invoke(
                        discovered -> {
                            if (autoRefreshTools) {
                                transport.onNotification(client::handleNotification);
                            }
                        })
                .replaceWith(client)
                .onFailure()
                .invoke(
                        failure -> {
                            LOG.warnv(
                                    "Handshake with {0} failed: {1}",
                                    LogSanitizer.sanitize(backendId),
                                    failure.getMessage());
                            transport.shutdown();
                        });
    }

    private Uni<Void> initialize() {
        ObjectMapper mapper = jsonRpc.mapper();
        ObjectNode params = mapper.createObjectNode();
        params.put("protocolVersion", PROTOCOL_VERSION);
        params.putObject("capabilities");
        ObjectNode info = params.putObject("clientInfo");
        info.put("name", clientInfo.name());
        info.put("version", clientInfo.version());

        return transport
                .sendRequest("initialize", params)
                .invoke(
                        result -> {
                            if (!result.isObject()) {
                                throw McpException.protocol(
                                        "Failed to parse initialize result: expected an object");
                            }
                            serverCapabilities = result.path("capabilities");
                            serverInfo = result.path("serverInfo");
                            LOG.infov(
                                    "MCP server initialized: {0} v{1}",
                                    LogSanitizer.sanitize(serverInfo.path("name").asText("?")),
                                    LogSanitizer.sanitize(serverInfo.path("version").asText("?")));
                            transport.sendNotification("notifications/initialized", null);
                        })
                .replaceWithVoid();
    }

    /// Re-issues `tools/list` and replaces the stored descriptors.
    ///
    /// @return Uni with the fresh descriptors
    public Uni<List<ToolDescriptor>> refreshTools() {
        if (shutdown.get()) {
            return closed();
        }
        return transport
                .sendRequest("tools/list", jsonRpc.mapper().createObjectNode())
                .map(this::parseTools)
                .invoke(
                        discovered -> {
                            tools = discovered;
                            LOG.infov(
                                    "Discovered {0} tools on {1}",
                                    discovered.size(),
                                    LogSanitizer.sanitize(backendId));
                        });
    }

    /// Calls a tool on the backend.
    ///
    /// @param name tool name as reported by the backend, not null
    /// @param arguments tool arguments, null is sent as `{}`
    /// @return Uni with the tool result
    public Uni<CallToolResult> callTool(String name, JsonNode arguments) {
        Objects.requireNonNull(name, "name must not be null");
        if (shutdown.get()) {
            return closed();
        }
        ObjectNode params = jsonRpc.mapper().createObjectNode();
        params.put("name", name);
        params.set(
                "arguments",
                arguments != null && !arguments.isNull()
                        ? arguments
                        : jsonRpc.mapper().createObjectNode());

        return transport.sendRequest("tools/call", params).map(CallToolResult::fromJson);
    }

    /// Returns the tools discovered by the last successful `tools/list`.
    ///
    /// @return immutable descriptor list, never null
    public List<ToolDescriptor> tools() {
        return tools;
    }

    /// Returns the capabilities the backend declared in `initialize`.
    ///
    /// @return capabilities node, `null` node if none were declared
    public JsonNode serverCapabilities() {
        return serverCapabilities;
    }

    /// Returns the server info the backend declared in `initialize`.
    ///
    /// @return server info node, `null` node if none was declared
    public JsonNode serverInfo() {
        return serverInfo;
    }

    /// Returns the OS process identifier of the backend.
    ///
    /// @return process id, or empty if unavailable
    public OptionalLong childProcessId() {
        return transport.pid();
    }

    public String backendId() {
        return backendId;
    }

    public String backendName() {
        return backendName;
    }

    /// Returns whether the client can still serve requests.
    ///
    /// @return false after shutdown or once the backend process has exited
    public boolean isAlive() {
        return !shutdown.get() && transport.isOpen();
    }

    /// Registers a callback run once when the underlying transport closes.
    ///
    /// @param listener close callback, not null
    public void onTerminated(Runnable listener) {
        transport.onClose(listener);
    }

    /// Shuts the session down and terminates the backend. Idempotent; later calls on this
    /// client fail with `TRANSPORT_CLOSED`.
    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            transport.shutdown();
        }
    }

    private void handleNotification(JsonNode notification) {
        if (!TOOLS_LIST_CHANGED.equals(jsonRpc.extractMethod(notification)) || shutdown.get()) {
            return;
        }
        LOG.infov("Tool list changed on {0}, refreshing", LogSanitizer.sanitize(backendId));
        refreshTools()
                .subscribe()
                .with(
                        refreshed -> LOG.debugv("Refreshed tools on {0}", backendId),
                        failure ->
                                LOG.warnv(
                                        "Tool refresh on {0} failed: {1}",
                                        LogSanitizer.sanitize(backendId),
                                        failure.getMessage()));
    }

    private List<ToolDescriptor> parseTools(JsonNode result) {
        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            throw McpException.protocol("Failed to parse tools list: missing tools array");
        }
        List<ToolDescriptor> parsed = new ArrayList<>(toolsNode.size());
        for (JsonNode tool : toolsNode) {
            JsonNode name = tool.get("name");
            if (name == null || !name.isTextual() || name.asText().isBlank()) {
                throw McpException.protocol("Failed to parse tools list: tool without name");
            }
            JsonNode schema = tool.get("inputSchema");
            parsed.add(
                    new ToolDescriptor(
                            name.asText(),
                            textOrNull(tool, "title"),
                            textOrNull(tool, "description"),
                            schema != null && schema.isObject()
                                    ? jsonRpc.mapper().convertValue(schema, SCHEMA_TYPE)
                                    : null,
                            backendId,
                            backendName));
        }
        return List.copyOf(parsed);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static <T> Uni<T> closed() {
        return Uni.createFrom().failure(McpException.transportClosed("client has been shut down"));
    }

    /// Client identity sent in `initialize`.
    ///
    /// @param name client name, not null
    /// @param version client version, not null
    public record ClientInfo(String name, String version) {

        public ClientInfo {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(version, "version must not be null");
        }
    }
}
