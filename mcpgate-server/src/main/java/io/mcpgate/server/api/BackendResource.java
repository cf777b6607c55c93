package io.mcpgate.server.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpgate.core.backend.BackendConfig;
import io.mcpgate.core.backend.BackendState;
import io.mcpgate.core.backend.BackendStatus;
import io.mcpgate.core.backend.BackendTransport;
import io.mcpgate.core.tool.ToolDescriptor;
import io.mcpgate.server.gateway.ProxyRuntimeState;
import io.mcpgate.server.service.ConnectionService;
import io.mcpgate.server.service.ConnectionService.ConnectionInfo;
import io.mcpgate.server.validation.LogSanitizer;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST API for managing backends and calling their tools directly.
///
/// ### Endpoints
/// | Method | Path | Description |
/// |--------|------|-------------|
/// | GET | `/api/v1/backends` | List backends with status |
/// | POST | `/api/v1/backends` | Add a backend |
/// | PUT | `/api/v1/backends/{id}` | Replace a backend's configuration |
/// | DELETE | `/api/v1/backends/{id}` | Remove a backend, disconnecting it first |
/// | POST | `/api/v1/backends/{id}/connect` | Spawn and handshake |
/// | POST | `/api/v1/backends/{id}/disconnect` | Terminate the backend process |
/// | GET | `/api/v1/backends/{id}/tools` | Tools of one backend |
/// | GET | `/api/v1/backends/tools` | Tools of all backends, namespaced |
/// | POST | `/api/v1/backends/tools/call` | Call a namespaced tool |
/// | POST | `/api/v1/backends/{id}/tools/{tool}/call` | Call a tool of one backend |
/// | GET | `/api/v1/backends/proxy` | Gateway state and per-backend URLs |
///
/// Domain failures are translated to HTTP statuses by
/// {@link io.mcpgate.server.security.GlobalExceptionMapper}.
///
/// @see ConnectionService for business logic
@Path("/api/v1/backends")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class BackendResource {

    private static final Logger LOG = Logger.getLogger(BackendResource.class);

    private final ConnectionService connectionService;
    private final ProxyRuntimeState runtimeState;
    private final ObjectMapper mapper;

    @Inject
    public BackendResource(
            ConnectionService connectionService,
            ProxyRuntimeState runtimeState,
            ObjectMapper mapper) {
        this.connectionService = connectionService;
        this.runtimeState = runtimeState;
        this.mapper = mapper;
    }

    /// Lists configured backends.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// [{"id": "files", "name": "filesystem", "enabled": true, "transport": "STDIO",
    ///   "status": "CONNECTED", "lastConnected": "2025-01-01T10:00:00Z"}]
    /// ```
    @GET
    public List<BackendView> list() {
        return connectionService.listBackends().stream().map(BackendView::of).toList();
    }

    /// Adds a backend.
    ///
    /// ### Request
    /// ```json
    /// {"id": "files", "name": "filesystem", "command": "npx",
    ///  "args": ["-y", "@modelcontextprotocol/server-filesystem", "/tmp"]}
    /// ```
    ///
    /// ### Response (201 Created)
    /// The stored backend, status `DISCONNECTED`.
    @POST
    public Response add(BackendConfig config) {
        if (config == null) {
            throw new BadRequestException("Backend configuration is required");
        }
        connectionService.addBackend(config);
        BackendView view =
                connectionService.listBackends().stream()
                        .filter(state -> state.id().equals(config.id()))
                        .findFirst()
                        .map(BackendView::of)
                        .orElseThrow();
        return Response.status(Response.Status.CREATED).entity(view).build();
    }

    /// Replaces a backend's configuration. The body has the same shape as for
    /// {@link #add(BackendConfig)} and its `id` must match the path.
    ///
    /// ### Response (200 OK)
    /// The updated backend with its current status. A connected backend stays connected
    /// and picks up the new configuration on its next connect.
    @PUT
    @Path("/{id}")
    public BackendView update(@PathParam("id") String id, BackendConfig config) {
        if (config == null) {
            throw new BadRequestException("Backend configuration is required");
        }
        return BackendView.of(connectionService.updateBackend(id, config));
    }

    @DELETE
    @Path("/{id}")
    public Response remove(@PathParam("id") String id) {
        connectionService.removeBackend(id);
        return Response.noContent().build();
    }

    /// Connects a backend.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"backendId": "files", "connected": true, "childPid": 4242, "toolCount": 11,
    ///  "serverInfo": {"name": "secure-filesystem-server", "version": "0.2.0"}}
    /// ```
    @POST
    @Path("/{id}/connect")
    public Uni<ConnectionInfo> connect(@PathParam("id") String id) {
        LOG.infov("Connect request: server={0}", LogSanitizer.sanitize(id));
        return connectionService.connect(id);
    }

    @POST
    @Path("/{id}/disconnect")
    public Map<String, Object> disconnect(@PathParam("id") String id) {
        connectionService.disconnect(id);
        return Map.of("backendId", id, "status", BackendStatus.DISCONNECTED.name());
    }

    @GET
    @Path("/{id}/tools")
    public List<ToolDescriptor> tools(@PathParam("id") String id) {
        return connectionService.listTools(id);
    }

    /// Lists the tools of every connected backend, named `backendName.toolName`.
    @GET
    @Path("/tools")
    public List<ToolDescriptor> allTools() {
        return connectionService.listAllTools();
    }

    /// Calls a tool by namespaced name.
    ///
    /// ### Request
    /// ```json
    /// {"name": "filesystem.read_file", "arguments": {"path": "/tmp/a.txt"}}
    /// ```
    ///
    /// ### Response (200 OK)
    /// The MCP `CallToolResult`: `{"content": [...], "isError": false}`.
    @POST
    @Path("/tools/call")
    public Uni<JsonNode> callQualified(QualifiedCallRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new BadRequestException("Tool name is required");
        }
        return connectionService
                .callQualifiedTool(request.name(), request.arguments())
                .map(result -> result.toJson(mapper));
    }

    /// Calls a tool of one backend. The request body is the tool's argument object.
    @POST
    @Path("/{id}/tools/{tool}/call")
    public Uni<JsonNode> callTool(
            @PathParam("id") String id, @PathParam("tool") String tool, JsonNode arguments) {
        LOG.infov(
                "Direct tool call: server={0}, tool={1}",
                LogSanitizer.sanitize(id),
                LogSanitizer.sanitize(tool));
        return connectionService
                .callTool(id, tool, arguments)
                .map(result -> result.toJson(mapper));
    }

    /// Reports the gateway state.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"running": true, "port": 51234,
    ///  "endpoints": {"files": "http://127.0.0.1:51234/mcp/files"}}
    /// ```
    @GET
    @Path("/proxy")
    public Map<String, Object> proxy() {
        ProxyRuntimeState.Snapshot snapshot = runtimeState.snapshot();
        Map<String, String> endpoints = new LinkedHashMap<>();
        if (snapshot.running()) {
            for (BackendState state : connectionService.listBackends()) {
                endpoints.put(state.id(), runtimeState.endpointFor(state.id()));
            }
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("running", snapshot.running());
        response.put("port", snapshot.port());
        response.put("endpoints", endpoints);
        return response;
    }

    /// Request body for namespaced tool calls.
    public record QualifiedCallRequest(String name, JsonNode arguments) {}

    /// Backend as exposed by the API. The process environment is never echoed back.
    public record BackendView(
            String id,
            String name,
            boolean enabled,
            BackendTransport transport,
            String command,
            List<String> args,
            String url,
            List<String> tags,
            BackendStatus status,
            Instant lastConnected,
            String lastError) {

        static BackendView of(BackendState state) {
            BackendConfig config = state.config();
            return new BackendView(
                    config.id(),
                    config.name(),
                    config.enabled(),
                    config.transport(),
                    config.command(),
                    config.args(),
                    config.url(),
                    config.tags(),
                    state.status(),
                    state.lastConnected(),
                    state.lastError());
        }
    }
}
