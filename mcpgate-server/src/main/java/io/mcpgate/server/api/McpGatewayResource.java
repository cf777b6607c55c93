package io.mcpgate.server.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpgate.server.gateway.GatewayDispatcher;
import io.mcpgate.server.gateway.McpResponses;
import io.mcpgate.server.gateway.OriginPolicy;
import io.mcpgate.server.mcp.JsonRpc;
import io.mcpgate.server.mcp.McpException;
import io.mcpgate.server.validation.LogSanitizer;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.UUID;
import org.jboss.logging.Logger;

/// MCP Streamable HTTP endpoint, one per configured backend.
///
/// External AI tools point their MCP client at `http://127.0.0.1:{port}/mcp/{backendId}`
/// and reach the backend's tools through the gateway's live connection.
///
/// ### Request Pipeline
/// 1. `GET` is rejected with `405`: server-initiated streams are not offered
/// 2. `Origin` must pass {@link OriginPolicy}, otherwise `403`
/// 3. The body is parsed; unreadable JSON gets `400` with a JSON-RPC error
/// 4. Messages without `id` (notifications, responses) get `202` and are dropped
/// 5. Requests are answered by {@link GatewayDispatcher}
/// 6. The reply is JSON, or one SSE event when `Accept` includes `text/event-stream`
///
/// ### Sessions
/// `initialize` issues a fresh `Mcp-Session-Id`; later requests have theirs echoed back.
/// Session ids are advisory and never checked.
///
/// ### Example
/// ```
/// POST /mcp/files
/// Accept: application/json, text/event-stream
/// Content-Type: application/json
///
/// {"jsonrpc":"2.0","id":7,"method":"tools/call","params":{"name":"read_file","arguments":{"path":"/tmp/a"}}}
/// ```
/// ```
/// HTTP/1.1 200 OK
/// Content-Type: text/event-stream
/// Mcp-Session-Id: 4f3c...
///
/// event: message
/// data: {"jsonrpc":"2.0","id":7,"result":{"content":[{"type":"text","text":"..."}]}}
/// ```
///
/// @see GatewayDispatcher for method handling
/// @see McpResponses for response framing
@Path("/mcp")
public class McpGatewayResource {

    private static final Logger LOG = Logger.getLogger(McpGatewayResource.class);

    private final GatewayDispatcher dispatcher;
    private final OriginPolicy originPolicy;
    private final JsonRpc jsonRpc;

    @Inject
    public McpGatewayResource(
            GatewayDispatcher dispatcher, OriginPolicy originPolicy, JsonRpc jsonRpc) {
        this.dispatcher = dispatcher;
        this.originPolicy = originPolicy;
        this.jsonRpc = jsonRpc;
    }

    /// Receives one JSON-RPC message for a backend.
    ///
    /// @param backendId backend identifier from the path
    /// @param origin `Origin` header, may be null
    /// @param accept `Accept` header, may be null
    /// @param sessionId `Mcp-Session-Id` header, may be null
    /// @param body raw JSON-RPC message
    /// @return HTTP reply
    @POST
    @Path("/{backendId}")
    @Consumes(MediaType.WILDCARD)
    public Uni<Response> post(
            @PathParam("backendId") String backendId,
            @HeaderParam("Origin") String origin,
            @HeaderParam(HttpHeaders.ACCEPT) String accept,
            @HeaderParam(McpResponses.SESSION_HEADER) String sessionId,
            String body) {

        if (!originPolicy.isAllowed(origin)) {
            LOG.warnv(
                    "Rejected origin {0} for {1}",
                    LogSanitizer.sanitize(origin),
                    LogSanitizer.sanitize(backendId));
            return Uni.createFrom().item(McpResponses.forbiddenOrigin(origin));
        }

        ObjectNode message;
        try {
            message = jsonRpc.parse(body != null ? body : "");
        } catch (McpException e) {
            LOG.debugv("Unreadable gateway message: {0}", e.getMessage());
            int code =
                    e.getCause() instanceof JsonProcessingException
                            ? JsonRpc.PARSE_ERROR
                            : JsonRpc.INVALID_REQUEST;
            return Uni.createFrom()
                    .item(
                            McpResponses.badRequest(
                                    jsonRpc.createErrorResponse(null, code, e.getMessage())));
        }

        String method = jsonRpc.extractMethod(message);
        if (jsonRpc.extractId(message).isEmpty()) {
            LOG.debugv(
                    "Accepted {0} for {1} without reply",
                    LogSanitizer.sanitize(method),
                    LogSanitizer.sanitize(backendId));
            return Uni.createFrom().item(McpResponses.accepted(sessionId));
        }

        LOG.infov(
                "Proxy request: backend={0}, method={1}",
                LogSanitizer.sanitize(backendId),
                LogSanitizer.sanitize(method));

        String replySession =
                "initialize".equals(method) ? UUID.randomUUID().toString() : sessionId;
        boolean useSse = McpResponses.acceptsEventStream(accept);
        return dispatcher
                .dispatch(backendId, message)
                .map(reply -> McpResponses.reply(reply, replySession, useSse));
    }

    /// Rejects server-initiated streaming.
    ///
    /// @param backendId backend identifier from the path
    /// @return `405 Method Not Allowed`
    @GET
    @Path("/{backendId}")
    public Response get(@PathParam("backendId") String backendId) {
        LOG.debugv("Rejected GET stream for {0}", LogSanitizer.sanitize(backendId));
        return McpResponses.methodNotAllowed();
    }
}
