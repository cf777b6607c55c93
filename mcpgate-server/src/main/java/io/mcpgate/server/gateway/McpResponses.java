package io.mcpgate.server.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/// HTTP response shaping for MCP Streamable HTTP.
///
/// A JSON-RPC reply is returned either as plain `application/json` or, when the caller
/// accepts `text/event-stream`, as a single SSE `message` event:
/// ```
/// event: message
/// data: {"jsonrpc":"2.0","id":1,"result":{...}}
///
/// ```
/// The `Mcp-Session-Id` header is attached whenever a session id is in play.
public final class McpResponses {

    public static final String SESSION_HEADER = "Mcp-Session-Id";

    public static final String EVENT_STREAM = "text/event-stream";

    private McpResponses() {}

    /// Returns whether the caller can consume an SSE response.
    ///
    /// @param accept `Accept` header value, may be null
    /// @return true if it mentions `text/event-stream`
    public static boolean acceptsEventStream(String accept) {
        return accept != null && accept.contains(EVENT_STREAM);
    }

    /// Builds the reply in the format the caller asked for.
    ///
    /// @param body JSON-RPC response, not null
    /// @param sessionId session id to attach, may be null
    /// @param useSse whether to frame the body as an SSE event
    /// @return HTTP 200 response
    public static Response reply(JsonNode body, String sessionId, boolean useSse) {
        return useSse ? sse(body, sessionId) : json(body, sessionId);
    }

    /// Builds an `application/json` response.
    ///
    /// @param body JSON-RPC response, not null
    /// @param sessionId session id to attach, may be null
    /// @return HTTP 200 response
    public static Response json(JsonNode body, String sessionId) {
        return withSession(
                        Response.ok(body.toString(), MediaType.APPLICATION_JSON_TYPE), sessionId)
                .build();
    }

    /// Builds a `text/event-stream` response carrying one `message` event.
    ///
    /// @param body JSON-RPC response, not null
    /// @param sessionId session id to attach, may be null
    /// @return HTTP 200 response
    public static Response sse(JsonNode body, String sessionId) {
        String event = "event: message\ndata: " + body + "\n\n";
        return withSession(
                        Response.ok(event, EVENT_STREAM)
                                .header(HttpHeaders.CACHE_CONTROL, "no-cache"),
                        sessionId)
                .build();
    }

    /// Builds the `202 Accepted` reply for notifications and responses.
    ///
    /// @param sessionId session id to attach, may be null
    /// @return HTTP 202 response with an empty body
    public static Response accepted(String sessionId) {
        return withSession(Response.accepted(), sessionId).build();
    }

    /// Builds a `400 Bad Request` reply carrying a JSON-RPC error for an unreadable body.
    ///
    /// @param body JSON-RPC error response, not null
    /// @return HTTP 400 response
    public static Response badRequest(JsonNode body) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(body.toString())
                .type(MediaType.APPLICATION_JSON_TYPE)
                .build();
    }

    /// Builds the `403 Forbidden` reply for a rejected origin.
    ///
    /// @param origin the rejected `Origin` header value
    /// @return HTTP 403 response
    public static Response forbiddenOrigin(String origin) {
        return Response.status(Response.Status.FORBIDDEN)
                .entity("Origin not allowed: " + origin)
                .type(MediaType.TEXT_PLAIN_TYPE)
                .build();
    }

    /// Builds the `405 Method Not Allowed` reply for server-initiated streaming requests.
    ///
    /// @return HTTP 405 response advertising `POST`
    public static Response methodNotAllowed() {
        return Response.status(Response.Status.METHOD_NOT_ALLOWED)
                .header(HttpHeaders.ALLOW, "POST")
                .build();
    }

    private static Response.ResponseBuilder withSession(
            Response.ResponseBuilder builder, String sessionId) {
        return sessionId != null ? builder.header(SESSION_HEADER, sessionId) : builder;
    }
}
