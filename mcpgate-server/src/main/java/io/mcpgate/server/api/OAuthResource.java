package io.mcpgate.server.api;

import io.mcpgate.server.oauth.OAuthCallbackListener;
import io.mcpgate.server.oauth.OAuthCallbackSession;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST API for OAuth authorization-code capture.
///
/// A caller starts a listener, sends the user's browser to the authorization server with
/// the returned `redirectUri`, then polls until the code arrives.
///
/// ### Endpoints
/// | Method | Path | Description |
/// |--------|------|-------------|
/// | POST | `/api/v1/oauth/callback-listener` | Start a loopback callback listener |
/// | GET | `/api/v1/oauth/callback-listener/{port}` | Outcome of a started listener |
///
/// @see OAuthCallbackListener for listener lifetime and callback handling
@Path("/api/v1/oauth")
@Produces(MediaType.APPLICATION_JSON)
public class OAuthResource {

    private static final Logger LOG = Logger.getLogger(OAuthResource.class);

    private final OAuthCallbackListener listener;

    @Inject
    public OAuthResource(OAuthCallbackListener listener) {
        this.listener = listener;
    }

    /// Starts a callback listener.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"port": 53117, "redirectUri": "http://127.0.0.1:53117/oauth/callback"}
    /// ```
    @POST
    @Path("/callback-listener")
    public Uni<Map<String, Object>> start() {
        return listener.start()
                .map(
                        session -> {
                            LOG.infov(
                                    "Started OAuth callback listener on port {0}",
                                    String.valueOf(session.port()));
                            return Map.<String, Object>of(
                                    "port", session.port(), "redirectUri", session.redirectUri());
                        });
    }

    /// Reports the outcome of a listener.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"port": 53117, "status": "COMPLETED", "code": "abc", "state": "xyz"}
    /// ```
    /// `status` is `PENDING`, `COMPLETED` or `FAILED`; failures carry an `error` message.
    @GET
    @Path("/callback-listener/{port}")
    public Map<String, Object> status(@PathParam("port") int port) {
        OAuthCallbackSession session =
                listener.session(port)
                        .orElseThrow(
                                () ->
                                        new NotFoundException(
                                                "No OAuth callback listener on port " + port));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("port", port);
        response.put("status", session.status().name());
        session.completedResult()
                .ifPresent(
                        result -> {
                            response.put("code", result.code());
                            response.put("state", result.state());
                        });
        session.failureMessage().ifPresent(message -> response.put("error", message));
        return response;
    }
}
