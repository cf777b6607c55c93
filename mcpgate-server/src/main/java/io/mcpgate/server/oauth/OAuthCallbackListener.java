package io.mcpgate.server.oauth;

import io.mcpgate.server.mcp.McpException;
import io.mcpgate.server.validation.LogSanitizer;
import io.smallrye.mutiny.Uni;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.http.HttpServerRequest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// Short-lived loopback HTTP listener that captures an OAuth authorization code.
///
/// Each {@link #start()} binds a separate Vert.x HTTP server to `127.0.0.1` on an
/// ephemeral port. The browser is redirected to `/oauth/callback` on that port by the
/// authorization server; the first hit decides the session outcome.
///
/// ### Callback Handling
/// | Query | Outcome |
/// |-------|---------|
/// | `error` present | failure "Authorization denied: {error} - {description}" |
/// | `code` and `state` present | success |
/// | anything else | failure "Missing code or state in OAuth callback" |
///
/// The browser always receives the same confirmation page. Other paths get `404` and do
/// not complete the session. Without a callback the session fails after
/// `mcpgate.oauth.callback-timeout`. The server is closed once the outcome is decided.
///
/// The session exists before the port is bound, so a callback that arrives before
/// {@link #start()} emits still decides the outcome. A decided session stays queryable
/// through {@link #session(int)} for `mcpgate.oauth.session-retention` and is then
/// forgotten.
///
/// ### Usage
/// {@snippet :
/// listener.start()
///     .invoke(session -> openBrowser(authorizeUrl(session.redirectUri())))
///     .chain(OAuthCallbackSession::result)
///     .subscribe().with(result -> exchange(result.code(), result.state()));
/// }
///
/// @implNote Thread-safe. Sessions are independent of each other.
@ApplicationScoped
public class OAuthCallbackListener {

    private static final Logger LOG = Logger.getLogger(OAuthCallbackListener.class);

    public static final String CALLBACK_PATH = "/oauth/callback";

    static final String CONFIRMATION_PAGE =
            """
            <!DOCTYPE html>
            <html>
            <head><title>mcpgate</title></head>
            <body style="font-family: system-ui, sans-serif; display: flex; \
            justify-content: center; align-items: center; min-height: 100vh; margin: 0; \
            background: #1a1a2e; color: #e0e0e0;">
            <div style="text-align: center;">
            <h1 style="font-size: 1.5rem; margin-bottom: 0.5rem;">Authorization Complete</h1>
            <p>You can close this tab and return to mcpgate.</p>
            </div>
            </body>
            </html>
            """;

    private final Vertx vertx;
    private final Duration callbackTimeout;
    private final Duration sessionRetention;
    private final Map<Integer, OAuthCallbackSession> sessions = new ConcurrentHashMap<>();

    @Inject
    public OAuthCallbackListener(
            Vertx vertx,
            @ConfigProperty(name = "mcpgate.oauth.callback-timeout", defaultValue = "120s")
                    Duration callbackTimeout,
            @ConfigProperty(name = "mcpgate.oauth.session-retention", defaultValue = "5m")
                    Duration sessionRetention) {
        this.vertx = vertx;
        this.callbackTimeout = callbackTimeout;
        this.sessionRetention = sessionRetention;
    }

    /// Starts a listener on an ephemeral loopback port.
    ///
    /// @return Uni emitting the session once the port is bound
    /// @throws McpException (as failure) with kind `IO` if the port cannot be bound
    public Uni<OAuthCallbackSession> start() {
        HttpServerOptions options = new HttpServerOptions().setHost("127.0.0.1").setPort(0);
        HttpServer server = vertx.createHttpServer(options);
        OAuthCallbackSession session = new OAuthCallbackSession();
        server.requestHandler(request -> handle(session, request));

        return Uni.createFrom()
                .completionStage(() -> server.listen().toCompletionStage())
                .onFailure()
                .transform(
                        failure ->
                                new McpException(
                                        McpException.Kind.IO,
                                        "Failed to bind OAuth callback server: "
                                                + failure.getMessage(),
                                        failure))
                .map(
                        bound -> {
                            session.bind(bound.actualPort());
                            arm(session, bound);
                            return session;
                        });
    }

    /// Looks up a session started by this listener.
    ///
    /// @param port listener port, as returned by {@link OAuthCallbackSession#port()}
    /// @return the session, empty if none was started on that port
    public Optional<OAuthCallbackSession> session(int port) {
        return Optional.ofNullable(sessions.get(port));
    }

    private void arm(OAuthCallbackSession session, HttpServer server) {
        sessions.put(session.port(), session);
        long timerId =
                vertx.setTimer(
                        callbackTimeout.toMillis(),
                        id -> {
                            if (session.fail(McpException.oauth(timeoutMessage()))) {
                                LOG.debugv(
                                        "OAuth callback server on port {0} timed out",
                                        String.valueOf(session.port()));
                            }
                        });

        session.outcome()
                .whenComplete(
                        (result, failure) -> {
                            vertx.cancelTimer(timerId);
                            server.close()
                                    .onFailure(
                                            e ->
                                                    LOG.warnv(
                                                            "Failed to close OAuth callback"
                                                                    + " server: {0}",
                                                            e.getMessage()));
                            vertx.setTimer(
                                    Math.max(1, sessionRetention.toMillis()),
                                    id -> forget(session));
                        });

        LOG.infov(
                "OAuth callback server listening on 127.0.0.1:{0}",
                String.valueOf(session.port()));
    }

    private void forget(OAuthCallbackSession session) {
        if (sessions.remove(session.port(), session)) {
            LOG.debugv("Forgot OAuth session on port {0}", String.valueOf(session.port()));
        }
    }

    private void handle(OAuthCallbackSession session, HttpServerRequest request) {
        if (request.method() != HttpMethod.GET || !CALLBACK_PATH.equals(request.path())) {
            request.response().setStatusCode(404).end();
            return;
        }
        // Settle only after the page is flushed: completion closes the server
        request.response()
                .setStatusCode(200)
                .putHeader("Content-Type", "text/html; charset=utf-8")
                .end(CONFIRMATION_PAGE)
                .onComplete(sent -> settle(session, request));
    }

    private void settle(OAuthCallbackSession session, HttpServerRequest request) {
        String error = request.getParam("error");
        String code = request.getParam("code");
        String state = request.getParam("state");

        boolean decided;
        if (error != null) {
            String description =
                    Optional.ofNullable(request.getParam("error_description")).orElse("");
            decided =
                    session.fail(
                            McpException.oauth(
                                    "Authorization denied: " + error + " - " + description));
            LOG.warnv("OAuth authorization denied: {0}", LogSanitizer.sanitize(error));
        } else if (code != null && state != null) {
            decided = session.complete(new OAuthCallbackResult(code, state));
        } else {
            decided =
                    session.fail(McpException.oauth("Missing code or state in OAuth callback"));
        }
        if (!decided) {
            LOG.debugv(
                    "Ignoring late OAuth callback on port {0}", String.valueOf(session.port()));
        }
    }

    private String timeoutMessage() {
        return "OAuth callback timed out - no response received within "
                + describe(callbackTimeout);
    }

    static String describe(Duration duration) {
        long seconds = duration.toSeconds();
        if (seconds >= 60 && seconds % 60 == 0) {
            long minutes = seconds / 60;
            return minutes + (minutes == 1 ? " minute" : " minutes");
        }
        if (seconds >= 1) {
            return seconds + (seconds == 1 ? " second" : " seconds");
        }
        return duration.toMillis() + " ms";
    }
}
