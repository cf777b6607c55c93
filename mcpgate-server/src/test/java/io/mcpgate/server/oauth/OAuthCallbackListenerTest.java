package io.mcpgate.server.oauth;

import static io.mcpgate.server.mcp.McpTestSupport.eventually;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.mcpgate.server.mcp.McpException;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class OAuthCallbackListenerTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private Vertx vertx;
    private HttpClient http;
    private OAuthCallbackListener listener;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
        listener = new OAuthCallbackListener(vertx, Duration.ofSeconds(30), Duration.ofMinutes(5));
    }

    @AfterEach
    void tearDown() {
        vertx.close().toCompletionStage().toCompletableFuture().join();
    }

    private OAuthCallbackSession start() {
        return listener.start().await().atMost(WAIT);
    }

    private HttpResponse<String> get(OAuthCallbackSession session, String pathAndQuery)
            throws Exception {
        HttpRequest request =
                HttpRequest.newBuilder(
                                URI.create("http://127.0.0.1:" + session.port() + pathAndQuery))
                        .timeout(WAIT)
                        .GET()
                        .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private boolean refusesConnections(OAuthCallbackSession session) throws Exception {
        for (int attempt = 0; attempt < 100; attempt++) {
            try {
                get(session, "/oauth/callback?code=late&state=late");
            } catch (IOException e) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }

    @Nested
    class Binding {

        @Test
        void shouldBindEphemeralLoopbackPort() {
            OAuthCallbackSession session = start();

            assertThat(session.port()).isPositive();
            assertThat(session.redirectUri())
                    .isEqualTo("http://127.0.0.1:" + session.port() + "/oauth/callback");
            assertThat(session.status()).isEqualTo(OAuthCallbackSession.Status.PENDING);
            assertThat(listener.session(session.port())).containsSame(session);
        }

        @Test
        void shouldBindDistinctPortsPerSession() {
            OAuthCallbackSession first = start();
            OAuthCallbackSession second = start();

            assertThat(first.port()).isNotEqualTo(second.port());
        }

        @Test
        void shouldReportUnknownPort() {
            assertThat(listener.session(1)).isEmpty();
        }
    }

    @Nested
    class Callbacks {

        @Test
        void shouldCaptureCodeAndState() throws Exception {
            OAuthCallbackSession session = start();

            HttpResponse<String> response = get(session, "/oauth/callback?code=abc&state=xyz");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type"))
                    .hasValueSatisfying(type -> assertThat(type).startsWith("text/html"));
            assertThat(response.body()).contains("Authorization Complete");
            OAuthCallbackResult result = session.result().await().atMost(WAIT);
            assertThat(result).isEqualTo(new OAuthCallbackResult("abc", "xyz"));
            assertThat(session.status()).isEqualTo(OAuthCallbackSession.Status.COMPLETED);
            assertThat(session.completedResult()).contains(result);
        }

        @Test
        void shouldFailOnAuthorizationError() throws Exception {
            OAuthCallbackSession session = start();

            HttpResponse<String> response =
                    get(
                            session,
                            "/oauth/callback?error=access_denied"
                                    + "&error_description=User%20said%20no");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThatThrownBy(() -> session.result().await().atMost(WAIT))
                    .isInstanceOf(McpException.class)
                    .hasMessage("Authorization denied: access_denied - User said no");
            assertThat(session.status()).isEqualTo(OAuthCallbackSession.Status.FAILED);
            assertThat(session.failureMessage())
                    .contains("Authorization denied: access_denied - User said no");
        }

        @Test
        void shouldFailOnErrorWithoutDescription() throws Exception {
            OAuthCallbackSession session = start();

            get(session, "/oauth/callback?error=invalid_scope");

            assertThatThrownBy(() -> session.result().await().atMost(WAIT))
                    .hasMessage("Authorization denied: invalid_scope - ");
        }

        @Test
        void shouldFailWhenStateIsMissing() throws Exception {
            OAuthCallbackSession session = start();

            HttpResponse<String> response = get(session, "/oauth/callback?code=abc");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThatThrownBy(() -> session.result().await().atMost(WAIT))
                    .isInstanceOf(McpException.class)
                    .hasMessage("Missing code or state in OAuth callback")
                    .satisfies(
                            e ->
                                    assertThat(((McpException) e).getKind())
                                            .isEqualTo(McpException.Kind.OAUTH));
        }

        @Test
        void shouldIgnoreOtherPaths() throws Exception {
            OAuthCallbackSession session = start();

            HttpResponse<String> response = get(session, "/favicon.ico");

            assertThat(response.statusCode()).isEqualTo(404);
            assertThat(session.status()).isEqualTo(OAuthCallbackSession.Status.PENDING);
        }

        @Test
        void shouldCloseServerOnceDecided() throws Exception {
            OAuthCallbackSession session = start();
            get(session, "/oauth/callback?code=abc&state=xyz");
            session.result().await().atMost(WAIT);

            assertThat(refusesConnections(session)).isTrue();
            assertThat(session.completedResult().orElseThrow().code()).isEqualTo("abc");
        }
    }

    @Nested
    class CallbackBeforeBindCompletes {

        private final Vertx mockVertx = mock(Vertx.class);
        private final HttpServer server = mock(HttpServer.class);
        private final Promise<HttpServer> listening = Promise.promise();

        @SuppressWarnings("unchecked")
        private Handler<HttpServerRequest> startAndCaptureHandler(
                OAuthCallbackListener pending, AtomicReference<OAuthCallbackSession> started) {
            when(mockVertx.createHttpServer(any(HttpServerOptions.class))).thenReturn(server);
            when(server.listen()).thenReturn(listening.future());
            when(server.close()).thenReturn(Future.succeededFuture());
            when(server.actualPort()).thenReturn(54321);
            when(mockVertx.setTimer(anyLong(), any())).thenReturn(1L, 2L);

            pending.start().subscribe().with(started::set);

            ArgumentCaptor<Handler<HttpServerRequest>> handler =
                    ArgumentCaptor.forClass(Handler.class);
            verify(server).requestHandler(handler.capture());
            return handler.getValue();
        }

        private HttpServerRequest callback(String code, String state) {
            HttpServerResponse response = mock(HttpServerResponse.class);
            when(response.setStatusCode(anyInt())).thenReturn(response);
            when(response.putHeader(anyString(), anyString())).thenReturn(response);
            when(response.end(anyString())).thenReturn(Future.succeededFuture());

            HttpServerRequest request = mock(HttpServerRequest.class);
            when(request.method()).thenReturn(HttpMethod.GET);
            when(request.path()).thenReturn(OAuthCallbackListener.CALLBACK_PATH);
            when(request.response()).thenReturn(response);
            when(request.getParam("code")).thenReturn(code);
            when(request.getParam("state")).thenReturn(state);
            return request;
        }

        @Test
        void shouldKeepOutcomeOfCallbackServedBeforeStartEmits() {
            OAuthCallbackListener pending =
                    new OAuthCallbackListener(
                            mockVertx, Duration.ofSeconds(30), Duration.ofMinutes(5));
            AtomicReference<OAuthCallbackSession> started = new AtomicReference<>();
            Handler<HttpServerRequest> handler = startAndCaptureHandler(pending, started);

            handler.handle(callback("early", "s1"));
            assertThat(started.get()).isNull();
            listening.complete(server);

            OAuthCallbackSession session = started.get();
            assertThat(session).isNotNull();
            assertThat(session.port()).isEqualTo(54321);
            assertThat(session.status()).isEqualTo(OAuthCallbackSession.Status.COMPLETED);
            assertThat(session.completedResult())
                    .contains(new OAuthCallbackResult("early", "s1"));
            assertThat(pending.session(54321)).containsSame(session);
            verify(server).close();
        }
    }

    @Nested
    class Timeout {

        @Test
        void shouldFailWhenNoCallbackArrives() {
            OAuthCallbackListener quick =
                    new OAuthCallbackListener(vertx, Duration.ofMillis(300), Duration.ofMinutes(5));

            OAuthCallbackSession session = quick.start().await().atMost(WAIT);

            assertThatThrownBy(() -> session.result().await().atMost(WAIT))
                    .isInstanceOf(McpException.class)
                    .hasMessage("OAuth callback timed out - no response received within 300 ms");
            assertThat(quick.session(session.port()).orElseThrow().status())
                    .isEqualTo(OAuthCallbackSession.Status.FAILED);
        }

        @Test
        void shouldForgetDecidedSessionAfterRetention() throws Exception {
            OAuthCallbackListener shortLived =
                    new OAuthCallbackListener(
                            vertx, Duration.ofSeconds(30), Duration.ofMillis(200));
            OAuthCallbackSession session = shortLived.start().await().atMost(WAIT);
            int port = session.port();

            get(session, "/oauth/callback?code=abc&state=xyz");
            session.result().await().atMost(WAIT);

            assertThat(eventually(() -> shortLived.session(port).isEmpty(), WAIT)).isTrue();
            assertThat(session.completedResult()).isPresent();
        }

        @Test
        void shouldForgetTimedOutSessionAfterRetention() {
            OAuthCallbackListener shortLived =
                    new OAuthCallbackListener(
                            vertx, Duration.ofMillis(100), Duration.ofMillis(100));
            OAuthCallbackSession session = shortLived.start().await().atMost(WAIT);
            int port = session.port();

            assertThatThrownBy(() -> session.result().await().atMost(WAIT))
                    .isInstanceOf(McpException.class);
            assertThat(eventually(() -> shortLived.session(port).isEmpty(), WAIT)).isTrue();
        }

        @Test
        void shouldKeepPendingSessionQueryable() throws Exception {
            OAuthCallbackListener shortLived =
                    new OAuthCallbackListener(
                            vertx, Duration.ofSeconds(30), Duration.ofMillis(50));
            OAuthCallbackSession session = shortLived.start().await().atMost(WAIT);

            Thread.sleep(300);

            assertThat(shortLived.session(session.port())).containsSame(session);
        }

        @Test
        void shouldDescribeTimeoutInReadableUnits() {
            assertThat(OAuthCallbackListener.describe(Duration.ofSeconds(120)))
                    .isEqualTo("2 minutes");
            assertThat(OAuthCallbackListener.describe(Duration.ofSeconds(60)))
                    .isEqualTo("1 minute");
            assertThat(OAuthCallbackListener.describe(Duration.ofSeconds(90)))
                    .isEqualTo("90 seconds");
            assertThat(OAuthCallbackListener.describe(Duration.ofMillis(300)))
                    .isEqualTo("300 ms");
        }
    }
}
