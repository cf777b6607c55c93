package io.mcpgate.server.service;

import static io.mcpgate.server.mcp.McpTestSupport.STARTUP;
import static io.mcpgate.server.mcp.McpTestSupport.eventually;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpgate.core.backend.BackendCatalog;
import io.mcpgate.core.backend.BackendConfig;
import io.mcpgate.core.backend.BackendState;
import io.mcpgate.core.backend.BackendStatus;
import io.mcpgate.core.backend.BackendTransport;
import io.mcpgate.core.exception.BackendAlreadyConnectedException;
import io.mcpgate.core.exception.BackendConnectCancelledException;
import io.mcpgate.core.exception.BackendNotFoundException;
import io.mcpgate.core.tool.ToolDescriptor;
import io.mcpgate.server.config.ServerConfiguration;
import io.mcpgate.server.mcp.CallToolResult;
import io.mcpgate.server.mcp.ConnectionRegistry;
import io.mcpgate.server.mcp.McpClient;
import io.mcpgate.server.mcp.McpClientFactory;
import io.mcpgate.server.mcp.McpException;
import io.mcpgate.server.mcp.McpTestSupport;
import io.mcpgate.server.mcp.StdioMcpClientFactory;
import io.mcpgate.server.service.ConnectionService.ConnectionInfo;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ConnectionServiceTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final ObjectMapper mapper = ServerConfiguration.createMapper();

    private BackendCatalog catalog;
    private ConnectionRegistry registry;
    private McpClientFactory factory;
    private ConnectionService service;

    @BeforeEach
    void setUp() {
        catalog =
                new BackendCatalog(
                        List.of(
                                BackendConfig.stdio("files", "filesystem", "npx", null, null),
                                new BackendConfig(
                                        "git",
                                        "git",
                                        false,
                                        BackendTransport.STDIO,
                                        "uvx",
                                        null,
                                        null,
                                        null,
                                        null,
                                        null)));
        registry = new ConnectionRegistry();
        factory = mock(McpClientFactory.class);
        service = new ConnectionService(catalog, registry, factory);
    }

    @AfterEach
    void tearDown() {
        registry.closeAll();
    }

    private McpClient client(String id, String name, String... tools) {
        McpClient client = mock(McpClient.class);
        when(client.isAlive()).thenReturn(true);
        when(client.backendId()).thenReturn(id);
        when(client.backendName()).thenReturn(name);
        when(client.childProcessId()).thenReturn(OptionalLong.of(4242));
        when(client.serverInfo()).thenReturn(mapper.createObjectNode().put("name", name));
        List<ToolDescriptor> descriptors =
                Arrays.stream(tools)
                        .map(tool -> new ToolDescriptor(tool, null, null, null, id, name))
                        .toList();
        when(client.tools()).thenReturn(descriptors);
        return client;
    }

    private ConnectionInfo connect(String id) {
        return service.connect(id).await().atMost(WAIT);
    }

    @Nested
    class Connect {

        @Test
        void shouldRegisterClientAndMarkConnected() {
            McpClient client = client("files", "filesystem", "read_file", "write_file");
            when(factory.connect(any())).thenReturn(Uni.createFrom().item(client));

            ConnectionInfo info = connect("files");

            assertThat(info)
                    .isEqualTo(
                            new ConnectionInfo(
                                    "files", true, 4242L, 2, client.serverInfo()));
            assertThat(catalog.status("files")).isEqualTo(BackendStatus.CONNECTED);
            assertThat(catalog.find("files").orElseThrow().lastConnected()).isNotNull();
            assertThat(registry.get("files")).contains(client);
        }

        @Test
        void shouldMarkErrorWhenFactoryFails() {
            when(factory.connect(any()))
                    .thenReturn(
                            Uni.createFrom()
                                    .failure(
                                            McpException.protocol(
                                                    "Failed to initialize MCP session")));

            assertThatThrownBy(() -> connect("files"))
                    .isInstanceOf(McpException.class)
                    .hasMessageContaining("Failed to initialize MCP session");

            BackendState state = catalog.find("files").orElseThrow();
            assertThat(state.status()).isEqualTo(BackendStatus.ERROR);
            assertThat(state.lastError()).contains("Failed to initialize MCP session");
            assertThat(registry.size()).isZero();
        }

        @Test
        void shouldAllowReconnectAfterError() {
            McpClient client = client("files", "filesystem");
            when(factory.connect(any()))
                    .thenReturn(Uni.createFrom().failure(McpException.protocol("boom")))
                    .thenReturn(Uni.createFrom().item(client));

            assertThatThrownBy(() -> connect("files")).isInstanceOf(McpException.class);
            connect("files");

            BackendState state = catalog.find("files").orElseThrow();
            assertThat(state.status()).isEqualTo(BackendStatus.CONNECTED);
            assertThat(state.lastError()).isNull();
        }

        @Test
        void shouldRejectConnectWhenAlreadyConnected() {
            when(factory.connect(any()))
                    .thenReturn(Uni.createFrom().item(client("files", "filesystem")));
            connect("files");

            assertThatThrownBy(() -> connect("files"))
                    .isInstanceOf(BackendAlreadyConnectedException.class);
            verify(factory).connect(any());
        }

        @Test
        void shouldRejectUnknownBackend() {
            assertThatThrownBy(() -> connect("nope"))
                    .isInstanceOf(BackendNotFoundException.class);
            verify(factory, never()).connect(any());
        }

        @Test
        void shouldMarkDisconnectedWhenProcessExits() {
            McpClient client = client("files", "filesystem");
            when(factory.connect(any())).thenReturn(Uni.createFrom().item(client));
            connect("files");

            ArgumentCaptor<Runnable> onExit = ArgumentCaptor.forClass(Runnable.class);
            verify(client).onTerminated(onExit.capture());
            onExit.getValue().run();

            assertThat(catalog.status("files")).isEqualTo(BackendStatus.DISCONNECTED);
            assertThat(registry.ids()).isEmpty();
        }

        @Test
        void shouldIgnoreExitOfReplacedClient() {
            McpClient first = client("files", "filesystem");
            McpClient second = client("files", "filesystem");
            when(factory.connect(any()))
                    .thenReturn(Uni.createFrom().item(first))
                    .thenReturn(Uni.createFrom().item(second));
            connect("files");
            ArgumentCaptor<Runnable> firstExit = ArgumentCaptor.forClass(Runnable.class);
            verify(first).onTerminated(firstExit.capture());
            service.disconnect("files");
            connect("files");

            firstExit.getValue().run();

            assertThat(catalog.status("files")).isEqualTo(BackendStatus.CONNECTED);
            assertThat(registry.get("files")).contains(second);
        }
    }

    @Nested
    class CancelledConnect {

        private final CompletableFuture<McpClient> handshake = new CompletableFuture<>();

        private UniAssertSubscriber<ConnectionInfo> startPendingConnect() {
            when(factory.connect(any())).thenReturn(Uni.createFrom().completionStage(handshake));
            UniAssertSubscriber<ConnectionInfo> subscriber =
                    service.connect("files")
                            .subscribe()
                            .withSubscriber(UniAssertSubscriber.create());
            assertThat(catalog.status("files")).isEqualTo(BackendStatus.CONNECTING);
            return subscriber;
        }

        @Test
        void shouldDiscardHandshakeThatFinishesAfterDisconnect() {
            UniAssertSubscriber<ConnectionInfo> subscriber = startPendingConnect();
            McpClient late = client("files", "filesystem", "read_file");

            service.disconnect("files");
            handshake.complete(late);

            subscriber.awaitFailure().assertFailedWith(BackendConnectCancelledException.class);
            verify(late).shutdown();
            verify(late, never()).onTerminated(any());
            assertThat(catalog.status("files")).isEqualTo(BackendStatus.DISCONNECTED);
            assertThat(registry.ids()).isEmpty();
            assertThat(service.connectionInfo("files").connected()).isFalse();
        }

        @Test
        void shouldKeepNewerConnectWhenStaleHandshakeFinishes() {
            UniAssertSubscriber<ConnectionInfo> stale = startPendingConnect();
            McpClient staleClient = client("files", "filesystem");
            McpClient current = client("files", "filesystem");

            service.disconnect("files");
            when(factory.connect(any())).thenReturn(Uni.createFrom().item(current));
            connect("files");
            handshake.complete(staleClient);

            stale.awaitFailure().assertFailedWith(BackendConnectCancelledException.class);
            verify(staleClient).shutdown();
            verify(current, never()).shutdown();
            assertThat(catalog.status("files")).isEqualTo(BackendStatus.CONNECTED);
            assertThat(registry.get("files")).contains(current);
        }

        @Test
        void shouldNotRecordErrorForHandshakeFailingAfterDisconnect() {
            UniAssertSubscriber<ConnectionInfo> subscriber = startPendingConnect();

            service.disconnect("files");
            handshake.completeExceptionally(McpException.transportClosed("terminated"));

            subscriber.awaitFailure().assertFailedWith(McpException.class);
            BackendState state = catalog.find("files").orElseThrow();
            assertThat(state.status()).isEqualTo(BackendStatus.DISCONNECTED);
            assertThat(state.lastError()).isNull();
        }

        @Test
        void shouldDiscardHandshakeThatFinishesAfterRemoval() {
            UniAssertSubscriber<ConnectionInfo> subscriber = startPendingConnect();
            McpClient late = client("files", "filesystem");

            service.removeBackend("files");
            handshake.complete(late);

            subscriber.awaitFailure().assertFailedWith(BackendConnectCancelledException.class);
            verify(late).shutdown();
            assertThat(catalog.find("files")).isEmpty();
            assertThat(registry.ids()).isEmpty();
        }
    }

    @Nested
    class Lifecycle {

        @Test
        void shouldShutDownClientOnDisconnect() {
            McpClient client = client("files", "filesystem");
            when(factory.connect(any())).thenReturn(Uni.createFrom().item(client));
            connect("files");

            service.disconnect("files");

            verify(client).shutdown();
            assertThat(catalog.status("files")).isEqualTo(BackendStatus.DISCONNECTED);
            assertThat(service.connectionInfo("files"))
                    .isEqualTo(new ConnectionInfo("files", false, null, 0, null));
        }

        @Test
        void shouldTolerateDisconnectOfIdleBackend() {
            service.disconnect("files");

            assertThat(catalog.status("files")).isEqualTo(BackendStatus.DISCONNECTED);
        }

        @Test
        void shouldRejectDisconnectOfUnknownBackend() {
            assertThatThrownBy(() -> service.disconnect("nope"))
                    .isInstanceOf(BackendNotFoundException.class);
        }

        @Test
        void shouldRemoveConnectedBackend() {
            McpClient client = client("files", "filesystem");
            when(factory.connect(any())).thenReturn(Uni.createFrom().item(client));
            connect("files");

            service.removeBackend("files");

            verify(client).shutdown();
            assertThat(catalog.find("files")).isEmpty();
            assertThat(registry.ids()).isEmpty();
        }

        @Test
        void shouldUpdateConfigurationForNextConnect() {
            McpClient client = client("files", "filesystem");
            when(factory.connect(any())).thenReturn(Uni.createFrom().item(client));
            connect("files");

            BackendState updated =
                    service.updateBackend(
                            "files",
                            BackendConfig.stdio("files", "fs", "node", List.of("fs.js"), null));

            assertThat(updated.config().command()).isEqualTo("node");
            assertThat(updated.status()).isEqualTo(BackendStatus.CONNECTED);
            verify(client, never()).shutdown();

            service.disconnect("files");
            connect("files");
            ArgumentCaptor<BackendConfig> used = ArgumentCaptor.forClass(BackendConfig.class);
            verify(factory, times(2)).connect(used.capture());
            assertThat(used.getAllValues())
                    .extracting(BackendConfig::command)
                    .containsExactly("npx", "node");
        }

        @Test
        void shouldRejectUpdateWithMismatchedId() {
            assertThatThrownBy(
                            () ->
                                    service.updateBackend(
                                            "files",
                                            BackendConfig.stdio("git", "git", "uvx", null, null)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Server id 'git' does not match path id 'files'");
            assertThat(catalog.find("files").orElseThrow().config().command()).isEqualTo("npx");
        }

        @Test
        void shouldRejectUpdateOfUnknownBackend() {
            assertThatThrownBy(
                            () ->
                                    service.updateBackend(
                                            "web",
                                            BackendConfig.stdio("web", "fetch", "uvx", null, null)))
                    .isInstanceOf(BackendNotFoundException.class);
        }

        @Test
        void shouldAddBackendAsDisconnected() {
            service.addBackend(BackendConfig.stdio("web", "fetch", "uvx", List.of(), null));

            assertThat(service.listBackends())
                    .extracting(BackendState::id)
                    .containsExactly("files", "git", "web");
            assertThat(catalog.status("web")).isEqualTo(BackendStatus.DISCONNECTED);
        }

        @Test
        void shouldConnectOnlyEnabledBackends() {
            when(factory.connect(any()))
                    .thenAnswer(
                            invocation -> {
                                BackendConfig config = invocation.getArgument(0);
                                return Uni.createFrom()
                                        .item(client(config.id(), config.name()));
                            });

            int connected = service.connectEnabled().await().atMost(WAIT);

            assertThat(connected).isEqualTo(1);
            assertThat(catalog.status("files")).isEqualTo(BackendStatus.CONNECTED);
            assertThat(catalog.status("git")).isEqualTo(BackendStatus.DISCONNECTED);
        }

        @Test
        void shouldCountOnlySuccessfulAutoConnects() {
            catalog.add(BackendConfig.stdio("web", "fetch", "uvx", null, null));
            when(factory.connect(any()))
                    .thenAnswer(
                            invocation -> {
                                BackendConfig config = invocation.getArgument(0);
                                if (config.id().equals("web")) {
                                    return Uni.createFrom()
                                            .failure(McpException.protocol("handshake failed"));
                                }
                                return Uni.createFrom()
                                        .item(client(config.id(), config.name()));
                            });

            int connected = service.connectEnabled().await().atMost(WAIT);

            assertThat(connected).isEqualTo(1);
            assertThat(catalog.status("web")).isEqualTo(BackendStatus.ERROR);
        }
    }

    @Nested
    class Tools {

        @BeforeEach
        void connectBoth() {
            McpClient files = client("files", "filesystem", "read_file");
            McpClient git = client("git", "git", "status", "log");
            when(factory.connect(any()))
                    .thenReturn(Uni.createFrom().item(files))
                    .thenReturn(Uni.createFrom().item(git));
            connect("files");
            connect("git");
        }

        @Test
        void shouldListToolsOfOneBackend() {
            assertThat(service.listTools("git"))
                    .extracting(ToolDescriptor::name)
                    .containsExactly("status", "log");
        }

        @Test
        void shouldListAllToolsNamespaced() {
            assertThat(service.listAllTools())
                    .extracting(ToolDescriptor::name)
                    .containsExactly("filesystem.read_file", "git.status", "git.log");
        }

        @Test
        void shouldReturnNoToolsForDisconnectedBackend() {
            service.disconnect("git");

            assertThat(service.listTools("git")).isEmpty();
        }

        @Test
        void shouldRouteQualifiedCallByBackendName() {
            McpClient files = registry.get("files").orElseThrow();
            ObjectNode arguments = mapper.createObjectNode().put("path", "/tmp/a");
            CallToolResult result = new CallToolResult(List.of(), false, null);
            when(files.callTool("read_file", arguments))
                    .thenReturn(Uni.createFrom().item(result));

            CallToolResult actual =
                    service.callQualifiedTool("filesystem.read_file", arguments)
                            .await()
                            .atMost(WAIT);

            assertThat(actual).isSameAs(result);
        }

        @Test
        void shouldRejectUnqualifiedToolName() {
            assertThatThrownBy(
                            () ->
                                    service.callQualifiedTool("read_file", null)
                                            .await()
                                            .atMost(WAIT))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage(
                            "Tool name must be namespaced as 'serverName.toolName', got: "
                                    + "read_file");
        }

        @Test
        void shouldRejectQualifiedCallToUnknownBackend() {
            assertThatThrownBy(
                            () -> service.callQualifiedTool("web.fetch", null).await().atMost(WAIT))
                    .isInstanceOf(BackendNotFoundException.class);
        }

        @Test
        void shouldRejectDirectCallToDisconnectedBackend() {
            service.disconnect("git");

            assertThatThrownBy(() -> service.callTool("git", "status", null).await().atMost(WAIT))
                    .isInstanceOf(BackendNotFoundException.class);
        }
    }

    @Nested
    class AgainstStubServer {

        private ConnectionService stubService;

        @BeforeEach
        void setUpStub() {
            catalog = new BackendCatalog(List.of(McpTestSupport.stubBackend("stub", "stub")));
            stubService =
                    new ConnectionService(
                            catalog,
                            registry,
                            new StdioMcpClientFactory(
                                    McpTestSupport.jsonRpc(),
                                    Duration.ofSeconds(20),
                                    Duration.ofSeconds(2),
                                    true,
                                    "mcpgate-test",
                                    "0.0.1"));
        }

        @Test
        void shouldConnectCallAndObserveExit() {
            ConnectionInfo info = stubService.connect("stub").await().atMost(STARTUP);
            assertThat(info.connected()).isTrue();
            assertThat(info.childPid()).isNotNull();
            assertThat(info.serverInfo().path("name").asText()).isEqualTo("stub");

            ObjectNode arguments = mapper.createObjectNode().put("x", 1);
            CallToolResult echoed =
                    stubService.callQualifiedTool("stub.echo", arguments).await().atMost(STARTUP);
            assertThat(echoed.content().get(0).path("text").asText()).isEqualTo("{\"x\":1}");

            AtomicReference<Throwable> exitFailure = new AtomicReference<>();
            stubService.callTool("stub", "exit", null)
                    .subscribe()
                    .with(ignored -> {}, exitFailure::set);

            assertThat(
                            eventually(
                                    () -> catalog.status("stub") == BackendStatus.DISCONNECTED,
                                    STARTUP))
                    .isTrue();
            assertThat(eventually(() -> exitFailure.get() != null, STARTUP)).isTrue();
            assertThat(registry.ids()).isEmpty();
        }

        @Test
        void shouldRecordSpawnFailure() {
            catalog.add(
                    BackendConfig.stdio(
                            "missing", "missing", "/nonexistent/mcp-server", null, null));

            assertThatThrownBy(() -> stubService.connect("missing").await().atMost(STARTUP))
                    .isInstanceOf(McpException.class);

            assertThat(catalog.status("missing")).isEqualTo(BackendStatus.ERROR);
            assertThat(catalog.find("missing").orElseThrow().lastError())
                    .contains("/nonexistent/mcp-server");
        }
    }
}
