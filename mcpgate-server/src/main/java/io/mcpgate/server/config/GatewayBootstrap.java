package io.mcpgate.server.config;

import io.mcpgate.server.gateway.ProxyRuntimeState;
import io.mcpgate.server.integration.IntegrationPortNotifier;
import io.mcpgate.server.service.ConnectionService;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.List;
import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// Publishes the gateway once Quarkus has bound its HTTP port.
///
/// Performs the following steps:
/// - Records `{running, port}` in {@link ProxyRuntimeState}
/// - Hands the port to every {@link IntegrationPortNotifier}; failures are logged only
/// - Connects enabled backends when `mcpgate.backends.auto-connect` is set
///
/// ### Execution Order
/// Runs during the Quarkus startup event. With `quarkus.http.port=0` the ephemeral port
/// chosen by the OS is published by Quarkus as the `quarkus.http.port` system property
/// before this observer runs.
///
/// @see ProxyRuntimeState for the published state
@ApplicationScoped
public class GatewayBootstrap {

    private static final Logger LOG = Logger.getLogger(GatewayBootstrap.class);

    private final ProxyRuntimeState runtimeState;
    private final List<IntegrationPortNotifier> notifiers;
    private final ConnectionService connectionService;
    private final boolean autoConnect;

    @Inject
    public GatewayBootstrap(
            ProxyRuntimeState runtimeState,
            Instance<IntegrationPortNotifier> notifiers,
            ConnectionService connectionService,
            @ConfigProperty(name = "mcpgate.backends.auto-connect", defaultValue = "false")
                    boolean autoConnect) {
        this(runtimeState, notifiers.stream().toList(), connectionService, autoConnect);
    }

    GatewayBootstrap(
            ProxyRuntimeState runtimeState,
            List<IntegrationPortNotifier> notifiers,
            ConnectionService connectionService,
            boolean autoConnect) {
        this.runtimeState = runtimeState;
        this.notifiers = List.copyOf(notifiers);
        this.connectionService = connectionService;
        this.autoConnect = autoConnect;
    }

    void onStart(@Observes StartupEvent ev) {
        start(boundPort());
    }

    /// Publishes the gateway on a bound port.
    ///
    /// @param port bound HTTP port, must be positive
    void start(int port) {
        runtimeState.markRunning(port);
        LOG.infov("MCP gateway listening on 127.0.0.1:{0}", String.valueOf(port));

        for (IntegrationPortNotifier notifier : notifiers) {
            try {
                notifier.portChanged(port);
            } catch (Exception e) {
                LOG.warnv(
                        "Failed to notify {0} of gateway port: {1}",
                        notifier.getClass().getSimpleName(),
                        e.getMessage());
            }
        }

        if (autoConnect) {
            connectionService
                    .connectEnabled()
                    .subscribe()
                    .with(
                            count -> LOG.infov("Auto-connected {0} server(s)", count),
                            failure -> LOG.errorv(failure, "Auto-connect failed"));
        }
    }

    private static int boundPort() {
        Integer published = Integer.getInteger("quarkus.http.port");
        if (published != null && published > 0) {
            return published;
        }
        return ConfigProvider.getConfig().getValue("quarkus.http.port", Integer.class);
    }
}
