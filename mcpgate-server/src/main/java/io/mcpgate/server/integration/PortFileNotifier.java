package io.mcpgate.server.integration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// Writes the gateway base URL to a well-known file.
///
/// AI tool integrations read `http://127.0.0.1:{port}/mcp` from the file configured by
/// `mcpgate.gateway.port-file`. The file is replaced atomically so readers never observe
/// a partial write. Without a configured file the port is only logged.
@ApplicationScoped
public class PortFileNotifier implements IntegrationPortNotifier {

    private static final Logger LOG = Logger.getLogger(PortFileNotifier.class);

    private final Optional<Path> portFile;

    @Inject
    public PortFileNotifier(
            @ConfigProperty(name = "mcpgate.gateway.port-file") Optional<String> portFile) {
        this.portFile = portFile.filter(p -> !p.isBlank()).map(Path::of);
    }

    @Override
    public void portChanged(int port) throws IOException {
        String baseUrl = baseUrl(port);
        if (portFile.isEmpty()) {
            LOG.infov("Gateway available at {0}", baseUrl);
            return;
        }

        Path target = portFile.get().toAbsolutePath();
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(temp, baseUrl + System.lineSeparator(), StandardCharsets.UTF_8);
        Files.move(
                temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOG.infov("Gateway available at {0}, written to {1}", baseUrl, target);
    }

    /// Returns the gateway base URL for a port.
    ///
    /// @param port bound port
    /// @return `http://127.0.0.1:{port}/mcp`
    static String baseUrl(int port) {
        return "http://127.0.0.1:" + port + "/mcp";
    }
}
