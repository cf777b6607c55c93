package io.mcpgate.server.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpgate.core.backend.BackendConfig;
import io.mcpgate.core.exception.BackendConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jboss.logging.Logger;

/// Reads backend definitions from a JSON file.
///
/// The file holds an array of backend objects:
/// ```json
/// [
///   {"id": "files", "name": "filesystem", "enabled": true, "transport": "stdio",
///    "command": "npx", "args": ["-y", "@modelcontextprotocol/server-filesystem", "/tmp"],
///    "env": {}}
/// ]
/// ```
/// Unknown members are ignored and `transport` is matched case-insensitively.
public final class BackendConfigLoader {

    private static final Logger LOG = Logger.getLogger(BackendConfigLoader.class);

    private static final TypeReference<List<BackendConfig>> BACKEND_LIST =
            new TypeReference<>() {};

    private final ObjectMapper mapper;

    public BackendConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /// Loads backends from a file.
    ///
    /// @param file JSON file, not null
    /// @return backends in file order, never null
    /// @throws BackendConfigurationException if the file cannot be read, is not a backend
    ///     array, or repeats an id
    public List<BackendConfig> load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new BackendConfigurationException("Backends file not found: " + file);
        }
        List<BackendConfig> backends;
        try {
            backends = mapper.readValue(file.toFile(), BACKEND_LIST);
        } catch (IOException | IllegalArgumentException e) {
            throw new BackendConfigurationException(
                    "Failed to read backends file " + file + ": " + e.getMessage());
        }
        if (backends == null) {
            return List.of();
        }

        Set<String> ids = new HashSet<>();
        for (BackendConfig backend : backends) {
            if (!ids.add(backend.id())) {
                throw new BackendConfigurationException(
                        backend.id(), "Duplicate backend id in " + file);
            }
        }
        LOG.infov("Loaded {0} backend(s) from {1}", backends.size(), file);
        return List.copyOf(backends);
    }
}
