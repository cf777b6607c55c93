package io.mcpgate.server.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mcpgate.core.backend.BackendCatalog;
import io.mcpgate.core.backend.BackendConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// CDI configuration for beans that are not CDI-managed themselves.
///
/// This class produces:
/// - The shared {@link ObjectMapper} used for JSON-RPC, REST bodies and backend files
/// - The {@link BackendCatalog}, seeded from `mcpgate.backends.file` when set
@ApplicationScoped
public class ServerConfiguration {

    private static final Logger LOG = Logger.getLogger(ServerConfiguration.class);

    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return createMapper();
    }

    /// Produces the backend catalog.
    ///
    /// @param mapper shared mapper, not null
    /// @param backendsFile optional path of a JSON backend list
    /// @return catalog holding the configured backends, all `DISCONNECTED`
    /// @throws io.mcpgate.core.exception.BackendConfigurationException if the file is
    ///     unreadable
    @Produces
    @Singleton
    public BackendCatalog backendCatalog(
            ObjectMapper mapper,
            @ConfigProperty(name = "mcpgate.backends.file") Optional<String> backendsFile) {
        List<BackendConfig> initial =
                backendsFile
                        .filter(file -> !file.isBlank())
                        .map(file -> new BackendConfigLoader(mapper).load(Path.of(file)))
                        .orElse(List.of());
        if (initial.isEmpty()) {
            LOG.info("No backends configured at startup");
        }
        return new BackendCatalog(initial);
    }

    /// Creates the mapper configuration shared by every JSON surface.
    ///
    /// @return new mapper, never null
    public static ObjectMapper createMapper() {
        return JsonMapper.builder()
                .addModule(new Jdk8Module())
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }
}
