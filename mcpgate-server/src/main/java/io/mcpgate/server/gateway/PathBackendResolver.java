package io.mcpgate.server.gateway;

import io.mcpgate.core.backend.BackendCatalog;
import io.mcpgate.core.backend.BackendState;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Optional;

/// Resolves the `{backendId}` path segment of `/mcp/{backendId}` against the catalog.
@ApplicationScoped
public class PathBackendResolver implements BackendResolver {

    private final BackendCatalog catalog;

    @Inject
    public PathBackendResolver(BackendCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Optional<String> resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        return catalog.find(reference).map(BackendState::id);
    }
}
