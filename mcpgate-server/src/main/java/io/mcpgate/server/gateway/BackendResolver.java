package io.mcpgate.server.gateway;

import java.util.Optional;

/// Maps the backend reference of an inbound gateway request to a backend identifier.
///
/// Keeps the dispatcher independent of the addressing scheme: one path per backend
/// (`/mcp/{backendId}`) or one shared path with namespaced tool names.
@FunctionalInterface
public interface BackendResolver {

    /// Resolves a backend reference.
    ///
    /// @param reference path segment or name taken from the request, may be null
    /// @return backend identifier, or empty if no configured backend matches
    Optional<String> resolve(String reference);
}
