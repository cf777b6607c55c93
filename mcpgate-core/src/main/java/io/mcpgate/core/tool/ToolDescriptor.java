package io.mcpgate.core.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A tool advertised by a backend MCP server.
///
/// Descriptors are replaced wholesale on every handshake or refresh; they are never edited
/// in place. The namespaced form used by aggregated listings is derived through
/// {@link #qualifiedName()} and never stored.
///
/// ### Contracts
/// - **Precondition**: `name`, `backendId` and `backendName` must not be null or blank
/// - **Postcondition**: `inputSchema` is an unmodifiable copy, never null
///
/// @param name tool name as reported by the backend, not null
/// @param title optional human-readable title, may be null
/// @param description optional description, may be null
/// @param inputSchema JSON schema of the tool's arguments, opaque to the gateway
/// @param backendId identifier of the owning backend, not null
/// @param backendName display name of the owning backend, not null
/// @see ToolNames for the namespacing format
public record ToolDescriptor(
        String name,
        String title,
        String description,
        Map<String, Object> inputSchema,
        String backendId,
        String backendName) {

    /// Compact constructor with validation.
    public ToolDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(backendId, "backendId must not be null");
        Objects.requireNonNull(backendName, "backendName must not be null");
        inputSchema =
                inputSchema != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema))
                        : Map.of("type", "object");
    }

    /// Returns the namespaced name `backendName.toolName`.
    ///
    /// @return qualified name, never null
    public String qualifiedName() {
        return ToolNames.qualify(backendName, name);
    }

    /// Returns a copy renamed to its namespaced form, for aggregated listings.
    ///
    /// @return namespaced descriptor, never null
    public ToolDescriptor namespaced() {
        return new ToolDescriptor(
                qualifiedName(), title, description, inputSchema, backendId, backendName);
    }
}
