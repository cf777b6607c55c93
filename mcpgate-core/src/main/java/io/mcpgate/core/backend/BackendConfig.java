package io.mcpgate.core.backend;

import io.mcpgate.core.exception.BackendConfigurationException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Static configuration of one backend MCP server.
///
/// Backends are addressed by {@code id} everywhere (catalog, connection registry, gateway
/// path segment). The {@code name} is the human-facing label and is what namespaced tool
/// names are prefixed with.
///
/// ### Contracts
/// - **Precondition**: `id` and `name` must not be null or blank
/// - **Postcondition**: collections are defensively copied and never null
///
/// ### Usage
/// {@snippet :
/// BackendConfig files = BackendConfig.stdio(
///     "files", "filesystem", "npx",
///     List.of("-y", "@modelcontextprotocol/server-filesystem", "/tmp"),
///     Map.of());
/// }
///
/// @param id stable backend identifier, not null
/// @param name display name used for tool namespacing, not null
/// @param enabled whether the backend takes part in auto-connect
/// @param transport how the backend is reached, defaults to {@link BackendTransport#STDIO}
/// @param command executable for stdio backends, may be null for HTTP backends
/// @param args command arguments, never null after construction
/// @param env environment overlay for the spawned process, never null after construction
/// @param url endpoint for HTTP backends, may be null
/// @param headers extra request headers for HTTP backends, never null after construction
/// @param tags free-form labels, never null after construction
public record BackendConfig(
        String id,
        String name,
        boolean enabled,
        BackendTransport transport,
        String command,
        List<String> args,
        Map<String, String> env,
        String url,
        Map<String, String> headers,
        List<String> tags) {

    /// Compact constructor with validation.
    public BackendConfig {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        transport = transport != null ? transport : BackendTransport.STDIO;
        args = args != null ? List.copyOf(args) : List.of();
        env = env != null ? Map.copyOf(env) : Map.of();
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    /// Creates an enabled stdio backend.
    ///
    /// @param id backend identifier, not null
    /// @param name display name, not null
    /// @param command executable to launch, not null
    /// @param args command arguments, may be null
    /// @param env environment overlay, may be null
    /// @return new configuration, never null
    public static BackendConfig stdio(
            String id, String name, String command, List<String> args, Map<String, String> env) {
        Objects.requireNonNull(command, "command must not be null");
        return new BackendConfig(
                id, name, true, BackendTransport.STDIO, command, args, env, null, null, null);
    }

    /// Checks that this backend can be launched as a stdio child process.
    ///
    /// @throws BackendConfigurationException if the transport is not stdio or no command is set
    public void requireLaunchable() {
        if (transport != BackendTransport.STDIO) {
            throw new BackendConfigurationException(
                    id, transport + " transport not yet implemented");
        }
        if (command == null || command.isBlank()) {
            throw new BackendConfigurationException(id, "No command specified");
        }
    }
}
