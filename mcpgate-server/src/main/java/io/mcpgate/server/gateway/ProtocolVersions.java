package io.mcpgate.server.gateway;

import java.util.List;

/// MCP protocol versions the gateway speaks, newest first.
public final class ProtocolVersions {

    public static final List<String> SUPPORTED = List.of("2025-06-18", "2025-03-26", "2024-11-05");

    public static final String LATEST = SUPPORTED.get(0);

    private ProtocolVersions() {}

    /// Picks the version to answer an `initialize` with.
    ///
    /// @param requested version declared by the caller, may be null or empty
    /// @return `requested` if supported, otherwise {@link #LATEST}
    public static String negotiate(String requested) {
        return requested != null && SUPPORTED.contains(requested) ? requested : LATEST;
    }
}
