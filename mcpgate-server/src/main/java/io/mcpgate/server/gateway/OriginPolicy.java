package io.mcpgate.server.gateway;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// `Origin` gate for the gateway endpoints.
///
/// Browsers attach `Origin` to cross-site requests; non-browser MCP clients usually do
/// not. Rejecting unknown origins stops web pages from driving local backends through
/// DNS-rebinding or plain cross-origin POSTs.
///
/// ### Rules
/// | Origin | Decision |
/// |--------|----------|
/// | absent or empty | allow |
/// | `http://localhost`, `http://127.0.0.1`, `http://[::1]`, optionally `:port` | allow |
/// | starts with a trusted webview prefix (`tauri://`, `https://tauri.`) | allow |
/// | anything else | reject with `403` |
///
/// Trusted prefixes come from `mcpgate.gateway.allowed-origin-prefixes`.
@ApplicationScoped
public class OriginPolicy {

    private static final List<String> LOCALHOST_ORIGINS =
            List.of("http://localhost", "http://127.0.0.1", "http://[::1]");

    private final List<String> trustedPrefixes;

    @Inject
    public OriginPolicy(
            @ConfigProperty(
                            name = "mcpgate.gateway.allowed-origin-prefixes",
                            defaultValue = "tauri://,https://tauri.")
                    List<String> trustedPrefixes) {
        this.trustedPrefixes = List.copyOf(trustedPrefixes);
    }

    /// Decides whether a request with this `Origin` header may proceed.
    ///
    /// @param origin header value, may be null
    /// @return true if allowed
    public boolean isAllowed(String origin) {
        if (origin == null || origin.isEmpty()) {
            return true;
        }
        if (isLocalhost(origin)) {
            return true;
        }
        return trustedPrefixes.stream().anyMatch(origin::startsWith);
    }

    private static boolean isLocalhost(String origin) {
        for (String candidate : LOCALHOST_ORIGINS) {
            if (origin.equals(candidate)) {
                return true;
            }
            if (origin.startsWith(candidate) && origin.charAt(candidate.length()) == ':') {
                return true;
            }
        }
        return false;
    }
}
