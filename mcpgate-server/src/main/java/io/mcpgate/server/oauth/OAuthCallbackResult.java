package io.mcpgate.server.oauth;

import java.util.Objects;

/// Authorization code captured from an OAuth redirect.
///
/// @param code authorization code, not null
/// @param state opaque state echoed by the authorization server, not null
public record OAuthCallbackResult(String code, String state) {

    public OAuthCallbackResult {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }
}
