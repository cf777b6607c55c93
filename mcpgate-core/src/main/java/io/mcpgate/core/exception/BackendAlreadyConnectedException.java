package io.mcpgate.core.exception;

import java.io.Serial;

/// Thrown when a connect is requested for a backend that is already connecting or connected.
public class BackendAlreadyConnectedException extends RuntimeException {
    @Serial private static final long serialVersionUID = -4410275138860152209L;

    public BackendAlreadyConnectedException(String backendId) {
        super("Server already connected: " + backendId);
    }
}
