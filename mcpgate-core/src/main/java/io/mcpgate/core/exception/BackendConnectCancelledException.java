package io.mcpgate.core.exception;

import java.io.Serial;

/// Thrown when a connect finishes after the backend was disconnected, removed or
/// reconnected. The freshly started connection has already been discarded.
public class BackendConnectCancelledException extends RuntimeException {
    @Serial private static final long serialVersionUID = 6093512784311094528L;

    public BackendConnectCancelledException(String backendId) {
        super("Connect to server was cancelled: " + backendId);
    }
}
