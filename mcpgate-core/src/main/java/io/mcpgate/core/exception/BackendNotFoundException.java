package io.mcpgate.core.exception;

import java.io.Serial;

/// Thrown when a backend identifier or name does not match any configured backend.
public class BackendNotFoundException extends RuntimeException {
    @Serial private static final long serialVersionUID = 2817346650921873114L;

    private final String backendId;

    public BackendNotFoundException(String backendId) {
        super("Server not found: " + backendId);
        this.backendId = backendId;
    }

    public String getBackendId() {
        return backendId;
    }
}
