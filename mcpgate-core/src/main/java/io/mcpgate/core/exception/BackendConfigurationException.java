package io.mcpgate.core.exception;

import java.io.Serial;

/// Thrown when a backend's configuration is invalid for the requested operation.
public class BackendConfigurationException extends RuntimeException {
    @Serial private static final long serialVersionUID = 6093154428843511872L;

    public BackendConfigurationException(String backendId, String message) {
        super("Invalid configuration for server " + backendId + ": " + message);
    }

    public BackendConfigurationException(String message) {
        super(message);
    }
}
