package io.mcpgate.server.security;

import io.mcpgate.core.exception.BackendAlreadyConnectedException;
import io.mcpgate.core.exception.BackendConfigurationException;
import io.mcpgate.core.exception.BackendConnectCancelledException;
import io.mcpgate.core.exception.BackendNotFoundException;
import io.mcpgate.server.mcp.McpException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;
import org.jboss.logging.Logger;

/// Global exception mapper for the management API.
///
/// Domain exceptions keep their message, everything unexpected is reduced to a generic
/// message. Full stack traces are logged server-side only.
///
/// ### Status Mapping
/// | Exception | Status |
/// |-----------|--------|
/// | {@link BackendNotFoundException} | 404 |
/// | {@link BackendAlreadyConnectedException}, {@link BackendConnectCancelledException} | 409 |
/// | {@link BackendConfigurationException}, {@link IllegalArgumentException} | 400 |
/// | {@link McpException} | 502 |
/// | {@link WebApplicationException} | its own status |
/// | anything else | 500 |
///
/// ### Response Format
/// ```json
/// {"error": "Human-readable message", "status": 404}
/// ```
///
/// The MCP gateway endpoint never reaches this mapper: it answers every failure with a
/// JSON-RPC error.
///
/// @implNote Thread-safe. Stateless.
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @Override
    public Response toResponse(Throwable exception) {
        if (exception instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            String message = sanitize(status, wae.getMessage());

            if (status >= 500) {
                LOG.errorv(exception, "Server error: {0}", message);
            } else {
                LOG.debugv("Client error {0}: {1}", status, message);
            }
            return build(status, message);
        }

        int status = statusOf(exception);
        if (status == 500) {
            LOG.errorv(exception, "Unhandled exception: {0}", exception.getMessage());
            return build(500, "Internal server error");
        }

        LOG.debugv("Request failed with {0}: {1}", status, exception.getMessage());
        return build(status, exception.getMessage());
    }

    private static int statusOf(Throwable exception) {
        if (exception instanceof BackendNotFoundException) {
            return 404;
        }
        if (exception instanceof BackendAlreadyConnectedException
                || exception instanceof BackendConnectCancelledException) {
            return 409;
        }
        if (exception instanceof BackendConfigurationException
                || exception instanceof IllegalArgumentException) {
            return 400;
        }
        if (exception instanceof McpException) {
            return 502;
        }
        return 500;
    }

    private static Response build(int status, String message) {
        String error = message != null ? message : "Request failed";
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", error, "status", status))
                .build();
    }

    private static String sanitize(int status, String raw) {
        return switch (status) {
            case 400 -> raw != null ? raw : "Bad request";
            case 404 -> "Resource not found";
            case 405 -> "Method not allowed";
            case 409 -> "Conflict";
            case 415 -> "Unsupported media type";
            default -> {
                if (status >= 500) yield "Internal server error";
                yield raw != null ? raw : "Request failed";
            }
        };
    }
}
