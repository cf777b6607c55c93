package io.mcpgate.server.validation;

/// Strips control characters from strings to prevent log injection.
///
/// Backend stderr, gateway request bodies and OAuth query parameters are all untrusted;
/// pass them through here before logging:
/// ```
/// LOG.infov("Proxy request: backend={0}", LogSanitizer.sanitize(backendId));
/// ```
public final class LogSanitizer {

    private LogSanitizer() {}

    /// Removes carriage-return and newline characters from the input.
    ///
    /// @param value the string to sanitize, may be null
    /// @return sanitized string, or {@code "null"} if input is null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        return value.replace("\r", "").replace("\n", "");
    }

    /// Sanitizes and truncates the input, marking truncation with an ellipsis.
    ///
    /// @param value the string to sanitize, may be null
    /// @param maxLength maximum number of characters kept, must be positive
    /// @return sanitized string of at most `maxLength` characters plus the marker
    public static String abbreviate(String value, int maxLength) {
        String sanitized = sanitize(value);
        if (sanitized.length() <= maxLength) {
            return sanitized;
        }
        return sanitized.substring(0, maxLength) + "...";
    }
}
