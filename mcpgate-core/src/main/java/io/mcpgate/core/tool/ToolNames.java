package io.mcpgate.core.tool;

import java.util.Objects;
import java.util.Optional;

/// Namespacing of tool names across backends: `backendName.toolName`.
///
/// The backend part ends at the first dot, so tool names may themselves contain dots
/// (`github.repos.list` splits into `github` / `repos.list`).
public final class ToolNames {

    public static final char SEPARATOR = '.';

    private ToolNames() {}

    /// Builds a namespaced tool name.
    ///
    /// @param backendName owning backend display name, not null
    /// @param toolName tool name as reported by the backend, not null
    /// @return `backendName.toolName`, never null
    public static String qualify(String backendName, String toolName) {
        Objects.requireNonNull(backendName, "backendName must not be null");
        Objects.requireNonNull(toolName, "toolName must not be null");
        return backendName + SEPARATOR + toolName;
    }

    /// Splits a namespaced tool name.
    ///
    /// @param qualifiedName name of the form `backendName.toolName`, may be null
    /// @return the two parts, or empty if either part would be blank
    public static Optional<QualifiedToolName> parse(String qualifiedName) {
        if (qualifiedName == null) {
            return Optional.empty();
        }
        int dot = qualifiedName.indexOf(SEPARATOR);
        if (dot <= 0 || dot == qualifiedName.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(
                new QualifiedToolName(
                        qualifiedName.substring(0, dot), qualifiedName.substring(dot + 1)));
    }

    /// A namespaced tool name split into its parts.
    ///
    /// @param backendName owning backend display name, not null
    /// @param toolName tool name as reported by the backend, not null
    public record QualifiedToolName(String backendName, String toolName) {

        public QualifiedToolName {
            Objects.requireNonNull(backendName, "backendName must not be null");
            Objects.requireNonNull(toolName, "toolName must not be null");
        }
    }
}
