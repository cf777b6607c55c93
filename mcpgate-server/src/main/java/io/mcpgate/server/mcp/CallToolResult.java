package io.mcpgate.server.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;

/// Result of a `tools/call` request.
///
/// Content items are opaque JSON objects (`text`, `image`, `resource`, ...) forwarded
/// unchanged to gateway callers.
///
/// @param content content items returned by the tool, never null
/// @param isError whether the tool reported a failure, null when the backend omitted the flag
/// @param structuredContent structured output of the tool, may be null
public record CallToolResult(List<JsonNode> content, Boolean isError, JsonNode structuredContent) {

    public CallToolResult {
        content = content != null ? List.copyOf(content) : List.of();
    }

    /// Parses the `result` member of a `tools/call` response.
    ///
    /// @param result result node, not null
    /// @return parsed result, never null
    /// @throws McpException of kind `PROTOCOL` if `content` is missing or not an array
    public static CallToolResult fromJson(JsonNode result) throws McpException {
        JsonNode contentNode = result.get("content");
        if (contentNode == null || !contentNode.isArray()) {
            throw McpException.protocol("Failed to parse tool call result: missing content array");
        }
        List<JsonNode> items = new ArrayList<>(contentNode.size());
        contentNode.forEach(items::add);

        JsonNode errorFlag = result.get("isError");
        Boolean isError = errorFlag != null && errorFlag.isBoolean() ? errorFlag.asBoolean() : null;
        return new CallToolResult(items, isError, result.get("structuredContent"));
    }

    /// Returns whether the tool reported a failure.
    ///
    /// @return true only when the backend set `isError: true`
    public boolean failed() {
        return Boolean.TRUE.equals(isError);
    }

    /// Renders this result back into its wire shape.
    ///
    /// @param mapper mapper used to create nodes, not null
    /// @return `{content, isError?, structuredContent?}`
    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.putArray("content").addAll(content);
        if (isError != null) {
            node.put("isError", isError);
        }
        if (structuredContent != null && !structuredContent.isNull()) {
            node.set("structuredContent", structuredContent);
        }
        return node;
    }
}
