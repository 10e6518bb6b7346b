package ai.agentdeck.mcp.capability;

import ai.agentdeck.util.Json;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

/** A tool advertised by a server in its {@code tools/list} response. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record McpTool(String serverId, String name, @Nullable String description, JsonNode inputSchema) {

    static McpTool fromWire(String serverId, JsonNode node) {
        var schema = node.get("inputSchema");
        return new McpTool(
                serverId,
                node.path("name").asText(),
                textOrNull(node, "description"),
                schema != null && !schema.isNull() ? schema : Json.object());
    }

    static @Nullable String textOrNull(JsonNode node, String field) {
        var value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
