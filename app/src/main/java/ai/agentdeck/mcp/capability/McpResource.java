package ai.agentdeck.mcp.capability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record McpResource(
        String serverId, String uri, String name, @Nullable String description, @Nullable String mimeType) {

    static McpResource fromWire(String serverId, JsonNode node) {
        var uri = node.path("uri").asText();
        var name = McpTool.textOrNull(node, "name");
        return new McpResource(
                serverId,
                uri,
                name != null ? name : uri,
                McpTool.textOrNull(node, "description"),
                McpTool.textOrNull(node, "mimeType"));
    }
}
