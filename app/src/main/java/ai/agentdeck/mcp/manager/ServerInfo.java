package ai.agentdeck.mcp.manager;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

/** What a server reported about itself in its {@code initialize} response. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerInfo(
        @Nullable String name, @Nullable String version, @Nullable String protocolVersion, JsonNode capabilities) {

    static ServerInfo fromInitializeResult(JsonNode result) {
        var info = result.path("serverInfo");
        return new ServerInfo(
                text(info, "name"), text(info, "version"), text(result, "protocolVersion"), result.path("capabilities"));
    }

    private static @Nullable String text(JsonNode node, String field) {
        var value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
