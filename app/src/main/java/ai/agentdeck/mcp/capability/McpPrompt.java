package ai.agentdeck.mcp.capability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record McpPrompt(String serverId, String name, @Nullable String description, List<Argument> arguments) {

    public McpPrompt {
        arguments = List.copyOf(arguments);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Argument(String name, @Nullable String description, boolean required) {}

    static McpPrompt fromWire(String serverId, JsonNode node) {
        var arguments = new ArrayList<Argument>();
        for (var arg : node.path("arguments")) {
            arguments.add(new Argument(
                    arg.path("name").asText(),
                    McpTool.textOrNull(arg, "description"),
                    arg.path("required").asBoolean(false)));
        }
        return new McpPrompt(serverId, node.path("name").asText(), McpTool.textOrNull(node, "description"), arguments);
    }
}
