package ai.agentdeck.mcp.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** On-disk shape of one scope file: {@code { "mcpServers": {...}, "settings": {...} }}. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record McpConfiguration(Map<String, ServerDefinition> mcpServers, Map<String, Object> settings) {

    public McpConfiguration {
        mcpServers = mcpServers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(mcpServers)) : Map.of();
        settings = settings != null ? Collections.unmodifiableMap(new LinkedHashMap<>(settings)) : Map.of();
    }

    public static McpConfiguration empty() {
        return new McpConfiguration(Map.of(), Map.of());
    }

    public @Nullable ServerDefinition server(String id) {
        return mcpServers.get(id);
    }
}
