package ai.agentdeck.mcp.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.jetbrains.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerMetadata(
        @Nullable String category,
        @Nullable List<String> tags,
        @Nullable String author,
        @Nullable String version,
        @Nullable String homepage) {}
