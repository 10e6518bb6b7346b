package ai.agentdeck.mcp.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/** Configuration tier. Reads merge with precedence {@code USER < PROJECT < LOCAL}. */
public enum McpScope {
    LOCAL,
    PROJECT,
    USER;

    /** Lookup order for reads and scope-less removal: highest precedence first. */
    public static final List<McpScope> LOOKUP_ORDER = List.of(LOCAL, PROJECT, USER);

    /** Merge order: later entries overwrite earlier ones. */
    public static final List<McpScope> MERGE_ORDER = List.of(USER, PROJECT, LOCAL);

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static @Nullable McpScope fromWireName(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "user" -> USER;
            case "project" -> PROJECT;
            case "local" -> LOCAL;
            default -> throw new IllegalArgumentException("Unknown MCP scope: " + value);
        };
    }
}
