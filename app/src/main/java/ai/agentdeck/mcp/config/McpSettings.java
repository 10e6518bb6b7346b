package ai.agentdeck.mcp.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Typed view over the merged {@code settings} objects of all scopes.
 *
 * @param timeout request timeout override ({@code settings.timeout}, milliseconds)
 * @param maxOutputTokens upper bound on tool output handed to agents
 * @param enableToolSearch {@code true}, {@code false}, {@code "auto"} or a free-form mode
 * @param allowedServers when non-empty, only these ids are started by {@code startAll}
 * @param deniedServers ids that are never started
 */
public record McpSettings(
        @Nullable Duration timeout,
        @Nullable Integer maxOutputTokens,
        @Nullable String enableToolSearch,
        List<String> allowedServers,
        List<String> deniedServers) {

    public static final String TIMEOUT = "timeout";
    public static final String MAX_OUTPUT_TOKENS = "maxOutputTokens";
    public static final String ENABLE_TOOL_SEARCH = "enableToolSearch";
    public static final String ALLOWED_SERVERS = "allowedServers";
    public static final String DENIED_SERVERS = "deniedServers";

    public static McpSettings from(Map<String, Object> merged) {
        Duration timeout = null;
        if (merged.get(TIMEOUT) instanceof Number n && n.longValue() > 0) {
            timeout = Duration.ofMillis(n.longValue());
        }
        Integer maxOutputTokens = merged.get(MAX_OUTPUT_TOKENS) instanceof Number n ? n.intValue() : null;
        Object toolSearch = merged.get(ENABLE_TOOL_SEARCH);
        return new McpSettings(
                timeout,
                maxOutputTokens,
                toolSearch != null ? String.valueOf(toolSearch) : null,
                stringList(merged.get(ALLOWED_SERVERS)),
                stringList(merged.get(DENIED_SERVERS)));
    }

    /** Whether {@code serverId} may be started under the allow/deny lists. */
    public boolean permits(String serverId) {
        if (deniedServers.contains(serverId)) {
            return false;
        }
        return allowedServers.isEmpty() || allowedServers.contains(serverId);
    }

    private static List<String> stringList(@Nullable Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
