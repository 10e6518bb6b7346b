package ai.agentdeck.mcp.registry;

import ai.agentdeck.mcp.config.McpScope;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Caller choices when turning a registry entry into a server definition.
 *
 * @param scope where the definition will be stored; {@code local} when null
 * @param envVars values the user supplied; only names the entry declares are used
 * @param customUrl replaces the remote URL advertised by the entry
 */
public record ServerConfigOptions(@Nullable McpScope scope, Map<String, String> envVars, @Nullable String customUrl) {

    public static final ServerConfigOptions DEFAULTS = new ServerConfigOptions(null, Map.of(), null);

    public ServerConfigOptions {
        envVars = envVars != null ? Map.copyOf(envVars) : Map.of();
    }

    public McpScope scopeOrDefault() {
        return scope != null ? scope : McpScope.LOCAL;
    }
}
