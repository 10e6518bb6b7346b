package ai.agentdeck.mcp.manager;

import ai.agentdeck.mcp.ServerStatus;
import ai.agentdeck.mcp.config.McpScope;
import ai.agentdeck.mcp.config.TransportType;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

/** Read-only view of one configured server, safe to hand to a UI that polls. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerSnapshot(
        String id,
        String name,
        @Nullable String description,
        McpScope scope,
        TransportType transport,
        boolean disabled,
        ServerStatus status,
        @Nullable String lastError,
        int toolCount,
        int resourceCount,
        int promptCount,
        @Nullable ServerInfo serverInfo) {}
