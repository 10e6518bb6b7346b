package ai.agentdeck.mcp;

public class ServerNotRunningException extends McpException {
    public ServerNotRunningException(String serverId, ServerStatus status) {
        super("MCP server " + serverId + " is not running (status: " + status.wireName() + ")");
    }
}
