package ai.agentdeck.mcp;

/** Raised when an operation names a server (or registry entry) id that is not known. */
public class ServerNotFoundException extends McpException {
    private final String serverId;

    public ServerNotFoundException(String serverId) {
        super("MCP server " + serverId + " not found");
        this.serverId = serverId;
    }

    public ServerNotFoundException(String serverId, String message) {
        super(message);
        this.serverId = serverId;
    }

    public String serverId() {
        return serverId;
    }
}
