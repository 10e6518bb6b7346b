package ai.agentdeck.mcp;

/** Base type for failures raised by the MCP client runtime. */
public class McpException extends Exception {
    public McpException(String message) {
        super(message);
    }

    public McpException(String message, Throwable cause) {
        super(message, cause);
    }
}
