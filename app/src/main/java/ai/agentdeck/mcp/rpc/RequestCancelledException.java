package ai.agentdeck.mcp.rpc;

import ai.agentdeck.mcp.McpException;

/** A pending request was abandoned because its server stopped or its transport went away. */
public class RequestCancelledException extends McpException {
    public RequestCancelledException(String message) {
        super(message);
    }
}
