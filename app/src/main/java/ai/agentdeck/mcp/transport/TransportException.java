package ai.agentdeck.mcp.transport;

import ai.agentdeck.mcp.McpException;

/** Spawn, connect or delivery failure of a transport. Puts the owning server into the error state. */
public class TransportException extends McpException {
    private final int statusCode;

    public TransportException(String message) {
        this(message, -1);
    }

    public TransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status code when the failure was a non-2xx response, otherwise -1. */
    public int statusCode() {
        return statusCode;
    }
}
