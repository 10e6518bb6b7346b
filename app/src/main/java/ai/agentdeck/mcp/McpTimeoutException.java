package ai.agentdeck.mcp;

import java.time.Duration;

/** A request or a wait exceeded its deadline. Does not change the status of the server involved. */
public class McpTimeoutException extends McpException {
    private final Duration timeout;

    public McpTimeoutException(String message, Duration timeout) {
        super(message);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
