package ai.agentdeck.mcp.manager;

/** Receives {@link McpEvent}s. Called on whichever thread produced the event; implementations must not block. */
@FunctionalInterface
public interface McpEventListener {
    void onEvent(McpEvent event);
}
