package ai.agentdeck.mcp.transport;

import ai.agentdeck.mcp.config.ServerDefinition;

/** Builds the transport for a server definition. The transport is returned unstarted. */
@FunctionalInterface
public interface McpTransportFactory {
    McpTransport create(ServerDefinition definition) throws TransportException;
}
