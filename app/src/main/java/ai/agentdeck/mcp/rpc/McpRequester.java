package ai.agentdeck.mcp.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.CompletableFuture;
import org.jetbrains.annotations.Nullable;

/** Request side of a server connection: sends a request and completes with its {@code result}. */
@FunctionalInterface
public interface McpRequester {
    CompletableFuture<JsonNode> call(String method, @Nullable JsonNode params);
}
