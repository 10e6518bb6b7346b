package ai.agentdeck.mcp.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

/** Receives server-initiated messages that carry a method but no id. */
@FunctionalInterface
public interface NotificationHandler {
    void onNotification(String method, @Nullable JsonNode params);
}
