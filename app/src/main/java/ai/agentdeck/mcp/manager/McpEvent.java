package ai.agentdeck.mcp.manager;

import ai.agentdeck.mcp.ServerStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/**
 * Something that happened to one server.
 *
 * @param status status of the server right after the event
 * @param detail human-readable payload: the error message, the number of capabilities, or a log line
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record McpEvent(String serverId, Kind kind, ServerStatus status, @Nullable String detail) {

    public enum Kind {
        REGISTERED,
        UNREGISTERED,
        STARTING,
        STARTED,
        STOPPED,
        ERROR,
        TOOLS_CHANGED,
        RESOURCES_CHANGED,
        PROMPTS_CHANGED,
        LOG_MESSAGE;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
