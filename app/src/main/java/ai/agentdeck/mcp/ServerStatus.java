package ai.agentdeck.mcp;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle of a configured server.
 *
 * <pre>
 * STOPPED -> STARTING -> RUNNING
 * RUNNING -> STOPPED            (clean exit or explicit stop)
 * any     -> ERROR              (transport failure)
 * ERROR   -> STARTING           (retry)
 * </pre>
 */
public enum ServerStatus {
    STOPPED,
    STARTING,
    RUNNING,
    ERROR;

    public boolean canTransitionTo(ServerStatus next) {
        if (next == ERROR) {
            return true;
        }
        return switch (this) {
            case STOPPED -> next == STARTING || next == STOPPED;
            case STARTING -> next == RUNNING || next == STOPPED;
            case RUNNING -> next == STOPPED;
            case ERROR -> next == STARTING || next == STOPPED;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
