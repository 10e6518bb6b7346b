package ai.agentdeck.mcp.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;

public enum TransportType {
    STDIO("stdio"),
    HTTP("http"),
    SSE("sse"),
    WEBSOCKET("websocket");

    private final String wireName;

    TransportType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isNetwork() {
        return this != STDIO;
    }

    /** Accepts the registry spelling {@code streamable-http} as an alias of {@link #HTTP}. */
    @JsonCreator
    public static @Nullable TransportType fromWireName(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "stdio" -> STDIO;
            case "http", "streamable-http" -> HTTP;
            case "sse" -> SSE;
            case "websocket", "ws" -> WEBSOCKET;
            default -> throw new IllegalArgumentException("Unknown MCP transport: " + value);
        };
    }
}
