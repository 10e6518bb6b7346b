package ai.agentdeck.mcp.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

/** OAuth requirement declared by a server definition. Only the callback port is used by the client runtime. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OAuthSettings(
        @Nullable String clientId, @Nullable String clientSecret, @Nullable Integer callbackPort) {

    public static final int DEFAULT_CALLBACK_PORT = 3118;

    public int callbackPortOrDefault() {
        return callbackPort != null ? callbackPort : DEFAULT_CALLBACK_PORT;
    }
}
