package ai.agentdeck.mcp.rpc;

import ai.agentdeck.mcp.McpException;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

/** The server answered with a JSON-RPC {@code error} object. The server itself stays running. */
public class JsonRpcException extends McpException {
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;

    private final int code;
    private final @Nullable JsonNode data;

    public JsonRpcException(int code, String message, @Nullable JsonNode data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public static JsonRpcException fromError(JsonNode error) {
        var message = error.path("message").asText("");
        if (message.isEmpty()) {
            message = "JSON-RPC error";
        }
        var data = error.get("data");
        return new JsonRpcException(error.path("code").asInt(INTERNAL_ERROR), message, data);
    }

    public int code() {
        return code;
    }

    public @Nullable JsonNode data() {
        return data;
    }
}
