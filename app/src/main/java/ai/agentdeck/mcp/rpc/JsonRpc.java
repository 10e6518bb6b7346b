package ai.agentdeck.mcp.rpc;

import ai.agentdeck.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.Nullable;

/** Builders and classifiers for JSON-RPC 2.0 envelopes. */
public final class JsonRpc {
    public static final String VERSION = "2.0";

    private JsonRpc() {}

    public static ObjectNode request(long id, String method, @Nullable JsonNode params) {
        var node = Json.object();
        node.put("jsonrpc", VERSION);
        node.put("id", id);
        node.put("method", method);
        if (params != null && !params.isNull()) {
            node.set("params", params);
        }
        return node;
    }

    public static ObjectNode notification(String method, @Nullable JsonNode params) {
        var node = Json.object();
        node.put("jsonrpc", VERSION);
        node.put("method", method);
        if (params != null && !params.isNull()) {
            node.set("params", params);
        }
        return node;
    }

    public static ObjectNode result(JsonNode id, JsonNode result) {
        var node = Json.object();
        node.put("jsonrpc", VERSION);
        node.set("id", id);
        node.set("result", result);
        return node;
    }

    public static ObjectNode error(JsonNode id, int code, String message) {
        var node = Json.object();
        node.put("jsonrpc", VERSION);
        node.set("id", id);
        var error = node.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return node;
    }

    public static boolean hasId(JsonNode message) {
        var id = message.get("id");
        return id != null && !id.isNull();
    }

    public static @Nullable String method(JsonNode message) {
        var method = message.get("method");
        return method != null && method.isTextual() ? method.asText() : null;
    }

    /** Numeric id of a response, accepting ids echoed back as strings. Null when the id is absent or not numeric. */
    public static @Nullable Long numericId(JsonNode message) {
        var id = message.get("id");
        if (id == null || id.isNull()) {
            return null;
        }
        if (id.canConvertToLong() && id.isIntegralNumber()) {
            return id.asLong();
        }
        if (id.isTextual()) {
            try {
                return Long.parseLong(id.asText());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
