package ai.agentdeck.testutil;

import ai.agentdeck.mcp.rpc.JsonRpc;
import ai.agentdeck.mcp.rpc.JsonRpcException;
import ai.agentdeck.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * In-memory MCP server behind the transport interface. Answers {@code initialize}, the three list methods and
 * {@code tools/call} asynchronously, the way a real server would reply from another thread.
 */
public final class FakeMcpServer extends FakeTransport {
    private final ExecutorService replies = Executors.newSingleThreadExecutor(r -> {
        var t = new Thread(r, "FakeMcpServer");
        t.setDaemon(true);
        return t;
    });

    private final List<ObjectNode> tools = new CopyOnWriteArrayList<>();
    private final List<ObjectNode> resources = new CopyOnWriteArrayList<>();
    private final List<ObjectNode> prompts = new CopyOnWriteArrayList<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private final Set<String> silent = ConcurrentHashMap.newKeySet();
    public final List<String> received = new CopyOnWriteArrayList<>();

    public FakeMcpServer withTool(String name, String description) {
        var tool = Json.object();
        tool.put("name", name);
        tool.put("description", description);
        tool.putObject("inputSchema").put("type", "object");
        tools.add(tool);
        return this;
    }

    public FakeMcpServer withResource(String uri, String name) {
        var resource = Json.object();
        resource.put("uri", uri);
        resource.put("name", name);
        resources.add(resource);
        return this;
    }

    public FakeMcpServer withPrompt(String name, String description) {
        var prompt = Json.object();
        prompt.put("name", name);
        prompt.put("description", description);
        prompts.add(prompt);
        return this;
    }

    /** Answers {@code method} with a JSON-RPC error. */
    public FakeMcpServer failing(String method) {
        failing.add(method);
        return this;
    }

    /** Never answers {@code method}. */
    public FakeMcpServer silent(String method) {
        silent.add(method);
        return this;
    }

    public void clearTools() {
        tools.clear();
    }

    public void sendNotification(String method) {
        replies.execute(() -> deliver(JsonRpc.notification(method, null)));
    }

    public void exit(int code) {
        replies.execute(() -> simulateExit(code));
    }

    @Override
    protected void onSent(JsonNode message) {
        var method = JsonRpc.method(message);
        if (method == null || !JsonRpc.hasId(message)) {
            if (method != null) {
                received.add(method);
            }
            return;
        }
        received.add(method);
        if (silent.contains(method)) {
            return;
        }
        var id = message.get("id");
        replies.execute(() -> {
            if (failing.contains(method)) {
                deliver(JsonRpc.error(id, JsonRpcException.METHOD_NOT_FOUND, method + " not supported"));
                return;
            }
            deliver(JsonRpc.result(id, resultFor(method, message.path("params"))));
        });
    }

    private JsonNode resultFor(String method, JsonNode params) {
        var result = Json.object();
        switch (method) {
            case "initialize" -> {
                result.put("protocolVersion", "2024-11-05");
                result.putObject("capabilities");
                var info = result.putObject("serverInfo");
                info.put("name", "fake-server");
                info.put("version", "0.0.1");
            }
            case "tools/list" -> fill(result.putArray("tools"), tools);
            case "resources/list" -> fill(result.putArray("resources"), resources);
            case "prompts/list" -> fill(result.putArray("prompts"), prompts);
            case "tools/call" -> result.putArray("content")
                    .addObject()
                    .put("type", "text")
                    .put("text", "called " + params.path("name").asText());
            default -> {}
        }
        return result;
    }

    private static void fill(ArrayNode target, List<ObjectNode> items) {
        items.forEach(target::add);
    }

    @Override
    public void close() {
        super.close();
        replies.shutdown();
    }
}
