package ai.agentdeck.mcp.transport;

import ai.agentdeck.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Full-duplex transport: each text frame carries exactly one JSON-RPC message in either direction. */
public final class WebSocketTransport implements McpTransport {
    private static final Logger logger = LogManager.getLogger(WebSocketTransport.class);
    private static final int NORMAL_CLOSURE = 1000;

    private final String serverId;
    private final String url;
    private final Map<String, String> headers;
    private final OkHttpClient client;

    private volatile @Nullable WebSocket webSocket;
    private volatile boolean open;

    public WebSocketTransport(String serverId, String url, Map<String, String> headers, OkHttpClient client)
            throws TransportException {
        // OkHttp accepts ws:// and wss:// in Request urls but HttpUrl.parse does not
        var httpForm = url.replaceFirst("(?i)^ws:", "http:").replaceFirst("(?i)^wss:", "https:");
        if (HttpUrl.parse(httpForm) == null) {
            throw new TransportException("Invalid MCP server URL: " + url);
        }
        this.serverId = serverId;
        this.url = url;
        this.headers = Map.copyOf(headers);
        this.client = client.newBuilder().readTimeout(0, TimeUnit.MILLISECONDS).build();
    }

    @Override
    public void start(Listener listener) {
        var requestBuilder = new Request.Builder().url(url);
        headers.forEach(requestBuilder::header);
        open = true;
        logger.info("Connecting to MCP server {} over WebSocket {}", serverId, url);
        webSocket = client.newWebSocket(requestBuilder.build(), new WebSocketListener() {
            @Override
            public void onOpen(WebSocket ws, Response response) {
                logger.debug("WebSocket to MCP server {} opened", serverId);
            }

            @Override
            public void onMessage(WebSocket ws, String text) {
                JsonNode node;
                try {
                    node = Json.mapper().readTree(text);
                } catch (JsonProcessingException e) {
                    logger.debug("[{}] ignoring non-JSON frame: {}", serverId, text);
                    return;
                }
                if (node != null && node.isObject()) {
                    listener.onMessage(node);
                }
            }

            @Override
            public void onClosing(WebSocket ws, int code, String reason) {
                ws.close(NORMAL_CLOSURE, null);
            }

            @Override
            public void onClosed(WebSocket ws, int code, String reason) {
                logger.info("WebSocket to MCP server {} closed: {} {}", serverId, code, reason);
                if (open) {
                    open = false;
                    listener.onClosed(null);
                }
            }

            @Override
            public void onFailure(WebSocket ws, Throwable t, @Nullable Response response) {
                logger.warn("WebSocket to MCP server {} failed: {}", serverId, t.getMessage());
                if (open) {
                    open = false;
                    listener.onError(new TransportException(
                            "WebSocket to MCP server " + serverId + " failed: " + t.getMessage(), t));
                }
            }
        });
    }

    @Override
    public CompletableFuture<Void> send(JsonNode message) {
        var ws = webSocket;
        if (!open || ws == null) {
            return CompletableFuture.failedFuture(
                    new TransportException("WebSocket to MCP server " + serverId + " is closed"));
        }
        if (!ws.send(Json.toJson(message))) {
            return CompletableFuture.failedFuture(
                    new TransportException("WebSocket to MCP server " + serverId + " rejected the message"));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public String describe() {
        return url;
    }

    @Override
    public void close() {
        open = false;
        var ws = webSocket;
        webSocket = null;
        if (ws != null) {
            ws.close(NORMAL_CLOSURE, "client closed");
        }
    }
}
