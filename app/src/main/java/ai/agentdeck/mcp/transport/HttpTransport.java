package ai.agentdeck.mcp.transport;

import ai.agentdeck.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.sse.EventSource;
import okhttp3.sse.EventSourceListener;
import okhttp3.sse.EventSources;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Stateless request/response transport: every JSON-RPC message is one POST to the server endpoint, and the response
 * body (plain JSON or a short event stream) carries the reply. A non-2xx status fails the send with
 * {@link TransportException}.
 */
public final class HttpTransport implements McpTransport {
    private static final Logger logger = LogManager.getLogger(HttpTransport.class);

    static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String SESSION_HEADER = "Mcp-Session-Id";

    private final String serverId;
    private final HttpUrl endpoint;
    private final Map<String, String> headers;
    private final OkHttpClient client;

    private volatile @Nullable Listener listener;
    private volatile @Nullable String sessionId;
    private volatile boolean open;

    public HttpTransport(String serverId, String url, Map<String, String> headers, OkHttpClient client)
            throws TransportException {
        this.serverId = serverId;
        this.endpoint = resolveEndpoint(url);
        this.headers = Map.copyOf(headers);
        this.client = client;
    }

    /** Appends {@code /mcp} when the URL has no path of its own; an explicit path is kept as is. */
    static HttpUrl resolveEndpoint(String url) throws TransportException {
        var parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new TransportException("Invalid MCP server URL: " + url);
        }
        if (parsed.encodedPath().equals("/")) {
            return parsed.newBuilder().encodedPath("/mcp").build();
        }
        return parsed;
    }

    @Override
    public void start(Listener listener) {
        this.listener = listener;
        this.open = true;
        logger.info("MCP server {} uses HTTP endpoint {}", serverId, endpoint);
    }

    @Override
    public CompletableFuture<Void> send(JsonNode message) {
        if (!open) {
            return CompletableFuture.failedFuture(new TransportException("HTTP transport for " + serverId + " is closed"));
        }
        var requestBuilder = new Request.Builder()
                .url(endpoint)
                .header("Accept", "application/json, text/event-stream")
                .post(RequestBody.create(Json.toJson(message), JSON));
        headers.forEach(requestBuilder::header);
        var session = sessionId;
        if (session != null) {
            requestBuilder.header(SESSION_HEADER, session);
        }

        var future = new CompletableFuture<Void>();
        client.newCall(requestBuilder.build()).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(new TransportException(
                        "HTTP request to MCP server " + serverId + " failed: " + e.getMessage(), e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (!response.isSuccessful()) {
                        future.completeExceptionally(new TransportException(
                                "MCP server " + serverId + " returned HTTP " + response.code(), response.code()));
                        return;
                    }
                    var newSession = response.header(SESSION_HEADER);
                    if (newSession != null && !newSession.equals(sessionId)) {
                        logger.debug("MCP server {} assigned session {}", serverId, newSession);
                        sessionId = newSession;
                    }
                    deliverBody(response);
                    future.complete(null);
                } catch (IOException e) {
                    future.completeExceptionally(new TransportException(
                            "Failed to read response from MCP server " + serverId + ": " + e.getMessage(), e));
                }
            }
        });
        return future;
    }

    private void deliverBody(Response response) throws IOException {
        var body = response.body();
        if (body == null || response.code() == 202 || response.code() == 204) {
            return;
        }
        var contentType = body.contentType();
        if (contentType != null && "event-stream".equals(contentType.subtype())) {
            EventSources.processResponse(response, new EventSourceListener() {
                @Override
                public void onEvent(EventSource eventSource, @Nullable String id, @Nullable String type, String data) {
                    deliver(data);
                }
            });
            return;
        }
        var text = body.string();
        if (!text.isBlank()) {
            deliver(text);
        }
    }

    private void deliver(String text) {
        var l = listener;
        if (l == null) {
            return;
        }
        JsonNode node;
        try {
            node = Json.mapper().readTree(text);
        } catch (JsonProcessingException e) {
            logger.debug("[{}] ignoring non-JSON HTTP payload: {}", serverId, text);
            return;
        }
        if (node == null) {
            return;
        }
        if (node.isArray()) {
            node.forEach(l::onMessage);
        } else if (node.isObject()) {
            l.onMessage(node);
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public String describe() {
        return endpoint.toString();
    }

    public @Nullable String sessionId() {
        return sessionId;
    }

    @Override
    public void close() {
        open = false;
        sessionId = null;
    }
}
