package ai.agentdeck.mcp.transport;

import ai.agentdeck.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
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
 * Server-push transport. A long-lived event stream is opened on the first {@link #send}; the server announces the URL
 * to POST messages to in an {@code endpoint} event, and replies arrive as {@code message} events on the stream.
 */
public final class SseTransport implements McpTransport {
    private static final Logger logger = LogManager.getLogger(SseTransport.class);
    static final Duration ENDPOINT_TIMEOUT = Duration.ofSeconds(30);

    private final String serverId;
    private final HttpUrl streamUrl;
    private final Map<String, String> headers;
    private final OkHttpClient client;
    private final Duration endpointTimeout;

    private final Object connectLock = new Object();
    private volatile @Nullable Listener listener;
    private volatile @Nullable EventSource eventSource;
    private volatile @Nullable StreamListener streamListener;
    private volatile @Nullable CompletableFuture<HttpUrl> endpoint;
    private volatile boolean open;

    public SseTransport(String serverId, String url, Map<String, String> headers, OkHttpClient client)
            throws TransportException {
        this(serverId, url, headers, client, ENDPOINT_TIMEOUT);
    }

    SseTransport(
            String serverId, String url, Map<String, String> headers, OkHttpClient client, Duration endpointTimeout)
            throws TransportException {
        var parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new TransportException("Invalid MCP server URL: " + url);
        }
        this.serverId = serverId;
        this.streamUrl = parsed;
        this.headers = Map.copyOf(headers);
        this.client = client.newBuilder().readTimeout(0, TimeUnit.MILLISECONDS).build();
        this.endpointTimeout = endpointTimeout;
    }

    @Override
    public void start(Listener listener) {
        this.listener = listener;
        this.open = true;
    }

    @Override
    public CompletableFuture<Void> send(JsonNode message) {
        if (!open) {
            return CompletableFuture.failedFuture(new TransportException("SSE transport for " + serverId + " is closed"));
        }
        return connect().thenCompose(postUrl -> post(postUrl, message));
    }

    /** Opens the event stream once and returns the announced message endpoint. */
    CompletableFuture<HttpUrl> connect() {
        synchronized (connectLock) {
            var existing = endpoint;
            if (existing != null && !existing.isCompletedExceptionally()) {
                return existing;
            }
            discardStream();
            var announced = new CompletableFuture<HttpUrl>();
            endpoint = announced;

            var requestBuilder = new Request.Builder().url(streamUrl).header("Accept", "text/event-stream");
            headers.forEach(requestBuilder::header);
            logger.info("Connecting to MCP event stream {} for {}", streamUrl, serverId);
            var streamListener = new StreamListener(announced);
            this.streamListener = streamListener;
            eventSource = EventSources.createFactory(client).newEventSource(requestBuilder.build(), streamListener);
            return announced.orTimeout(endpointTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /** Cancels the current stream, if any; its listener stops delivering before the cancellation is reported. */
    private void discardStream() {
        var previousListener = streamListener;
        if (previousListener != null) {
            previousListener.stale = true;
        }
        streamListener = null;
        var previous = eventSource;
        eventSource = null;
        if (previous != null) {
            logger.debug("Cancelling event stream of MCP server {}", serverId);
            previous.cancel();
        }
    }

    private CompletableFuture<Void> post(HttpUrl postUrl, JsonNode message) {
        var requestBuilder = new Request.Builder()
                .url(postUrl)
                .post(RequestBody.create(Json.toJson(message), HttpTransport.JSON));
        headers.forEach(requestBuilder::header);

        var future = new CompletableFuture<Void>();
        client.newCall(requestBuilder.build()).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(
                        new TransportException("POST to MCP server " + serverId + " failed: " + e.getMessage(), e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (!response.isSuccessful()) {
                        future.completeExceptionally(new TransportException(
                                "MCP server " + serverId + " returned HTTP " + response.code(), response.code()));
                        return;
                    }
                    future.complete(null);
                }
            }
        });
        return future;
    }

    private final class StreamListener extends EventSourceListener {
        private final CompletableFuture<HttpUrl> announced;
        private volatile boolean stale;

        StreamListener(CompletableFuture<HttpUrl> announced) {
            this.announced = announced;
        }

        @Override
        public void onOpen(EventSource source, Response response) {
            logger.debug("MCP event stream for {} opened (HTTP {})", serverId, response.code());
        }

        @Override
        public void onEvent(EventSource source, @Nullable String id, @Nullable String type, String data) {
            if (stale) {
                return;
            }
            if ("endpoint".equals(type)) {
                var resolved = streamUrl.resolve(data.trim());
                if (resolved == null) {
                    announced.completeExceptionally(
                            new TransportException("MCP server " + serverId + " announced invalid endpoint: " + data));
                } else {
                    logger.debug("MCP server {} message endpoint: {}", serverId, resolved);
                    announced.complete(resolved);
                }
                return;
            }
            if (type != null && !"message".equals(type)) {
                logger.debug("[{}] ignoring SSE event of type {}", serverId, type);
                return;
            }
            var l = listener;
            if (l == null) {
                return;
            }
            try {
                var node = Json.mapper().readTree(data);
                if (node != null && node.isObject()) {
                    l.onMessage(node);
                }
            } catch (JsonProcessingException e) {
                logger.debug("[{}] ignoring non-JSON SSE data: {}", serverId, data);
            }
        }

        @Override
        public void onClosed(EventSource source) {
            if (stale) {
                return;
            }
            logger.info("MCP event stream for {} closed by server", serverId);
            announced.completeExceptionally(new TransportException("Event stream closed before endpoint was announced"));
            var l = listener;
            if (open && l != null) {
                open = false;
                l.onClosed(null);
            }
        }

        @Override
        public void onFailure(EventSource source, @Nullable Throwable t, @Nullable Response response) {
            if (stale) {
                return;
            }
            var reason = t != null
                    ? t.getMessage()
                    : response != null ? "HTTP " + response.code() : "unknown error";
            var error = new TransportException(
                    "Event stream of MCP server " + serverId + " failed: " + reason,
                    response != null ? response.code() : -1);
            if (!announced.isDone()) {
                // connection never came up: only the pending send fails
                announced.completeExceptionally(error);
                return;
            }
            var l = listener;
            if (open && l != null) {
                open = false;
                l.onError(error);
            }
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public boolean isConnected() {
        var e = endpoint;
        return e != null && e.isDone() && !e.isCompletedExceptionally();
    }

    @Override
    public String describe() {
        return streamUrl.toString();
    }

    @Override
    public void close() {
        open = false;
        synchronized (connectLock) {
            discardStream();
        }
    }
}
