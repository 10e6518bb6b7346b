package ai.agentdeck.mcp.rpc;

import ai.agentdeck.mcp.McpTimeoutException;
import ai.agentdeck.mcp.transport.McpTransport;
import ai.agentdeck.mcp.transport.TransportException;
import ai.agentdeck.util.Json;
import ai.agentdeck.util.Throwables;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Matches JSON-RPC responses from one server to the requests that caused them.
 *
 * <p>Each {@link #call} gets a strictly increasing id and exactly one deadline timer. A pending entry is removed from
 * the map exactly once, by whichever of response, timeout, delivery failure or {@link #cancelAll} gets there first;
 * every later attempt finds nothing and is a no-op. Responses are matched by id, so arrival order does not matter.
 */
public final class MessageCorrelator implements McpRequester {
    private static final Logger logger = LogManager.getLogger(MessageCorrelator.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String serverId;
    private final McpTransport transport;
    private final ScheduledExecutorService scheduler;
    private final Duration defaultTimeout;
    private final NotificationHandler notificationHandler;

    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<Long, PendingRequest> pending = new ConcurrentHashMap<>();

    private static final class PendingRequest {
        final long id;
        final String method;
        final CompletableFuture<JsonNode> future = new CompletableFuture<>();
        volatile @Nullable ScheduledFuture<?> timer;

        PendingRequest(long id, String method) {
            this.id = id;
            this.method = method;
        }

        void cancelTimer() {
            var t = timer;
            if (t != null) {
                t.cancel(false);
            }
        }
    }

    public MessageCorrelator(
            String serverId,
            McpTransport transport,
            ScheduledExecutorService scheduler,
            Duration defaultTimeout,
            NotificationHandler notificationHandler) {
        this.serverId = serverId;
        this.transport = transport;
        this.scheduler = scheduler;
        this.defaultTimeout = defaultTimeout;
        this.notificationHandler = notificationHandler;
    }

    @Override
    public CompletableFuture<JsonNode> call(String method, @Nullable JsonNode params) {
        return call(method, params, defaultTimeout);
    }

    /**
     * Sends a request and returns a future for its {@code result}. The future fails with {@link JsonRpcException},
     * {@link McpTimeoutException}, {@link TransportException} or {@link RequestCancelledException}.
     */
    public CompletableFuture<JsonNode> call(String method, @Nullable JsonNode params, Duration timeout) {
        long id = nextId.getAndIncrement();
        var request = new PendingRequest(id, method);
        pending.put(id, request);
        request.timer = scheduler.schedule(() -> expire(id, timeout), timeout.toMillis(), TimeUnit.MILLISECONDS);

        logger.trace("[{}] -> {} #{}", serverId, method, id);
        transport.send(JsonRpc.request(id, method, params)).whenComplete((ignored, error) -> {
            if (error != null) {
                var cause = Throwables.unwrap(error);
                settle(id, null, cause instanceof TransportException
                        ? cause
                        : new TransportException("Failed to send " + method + " to " + serverId + ": "
                                + Throwables.rootMessage(cause), cause));
            }
        });
        return request.future;
    }

    /** Fire-and-forget notification; no id is assigned and no response is expected. */
    public CompletableFuture<Void> notify(String method, @Nullable JsonNode params) {
        logger.trace("[{}] -> notification {}", serverId, method);
        return transport.send(JsonRpc.notification(method, params));
    }

    /** Entry point for every inbound message of this server. */
    public void onMessage(JsonNode message) {
        var method = JsonRpc.method(message);
        boolean hasId = JsonRpc.hasId(message);

        if (method != null && hasId) {
            answerServerRequest(method, message);
            return;
        }
        if (method != null) {
            try {
                notificationHandler.onNotification(method, message.get("params"));
            } catch (RuntimeException e) {
                logger.warn("[{}] Notification handler failed for {}", serverId, method, e);
            }
            return;
        }

        var id = JsonRpc.numericId(message);
        if (id == null) {
            logger.debug("[{}] Dropping message without id or method: {}", serverId, message);
            return;
        }
        var error = message.get("error");
        if (error != null && !error.isNull()) {
            settle(id, null, JsonRpcException.fromError(error));
        } else {
            var result = message.get("result");
            settle(id, result != null ? result : Json.object(), null);
        }
    }

    /** Rejects every pending request with {@link RequestCancelledException} and cancels their timers. */
    public void cancelAll(String reason) {
        var ids = new ArrayList<>(pending.keySet());
        if (!ids.isEmpty()) {
            logger.debug("[{}] Cancelling {} pending request(s): {}", serverId, ids.size(), reason);
        }
        for (var id : ids) {
            settle(id, null, new RequestCancelledException(reason));
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    private void expire(long id, Duration timeout) {
        var request = pending.get(id);
        var method = request != null ? request.method : "request";
        settle(id, null, new McpTimeoutException(
                "MCP request " + method + " to " + serverId + " timed out after " + timeout.toMillis() + " ms",
                timeout));
    }

    private void settle(long id, @Nullable JsonNode result, @Nullable Throwable failure) {
        var request = pending.remove(id);
        if (request == null) {
            logger.debug("[{}] Ignoring settlement for request #{} that is no longer pending", serverId, id);
            return;
        }
        request.cancelTimer();
        if (failure != null) {
            logger.trace("[{}] <- {} #{} failed: {}", serverId, request.method, id, failure.getMessage());
            request.future.completeExceptionally(failure);
        } else {
            logger.trace("[{}] <- {} #{}", serverId, request.method, id);
            request.future.complete(result);
        }
    }

    private void answerServerRequest(String method, JsonNode message) {
        var id = message.get("id");
        JsonNode reply;
        if ("ping".equals(method)) {
            reply = JsonRpc.result(id, Json.object());
        } else {
            logger.debug("[{}] Server request {} is not supported by this client", serverId, method);
            reply = JsonRpc.error(id, JsonRpcException.METHOD_NOT_FOUND, "Method not found: " + method);
        }
        transport.send(reply).whenComplete((ignored, error) -> {
            if (error != null) {
                logger.debug("[{}] Failed to answer server request {}: {}", serverId, method, error.getMessage());
            }
        });
    }
}
