package ai.agentdeck.mcp.oauth;

import ai.agentdeck.mcp.McpTimeoutException;
import ai.agentdeck.mcp.transport.TransportException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Short-lived loopback listener that waits for the browser redirect at the end of an OAuth authorization.
 *
 * <p>Only the shape of the callback is handled: a request to {@value #CALLBACK_PATH} carrying a {@code code} parameter
 * resolves {@code true}, one without it resolves {@code false}. Exchanging the code for a token is left to the caller.
 * The listener is stopped before the returned future completes, on success, rejection and timeout alike.
 */
public final class OAuthCallbackListener {
    private static final Logger logger = LogManager.getLogger(OAuthCallbackListener.class);

    public static final String CALLBACK_PATH = "/callback";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    private static final String SUCCESS_PAGE =
            "<html><body><h3>Authorization complete</h3><p>You can close this window.</p></body></html>";
    private static final String FAILURE_PAGE =
            "<html><body><h3>Authorization failed</h3><p>No authorization code was received.</p></body></html>";

    private final int port;
    private final Duration timeout;
    private final ScheduledExecutorService scheduler;

    public OAuthCallbackListener(int port, Duration timeout, ScheduledExecutorService scheduler) {
        this.port = port;
        this.timeout = timeout;
        this.scheduler = scheduler;
    }

    /**
     * Binds the listener and waits for one callback.
     *
     * @return future completing with whether a code arrived; fails with {@link McpTimeoutException} when nothing
     *     arrives in time, or with {@link TransportException} when the port cannot be bound
     */
    public CompletableFuture<Boolean> awaitCallback(String serverId) {
        HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 0);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new TransportException(
                    "Cannot listen for OAuth callback of " + serverId + " on port " + port + ": " + e.getMessage(), e));
        }

        var signal = new CompletableFuture<Boolean>();
        var outcome = new CompletableFuture<Boolean>();
        ExecutorService handlerExecutor = Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "OAuthCallback-" + serverId);
            t.setDaemon(true);
            return t;
        });

        server.createContext(CALLBACK_PATH, exchange -> {
            var code = parseQuery(exchange.getRequestURI().getRawQuery()).get("code");
            boolean authorized = code != null && !code.isBlank();
            try {
                respond(exchange, authorized ? 200 : 400, authorized ? SUCCESS_PAGE : FAILURE_PAGE);
            } finally {
                signal.complete(authorized);
            }
        });
        server.setExecutor(handlerExecutor);
        server.start();
        logger.info("Waiting for OAuth callback of {} on http://127.0.0.1:{}{}", serverId, port, CALLBACK_PATH);

        var timer = scheduler.schedule(
                () -> signal.completeExceptionally(new McpTimeoutException(
                        "No OAuth callback for " + serverId + " within " + timeout.toSeconds() + " s", timeout)),
                timeout.toMillis(),
                TimeUnit.MILLISECONDS);

        signal.whenComplete((authorized, error) -> {
            timer.cancel(false);
            server.stop(0);
            handlerExecutor.shutdown();
            logger.debug("OAuth callback listener for {} on port {} closed", serverId, port);
            if (error != null) {
                logger.warn("OAuth flow for {} failed: {}", serverId, error.getMessage());
                outcome.completeExceptionally(error);
            } else {
                logger.info("OAuth flow for {} {}", serverId, authorized ? "received a code" : "was rejected");
                outcome.complete(authorized);
            }
        });
        return outcome;
    }

    public int port() {
        return port;
    }

    static Map<String, String> parseQuery(@Nullable String rawQuery) {
        var params = new LinkedHashMap<String, String>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (var pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            var key = eq >= 0 ? pair.substring(0, eq) : pair;
            var value = eq >= 0 ? pair.substring(eq + 1) : "";
            params.putIfAbsent(
                    URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private static void respond(HttpExchange exchange, int status, String html) throws IOException {
        byte[] bytes = html.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (var os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
