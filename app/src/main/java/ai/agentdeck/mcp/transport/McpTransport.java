package ai.agentdeck.mcp.transport;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.CompletableFuture;
import org.jetbrains.annotations.Nullable;

/**
 * A channel to one MCP server. Implementations deliver every inbound JSON-RPC message to the {@link Listener} given to
 * {@link #start}; they never interpret the messages themselves.
 */
public interface McpTransport extends AutoCloseable {

    /** Opens the channel. Network transports may defer the actual connection until the first {@link #send}. */
    void start(Listener listener) throws TransportException;

    /**
     * Hands one JSON-RPC envelope to the server. The returned future fails with {@link TransportException} when the
     * message could not be delivered.
     */
    CompletableFuture<Void> send(JsonNode message);

    boolean isOpen();

    /** Short human-readable description used in log messages. */
    String describe();

    /** Releases the process or connection. Idempotent; does not invoke {@link Listener#onClosed}. */
    @Override
    void close();

    interface Listener {
        void onMessage(JsonNode message);

        /** The channel failed after it was started. */
        void onError(Throwable error);

        /**
         * The channel closed on its own.
         *
         * @param exitCode process exit code for stdio servers, null for network transports
         */
        void onClosed(@Nullable Integer exitCode);
    }
}
