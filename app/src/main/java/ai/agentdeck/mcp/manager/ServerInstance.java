package ai.agentdeck.mcp.manager;

import ai.agentdeck.mcp.ServerStatus;
import ai.agentdeck.mcp.config.ServerDefinition;
import ai.agentdeck.mcp.rpc.MessageCorrelator;
import ai.agentdeck.mcp.transport.McpTransport;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runtime state of one registered server. All mutation goes through synchronized methods.
 *
 * <p>Every start attempt gets a new generation number. Callbacks from a transport carry the generation they were
 * created for, and anything tagged with an older generation is ignored, so a process that exits after a restart cannot
 * touch the new connection's state.
 */
final class ServerInstance {
    private static final Logger logger = LogManager.getLogger(ServerInstance.class);

    /** Live handles of one start attempt. */
    record Connection(McpTransport transport, MessageCorrelator correlator) {}

    private ServerDefinition definition;
    private ServerStatus status = ServerStatus.STOPPED;
    private @Nullable String lastError;
    private @Nullable Connection connection;
    private @Nullable ServerInfo serverInfo;
    private @Nullable CompletableFuture<Void> startFuture;
    private long generation;

    ServerInstance(ServerDefinition definition) {
        this.definition = definition;
    }

    String id() {
        return definition.id();
    }

    synchronized ServerDefinition definition() {
        return definition;
    }

    synchronized void setDefinition(ServerDefinition definition) {
        this.definition = definition;
    }

    synchronized ServerStatus status() {
        return status;
    }

    synchronized @Nullable String lastError() {
        return lastError;
    }

    synchronized @Nullable ServerInfo serverInfo() {
        return serverInfo;
    }

    synchronized @Nullable Connection connection() {
        return connection;
    }

    synchronized @Nullable CompletableFuture<Void> startFuture() {
        return startFuture;
    }

    synchronized long generation() {
        return generation;
    }

    synchronized boolean isCurrent(long gen) {
        return gen == generation;
    }

    /** Moves to STARTING and returns the new generation. */
    synchronized long beginStart(CompletableFuture<Void> future) {
        transition(ServerStatus.STARTING);
        lastError = null;
        serverInfo = null;
        startFuture = future;
        return ++generation;
    }

    synchronized boolean attach(long gen, Connection newConnection) {
        if (gen != generation) {
            return false;
        }
        connection = newConnection;
        return true;
    }

    synchronized boolean markRunning(long gen, ServerInfo info) {
        if (gen != generation || status != ServerStatus.STARTING || connection == null) {
            return false;
        }
        serverInfo = info;
        transition(ServerStatus.RUNNING);
        startFuture = null;
        return true;
    }

    /** What a generation left behind when it ended. */
    record Ended(ServerStatus previous, @Nullable Connection connection, @Nullable CompletableFuture<Void> startFuture) {}

    /**
     * Ends the given generation with {@code next} (STOPPED or ERROR) and hands back its handles for cleanup.
     *
     * @return null when {@code gen} is no longer current
     */
    synchronized @Nullable Ended end(long gen, ServerStatus next, @Nullable String error) {
        if (gen != generation) {
            return null;
        }
        return endCurrent(next, error);
    }

    synchronized Ended endCurrent(ServerStatus next, @Nullable String error) {
        var ended = new Ended(status, connection, startFuture);
        connection = null;
        startFuture = null;
        serverInfo = null;
        lastError = error;
        generation++;
        transition(next);
        return ended;
    }

    private void transition(ServerStatus next) {
        if (!status.canTransitionTo(next)) {
            logger.debug("Unusual status change for {}: {} -> {}", id(), status, next);
        }
        status = next;
    }
}
