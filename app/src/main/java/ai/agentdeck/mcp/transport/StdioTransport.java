package ai.agentdeck.mcp.transport;

import ai.agentdeck.util.Environment;
import ai.agentdeck.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs the server as a child process and exchanges newline-delimited JSON over its standard streams. Standard error is
 * logged line by line; it never carries protocol messages.
 */
public final class StdioTransport implements McpTransport {
    private static final Logger logger = LogManager.getLogger(StdioTransport.class);
    private static final long DESTROY_GRACE_SECONDS = 5;

    private final String serverId;
    private final String command;
    private final List<String> args;
    private final Map<String, String> env;
    private final @Nullable Path workingDirectory;

    private final Object writeLock = new Object();
    private volatile @Nullable Process process;
    private volatile boolean closing;

    public StdioTransport(
            String serverId,
            String command,
            List<String> args,
            Map<String, String> env,
            @Nullable Path workingDirectory) {
        this.serverId = serverId;
        this.command = command;
        this.args = List.copyOf(args);
        this.env = Map.copyOf(env);
        this.workingDirectory = workingDirectory;
    }

    @Override
    public void start(Listener listener) throws TransportException {
        var commandLine = new ArrayList<String>();
        commandLine.add(command);
        commandLine.addAll(args);

        var processBuilder = new ProcessBuilder(commandLine);
        processBuilder.environment().putAll(Environment.expandEnvMap(env));
        if (workingDirectory != null) {
            processBuilder.directory(workingDirectory.toFile());
        }

        Process started;
        try {
            started = processBuilder.start();
        } catch (IOException e) {
            throw new TransportException("Failed to start MCP server " + serverId + " ('" + describe() + "'): "
                    + e.getMessage(), e);
        }
        process = started;
        logger.info("Started MCP server {} (pid={}): {}", serverId, started.pid(), describe());

        var stdoutReader = consumeStdout(started, listener);
        consumeStderr(started);
        started.onExit().thenAccept(p -> {
            int exitCode = p.exitValue();
            awaitDrained(stdoutReader);
            if (closing) {
                logger.debug("MCP server {} exited with code {} after close", serverId, exitCode);
                return;
            }
            logger.info("MCP server {} exited with code {}", serverId, exitCode);
            listener.onClosed(exitCode);
        });
    }

    @Override
    public CompletableFuture<Void> send(JsonNode message) {
        var p = process;
        if (p == null || !p.isAlive()) {
            return CompletableFuture.failedFuture(new TransportException("MCP server " + serverId + " is not running"));
        }
        try {
            byte[] line = (Json.mapper().writeValueAsString(message) + "\n").getBytes(StandardCharsets.UTF_8);
            synchronized (writeLock) {
                OutputStream stdin = p.getOutputStream();
                stdin.write(line);
                stdin.flush();
            }
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new TransportException("Failed to write to MCP server " + serverId + ": " + e.getMessage(), e));
        }
    }

    @Override
    public boolean isOpen() {
        var p = process;
        return p != null && p.isAlive();
    }

    @Override
    public String describe() {
        return args.isEmpty() ? command : command + " " + String.join(" ", args);
    }

    public @Nullable Long pid() {
        var p = process;
        return p != null ? p.pid() : null;
    }

    @Override
    public void close() {
        closing = true;
        var p = process;
        if (p == null) {
            return;
        }
        process = null;
        try {
            p.getOutputStream().close();
        } catch (IOException e) {
            logger.debug("Error closing stdin of MCP server {}: {}", serverId, e.getMessage());
        }
        p.destroy();
        try {
            if (!p.waitFor(DESTROY_GRACE_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("MCP server {} did not terminate gracefully, forcing kill", serverId);
                p.destroyForcibly();
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for MCP server {} to terminate", serverId);
            p.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    private Thread consumeStdout(Process p, Listener listener) {
        var reader = new Thread(
                () -> {
                    try (var in = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                        String line;
                        while ((line = in.readLine()) != null) {
                            dispatchLine(line, listener);
                        }
                    } catch (IOException e) {
                        if (!closing) {
                            logger.warn("Error reading output of MCP server {}: {}", serverId, e.getMessage());
                        }
                    }
                },
                "McpStdout-" + serverId);
        reader.setDaemon(true);
        reader.start();
        return reader;
    }

    /** Lets the stdout reader deliver the last lines before the exit is reported. */
    private void awaitDrained(Thread stdoutReader) {
        try {
            stdoutReader.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void dispatchLine(String line, Listener listener) {
        var trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        JsonNode message;
        try {
            message = Json.mapper().readTree(trimmed);
        } catch (JsonProcessingException e) {
            logger.debug("[{}] non-JSON output: {}", serverId, trimmed);
            return;
        }
        if (message == null || !message.isObject()) {
            logger.debug("[{}] ignoring non-object output: {}", serverId, trimmed);
            return;
        }
        try {
            listener.onMessage(message);
        } catch (RuntimeException e) {
            logger.warn("[{}] Failed to handle inbound message", serverId, e);
        }
    }

    private void consumeStderr(Process p) {
        var reader = new Thread(
                () -> {
                    try (var in = new BufferedReader(new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
                        in.lines().forEach(line -> logger.warn("[mcp:{}] {}", serverId, line));
                    } catch (IOException | UncheckedIOException e) {
                        logger.debug("Error consuming stderr of MCP server {}: {}", serverId, e.getMessage());
                    }
                },
                "McpStderr-" + serverId);
        reader.setDaemon(true);
        reader.start();
    }
}
