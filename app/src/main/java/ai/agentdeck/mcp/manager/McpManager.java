package ai.agentdeck.mcp.manager;

import ai.agentdeck.mcp.McpException;
import ai.agentdeck.mcp.ServerNotFoundException;
import ai.agentdeck.mcp.ServerNotRunningException;
import ai.agentdeck.mcp.ServerStatus;
import ai.agentdeck.mcp.capability.CapabilityIndex;
import ai.agentdeck.mcp.capability.CapabilityKind;
import ai.agentdeck.mcp.capability.McpPrompt;
import ai.agentdeck.mcp.capability.McpResource;
import ai.agentdeck.mcp.capability.McpTool;
import ai.agentdeck.mcp.capability.SearchResult;
import ai.agentdeck.mcp.capability.ServerCapabilities;
import ai.agentdeck.mcp.capability.ToolCategory;
import ai.agentdeck.mcp.config.McpConfigStore;
import ai.agentdeck.mcp.config.ServerDefinition;
import ai.agentdeck.mcp.oauth.OAuthCallbackListener;
import ai.agentdeck.mcp.registry.RegistryClient;
import ai.agentdeck.mcp.registry.ServerConfigOptions;
import ai.agentdeck.mcp.rpc.MessageCorrelator;
import ai.agentdeck.mcp.rpc.RequestCancelledException;
import ai.agentdeck.mcp.transport.DefaultTransportFactory;
import ai.agentdeck.mcp.transport.McpTransport;
import ai.agentdeck.mcp.transport.McpTransportFactory;
import ai.agentdeck.mcp.transport.TransportException;
import ai.agentdeck.util.Json;
import ai.agentdeck.util.Throwables;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Owns the set of registered MCP servers and drives their lifecycle.
 *
 * <p>Starting a server opens its transport, performs the {@code initialize} handshake, sends
 * {@code notifications/initialized} and runs capability discovery; only then is the server {@code running}. Failures
 * are confined to the server that caused them: its status becomes {@code error} with {@code lastError} set, the
 * returned future fails, and an {@link McpEvent} is published. Nothing here throws into the caller's thread for a
 * server-side problem.
 */
public final class McpManager implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(McpManager.class);

    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final String CLIENT_NAME = "agentdeck";
    public static final String CLIENT_VERSION = "1.0.0";

    private final McpConfigStore configStore;
    private final McpTransportFactory transportFactory;
    private final @Nullable RegistryClient registry;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService executor;
    private final CapabilityIndex capabilityIndex;
    private final Duration oauthTimeout;

    private final Map<String, ServerInstance> servers = new LinkedHashMap<>();
    private final List<McpEventListener> listeners = new CopyOnWriteArrayList<>();

    public McpManager(McpConfigStore configStore, @Nullable RegistryClient registry) {
        this(configStore, new DefaultTransportFactory(), registry, Clock.systemUTC(), OAuthCallbackListener.DEFAULT_TIMEOUT);
    }

    public McpManager(
            McpConfigStore configStore,
            McpTransportFactory transportFactory,
            @Nullable RegistryClient registry,
            Clock clock,
            Duration oauthTimeout) {
        this.configStore = configStore;
        this.transportFactory = transportFactory;
        this.registry = registry;
        this.oauthTimeout = oauthTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "McpTimeouts");
            t.setDaemon(true);
            return t;
        });
        var threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "McpManager-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.capabilityIndex = new CapabilityIndex(
                this::runningServerIds, executor, clock, CapabilityIndex.SEARCH_CACHE_TTL, this::onCapabilitiesChanged);
    }

    /**
     * Loads the configuration and registers every configured server. Built-in defaults are registered first when
     * requested, so a configured server with the same id replaces its default.
     */
    public void initialize(@Nullable Path projectRoot, boolean includeDefaults) {
        configStore.load(projectRoot);
        if (includeDefaults) {
            DefaultServers.all().forEach(this::registerServer);
        }
        configStore.getAllServers().values().forEach(this::registerServer);
        logger.info("MCP manager initialized with {} server(s)", serverCount());
    }

    // ---------------------------------------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------------------------------------

    /** Adds a server to the in-memory registry, or replaces the definition of one that is not running. */
    public void registerServer(ServerDefinition definition) {
        synchronized (servers) {
            var existing = servers.get(definition.id());
            if (existing != null) {
                if (existing.status() == ServerStatus.RUNNING || existing.status() == ServerStatus.STARTING) {
                    logger.warn("Not replacing definition of active MCP server {}; stop it first", definition.id());
                    return;
                }
                existing.setDefinition(definition);
            } else {
                servers.put(definition.id(), new ServerInstance(definition));
            }
        }
        logger.info("Registered MCP server: {}", definition.name());
        emit(definition.id(), McpEvent.Kind.REGISTERED, ServerStatus.STOPPED, definition.name());
    }

    @Blocking
    public void unregisterServer(String serverId) throws ServerNotFoundException {
        stop(serverId);
        synchronized (servers) {
            servers.remove(serverId);
        }
        emit(serverId, McpEvent.Kind.UNREGISTERED, ServerStatus.STOPPED, null);
    }

    /** Persists a definition to its scope and registers it. */
    public void addServer(ServerDefinition definition) throws IOException {
        configStore.addServer(definition);
        registerServer(definition);
    }

    /** Stops the server and removes it from the configuration and from the registry. */
    @Blocking
    public void removeServer(String serverId) throws IOException, ServerNotFoundException {
        configStore.removeServer(serverId);
        if (find(serverId) != null) {
            unregisterServer(serverId);
        }
    }

    /**
     * Persists the enabled flag; disabling a running server also stops it. A built-in server that has no configuration
     * entry yet is written to its own scope first.
     */
    @Blocking
    public void setEnabled(String serverId, boolean enabled) throws IOException, ServerNotFoundException {
        var instance = require(serverId);
        if (configStore.getServer(serverId) == null) {
            configStore.addServer(instance.definition().withDisabled(!enabled));
        } else {
            configStore.setEnabled(serverId, enabled);
        }
        instance.setDefinition(instance.definition().withDisabled(!enabled));
        if (!enabled) {
            stop(serverId);
        }
    }

    /**
     * Generates a definition from a registry entry, persists it and registers it.
     *
     * @throws ServerNotFoundException when the entry is unknown or offers nothing launchable
     */
    public ServerDefinition installFromRegistry(String entryId, ServerConfigOptions options)
            throws IOException, ServerNotFoundException {
        if (registry == null) {
            throw new IllegalStateException("No MCP registry client configured");
        }
        var definition = registry.generateServerConfig(entryId, options);
        if (definition == null) {
            throw new ServerNotFoundException(entryId, "Registry entry " + entryId + " not found or not installable");
        }
        addServer(definition);
        logger.info("Installed MCP server {} from registry", entryId);
        return definition;
    }

    // ---------------------------------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------------------------------

    /**
     * Starts a server. Completes immediately when it is already running and joins the attempt in progress when it is
     * starting. The future fails with {@link ServerNotFoundException} for an unknown id, {@link McpException} for a
     * disabled or denied server, and otherwise with the failure that put the server into {@code error}.
     */
    public CompletableFuture<Void> start(String serverId) {
        var instance = find(serverId);
        if (instance == null) {
            return CompletableFuture.failedFuture(new ServerNotFoundException(serverId));
        }
        var definition = instance.definition();
        if (definition.disabled()) {
            return CompletableFuture.failedFuture(new McpException("MCP server " + serverId + " is disabled"));
        }
        if (!configStore.getEffectiveSettings().permits(serverId)) {
            return CompletableFuture.failedFuture(
                    new McpException("MCP server " + serverId + " is not allowed by the allowed/denied server settings"));
        }

        var result = new CompletableFuture<Void>();
        long gen;
        synchronized (instance) {
            if (instance.status() == ServerStatus.RUNNING) {
                return CompletableFuture.completedFuture(null);
            }
            var inFlight = instance.startFuture();
            if (instance.status() == ServerStatus.STARTING && inFlight != null) {
                return inFlight;
            }
            gen = instance.beginStart(result);
        }
        emit(serverId, McpEvent.Kind.STARTING, ServerStatus.STARTING, null);

        executor.execute(() -> connect(instance, definition, gen, result));
        return result;
    }

    private void connect(ServerInstance instance, ServerDefinition definition, long gen, CompletableFuture<Void> result) {
        var serverId = definition.id();
        var timeout = configStore.getEffectiveSettings().timeout();
        var requestTimeout = timeout != null ? timeout : MessageCorrelator.DEFAULT_TIMEOUT;

        MessageCorrelator correlator;
        try {
            var created = transportFactory.create(definition);
            correlator = new MessageCorrelator(
                    serverId,
                    created,
                    scheduler,
                    requestTimeout,
                    (method, params) -> onNotification(instance, gen, method, params));
            var rpc = correlator;
            if (!instance.attach(gen, new ServerInstance.Connection(created, rpc))) {
                created.close();
                result.completeExceptionally(new RequestCancelledException("Start of " + serverId + " was aborted"));
                return;
            }
            capabilityIndex.open(serverId);
            created.start(new McpTransport.Listener() {
                @Override
                public void onMessage(JsonNode message) {
                    rpc.onMessage(message);
                }

                @Override
                public void onError(Throwable error) {
                    handleConnectionLost(instance, gen, null, error);
                }

                @Override
                public void onClosed(@Nullable Integer exitCode) {
                    handleConnectionLost(instance, gen, exitCode, null);
                }
            });
        } catch (TransportException | RuntimeException e) {
            fail(instance, gen, result, e);
            return;
        }

        var params = Json.object();
        params.put("protocolVersion", PROTOCOL_VERSION);
        params.putObject("capabilities");
        var clientInfo = params.putObject("clientInfo");
        clientInfo.put("name", CLIENT_NAME);
        clientInfo.put("version", CLIENT_VERSION);

        correlator
                .call("initialize", params, requestTimeout)
                .thenCompose(initResult -> {
                    var info = ServerInfo.fromInitializeResult(initResult);
                    logger.debug(
                            "MCP server {} initialized: {} {} (protocol {})",
                            serverId,
                            info.name(),
                            info.version(),
                            info.protocolVersion());
                    return correlator
                            .notify("notifications/initialized", null)
                            .thenCompose(ignored -> capabilityIndex.discover(serverId, correlator))
                            .thenApply(capabilities -> info);
                })
                .whenComplete((info, error) -> {
                    if (error != null) {
                        fail(instance, gen, result, Throwables.unwrap(error));
                        return;
                    }
                    if (!instance.markRunning(gen, info)) {
                        result.completeExceptionally(
                                new RequestCancelledException("Start of " + serverId + " was aborted"));
                        return;
                    }
                    var caps = capabilityIndex.capabilities(serverId);
                    logger.info(
                            "MCP server started: {} ({} tools, {} resources, {} prompts)",
                            definition.name(),
                            caps.tools().size(),
                            caps.resources().size(),
                            caps.prompts().size());
                    emit(serverId, McpEvent.Kind.STARTED, ServerStatus.RUNNING, null);
                    result.complete(null);
                });
    }

    private void fail(ServerInstance instance, long gen, CompletableFuture<Void> result, Throwable error) {
        var serverId = instance.id();
        var message = Throwables.rootMessage(error);
        var ended = instance.end(gen, ServerStatus.ERROR, message);
        if (ended != null) {
            logger.error("Failed to start MCP server {}: {}", serverId, message);
            release(serverId, ended.connection(), "start of " + serverId + " failed");
            emit(serverId, McpEvent.Kind.ERROR, ServerStatus.ERROR, message);
        }
        result.completeExceptionally(error instanceof McpException ? error : new McpException(message, error));
    }

    private void handleConnectionLost(
            ServerInstance instance, long gen, @Nullable Integer exitCode, @Nullable Throwable error) {
        var serverId = instance.id();
        ServerStatus next;
        String reason;
        if (error != null) {
            next = ServerStatus.ERROR;
            reason = Throwables.rootMessage(error);
        } else if (exitCode != null && exitCode != 0) {
            next = ServerStatus.ERROR;
            reason = "MCP server " + serverId + " exited with code " + exitCode;
        } else if (instance.status() == ServerStatus.STARTING) {
            next = ServerStatus.ERROR;
            reason = "MCP server " + serverId + " exited during startup";
        } else {
            next = ServerStatus.STOPPED;
            reason = null;
        }
        var ended = instance.end(gen, next, reason);
        if (ended == null) {
            return;
        }
        if (next == ServerStatus.ERROR) {
            logger.warn("MCP server {} failed: {}", serverId, reason);
        } else {
            logger.info("MCP server {} exited", serverId);
        }
        release(serverId, ended.connection(), reason != null ? reason : "MCP server " + serverId + " exited");
        var pendingStart = ended.startFuture();
        if (pendingStart != null) {
            pendingStart.completeExceptionally(new TransportException(reason != null ? reason : "exited"));
        }
        emit(serverId, next == ServerStatus.ERROR ? McpEvent.Kind.ERROR : McpEvent.Kind.STOPPED, next, reason);
    }

    /** Stops a server. Stopping a server that is not running does nothing. */
    @Blocking
    public void stop(String serverId) throws ServerNotFoundException {
        var instance = require(serverId);
        ServerInstance.Ended ended;
        synchronized (instance) {
            if (instance.status() == ServerStatus.STOPPED) {
                return;
            }
            ended = instance.endCurrent(ServerStatus.STOPPED, null);
        }
        release(serverId, ended.connection(), "MCP server " + serverId + " was stopped");
        var pendingStart = ended.startFuture();
        if (pendingStart != null) {
            pendingStart.completeExceptionally(new RequestCancelledException("Start of " + serverId + " was aborted"));
        }
        logger.info("MCP server stopped: {}", instance.definition().name());
        emit(serverId, McpEvent.Kind.STOPPED, ServerStatus.STOPPED, null);
    }

    private void release(String serverId, @Nullable ServerInstance.Connection connection, String reason) {
        capabilityIndex.close(serverId);
        if (connection == null) {
            return;
        }
        connection.correlator().cancelAll(reason);
        connection.transport().close();
    }

    /** Starts every enabled server permitted by the settings. Completes once all attempts have finished. */
    public CompletableFuture<Void> startAll() {
        var settings = configStore.getEffectiveSettings();
        var attempts = new ArrayList<CompletableFuture<Void>>();
        for (var instance : instances()) {
            var definition = instance.definition();
            if (definition.disabled() || !settings.permits(definition.id())) {
                continue;
            }
            attempts.add(start(definition.id()).exceptionally(error -> null));
        }
        return CompletableFuture.allOf(attempts.toArray(new CompletableFuture<?>[0]));
    }

    @Blocking
    public void stopAll() {
        for (var instance : instances()) {
            try {
                stop(instance.id());
            } catch (ServerNotFoundException e) {
                logger.debug("MCP server {} was removed while stopping all servers", instance.id());
            }
        }
    }

    @Override
    @Blocking
    public void close() {
        stopAll();
        executor.shutdown();
        scheduler.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Invocation
    // ---------------------------------------------------------------------------------------------

    public CompletableFuture<JsonNode> callTool(String serverId, String toolName, @Nullable JsonNode arguments) {
        var params = Json.object();
        params.put("name", toolName);
        params.set("arguments", arguments != null ? arguments : Json.object());
        return request(serverId, "tools/call", params);
    }

    public CompletableFuture<JsonNode> callTool(String serverId, String toolName, Map<String, ?> arguments) {
        return callTool(serverId, toolName, Json.toTree(arguments));
    }

    public CompletableFuture<JsonNode> readResource(String serverId, String uri) {
        var params = Json.object();
        params.put("uri", uri);
        return request(serverId, "resources/read", params);
    }

    public CompletableFuture<JsonNode> getPrompt(String serverId, String promptName, Map<String, String> arguments) {
        var params = Json.object();
        params.put("name", promptName);
        var args = params.putObject("arguments");
        arguments.forEach(args::put);
        return request(serverId, "prompts/get", params);
    }

    private CompletableFuture<JsonNode> request(String serverId, String method, JsonNode params) {
        var instance = find(serverId);
        if (instance == null) {
            return CompletableFuture.failedFuture(new ServerNotFoundException(serverId));
        }
        ServerInstance.Connection connection;
        synchronized (instance) {
            connection = instance.status() == ServerStatus.RUNNING ? instance.connection() : null;
            if (connection == null) {
                return CompletableFuture.failedFuture(new ServerNotRunningException(serverId, instance.status()));
            }
        }
        return connection.correlator().call(method, params);
    }

    // ---------------------------------------------------------------------------------------------
    // Notifications and events
    // ---------------------------------------------------------------------------------------------

    private void onNotification(ServerInstance instance, long gen, String method, @Nullable JsonNode params) {
        var serverId = instance.id();
        var kind = CapabilityKind.forChangedNotification(method);
        if (kind.isPresent()) {
            var connection = instance.isCurrent(gen) ? instance.connection() : null;
            if (connection == null) {
                return;
            }
            logger.debug("MCP server {} changed its {}; refreshing", serverId, kind.get().resultField());
            capabilityIndex.refresh(serverId, connection.correlator(), kind.get());
            return;
        }
        if ("notifications/message".equals(method) && params != null) {
            var level = logLevel(params.path("level").asText("info"));
            var data = params.get("data");
            var text = data == null ? "" : data.isTextual() ? data.asText() : Json.toJson(data);
            var source = params.path("logger").asText(serverId);
            logger.log(level, "[mcp:{}] {}: {}", serverId, source, text);
            emit(serverId, McpEvent.Kind.LOG_MESSAGE, instance.status(), text);
            return;
        }
        logger.debug("Ignoring notification {} from MCP server {}", method, serverId);
    }

    static Level logLevel(String mcpLevel) {
        return switch (mcpLevel) {
            case "debug" -> Level.DEBUG;
            case "notice", "info" -> Level.INFO;
            case "warning" -> Level.WARN;
            case "error" -> Level.ERROR;
            case "critical", "alert", "emergency" -> Level.FATAL;
            default -> Level.INFO;
        };
    }

    private void onCapabilitiesChanged(String serverId, CapabilityKind kind, ServerCapabilities snapshot) {
        var instance = find(serverId);
        var status = instance != null ? instance.status() : ServerStatus.STOPPED;
        switch (kind) {
            case TOOLS -> emit(serverId, McpEvent.Kind.TOOLS_CHANGED, status, String.valueOf(snapshot.tools().size()));
            case RESOURCES -> emit(
                    serverId, McpEvent.Kind.RESOURCES_CHANGED, status, String.valueOf(snapshot.resources().size()));
            case PROMPTS -> emit(
                    serverId, McpEvent.Kind.PROMPTS_CHANGED, status, String.valueOf(snapshot.prompts().size()));
        }
    }

    public void addEventListener(McpEventListener listener) {
        listeners.add(listener);
    }

    public void removeEventListener(McpEventListener listener) {
        listeners.remove(listener);
    }

    private void emit(String serverId, McpEvent.Kind kind, ServerStatus status, @Nullable String detail) {
        var event = new McpEvent(serverId, kind, status, detail);
        for (var listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("MCP event listener failed on {}", event, e);
            }
        }
    }

    // ---------------------------------------------------------------------------------------------
    // OAuth
    // ---------------------------------------------------------------------------------------------

    /**
     * Waits for the OAuth redirect of a server that declares an {@code oauth} block. The future fails with
     * {@link IllegalStateException} when the server declares no OAuth requirement.
     */
    public CompletableFuture<Boolean> authenticate(String serverId) {
        var instance = find(serverId);
        if (instance == null) {
            return CompletableFuture.failedFuture(new ServerNotFoundException(serverId));
        }
        var oauth = instance.definition().oauth();
        if (oauth == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("MCP server " + serverId + " does not declare OAuth"));
        }
        return new OAuthCallbackListener(oauth.callbackPortOrDefault(), oauthTimeout, scheduler).awaitCallback(serverId);
    }

    // ---------------------------------------------------------------------------------------------
    // Read-only views
    // ---------------------------------------------------------------------------------------------

    public List<ServerSnapshot> listServers() {
        var result = new ArrayList<ServerSnapshot>();
        for (var instance : instances()) {
            var definition = instance.definition();
            var caps = capabilityIndex.capabilities(definition.id());
            result.add(new ServerSnapshot(
                    definition.id(),
                    definition.name(),
                    definition.description(),
                    definition.effectiveScope(),
                    definition.transport(),
                    definition.disabled(),
                    instance.status(),
                    instance.lastError(),
                    caps.tools().size(),
                    caps.resources().size(),
                    caps.prompts().size(),
                    instance.serverInfo()));
        }
        return result;
    }

    /** Status of a server; unknown ids report {@code stopped}. */
    public ServerStatus getServerStatus(String serverId) {
        var instance = find(serverId);
        return instance != null ? instance.status() : ServerStatus.STOPPED;
    }

    public @Nullable String getLastError(String serverId) {
        var instance = find(serverId);
        return instance != null ? instance.lastError() : null;
    }

    public @Nullable ServerInfo getServerInfo(String serverId) {
        var instance = find(serverId);
        return instance != null ? instance.serverInfo() : null;
    }

    public ServerCapabilities getCapabilities(String serverId) {
        return capabilityIndex.capabilities(serverId);
    }

    public List<McpTool> getAllTools() {
        return capabilityIndex.getAllTools();
    }

    public List<McpResource> getAllResources() {
        return capabilityIndex.getAllResources();
    }

    public List<McpPrompt> getAllPrompts() {
        return capabilityIndex.getAllPrompts();
    }

    public SearchResult searchTools(String query) {
        return capabilityIndex.searchTools(query);
    }

    public SearchResult searchToolsCached(String query) {
        return capabilityIndex.searchToolsCached(query);
    }

    public List<McpTool> getRelevantTools(String serverId, String context) {
        return capabilityIndex.getRelevantTools(serverId, context);
    }

    public Map<ToolCategory, Integer> getCategories(String serverId) {
        return capabilityIndex.getCategories(serverId);
    }

    public List<McpTool> getToolsByCategory(String serverId, ToolCategory category) {
        return capabilityIndex.getToolsByCategory(serverId, category);
    }

    private List<String> runningServerIds() {
        return instances().stream()
                .filter(i -> i.status() == ServerStatus.RUNNING)
                .map(ServerInstance::id)
                .toList();
    }

    private List<ServerInstance> instances() {
        synchronized (servers) {
            return List.copyOf(servers.values());
        }
    }

    private int serverCount() {
        synchronized (servers) {
            return servers.size();
        }
    }

    private @Nullable ServerInstance find(String serverId) {
        synchronized (servers) {
            return servers.get(serverId);
        }
    }

    private ServerInstance require(String serverId) throws ServerNotFoundException {
        var instance = find(serverId);
        if (instance == null) {
            throw new ServerNotFoundException(serverId);
        }
        return instance;
    }
}
