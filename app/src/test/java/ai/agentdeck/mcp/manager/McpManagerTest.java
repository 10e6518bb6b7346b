package ai.agentdeck.mcp.manager;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.agentdeck.mcp.McpException;
import ai.agentdeck.mcp.McpTimeoutException;
import ai.agentdeck.mcp.ServerNotFoundException;
import ai.agentdeck.mcp.ServerNotRunningException;
import ai.agentdeck.mcp.ServerStatus;
import ai.agentdeck.mcp.capability.McpTool;
import ai.agentdeck.mcp.capability.ToolCategory;
import ai.agentdeck.mcp.config.McpConfigStore;
import ai.agentdeck.mcp.config.McpScope;
import ai.agentdeck.mcp.config.McpSettings;
import ai.agentdeck.mcp.config.OAuthSettings;
import ai.agentdeck.mcp.config.ServerDefinition;
import ai.agentdeck.mcp.registry.RegistryClient;
import ai.agentdeck.mcp.registry.ServerConfigOptions;
import ai.agentdeck.mcp.rpc.JsonRpc;
import ai.agentdeck.mcp.rpc.JsonRpcException;
import ai.agentdeck.mcp.rpc.RequestCancelledException;
import ai.agentdeck.mcp.transport.TransportException;
import ai.agentdeck.testutil.FakeMcpServer;
import ai.agentdeck.testutil.FakeTransportFactory;
import ai.agentdeck.testutil.MutableClock;
import ai.agentdeck.util.Json;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.Level;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class McpManagerTest {

    @TempDir
    Path tempDir;

    private McpConfigStore store;
    private FakeTransportFactory factory;
    private McpManager manager;
    private final List<McpEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        store = new McpConfigStore(tempDir.resolve("config"));
        factory = new FakeTransportFactory()
                .register("fs", () -> new FakeMcpServer()
                        .withTool("read_file", "Read a file")
                        .withResource("file:///notes.txt", "notes")
                        .withPrompt("summarize", "Summarize a file"));
        manager = newManager(null);
    }

    private McpManager newManager(@Nullable RegistryClient registry) {
        var m = new McpManager(
                store, factory, registry, new MutableClock(Instant.parse("2026-01-01T00:00:00Z")), Duration.ofMillis(200));
        m.initialize(tempDir.resolve("project"), false);
        m.addEventListener(events::add);
        return m;
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private static ServerDefinition stdio(String id) {
        return ServerDefinition.stdio(id, "npx", List.of("-y", "@example/" + id), McpScope.USER);
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        var ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return ex.getCause();
    }

    private static void eventually(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5 seconds");
            }
            Thread.sleep(10);
        }
    }

    private List<String> toolNames() {
        return manager.getAllTools().stream().map(McpTool::name).toList();
    }

    @Test
    void failingServerDoesNotAffectHealthyOne() throws Exception {
        manager.addServer(stdio("fs"));
        manager.addServer(stdio("git"));

        await(manager.startAll());

        assertEquals(ServerStatus.RUNNING, manager.getServerStatus("fs"));
        assertEquals(ServerStatus.ERROR, manager.getServerStatus("git"));
        assertTrue(manager.getLastError("git").contains("Cannot run program"));
        assertNull(manager.getLastError("fs"));
        assertEquals(List.of("read_file"), toolNames());
        assertEquals(1, manager.getAllResources().size());
        assertEquals(1, manager.getAllPrompts().size());

        var gitStart = manager.start("git");
        assertInstanceOf(TransportException.class, failureOf(gitStart));
        assertEquals(ServerStatus.ERROR, manager.getServerStatus("git"));
    }

    @Test
    void unexpectedConnectFailureMovesServerToError() throws Exception {
        factory.register("broken", () -> {
            throw new IllegalStateException("transport setup blew up");
        });
        manager.addServer(stdio("broken"));

        var error = failureOf(manager.start("broken"));
        assertInstanceOf(McpException.class, error);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals(ServerStatus.ERROR, manager.getServerStatus("broken"));
        assertEquals("transport setup blew up", manager.getLastError("broken"));

        // the failed attempt is not joined by the next one
        factory.register("broken", FakeMcpServer::new);
        await(manager.start("broken"));
        assertEquals(ServerStatus.RUNNING, manager.getServerStatus("broken"));
    }

    @Test
    void handshakeSendsInitializeThenInitializedThenLists() throws Exception {
        manager.addServer(stdio("fs"));

        await(manager.start("fs"));

        var fake = factory.last("fs");
        assertEquals(List.of("initialize", "notifications/initialized"), fake.received.subList(0, 2));
        assertTrue(fake.received.containsAll(List.of("tools/list", "resources/list", "prompts/list")));

        var init = fake.sent.get(0);
        assertEquals(McpManager.PROTOCOL_VERSION, init.path("params").path("protocolVersion").asText());
        assertEquals("agentdeck", init.path("params").path("clientInfo").path("name").asText());

        var info = manager.getServerInfo("fs");
        assertNotNull(info);
        assertEquals("fake-server", info.name());
        assertEquals("2024-11-05", info.protocolVersion());
    }

    @Test
    void startIsIdempotentWhileRunning() throws Exception {
        manager.addServer(stdio("fs"));
        await(manager.start("fs"));
        var first = factory.last("fs");

        await(manager.start("fs"));

        assertTrue(first == factory.last("fs"));
        assertEquals(1, first.received.stream().filter("initialize"::equals).count());
    }

    @Test
    void restartAfterErrorWorks() throws Exception {
        manager.addServer(stdio("git"));
        failureOf(manager.start("git"));
        assertEquals(ServerStatus.ERROR, manager.getServerStatus("git"));

        factory.register("git", () -> new FakeMcpServer().withTool("git_log", "Show history"));
        await(manager.start("git"));

        assertEquals(ServerStatus.RUNNING, manager.getServerStatus("git"));
        assertNull(manager.getLastError("git"));
        assertEquals(List.of("git_log"), toolNames());
    }

    @Test
    void stopCancelsPendingRequests() throws Exception {
        factory.register("fs", () -> new FakeMcpServer().withTool("read_file", "Read").silent("tools/call"));
        manager.addServer(stdio("fs"));
        await(manager.start("fs"));

        var call = manager.callTool("fs", "read_file", Map.of("path", "/tmp/x"));
        manager.stop("fs");

        assertInstanceOf(RequestCancelledException.class, failureOf(call));
        assertEquals(ServerStatus.STOPPED, manager.getServerStatus("fs"));
        assertFalse(factory.last("fs").isOpen());
        assertTrue(manager.getAllTools().isEmpty());

        manager.stop("fs");
        assertEquals(ServerStatus.STOPPED, manager.getServerStatus("fs"));
    }

    @Test
    void stopDuringStartupAbortsTheStart() throws Exception {
        factory.register("fs", () -> new FakeMcpServer().silent("initialize"));
        manager.addServer(stdio("fs"));

        var start = manager.start("fs");
        eventually(() -> {
            try {
                return !factory.last("fs").received.isEmpty();
            } catch (IllegalStateException notYetCreated) {
                return false;
            }
        });
        assertTrue(start == manager.start("fs"));
        manager.stop("fs");

        assertInstanceOf(RequestCancelledException.class, failureOf(start));
        assertEquals(ServerStatus.STOPPED, manager.getServerStatus("fs"));
    }

    @Test
    void listChangedNotificationRefreshesTools() throws Exception {
        manager.addServer(stdio("fs"));
        await(manager.start("fs"));
        var fake = factory.last("fs");

        fake.clearTools();
        fake.withTool("write_file", "Write a file");
        fake.sendNotification("notifications/tools/list_changed");

        eventually(() -> toolNames().equals(List.of("write_file")));
        assertEquals(1, manager.getAllResources().size());
        assertEquals(ServerStatus.RUNNING, manager.getServerStatus("fs"));
    }

    @Test
    void logNotificationsBecomeEvents() throws Exception {
        manager.addServer(stdio("fs"));
        await(manager.start("fs"));

        var params = Json.object();
        params.put("level", "warning");
        params.put("data", "disk almost full");
        factory.last("fs").deliver(JsonRpc.notification("notifications/message", params));

        assertTrue(events.stream()
                .anyMatch(e -> e.kind() == McpEvent.Kind.LOG_MESSAGE && "disk almost full".equals(e.detail())));
    }

    @Test
    void mapsServerLogLevels() {
        assertEquals(Level.DEBUG, McpManager.logLevel("debug"));
        assertEquals(Level.INFO, McpManager.logLevel("info"));
        assertEquals(Level.INFO, McpManager.logLevel("notice"));
        assertEquals(Level.WARN, McpManager.logLevel("warning"));
        assertEquals(Level.ERROR, McpManager.logLevel("error"));
        assertEquals(Level.FATAL, McpManager.logLevel("critical"));
        assertEquals(Level.FATAL, McpManager.logLevel("alert"));
        assertEquals(Level.FATAL, McpManager.logLevel("emergency"));
        assertEquals(Level.INFO, McpManager.logLevel("chatty"));
    }

    @Test
    void disabledServerIsNotStarted() throws Exception {
        manager.addServer(stdio("fs").withDisabled(true));

        var ex = failureOf(manager.start("fs"));
        assertEquals(McpException.class, ex.getClass());
        assertTrue(ex.getMessage().contains("disabled"));

        await(manager.startAll());
        assertEquals(ServerStatus.STOPPED, manager.getServerStatus("fs"));
        assertThrows(IllegalStateException.class, () -> factory.last("fs"));
    }

    @Test
    void deniedServerIsNotStarted() throws Exception {
        manager.addServer(stdio("fs"));
        store.setSetting(McpSettings.DENIED_SERVERS, List.of("fs"), McpScope.USER);

        await(manager.startAll());

        assertEquals(ServerStatus.STOPPED, manager.getServerStatus("fs"));
        assertInstanceOf(McpException.class, failureOf(manager.start("fs")));
        assertThrows(IllegalStateException.class, () -> factory.last("fs"));
    }

    @Test
    void nonZeroExitMovesToError() throws Exception {
        manager.addServer(stdio("fs"));
        await(manager.start("fs"));

        factory.last("fs").exit(1);

        eventually(() -> manager.getServerStatus("fs") == ServerStatus.ERROR);
        assertTrue(manager.getLastError("fs").contains("code 1"));
        assertTrue(manager.getAllTools().isEmpty());
        assertTrue(events.stream()
                .anyMatch(e -> e.kind() == McpEvent.Kind.ERROR && e.serverId().equals("fs")));
    }

    @Test
    void cleanExitMovesToStopped() throws Exception {
        manager.addServer(stdio("fs"));
        await(manager.start("fs"));

        factory.last("fs").exit(0);

        eventually(() -> manager.getServerStatus("fs") == ServerStatus.STOPPED);
        assertNull(manager.getLastError("fs"));
    }

    @Test
    void callsRequireRunningServer() throws Exception {
        manager.addServer(stdio("fs"));

        assertInstanceOf(ServerNotRunningException.class, failureOf(manager.callTool("fs", "read_file", Map.of())));
        assertInstanceOf(ServerNotRunningException.class, failureOf(manager.readResource("fs", "file:///x")));
        assertInstanceOf(ServerNotRunningException.class, failureOf(manager.getPrompt("fs", "summarize", Map.of())));
        assertInstanceOf(ServerNotFoundException.class, failureOf(manager.callTool("nope", "x", Map.of())));
        assertInstanceOf(ServerNotFoundException.class, failureOf(manager.start("nope")));
        assertEquals(ServerStatus.STOPPED, manager.getServerStatus("nope"));
    }

    @Test
    void callToolReturnsResult() throws Exception {
        manager.addServer(stdio("fs"));
        await(manager.start("fs"));

        var result = await(manager.callTool("fs", "read_file", Map.of("path", "/tmp/a.txt")));

        assertEquals("called read_file", result.path("content").get(0).path("text").asText());
        var request = factory.last("fs").lastSent();
        assertEquals("tools/call", request.path("method").asText());
        assertEquals("/tmp/a.txt", request.path("params").path("arguments").path("path").asText());
    }

    @Test
    void jsonRpcErrorLeavesServerRunning() throws Exception {
        factory.register("fs", () -> new FakeMcpServer().withTool("read_file", "Read").failing("tools/call"));
        manager.addServer(stdio("fs"));
        await(manager.start("fs"));

        var error = failureOf(manager.callTool("fs", "read_file", Map.of()));

        var rpc = assertInstanceOf(JsonRpcException.class, error);
        assertEquals(JsonRpcException.METHOD_NOT_FOUND, rpc.code());
        assertEquals(ServerStatus.RUNNING, manager.getServerStatus("fs"));
    }

    @Test
    void failingPromptListStillStartsServer() throws Exception {
        factory.register("fs", () -> new FakeMcpServer().withTool("read_file", "Read").failing("prompts/list"));
        manager.addServer(stdio("fs"));

        await(manager.start("fs"));

        assertEquals(ServerStatus.RUNNING, manager.getServerStatus("fs"));
        assertEquals(1, manager.getAllTools().size());
        assertTrue(manager.getAllPrompts().isEmpty());
    }

    @Test
    void emitsLifecycleEvents() throws Exception {
        manager.addServer(stdio("fs"));
        await(manager.start("fs"));
        manager.stop("fs");

        var kinds = events.stream()
                .filter(e -> e.serverId().equals("fs"))
                .map(McpEvent::kind)
                .toList();
        assertEquals(McpEvent.Kind.REGISTERED, kinds.get(0));
        assertEquals(McpEvent.Kind.STARTING, kinds.get(1));
        assertTrue(kinds.contains(McpEvent.Kind.TOOLS_CHANGED));
        assertTrue(kinds.indexOf(McpEvent.Kind.STARTED) > kinds.indexOf(McpEvent.Kind.TOOLS_CHANGED));
        assertEquals(McpEvent.Kind.STOPPED, kinds.get(kinds.size() - 1));
    }

    @Test
    void viewsExposeCapabilitiesOfRunningServers() throws Exception {
        factory.register("fs", () -> new FakeMcpServer()
                .withTool("read_file", "Read a file")
                .withTool("git_status", "Show status")
                .withTool("weather", "Forecast"));
        manager.addServer(stdio("fs"));
        await(manager.start("fs"));

        assertEquals(List.of("read_file"), manager.searchTools("read").tools().stream().map(McpTool::name).toList());
        assertTrue(manager.searchToolsCached("status") == manager.searchToolsCached("status"));
        assertEquals(
                Map.of(ToolCategory.FILESYSTEM, 1, ToolCategory.GIT, 1, ToolCategory.OTHER, 1),
                manager.getCategories("fs"));
        assertEquals(1, manager.getToolsByCategory("fs", ToolCategory.GIT).size());
        assertEquals("read_file", manager.getRelevantTools("fs", "please read_file").get(0).name());

        var snapshot = manager.listServers().stream().filter(s -> s.id().equals("fs")).findFirst().orElseThrow();
        assertEquals(3, snapshot.toolCount());
        assertEquals(ServerStatus.RUNNING, snapshot.status());
        assertEquals(McpScope.USER, snapshot.scope());
        assertNotNull(snapshot.serverInfo());
    }

    @Test
    void setEnabledPersistsAndStops() throws Exception {
        manager.addServer(stdio("fs"));
        await(manager.start("fs"));

        manager.setEnabled("fs", false);

        assertEquals(ServerStatus.STOPPED, manager.getServerStatus("fs"));
        assertTrue(store.getServer("fs").disabled());
        assertInstanceOf(McpException.class, failureOf(manager.start("fs")));

        manager.setEnabled("fs", true);
        await(manager.start("fs"));
        assertEquals(ServerStatus.RUNNING, manager.getServerStatus("fs"));
    }

    @Test
    void builtInServersCanBeEnabled() throws Exception {
        manager.close();
        events.clear();
        manager = new McpManager(
                store, factory, null, new MutableClock(Instant.parse("2026-01-01T00:00:00Z")), Duration.ofMillis(200));
        manager.initialize(tempDir.resolve("project"), true);

        var ids = manager.listServers().stream().map(ServerSnapshot::id).toList();
        assertTrue(ids.containsAll(List.of("filesystem", "git", "github", "postgres", "brave-search")));
        assertNull(store.getServer("postgres"));

        manager.setEnabled("postgres", true);

        assertFalse(store.getServer("postgres").disabled());
        assertEquals(McpScope.USER, store.owningScope("postgres"));
    }

    @Test
    void removeServerUnregistersAndForgets() throws Exception {
        manager.addServer(stdio("fs"));
        await(manager.start("fs"));

        manager.removeServer("fs");

        assertNull(store.getServer("fs"));
        assertTrue(manager.listServers().stream().noneMatch(s -> s.id().equals("fs")));
        assertFalse(factory.last("fs").isOpen());
        assertThrows(ServerNotFoundException.class, () -> manager.removeServer("fs"));
    }

    @Test
    void installsFromRegistry() throws Exception {
        var cacheDir = tempDir.resolve("registry");
        Files.createDirectories(cacheDir);
        Files.writeString(
                cacheDir.resolve("registry-cache.json"),
                """
                {"timestamp": "2026-01-01T00:00:00Z",
                 "entries": [{"id": "com.example/echo", "name": "Echo",
                              "packages": [{"registryType": "npm", "identifier": "echo-mcp"}]}]}
                """);
        var registry = new RegistryClient(new OkHttpClient(), "http://127.0.0.1:1", cacheDir, Clock.systemUTC());
        registry.loadCache();
        manager.close();
        manager = newManager(registry);

        var def = manager.installFromRegistry("com.example/echo", ServerConfigOptions.DEFAULTS);

        assertEquals(List.of("-y", "echo-mcp"), def.args());
        assertEquals(McpScope.LOCAL, store.owningScope("com.example/echo"));
        assertTrue(manager.listServers().stream().anyMatch(s -> s.id().equals("com.example/echo")));
        assertThrows(
                ServerNotFoundException.class,
                () -> manager.installFromRegistry("com.example/missing", ServerConfigOptions.DEFAULTS));
    }

    @Test
    void installWithoutRegistryIsRejected() {
        assertThrows(
                IllegalStateException.class,
                () -> manager.installFromRegistry("anything", ServerConfigOptions.DEFAULTS));
    }

    @Test
    void authenticateRequiresOAuthBlock() throws Exception {
        manager.addServer(stdio("fs"));
        assertInstanceOf(IllegalStateException.class, failureOf(manager.authenticate("fs")));

        int port;
        try (var socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        manager.addServer(stdio("secure").toBuilder().oauth(new OAuthSettings("client", null, port)).build());

        var outcome = manager.authenticate("secure");

        assertInstanceOf(McpTimeoutException.class, failureOf(outcome));
        assertInstanceOf(ServerNotFoundException.class, failureOf(manager.authenticate("nope")));
    }
}
