package ai.agentdeck.mcp.capability;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.agentdeck.mcp.rpc.JsonRpcException;
import ai.agentdeck.mcp.rpc.McpRequester;
import ai.agentdeck.testutil.MutableClock;
import ai.agentdeck.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CapabilityIndexTest {

    private final List<String> running = new CopyOnWriteArrayList<>();
    private final List<String> changes = new CopyOnWriteArrayList<>();
    private MutableClock clock;
    private CapabilityIndex index;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        index = new CapabilityIndex(
                () -> List.copyOf(running),
                Runnable::run,
                clock,
                Duration.ofMinutes(5),
                (serverId, kind, snapshot) -> changes.add(serverId + ":" + kind));
    }

    /** Requester answering the list methods from fixed content. */
    private static final class StaticServer implements McpRequester {
        final List<String> calls = new CopyOnWriteArrayList<>();
        final List<String> tools = new ArrayList<>();
        final List<String> resources = new ArrayList<>();
        final List<String> prompts = new ArrayList<>();
        @Nullable String failing;

        StaticServer tools(String... names) {
            tools.addAll(List.of(names));
            return this;
        }

        @Override
        public CompletableFuture<JsonNode> call(String method, @Nullable JsonNode params) {
            calls.add(method);
            if (method.equals(failing)) {
                return CompletableFuture.failedFuture(
                        new JsonRpcException(JsonRpcException.METHOD_NOT_FOUND, "Method not found", null));
            }
            var result = Json.object();
            switch (method) {
                case "tools/list" -> tools.forEach(n -> result.withArray("tools")
                        .addObject()
                        .put("name", n)
                        .put("description", "Tool " + n));
                case "resources/list" -> resources.forEach(
                        u -> result.withArray("resources").addObject().put("uri", u));
                case "prompts/list" -> prompts.forEach(
                        n -> result.withArray("prompts").addObject().put("name", n));
                default -> {}
            }
            return CompletableFuture.completedFuture(result);
        }
    }

    private ServerCapabilities discover(String serverId, McpRequester requester) throws Exception {
        index.open(serverId);
        running.add(serverId);
        return index.discover(serverId, requester).get(5, TimeUnit.SECONDS);
    }

    @Test
    void failingListLeavesOnlyThatKindEmpty() throws Exception {
        var server = new StaticServer().tools("read_file", "write_file");
        server.resources.add("file:///readme.md");
        server.failing = "prompts/list";

        var caps = discover("fs", server);

        assertEquals(2, caps.tools().size());
        assertEquals(1, caps.resources().size());
        assertEquals("file:///readme.md", caps.resources().get(0).name());
        assertTrue(caps.prompts().isEmpty());
        assertEquals(caps, index.capabilities("fs"));
    }

    @Test
    void aggregationAndSearchCoverRunningServersOnly() throws Exception {
        discover("fs", new StaticServer().tools("read_file"));
        discover("git", new StaticServer().tools("git_log", "read_blob"));
        running.remove("git");

        assertEquals(List.of("read_file"), index.getAllTools().stream().map(McpTool::name).toList());
        var result = index.searchTools("READ");
        assertEquals(List.of("read_file"), result.tools().stream().map(McpTool::name).toList());
        assertEquals("READ", result.query());
    }

    @Test
    void searchMatchesDescriptionsResourcesAndPrompts() throws Exception {
        var server = new StaticServer().tools("alpha");
        server.resources.add("db://alpha/table");
        server.prompts.add("alpha_prompt");
        discover("s", server);

        var result = index.searchTools("alpha");
        assertEquals(1, result.tools().size());
        assertEquals(1, result.resources().size());
        assertEquals(1, result.prompts().size());

        assertEquals(1, index.searchTools("tool alpha").tools().size());
        assertTrue(index.searchTools("zzz").isEmpty());
    }

    @Test
    void cachedSearchHonorsTtlAndInvalidation() throws Exception {
        var server = new StaticServer().tools("read_file");
        discover("fs", server);

        var first = index.searchToolsCached("read");
        clock.advance(Duration.ofMinutes(5));
        assertSame(first, index.searchToolsCached("read"));

        clock.advance(Duration.ofSeconds(1));
        var expired = index.searchToolsCached("read");
        assertNotSame(first, expired);

        server.tools.add("read_dir");
        index.refresh("fs", server, CapabilityKind.TOOLS).get(5, TimeUnit.SECONDS);
        var afterChange = index.searchToolsCached("read");
        assertNotSame(expired, afterChange);
        assertEquals(2, afterChange.tools().size());
    }

    @Test
    void expiredSearchesAreEvictedWhenNewOnesAreCached() throws Exception {
        discover("fs", new StaticServer().tools("read_file"));

        index.searchToolsCached("r");
        index.searchToolsCached("re");
        index.searchToolsCached("rea");
        assertEquals(3, index.searchCacheSize());

        clock.advance(Duration.ofMinutes(6));
        index.searchToolsCached("read");
        assertEquals(1, index.searchCacheSize());
    }

    @Test
    void relevantToolsRankDirectMentionsFirst() throws Exception {
        discover("s", new StaticServer().tools("git_commit", "run_query", "read_file"));

        var relevant = index.getRelevantTools("s", "read file then commit it");

        assertEquals(List.of("read_file", "git_commit"), relevant.stream().map(McpTool::name).toList());
    }

    @Test
    void relevantToolsFallBackToFirstFew() throws Exception {
        discover("s", new StaticServer().tools("a1", "a2", "a3", "a4", "a5", "a6"));

        var relevant = index.getRelevantTools("s", "hello there");

        assertEquals(CapabilityIndex.RELEVANT_FALLBACK_LIMIT, relevant.size());
        assertEquals("a1", relevant.get(0).name());
        assertTrue(index.getRelevantTools("unknown", "anything").isEmpty());
    }

    @Test
    void refreshReplacesOnlyThatKind() throws Exception {
        var server = new StaticServer().tools("one");
        server.prompts.add("p");
        discover("s", server);
        server.tools.clear();
        server.tools.add("two");
        server.prompts.clear();
        server.calls.clear();

        var caps = index.refresh("s", server, CapabilityKind.TOOLS).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("two"), caps.tools().stream().map(McpTool::name).toList());
        assertEquals(1, caps.prompts().size());
        assertEquals(List.of("tools/list"), server.calls);
        assertTrue(changes.contains("s:TOOLS"));
    }

    @Test
    void categoriesFollowTools() throws Exception {
        discover("s", new StaticServer().tools("read_file", "write_file", "git_log", "weather"));

        assertEquals(
                Map.of(ToolCategory.FILESYSTEM, 2, ToolCategory.GIT, 1, ToolCategory.OTHER, 1),
                index.getCategories("s"));
        assertEquals(
                List.of("git_log"),
                index.getToolsByCategory("s", ToolCategory.GIT).stream().map(McpTool::name).toList());
        assertTrue(index.getToolsByCategory("s", ToolCategory.DATABASE).isEmpty());
    }

    @Test
    void passFinishingAfterCloseIsDiscarded() throws Exception {
        var pending = new CompletableFuture<JsonNode>();
        McpRequester slow = (method, params) -> method.equals("tools/list")
                ? pending
                : CompletableFuture.completedFuture(Json.object());
        index.open("s");
        running.add("s");
        var pass = index.discover("s", slow);

        index.close("s");
        index.open("s");
        var tools = Json.object();
        tools.withArray("tools").addObject().put("name", "late_tool");
        pending.complete(tools);
        pass.get(5, TimeUnit.SECONDS);

        assertTrue(index.capabilities("s").tools().isEmpty());
        assertFalse(changes.contains("s:TOOLS"));
    }

    @Test
    void passesForOneServerDoNotOverlap() throws Exception {
        var gate = new CompletableFuture<JsonNode>();
        var calls = new CopyOnWriteArrayList<String>();
        BiFunction<String, JsonNode, CompletableFuture<JsonNode>> answer = (method, params) -> {
            calls.add(method);
            if (method.equals("tools/list") && calls.size() <= 3) {
                return gate;
            }
            return CompletableFuture.completedFuture(Json.object());
        };
        index.open("s");
        var first = index.discover("s", answer::apply);
        var second = index.refresh("s", answer::apply, CapabilityKind.TOOLS);

        assertEquals(3, calls.size());
        assertFalse(second.isDone());

        gate.complete(Json.object());
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);
        assertEquals(4, calls.size());
    }

    @Test
    void followsNextCursorAcrossPages() throws Exception {
        var cursors = new CopyOnWriteArrayList<String>();
        McpRequester paged = (method, params) -> {
            var result = Json.object();
            if (method.equals("tools/list")) {
                var cursor = params == null ? null : params.path("cursor").asText(null);
                cursors.add(String.valueOf(cursor));
                int page = cursor == null ? 0 : Integer.parseInt(cursor);
                result.withArray("tools").addObject().put("name", "tool_" + page);
                if (page < 2) {
                    result.put("nextCursor", String.valueOf(page + 1));
                }
            }
            return CompletableFuture.completedFuture(result);
        };

        var caps = discover("s", paged);

        assertEquals(List.of("null", "1", "2"), cursors);
        assertEquals(
                List.of("tool_0", "tool_1", "tool_2"),
                caps.tools().stream().map(McpTool::name).toList());
    }
}
