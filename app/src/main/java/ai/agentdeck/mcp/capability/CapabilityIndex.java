package ai.agentdeck.mcp.capability;

import ai.agentdeck.mcp.rpc.McpRequester;
import ai.agentdeck.util.Json;
import ai.agentdeck.util.Throwables;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Per-server cache of discovered tools, resources and prompts, plus cross-server search.
 *
 * <p>Discovery passes for one server run one after another: a pass requested while another is in flight is chained
 * behind it, so a refresh triggered by a notification never interleaves with the discovery started by {@code start}.
 * Each server's capabilities live in an immutable {@link ServerCapabilities} snapshot that is swapped atomically.
 * Results of a pass that finishes after the server was {@linkplain #close closed} (or closed and reopened) are
 * discarded.
 */
public final class CapabilityIndex {
    private static final Logger logger = LogManager.getLogger(CapabilityIndex.class);

    public static final Duration SEARCH_CACHE_TTL = Duration.ofMinutes(5);
    public static final int RELEVANT_FALLBACK_LIMIT = 5;
    private static final int MAX_LIST_PAGES = 50;

    @FunctionalInterface
    public interface ChangeListener {
        void capabilitiesChanged(String serverId, CapabilityKind kind, ServerCapabilities snapshot);
    }

    private record Slot(long epoch, ServerCapabilities capabilities) {}

    private record CachedSearch(SearchResult result, Instant computedAt) {}

    private final Supplier<List<String>> runningServers;
    private final Executor executor;
    private final Clock clock;
    private final Duration searchCacheTtl;
    private final ChangeListener changeListener;

    private final AtomicLong epochs = new AtomicLong();
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<?>> passChains = new ConcurrentHashMap<>();
    private final Map<String, CachedSearch> searchCache = new ConcurrentHashMap<>();

    /**
     * @param runningServers ids of the servers currently running, in enumeration order; only these are searched
     * @param executor runs discovery passes so they never execute on a transport reader thread
     */
    public CapabilityIndex(
            Supplier<List<String>> runningServers,
            Executor executor,
            Clock clock,
            Duration searchCacheTtl,
            ChangeListener changeListener) {
        this.runningServers = runningServers;
        this.executor = executor;
        this.clock = clock;
        this.searchCacheTtl = searchCacheTtl;
        this.changeListener = changeListener;
    }

    /** Starts tracking a server with empty capabilities, discarding anything left from a previous run. */
    public void open(String serverId) {
        slots.put(serverId, new Slot(epochs.incrementAndGet(), ServerCapabilities.EMPTY));
        invalidateSearchCache();
    }

    /** Forgets everything known about a server. Passes still in flight for it will not write their results. */
    public void close(String serverId) {
        if (slots.remove(serverId) != null) {
            invalidateSearchCache();
        }
    }

    /** Lists all three capability kinds. A failing list is logged and left empty; the other two still complete. */
    public CompletableFuture<ServerCapabilities> discover(String serverId, McpRequester requester) {
        return enqueue(serverId, () -> runPass(serverId, requester, EnumSet.allOf(CapabilityKind.class)));
    }

    /** Re-lists one capability kind, typically after a {@code list_changed} notification. */
    public CompletableFuture<ServerCapabilities> refresh(String serverId, McpRequester requester, CapabilityKind kind) {
        return enqueue(serverId, () -> runPass(serverId, requester, EnumSet.of(kind)));
    }

    public ServerCapabilities capabilities(String serverId) {
        var slot = slots.get(serverId);
        return slot != null ? slot.capabilities() : ServerCapabilities.EMPTY;
    }

    private CompletableFuture<ServerCapabilities> enqueue(
            String serverId, Supplier<CompletableFuture<ServerCapabilities>> pass) {
        var result = new CompletableFuture<ServerCapabilities>();
        passChains.compute(serverId, (id, previous) -> {
            CompletableFuture<?> tail = previous != null ? previous : CompletableFuture.completedFuture(null);
            return tail.handle((ignored, error) -> null)
                    .thenComposeAsync(ignored -> pass.get(), executor)
                    .whenComplete((capabilities, error) -> {
                        if (error != null) {
                            result.completeExceptionally(Throwables.unwrap(error));
                        } else {
                            result.complete(capabilities);
                        }
                    });
        });
        return result;
    }

    private CompletableFuture<ServerCapabilities> runPass(
            String serverId, McpRequester requester, Set<CapabilityKind> kinds) {
        var slot = slots.get(serverId);
        if (slot == null) {
            logger.debug("Skipping discovery for {}: server is no longer open", serverId);
            return CompletableFuture.completedFuture(ServerCapabilities.EMPTY);
        }
        long epoch = slot.epoch();
        var steps = new ArrayList<CompletableFuture<Void>>();
        for (var kind : kinds) {
            steps.add(listAll(requester, kind, null, new ArrayList<>(), 0).handle((items, error) -> {
                if (error != null) {
                    logger.warn(
                            "{} failed for MCP server {}: {}",
                            kind.listMethod(),
                            serverId,
                            Throwables.rootMessage(Throwables.unwrap(error)));
                    store(serverId, epoch, kind, List.of());
                } else {
                    store(serverId, epoch, kind, items);
                }
                return null;
            }));
        }
        return CompletableFuture.allOf(steps.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> capabilities(serverId));
    }

    private CompletableFuture<List<JsonNode>> listAll(
            McpRequester requester, CapabilityKind kind, @Nullable String cursor, List<JsonNode> collected, int page) {
        var params = cursor != null ? Json.object().put("cursor", cursor) : null;
        return requester.call(kind.listMethod(), params).thenCompose(result -> {
            result.path(kind.resultField()).forEach(collected::add);
            var next = result.path("nextCursor");
            if (next.isTextual() && !next.asText().isEmpty() && page + 1 < MAX_LIST_PAGES) {
                return listAll(requester, kind, next.asText(), collected, page + 1);
            }
            return CompletableFuture.completedFuture(collected);
        });
    }

    private void store(String serverId, long epoch, CapabilityKind kind, List<JsonNode> items) {
        var updated = new AtomicBoolean();
        var slot = slots.computeIfPresent(serverId, (id, current) -> {
            if (current.epoch() != epoch) {
                return current;
            }
            updated.set(true);
            return new Slot(epoch, apply(serverId, current.capabilities(), kind, items));
        });
        if (!updated.get() || slot == null) {
            logger.debug("Discarding stale {} for {}", kind.listMethod(), serverId);
            return;
        }
        logger.debug("MCP server {} advertises {} {}", serverId, items.size(), kind.resultField());
        invalidateSearchCache();
        try {
            changeListener.capabilitiesChanged(serverId, kind, slot.capabilities());
        } catch (RuntimeException e) {
            logger.warn("Capability listener failed for {}", serverId, e);
        }
    }

    private static ServerCapabilities apply(
            String serverId, ServerCapabilities current, CapabilityKind kind, List<JsonNode> items) {
        return switch (kind) {
            case TOOLS -> current.withTools(
                    items.stream().map(n -> McpTool.fromWire(serverId, n)).toList());
            case RESOURCES -> current.withResources(
                    items.stream().map(n -> McpResource.fromWire(serverId, n)).toList());
            case PROMPTS -> current.withPrompts(
                    items.stream().map(n -> McpPrompt.fromWire(serverId, n)).toList());
        };
    }

    public List<McpTool> getAllTools() {
        var all = new ArrayList<McpTool>();
        runningServers.get().forEach(id -> all.addAll(capabilities(id).tools()));
        return all;
    }

    public List<McpResource> getAllResources() {
        var all = new ArrayList<McpResource>();
        runningServers.get().forEach(id -> all.addAll(capabilities(id).resources()));
        return all;
    }

    public List<McpPrompt> getAllPrompts() {
        var all = new ArrayList<McpPrompt>();
        runningServers.get().forEach(id -> all.addAll(capabilities(id).prompts()));
        return all;
    }

    /** Case-insensitive substring search over the running servers. No ranking: results keep enumeration order. */
    public SearchResult searchTools(String query) {
        var needle = query.toLowerCase(Locale.ROOT);
        var tools = new ArrayList<McpTool>();
        var resources = new ArrayList<McpResource>();
        var prompts = new ArrayList<McpPrompt>();
        for (var serverId : runningServers.get()) {
            var caps = capabilities(serverId);
            caps.tools().stream()
                    .filter(t -> contains(t.name(), needle) || contains(t.description(), needle))
                    .forEach(tools::add);
            caps.resources().stream()
                    .filter(r -> contains(r.name(), needle)
                            || contains(r.description(), needle)
                            || contains(r.uri(), needle))
                    .forEach(resources::add);
            caps.prompts().stream()
                    .filter(p -> contains(p.name(), needle) || contains(p.description(), needle))
                    .forEach(prompts::add);
        }
        return new SearchResult(query, tools, resources, prompts);
    }

    /**
     * {@link #searchTools} behind a cache keyed by the literal query. Within the TTL the cached object itself is
     * returned; the cache is also dropped whenever any server's capabilities change.
     */
    public SearchResult searchToolsCached(String query) {
        var now = clock.instant();
        var cached = searchCache.get(query);
        if (cached != null && !isExpired(cached, now)) {
            return cached.result();
        }
        var fresh = searchTools(query);
        searchCache.values().removeIf(entry -> isExpired(entry, now));
        searchCache.put(query, new CachedSearch(fresh, now));
        return fresh;
    }

    private boolean isExpired(CachedSearch entry, Instant now) {
        return Duration.between(entry.computedAt(), now).compareTo(searchCacheTtl) > 0;
    }

    int searchCacheSize() {
        return searchCache.size();
    }

    public void invalidateSearchCache() {
        searchCache.clear();
    }

    /**
     * Tools of one server that look useful for {@code context}. Direct mentions rank before tools whose category the
     * context implies; tools matching neither are left out. When nothing matches, the first
     * {@value #RELEVANT_FALLBACK_LIMIT} tools are returned instead of an empty list.
     */
    public List<McpTool> getRelevantTools(String serverId, String context) {
        var tools = capabilities(serverId).tools();
        var lowered = context.toLowerCase(Locale.ROOT);
        var inferred = ToolCategorizer.inferCategories(context);

        record Scored(McpTool tool, int score) {}
        var scored = new ArrayList<Scored>();
        for (var tool : tools) {
            int score = 0;
            var name = tool.name().toLowerCase(Locale.ROOT);
            if (!name.isEmpty() && (lowered.contains(name) || lowered.contains(name.replace('_', ' ')))) {
                score = 2;
            } else if (!lowered.isBlank() && contains(tool.description(), lowered)) {
                score = 2;
            } else if (inferred.contains(ToolCategorizer.categorize(tool))) {
                score = 1;
            }
            if (score > 0) {
                scored.add(new Scored(tool, score));
            }
        }
        if (scored.isEmpty()) {
            return tools.stream().limit(RELEVANT_FALLBACK_LIMIT).toList();
        }
        return scored.stream()
                .sorted(Comparator.comparingInt(Scored::score).reversed())
                .map(Scored::tool)
                .toList();
    }

    /** Number of tools per non-empty category, in category priority order. */
    public Map<ToolCategory, Integer> getCategories(String serverId) {
        var counts = new EnumMap<ToolCategory, Integer>(ToolCategory.class);
        capabilities(serverId).toolsByCategory().forEach((category, list) -> {
            if (!list.isEmpty()) {
                counts.put(category, list.size());
            }
        });
        return counts;
    }

    public List<McpTool> getToolsByCategory(String serverId, ToolCategory category) {
        return capabilities(serverId).toolsIn(category);
    }

    private static boolean contains(@Nullable String haystack, String loweredNeedle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(loweredNeedle);
    }
}
