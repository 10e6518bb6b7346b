package ai.agentdeck.mcp.registry;

import ai.agentdeck.mcp.config.ServerDefinition;
import ai.agentdeck.mcp.config.ServerMetadata;
import ai.agentdeck.mcp.config.TransportType;
import ai.agentdeck.util.AtomicWrites;
import ai.agentdeck.util.ConfigPaths;
import ai.agentdeck.util.Json;
import ai.agentdeck.util.Throwables;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Client for the remote catalog of installable MCP servers.
 *
 * <p>The catalog is kept in memory and mirrored to {@code registry-cache.json} in the cache directory. A failed sync
 * leaves both the in-memory entries and the last sync time untouched, so callers keep working from the stale copy.
 */
public final class RegistryClient {
    private static final Logger logger = LogManager.getLogger(RegistryClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com/mcp-registry/v0";
    public static final Duration CACHE_TTL = Duration.ofHours(24);
    static final String CACHE_FILE = "registry-cache.json";
    static final String META_KEY = "com.anthropic.api/mcp-registry";

    private static final TypeReference<List<RegistryEntry.InstallPackage>> PACKAGE_LIST = new TypeReference<>() {};
    private static final TypeReference<List<RegistryEntry.Remote>> REMOTE_LIST = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    /** On-disk shape of the cache file. */
    record CacheSnapshot(Instant timestamp, List<RegistryEntry> entries) {}

    private final OkHttpClient httpClient;
    private final String baseUrl;
    private final Path cacheFile;
    private final Clock clock;

    private volatile Map<String, RegistryEntry> entries = Map.of();
    private volatile @Nullable Instant lastSync;

    public RegistryClient(OkHttpClient httpClient) {
        this(httpClient, DEFAULT_BASE_URL, ConfigPaths.getCacheDir().resolve("mcp"), Clock.systemUTC());
    }

    public RegistryClient(OkHttpClient httpClient, String baseUrl, Path cacheDir, Clock clock) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.cacheFile = cacheDir.resolve(CACHE_FILE);
        this.clock = clock;
    }

    /** Loads the on-disk snapshot, if any. A missing or unreadable cache leaves the client empty. */
    public synchronized void loadCache() {
        if (!Files.exists(cacheFile)) {
            logger.debug("No MCP registry cache at {}", cacheFile);
            return;
        }
        try {
            var snapshot = Json.mapper().readValue(Files.readString(cacheFile), CacheSnapshot.class);
            if (snapshot == null || snapshot.entries() == null) {
                logger.debug("Ignoring empty MCP registry cache at {}", cacheFile);
                return;
            }
            entries = index(snapshot.entries());
            lastSync = snapshot.timestamp();
            logger.info("Loaded {} MCP servers from registry cache", entries.size());
        } catch (IOException | RuntimeException e) {
            logger.warn("Ignoring unreadable MCP registry cache {}: {}", cacheFile, Throwables.rootMessage(e));
        }
    }

    /**
     * Fetches the whole catalog, replaces the in-memory entries and rewrites the cache file.
     *
     * @return false when the fetch failed and the previous data is still being served
     */
    @Blocking
    public boolean sync() {
        var url = HttpUrl.parse(baseUrl + "/servers");
        if (url == null) {
            logger.error("Invalid MCP registry URL: {}", baseUrl);
            return false;
        }
        var request = new Request.Builder()
                .url(url.newBuilder()
                        .addQueryParameter("version", "latest")
                        .addQueryParameter("visibility", "commercial")
                        .addQueryParameter("limit", "100")
                        .build())
                .header("Accept", "application/json")
                .get()
                .build();

        logger.info("Syncing MCP registry from {}", baseUrl);
        List<RegistryEntry> fetched;
        try (var response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Registry sync failed: HTTP " + response.code());
            }
            var body = response.body();
            if (body == null) {
                throw new IOException("Registry sync failed: empty response");
            }
            fetched = parseCatalog(Json.mapper().readTree(body.string()));
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to sync MCP registry: {}", Throwables.rootMessage(e));
            if (!entries.isEmpty()) {
                logger.warn("Using cached MCP registry data ({} entries)", entries.size());
            }
            return false;
        }

        synchronized (this) {
            entries = index(fetched);
            lastSync = clock.instant();
            saveCache();
        }
        logger.info("Synced {} MCP servers from registry", fetched.size());
        return true;
    }

    public CompletableFuture<Boolean> syncAsync(Executor executor) {
        return CompletableFuture.supplyAsync(this::sync, executor);
    }

    static List<RegistryEntry> parseCatalog(JsonNode root) throws IOException {
        var servers = root.get("servers");
        if (servers == null || !servers.isArray()) {
            throw new IOException("Registry response has no servers array");
        }
        var result = new ArrayList<RegistryEntry>();
        for (var item : servers) {
            var server = item.path("server");
            if (!server.isObject()) {
                continue;
            }
            result.add(toEntry(server, item.path("_meta").path(META_KEY)));
        }
        return result;
    }

    private static RegistryEntry toEntry(JsonNode server, JsonNode meta) {
        var mapper = Json.mapper();
        var id = firstText(server, "name", "id");
        List<RegistryEntry.InstallPackage> packages =
                server.has("packages") ? mapper.convertValue(server.get("packages"), PACKAGE_LIST) : List.of();
        List<RegistryEntry.Remote> remotes =
                server.has("remotes") ? mapper.convertValue(server.get("remotes"), REMOTE_LIST) : List.of();
        var transports = remotes.isEmpty()
                ? List.of("stdio")
                : remotes.stream().map(RegistryEntry.Remote::type).toList();
        var firstPackageEnv = packages.isEmpty() ? null : packages.get(0).environmentVariables();
        var repository = server.has("repository")
                ? mapper.convertValue(server.get("repository"), RegistryEntry.Repository.class)
                : null;

        return new RegistryEntry(
                id != null ? id : "",
                Optional.ofNullable(firstText(meta, "displayName"))
                        .or(() -> Optional.ofNullable(firstText(server, "title", "name")))
                        .orElse(id != null ? id : ""),
                Optional.ofNullable(firstText(meta, "oneLiner")).orElse(firstText(server, "description")),
                firstText(meta, "publisher"),
                firstText(server, "version"),
                transports,
                meta.has("categories") ? mapper.convertValue(meta.get("categories"), STRING_LIST) : null,
                meta.has("tags") ? mapper.convertValue(meta.get("tags"), STRING_LIST) : null,
                meta.path("installs").asLong(0),
                meta.path("rating").asDouble(0),
                Optional.ofNullable(firstText(meta, "documentation")).orElse(firstText(server, "documentation")),
                repository,
                packages,
                remotes,
                firstPackageEnv);
    }

    private static @Nullable String firstText(JsonNode node, String... fields) {
        for (var field : fields) {
            var value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private void saveCache() {
        var snapshot = new CacheSnapshot(lastSync != null ? lastSync : clock.instant(), List.copyOf(entries.values()));
        try {
            AtomicWrites.atomicOverwrite(cacheFile, Json.toPrettyJson(snapshot));
        } catch (IOException e) {
            logger.error("Failed to save MCP registry cache {}: {}", cacheFile, e.getMessage());
        }
    }

    private static Map<String, RegistryEntry> index(List<RegistryEntry> list) {
        var map = new LinkedHashMap<String, RegistryEntry>();
        for (var entry : list) {
            if (entry != null && !entry.id().isBlank()) {
                map.put(entry.id(), entry);
            }
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * Entries whose name, description or any tag contains {@code query} (case-insensitive), narrowed by
     * {@code filters}, most popular first.
     */
    public List<RegistryEntry> search(String query, RegistrySearchFilters filters) {
        var needle = query.toLowerCase(Locale.ROOT);
        return entries.values().stream()
                .filter(e -> e.name().toLowerCase(Locale.ROOT).contains(needle)
                        || e.description().toLowerCase(Locale.ROOT).contains(needle)
                        || e.tags().stream().anyMatch(t -> t.toLowerCase(Locale.ROOT).contains(needle)))
                .filter(e -> filters.category() == null || e.categories().contains(filters.category()))
                .filter(e -> filters.transport() == null || offers(e, filters.transport()))
                .filter(e -> e.tags().containsAll(filters.tags()))
                .sorted(Comparator.comparingDouble(RegistryEntry::popularityScore).reversed())
                .toList();
    }

    public List<RegistryEntry> search(String query) {
        return search(query, RegistrySearchFilters.NONE);
    }

    private static boolean offers(RegistryEntry entry, TransportType transport) {
        return entry.transports().stream().anyMatch(name -> parseTransport(name) == transport);
    }

    private static @Nullable TransportType parseTransport(String name) {
        try {
            return TransportType.fromWireName(name);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public boolean needsSync() {
        var last = lastSync;
        return last == null || Duration.between(last, clock.instant()).compareTo(CACHE_TTL) > 0;
    }

    /**
     * Builds a runnable definition for a catalog entry. A remote endpoint is preferred (streamable HTTP, then SSE,
     * then WebSocket); otherwise the entry's npm package is launched with {@code npx}. Only environment variables that
     * the entry declares and the caller supplied are copied.
     *
     * @return null when the entry is unknown or offers neither a remote nor an npm package
     */
    public @Nullable ServerDefinition generateServerConfig(String entryId, ServerConfigOptions options) {
        var entry = entries.get(entryId);
        if (entry == null) {
            return null;
        }
        var transport = determineTransport(entry);
        var builder = ServerDefinition.builder(entryId)
                .name(entry.name())
                .description(entry.description())
                .scope(options.scopeOrDefault())
                .transport(transport);

        if (transport.isNetwork()) {
            var remote = entry.remotes().stream()
                    .filter(r -> parseTransport(r.type()) == transport)
                    .findFirst();
            var url = options.customUrl() != null
                    ? options.customUrl()
                    : remote.map(RegistryEntry.Remote::url).orElse(null);
            if (url == null) {
                logger.warn("Registry entry {} declares {} but no matching remote", entryId, transport.wireName());
                return null;
            }
            builder.url(url);
        } else {
            var npm = entry.packages().stream()
                    .filter(p -> "npm".equals(p.registryType()))
                    .findFirst();
            if (npm.isEmpty()) {
                logger.warn("Registry entry {} has no remote endpoint and no npm package", entryId);
                return null;
            }
            builder.command("npx").args(List.of("-y", npm.get().identifier()));
        }

        var env = new LinkedHashMap<String, String>();
        for (var name : declaredVariables(entry)) {
            var value = options.envVars().get(name);
            if (value != null && !value.isEmpty()) {
                env.put(name, value);
            }
        }
        builder.env(env);

        builder.metadata(new ServerMetadata(
                entry.categories().isEmpty() ? null : entry.categories().get(0),
                entry.tags(),
                entry.publisher(),
                entry.version(),
                entry.documentation()));
        return builder.build();
    }

    private static TransportType determineTransport(RegistryEntry entry) {
        for (var candidate : List.of(TransportType.HTTP, TransportType.SSE, TransportType.WEBSOCKET)) {
            if (offers(entry, candidate)) {
                return candidate;
            }
        }
        return TransportType.STDIO;
    }

    private static List<String> declaredVariables(RegistryEntry entry) {
        var names = new LinkedHashSet<String>();
        entry.environmentVariables().forEach(v -> names.add(v.name()));
        for (var pkg : entry.packages()) {
            if (pkg.environmentVariables() != null) {
                pkg.environmentVariables().forEach(v -> names.add(v.name()));
            }
        }
        return List.copyOf(names);
    }

    public @Nullable RegistryEntry getEntry(String id) {
        return entries.get(id);
    }

    public List<RegistryEntry> getAllEntries() {
        return List.copyOf(entries.values());
    }

    public List<String> getAllCategories() {
        var categories = new TreeSet<String>();
        entries.values().forEach(e -> categories.addAll(e.categories()));
        return List.copyOf(categories);
    }

    public List<RegistryEntry> getPopularEntries(int limit) {
        return entries.values().stream()
                .sorted(Comparator.comparingLong(RegistryEntry::installs).reversed())
                .limit(limit)
                .toList();
    }

    public List<RegistryEntry> getTopRated(int limit) {
        return entries.values().stream()
                .filter(e -> e.rating() > 0)
                .sorted(Comparator.comparingDouble(RegistryEntry::rating).reversed())
                .limit(limit)
                .toList();
    }

    public @Nullable Instant getLastSyncTime() {
        return lastSync;
    }

    public int getCacheSize() {
        return entries.size();
    }

    Path cacheFile() {
        return cacheFile;
    }
}
