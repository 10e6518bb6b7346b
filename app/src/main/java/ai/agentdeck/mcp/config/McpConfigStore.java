package ai.agentdeck.mcp.config;

import ai.agentdeck.mcp.ServerNotFoundException;
import ai.agentdeck.util.AtomicWrites;
import ai.agentdeck.util.ConfigPaths;
import ai.agentdeck.util.Json;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Loads, merges and persists the three MCP configuration scopes.
 *
 * <ul>
 *   <li>{@link McpScope#USER}: {@code <configDir>/mcp.json}, shared by every project
 *   <li>{@link McpScope#PROJECT}: {@code <projectRoot>/mcp.json}, meant to be committed
 *   <li>{@link McpScope#LOCAL}: {@code <configDir>/mcp-local.json}, machine-local and never committed
 * </ul>
 *
 * Reads merge with precedence user &lt; project &lt; local. Every mutation rewrites the owning scope's file. A missing
 * or unparsable file is treated as an empty configuration.
 */
public class McpConfigStore {
    private static final Logger logger = LogManager.getLogger(McpConfigStore.class);

    public static final String CONFIG_FILE_NAME = "mcp.json";
    public static final String LOCAL_CONFIG_FILE_NAME = "mcp-local.json";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private final Path userConfigPath;
    private final Path localConfigPath;
    private @Nullable Path projectConfigPath;
    private final Map<McpScope, McpConfiguration> configs = new EnumMap<>(McpScope.class);

    public McpConfigStore() {
        this(ConfigPaths.getGlobalConfigDir());
    }

    public McpConfigStore(Path configDir) {
        this.userConfigPath = configDir.resolve(CONFIG_FILE_NAME);
        this.localConfigPath = configDir.resolve(LOCAL_CONFIG_FILE_NAME);
        for (var scope : McpScope.values()) {
            configs.put(scope, McpConfiguration.empty());
        }
    }

    public record ConfigFilePaths(Path user, @Nullable Path project, Path local) {}

    /** (Re)reads all scope files. Passing a project root enables the project scope. */
    public synchronized void load(@Nullable Path projectRoot) {
        projectConfigPath = projectRoot != null ? projectRoot.resolve(CONFIG_FILE_NAME) : null;
        configs.put(McpScope.USER, readConfigFile(userConfigPath));
        configs.put(
                McpScope.PROJECT,
                projectConfigPath != null ? readConfigFile(projectConfigPath) : McpConfiguration.empty());
        configs.put(McpScope.LOCAL, readConfigFile(localConfigPath));
        logger.info(
                "Loaded MCP configuration: {} user, {} project, {} local server(s)",
                configs.get(McpScope.USER).mcpServers().size(),
                configs.get(McpScope.PROJECT).mcpServers().size(),
                configs.get(McpScope.LOCAL).mcpServers().size());
    }

    /** Writes {@code server} into the file of its scope ({@code local} when it declares none). */
    public synchronized void addServer(ServerDefinition server) throws IOException {
        var scope = server.effectiveScope();
        var normalized = server.scope() == scope ? server : server.withScope(scope);
        var current = configs.get(scope);
        var servers = new LinkedHashMap<>(current.mcpServers());
        servers.put(normalized.id(), normalized);
        save(scope, new McpConfiguration(servers, current.settings()));
        logger.info("Added MCP server {} to {} config", server.id(), scope.wireName());
    }

    /**
     * Removes {@code serverId} from {@code scope}, or, when no scope is given, from the first of local, project and user
     * that defines it.
     */
    public synchronized void removeServer(String serverId, @Nullable McpScope scope)
            throws IOException, ServerNotFoundException {
        var candidates = scope != null ? List.of(scope) : McpScope.LOOKUP_ORDER;
        for (var s : candidates) {
            if (s == McpScope.PROJECT && projectConfigPath == null) {
                continue;
            }
            var current = configs.get(s);
            if (current.mcpServers().containsKey(serverId)) {
                var servers = new LinkedHashMap<>(current.mcpServers());
                servers.remove(serverId);
                save(s, new McpConfiguration(servers, current.settings()));
                logger.info("Removed MCP server {} from {} config", serverId, s.wireName());
                return;
            }
        }
        throw new ServerNotFoundException(serverId, "Server " + serverId + " not found in any config");
    }

    public void removeServer(String serverId) throws IOException, ServerNotFoundException {
        removeServer(serverId, null);
    }

    /** Highest-precedence definition for {@code serverId}, or null. */
    public synchronized @Nullable ServerDefinition getServer(String serverId) {
        var owner = owningScope(serverId);
        return owner != null ? configs.get(owner).server(serverId) : null;
    }

    /** The scope whose definition of {@code serverId} wins, or null when no scope defines it. */
    public synchronized @Nullable McpScope owningScope(String serverId) {
        for (var scope : McpScope.LOOKUP_ORDER) {
            if (configs.get(scope).mcpServers().containsKey(serverId)) {
                return scope;
            }
        }
        return null;
    }

    public synchronized Map<String, ServerDefinition> getAllServers() {
        var merged = new LinkedHashMap<String, ServerDefinition>();
        for (var scope : McpScope.MERGE_ORDER) {
            merged.putAll(configs.get(scope).mcpServers());
        }
        return merged;
    }

    public synchronized List<ServerDefinition> getEnabledServers() {
        return getAllServers().values().stream()
                .filter(ServerDefinition::enabled)
                .toList();
    }

    public synchronized void setEnabled(String serverId, boolean enabled) throws IOException, ServerNotFoundException {
        var owner = requireOwner(serverId);
        var server = Objects.requireNonNull(configs.get(owner).server(serverId));
        addServer(server.withDisabled(!enabled).withScope(owner));
    }

    /** Merges {@code patch} over the existing environment of {@code serverId}. */
    public synchronized void updateEnv(String serverId, Map<String, String> patch)
            throws IOException, ServerNotFoundException {
        var owner = requireOwner(serverId);
        var server = Objects.requireNonNull(configs.get(owner).server(serverId));
        addServer(server.withEnvPatch(patch).withScope(owner));
    }

    public synchronized McpConfiguration getConfig(McpScope scope) {
        return configs.get(scope);
    }

    /** Settings of all scopes, shallow-merged with the usual precedence. */
    public synchronized Map<String, Object> getSettings() {
        var merged = new LinkedHashMap<String, Object>();
        for (var scope : McpScope.MERGE_ORDER) {
            merged.putAll(configs.get(scope).settings());
        }
        return merged;
    }

    public McpSettings getEffectiveSettings() {
        return McpSettings.from(getSettings());
    }

    public synchronized void setSetting(String key, Object value, McpScope scope) throws IOException {
        var current = configs.get(scope);
        var settings = new LinkedHashMap<>(current.settings());
        settings.put(key, value);
        save(scope, new McpConfiguration(current.mcpServers(), settings));
    }

    public synchronized ConfigFilePaths getConfigPaths() {
        return new ConfigFilePaths(userConfigPath, projectConfigPath, localConfigPath);
    }

    /**
     * Imports the {@code mcpServers} block of a Claude Desktop settings file into the user scope.
     *
     * @return the number of imported servers; 0 when the file is missing, unreadable or has no servers
     */
    public int importFromClaudeDesktop(Path settingsFile) {
        JsonNode root;
        try {
            root = Json.mapper().readTree(Files.readString(settingsFile));
        } catch (IOException e) {
            logger.warn("Failed to import from Claude Desktop config {}: {}", settingsFile, e.getMessage());
            return 0;
        }
        var servers = root == null ? null : root.get("mcpServers");
        if (servers == null || !servers.isObject()) {
            return 0;
        }

        var imported = new ArrayList<String>();
        var fields = servers.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var node = field.getValue();
            try {
                var type = TransportType.fromWireName(node.path("type").asText(null));
                var builder = ServerDefinition.builder(field.getKey())
                        .scope(McpScope.USER)
                        .transport(type != null ? type : TransportType.STDIO)
                        .command(node.path("command").asText(null))
                        .url(node.path("url").asText(null));
                if (node.has("args")) {
                    builder.args(Json.mapper().convertValue(node.get("args"), STRING_LIST));
                }
                if (node.has("env")) {
                    builder.env(Json.mapper().convertValue(node.get("env"), STRING_MAP));
                }
                addServer(builder.build());
                imported.add(field.getKey());
            } catch (IOException | IllegalArgumentException e) {
                logger.warn("Skipping Claude Desktop server {}: {}", field.getKey(), e.getMessage());
            }
        }
        logger.info("Imported {} MCP server(s) from Claude Desktop: {}", imported.size(), imported);
        return imported.size();
    }

    /** Default location of the Claude Desktop settings file on this machine. */
    public static Path defaultClaudeDesktopSettings() {
        return Path.of(System.getProperty("user.home"), "Library", "Application Support", "Claude", "settings.json");
    }

    private McpScope requireOwner(String serverId) throws ServerNotFoundException {
        var owner = owningScope(serverId);
        if (owner == null) {
            throw new ServerNotFoundException(serverId);
        }
        return owner;
    }

    private Path pathFor(McpScope scope) {
        return switch (scope) {
            case USER -> userConfigPath;
            case LOCAL -> localConfigPath;
            case PROJECT -> {
                if (projectConfigPath == null) {
                    throw new IllegalStateException("Project config path not set");
                }
                yield projectConfigPath;
            }
        };
    }

    private void save(McpScope scope, McpConfiguration config) throws IOException {
        var path = pathFor(scope);
        try {
            AtomicWrites.atomicOverwrite(path, Json.toPrettyJson(config));
        } catch (IOException e) {
            logger.error("Failed to save MCP config to {}: {}", path, e.getMessage());
            throw e;
        }
        configs.put(scope, config);
    }

    private static McpConfiguration readConfigFile(Path path) {
        if (!Files.exists(path)) {
            return McpConfiguration.empty();
        }
        try {
            var parsed = Json.mapper().readValue(Files.readString(path), McpConfiguration.class);
            if (parsed == null) {
                return McpConfiguration.empty();
            }
            // the map key is authoritative for the id
            var servers = new LinkedHashMap<String, ServerDefinition>();
            parsed.mcpServers().forEach((id, def) -> {
                if (def != null) {
                    servers.put(id, Objects.equals(def.id(), id) ? def : def.withId(id));
                }
            });
            return new McpConfiguration(servers, parsed.settings());
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Ignoring unreadable MCP config {}: {}", path, e.getMessage());
            return McpConfiguration.empty();
        }
    }
}
