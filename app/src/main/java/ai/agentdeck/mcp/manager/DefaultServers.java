package ai.agentdeck.mcp.manager;

import ai.agentdeck.mcp.config.McpScope;
import ai.agentdeck.mcp.config.ServerDefinition;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Servers known out of the box. A configured server with the same id replaces the built-in one. */
public final class DefaultServers {
    private DefaultServers() {}

    public static List<ServerDefinition> all() {
        var home = System.getProperty("user.home");
        return List.of(
                npx("filesystem", "File System", "@modelcontextprotocol/server-filesystem", List.of(home))
                        .build(),
                npx("git", "Git", "@modelcontextprotocol/server-git", List.of()).build(),
                npx("github", "GitHub", "@modelcontextprotocol/server-github", List.of())
                        .env(Map.of("GITHUB_PERSONAL_ACCESS_TOKEN", "${GITHUB_TOKEN}"))
                        .build(),
                npx("postgres", "PostgreSQL", "@modelcontextprotocol/server-postgres",
                                List.of("postgresql://localhost/mydb"))
                        .disabled(true)
                        .build(),
                npx("brave-search", "Brave Search", "@modelcontextprotocol/server-brave-search", List.of())
                        .env(Map.of("BRAVE_API_KEY", "${BRAVE_API_KEY}"))
                        .disabled(true)
                        .build());
    }

    private static ServerDefinition.Builder npx(String id, String name, String pkg, List<String> extraArgs) {
        var args = new ArrayList<String>();
        args.add("-y");
        args.add(pkg);
        args.addAll(extraArgs);
        return ServerDefinition.builder(id).name(name).command("npx").args(args).scope(McpScope.USER);
    }
}
