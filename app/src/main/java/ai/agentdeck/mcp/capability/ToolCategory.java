package ai.agentdeck.mcp.capability;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

/**
 * Fixed tool categories. Declaration order is the classification priority: a tool that matches several categories
 * belongs to the first one. {@link #OTHER} has no keywords and catches everything else.
 */
public enum ToolCategory {
    FILESYSTEM("file", "path", "directory", "folder", "fs"),
    GIT("git", "commit", "branch", "merge", "checkout", "diff"),
    SEARCH("search", "find", "grep", "lookup"),
    DATABASE("database", "sql", "query", "table", "postgres", "mysql", "sqlite", "mongo", "redis"),
    API("http", "api", "request", "fetch", "url", "endpoint", "webhook"),
    EXECUTION("exec", "run", "shell", "command", "terminal", "process", "script"),
    OTHER;

    private final List<String> keywords;

    ToolCategory(String... keywords) {
        this.keywords = List.of(keywords);
    }

    public List<String> keywords() {
        return keywords;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
