package ai.agentdeck.mcp.capability;

import java.util.List;

/** Matches of one search across all running servers, in server-then-capability order. */
public record SearchResult(String query, List<McpTool> tools, List<McpResource> resources, List<McpPrompt> prompts) {

    public SearchResult {
        tools = List.copyOf(tools);
        resources = List.copyOf(resources);
        prompts = List.copyOf(prompts);
    }

    public boolean isEmpty() {
        return tools.isEmpty() && resources.isEmpty() && prompts.isEmpty();
    }
}
