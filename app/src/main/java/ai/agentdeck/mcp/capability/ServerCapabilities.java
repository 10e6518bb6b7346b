package ai.agentdeck.mcp.capability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of what one server advertises. The category index is derived from {@code tools} whenever the
 * tools change, so both are always consistent with each other.
 */
public record ServerCapabilities(
        List<McpTool> tools,
        List<McpResource> resources,
        List<McpPrompt> prompts,
        Map<ToolCategory, List<McpTool>> toolsByCategory) {

    public static final ServerCapabilities EMPTY = new ServerCapabilities(List.of(), List.of(), List.of(), Map.of());

    public ServerCapabilities {
        tools = List.copyOf(tools);
        resources = List.copyOf(resources);
        prompts = List.copyOf(prompts);
        var copy = new EnumMap<ToolCategory, List<McpTool>>(ToolCategory.class);
        toolsByCategory.forEach((category, list) -> copy.put(category, List.copyOf(list)));
        toolsByCategory = Collections.unmodifiableMap(copy);
    }

    public ServerCapabilities withTools(List<McpTool> newTools) {
        return new ServerCapabilities(newTools, resources, prompts, categorize(newTools));
    }

    public ServerCapabilities withResources(List<McpResource> newResources) {
        return new ServerCapabilities(tools, newResources, prompts, toolsByCategory);
    }

    public ServerCapabilities withPrompts(List<McpPrompt> newPrompts) {
        return new ServerCapabilities(tools, resources, newPrompts, toolsByCategory);
    }

    public List<McpTool> toolsIn(ToolCategory category) {
        return toolsByCategory.getOrDefault(category, List.of());
    }

    private static Map<ToolCategory, List<McpTool>> categorize(List<McpTool> tools) {
        var grouped = new EnumMap<ToolCategory, List<McpTool>>(ToolCategory.class);
        for (var tool : tools) {
            grouped.computeIfAbsent(ToolCategorizer.categorize(tool), c -> new ArrayList<>()).add(tool);
        }
        return grouped;
    }
}
