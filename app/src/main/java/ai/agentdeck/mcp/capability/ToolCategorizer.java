package ai.agentdeck.mcp.capability;

import ai.agentdeck.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Keyword classification of tools into {@link ToolCategory}. Text is split into lowercase word tokens (camelCase and
 * snake_case are both split) and a keyword matches a token it prefixes, so {@code file} matches {@code filename} but
 * {@code dir} never matches {@code description}.
 */
public final class ToolCategorizer {
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");
    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9]+");

    private ToolCategorizer() {}

    /** Pure function of the tool name and its serialized input schema. Never returns null. */
    public static ToolCategory categorize(String name, @Nullable JsonNode inputSchema) {
        var tokens = new ArrayList<>(tokenize(name));
        if (inputSchema != null && !inputSchema.isNull()) {
            tokens.addAll(tokenize(Json.toJson(inputSchema)));
        }
        for (var category : ToolCategory.values()) {
            if (matches(category, tokens)) {
                return category;
            }
        }
        return ToolCategory.OTHER;
    }

    public static ToolCategory categorize(McpTool tool) {
        return categorize(tool.name(), tool.inputSchema());
    }

    /** All categories a free-text context mentions, in priority order; empty when none does. */
    public static Set<ToolCategory> inferCategories(String context) {
        var tokens = tokenize(context);
        var result = EnumSet.noneOf(ToolCategory.class);
        for (var category : ToolCategory.values()) {
            if (matches(category, tokens)) {
                result.add(category);
            }
        }
        return result;
    }

    static List<String> tokenize(String text) {
        var split = CAMEL_BOUNDARY.matcher(text).replaceAll(" ").toLowerCase(Locale.ROOT);
        return Arrays.stream(NON_WORD.split(split)).filter(t -> !t.isEmpty()).toList();
    }

    private static boolean matches(ToolCategory category, List<String> tokens) {
        for (var keyword : category.keywords()) {
            for (var token : tokens) {
                if (token.startsWith(keyword)) {
                    return true;
                }
            }
        }
        return false;
    }
}
