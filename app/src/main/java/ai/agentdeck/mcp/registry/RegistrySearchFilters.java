package ai.agentdeck.mcp.registry;

import ai.agentdeck.mcp.config.TransportType;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Optional narrowing of a registry search. All present filters must match. */
public record RegistrySearchFilters(@Nullable String category, @Nullable TransportType transport, List<String> tags) {

    public static final RegistrySearchFilters NONE = new RegistrySearchFilters(null, null, List.of());

    public RegistrySearchFilters {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public static RegistrySearchFilters category(String category) {
        return new RegistrySearchFilters(category, null, List.of());
    }

    public static RegistrySearchFilters transport(TransportType transport) {
        return new RegistrySearchFilters(null, transport, List.of());
    }

    public static RegistrySearchFilters tags(List<String> tags) {
        return new RegistrySearchFilters(null, null, tags);
    }
}
