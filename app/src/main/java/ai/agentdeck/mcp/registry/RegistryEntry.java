package ai.agentdeck.mcp.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * One installable server from the remote catalog. Entries are never modified after a sync; a new sync replaces all of
 * them.
 *
 * @param transports transport names as the catalog spells them ({@code stdio}, {@code streamable-http}, {@code sse})
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegistryEntry(
        String id,
        String name,
        String description,
        String publisher,
        String version,
        @JsonProperty("transport") List<String> transports,
        List<String> categories,
        List<String> tags,
        long installs,
        double rating,
        @Nullable String documentation,
        @Nullable Repository repository,
        List<InstallPackage> packages,
        List<Remote> remotes,
        List<EnvironmentVariable> environmentVariables) {

    public RegistryEntry {
        id = id != null ? id : "";
        name = name != null && !name.isBlank() ? name : id;
        description = description != null ? description : "";
        publisher = publisher != null ? publisher : "Unknown";
        version = version != null ? version : "1.0.0";
        transports = transports != null ? nonNull(transports) : List.of("stdio");
        categories = nonNull(categories);
        tags = nonNull(tags);
        packages = nonNull(packages);
        remotes = nonNull(remotes);
        environmentVariables = nonNull(environmentVariables);
    }

    private static <T> List<T> nonNull(@Nullable List<T> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }

    /** Blended popularity used to order search results. */
    @JsonIgnore
    public double popularityScore() {
        return installs * 0.7 + rating * 100 * 0.3;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Repository(@Nullable String url, @Nullable String source) {}

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record InstallPackage(
            String registryType,
            String identifier,
            @Nullable String version,
            @Nullable List<EnvironmentVariable> environmentVariables) {}

    public record Remote(String type, String url) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EnvironmentVariable(
            String name,
            @Nullable String description,
            @JsonProperty("isRequired") boolean required,
            @JsonProperty("isSecret") boolean secret) {}
}
