package ai.agentdeck.mcp.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * A configured MCP server as stored in one of the configuration scopes.
 *
 * <p>Stdio servers use {@code command}, {@code args} and {@code env}; network servers (http, sse, websocket) use
 * {@code url} and {@code headers}. The same {@code id} may be defined in several scopes; {@link McpConfigStore} decides
 * which definition wins.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ServerDefinition(
        String id,
        String name,
        @Nullable String description,
        @Nullable McpScope scope,
        TransportType transport,
        @Nullable String command,
        List<String> args,
        Map<String, String> env,
        @Nullable String url,
        Map<String, String> headers,
        boolean disabled,
        @Nullable OAuthSettings oauth,
        @Nullable ServerMetadata metadata) {

    public ServerDefinition {
        if (name == null || name.isBlank()) {
            name = id;
        }
        transport = transport != null ? transport : TransportType.STDIO;
        args = withoutNulls(args);
        env = withoutNulls(env);
        headers = withoutNulls(headers);
    }

    // hand-edited config files may carry null entries, e.g. "env": {"TOKEN": null}
    private static List<String> withoutNulls(@Nullable List<String> values) {
        if (values == null) {
            return List.of();
        }
        var kept = new ArrayList<String>(values.size());
        for (var value : values) {
            if (value != null) {
                kept.add(value);
            }
        }
        return Collections.unmodifiableList(kept);
    }

    private static Map<String, String> withoutNulls(@Nullable Map<String, String> values) {
        if (values == null) {
            return Map.of();
        }
        var kept = new LinkedHashMap<String, String>();
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                kept.put(key, value);
            }
        });
        return Collections.unmodifiableMap(kept);
    }

    /** The scope this definition is written to when it does not declare one. */
    @JsonIgnore
    public McpScope effectiveScope() {
        return scope != null ? scope : McpScope.LOCAL;
    }

    @JsonIgnore
    public boolean enabled() {
        return !disabled;
    }

    @JsonIgnore
    public boolean requiresOAuth() {
        return oauth != null;
    }

    public ServerDefinition withId(String newId) {
        return toBuilder().id(newId).build();
    }

    public ServerDefinition withScope(McpScope newScope) {
        return toBuilder().scope(newScope).build();
    }

    public ServerDefinition withDisabled(boolean newDisabled) {
        return toBuilder().disabled(newDisabled).build();
    }

    /** Returns a copy whose environment is this one's with {@code patch} applied on top. */
    public ServerDefinition withEnvPatch(Map<String, String> patch) {
        var merged = new LinkedHashMap<>(env);
        merged.putAll(patch);
        return toBuilder().env(merged).build();
    }

    public Builder toBuilder() {
        return new Builder(id)
                .name(name)
                .description(description)
                .scope(scope)
                .transport(transport)
                .command(command)
                .args(args)
                .env(env)
                .url(url)
                .headers(headers)
                .disabled(disabled)
                .oauth(oauth)
                .metadata(metadata);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static ServerDefinition stdio(String id, String command, List<String> args, McpScope scope) {
        return builder(id).command(command).args(args).scope(scope).build();
    }

    public static ServerDefinition remote(String id, TransportType transport, String url, McpScope scope) {
        return builder(id).transport(transport).url(url).scope(scope).build();
    }

    public static final class Builder {
        private String id;
        private @Nullable String name;
        private @Nullable String description;
        private @Nullable McpScope scope;
        private TransportType transport = TransportType.STDIO;
        private @Nullable String command;
        private List<String> args = List.of();
        private Map<String, String> env = Map.of();
        private @Nullable String url;
        private Map<String, String> headers = Map.of();
        private boolean disabled;
        private @Nullable OAuthSettings oauth;
        private @Nullable ServerMetadata metadata;

        private Builder(String id) {
            this.id = id;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(@Nullable String name) {
            this.name = name;
            return this;
        }

        public Builder description(@Nullable String description) {
            this.description = description;
            return this;
        }

        public Builder scope(@Nullable McpScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder transport(TransportType transport) {
            this.transport = transport;
            return this;
        }

        public Builder command(@Nullable String command) {
            this.command = command;
            return this;
        }

        public Builder args(List<String> args) {
            this.args = args;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder url(@Nullable String url) {
            this.url = url;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder disabled(boolean disabled) {
            this.disabled = disabled;
            return this;
        }

        public Builder oauth(@Nullable OAuthSettings oauth) {
            this.oauth = oauth;
            return this;
        }

        public Builder metadata(@Nullable ServerMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public ServerDefinition build() {
            return new ServerDefinition(
                    id,
                    name != null ? name : id,
                    description,
                    scope,
                    transport,
                    command,
                    args,
                    env,
                    url,
                    headers,
                    disabled,
                    oauth,
                    metadata);
        }
    }
}
