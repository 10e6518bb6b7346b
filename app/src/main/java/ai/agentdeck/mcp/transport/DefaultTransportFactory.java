package ai.agentdeck.mcp.transport;

import ai.agentdeck.mcp.config.ServerDefinition;
import java.nio.file.Path;
import java.time.Duration;
import okhttp3.OkHttpClient;
import org.jetbrains.annotations.Nullable;

/** Maps each {@link ai.agentdeck.mcp.config.TransportType} to its transport implementation. */
public final class DefaultTransportFactory implements McpTransportFactory {
    private final OkHttpClient httpClient;
    private final @Nullable Path workingDirectory;

    public DefaultTransportFactory() {
        this(defaultHttpClient(), null);
    }

    public DefaultTransportFactory(OkHttpClient httpClient, @Nullable Path workingDirectory) {
        this.httpClient = httpClient;
        this.workingDirectory = workingDirectory;
    }

    public static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(60))
                .writeTimeout(Duration.ofSeconds(30))
                .build();
    }

    @Override
    public McpTransport create(ServerDefinition definition) throws TransportException {
        var id = definition.id();
        return switch (definition.transport()) {
            case STDIO -> {
                var command = definition.command();
                if (command == null || command.isBlank()) {
                    throw new TransportException("Stdio server " + id + " has no command configured");
                }
                yield new StdioTransport(id, command, definition.args(), definition.env(), workingDirectory);
            }
            case HTTP -> new HttpTransport(id, requireUrl(definition), definition.headers(), httpClient);
            case SSE -> new SseTransport(id, requireUrl(definition), definition.headers(), httpClient);
            case WEBSOCKET -> new WebSocketTransport(id, requireUrl(definition), definition.headers(), httpClient);
        };
    }

    private static String requireUrl(ServerDefinition definition) throws TransportException {
        var url = definition.url();
        if (url == null || url.isBlank()) {
            throw new TransportException(
                    definition.transport().wireName() + " server " + definition.id() + " has no url configured");
        }
        return url;
    }
}
