package ai.agentdeck.mcp.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.agentdeck.mcp.rpc.JsonRpc;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

@EnabledOnOs({OS.LINUX, OS.MAC})
class StdioTransportTest {

    @Test
    void echoesNewlineDelimitedJson() throws Exception {
        var transport = new StdioTransport("echo", "cat", List.of(), Map.of(), null);
        var listener = new RecordingListener();
        try {
            transport.start(listener);
            assertTrue(transport.isOpen());

            transport.send(JsonRpc.request(1, "ping", null)).get(5, TimeUnit.SECONDS);

            var echoed = listener.next();
            assertEquals("ping", echoed.get("method").asText());
            assertEquals(1, echoed.get("id").asInt());
        } finally {
            transport.close();
        }
        assertFalse(transport.isOpen());
    }

    @Test
    void skipsNonJsonLinesAndReportsExitCode() throws Exception {
        var script = "printf 'starting up\\n{\"jsonrpc\":\"2.0\",\"method\":\"hello\"}\\n'; exit 3";
        var transport = new StdioTransport("script", "sh", List.of("-c", script), Map.of(), null);
        var listener = new RecordingListener();

        transport.start(listener);

        assertEquals("hello", listener.next().get("method").asText());
        assertEquals(3, listener.closed.get(5, TimeUnit.SECONDS));
        assertTrue(listener.messages.isEmpty());
        transport.close();
    }

    @Test
    void expandsEnvironmentReferences() throws Exception {
        var script = "printf '{\"jsonrpc\":\"2.0\",\"method\":\"%s\"}\\n' \"$GREETING\"";
        var transport = new StdioTransport(
                "env", "sh", List.of("-c", script), Map.of("GREETING", "hi-${HOME_MISSING_FOR_TEST}"), null);
        var listener = new RecordingListener();

        transport.start(listener);

        assertEquals("hi-${HOME_MISSING_FOR_TEST}", listener.next().get("method").asText());
        listener.closed.get(5, TimeUnit.SECONDS);
        transport.close();
    }

    @Test
    void closeDoesNotReportExit() throws Exception {
        var transport = new StdioTransport("sleepy", "sleep", List.of("30"), Map.of(), null);
        var listener = new RecordingListener();
        transport.start(listener);

        transport.close();

        Thread.sleep(200);
        assertFalse(listener.closed.isDone());
    }

    @Test
    void missingBinaryFailsToStart() {
        var transport = new StdioTransport("ghost", "definitely-not-a-real-binary-xyz", List.of(), Map.of(), null);

        var ex = assertThrows(TransportException.class, () -> transport.start(new RecordingListener()));
        assertTrue(ex.getMessage().contains("ghost"));
    }

    @Test
    void sendAfterExitFails() throws Exception {
        var transport = new StdioTransport("quick", "true", List.of(), Map.of(), null);
        var listener = new RecordingListener();
        transport.start(listener);
        listener.closed.get(5, TimeUnit.SECONDS);

        var ex = assertThrows(
                ExecutionException.class,
                () -> transport.send(JsonRpc.request(1, "ping", null)).get(5, TimeUnit.SECONDS));
        assertInstanceOf(TransportException.class, ex.getCause());
        transport.close();
    }
}
