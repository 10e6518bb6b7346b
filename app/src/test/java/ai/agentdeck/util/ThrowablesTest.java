package ai.agentdeck.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;

class ThrowablesTest {

    @Test
    void unwrapStripsFutureWrappersOnly() {
        var root = new IOException("disk");
        var wrapped = new CompletionException(new ExecutionException(root));

        assertSame(root, Throwables.unwrap(wrapped));
        var plain = new IllegalStateException("x", root);
        assertSame(plain, Throwables.unwrap(plain));
    }

    @Test
    void rootMessageFallsBackToClassName() {
        assertEquals("disk", Throwables.rootMessage(new RuntimeException("outer", new IOException("disk"))));
        assertEquals("NullPointerException", Throwables.rootMessage(new RuntimeException(new NullPointerException())));
    }
}
