package ai.agentdeck.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.jspecify.annotations.NullMarked;

@NullMarked
public final class Throwables {
    private Throwables() {}

    public static Throwable rootCause(Throwable t) {
        Throwable rootCause = t;
        while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
            rootCause = rootCause.getCause();
        }
        return rootCause;
    }

    /** Message of the root cause, or its simple class name when the message is null. */
    public static String rootMessage(Throwable t) {
        Throwable rootCause = rootCause(t);
        return rootCause.getMessage() != null
                ? rootCause.getMessage()
                : rootCause.getClass().getSimpleName();
    }

    /** Strips the {@link CompletionException} / {@link ExecutionException} wrappers added by futures. */
    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
