package ai.agentdeck.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvironmentTest {

    private static final Map<String, String> VARS = Map.of("HOME", "/home/dev", "GITHUB_TOKEN", "ghp_123");

    @Test
    void expandsBracedAndBareReferences() {
        var env = new LinkedHashMap<String, String>();
        env.put("TOKEN", "${GITHUB_TOKEN}");
        env.put("DATA", "$HOME/data");
        env.put("PLAIN", "value");

        var expanded = Environment.expandEnvMap(env, VARS::get);

        assertEquals(Map.of("TOKEN", "ghp_123", "DATA", "/home/dev/data", "PLAIN", "value"), expanded);
    }

    @Test
    void unknownReferencesAreLeftAsWritten() {
        assertEquals("${NOPE}-x", Environment.expand("${NOPE}-x", VARS::get));
        assertEquals("$NOPE", Environment.expand("$NOPE", VARS::get));
    }

    @Test
    void replacementWithDollarSignIsLiteral() {
        assertEquals("a$1b", Environment.expand("a${X}b", name -> "$1"));
    }

    @Test
    void nullMapExpandsToEmpty() {
        assertTrue(Environment.expandEnvMap(null, VARS::get).isEmpty());
    }
}
