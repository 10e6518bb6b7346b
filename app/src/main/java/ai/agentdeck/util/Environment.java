package ai.agentdeck.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/** Environment-variable helpers for child processes. */
@NullMarked
public final class Environment {
    private static final Pattern VAR_REF = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}|\\$([A-Za-z_][A-Za-z0-9_]*)");

    private Environment() {}

    /**
     * Expands {@code $VAR} and {@code ${VAR}} references in every value against the process environment. Unknown
     * references are left as written.
     */
    public static Map<String, String> expandEnvMap(@Nullable Map<String, String> env) {
        return expandEnvMap(env, System::getenv);
    }

    public static Map<String, String> expandEnvMap(
            @Nullable Map<String, String> env, Function<String, @Nullable String> lookup) {
        var result = new LinkedHashMap<String, String>();
        if (env == null) {
            return result;
        }
        env.forEach((key, value) -> result.put(key, expand(value, lookup)));
        return result;
    }

    static String expand(String value, Function<String, @Nullable String> lookup) {
        Matcher m = VAR_REF.matcher(value);
        var sb = new StringBuilder();
        while (m.find()) {
            String name = m.group(1) != null ? m.group(1) : m.group(2);
            String replacement = lookup.apply(name);
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement != null ? replacement : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
