package ai.agentdeck.util;

import java.nio.file.Path;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Resolves the platform-specific directories used for global configuration and caches.
 *
 * <ul>
 *   <li>Windows: {@code %APPDATA%/AgentDeck}, falling back to {@code ~/AppData/Roaming/AgentDeck}
 *   <li>macOS: {@code ~/Library/Application Support/AgentDeck}
 *   <li>Linux and others: {@code $XDG_CONFIG_HOME/AgentDeck}, falling back to {@code ~/.config/AgentDeck}
 * </ul>
 */
@NullMarked
public final class ConfigPaths {
    private static final String APP_DIR = "AgentDeck";

    private ConfigPaths() {}

    public static Path getGlobalConfigDir() {
        String osName = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        String userHome = System.getProperty("user.home");

        if (osName.contains("windows")) {
            String appData = System.getenv("APPDATA");
            if (appData != null && !appData.isBlank()) {
                return Path.of(appData, APP_DIR);
            }
            return Path.of(userHome, "AppData", "Roaming", APP_DIR);
        }
        if (osName.contains("mac")) {
            return Path.of(userHome, "Library", "Application Support", APP_DIR);
        }
        return xdgDir("XDG_CONFIG_HOME", userHome, ".config");
    }

    /** Cache directory for data that may be deleted at any time, such as the registry snapshot. */
    public static Path getCacheDir() {
        String osName = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        String userHome = System.getProperty("user.home");

        if (osName.contains("windows")) {
            String localAppData = System.getenv("LOCALAPPDATA");
            if (localAppData != null && !localAppData.isBlank()) {
                return Path.of(localAppData, APP_DIR, "cache");
            }
            return Path.of(userHome, "AppData", "Local", APP_DIR, "cache");
        }
        if (osName.contains("mac")) {
            return Path.of(userHome, "Library", "Caches", APP_DIR);
        }
        return xdgDir("XDG_CACHE_HOME", userHome, ".cache");
    }

    private static Path xdgDir(String variable, String userHome, String fallback) {
        @Nullable String xdg = System.getenv(variable);
        if (xdg != null && !xdg.isBlank()) {
            return Path.of(xdg, APP_DIR);
        }
        return Path.of(userHome, fallback, APP_DIR);
    }
}
