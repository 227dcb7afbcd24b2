package de.bsommerfeld.stockroom.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves OS-specific application data directories following each platform's
 * native conventions. Paths are absolute but are <strong>not</strong> created;
 * the caller is responsible for ensuring the directory exists.
 *
 * <p>
 * Resolution per platform:
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "stockroom";

    private StorageUtils() {
    }

    /**
     * Returns the platform-specific data directory for {@code appName}.
     *
     * @param appName application identifier used as the directory name
     * @return absolute path to the application's data directory
     */
    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        Path path;

        if (os.contains("mac") || os.contains("darwin")) {
            path = Paths.get(System.getProperty("user.home"), "Library", "Application Support", appName);
        } else if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData != null) {
                path = Paths.get(appData, appName);
            } else {
                path = Paths.get(System.getProperty("user.home"), "AppData", "Roaming", appName);
            }
        } else {
            String xdgData = System.getenv("XDG_DATA_HOME");
            if (xdgData != null && !xdgData.isEmpty()) {
                path = Paths.get(xdgData, appName);
            } else {
                path = Paths.get(System.getProperty("user.home"), ".local", "share", appName);
            }
        }
        return path.toAbsolutePath();
    }

    /** {@code {appDataDir}/config.toml} */
    public static Path getConfigFile(String appName) {
        return getAppDataDir(appName).resolve("config.toml");
    }

    /** {@code {appDataDir}/{appName}.db}, used when no database path is configured. */
    public static Path getDefaultDatabaseFile(String appName) {
        return getAppDataDir(appName).resolve(appName + ".db");
    }
}
