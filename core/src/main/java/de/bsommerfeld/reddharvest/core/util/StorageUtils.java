package de.bsommerfeld.reddharvest.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Default locations of the configuration file and the download folder. All
 * paths are returned as absolute {@link Path} instances but are
 * <strong>not</strong> created; the caller is responsible for that.
 */
public final class StorageUtils {

    private StorageUtils() {
    }

    /** {@code ~/.config/redd-harvest} */
    public static Path getConfigDir() {
        return userHome().resolve(".config").resolve("redd-harvest");
    }

    /** {@code ~/.config/redd-harvest/config.yml} */
    public static Path getDefaultConfigFile() {
        return getConfigDir().resolve("config.yml");
    }

    /** {@code ~/.redd-harvest/data} */
    public static Path getDefaultDownloadDir() {
        return userHome().resolve(".redd-harvest").resolve("data");
    }

    /**
     * Replaces a leading {@code ~} with the user's home directory, the way a
     * shell would. Other paths are returned unchanged.
     */
    public static Path expandHome(String path) {
        if (path == null || path.isBlank()) {
            return getDefaultDownloadDir();
        }
        String trimmed = path.strip();
        if (trimmed.equals("~")) {
            return userHome();
        }
        if (trimmed.startsWith("~/") || trimmed.startsWith("~\\")) {
            return userHome().resolve(trimmed.substring(2));
        }
        return Paths.get(trimmed);
    }

    private static Path userHome() {
        return Paths.get(System.getProperty("user.home"));
    }
}
