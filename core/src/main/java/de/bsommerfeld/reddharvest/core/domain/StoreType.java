package de.bsommerfeld.reddharvest.core.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Folder layout policy for a tracked entity.
 *
 * <ul>
 * <li>{@link #NESTED}: {@code <alias>/<counterpart>}, where the counterpart
 * is the subreddit for redditors and the author for subreddits</li>
 * <li>{@link #FLAT}: {@code <alias>}</li>
 * <li>{@link #REALLY_FLAT}: the download root itself</li>
 * </ul>
 */
public enum StoreType {

    NESTED("nested"),
    FLAT("flat"),
    REALLY_FLAT("really-flat");

    private static final Logger LOG = LoggerFactory.getLogger(StoreType.class);

    private final String configName;

    StoreType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * Resolves a configured store type (case-insensitive). Missing or
     * unsupported values resolve to the given fallback, which differs per
     * entity kind.
     */
    public static StoreType fromConfig(String value, StoreType fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        for (StoreType type : values()) {
            if (type.configName.equals(normalized)) {
                return type;
            }
        }
        LOG.warn("Unsupported store type '{}'. Defaulting to {}.", value, fallback.configName);
        return fallback;
    }
}
