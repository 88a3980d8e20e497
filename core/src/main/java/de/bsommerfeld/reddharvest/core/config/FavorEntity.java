package de.bsommerfeld.reddharvest.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Which entity kind's folder convention wins when a post is reachable
 * through both a tracked redditor and a tracked subreddit.
 */
public enum FavorEntity {

    REDDITOR,
    SUBREDDIT,
    DISABLED;

    private static final Logger LOG = LoggerFactory.getLogger(FavorEntity.class);

    public static final FavorEntity DEFAULT = REDDITOR;

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a configured favor mode (case-insensitive). Missing or
     * unsupported values resolve to {@link #DEFAULT}.
     */
    public static FavorEntity fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        try {
            return FavorEntity.valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unsupported favor-entity '{}'. Defaulting to {}.", value, DEFAULT.configName());
            return DEFAULT;
        }
    }
}
