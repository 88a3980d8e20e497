package de.bsommerfeld.reddharvest.core.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Time window for {@link SortType#TOP} and {@link SortType#CONTROVERSIAL}
 * listings. Sent to Reddit as the {@code t} query parameter.
 */
public enum SortToggle {

    HOUR,
    DAY,
    WEEK,
    MONTH,
    YEAR,
    ALL;

    private static final Logger LOG = LoggerFactory.getLogger(SortToggle.class);

    public static final SortToggle DEFAULT = WEEK;

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a configured toggle (case-insensitive), falling back to
     * {@link #DEFAULT} when missing or unsupported.
     */
    public static SortToggle fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        try {
            return SortToggle.valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unsupported sort toggle '{}'. Defaulting to {}.", value, DEFAULT.configName());
            return DEFAULT;
        }
    }
}
