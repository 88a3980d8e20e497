package de.bsommerfeld.reddharvest.core.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Listing sort orders, named the way they appear in configuration files.
 * {@link #STREAM} behaves like {@link #NEW} but is never limited by the
 * listing endpoint, only by the client-side post limit.
 */
public enum SortType {

    HOT("hot"),
    NEW("new"),
    TOP("top"),
    CONTROVERSIAL("controversial"),
    STREAM("stream"),
    RANDOM("random"),
    RANDOM_RISING("random_rising"),
    RISING("rising");

    private static final Logger LOG = LoggerFactory.getLogger(SortType.class);

    /** Sort orders a redditor's submission listing supports. */
    public static final Set<SortType> ACCOUNT_SORT_TYPES = EnumSet.of(HOT, NEW, TOP, CONTROVERSIAL, STREAM);

    private final String configName;

    SortType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /** Only {@link #TOP} and {@link #CONTROVERSIAL} accept a time window. */
    public boolean supportsToggle() {
        return this == TOP || this == CONTROVERSIAL;
    }

    /**
     * Resolves a configured sort name (case-insensitive). Missing values
     * resolve to {@link #NEW}; unknown values are logged and also resolve
     * to {@link #NEW}.
     */
    public static SortType fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return NEW;
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (SortType type : values()) {
            if (type.configName.equals(normalized)) {
                return type;
            }
        }
        LOG.warn("Unsupported sort type '{}'. Defaulting to {}.", value, NEW.configName);
        return NEW;
    }
}
