package de.bsommerfeld.reddharvest.core.domain;

/**
 * A followed redditor or subreddit. There are exactly two variants,
 * {@link SourceAccount} and {@link Community}; call sites that need
 * variant-specific behavior switch over {@link #kind()}.
 */
public sealed interface TrackedEntity permits SourceAccount, Community {

    /** Canonical name as known to Reddit (case matters). */
    String name();

    /** Folder name used in place of {@link #name()}; defaults to the name. */
    String alias();

    StoreType storeType();

    SearchCriteria searchCriteria();

    EntityKind kind();

    /** Returns {@code value} unless it is blank, in which case {@code name} is used. */
    static String aliasOrName(String value, String name) {
        return value == null || value.isBlank() ? name : value.strip();
    }
}
