package de.bsommerfeld.reddharvest.core.domain;

import java.util.Objects;

/**
 * A redditor or subreddit excluded from harvesting. Names are compared
 * exactly (case-sensitive) against post authors and subreddit names.
 */
public record IgnoreEntry(String name, EntityKind kind) {

    public IgnoreEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        name = name.strip();
    }

    public static IgnoreEntry redditor(String name) {
        return new IgnoreEntry(name, EntityKind.SOURCE_ACCOUNT);
    }

    public static IgnoreEntry subreddit(String name) {
        return new IgnoreEntry(name, EntityKind.COMMUNITY);
    }
}
