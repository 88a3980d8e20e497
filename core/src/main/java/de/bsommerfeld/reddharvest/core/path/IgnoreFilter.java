package de.bsommerfeld.reddharvest.core.path;

import de.bsommerfeld.reddharvest.core.domain.EntityKind;
import de.bsommerfeld.reddharvest.core.domain.IgnoreEntry;
import de.bsommerfeld.reddharvest.core.domain.Post;
import de.bsommerfeld.reddharvest.core.domain.TrackedEntity;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Exact, case-sensitive matching of posts and entities against the ignore
 * lists.
 */
public final class IgnoreFilter {

    private final Set<String> ignoredRedditors;
    private final Set<String> ignoredSubreddits;

    public IgnoreFilter(List<IgnoreEntry> entries) {
        this.ignoredRedditors = namesOf(entries, EntityKind.SOURCE_ACCOUNT);
        this.ignoredSubreddits = namesOf(entries, EntityKind.COMMUNITY);
    }

    public static IgnoreFilter none() {
        return new IgnoreFilter(List.of());
    }

    /** True when the author is an ignored redditor or the subreddit is an ignored subreddit. */
    public boolean shouldIgnore(Post post) {
        return ignoredRedditors.contains(post.author()) || ignoredSubreddits.contains(post.community());
    }

    /** True when the entity itself appears on the ignore list of its own kind. */
    public boolean isIgnored(TrackedEntity entity) {
        return switch (entity.kind()) {
            case SOURCE_ACCOUNT -> ignoredRedditors.contains(entity.name());
            case COMMUNITY -> ignoredSubreddits.contains(entity.name());
        };
    }

    public Set<String> ignoredRedditors() {
        return ignoredRedditors;
    }

    public Set<String> ignoredSubreddits() {
        return ignoredSubreddits;
    }

    private static Set<String> namesOf(List<IgnoreEntry> entries, EntityKind kind) {
        return entries.stream()
                .filter(e -> e.kind() == kind)
                .map(IgnoreEntry::name)
                .collect(Collectors.toUnmodifiableSet());
    }
}
