package de.bsommerfeld.reddharvest.core.path;

import de.bsommerfeld.reddharvest.core.config.FavorEntity;
import de.bsommerfeld.reddharvest.core.domain.Community;
import de.bsommerfeld.reddharvest.core.domain.SourceAccount;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything {@link PathResolver} needs besides the entity and the post.
 * Built once per run from the loaded configuration.
 *
 * @param favorEntity which kind wins when a post is reachable through both
 * @param redditors   tracked redditors, in configured order
 * @param subreddits  tracked subreddits, in configured order
 */
public record PathSettings(FavorEntity favorEntity, List<SourceAccount> redditors, List<Community> subreddits) {

    public PathSettings {
        Objects.requireNonNull(favorEntity, "favorEntity");
        redditors = redditors == null ? List.of() : List.copyOf(redditors);
        subreddits = subreddits == null ? List.of() : List.copyOf(subreddits);
    }

    /** First tracked redditor whose name equals {@code name} exactly. */
    public Optional<SourceAccount> findRedditor(String name) {
        return redditors.stream().filter(r -> r.name().equals(name)).findFirst();
    }

    /** First tracked subreddit whose name equals {@code name} exactly. */
    public Optional<Community> findSubreddit(String name) {
        return subreddits.stream().filter(s -> s.name().equals(name)).findFirst();
    }
}
