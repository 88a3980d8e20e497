package de.bsommerfeld.reddharvest.core.path;

import de.bsommerfeld.reddharvest.core.config.FavorEntity;
import de.bsommerfeld.reddharvest.core.domain.EntityKind;
import de.bsommerfeld.reddharvest.core.domain.Post;
import de.bsommerfeld.reddharvest.core.domain.TrackedEntity;

/**
 * Computes the sub-folder (relative to the download root) a post's media is
 * stored in.
 *
 * <p>
 * The entity's own store type decides the layout, unless the favor override
 * applies: with {@link FavorEntity#REDDITOR}, a post found through a
 * subreddit whose author is a tracked redditor is stored the way that
 * redditor would store it. {@link FavorEntity#SUBREDDIT} is symmetric.
 *
 * <p>
 * Pure function of its arguments. Segments are joined with {@code /}; the
 * empty string denotes the root itself.
 */
public final class PathResolver {

    private PathResolver() {
    }

    public static String resolve(TrackedEntity entity, Post post, PathSettings settings) {
        return folderFor(favoredEntity(entity, post, settings), post);
    }

    static TrackedEntity favoredEntity(TrackedEntity entity, Post post, PathSettings settings) {
        if (settings.favorEntity() == FavorEntity.REDDITOR && entity.kind() == EntityKind.COMMUNITY) {
            return settings.findRedditor(post.author()).<TrackedEntity>map(r -> r).orElse(entity);
        }
        if (settings.favorEntity() == FavorEntity.SUBREDDIT && entity.kind() == EntityKind.SOURCE_ACCOUNT) {
            return settings.findSubreddit(post.community()).<TrackedEntity>map(s -> s).orElse(entity);
        }
        return entity;
    }

    static String folderFor(TrackedEntity entity, Post post) {
        return switch (entity.storeType()) {
            case REALLY_FLAT -> "";
            case FLAT -> entity.alias();
            case NESTED -> entity.alias() + "/" + counterpart(entity, post);
        };
    }

    /** The other half of a nested path: the subreddit for redditors, the author for subreddits. */
    private static String counterpart(TrackedEntity entity, Post post) {
        return switch (entity.kind()) {
            case SOURCE_ACCOUNT -> post.community();
            case COMMUNITY -> post.author();
        };
    }
}
