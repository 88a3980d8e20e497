package de.bsommerfeld.reddharvest.core.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Resolved global settings. Built once by {@link HarvestConfigLoader} from
 * the {@code globals} section and never mutated.
 *
 * @param app               application name used in the User-Agent
 * @param username          Reddit username used in the User-Agent
 * @param postLimit         default post limit for entities without one
 * @param rateLimitMaxWait  upper bound for a rate-limit wait
 * @param backoffSleep      pause between two entities
 * @param downloadRoot      absolute download folder
 * @param separateMedia     whether files are sorted into images/videos/unknown
 * @param pruneIgnorables   whether ignored content is pruned before a run
 * @param favorEntity       favor override mode for path resolution
 * @param allowAdultContent whether adult posts are downloaded
 * @param downloadThreads   worker count for the candidate URLs of one post
 */
public record HarvestSettings(
        String app,
        String username,
        int postLimit,
        Duration rateLimitMaxWait,
        Duration backoffSleep,
        Path downloadRoot,
        boolean separateMedia,
        boolean pruneIgnorables,
        FavorEntity favorEntity,
        boolean allowAdultContent,
        int downloadThreads) {

    public HarvestSettings {
        Objects.requireNonNull(app, "app");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(rateLimitMaxWait, "rateLimitMaxWait");
        Objects.requireNonNull(backoffSleep, "backoffSleep");
        Objects.requireNonNull(downloadRoot, "downloadRoot");
        Objects.requireNonNull(favorEntity, "favorEntity");
        downloadThreads = Math.max(1, downloadThreads);
    }

    /** Settings with every documented default, rooted at the given folder. */
    public static HarvestSettings defaults(Path downloadRoot) {
        GlobalsConfig defaults = new GlobalsConfig();
        return new HarvestSettings(defaults.getApp(), defaults.getUsername(), defaults.getPostLimit(),
                Duration.ofSeconds(defaults.getRateLimitMaxWait()),
                Duration.ofMillis(Math.round(defaults.getBackoffSleep() * 1000)),
                downloadRoot, defaults.isSeparateMedia(), defaults.isPruneIgnorables(),
                FavorEntity.DEFAULT, defaults.isBonk(), defaults.getDownloadThreads());
    }
}
