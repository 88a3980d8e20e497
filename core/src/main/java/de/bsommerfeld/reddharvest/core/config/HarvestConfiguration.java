package de.bsommerfeld.reddharvest.core.config;

import de.bsommerfeld.reddharvest.core.domain.Community;
import de.bsommerfeld.reddharvest.core.domain.IgnoreEntry;
import de.bsommerfeld.reddharvest.core.domain.LinkRule;
import de.bsommerfeld.reddharvest.core.domain.SourceAccount;
import de.bsommerfeld.reddharvest.core.domain.TrackedEntity;
import de.bsommerfeld.reddharvest.core.path.IgnoreFilter;
import de.bsommerfeld.reddharvest.core.path.PathSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable result of loading a configuration file. This is the only
 * configuration value passed around at runtime; nothing reads global state.
 */
public record HarvestConfiguration(
        HarvestSettings settings,
        List<SourceAccount> redditors,
        List<Community> subreddits,
        List<IgnoreEntry> ignored,
        List<LinkRule> links) {

    public HarvestConfiguration {
        Objects.requireNonNull(settings, "settings");
        redditors = redditors == null ? List.of() : List.copyOf(redditors);
        subreddits = subreddits == null ? List.of() : List.copyOf(subreddits);
        ignored = ignored == null ? List.of() : List.copyOf(ignored);
        links = links == null ? List.of() : List.copyOf(links);
    }

    public PathSettings pathSettings() {
        return new PathSettings(settings.favorEntity(), redditors, subreddits);
    }

    public IgnoreFilter ignoreFilter() {
        return new IgnoreFilter(ignored);
    }

    /**
     * Redditors followed by subreddits, minus every entity whose own name is
     * on the ignore list of its kind.
     */
    public List<TrackedEntity> harvestableEntities() {
        IgnoreFilter filter = ignoreFilter();
        List<TrackedEntity> entities = new ArrayList<>();
        for (SourceAccount redditor : redditors) {
            if (!filter.isIgnored(redditor)) {
                entities.add(redditor);
            }
        }
        for (Community subreddit : subreddits) {
            if (!filter.isIgnored(subreddit)) {
                entities.add(subreddit);
            }
        }
        return List.copyOf(entities);
    }
}
