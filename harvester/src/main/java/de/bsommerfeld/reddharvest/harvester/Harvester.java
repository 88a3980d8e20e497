package de.bsommerfeld.reddharvest.harvester;

import com.google.inject.Singleton;
import de.bsommerfeld.reddharvest.core.concurrent.CancellationToken;
import de.bsommerfeld.reddharvest.core.config.HarvestConfiguration;
import de.bsommerfeld.reddharvest.core.domain.Post;
import de.bsommerfeld.reddharvest.core.domain.RetrievalOutcome;
import de.bsommerfeld.reddharvest.core.domain.TrackedEntity;
import de.bsommerfeld.reddharvest.core.event.HarvestEventBus;
import de.bsommerfeld.reddharvest.core.event.HarvestEvents;
import de.bsommerfeld.reddharvest.reddit.PostSource;
import de.bsommerfeld.reddharvest.reddit.RateLimitSnapshot;
import de.bsommerfeld.reddharvest.retrieval.ContentRetriever;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives one harvest run: optional pruning, then every tracked entity in
 * configuration order (redditors first), each validated against Reddit
 * before its posts are listed and retrieved.
 *
 * <h3>Pacing</h3>
 * Before every entity except the first the harvester logs the upstream
 * rate-limit counters and sleeps for the configured backoff.
 *
 * <h3>Cancellation</h3>
 * The {@link CancellationToken} is polled between entities, between posts
 * and between outcome records. A cancelled backoff ends the run
 * immediately. Downloads already in flight are allowed to finish, and the
 * retriever's worker pool is released when the run ends.
 */
@Singleton
public class Harvester {

    private static final Logger LOG = LoggerFactory.getLogger(Harvester.class);

    private final HarvestConfiguration config;
    private final PostSource postSource;
    private final ContentRetriever contentRetriever;
    private final IgnorablePruner pruner;
    private final HarvestEventBus eventBus;
    private final CancellationToken cancellationToken;

    private final Set<TrackedEntity> validEntities = ConcurrentHashMap.newKeySet();

    @Inject
    public Harvester(HarvestConfiguration config, PostSource postSource, ContentRetriever contentRetriever,
            IgnorablePruner pruner, HarvestEventBus eventBus, CancellationToken cancellationToken) {
        this.config = config;
        this.postSource = postSource;
        this.contentRetriever = contentRetriever;
        this.pruner = pruner;
        this.eventBus = eventBus;
        this.cancellationToken = cancellationToken;
    }

    /**
     * Runs the harvest.
     *
     * @return number of entities for which a harvest was attempted
     */
    public int harvest(HarvestRunOptions options) {
        if (config.settings().pruneIgnorables()) {
            pruner.prune(config);
        }

        int attempted = 0;
        try {
            for (TrackedEntity entity : config.harvestableEntities()) {
                if (cancellationToken.isCancelled()) {
                    LOG.info("Interrupted, quitting early");
                    break;
                }
                Optional<String> skipReason = options.skipReason(entity);
                if (skipReason.isPresent()) {
                    LOG.info("Skipping '{}': {}", entity.name(), skipReason.get());
                    eventBus.post(new HarvestEvents.EntitySkippedEvent(entity, skipReason.get()));
                    continue;
                }

                if (attempted > 0 && backoff()) {
                    LOG.info("Interrupted, quitting early");
                    break;
                }
                attempted++;

                if (!validate(entity)) {
                    eventBus.post(new HarvestEvents.EntitySkippedEvent(entity, "validation failed"));
                    continue;
                }
                eventBus.post(new HarvestEvents.EntityStartedEvent(entity));
                harvestEntity(entity);
            }
        } finally {
            contentRetriever.shutdown();
        }

        eventBus.post(new HarvestEvents.HarvestFinishedEvent(attempted, cancellationToken.isCancelled()));
        return attempted;
    }

    /** Whether the entity passed validation during this run. */
    public boolean isValid(TrackedEntity entity) {
        return validEntities.contains(entity);
    }

    // =====================================================================
    // Per Entity
    // =====================================================================

    /**
     * @return {@code true} if the run was cancelled while sleeping
     */
    private boolean backoff() {
        RateLimitSnapshot limits = postSource.rateLimits();
        if (limits.isKnown()) {
            LOG.info("Current rate limits: remaining {}, used {}, reset in {}s",
                    limits.remaining(), limits.used(), limits.resetSeconds());
        }
        Duration sleep = config.settings().backoffSleep();
        LOG.info("Sleeping for {}ms before next entity", sleep.toMillis());
        return cancellationToken.sleep(sleep);
    }

    private boolean validate(TrackedEntity entity) {
        try {
            if (postSource.validate(entity)) {
                validEntities.add(entity);
                return true;
            }
            LOG.warn("Trouble fetching submissions from '{}'; continuing", entity.name());
        } catch (RuntimeException e) {
            LOG.warn("Exception while validating '{}'; continuing", entity.name(), e);
        }
        return false;
    }

    private void harvestEntity(TrackedEntity entity) {
        int limit = entity.searchCriteria().postLimit();
        int count = 0;
        Iterator<Post> posts = postSource.posts(entity);
        while (count < limit && posts.hasNext()) {
            if (cancellationToken.isCancelled()) {
                LOG.info("Interrupted, quitting early");
                break;
            }
            Post post = posts.next();
            LOG.info("Processing post {} w/ id '{}' from {} in {} w/ url {}",
                    count, post.id(), post.author(), post.community(), post.url());

            List<RetrievalOutcome> outcomes = contentRetriever.resolveAndFetch(entity, post, config.links(), config);
            for (RetrievalOutcome outcome : outcomes) {
                LOG.info("Status: {}; source url: {}", outcome.status(), outcome.sourceUrl());
                eventBus.post(new HarvestEvents.RetrievalEvent(entity, post, outcome));
                if (cancellationToken.isCancelled()) {
                    break;
                }
            }
            eventBus.post(new HarvestEvents.PostProcessedEvent(entity, post, count));
            count++;
        }
        LOG.info("Processed {} posts from '{}'", count, entity.name());
    }
}
