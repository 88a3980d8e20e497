package de.bsommerfeld.reddharvest.harvester;

import com.google.common.collect.EnumMultiset;
import com.google.common.collect.Multiset;
import com.google.common.eventbus.Subscribe;
import com.google.inject.Singleton;
import de.bsommerfeld.reddharvest.core.domain.RetrievalStatus;
import de.bsommerfeld.reddharvest.core.event.HarvestEvents.EntitySkippedEvent;
import de.bsommerfeld.reddharvest.core.event.HarvestEvents.EntityStartedEvent;
import de.bsommerfeld.reddharvest.core.event.HarvestEvents.HarvestFinishedEvent;
import de.bsommerfeld.reddharvest.core.event.HarvestEvents.PostProcessedEvent;
import de.bsommerfeld.reddharvest.core.event.HarvestEvents.RetrievalEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Listens on the harvest event bus and aggregates what happened during a
 * run. The summary is logged once the run finishes.
 */
@Singleton
public class HarvestReport {

    private static final Logger LOG = LoggerFactory.getLogger(HarvestReport.class);

    private final Multiset<RetrievalStatus> outcomes = EnumMultiset.create(RetrievalStatus.class);
    private int entitiesStarted;
    private int entitiesSkipped;
    private int postsProcessed;

    @Subscribe
    public void onEntityStarted(EntityStartedEvent event) {
        entitiesStarted++;
    }

    @Subscribe
    public void onEntitySkipped(EntitySkippedEvent event) {
        entitiesSkipped++;
    }

    @Subscribe
    public void onPostProcessed(PostProcessedEvent event) {
        postsProcessed++;
    }

    @Subscribe
    public void onRetrieval(RetrievalEvent event) {
        outcomes.add(event.outcome().status());
    }

    @Subscribe
    public void onFinished(HarvestFinishedEvent event) {
        LOG.info("Harvest {}: {} entities harvested, {} skipped, {} posts processed",
                event.cancelled() ? "cancelled" : "finished", entitiesStarted, entitiesSkipped, postsProcessed);
        LOG.info("Outcomes: {} new, {} already saved, {} not saved, {} ignored, {} age restricted",
                count(RetrievalStatus.NEW_SAVED), count(RetrievalStatus.ALREADY_SAVED),
                count(RetrievalStatus.NOT_SAVED), count(RetrievalStatus.IGNORED),
                count(RetrievalStatus.AGE_RESTRICTED));
    }

    public int count(RetrievalStatus status) {
        return outcomes.count(status);
    }

    public int entitiesStarted() {
        return entitiesStarted;
    }

    public int entitiesSkipped() {
        return entitiesSkipped;
    }

    public int postsProcessed() {
        return postsProcessed;
    }
}
