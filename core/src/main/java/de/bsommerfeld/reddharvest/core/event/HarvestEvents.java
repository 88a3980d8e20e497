package de.bsommerfeld.reddharvest.core.event;

import de.bsommerfeld.reddharvest.core.domain.Post;
import de.bsommerfeld.reddharvest.core.domain.RetrievalOutcome;
import de.bsommerfeld.reddharvest.core.domain.TrackedEntity;

/**
 * Events published on the {@link HarvestEventBus} during a run.
 */
public class HarvestEvents {

    /** An entity passed validation and its posts are about to be listed. */
    public record EntityStartedEvent(TrackedEntity entity) {
    }

    /** An entity was not harvested, e.g. because it could not be validated. */
    public record EntitySkippedEvent(TrackedEntity entity, String reason) {
    }

    /** All candidate URLs of a post were handled. */
    public record PostProcessedEvent(TrackedEntity entity, Post post, int index) {
    }

    /** One candidate URL of a post was handled. */
    public record RetrievalEvent(TrackedEntity entity, Post post, RetrievalOutcome outcome) {
    }

    public record HarvestFinishedEvent(int entitiesHarvested, boolean cancelled) {
    }
}
