package de.bsommerfeld.reddharvest.reddit;

import de.bsommerfeld.reddharvest.core.domain.Post;
import de.bsommerfeld.reddharvest.core.domain.TrackedEntity;

import java.util.Iterator;

/**
 * Upstream feed of submissions for tracked entities.
 */
public interface PostSource {

    /**
     * Confirms the entity exists upstream. An entity that fails validation
     * is skipped for the run.
     */
    boolean validate(TrackedEntity entity);

    /**
     * Lazily lists the entity's submissions in the order of its sort
     * criteria, never more than its post limit. Listing failures end the
     * iteration early instead of throwing.
     */
    Iterator<Post> posts(TrackedEntity entity);

    /** Rate-limit counters of the most recent upstream response. */
    RateLimitSnapshot rateLimits();
}
