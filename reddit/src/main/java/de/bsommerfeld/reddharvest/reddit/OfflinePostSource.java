package de.bsommerfeld.reddharvest.reddit;

import com.google.inject.Singleton;
import de.bsommerfeld.reddharvest.core.domain.Post;
import de.bsommerfeld.reddharvest.core.domain.TrackedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;

/**
 * Offline stand-in for {@link RedditClient} when the application runs in
 * TEST mode. No HTTP requests are made: every entity validates and has no
 * submissions, so a full run exercises configuration, pruning and the
 * harvest loop without touching the network.
 */
@Singleton
public class OfflinePostSource implements PostSource {

    private static final Logger LOG = LoggerFactory.getLogger(OfflinePostSource.class);

    public OfflinePostSource() {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Reddit access is DISABLED       #");
        LOG.warn("#  Entities validate, listings are empty              #");
        LOG.warn("#######################################################");
    }

    @Override
    public boolean validate(TrackedEntity entity) {
        LOG.debug("[TEST] Validating {}", entity.name());
        return true;
    }

    @Override
    public Iterator<Post> posts(TrackedEntity entity) {
        LOG.debug("[TEST] Listing {}", entity.name());
        return Collections.emptyIterator();
    }

    @Override
    public RateLimitSnapshot rateLimits() {
        return RateLimitSnapshot.UNKNOWN;
    }
}
