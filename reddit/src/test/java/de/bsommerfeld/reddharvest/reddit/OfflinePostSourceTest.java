package de.bsommerfeld.reddharvest.reddit;

import de.bsommerfeld.reddharvest.core.domain.Community;
import de.bsommerfeld.reddharvest.core.domain.SearchCriteria;
import de.bsommerfeld.reddharvest.core.domain.SortType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OfflinePostSourceTest {

    private final OfflinePostSource source = new OfflinePostSource();
    private final Community pics = new Community("pics", null, null, new SearchCriteria(SortType.NEW, null, 5));

    @Test
    void validate_shouldAcceptEveryEntity() {
        assertTrue(source.validate(pics));
    }

    @Test
    void posts_shouldBeEmpty() {
        assertFalse(source.posts(pics).hasNext());
    }

    @Test
    void rateLimits_shouldBeUnknown() {
        assertEquals(RateLimitSnapshot.UNKNOWN, source.rateLimits());
    }
}
