package de.bsommerfeld.reddharvest.harvester;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.reddharvest.core.concurrent.CancellationToken;
import de.bsommerfeld.reddharvest.core.config.FavorEntity;
import de.bsommerfeld.reddharvest.core.config.HarvestConfiguration;
import de.bsommerfeld.reddharvest.core.config.HarvestSettings;
import de.bsommerfeld.reddharvest.core.domain.Community;
import de.bsommerfeld.reddharvest.core.domain.IgnoreEntry;
import de.bsommerfeld.reddharvest.core.domain.LinkRule;
import de.bsommerfeld.reddharvest.core.domain.Post;
import de.bsommerfeld.reddharvest.core.domain.RetrievalOutcome;
import de.bsommerfeld.reddharvest.core.domain.SearchCriteria;
import de.bsommerfeld.reddharvest.core.domain.SortType;
import de.bsommerfeld.reddharvest.core.domain.SourceAccount;
import de.bsommerfeld.reddharvest.core.domain.TrackedEntity;
import de.bsommerfeld.reddharvest.core.event.HarvestEventBus;
import de.bsommerfeld.reddharvest.core.event.HarvestEvents;
import de.bsommerfeld.reddharvest.reddit.PostSource;
import de.bsommerfeld.reddharvest.reddit.RateLimitSnapshot;
import de.bsommerfeld.reddharvest.retrieval.ContentRetriever;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HarvesterTest {

    private static final SourceAccount ALICE =
            new SourceAccount("alice", null, null, new SearchCriteria(SortType.NEW, null, 2));
    private static final Community PICS =
            new Community("pics", null, null, new SearchCriteria(SortType.HOT, null, 3));
    private static final List<LinkRule> RULES = List.of(new LinkRule("https://i.redd.it"));

    @Mock
    private PostSource postSource;
    @Mock
    private ContentRetriever contentRetriever;
    @Mock
    private IgnorablePruner pruner;

    private final HarvestEventBus eventBus = new HarvestEventBus();
    private final CancellationToken token = new CancellationToken();
    private final List<Object> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        eventBus.register(new Object() {
            @Subscribe
            public void onEvent(Object event) {
                events.add(event);
            }
        });
    }

    private static HarvestConfiguration config(boolean prune, List<IgnoreEntry> ignored) {
        HarvestSettings settings = new HarvestSettings("redd-harvest", "tester", 5, Duration.ofSeconds(1),
                Duration.ZERO, Path.of("/tmp/harvest"), true, prune, FavorEntity.REDDITOR, false, 1);
        return new HarvestConfiguration(settings, List.of(ALICE), List.of(PICS), ignored, RULES);
    }

    private Harvester harvester(HarvestConfiguration config) {
        return new Harvester(config, postSource, contentRetriever, pruner, eventBus, token);
    }

    private static List<Post> posts(String prefix, int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new Post(prefix + i, "t", "bob", "pics", "https://i.redd.it/" + i + ".png",
                        "", Instant.EPOCH, false, null))
                .toList();
    }

    private <T> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    // -- entity loop --

    @Test
    void harvest_shouldProcessRedditorsBeforeSubreddits() {
        HarvestConfiguration config = config(false, List.of());
        when(postSource.validate(any())).thenReturn(true);
        when(postSource.rateLimits()).thenReturn(RateLimitSnapshot.UNKNOWN);
        when(postSource.posts(ALICE)).thenReturn(posts("a", 1).iterator());
        when(postSource.posts(PICS)).thenReturn(posts("p", 1).iterator());
        when(contentRetriever.resolveAndFetch(any(), any(), eq(RULES), eq(config)))
                .thenReturn(List.of(RetrievalOutcome.notSaved("x")));

        int attempted = harvester(config).harvest(HarvestRunOptions.defaults());

        assertEquals(2, attempted);
        List<TrackedEntity> started = eventsOf(HarvestEvents.EntityStartedEvent.class).stream()
                .map(HarvestEvents.EntityStartedEvent::entity).toList();
        assertEquals(List.of(ALICE, PICS), started);
        assertEquals(new HarvestEvents.HarvestFinishedEvent(2, false),
                eventsOf(HarvestEvents.HarvestFinishedEvent.class).get(0));
        verify(pruner, never()).prune(any());
        verify(contentRetriever).shutdown();
    }

    @Test
    void harvest_shouldEnforcePostLimitClientSide() {
        HarvestConfiguration config = config(false, List.of());
        when(postSource.validate(ALICE)).thenReturn(true);
        when(postSource.posts(ALICE)).thenReturn(posts("a", 10).iterator());
        when(contentRetriever.resolveAndFetch(any(), any(), any(), any()))
                .thenReturn(List.of(RetrievalOutcome.notSaved("x")));

        harvester(config).harvest(new HarvestRunOptions(Path.of("c.yml"), false, true, "", false));

        verify(contentRetriever, times(2)).resolveAndFetch(eq(ALICE), any(), any(), any());
        assertEquals(2, eventsOf(HarvestEvents.PostProcessedEvent.class).size());
    }

    @Test
    void harvest_shouldSkipEntitiesThatFailValidation() {
        HarvestConfiguration config = config(false, List.of());
        when(postSource.validate(ALICE)).thenReturn(false);
        when(postSource.validate(PICS)).thenThrow(new IllegalStateException("boom"));
        when(postSource.rateLimits()).thenReturn(RateLimitSnapshot.UNKNOWN);

        Harvester harvester = harvester(config);
        harvester.harvest(HarvestRunOptions.defaults());

        verify(postSource, never()).posts(any());
        assertFalse(harvester.isValid(ALICE));
        assertEquals(2, eventsOf(HarvestEvents.EntitySkippedEvent.class).size());
    }

    @Test
    void harvest_shouldRememberValidatedEntities() {
        HarvestConfiguration config = config(false, List.of());
        when(postSource.validate(ALICE)).thenReturn(true);
        when(postSource.posts(ALICE)).thenReturn(posts("a", 0).iterator());

        Harvester harvester = harvester(config);
        harvester.harvest(new HarvestRunOptions(Path.of("c.yml"), false, false, "alice", false));

        assertTrue(harvester.isValid(ALICE));
        assertFalse(harvester.isValid(PICS));
    }

    @Test
    void harvest_shouldNotHarvestIgnoredEntities() {
        HarvestConfiguration config = config(false, List.of(IgnoreEntry.subreddit("pics")));
        when(postSource.validate(ALICE)).thenReturn(true);
        when(postSource.posts(ALICE)).thenReturn(posts("a", 0).iterator());

        assertEquals(1, harvester(config).harvest(HarvestRunOptions.defaults()));
        verify(postSource, never()).validate(PICS);
    }

    // -- filters --

    @Test
    void harvest_shouldApplyRunFiltersWithoutBackoff() {
        HarvestConfiguration config = config(false, List.of());
        when(postSource.validate(PICS)).thenReturn(true);
        when(postSource.posts(PICS)).thenReturn(posts("p", 0).iterator());

        harvester(config).harvest(new HarvestRunOptions(Path.of("c.yml"), true, false, "", false));

        verify(postSource, never()).validate(ALICE);
        verify(postSource, never()).rateLimits();
        assertEquals("configured to skip redditors",
                eventsOf(HarvestEvents.EntitySkippedEvent.class).get(0).reason());
    }

    // -- pruning --

    @Test
    void harvest_shouldPruneBeforeHarvestingWhenEnabled() {
        HarvestConfiguration config = config(true, List.of());
        when(postSource.validate(any())).thenReturn(false);
        when(postSource.rateLimits()).thenReturn(RateLimitSnapshot.UNKNOWN);

        harvester(config).harvest(HarvestRunOptions.defaults());

        var order = inOrder(pruner, postSource);
        order.verify(pruner).prune(config);
        order.verify(postSource).validate(ALICE);
    }

    // -- cancellation --

    @Test
    void harvest_shouldStopImmediatelyWhenCancelledBeforeStart() {
        token.cancel();

        assertEquals(0, harvester(config(false, List.of())).harvest(HarvestRunOptions.defaults()));
        verifyNoInteractions(postSource);
        assertTrue(eventsOf(HarvestEvents.HarvestFinishedEvent.class).get(0).cancelled());
    }

    @Test
    void harvest_shouldStopBetweenPostsWhenCancelled() {
        HarvestConfiguration config = config(false, List.of());
        when(postSource.validate(ALICE)).thenReturn(true);
        when(postSource.posts(ALICE)).thenReturn(posts("a", 2).iterator());
        when(contentRetriever.resolveAndFetch(any(), any(), any(), any())).thenAnswer(invocation -> {
            token.cancel();
            return List.of(RetrievalOutcome.notSaved("x"), RetrievalOutcome.notSaved("y"));
        });

        int attempted = harvester(config).harvest(HarvestRunOptions.defaults());

        assertEquals(1, attempted);
        verify(contentRetriever, times(1)).resolveAndFetch(any(), any(), any(), any());
        assertEquals(1, eventsOf(HarvestEvents.RetrievalEvent.class).size());
    }
}
