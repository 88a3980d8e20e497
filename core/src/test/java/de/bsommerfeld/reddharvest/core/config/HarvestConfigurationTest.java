package de.bsommerfeld.reddharvest.core.config;

import de.bsommerfeld.reddharvest.core.domain.Community;
import de.bsommerfeld.reddharvest.core.domain.IgnoreEntry;
import de.bsommerfeld.reddharvest.core.domain.SearchCriteria;
import de.bsommerfeld.reddharvest.core.domain.SortType;
import de.bsommerfeld.reddharvest.core.domain.SourceAccount;
import de.bsommerfeld.reddharvest.core.domain.TrackedEntity;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HarvestConfigurationTest {

    private static final SearchCriteria CRITERIA = new SearchCriteria(SortType.NEW, null, 5);

    @Test
    void harvestableEntities_shouldListRedditorsBeforeSubredditsAndDropIgnored() {
        var alice = new SourceAccount("alice", null, null, CRITERIA);
        var spammer = new SourceAccount("spammer", null, null, CRITERIA);
        var pics = new Community("pics", null, null, CRITERIA);
        var memes = new Community("memes", null, null, CRITERIA);

        var config = new HarvestConfiguration(HarvestSettings.defaults(Path.of("/tmp/data")),
                List.of(alice, spammer), List.of(pics, memes),
                List.of(IgnoreEntry.redditor("spammer"), IgnoreEntry.subreddit("memes")), List.of());

        List<TrackedEntity> entities = config.harvestableEntities();

        assertEquals(List.of(alice, pics), entities);
    }

    @Test
    void ignoreByName_shouldOnlyApplyToMatchingKind() {
        var pics = new Community("pics", null, null, CRITERIA);

        var config = new HarvestConfiguration(HarvestSettings.defaults(Path.of("/tmp/data")),
                List.of(), List.of(pics), List.of(IgnoreEntry.redditor("pics")), List.of());

        assertEquals(List.of(pics), config.harvestableEntities());
    }

    @Test
    void pathSettings_shouldCarryFavorModeAndEntities() {
        var alice = new SourceAccount("alice", null, null, CRITERIA);
        var config = new HarvestConfiguration(HarvestSettings.defaults(Path.of("/tmp/data")),
                List.of(alice), List.of(), List.of(), List.of());

        assertEquals(FavorEntity.REDDITOR, config.pathSettings().favorEntity());
        assertTrue(config.pathSettings().findRedditor("alice").isPresent());
    }

    @Test
    void favorEntity_shouldParseCaseInsensitively() {
        assertEquals(FavorEntity.SUBREDDIT, FavorEntity.fromConfig("SubReddit"));
        assertEquals(FavorEntity.DEFAULT, FavorEntity.fromConfig(null));
        assertEquals(FavorEntity.DEFAULT, FavorEntity.fromConfig("nobody"));
    }
}
