package de.bsommerfeld.reddharvest.harvester;

import de.bsommerfeld.reddharvest.core.config.FavorEntity;
import de.bsommerfeld.reddharvest.core.config.HarvestConfiguration;
import de.bsommerfeld.reddharvest.core.config.HarvestSettings;
import de.bsommerfeld.reddharvest.core.domain.Community;
import de.bsommerfeld.reddharvest.core.domain.IgnoreEntry;
import de.bsommerfeld.reddharvest.core.domain.SearchCriteria;
import de.bsommerfeld.reddharvest.core.domain.SortType;
import de.bsommerfeld.reddharvest.core.domain.SourceAccount;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IgnorablePrunerTest {

    private static final SearchCriteria CRITERIA = new SearchCriteria(SortType.NEW, null, 1);

    @TempDir
    Path root;

    private HarvestConfiguration config(List<SourceAccount> redditors, List<Community> subreddits,
            List<IgnoreEntry> ignored) {
        HarvestSettings settings = new HarvestSettings("redd-harvest", "tester", 5, Duration.ofSeconds(1),
                Duration.ZERO, root, true, true, FavorEntity.REDDITOR, false, 1);
        return new HarvestConfiguration(settings, redditors, subreddits, ignored, List.of());
    }

    private Path createFileIn(Path folder) throws IOException {
        Files.createDirectories(folder);
        return Files.writeString(folder.resolve("abc.png"), "x");
    }

    @Test
    void prune_shouldRemoveIgnoredRedditorBelowTrackedSubreddit() throws IOException {
        Community pics = new Community("pics", "pictures", null, CRITERIA);
        createFileIn(root.resolve("pictures").resolve("troll"));
        createFileIn(root.resolve("images").resolve("pictures").resolve("troll"));
        Path kept = createFileIn(root.resolve("images").resolve("pictures").resolve("bob"));

        int deleted = new IgnorablePruner().prune(
                config(List.of(), List.of(pics), List.of(IgnoreEntry.redditor("troll"))));

        assertEquals(2, deleted);
        assertFalse(Files.exists(root.resolve("pictures").resolve("troll")));
        assertFalse(Files.exists(root.resolve("images").resolve("pictures").resolve("troll")));
        assertTrue(Files.exists(kept));
    }

    @Test
    void prune_shouldRemoveIgnoredSubredditBelowTrackedRedditor() throws IOException {
        SourceAccount alice = new SourceAccount("alice", null, null, CRITERIA);
        createFileIn(root.resolve("videos").resolve("alice").resolve("spam"));

        int deleted = new IgnorablePruner().prune(
                config(List.of(alice), List.of(), List.of(IgnoreEntry.subreddit("spam"))));

        assertEquals(1, deleted);
        assertTrue(Files.isDirectory(root.resolve("videos").resolve("alice")));
    }

    @Test
    void prune_shouldIgnoreMissingFolders() {
        SourceAccount alice = new SourceAccount("alice", null, null, CRITERIA);

        assertEquals(0, new IgnorablePruner().prune(
                config(List.of(alice), List.of(), List.of(IgnoreEntry.subreddit("spam")))));
    }

    @Test
    void candidateFolders_shouldCoverPlainAndEveryMediaKind() {
        Community pics = new Community("pics", null, null, CRITERIA);

        List<Path> folders = IgnorablePruner.candidateFolders(Path.of("/data"), pics, " troll ");

        assertEquals(List.of(
                Path.of("/data/pics/troll"),
                Path.of("/data/images/pics/troll"),
                Path.of("/data/videos/pics/troll"),
                Path.of("/data/unknown/pics/troll")), folders);
    }
}
