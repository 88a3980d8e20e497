package de.bsommerfeld.reddharvest.harvester;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.inject.Singleton;
import de.bsommerfeld.reddharvest.core.config.HarvestConfiguration;
import de.bsommerfeld.reddharvest.core.domain.Community;
import de.bsommerfeld.reddharvest.core.domain.SourceAccount;
import de.bsommerfeld.reddharvest.core.domain.TrackedEntity;
import de.bsommerfeld.reddharvest.retrieval.download.MediaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes already saved content of ignored entities from nested folders.
 *
 * <p>
 * For every tracked subreddit and ignored redditor the folder
 * {@code <alias>/<redditor>} is deleted, and for every tracked redditor and
 * ignored subreddit the folder {@code <alias>/<subreddit>}. Each folder is
 * checked directly below the download root and below every media kind
 * folder. Deletion is best effort; failures are logged and the next folder
 * is tried.
 */
@Singleton
public class IgnorablePruner {

    private static final Logger LOG = LoggerFactory.getLogger(IgnorablePruner.class);

    /**
     * @return number of folders that were deleted
     */
    public int prune(HarvestConfiguration config) {
        Path root = config.settings().downloadRoot();
        Set<String> ignoredRedditors = config.ignoreFilter().ignoredRedditors();
        Set<String> ignoredSubreddits = config.ignoreFilter().ignoredSubreddits();

        LOG.info("Pruning content of ignored entities below {}", root);
        int deleted = 0;
        for (Community subreddit : config.subreddits()) {
            for (String redditor : ignoredRedditors) {
                deleted += pruneAll(candidateFolders(root, subreddit, redditor));
            }
        }
        for (SourceAccount redditor : config.redditors()) {
            for (String subreddit : ignoredSubreddits) {
                deleted += pruneAll(candidateFolders(root, redditor, subreddit));
            }
        }
        LOG.info("Pruning finished, {} folder(s) removed", deleted);
        return deleted;
    }

    static List<Path> candidateFolders(Path root, TrackedEntity entity, String ignoredName) {
        Set<Path> folders = new LinkedHashSet<>();
        String name = ignoredName.strip();
        folders.add(root.resolve(entity.alias()).resolve(name));
        for (MediaKind kind : MediaKind.values()) {
            folders.add(root.resolve(kind.folderName()).resolve(entity.alias()).resolve(name));
        }
        return new ArrayList<>(folders);
    }

    private static int pruneAll(List<Path> folders) {
        int deleted = 0;
        for (Path folder : folders) {
            LOG.debug("Checking for folder {}", folder);
            if (!Files.isDirectory(folder)) {
                continue;
            }
            try {
                MoreFiles.deleteRecursively(folder, RecursiveDeleteOption.ALLOW_INSECURE);
                LOG.info("Removed folder {}", folder);
                deleted++;
            } catch (IOException e) {
                LOG.warn("Could not remove folder {}: {}", folder, e.getMessage());
            }
        }
        return deleted;
    }
}
