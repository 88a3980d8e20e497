package de.bsommerfeld.reddharvest.retrieval.store;

import com.google.inject.Singleton;
import de.bsommerfeld.reddharvest.core.domain.RetrievalOutcome;
import de.bsommerfeld.reddharvest.core.domain.RetrievalStatus;
import de.bsommerfeld.reddharvest.core.hash.HashUtil;
import de.bsommerfeld.reddharvest.retrieval.download.DetectedMedia;
import de.bsommerfeld.reddharvest.retrieval.download.MediaKindDetector;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Content-addressed file store. Files are named {@code <sha256><ext>}; a
 * file whose name stem equals the digest of new bytes marks those bytes as
 * already saved, regardless of the URL they came from.
 *
 * <p>
 * The lookup and the write for one directory happen under a lock held per
 * directory, so concurrent workers never write the same digest twice.
 */
@Singleton
public class ContentStore {

    private static final Logger LOG = LoggerFactory.getLogger(ContentStore.class);

    private final MediaKindDetector detector;
    private final Map<Path, Object> directoryLocks = new ConcurrentHashMap<>();

    @Inject
    public ContentStore(MediaKindDetector detector) {
        this.detector = detector;
    }

    /**
     * Stores the bytes below {@code <root>/[<kind>/]<subFolder>}.
     *
     * @param data      downloaded bytes
     * @param sourceUrl URL the bytes came from, used for the fallback extension
     * @param subFolder relative folder from the path resolver, empty for the root
     * @throws IOException if the directory or the file cannot be written
     */
    public RetrievalOutcome store(byte[] data, String sourceUrl, String subFolder, StoreSettings settings)
            throws IOException {
        String digest = HashUtil.sha256(data);
        DetectedMedia media = detector.detect(data, sourceUrl);
        Path directory = directoryFor(settings, media, subFolder);

        Object lock = directoryLocks.computeIfAbsent(directory, key -> new Object());
        synchronized (lock) {
            Files.createDirectories(directory);

            Optional<Path> existing = findByDigest(directory, digest);
            if (existing.isPresent()) {
                LOG.debug("{} already stored as {}", sourceUrl, existing.get());
                return new RetrievalOutcome(RetrievalStatus.ALREADY_SAVED, sourceUrl, existing.get(), digest);
            }

            Path target = directory.resolve(digest + media.extension());
            Path temp = Files.createTempFile(directory, ".incoming-", ".part");
            try {
                Files.write(temp, data);
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
            LOG.debug("Stored {} as {}", sourceUrl, target);
            return new RetrievalOutcome(RetrievalStatus.NEW_SAVED, sourceUrl, target, digest);
        }
    }

    static Path directoryFor(StoreSettings settings, DetectedMedia media, String subFolder) {
        Path directory = settings.root();
        if (settings.separateMedia()) {
            directory = directory.resolve(media.kind().folderName());
        }
        if (subFolder != null && !subFolder.isEmpty()) {
            directory = directory.resolve(subFolder);
        }
        return directory.toAbsolutePath().normalize();
    }

    /** A file matches when its name is the digest or starts with the digest followed by a dot. */
    static Optional<Path> findByDigest(Path directory, String digest) throws IOException {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (name.equals(digest) || name.startsWith(digest + ".")) {
                    return Optional.of(entry);
                }
            }
        }
        return Optional.empty();
    }
}
