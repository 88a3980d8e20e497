package de.bsommerfeld.reddharvest.retrieval;

import com.google.inject.Singleton;
import de.bsommerfeld.reddharvest.core.config.HarvestConfiguration;
import de.bsommerfeld.reddharvest.core.domain.LinkRule;
import de.bsommerfeld.reddharvest.core.domain.Post;
import de.bsommerfeld.reddharvest.core.domain.RetrievalOutcome;
import de.bsommerfeld.reddharvest.core.domain.TrackedEntity;
import de.bsommerfeld.reddharvest.core.path.PathResolver;
import de.bsommerfeld.reddharvest.retrieval.download.Downloader;
import de.bsommerfeld.reddharvest.retrieval.resolve.LinkRuleMatcher;
import de.bsommerfeld.reddharvest.retrieval.store.ContentStore;
import de.bsommerfeld.reddharvest.retrieval.store.StoreSettings;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Turns one post of one tracked entity into retrieval outcomes: ignore and
 * adult checks first, then link rule resolution, then fetch and store for
 * every candidate URL.
 *
 * <p>
 * A failed candidate yields {@code NOT_SAVED} for that URL only; its
 * siblings are still attempted. With more than one download thread the
 * candidates of a post are fetched in parallel, but outcomes keep candidate
 * order. The worker pool is created on first use and lives until
 * {@link #shutdown()}.
 */
@Singleton
public class ContentRetriever {

    private static final Logger LOG = LoggerFactory.getLogger(ContentRetriever.class);

    private final LinkRuleMatcher linkRuleMatcher;
    private final Downloader downloader;
    private final ContentStore contentStore;

    private ExecutorService downloadPool;

    @Inject
    public ContentRetriever(LinkRuleMatcher linkRuleMatcher, Downloader downloader, ContentStore contentStore) {
        this.linkRuleMatcher = linkRuleMatcher;
        this.downloader = downloader;
        this.contentStore = contentStore;
    }

    public List<RetrievalOutcome> resolveAndFetch(TrackedEntity entity, Post post, List<LinkRule> rules,
            HarvestConfiguration config) {
        if (config.ignoreFilter().shouldIgnore(post)) {
            LOG.info("Ignoring post {} by {} in r/{}", post.id(), post.author(), post.community());
            return List.of(RetrievalOutcome.ignored(post.url()));
        }
        if (post.over18() && !config.settings().allowAdultContent()) {
            LOG.info("Skipping adult post {} ({})", post.id(), post.url());
            return List.of(RetrievalOutcome.ageRestricted(post.url()));
        }

        String subFolder = PathResolver.resolve(entity, post, config.pathSettings());
        List<String> urls = linkRuleMatcher.resolve(post, rules);
        if (urls.isEmpty()) {
            return List.of(RetrievalOutcome.notSaved(post.url()));
        }

        StoreSettings storeSettings = StoreSettings.from(config.settings());
        int threads = config.settings().downloadThreads();
        if (Math.min(threads, urls.size()) <= 1) {
            List<RetrievalOutcome> outcomes = new ArrayList<>(urls.size());
            for (String url : urls) {
                outcomes.add(fetchAndStore(url, post, subFolder, storeSettings));
            }
            return outcomes;
        }
        return fetchInParallel(urls, post, subFolder, storeSettings, threads);
    }

    private List<RetrievalOutcome> fetchInParallel(List<String> urls, Post post, String subFolder,
            StoreSettings storeSettings, int threads) {
        ExecutorService pool = downloadPool(threads);
        List<Future<RetrievalOutcome>> futures = new ArrayList<>(urls.size());
        for (String url : urls) {
            futures.add(pool.submit(() -> fetchAndStore(url, post, subFolder, storeSettings)));
        }
        List<RetrievalOutcome> outcomes = new ArrayList<>(urls.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(await(futures.get(i), urls.get(i)));
        }
        return outcomes;
    }

    private synchronized ExecutorService downloadPool(int threads) {
        if (downloadPool == null) {
            LOG.debug("Starting download pool with {} threads", threads);
            downloadPool = Executors.newFixedThreadPool(threads);
        }
        return downloadPool;
    }

    /**
     * Lets in-flight downloads finish (bounded by their read timeouts) and
     * releases the worker pool. A later parallel fetch starts a fresh pool.
     */
    public synchronized void shutdown() {
        if (downloadPool == null) {
            return;
        }
        downloadPool.shutdown();
        try {
            if (!downloadPool.awaitTermination(30, TimeUnit.SECONDS)) {
                downloadPool.shutdownNow();
                LOG.warn("Download pool forced shutdown (timed out)");
            }
        } catch (InterruptedException e) {
            downloadPool.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            downloadPool = null;
        }
    }

    synchronized boolean hasDownloadPool() {
        return downloadPool != null;
    }

    private static RetrievalOutcome await(Future<RetrievalOutcome> future, String url) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while fetching {}", url);
            return RetrievalOutcome.notSaved(url);
        } catch (ExecutionException e) {
            LOG.warn("Unexpected failure fetching {}", url, e.getCause());
            return RetrievalOutcome.notSaved(url);
        }
    }

    RetrievalOutcome fetchAndStore(String url, Post post, String subFolder, StoreSettings storeSettings) {
        try {
            byte[] data = downloader.fetchBytes(url);
            return contentStore.store(data, url, subFolder, storeSettings);
        } catch (IOException e) {
            LOG.warn("Could not save {} of post {}: {}", url, post.id(), e.getMessage());
            return RetrievalOutcome.notSaved(url);
        } catch (RuntimeException e) {
            LOG.warn("Unexpected failure saving {} of post {}", url, post.id(), e);
            return RetrievalOutcome.notSaved(url);
        }
    }
}
