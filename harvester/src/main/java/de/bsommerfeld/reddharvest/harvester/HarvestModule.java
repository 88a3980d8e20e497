package de.bsommerfeld.reddharvest.harvester;

import com.google.inject.AbstractModule;
import de.bsommerfeld.reddharvest.core.concurrent.CancellationToken;
import de.bsommerfeld.reddharvest.core.config.ApplicationMode;
import de.bsommerfeld.reddharvest.core.config.HarvestConfiguration;
import de.bsommerfeld.reddharvest.core.config.HarvestSettings;
import de.bsommerfeld.reddharvest.reddit.OfflinePostSource;
import de.bsommerfeld.reddharvest.reddit.PostSource;
import de.bsommerfeld.reddharvest.reddit.RedditClient;
import de.bsommerfeld.reddharvest.retrieval.download.Downloader;
import de.bsommerfeld.reddharvest.retrieval.resolve.PageFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice module for the harvest run. The configuration is loaded before the
 * injector is created and bound as an instance.
 */
public class HarvestModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(HarvestModule.class);

    private final HarvestConfiguration config;
    private final CancellationToken cancellationToken;

    public HarvestModule(HarvestConfiguration config, CancellationToken cancellationToken) {
        this.config = config;
        this.cancellationToken = cancellationToken;
    }

    @Override
    protected void configure() {
        bind(HarvestConfiguration.class).toInstance(config);
        bind(HarvestSettings.class).toInstance(config.settings());
        bind(CancellationToken.class).toInstance(cancellationToken);

        // Pages for regex scraping are fetched through the same client as media
        bind(PageFetcher.class).to(Downloader.class);

        // --- MODE SWITCHING (PROD vs TEST) ---
        ApplicationMode mode = ApplicationMode.get();
        LOG.info("Application Mode initialized: {}", mode);

        if (mode.isOffline()) {
            bind(PostSource.class).to(OfflinePostSource.class);
        } else {
            bind(PostSource.class).to(RedditClient.class);
        }
    }
}
