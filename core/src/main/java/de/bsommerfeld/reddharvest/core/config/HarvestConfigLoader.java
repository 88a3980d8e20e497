package de.bsommerfeld.reddharvest.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import de.bsommerfeld.reddharvest.core.domain.Community;
import de.bsommerfeld.reddharvest.core.domain.IgnoreEntry;
import de.bsommerfeld.reddharvest.core.domain.LinkRule;
import de.bsommerfeld.reddharvest.core.domain.SearchCriteria;
import de.bsommerfeld.reddharvest.core.domain.SourceAccount;
import de.bsommerfeld.reddharvest.core.domain.StoreType;
import de.bsommerfeld.reddharvest.core.domain.SubSearch;
import de.bsommerfeld.reddharvest.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the YAML configuration file and turns it into an immutable
 * {@link HarvestConfiguration}.
 *
 * <p>
 * Unsupported enum values fall back to their defaults with a warning.
 * Entries without a name are skipped. A missing file, unreadable file or
 * YAML syntax error is fatal and surfaces as {@link HarvestConfigException}.
 */
public class HarvestConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(HarvestConfigLoader.class);

    private final ObjectMapper mapper;

    public HarvestConfigLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public HarvestConfiguration load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new HarvestConfigException("Configuration file not found: " + file);
        }
        LOG.info("Loading configuration from {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new HarvestConfigException("Could not read configuration file " + file, e);
        }
    }

    public HarvestConfiguration load(InputStream in) throws IOException {
        HarvestConfigFile raw;
        try {
            raw = mapper.readValue(in, HarvestConfigFile.class);
        } catch (JsonProcessingException e) {
            throw new HarvestConfigException("Malformed configuration: " + e.getOriginalMessage(), e);
        }
        if (raw == null) {
            raw = new HarvestConfigFile();
        }
        return convert(raw);
    }

    HarvestConfiguration convert(HarvestConfigFile raw) {
        GlobalsConfig globals = raw.getGlobals() == null ? new GlobalsConfig() : raw.getGlobals();
        HarvestSettings settings = toSettings(globals);

        List<SourceAccount> redditors = new ArrayList<>();
        for (EntityConfig entry : nonNull(raw.getRedditors())) {
            if (isNamed(entry, "redditor")) {
                redditors.add(new SourceAccount(entry.getName(), entry.getAlias(),
                        StoreType.fromConfig(entry.getStoreType(), SourceAccount.DEFAULT_STORE_TYPE),
                        toCriteria(entry.getSearchCriteria(), settings.postLimit())));
            }
        }

        List<Community> subreddits = new ArrayList<>();
        for (EntityConfig entry : nonNull(raw.getSubreddits())) {
            if (isNamed(entry, "subreddit")) {
                subreddits.add(new Community(entry.getName(), entry.getAlias(),
                        StoreType.fromConfig(entry.getStoreType(), Community.DEFAULT_STORE_TYPE),
                        toCriteria(entry.getSearchCriteria(), settings.postLimit())));
            }
        }

        List<IgnoreEntry> ignored = new ArrayList<>();
        for (IgnoredConfig entry : nonNull(raw.getIgnoredRedditors())) {
            if (entry != null && entry.getName() != null && !entry.getName().isBlank()) {
                ignored.add(IgnoreEntry.redditor(entry.getName()));
            }
        }
        for (IgnoredConfig entry : nonNull(raw.getIgnoredSubreddits())) {
            if (entry != null && entry.getName() != null && !entry.getName().isBlank()) {
                ignored.add(IgnoreEntry.subreddit(entry.getName()));
            }
        }

        List<LinkRule> links = new ArrayList<>();
        for (LinkConfig entry : nonNull(raw.getLinks())) {
            if (entry == null || entry.getBaseUrl() == null || entry.getBaseUrl().isBlank()) {
                LOG.warn("Skipping link rule without base-url");
                continue;
            }
            List<SubSearch> subSearches = new ArrayList<>();
            for (SubSearchConfig sub : nonNull(entry.getSubSearches())) {
                if (sub != null) {
                    subSearches.add(new SubSearch(sub.getExtension(), sub.getPageSearchRegex()));
                }
            }
            links.add(new LinkRule(entry.getBaseUrl(), entry.getDirectDownloadExtensions(), subSearches));
        }

        LOG.info("Loaded {} redditor(s), {} subreddit(s), {} ignore entries, {} link rule(s)",
                redditors.size(), subreddits.size(), ignored.size(), links.size());
        return new HarvestConfiguration(settings, redditors, subreddits, ignored, links);
    }

    private static HarvestSettings toSettings(GlobalsConfig globals) {
        Path root = StorageUtils.expandHome(globals.getDownloadFolder()).toAbsolutePath().normalize();
        int postLimit = globals.getPostLimit();
        if (postLimit < 0) {
            LOG.warn("Negative post-limit {}. Defaulting to {}.", postLimit, new GlobalsConfig().getPostLimit());
            postLimit = new GlobalsConfig().getPostLimit();
        }
        return new HarvestSettings(
                globals.getApp(),
                globals.getUsername(),
                postLimit,
                Duration.ofSeconds(Math.max(0, globals.getRateLimitMaxWait())),
                Duration.ofMillis(Math.max(0, Math.round(globals.getBackoffSleep() * 1000))),
                root,
                globals.isSeparateMedia(),
                globals.isPruneIgnorables(),
                FavorEntity.fromConfig(globals.getFavorEntity()),
                globals.isBonk(),
                globals.getDownloadThreads());
    }

    private static SearchCriteria toCriteria(SearchCriteriaConfig raw, int defaultPostLimit) {
        if (raw == null) {
            return SearchCriteria.fromConfig(null, null, defaultPostLimit);
        }
        Integer limit = raw.getPostLimit();
        int postLimit = limit == null || limit < 0 ? defaultPostLimit : limit;
        return SearchCriteria.fromConfig(raw.getSortType(), raw.getSortToggle(), postLimit);
    }

    private static boolean isNamed(EntityConfig entry, String kind) {
        if (entry == null || entry.getName() == null || entry.getName().isBlank()) {
            LOG.warn("Skipping {} entry without a name", kind);
            return false;
        }
        return true;
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }
}
