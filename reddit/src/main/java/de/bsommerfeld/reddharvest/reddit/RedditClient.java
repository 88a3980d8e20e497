package de.bsommerfeld.reddharvest.reddit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.AbstractIterator;
import com.google.inject.Singleton;
import de.bsommerfeld.reddharvest.core.concurrent.CancellationToken;
import de.bsommerfeld.reddharvest.core.config.HarvestSettings;
import de.bsommerfeld.reddharvest.core.domain.Post;
import de.bsommerfeld.reddharvest.core.domain.SearchCriteria;
import de.bsommerfeld.reddharvest.core.domain.SortType;
import de.bsommerfeld.reddharvest.core.domain.TrackedEntity;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Properties;

/**
 * Lists submissions of redditors and subreddits via the public {@code .json}
 * endpoints; no API key required.
 *
 * <h3>Listings</h3>
 * Subreddits are listed via {@code /r/<name>/<sort>.json}, redditors via
 * {@code /user/<name>/submitted.json?sort=<sort>}. {@code top} and
 * {@code controversial} carry the time window as {@code t}. Pages are
 * requested with {@code after} until the post limit is reached or the
 * listing ends. {@code stream} lists like {@code new}; the random sorts
 * return a single post.
 *
 * <h3>Rate limiting</h3>
 * Every response's {@code x-ratelimit-*} headers are recorded. When fewer
 * than 2 requests remain, the client waits for the reset window plus one
 * second, capped by the configured maximum wait. The wait ends early when
 * the run is cancelled.
 *
 * <h3>User-Agent convention</h3>
 * {@code java:<app>:v<version> (by /u/<username>)}. The version is injected
 * from {@code reddit-version.properties} at build time via Maven resource
 * filtering.
 */
@Singleton
public class RedditClient implements PostSource {

    private static final Logger LOG = LoggerFactory.getLogger(RedditClient.class);

    static final String REDDIT_BASE = "https://www.reddit.com";
    private static final String JSON_SUFFIX = ".json";

    /** Reddit caps listing pages at 100 entries. */
    static final int MAX_PAGE_SIZE = 100;

    private static final int DESCRIPTION_PREVIEW = 300;

    private final HarvestSettings settings;
    private final CancellationToken cancellationToken;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String userAgent;

    private volatile RateLimitSnapshot lastRateLimits = RateLimitSnapshot.UNKNOWN;

    @Inject
    public RedditClient(HarvestSettings settings, CancellationToken cancellationToken) {
        this.settings = settings;
        this.cancellationToken = cancellationToken;
        this.httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.mapper = new ObjectMapper();
        this.userAgent = buildUserAgent(settings.app(), settings.username());
    }

    // =====================================================================
    // Validation
    // =====================================================================

    @Override
    public boolean validate(TrackedEntity entity) {
        String url = aboutUrl(entity);
        try {
            RedditResponse response = executeGet(url);
            if (response.statusCode() != 200) {
                LOG.warn("Could not validate {} '{}': HTTP {}", describe(entity), entity.name(),
                        response.statusCode());
                return false;
            }
            JsonNode data = mapper.readTree(response.body()).path("data");
            if (!data.isObject() || data.isEmpty()) {
                LOG.warn("Could not validate {} '{}': no data in response", describe(entity), entity.name());
                return false;
            }
            logIdentity(entity, data);
            return true;
        } catch (IOException e) {
            LOG.warn("Could not validate {} '{}': {}", describe(entity), entity.name(), e.getMessage());
            return false;
        }
    }

    private static void logIdentity(TrackedEntity entity, JsonNode data) {
        switch (entity.kind()) {
            case SOURCE_ACCOUNT -> LOG.info("Found redditor {} (id {}, mod: {}, gold: {}, verified email: {})",
                    data.path("name").asText(entity.name()), data.path("id").asText("?"),
                    data.path("is_mod").asBoolean(false), data.path("is_gold").asBoolean(false),
                    data.path("has_verified_email").asBoolean(false));
            case COMMUNITY -> {
                String description = data.path("public_description").asText("");
                if (description.length() > DESCRIPTION_PREVIEW) {
                    description = description.substring(0, DESCRIPTION_PREVIEW) + "...";
                }
                LOG.info("Found subreddit {} (id {}, over18: {}): {}",
                        data.path("display_name").asText(entity.name()), data.path("name").asText("?"),
                        data.path("over18").asBoolean(false), description);
            }
        }
    }

    // =====================================================================
    // Listings
    // =====================================================================

    @Override
    public Iterator<Post> posts(TrackedEntity entity) {
        SearchCriteria criteria = entity.searchCriteria();
        LOG.info("Listing submissions of {} '{}' by {}{}", describe(entity), entity.name(),
                criteria.sortType().configName(),
                criteria.sortToggle() == null ? "" : "/" + criteria.sortToggle().configName());
        return new ListingIterator(entity);
    }

    @Override
    public RateLimitSnapshot rateLimits() {
        return lastRateLimits;
    }

    /** Lazily pages through a listing; stops at the post limit, the last page or the first failure. */
    private final class ListingIterator extends AbstractIterator<Post> {

        private final TrackedEntity entity;
        private final int limit;
        private final Deque<Post> buffer = new ArrayDeque<>();
        private String after;
        private int returned;
        private boolean lastPage;

        ListingIterator(TrackedEntity entity) {
            this.entity = entity;
            this.limit = entity.searchCriteria().postLimit();
        }

        @Override
        protected Post computeNext() {
            if (returned >= limit) {
                return endOfData();
            }
            if (buffer.isEmpty() && !lastPage) {
                fetchPage();
            }
            if (buffer.isEmpty()) {
                return endOfData();
            }
            returned++;
            return buffer.poll();
        }

        private void fetchPage() {
            int pageSize = Math.min(MAX_PAGE_SIZE, limit - returned);
            String url = listingUrl(entity, after, pageSize);
            try {
                RedditResponse response = executeGet(url);
                if (response.statusCode() != 200) {
                    LOG.warn("Listing {} failed: HTTP {}", url, response.statusCode());
                    lastPage = true;
                    return;
                }
                JsonNode root = mapper.readTree(response.body());
                buffer.addAll(PostParser.parseListing(root));
                after = PostParser.nextCursor(root);
                lastPage = after == null || isSinglePostSort(entity.searchCriteria().sortType());
            } catch (IOException e) {
                LOG.warn("Listing {} failed: {}", url, e.getMessage());
                lastPage = true;
            }
        }
    }

    // =====================================================================
    // URLs
    // =====================================================================

    static String aboutUrl(TrackedEntity entity) {
        return REDDIT_BASE + entityPath(entity) + "/about" + JSON_SUFFIX;
    }

    static String listingUrl(TrackedEntity entity, String after, int pageSize) {
        SearchCriteria criteria = entity.searchCriteria();
        SortType sort = criteria.sortType() == SortType.STREAM ? SortType.NEW : criteria.sortType();

        StringBuilder url = new StringBuilder(REDDIT_BASE).append(entityPath(entity));
        switch (entity.kind()) {
            case SOURCE_ACCOUNT -> url.append("/submitted").append(JSON_SUFFIX)
                    .append("?sort=").append(sort.configName())
                    .append("&limit=").append(pageSize);
            case COMMUNITY -> url.append('/').append(subredditEndpoint(sort)).append(JSON_SUFFIX)
                    .append("?limit=").append(pageSize);
        }
        if (criteria.sortToggle() != null) {
            url.append("&t=").append(criteria.sortToggle().configName());
        }
        if (after != null) {
            url.append("&after=").append(URLEncoder.encode(after, StandardCharsets.UTF_8));
        }
        return url.toString();
    }

    private static String subredditEndpoint(SortType sort) {
        return switch (sort) {
            case RANDOM_RISING -> "randomrising";
            default -> sort.configName();
        };
    }

    private static boolean isSinglePostSort(SortType sort) {
        return sort == SortType.RANDOM;
    }

    private static String entityPath(TrackedEntity entity) {
        String name = URLEncoder.encode(entity.name(), StandardCharsets.UTF_8);
        return switch (entity.kind()) {
            case SOURCE_ACCOUNT -> "/user/" + name;
            case COMMUNITY -> "/r/" + name;
        };
    }

    private static String describe(TrackedEntity entity) {
        return switch (entity.kind()) {
            case SOURCE_ACCOUNT -> "redditor";
            case COMMUNITY -> "subreddit";
        };
    }

    // =====================================================================
    // HTTP
    // =====================================================================

    /**
     * Executes a GET request with the Reddit User-Agent header and
     * rate-limit handling. Every outgoing call flows through here.
     */
    RedditResponse executeGet(String url) throws IOException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("User-Agent", userAgent)
                .timeout(Duration.ofSeconds(30))
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            RedditResponse result = new RedditResponse(response.statusCode(), response.body(), response.headers());
            checkRateLimit(result.headers());
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Request interrupted: " + url, e);
        }
    }

    /**
     * Records the rate-limit headers and, if fewer than 2 requests remain,
     * blocks for the reset window plus one second (capped).
     */
    void checkRateLimit(HttpHeaders headers) {
        RateLimitSnapshot snapshot = RateLimitSnapshot.fromHeaders(headers);
        if (snapshot.isKnown()) {
            lastRateLimits = snapshot;
        }
        if (snapshot.isNearLimit() && snapshot.resetSeconds() >= 0) {
            Duration wait = rateLimitWait(snapshot, settings.rateLimitMaxWait());
            LOG.warn("Reddit rate limit near ({} left). Sleeping for {}s", snapshot.remaining(), wait.toSeconds());
            cancellationToken.sleep(wait);
        }
    }

    static Duration rateLimitWait(RateLimitSnapshot snapshot, Duration maxWait) {
        Duration wait = Duration.ofSeconds((long) snapshot.resetSeconds() + 1);
        return wait.compareTo(maxWait) > 0 ? maxWait : wait;
    }

    String userAgent() {
        return userAgent;
    }

    // =====================================================================
    // User-Agent
    // =====================================================================

    static String buildUserAgent(String app, String username) {
        return "java:" + app + ":v" + appVersion() + " (by /u/" + username + ")";
    }

    /**
     * Reads the Maven-filtered version property. Falls back to "unknown" if
     * the properties file is missing (e.g. during IDE-only runs without a
     * Maven build).
     */
    public static String appVersion() {
        try (InputStream in = RedditClient.class.getResourceAsStream("/reddit-version.properties")) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                return props.getProperty("app.version", "unknown");
            }
        } catch (IOException e) {
            LOG.debug("Could not read reddit-version.properties", e);
        }
        return "unknown";
    }

    /** Status, body and headers of one Reddit response. */
    record RedditResponse(int statusCode, String body, HttpHeaders headers) {
    }
}
