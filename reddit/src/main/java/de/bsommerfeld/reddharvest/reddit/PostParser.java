package de.bsommerfeld.reddharvest.reddit;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.reddharvest.core.domain.Post;
import de.bsommerfeld.reddharvest.core.util.UrlUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps Reddit listing JSON onto {@link Post} records.
 */
final class PostParser {

    private static final String DELETED_AUTHOR = "[deleted]";

    private PostParser() {
    }

    /**
     * Parses the {@code t3} children of a listing. Accepts both a plain
     * listing object and the two-element array returned by the random
     * endpoints, whose first element is the listing.
     */
    static List<Post> parseListing(JsonNode root) {
        JsonNode listing = root.isArray() ? root.path(0) : root;
        List<Post> posts = new ArrayList<>();
        for (JsonNode child : listing.path("data").path("children")) {
            if (!"t3".equals(child.path("kind").asText())) {
                continue;
            }
            JsonNode data = child.path("data");
            if (data.hasNonNull("id")) {
                posts.add(parse(data));
            }
        }
        return posts;
    }

    /** Cursor for the next page, {@code null} on the last page. */
    static String nextCursor(JsonNode root) {
        JsonNode listing = root.isArray() ? root.path(0) : root;
        JsonNode after = listing.path("data").path("after");
        return after.isTextual() && !after.asText().isEmpty() ? after.asText() : null;
    }

    static Post parse(JsonNode data) {
        String author = data.path("author").asText(null);
        if (author == null || DELETED_AUTHOR.equals(author)) {
            author = Post.UNKNOWN_AUTHOR;
        }
        return new Post(
                data.path("id").asText(),
                data.path("title").asText(""),
                author,
                data.path("subreddit").asText(""),
                UrlUtils.unescapeHtml(data.path("url").asText("")),
                data.path("selftext").asText(""),
                Instant.ofEpochSecond(data.path("created_utc").asLong(0)),
                data.path("over_18").asBoolean(false),
                data);
    }
}
