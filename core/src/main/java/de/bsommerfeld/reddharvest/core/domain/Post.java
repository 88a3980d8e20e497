package de.bsommerfeld.reddharvest.core.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a Reddit submission at the time it was listed.
 * Carries the fields the retrieval pipeline needs plus the raw JSON
 * payload, from which gallery and hosted-video URLs are extracted.
 *
 * <p>
 * The raw payload is a Jackson tree and is treated as read-only by every
 * consumer. Instances are created once per listed submission and passed
 * by reference through the pipeline.
 *
 * @param id        bare submission ID (e.g. {@code abc123})
 * @param title     submission title
 * @param author    author username, {@value #UNKNOWN_AUTHOR} when it
 *                  cannot be resolved (deleted accounts)
 * @param community subreddit name without {@code r/} prefix
 * @param url       the URL the submission links to
 * @param selfText  self-text body, empty for link posts
 * @param created   creation time (UTC)
 * @param over18    whether the submission is flagged as adult content
 * @param raw       raw submission {@code data} object
 */
public record Post(
        String id,
        String title,
        String author,
        String community,
        String url,
        String selfText,
        Instant created,
        boolean over18,
        JsonNode raw) {

    /** Sentinel author for submissions whose author cannot be resolved. */
    public static final String UNKNOWN_AUTHOR = "unknown";

    public Post {
        Objects.requireNonNull(id, "id");
        author = author == null || author.isBlank() ? UNKNOWN_AUTHOR : author.strip();
        community = community == null ? "" : community.strip();
        url = url == null ? "" : url.strip();
        title = title == null ? "" : title;
        selfText = selfText == null ? "" : selfText;
        created = created == null ? Instant.EPOCH : created;
        raw = raw == null ? MissingNode.getInstance() : raw;
    }
}
