package de.bsommerfeld.reddharvest.retrieval.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.reddharvest.core.domain.Post;
import de.bsommerfeld.reddharvest.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Pulls media URLs out of the raw submission payload: gallery images and
 * Reddit-hosted videos, including those of a cross-posted parent.
 *
 * <p>
 * Missing or malformed nested fields never throw. They are logged with
 * the post id and URL and the affected sub-case yields nothing.
 */
public class StructuredMediaExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(StructuredMediaExtractor.class);

    /** Gallery URLs if any, otherwise hosted-video URLs. */
    public List<String> extract(Post post) {
        List<String> urls = galleryUrls(post);
        if (!urls.isEmpty()) {
            return urls;
        }
        return videoUrls(post);
    }

    // ===== Gallery =====

    public List<String> galleryUrls(Post post) {
        JsonNode raw = post.raw();
        try {
            if (raw.path("is_gallery").asBoolean(false)) {
                return mediaMetadataUrls(raw);
            }
            if (isCrosspost(raw)) {
                List<String> urls = new ArrayList<>();
                for (JsonNode parent : raw.path("crosspost_parent_list")) {
                    if (parent.path("is_gallery").asBoolean(false)) {
                        urls.addAll(mediaMetadataUrls(parent));
                    }
                }
                return urls;
            }
        } catch (MalformedPayloadException e) {
            LOG.warn("Could not read gallery items of post {} ({}): {}", post.id(), post.url(), e.getMessage());
        }
        return List.of();
    }

    private static List<String> mediaMetadataUrls(JsonNode payload) {
        JsonNode metadata = payload.get("media_metadata");
        if (metadata == null || !metadata.isObject()) {
            throw new MalformedPayloadException("media_metadata missing");
        }
        List<String> urls = new ArrayList<>();
        Iterator<String> ids = metadata.fieldNames();
        while (ids.hasNext()) {
            String id = ids.next();
            JsonNode source = metadata.get(id).path("s").path("u");
            if (!source.isTextual()) {
                throw new MalformedPayloadException("media_metadata." + id + ".s.u missing");
            }
            urls.add(UrlUtils.unescapeHtml(source.asText().strip()));
        }
        return urls;
    }

    // ===== Hosted video =====

    public List<String> videoUrls(Post post) {
        JsonNode raw = post.raw();
        try {
            if (raw.path("is_video").asBoolean(false)) {
                return List.of(fallbackUrl(raw));
            }
            if (isCrosspost(raw)) {
                List<String> urls = new ArrayList<>();
                for (JsonNode parent : raw.path("crosspost_parent_list")) {
                    if (parent.path("is_video").asBoolean(false)) {
                        urls.add(fallbackUrl(parent));
                    }
                }
                return urls;
            }
        } catch (MalformedPayloadException e) {
            LOG.warn("Could not read hosted video of post {} ({}): {}", post.id(), post.url(), e.getMessage());
        }
        return List.of();
    }

    private static String fallbackUrl(JsonNode payload) {
        JsonNode url = payload.path("media").path("reddit_video").path("fallback_url");
        if (!url.isTextual()) {
            throw new MalformedPayloadException("media.reddit_video.fallback_url missing");
        }
        return url.asText().strip();
    }

    private static boolean isCrosspost(JsonNode raw) {
        JsonNode parent = raw.path("crosspost_parent");
        return parent.isTextual() && !parent.asText().isEmpty();
    }

    private static final class MalformedPayloadException extends RuntimeException {
        MalformedPayloadException(String message) {
            super(message);
        }
    }
}
