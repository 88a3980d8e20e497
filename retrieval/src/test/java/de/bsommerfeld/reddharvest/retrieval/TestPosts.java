package de.bsommerfeld.reddharvest.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.reddharvest.core.domain.Post;

import java.io.UncheckedIOException;
import java.time.Instant;

/** Post fixtures for retrieval tests. */
public final class TestPosts {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TestPosts() {
    }

    public static Post link(String url) {
        return new Post("p1", "title", "bob", "pics", url, "", Instant.EPOCH, false, null);
    }

    public static Post withRaw(String url, String rawJson) {
        return new Post("p1", "title", "bob", "pics", url, "", Instant.EPOCH, false, json(rawJson));
    }

    public static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Smallest byte sequence Tika recognizes as PNG. */
    public static byte[] png(int variant) {
        return new byte[] { (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n',
                0, 0, 0, 13, 'I', 'H', 'D', 'R', 0, 0, 0, 1, 0, 0, 0, 1, 8, 2, 0, 0, 0, (byte) variant };
    }

    public static byte[] gif() {
        return new byte[] { 'G', 'I', 'F', '8', '9', 'a', 1, 0, 1, 0, 0, 0, 0, ';' };
    }
}
