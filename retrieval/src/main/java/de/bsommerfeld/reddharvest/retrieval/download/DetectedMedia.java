package de.bsommerfeld.reddharvest.retrieval.download;

import java.util.Objects;

/**
 * @param kind      sniffed payload category
 * @param extension file extension including the dot, empty when unknown
 */
public record DetectedMedia(MediaKind kind, String extension) {

    public DetectedMedia {
        Objects.requireNonNull(kind, "kind");
        extension = extension == null ? "" : extension;
    }
}
