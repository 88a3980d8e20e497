package de.bsommerfeld.reddharvest.core.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Reporting value for one candidate URL of one post. Not persisted.
 *
 * @param status    what happened
 * @param sourceUrl the candidate URL, or the post URL when no candidate
 *                  was attempted
 * @param localFile the resolved file, {@code null} unless saved
 * @param digest    SHA-256 hex digest, {@code null} unless computed
 */
public record RetrievalOutcome(RetrievalStatus status, String sourceUrl, Path localFile, String digest) {

    public RetrievalOutcome {
        Objects.requireNonNull(status, "status");
    }

    public static RetrievalOutcome notSaved(String sourceUrl) {
        return new RetrievalOutcome(RetrievalStatus.NOT_SAVED, sourceUrl, null, null);
    }

    public static RetrievalOutcome ignored(String sourceUrl) {
        return new RetrievalOutcome(RetrievalStatus.IGNORED, sourceUrl, null, null);
    }

    public static RetrievalOutcome ageRestricted(String sourceUrl) {
        return new RetrievalOutcome(RetrievalStatus.AGE_RESTRICTED, sourceUrl, null, null);
    }

    public boolean isSaved() {
        return status == RetrievalStatus.NEW_SAVED || status == RetrievalStatus.ALREADY_SAVED;
    }
}
