package de.bsommerfeld.reddharvest.core.domain;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Trusted base URL together with the ways real media URLs are derived from
 * posts linking to it. Rules are read-only configuration shared across a
 * whole run.
 *
 * @param baseUrl                URL prefix deciding whether the rule applies
 * @param directDownloadExtensions extensions downloaded directly when the
 *                               post URL ends with them
 * @param subSearches            page-scrape rules, in configured order
 */
public record LinkRule(String baseUrl, List<String> directDownloadExtensions, List<SubSearch> subSearches) {

    public LinkRule {
        Objects.requireNonNull(baseUrl, "baseUrl");
        baseUrl = baseUrl.strip();
        directDownloadExtensions = directDownloadExtensions == null
                ? List.of()
                : directDownloadExtensions.stream()
                        .filter(Objects::nonNull)
                        .map(String::strip)
                        .filter(ext -> !ext.isEmpty())
                        .collect(Collectors.toUnmodifiableList());
        subSearches = subSearches == null
                ? List.of()
                : subSearches.stream()
                        .filter(Objects::nonNull)
                        .filter(SubSearch::isUsable)
                        .collect(Collectors.toUnmodifiableList());
    }

    public LinkRule(String baseUrl) {
        this(baseUrl, List.of(), List.of());
    }

    /** Case-insensitive prefix test of the post URL against {@link #baseUrl()}. */
    public boolean appliesTo(String url) {
        if (url == null) {
            return false;
        }
        return url.toLowerCase(Locale.ROOT).startsWith(baseUrl.toLowerCase(Locale.ROOT));
    }
}
