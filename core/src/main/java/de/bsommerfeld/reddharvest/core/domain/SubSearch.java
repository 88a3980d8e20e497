package de.bsommerfeld.reddharvest.core.domain;

/**
 * One page-scrape rule of a {@link LinkRule}: a regular expression that
 * locates the real media URL inside the linked page, optionally guarded by
 * the extension the post URL must end with.
 *
 * @param extension         expected post URL extension without the dot,
 *                          {@code null} to apply to every URL
 * @param pageSearchRegex   expression matched against the page text; only
 *                          the whole match is used, so groups must be
 *                          non-capturing
 */
public record SubSearch(String extension, String pageSearchRegex) {

    public SubSearch {
        extension = extension == null || extension.isBlank() ? null : extension.strip();
    }

    public boolean hasExtension() {
        return extension != null;
    }

    /** A sub search without an expression can never contribute and is dropped by {@link LinkRule}. */
    public boolean isUsable() {
        return pageSearchRegex != null && !pageSearchRegex.isEmpty();
    }
}
