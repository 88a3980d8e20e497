package de.bsommerfeld.reddharvest.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Small URL helpers shared by the extraction strategies and the fetcher.
 */
public final class UrlUtils {

    private UrlUtils() {
    }

    /**
     * Undoes the HTML entity escaping Reddit applies to URLs inside its JSON
     * payloads and that pages apply inside attributes.
     */
    public static String unescapeHtml(String text) {
        if (text == null)
            return null;
        return text.replace("&amp;", "&")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&#x27;", "'");
    }

    /** Scheme, host and path must all be present and non-empty. */
    public static boolean isValidAbsoluteUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(candidate);
            return notEmpty(uri.getScheme()) && notEmpty(uri.getHost()) && notEmpty(uri.getRawPath());
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * Lower-cased extension of the URL's last path segment including the dot,
     * with the query and fragment stripped. {@code .jpeg} is normalized to
     * {@code .jpg}. Returns an empty string when there is none.
     */
    public static String fileExtension(String url) {
        if (url == null) {
            return "";
        }
        String path = url;
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        int scheme = path.indexOf("://");
        if (scheme >= 0) {
            int pathStart = path.indexOf('/', scheme + 3);
            if (pathStart < 0) {
                return "";
            }
            path = path.substring(pathStart);
        }
        int slash = path.lastIndexOf('/');
        String segment = slash >= 0 ? path.substring(slash + 1) : path;
        int dot = segment.lastIndexOf('.');
        if (dot < 0 || dot == segment.length() - 1) {
            return "";
        }
        return normalizeExtension(segment.substring(dot));
    }

    /** Lower-cases an extension and maps {@code .jpeg} to {@code .jpg}. */
    public static String normalizeExtension(String extension) {
        if (extension == null || extension.isEmpty()) {
            return "";
        }
        String ext = extension.toLowerCase(Locale.ROOT);
        if (!ext.startsWith(".")) {
            ext = "." + ext;
        }
        return ext.equals(".jpeg") ? ".jpg" : ext;
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a);
        int j = s.indexOf(b);
        if (i < 0)
            return j;
        if (j < 0)
            return i;
        return Math.min(i, j);
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }
}
