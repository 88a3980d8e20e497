package de.bsommerfeld.reddharvest.retrieval.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a post URL that already points at a media file into a directly
 * downloadable URL.
 *
 * <p>
 * For every configured extension, in order, the first of these that
 * applies contributes one URL:
 * <ol>
 * <li>the URL ends with {@code .ext}: used as-is</li>
 * <li>the URL is a thumbnail like {@code abc_d.ext?maxwidth=640}: cut at
 * the {@code _d} right before {@code .ext?} and re-suffixed with
 * {@code .ext}</li>
 * <li>the URL carries a query like {@code abc.ext?width=640}: cut at
 * {@code ?}</li>
 * </ol>
 * Matching is done on the lower-cased URL.
 */
public class DirectExtensionRewriter {

    public List<String> rewrite(String url, List<String> extensions) {
        List<String> urls = new ArrayList<>();
        if (url == null || url.isEmpty()) {
            return urls;
        }
        String lowerUrl = url.toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            String ext = extension.toLowerCase(Locale.ROOT);
            String quoted = Pattern.quote(ext);
            Matcher thumbnail = Pattern.compile("^(.+?)_d\\." + quoted + "\\?.*$").matcher(lowerUrl);

            if (Pattern.matches("^.+\\." + quoted + "$", lowerUrl)) {
                urls.add(url);
            } else if (thumbnail.matches()) {
                urls.add(url.substring(0, thumbnail.end(1)) + "." + ext);
            } else if (Pattern.matches("^.+\\." + quoted + "\\?.*$", lowerUrl)) {
                urls.add(url.substring(0, lowerUrl.indexOf('?')));
            }
        }
        return urls;
    }
}
