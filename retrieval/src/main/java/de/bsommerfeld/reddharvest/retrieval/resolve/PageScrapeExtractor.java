package de.bsommerfeld.reddharvest.retrieval.resolve;

import de.bsommerfeld.reddharvest.core.domain.LinkRule;
import de.bsommerfeld.reddharvest.core.domain.Post;
import de.bsommerfeld.reddharvest.core.domain.SubSearch;
import de.bsommerfeld.reddharvest.core.util.UrlUtils;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Fetches the page a post links to and runs the rule's sub searches over
 * its text. Each sub search contributes its first match that is a valid
 * absolute URL; duplicates across sub searches are dropped.
 */
public class PageScrapeExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(PageScrapeExtractor.class);

    private final PageFetcher pageFetcher;

    @Inject
    public PageScrapeExtractor(PageFetcher pageFetcher) {
        this.pageFetcher = pageFetcher;
    }

    public List<String> extract(Post post, LinkRule rule) {
        List<String> urls = new ArrayList<>();
        if (rule.subSearches().isEmpty()) {
            return urls;
        }

        String page;
        try {
            page = pageFetcher.fetchPage(post.url());
        } catch (IOException e) {
            LOG.warn("Could not fetch page {} of post {}: {}", post.url(), post.id(), e.getMessage());
            return urls;
        }

        String lowerUrl = post.url().toLowerCase(Locale.ROOT);
        for (SubSearch subSearch : rule.subSearches()) {
            if (subSearch.hasExtension()
                    && !lowerUrl.endsWith("." + subSearch.extension().toLowerCase(Locale.ROOT))) {
                continue;
            }
            String match = firstValidMatch(page, subSearch, post);
            if (match != null && !urls.contains(match)) {
                urls.add(match);
            }
        }
        return urls;
    }

    private static String firstValidMatch(String page, SubSearch subSearch, Post post) {
        Pattern pattern;
        try {
            pattern = Pattern.compile(subSearch.pageSearchRegex());
        } catch (PatternSyntaxException e) {
            LOG.warn("Invalid page-search-regex '{}' for post {}: {}",
                    subSearch.pageSearchRegex(), post.id(), e.getDescription());
            return null;
        }

        Matcher matcher = pattern.matcher(page);
        while (matcher.find()) {
            String candidate = matcher.group();
            if (UrlUtils.isValidAbsoluteUrl(candidate)) {
                return candidate.replace("&amp;", "&");
            }
            LOG.debug("Discarding match '{}' on {}: not a valid URL", candidate, post.url());
        }
        LOG.debug("No match for '{}' on {}", subSearch.pageSearchRegex(), post.url());
        return null;
    }
}
