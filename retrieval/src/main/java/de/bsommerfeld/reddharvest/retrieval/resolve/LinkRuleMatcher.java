package de.bsommerfeld.reddharvest.retrieval.resolve;

import de.bsommerfeld.reddharvest.core.domain.LinkRule;
import de.bsommerfeld.reddharvest.core.domain.Post;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Finds the link rule responsible for a post and derives the candidate
 * media URLs from it.
 *
 * <p>
 * The first rule (in configured order) whose base URL prefixes the post URL
 * is the only one consulted, even when it yields nothing. Within that rule
 * the strategies run in order and the first non-empty result wins:
 * direct extension, structured media, page scrape.
 */
public class LinkRuleMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(LinkRuleMatcher.class);

    private final DirectExtensionRewriter directExtensionRewriter;
    private final StructuredMediaExtractor structuredMediaExtractor;
    private final PageScrapeExtractor pageScrapeExtractor;

    @Inject
    public LinkRuleMatcher(DirectExtensionRewriter directExtensionRewriter,
            StructuredMediaExtractor structuredMediaExtractor,
            PageScrapeExtractor pageScrapeExtractor) {
        this.directExtensionRewriter = directExtensionRewriter;
        this.structuredMediaExtractor = structuredMediaExtractor;
        this.pageScrapeExtractor = pageScrapeExtractor;
    }

    public Optional<LinkRule> findRule(String url, List<LinkRule> rules) {
        return rules.stream().filter(rule -> rule.appliesTo(url)).findFirst();
    }

    public List<String> resolve(Post post, List<LinkRule> rules) {
        Optional<LinkRule> match = findRule(post.url(), rules);
        if (match.isEmpty()) {
            LOG.debug("No link rule for {} (post {})", post.url(), post.id());
            return List.of();
        }
        LinkRule rule = match.get();

        List<String> urls = directExtensionRewriter.rewrite(post.url(), rule.directDownloadExtensions());
        if (!urls.isEmpty()) {
            return urls;
        }
        urls = structuredMediaExtractor.extract(post);
        if (!urls.isEmpty()) {
            return urls;
        }
        urls = pageScrapeExtractor.extract(post, rule);
        if (urls.isEmpty()) {
            LOG.debug("Rule {} yielded no URL for {} (post {})", rule.baseUrl(), post.url(), post.id());
        }
        return urls;
    }
}
