package de.bsommerfeld.reddharvest.retrieval.resolve;

import java.io.IOException;

/**
 * Source of page text for {@link PageScrapeExtractor}.
 */
@FunctionalInterface
public interface PageFetcher {

    /**
     * Fetches the body of the given URL as text.
     *
     * @throws IOException on transport failure or a non-2xx status
     */
    String fetchPage(String url) throws IOException;
}
