package de.bsommerfeld.reddharvest.retrieval.resolve;

import de.bsommerfeld.reddharvest.core.domain.LinkRule;
import de.bsommerfeld.reddharvest.core.domain.SubSearch;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static de.bsommerfeld.reddharvest.retrieval.TestPosts.link;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PageScrapeExtractorTest {

    private static final String PAGE = """
            <meta content="/relative/clip.mp4">
            <meta property="og:video" content="https://i.imgur.com/clip.mp4?a=1&amp;b=2">
            <source src="https://i.imgur.com/clip.webm">
            <source src="https://i.imgur.com/clip.mp4?a=1&amp;b=2">
            """;

    @Mock
    private PageFetcher pageFetcher;

    private PageScrapeExtractor extractor() {
        return new PageScrapeExtractor(pageFetcher);
    }

    @Test
    void extract_shouldTakeFirstValidMatchAndUnescape() throws IOException {
        when(pageFetcher.fetchPage("https://imgur.com/clip")).thenReturn(PAGE);
        var rule = new LinkRule("https://imgur.com", List.of(),
                List.of(new SubSearch(null, "(?:https://i\\.imgur\\.com)?/[^\"]*\\.mp4[^\"]*")));

        assertEquals(List.of("https://i.imgur.com/clip.mp4?a=1&b=2"),
                extractor().extract(link("https://imgur.com/clip"), rule));
    }

    @Test
    void extract_shouldDeduplicateAcrossSubSearches() throws IOException {
        when(pageFetcher.fetchPage("https://imgur.com/clip")).thenReturn(PAGE);
        var rule = new LinkRule("https://imgur.com", List.of(), List.of(
                new SubSearch(null, "https://i\\.imgur\\.com/clip\\.mp4[^\"]*"),
                new SubSearch(null, "https://i\\.imgur\\.com/clip\\.mp4\\?[^\"]*"),
                new SubSearch(null, "https://i\\.imgur\\.com/clip\\.webm")));

        assertEquals(List.of("https://i.imgur.com/clip.mp4?a=1&b=2", "https://i.imgur.com/clip.webm"),
                extractor().extract(link("https://imgur.com/clip"), rule));
    }

    @Test
    void extract_shouldSkipSubSearchWhoseExtensionDoesNotMatch() throws IOException {
        when(pageFetcher.fetchPage("https://imgur.com/clip.GIFV")).thenReturn(PAGE);
        var rule = new LinkRule("https://imgur.com", List.of(), List.of(
                new SubSearch("mp4", "https://i\\.imgur\\.com/clip\\.webm"),
                new SubSearch("gifv", "https://i\\.imgur\\.com/clip\\.mp4[^\"]*")));

        assertEquals(List.of("https://i.imgur.com/clip.mp4?a=1&b=2"),
                extractor().extract(link("https://imgur.com/clip.GIFV"), rule));
    }

    @Test
    void extract_shouldIgnoreInvalidRegexAndContinue() throws IOException {
        when(pageFetcher.fetchPage("https://imgur.com/clip")).thenReturn(PAGE);
        var rule = new LinkRule("https://imgur.com", List.of(), List.of(
                new SubSearch(null, "https://(unclosed"),
                new SubSearch(null, "https://i\\.imgur\\.com/clip\\.webm")));

        assertEquals(List.of("https://i.imgur.com/clip.webm"),
                extractor().extract(link("https://imgur.com/clip"), rule));
    }

    @Test
    void extract_shouldReturnEmptyWhenPageFetchFails() throws IOException {
        when(pageFetcher.fetchPage(anyString())).thenThrow(new IOException("HTTP 404"));
        var rule = new LinkRule("https://imgur.com", List.of(), List.of(new SubSearch(null, ".*")));

        assertTrue(extractor().extract(link("https://imgur.com/clip"), rule).isEmpty());
    }

    @Test
    void extract_shouldNotFetchWithoutSubSearches() {
        var rule = new LinkRule("https://imgur.com");

        assertTrue(extractor().extract(link("https://imgur.com/clip"), rule).isEmpty());
        verifyNoInteractions(pageFetcher);
    }

    @Test
    void extract_shouldFetchPageOnlyOnce() throws IOException {
        when(pageFetcher.fetchPage("https://imgur.com/clip")).thenReturn(PAGE);
        var rule = new LinkRule("https://imgur.com", List.of(), List.of(
                new SubSearch(null, "https://i\\.imgur\\.com/clip\\.webm"),
                new SubSearch(null, "nothing-matches-this")));

        extractor().extract(link("https://imgur.com/clip"), rule);

        verify(pageFetcher, times(1)).fetchPage("https://imgur.com/clip");
    }
}
