package com.metromatch.bpm.web;

import com.metromatch.bpm.ResolutionResult;
import com.metromatch.bpm.TrackQuery;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SlugVariantStrategyTest {
    private final SongPageUrls urls = new SongPageUrls(StubPageFetcher.BASE);

    @Test
    void testTriesVariantsInOrder() {
        StubPageFetcher fetcher = new StubPageFetcher();
        SlugVariantStrategy strategy = new SlugVariantStrategy(fetcher, urls);

        Optional<ResolutionResult> result = strategy.attempt(new ResolutionAttempt(new TrackQuery("Rihanna", "Work (feat. Drake)")));

        assertTrue(result.isEmpty());
        assertEquals(List.of(
            StubPageFetcher.BASE + "/@rihanna/work-feat--drake",
            StubPageFetcher.BASE + "/@rihanna/work--feat-drake",
            StubPageFetcher.BASE + "/@rihanna/work-feat-drake",
            StubPageFetcher.BASE + "/@rihanna/work"), fetcher.fetched());
    }

    @Test
    void testStopsAtFirstPlausiblePage() {
        StubPageFetcher fetcher = new StubPageFetcher()
            .page("/@rihanna/work-feat--drake", "<html><body>Tempo unknown</body></html>")
            .page("/@rihanna/work--feat-drake", StubPageFetcher.songPage("Work", 92))
            .page("/@rihanna/work-feat-drake", StubPageFetcher.songPage("Work", 150));
        SlugVariantStrategy strategy = new SlugVariantStrategy(fetcher, urls);

        Optional<ResolutionResult> result = strategy.attempt(new ResolutionAttempt(new TrackQuery("Rihanna", "Work (feat. Drake)")));

        assertEquals(92.0, result.orElseThrow().bpm());
        assertEquals(2, fetcher.fetched().size());
        assertEquals("slug-variants", result.get().rawMetadata().get("strategy"));
    }

    @Test
    void testSkipsUrlsAlreadyFetched() {
        StubPageFetcher fetcher = new StubPageFetcher();
        ResolutionAttempt attempt = new ResolutionAttempt(new TrackQuery("Daft Punk", "Get Lucky"));
        attempt.markFetched(StubPageFetcher.BASE + "/@daft-punk/get-lucky");

        assertTrue(new SlugVariantStrategy(fetcher, urls).attempt(attempt).isEmpty());
        assertTrue(fetcher.fetched().isEmpty());
    }

    @Test
    void testSkippedWhenCatalogHadEvidence() {
        StubPageFetcher fetcher = new StubPageFetcher();
        ResolutionAttempt attempt = new ResolutionAttempt(new TrackQuery("Rihanna", "Work (feat. Drake)"));
        attempt.recordCatalogEvidence(true);

        assertTrue(new SlugVariantStrategy(fetcher, urls).attempt(attempt).isEmpty());
        assertTrue(fetcher.fetched().isEmpty());
    }
}
