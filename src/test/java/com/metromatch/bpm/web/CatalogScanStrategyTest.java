package com.metromatch.bpm.web;

import com.metromatch.bpm.BpmSource;
import com.metromatch.bpm.ResolutionResult;
import com.metromatch.bpm.TrackQuery;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class CatalogScanStrategyTest {
    private final SongPageUrls urls = new SongPageUrls(StubPageFetcher.BASE);

    @Test
    void testNeverVisitsMoreThanMaxPages() {
        List<String> fetched = new ArrayList<>();
        PageFetcher endless = url -> {
            fetched.add(url);
            int page = url.contains("after=") ? Integer.parseInt(url.substring(url.indexOf("after=") + 6)) : 0;
            String html = StubPageFetcher.links("/@daft-punk/song-" + page, "/@daft-punk?after=" + (page + 1));
            return Optional.of(new FetchedPage(url, 200, html));
        };
        CatalogScanStrategy strategy = new CatalogScanStrategy(endless, urls, 15);

        CatalogAccumulator accumulator = strategy.scan(new ResolutionAttempt(new TrackQuery("Daft Punk", "Get Lucky")));

        assertEquals(15, accumulator.pagesVisited());
        assertEquals(15, fetched.size());
        assertEquals(15, accumulator.songPaths().size());
    }

    @Test
    void testStopsPaginatingOnStrongMatch() {
        StubPageFetcher fetcher = new StubPageFetcher()
            .page("/@daft-punk", StubPageFetcher.links("/@daft-punk/around-the-world", "/@daft-punk/get-lucky-radio-edit", "/@daft-punk?after=p2"))
            .page("/@daft-punk?after=p2", StubPageFetcher.links("/@daft-punk/get-lucky"))
            .page("/@daft-punk/get-lucky-radio-edit", StubPageFetcher.songPage("Get Lucky (Radio Edit)", 116));
        CatalogScanStrategy strategy = new CatalogScanStrategy(fetcher, urls, 15);

        Optional<ResolutionResult> result = strategy.attempt(new ResolutionAttempt(new TrackQuery("Daft Punk", "Get Lucky")));

        assertTrue(result.isPresent());
        assertEquals(116.0, result.get().bpm());
        assertEquals(BpmSource.SCRAPER, result.get().source());
        assertEquals("catalog-scan", result.get().rawMetadata().get("strategy"));
        assertFalse(fetcher.fetched().contains(StubPageFetcher.BASE + "/@daft-punk?after=p2"));
    }

    @Test
    void testExcludedMatchDoesNotStopPagination() {
        StubPageFetcher fetcher = new StubPageFetcher()
            .page("/@daft-punk", StubPageFetcher.links("/@daft-punk/one-more-time", "/@daft-punk/get-lucky-remix", "/@daft-punk?after=2"))
            .page("/@daft-punk?after=2", StubPageFetcher.links("/@daft-punk/get-lucky-radio-edit"))
            .page("/@daft-punk/one-more-time", StubPageFetcher.songPage("One More Time", 123))
            .page("/@daft-punk/get-lucky-radio-edit", StubPageFetcher.songPage("Get Lucky (Radio Edit)", 116));
        CatalogScanStrategy strategy = new CatalogScanStrategy(fetcher, urls, 15);

        Optional<ResolutionResult> result = strategy.attempt(new ResolutionAttempt(new TrackQuery("Daft Punk", "Get Lucky")));

        assertEquals(116.0, result.orElseThrow().bpm());
        assertTrue(fetcher.fetched().contains(StubPageFetcher.BASE + "/@daft-punk?after=2"));
        assertFalse(fetcher.fetched().contains(StubPageFetcher.BASE + "/@daft-punk/one-more-time"));
    }

    @Test
    void testFollowsNextPageAndIgnoresOtherArtists() {
        StubPageFetcher fetcher = new StubPageFetcher()
            .page("/@justice", StubPageFetcher.links("/@justice/genesis", "/@daft-punk/one-more-time", "/@justice", "/@justice?after=2"))
            .page("/@justice?after=2", StubPageFetcher.links(StubPageFetcher.BASE + "/@justice/d-a-n-c-e?ref=list", "/@justice?after=2"));
        CatalogScanStrategy strategy = new CatalogScanStrategy(fetcher, urls, 15);

        CatalogAccumulator accumulator = strategy.scan(new ResolutionAttempt(new TrackQuery("Justice", "D.A.N.C.E.")));

        assertEquals(2, accumulator.pagesVisited());
        assertEquals(List.of("/@justice/genesis", "/@justice/d-a-n-c-e"), accumulator.songPaths());
    }

    @Test
    void testRecordsCatalogEvidence() {
        StubPageFetcher fetcher = new StubPageFetcher()
            .page("/@rihanna", StubPageFetcher.links("/@rihanna/umbrella", "/@rihanna/diamonds"));
        CatalogScanStrategy strategy = new CatalogScanStrategy(fetcher, urls, 15);
        ResolutionAttempt attempt = new ResolutionAttempt(new TrackQuery("Rihanna", "Work (feat. Drake)"));

        Optional<ResolutionResult> result = strategy.attempt(attempt);

        assertTrue(result.isEmpty());
        assertFalse(attempt.hasCatalogEvidence());
        assertTrue(fetcher.fetched().contains(StubPageFetcher.BASE + "/@rihanna/umbrella"));
    }

    @Test
    void testMissingCatalogIsAMiss() {
        StubPageFetcher fetcher = new StubPageFetcher();
        CatalogScanStrategy strategy = new CatalogScanStrategy(fetcher, urls, 15);

        assertTrue(strategy.attempt(new ResolutionAttempt(new TrackQuery("Nobody", "Nothing"))).isEmpty());
        assertEquals(1, fetcher.fetched().size());
    }
}
