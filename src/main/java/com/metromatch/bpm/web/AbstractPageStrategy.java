package com.metromatch.bpm.web;

import com.metromatch.bpm.BpmExtractor;
import com.metromatch.bpm.BpmSource;
import com.metromatch.bpm.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Shared fetch-then-extract plumbing of the static-page strategies.
 */
public abstract class AbstractPageStrategy implements WebStrategy {
    private static final Logger logger = LoggerFactory.getLogger(AbstractPageStrategy.class);

    protected final PageFetcher fetcher;
    protected final SongPageUrls urls;

    protected AbstractPageStrategy(PageFetcher fetcher, SongPageUrls urls) {
        this.fetcher = fetcher;
        this.urls = urls;
    }

    /**
     * Fetches a song page, recording it as fetched for this call.
     */
    protected Optional<FetchedPage> fetchSongPage(String url, ResolutionAttempt attempt) {
        attempt.markFetched(url);
        return fetcher.fetch(url);
    }

    /**
     * Extracts a BPM from a successful page.
     */
    protected Optional<ResolutionResult> extract(FetchedPage page, ResolutionAttempt attempt) {
        if (!page.isSuccess()) {
            logger.debug("[{}] {} returned status {}", name(), page.url(), page.statusCode());
            return Optional.empty();
        }
        OptionalDouble bpm = BpmExtractor.extractBpm(page.body());
        if (bpm.isEmpty()) {
            logger.debug("[{}] no plausible BPM on {}", name(), page.url());
            return Optional.empty();
        }
        return Optional.of(scraped(bpm.getAsDouble(), page.url(), attempt));
    }

    protected Optional<ResolutionResult> fetchAndExtract(String url, ResolutionAttempt attempt) {
        return fetchSongPage(url, attempt).flatMap(page -> extract(page, attempt));
    }

    protected ResolutionResult scraped(double bpm, String url, ResolutionAttempt attempt) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("url", url);
        metadata.put("strategy", name());
        metadata.put("artist", attempt.query().artist());
        metadata.put("title", attempt.query().title());
        return new ResolutionResult(bpm, BpmSource.SCRAPER, metadata);
    }
}
