package com.metromatch.bpm.web;

import com.metromatch.bpm.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Guesses the song page address from the artist slug and the plain title slug.
 * A 404 hands over to the catalog scan.
 */
public class DirectUrlStrategy extends AbstractPageStrategy {
    private static final Logger logger = LoggerFactory.getLogger(DirectUrlStrategy.class);

    public DirectUrlStrategy(PageFetcher fetcher, SongPageUrls urls) {
        super(fetcher, urls);
    }

    @Override
    public String name() {
        return "direct-url";
    }

    @Override
    public Optional<ResolutionResult> attempt(ResolutionAttempt attempt) {
        if (attempt.artistSlug().isEmpty() || attempt.plainTitleSlug().isEmpty()) {
            logger.debug("No usable slug for {}; skipping direct URL guess", attempt.query());
            return Optional.empty();
        }
        String url = urls.songUrl(attempt.artistSlug(), attempt.plainTitleSlug());
        Optional<FetchedPage> page = fetchSongPage(url, attempt);
        if (page.isEmpty()) return Optional.empty();
        if (page.get().isNotFound()) {
            logger.debug("Direct URL {} not found; moving on to catalog scan", url);
            return Optional.empty();
        }
        Optional<ResolutionResult> result = extract(page.get(), attempt);
        result.ifPresent(r -> logger.info("Direct URL {} gave {} BPM", url, r.bpm()));
        return result;
    }
}
