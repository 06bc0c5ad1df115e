package com.metromatch.bpm.web;

import com.metromatch.bpm.ResolutionResult;
import com.metromatch.bpm.TrackNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Last resort when the catalog held no evidence for the title: tries each slug variant of the title
 * (period-joined, double-dash, single-dash, plain) under the artist and stops at the first page with a plausible BPM.
 * URLs already fetched in this call are skipped.
 */
public class SlugVariantStrategy extends AbstractPageStrategy {
    private static final Logger logger = LoggerFactory.getLogger(SlugVariantStrategy.class);

    public SlugVariantStrategy(PageFetcher fetcher, SongPageUrls urls) {
        super(fetcher, urls);
    }

    @Override
    public String name() {
        return "slug-variants";
    }

    @Override
    public Optional<ResolutionResult> attempt(ResolutionAttempt attempt) {
        if (attempt.hasCatalogEvidence()) {
            logger.debug("Catalog scan found evidence for {}; slug variants not needed", attempt.query());
            return Optional.empty();
        }
        if (attempt.artistSlug().isEmpty()) return Optional.empty();
        List<String> variants = TrackNormalizer.slugVariants(attempt.query().artist(), attempt.query().title());
        for (String variant : variants) {
            if (variant.isEmpty()) continue;
            String url = urls.songUrl(attempt.artistSlug(), variant);
            if (attempt.alreadyFetched(url)) {
                logger.debug("Skipping already fetched variant {}", url);
                continue;
            }
            Optional<ResolutionResult> result = fetchAndExtract(url, attempt);
            if (result.isPresent()) {
                logger.info("Slug variant {} gave {} BPM", url, result.get().bpm());
                return result;
            }
        }
        return Optional.empty();
    }
}
