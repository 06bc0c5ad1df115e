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
 * Runs the site's own search through a {@link RenderedSearchCapability} and extracts the BPM of the first result.
 */
public class RenderedSearchStrategy implements WebStrategy {
    private static final Logger logger = LoggerFactory.getLogger(RenderedSearchStrategy.class);

    private final RenderedSearchCapability capability;

    public RenderedSearchStrategy(RenderedSearchCapability capability) {
        this.capability = capability;
    }

    @Override
    public String name() {
        return "rendered-search";
    }

    @Override
    public Optional<ResolutionResult> attempt(ResolutionAttempt attempt) {
        Optional<FetchedPage> rendered;
        try {
            rendered = capability.renderFirstResult(attempt.query().combined());
        } catch (RuntimeException e) {
            logger.warn("Rendered search raised unexpectedly: {}", e.getMessage());
            return Optional.empty();
        }
        if (rendered.isEmpty()) return Optional.empty();
        if (!rendered.get().isSuccess()) {
            logger.debug("Rendered result {} returned status {}", rendered.get().url(), rendered.get().statusCode());
            return Optional.empty();
        }
        OptionalDouble bpm = BpmExtractor.extractBpm(rendered.get().body());
        if (bpm.isEmpty()) {
            logger.debug("No plausible BPM on rendered result {}", rendered.get().url());
            return Optional.empty();
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("url", rendered.get().url());
        metadata.put("strategy", name());
        metadata.put("artist", attempt.query().artist());
        metadata.put("title", attempt.query().title());
        logger.info("Rendered search gave {} BPM from {}", bpm.getAsDouble(), rendered.get().url());
        return Optional.of(new ResolutionResult(bpm.getAsDouble(), BpmSource.SCRAPER, metadata));
    }
}
