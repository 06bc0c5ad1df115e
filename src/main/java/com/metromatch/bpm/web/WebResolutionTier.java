package com.metromatch.bpm.web;

import com.metromatch.bpm.PipelineConfig;
import com.metromatch.bpm.ResolutionResult;
import com.metromatch.bpm.TrackQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Heuristic BPM resolution against the public song site.
 * <p>
 * Runs its strategies strictly in order, each exactly once per call, and returns the first plausible BPM:
 * <ol>
 *   <li>{@link RenderedSearchStrategy} (only when a {@link RenderedSearchCapability} is configured)</li>
 *   <li>{@link DirectUrlStrategy}</li>
 *   <li>{@link CatalogScanStrategy}</li>
 *   <li>{@link SlugVariantStrategy} (only when the catalog scan found no evidence)</li>
 * </ol>
 * A strategy that fails in any way counts as a miss; nothing is retried and nothing propagates.
 *
 * @author MetroMatch Team
 * @since 1.0
 */
public class WebResolutionTier {
    private static final Logger logger = LoggerFactory.getLogger(WebResolutionTier.class);

    private final List<WebStrategy> strategies;

    public WebResolutionTier(List<WebStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Builds the standard strategy chain.
     * @param fetcher static page fetcher shared by strategies B to D
     * @param urls URL shapes of the site
     * @param maxCatalogPages pagination bound of the catalog scan
     * @param renderedSearch browser search capability, or null when unavailable
     */
    public static WebResolutionTier standard(PageFetcher fetcher, SongPageUrls urls, int maxCatalogPages,
                                             RenderedSearchCapability renderedSearch) {
        List<WebStrategy> chain = new ArrayList<>();
        if (renderedSearch != null) chain.add(new RenderedSearchStrategy(renderedSearch));
        chain.add(new DirectUrlStrategy(fetcher, urls));
        chain.add(new CatalogScanStrategy(fetcher, urls, maxCatalogPages));
        chain.add(new SlugVariantStrategy(fetcher, urls));
        return new WebResolutionTier(chain);
    }

    /**
     * Builds the chain from configuration; rendered search is included only when enabled and supported.
     */
    public static WebResolutionTier fromConfig(PipelineConfig config) {
        SongPageUrls urls = new SongPageUrls(config.siteBaseUrl());
        PageFetcher fetcher = new HttpPageFetcher(config.webTimeout(), config.scraperRequestInterval());
        RenderedSearchCapability renderedSearch = null;
        if (config.browserSearchEnabled() && PlaywrightSearchCapability.isSupported()) {
            renderedSearch = new PlaywrightSearchCapability(urls, config.browserTimeout());
        }
        return standard(fetcher, urls, config.maxCatalogPages(), renderedSearch);
    }

    public List<WebStrategy> strategies() {
        return Collections.unmodifiableList(strategies);
    }

    public boolean hasRenderedSearch() {
        return strategies.stream().anyMatch(s -> s instanceof RenderedSearchStrategy);
    }

    /**
     * Resolves a track through the strategy chain.
     * @param artist Artist name
     * @param title Song title
     * @return scraper-sourced result, or empty when every strategy missed
     * @throws IllegalArgumentException if artist or title is null or blank
     */
    public Optional<ResolutionResult> resolve(String artist, String title) {
        return resolve(new TrackQuery(artist, title));
    }

    public Optional<ResolutionResult> resolve(TrackQuery query) {
        ResolutionAttempt attempt = new ResolutionAttempt(query);
        for (WebStrategy strategy : strategies) {
            try {
                Optional<ResolutionResult> result = strategy.attempt(attempt);
                if (result.isPresent()) {
                    logger.info("Web strategy {} resolved {} - {}: {} BPM", strategy.name(), query.artist(), query.title(), result.get().bpm());
                    return result;
                }
                logger.debug("Web strategy {} missed for {} - {}", strategy.name(), query.artist(), query.title());
            } catch (RuntimeException e) {
                logger.warn("Web strategy {} failed for {} - {}: {}", strategy.name(), query.artist(), query.title(), e.getMessage());
            }
        }
        return Optional.empty();
    }
}
