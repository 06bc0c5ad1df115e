package com.metromatch.bpm.web;

import com.metromatch.bpm.ResolutionResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Browses the artist's paginated catalog, scores the song links against the title and fetches the best one.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Start at {@code /@{artist}} and follow the explicit next-page link ({@code ?after=token}) while one exists,
 *   visiting at most {@code maxPages} listing pages.</li>
 *   <li>Collect every link of the form {@code /@{artist}/{song}}; the artist root and other artists are ignored.</li>
 *   <li>Stop paginating as soon as a collected, non-excluded link is a strong match (see {@link CandidateScorer#isStrongMatch}).</li>
 *   <li>Select a candidate with {@link CandidateScorer#select}, record whether the catalog held evidence for the
 *   title, then fetch the candidate and extract its BPM.</li>
 * </ul>
 */
public class CatalogScanStrategy extends AbstractPageStrategy {
    private static final Logger logger = LoggerFactory.getLogger(CatalogScanStrategy.class);

    private final int maxPages;

    public CatalogScanStrategy(PageFetcher fetcher, SongPageUrls urls, int maxPages) {
        super(fetcher, urls);
        this.maxPages = maxPages;
    }

    @Override
    public String name() {
        return "catalog-scan";
    }

    @Override
    public Optional<ResolutionResult> attempt(ResolutionAttempt attempt) {
        attempt.recordCatalogEvidence(false);
        if (attempt.artistSlug().isEmpty()) return Optional.empty();

        CatalogAccumulator accumulator = scan(attempt);
        Optional<CandidateScorer.Selection> selection = CandidateScorer.select(accumulator.songPaths(), attempt.plainTitleSlug());
        if (selection.isEmpty()) {
            logger.info("Catalog of {} yielded no song links after {} page(s)", attempt.artistSlug(), accumulator.pagesVisited());
            return Optional.empty();
        }
        CandidateScorer.Selection chosen = selection.get();
        attempt.recordCatalogEvidence(chosen.hasEvidence());
        logger.info("Catalog candidate {} (score {}) out of {} link(s) on {} page(s)",
            chosen.candidate().urlPath(), chosen.bestScore(), accumulator.songPaths().size(), accumulator.pagesVisited());

        String url = urls.toAbsolute(chosen.candidate().urlPath());
        Optional<ResolutionResult> result = fetchAndExtract(url, attempt);
        result.ifPresent(r -> logger.info("Catalog candidate {} gave {} BPM", url, r.bpm()));
        return result;
    }

    /**
     * Walks the listing pages and collects song links.
     */
    CatalogAccumulator scan(ResolutionAttempt attempt) {
        CatalogAccumulator accumulator = new CatalogAccumulator(maxPages);
        String pageUrl = urls.catalogUrl(attempt.artistSlug());
        while (pageUrl != null && accumulator.canVisitMore()) {
            if (!accumulator.markVisited(SongPageUrls.pathAndQuery(pageUrl))) break;
            Optional<FetchedPage> page = fetcher.fetch(pageUrl);
            if (page.isEmpty() || !page.get().isSuccess()) {
                logger.debug("Catalog page {} unavailable ({})", pageUrl,
                    page.map(p -> String.valueOf(p.statusCode())).orElse("transport failure"));
                break;
            }
            Document doc = Jsoup.parse(page.get().body());
            boolean strongMatch = false;
            String nextPage = null;
            for (Element link : doc.select("a[href]")) {
                String href = link.attr("href");
                Optional<String> songSlug = SongPageUrls.songSlugOf(href, attempt.artistSlug());
                if (songSlug.isPresent()) {
                    accumulator.addSongPath(SongPageUrls.songPath(href));
                    if (!CandidateScorer.isExcluded(songSlug.get())
                            && CandidateScorer.isStrongMatch(songSlug.get(), attempt.plainTitleSlug())) {
                        strongMatch = true;
                    }
                } else if (nextPage == null && SongPageUrls.isNextPageLink(href, attempt.artistSlug())
                        && !accumulator.wasVisited(SongPageUrls.pathAndQuery(href))) {
                    nextPage = urls.toAbsolute(SongPageUrls.pathAndQuery(href));
                }
            }
            if (strongMatch) {
                logger.debug("Strong match on catalog page {}; stopping pagination", accumulator.pagesVisited());
                break;
            }
            pageUrl = nextPage;
        }
        return accumulator;
    }
}
