package com.metromatch.bpm.web;

import com.metromatch.bpm.TrackNormalizer;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Scores catalog links against a title and picks the one to fetch.
 * <p>
 * Score of a link = number of significant title words (length &gt; 2) present as whole dash-delimited tokens of
 * its song slug, plus a bonus equal to the title's total word count when the plain title slug is a substring of
 * the song slug. Links whose song slug contains {@code -instrumental}, {@code -remix} or {@code -cover} are
 * never scored.
 */
public final class CandidateScorer {

    private static final List<String> EXCLUDED_MARKERS = List.of("-instrumental", "-remix", "-cover");

    private CandidateScorer() {}

    /**
     * Chosen link and the best score seen; a best score of 0 means the catalog held no evidence for the title.
     */
    public record Selection(SearchCandidate candidate, int bestScore) {
        public boolean hasEvidence() {
            return bestScore > 0;
        }
    }

    public static boolean isExcluded(String songSlug) {
        for (String marker : EXCLUDED_MARKERS) {
            if (songSlug.contains(marker)) return true;
        }
        return false;
    }

    public static int score(String songSlug, String plainTitleSlug) {
        List<String> titleWords = TrackNormalizer.slugTokens(plainTitleSlug);
        Set<String> linkTokens = new HashSet<>(TrackNormalizer.slugTokens(songSlug));
        int score = 0;
        for (String word : TrackNormalizer.significantWords(plainTitleSlug)) {
            if (linkTokens.contains(word)) score++;
        }
        if (!plainTitleSlug.isEmpty() && songSlug.contains(plainTitleSlug)) {
            score += titleWords.size();
        }
        return score;
    }

    /**
     * True when a link is strong enough to stop paginating: its song slug contains the plain title slug, or every
     * significant title word appears as a whole token.
     */
    public static boolean isStrongMatch(String songSlug, String plainTitleSlug) {
        if (!plainTitleSlug.isEmpty() && songSlug.contains(plainTitleSlug)) return true;
        List<String> significant = TrackNormalizer.significantWords(plainTitleSlug);
        if (significant.isEmpty()) return false;
        Set<String> linkTokens = new HashSet<>(TrackNormalizer.slugTokens(songSlug));
        return linkTokens.containsAll(significant);
    }

    /**
     * Picks the strictly highest-scoring non-excluded link; ties keep the earlier link. With a best score of 0 the
     * first non-excluded link is chosen, or the first link overall when every link is excluded.
     *
     * @param songPaths collected links in collection order
     * @param plainTitleSlug plain slug of the requested title
     * @return the selection, or empty when no link was collected
     */
    public static Optional<Selection> select(List<String> songPaths, String plainTitleSlug) {
        if (songPaths == null || songPaths.isEmpty()) return Optional.empty();
        SearchCandidate best = null;
        SearchCandidate firstEligible = null;
        for (String path : songPaths) {
            SearchCandidate unscored = new SearchCandidate(path, 0);
            String slug = unscored.songSlug();
            if (isExcluded(slug)) continue;
            SearchCandidate scored = new SearchCandidate(path, score(slug, plainTitleSlug));
            if (firstEligible == null) firstEligible = scored;
            if (best == null || scored.matchScore() > best.matchScore()) best = scored;
        }
        if (best != null && best.matchScore() > 0) {
            return Optional.of(new Selection(best, best.matchScore()));
        }
        SearchCandidate fallback = firstEligible != null ? firstEligible : new SearchCandidate(songPaths.get(0), 0);
        return Optional.of(new Selection(fallback, 0));
    }
}
