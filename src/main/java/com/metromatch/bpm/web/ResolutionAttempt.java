package com.metromatch.bpm.web;

import com.metromatch.bpm.TrackNormalizer;
import com.metromatch.bpm.TrackQuery;

import java.util.HashSet;
import java.util.Set;

/**
 * Per-call state shared by the web strategies of one resolution: the query, its derived slugs, the song URLs
 * already fetched and whether the catalog scan found evidence for the title.
 * Created by {@link WebResolutionTier} for each call and discarded afterwards.
 */
public class ResolutionAttempt {
    private final TrackQuery query;
    private final String artistSlug;
    private final String plainTitleSlug;
    private final Set<String> fetchedUrls = new HashSet<>();
    private boolean catalogEvidence;

    public ResolutionAttempt(TrackQuery query) {
        this.query = query;
        this.artistSlug = TrackNormalizer.artistSlug(query.artist());
        this.plainTitleSlug = TrackNormalizer.plainTitleSlug(query.title());
    }

    public TrackQuery query() {
        return query;
    }

    public String artistSlug() {
        return artistSlug;
    }

    public String plainTitleSlug() {
        return plainTitleSlug;
    }

    /**
     * Remembers a song URL as fetched.
     * @return false if it had been fetched before in this call
     */
    public boolean markFetched(String url) {
        return fetchedUrls.add(url);
    }

    public boolean alreadyFetched(String url) {
        return fetchedUrls.contains(url);
    }

    public boolean hasCatalogEvidence() {
        return catalogEvidence;
    }

    public void recordCatalogEvidence(boolean evidence) {
        this.catalogEvidence = evidence;
    }
}
