package com.metromatch.bpm.web;

import java.util.Optional;

/**
 * Interface for fetching static pages of the public site.
 */
public interface PageFetcher {
    /**
     * Fetches a page with a GET request.
     * @param url Absolute URL
     * @return The page with its status (any status, including 404), or empty on a transport failure
     */
    Optional<FetchedPage> fetch(String url);
}
