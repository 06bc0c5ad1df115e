package com.metromatch.bpm.web;

/**
 * A catalog link hypothesized to point at the requested song, with its match score. Never persisted.
 *
 * @param urlPath site-relative path, e.g. {@code /@daft-punk/get-lucky}
 * @param matchScore evidence score computed by {@link CandidateScorer}
 */
public record SearchCandidate(String urlPath, int matchScore) {

    /**
     * Last path segment of the link.
     */
    public String songSlug() {
        String path = urlPath.endsWith("/") ? urlPath.substring(0, urlPath.length() - 1) : urlPath;
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
