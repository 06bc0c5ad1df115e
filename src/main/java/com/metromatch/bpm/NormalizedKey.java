package com.metromatch.bpm;

/**
 * Cache identity of a track: lower-cased, trimmed artist and title with inner whitespace collapsed.
 * Produced by {@link TrackNormalizer#normalize(String, String)}.
 */
public record NormalizedKey(String artistNorm, String titleNorm) {
}
