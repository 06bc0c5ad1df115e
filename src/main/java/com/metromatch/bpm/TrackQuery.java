package com.metromatch.bpm;

/**
 * Immutable (artist, title) pair as supplied by a caller or a now-playing detector.
 * <p>
 * Construction is the only place the pipeline raises: a null or blank artist or title is a
 * programmer error and fails fast with {@link IllegalArgumentException}, before any I/O happens.
 *
 * @author MetroMatch Team
 * @since 1.0
 */
public record TrackQuery(String artist, String title) {

    public TrackQuery {
        if (artist == null || artist.isBlank()) {
            throw new IllegalArgumentException("Artist must not be null or blank");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Title must not be null or blank");
        }
    }

    /**
     * Free-text form used by site search boxes: {@code "artist title"}.
     */
    public String combined() {
        return artist.trim() + " " + title.trim();
    }
}
