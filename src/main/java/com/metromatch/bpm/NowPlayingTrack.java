package com.metromatch.bpm;

/**
 * Track reported by a now-playing detector. {@code album} and {@code player} may be null.
 */
public record NowPlayingTrack(String artist, String title, String album, String player) {
}
