package com.metromatch.bpm;

import java.util.Optional;

/**
 * Producer of the currently playing track (OS media sessions, window titles, ...). Implemented outside this library.
 */
public interface NowPlayingSource {
    /**
     * @return the track playing right now, or empty when nothing is playing
     */
    Optional<NowPlayingTrack> currentTrack();
}
