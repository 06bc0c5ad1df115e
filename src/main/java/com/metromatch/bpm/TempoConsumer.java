package com.metromatch.bpm;

/**
 * Consumer of a resolved tempo, such as a metronome or a playback surface. Implemented outside this library.
 */
public interface TempoConsumer {
    void setBpm(double bpm);
}
