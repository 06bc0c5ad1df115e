package com.metromatch.bpm;

import java.util.Optional;

/**
 * Interface for a structured tempo database queried by artist and title.
 */
public interface TempoApiClientInterface {
    /**
     * Looks up the tempo of a track. Transport errors and unexpected payloads yield empty.
     * @param artist Artist name
     * @param title Song title
     * @return API-sourced result, or empty when the service has no usable tempo
     */
    Optional<ResolutionResult> search(String artist, String title);
}
