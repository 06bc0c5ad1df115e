package com.metromatch.bpm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a successful tier: the tempo, the tier that produced it and whatever raw details
 * the tier wants persisted alongside (page URL, API identifiers, ...).
 */
public record ResolutionResult(double bpm, BpmSource source, Map<String, Object> rawMetadata) {

    public ResolutionResult {
        rawMetadata = rawMetadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawMetadata));
    }
}
