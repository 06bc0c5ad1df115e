package com.metromatch.bpm;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable row of the BPM cache. Unique per ({@code artistNorm}, {@code titleNorm}); writes are upserts,
 * so the record always reflects the last successful resolution.
 *
 * @author MetroMatch Team
 * @since 1.0
 */
public record BpmRecord(
    String artistNorm,
    String titleNorm,
    double bpm,
    BpmSource source,
    Instant lastUpdated,
    Map<String, Object> metadata
) {
    public BpmRecord {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public NormalizedKey key() {
        return new NormalizedKey(artistNorm, titleNorm);
    }
}
