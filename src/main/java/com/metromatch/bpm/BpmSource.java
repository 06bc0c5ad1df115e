package com.metromatch.bpm;

import java.util.Locale;

/**
 * Where a BPM value came from. Stored lower-case in the {@code source} column of the cache.
 */
public enum BpmSource {
    CACHE,
    API,
    SCRAPER,
    MANUAL;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a stored value; unknown values map to {@link #CACHE}.
     */
    public static BpmSource fromDbValue(String value) {
        if (value == null) return CACHE;
        for (BpmSource source : values()) {
            if (source.dbValue().equalsIgnoreCase(value.trim())) return source;
        }
        return CACHE;
    }
}
