package com.metromatch.bpm;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Interface for the persistent BPM cache.
 * <p>
 * Implementations never throw for connectivity problems: reads return empty results and writes return
 * {@code false}, with the failure logged.
 */
public interface BpmCacheInterface {
    /**
     * Creates the cache table and its indexes if they don't already exist.
     * @return false if the store could not be reached
     */
    boolean createTables();

    /**
     * Looks up a record by its normalized key. Side-effect-free.
     * @param key Normalized (artist, title)
     * @return The record, or empty on a miss or a store failure
     */
    Optional<BpmRecord> get(NormalizedKey key);

    /**
     * Inserts or overwrites the record for a key; the last write wins.
     * @param key Normalized (artist, title)
     * @param bpm Tempo to store
     * @param source Tier that produced the tempo
     * @param metadata Extra details persisted as JSON (may be null)
     * @return true if the row was written
     */
    boolean put(NormalizedKey key, double bpm, BpmSource source, Map<String, Object> metadata);

    /**
     * Removes the record for one key.
     * @return true if a row was deleted
     */
    boolean delete(NormalizedKey key);

    /**
     * Lists records whose normalized artist contains the given fragment (case-insensitive), newest first.
     */
    List<BpmRecord> findByArtist(String artistFragment);

    /**
     * Removes all records.
     * @return number of deleted rows, or -1 on failure
     */
    int clear();
}
