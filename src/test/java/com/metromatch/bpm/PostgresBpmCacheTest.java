package com.metromatch.bpm;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the cache against an embedded PostgreSQL instance.
 */
public class PostgresBpmCacheTest {
    private static EmbeddedPostgres postgres;
    private static PostgresBpmCache cache;

    @BeforeAll
    static void startDatabase() throws IOException {
        postgres = EmbeddedPostgres.start();
        String url = String.format("jdbc:postgresql://localhost:%d/postgres", postgres.getPort());
        cache = new PostgresBpmCache(url, "postgres", "postgres");
        assertTrue(cache.createTables());
    }

    @AfterAll
    static void stopDatabase() throws IOException {
        if (postgres != null) postgres.close();
    }

    @BeforeEach
    void emptyCache() {
        assertTrue(cache.clear() >= 0);
    }

    @Test
    void testCreateTablesIsIdempotent() {
        assertTrue(cache.createTables());
    }

    @Test
    void testPutThenGet() {
        NormalizedKey key = new NormalizedKey("daft punk", "get lucky");
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("id", "abc123");
        metadata.put("artist", null);

        assertTrue(cache.put(key, 116.0, BpmSource.API, metadata));

        Optional<BpmRecord> record = cache.get(key);
        assertTrue(record.isPresent());
        assertEquals(116.0, record.get().bpm());
        assertEquals(BpmSource.API, record.get().source());
        assertEquals("daft punk", record.get().artistNorm());
        assertEquals("get lucky", record.get().titleNorm());
        assertNotNull(record.get().lastUpdated());
        assertEquals("abc123", record.get().metadata().get("id"));
    }

    @Test
    void testMissReturnsEmpty() {
        assertTrue(cache.get(new NormalizedKey("nobody", "nothing")).isEmpty());
    }

    @Test
    void testUpsertOverwritesAndLastWriteWins() {
        NormalizedKey key = new NormalizedKey("rihanna", "work");
        assertTrue(cache.put(key, 92.0, BpmSource.SCRAPER, Map.of("url", "https://songbpm.com/@rihanna/work")));
        assertTrue(cache.put(key, 91.0, BpmSource.MANUAL, null));

        BpmRecord record = cache.get(key).orElseThrow();
        assertEquals(91.0, record.bpm());
        assertEquals(BpmSource.MANUAL, record.source());
        assertTrue(record.metadata().isEmpty());
    }

    @Test
    void testDelete() {
        NormalizedKey key = new NormalizedKey("daft punk", "around the world");
        cache.put(key, 121.0, BpmSource.SCRAPER, Map.of());
        assertTrue(cache.delete(key));
        assertFalse(cache.delete(key));
        assertTrue(cache.get(key).isEmpty());
    }

    @Test
    void testFindByArtistNewestFirst() throws InterruptedException {
        cache.put(new NormalizedKey("daft punk", "get lucky"), 116.0, BpmSource.API, Map.of());
        Thread.sleep(20);
        cache.put(new NormalizedKey("daft punk", "one more time"), 123.0, BpmSource.SCRAPER, Map.of());
        cache.put(new NormalizedKey("justice", "d.a.n.c.e."), 113.0, BpmSource.SCRAPER, Map.of());

        List<BpmRecord> records = cache.findByArtist("DAFT");
        assertEquals(2, records.size());
        assertEquals("one more time", records.get(0).titleNorm());
        assertEquals("get lucky", records.get(1).titleNorm());
        assertTrue(cache.findByArtist("100%").isEmpty());
    }

    @Test
    void testClearReportsDeletedRows() {
        cache.put(new NormalizedKey("a", "b"), 100.0, BpmSource.API, Map.of());
        cache.put(new NormalizedKey("c", "d"), 101.0, BpmSource.API, Map.of());
        assertEquals(2, cache.clear());
        assertEquals(0, cache.clear());
    }

    @Test
    void testUnreachableDatabaseNeverThrows() {
        PostgresBpmCache offline = new PostgresBpmCache("jdbc:postgresql://127.0.0.1:1/none", "postgres", "postgres");
        NormalizedKey key = new NormalizedKey("a", "b");
        assertFalse(offline.createTables());
        assertTrue(offline.get(key).isEmpty());
        assertFalse(offline.put(key, 100.0, BpmSource.API, Map.of()));
        assertFalse(offline.delete(key));
        assertTrue(offline.findByArtist("a").isEmpty());
        assertEquals(-1, offline.clear());
    }
}
