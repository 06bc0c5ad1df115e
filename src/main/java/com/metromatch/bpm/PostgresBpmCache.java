package com.metromatch.bpm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * BPM cache backed by a PostgreSQL table.
 * <p>
 * Schema:
 * <ul>
 *   <li>{@code bpm_cache(artist_norm, title_norm)} primary key, so writes are upserts.</li>
 *   <li>{@code bpm DOUBLE PRECISION}, {@code source TEXT}, {@code last_updated TIMESTAMPTZ}, {@code metadata JSONB}.</li>
 *   <li>Secondary index on {@code last_updated} for administrative sweeps; nothing expires automatically.</li>
 * </ul>
 * <p>
 * Every operation opens its own connection. SQL failures are logged and reported through the return value,
 * never thrown, so an unreachable database only disables the cache tier.
 *
 * @author MetroMatch Team
 * @since 1.0
 */
public class PostgresBpmCache implements BpmCacheInterface {
    private static final Logger logger = LoggerFactory.getLogger(PostgresBpmCache.class);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final String url;
    private final String user;
    private final String password;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Constructs a cache with the given connection parameters. No connection is opened here.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     */
    public PostgresBpmCache(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    @Override
    public boolean createTables() {
        String table = "CREATE TABLE IF NOT EXISTS bpm_cache (" +
                "artist_norm TEXT NOT NULL, " +
                "title_norm TEXT NOT NULL, " +
                "bpm DOUBLE PRECISION NOT NULL, " +
                "source TEXT NOT NULL, " +
                "last_updated TIMESTAMPTZ NOT NULL, " +
                "metadata JSONB, " +
                "PRIMARY KEY (artist_norm, title_norm)" +
                ")";
        String index = "CREATE INDEX IF NOT EXISTS bpm_cache_last_updated_idx ON bpm_cache (last_updated)";
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(table);
            stmt.execute(index);
            logger.info("Ensured bpm_cache table exists.");
            return true;
        } catch (SQLException e) {
            logger.error("Error creating bpm_cache table: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<BpmRecord> get(NormalizedKey key) {
        if (key == null) {
            logger.warn("Cache lookup called with null key.");
            return Optional.empty();
        }
        String sql = "SELECT artist_norm, title_norm, bpm, source, last_updated, metadata FROM bpm_cache " +
                "WHERE artist_norm = ? AND title_norm = ?";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key.artistNorm());
            ps.setString(2, key.titleNorm());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    BpmRecord record = readRecord(rs);
                    logger.debug("Cache hit for {} - {}", key.artistNorm(), key.titleNorm());
                    return Optional.of(record);
                }
            }
            logger.debug("Cache miss for {} - {}", key.artistNorm(), key.titleNorm());
        } catch (SQLException e) {
            logger.error("Error reading from cache: {}", e.getMessage());
        }
        return Optional.empty();
    }

    @Override
    public boolean put(NormalizedKey key, double bpm, BpmSource source, Map<String, Object> metadata) {
        if (key == null || source == null) {
            logger.warn("Invalid cache write: key={}, source={}", key, source);
            return false;
        }
        String sql = "INSERT INTO bpm_cache (artist_norm, title_norm, bpm, source, last_updated, metadata) " +
                "VALUES (?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT (artist_norm, title_norm) DO UPDATE SET bpm = EXCLUDED.bpm, source = EXCLUDED.source, " +
                "last_updated = EXCLUDED.last_updated, metadata = EXCLUDED.metadata";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key.artistNorm());
            ps.setString(2, key.titleNorm());
            ps.setDouble(3, bpm);
            ps.setString(4, source.dbValue());
            ps.setTimestamp(5, Timestamp.from(Instant.now()));
            ps.setObject(6, mapper.writeValueAsString(metadata == null ? Map.of() : metadata), Types.OTHER);
            ps.executeUpdate();
            logger.info("Cached BPM for {} - {}: {} ({})", key.artistNorm(), key.titleNorm(), bpm, source.dbValue());
            return true;
        } catch (SQLException e) {
            logger.error("Error storing in cache: {}", e.getMessage());
        } catch (JsonProcessingException e) {
            logger.error("Error serializing cache metadata: {}", e.getMessage());
        }
        return false;
    }

    @Override
    public boolean delete(NormalizedKey key) {
        if (key == null) return false;
        String sql = "DELETE FROM bpm_cache WHERE artist_norm = ? AND title_norm = ?";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key.artistNorm());
            ps.setString(2, key.titleNorm());
            int deleted = ps.executeUpdate();
            logger.info("Deleted {} cache entries for {} - {}", deleted, key.artistNorm(), key.titleNorm());
            return deleted > 0;
        } catch (SQLException e) {
            logger.error("Error deleting cache entry: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<BpmRecord> findByArtist(String artistFragment) {
        List<BpmRecord> records = new ArrayList<>();
        if (artistFragment == null || artistFragment.isBlank()) {
            logger.warn("findByArtist called with blank fragment.");
            return records;
        }
        String sql = "SELECT artist_norm, title_norm, bpm, source, last_updated, metadata FROM bpm_cache " +
                "WHERE artist_norm LIKE ? ESCAPE '\\' ORDER BY last_updated DESC";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, "%" + escapeLike(artistFragment.trim().toLowerCase(Locale.ROOT)) + "%");
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(readRecord(rs));
                }
            }
        } catch (SQLException e) {
            logger.error("Error searching cache: {}", e.getMessage());
        }
        return records;
    }

    @Override
    public int clear() {
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            int deleted = stmt.executeUpdate("DELETE FROM bpm_cache");
            logger.info("Cleared {} cached entries", deleted);
            return deleted;
        } catch (SQLException e) {
            logger.error("Error clearing cache: {}", e.getMessage());
            return -1;
        }
    }

    private BpmRecord readRecord(ResultSet rs) throws SQLException {
        Timestamp updated = rs.getTimestamp("last_updated");
        return new BpmRecord(
            rs.getString("artist_norm"),
            rs.getString("title_norm"),
            rs.getDouble("bpm"),
            BpmSource.fromDbValue(rs.getString("source")),
            updated == null ? null : updated.toInstant(),
            readMetadata(rs.getString("metadata"))
        );
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return mapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring unreadable cache metadata: {}", e.getMessage());
            return Map.of();
        }
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
