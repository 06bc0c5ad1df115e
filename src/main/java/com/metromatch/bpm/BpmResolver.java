package com.metromatch.bpm;

import com.metromatch.bpm.web.WebResolutionTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * Resolves the BPM of a track through the waterfall cache, structured API, web resolution.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Normalize the query and look it up in the cache; a hit returns immediately and no other tier is touched.</li>
 *   <li>Otherwise ask the API client, then the web tier; the first tier with a result wins.</li>
 *   <li>A result from a tier other than the cache is upserted into the cache, tagged with its source, before
 *   returning.</li>
 * </ul>
 * <p>
 * Each tier is optional: a null collaborator means the tier is disabled for the lifetime of this instance.
 * Misses, transport failures and tier defects are logged and never reach the caller; only a null or blank
 * artist or title raises ({@link IllegalArgumentException}), before any I/O.
 * <p>
 * The resolver performs blocking I/O and holds no locks: concurrent calls for the same unseen track each run the
 * full waterfall and the last cache write wins. Callers with an interactive thread should invoke it from a worker.
 *
 * @author MetroMatch Team
 * @since 1.0
 */
public class BpmResolver {
    private static final Logger logger = LoggerFactory.getLogger(BpmResolver.class);

    private final BpmCacheInterface cache;
    private final TempoApiClientInterface apiClient;
    private final WebResolutionTier webTier;

    /**
     * @param cache cache tier, or null to disable it
     * @param apiClient structured API tier, or null to disable it
     * @param webTier web resolution tier, or null to disable it
     */
    public BpmResolver(BpmCacheInterface cache, TempoApiClientInterface apiClient, WebResolutionTier webTier) {
        this.cache = cache;
        this.apiClient = apiClient;
        this.webTier = webTier;
    }

    /**
     * Builds the tiers described by the configuration. A configured but unreachable cache is disabled with a warning.
     */
    public static BpmResolver fromConfig(PipelineConfig config) {
        BpmCacheInterface cache = null;
        if (config.cacheConfigured()) {
            PostgresBpmCache postgres = new PostgresBpmCache(config.dbUrl(), config.dbUser(), config.dbPassword());
            if (postgres.createTables()) {
                cache = postgres;
            } else {
                logger.warn("Cache database at {} is unreachable; cache tier disabled.", config.dbUrl());
            }
        }
        TempoApiClientInterface api = config.apiConfigured() ? new GetSongBpmClient(config) : null;
        WebResolutionTier web = config.scraperEnabled() ? WebResolutionTier.fromConfig(config) : null;
        BpmResolver resolver = new BpmResolver(cache, api, web);
        logger.info("BPM resolver initialized: {}", resolver.status());
        return resolver;
    }

    public PipelineStatus status() {
        return new PipelineStatus(cache != null, apiClient != null, webTier != null,
            webTier != null && webTier.hasRenderedSearch());
    }

    /**
     * Resolves the BPM of a track.
     * @param artist Artist name
     * @param title Song title
     * @return plausible BPM, or empty when every enabled tier missed
     * @throws IllegalArgumentException if artist or title is null or blank
     */
    public OptionalDouble resolveBpm(String artist, String title) {
        return resolve(artist, title)
            .map(r -> OptionalDouble.of(r.bpm()))
            .orElse(OptionalDouble.empty());
    }

    /**
     * Same waterfall as {@link #resolveBpm}, returning the producing tier and its metadata as well.
     */
    public Optional<ResolutionResult> resolve(String artist, String title) {
        TrackQuery query = new TrackQuery(artist, title);
        NormalizedKey key = TrackNormalizer.normalize(query);

        if (cache != null) {
            Optional<BpmRecord> cached = guarded("cache", () -> cache.get(key));
            if (cached.isPresent()) {
                logger.info("BPM found in cache for {} - {}: {}", artist, title, cached.get().bpm());
                return Optional.of(new ResolutionResult(cached.get().bpm(), BpmSource.CACHE, cached.get().metadata()));
            }
        }

        if (apiClient != null) {
            Optional<ResolutionResult> fromApi = guarded("api", () -> apiClient.search(query.artist(), query.title()));
            if (fromApi.isPresent()) {
                logger.info("BPM found via API for {} - {}: {}", artist, title, fromApi.get().bpm());
                return Optional.of(writeBack(key, fromApi.get()));
            }
        }

        if (webTier != null) {
            Optional<ResolutionResult> fromWeb = guarded("web", () -> webTier.resolve(query));
            if (fromWeb.isPresent()) {
                logger.info("BPM found via web resolution for {} - {}: {}", artist, title, fromWeb.get().bpm());
                return Optional.of(writeBack(key, fromWeb.get()));
            }
        }

        logger.warn("Could not find BPM for {} - {}", artist, title);
        return Optional.empty();
    }

    /**
     * Stores an operator-supplied BPM, tagged {@link BpmSource#MANUAL}.
     * @return true if the cache accepted the write; false when the cache tier is disabled or failed
     * @throws IllegalArgumentException for a blank artist/title or a non-positive BPM
     */
    public boolean remember(String artist, String title, double bpm) {
        TrackQuery query = new TrackQuery(artist, title);
        if (!(bpm > 0) || Double.isInfinite(bpm)) {
            throw new IllegalArgumentException("BPM must be a positive number: " + bpm);
        }
        if (cache == null) {
            logger.warn("Cache tier disabled; cannot store manual BPM for {} - {}", artist, title);
            return false;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", BpmSource.MANUAL.dbValue());
        metadata.put("original_artist", query.artist());
        metadata.put("original_title", query.title());
        return guardedBoolean(() -> cache.put(TrackNormalizer.normalize(query), bpm, BpmSource.MANUAL, metadata));
    }

    /**
     * Removes the cached BPM of one track.
     * @return true if an entry was removed
     */
    public boolean forget(String artist, String title) {
        NormalizedKey key = TrackNormalizer.normalize(new TrackQuery(artist, title));
        if (cache == null) return false;
        return guardedBoolean(() -> cache.delete(key));
    }

    /**
     * Cached records whose artist contains the fragment; empty when the cache tier is disabled.
     */
    public List<BpmRecord> cachedForArtist(String artistFragment) {
        if (cache == null) return List.of();
        try {
            return cache.findByArtist(artistFragment);
        } catch (RuntimeException e) {
            logger.error("Cache search failed: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Removes every cached record.
     * @return number of removed records, or -1 when the cache tier is disabled or failed
     */
    public int clearCache() {
        if (cache == null) return -1;
        try {
            return cache.clear();
        } catch (RuntimeException e) {
            logger.error("Cache clear failed: {}", e.getMessage());
            return -1;
        }
    }

    /**
     * Resolves the track currently reported by a now-playing source and hands its BPM to a consumer.
     * @return true if a BPM was delivered; false when nothing is playing or no BPM was found
     */
    public boolean syncToNowPlaying(NowPlayingSource source, TempoConsumer consumer) {
        Optional<NowPlayingTrack> track;
        try {
            track = source.currentTrack();
        } catch (RuntimeException e) {
            logger.warn("Now-playing source failed: {}", e.getMessage());
            return false;
        }
        if (track.isEmpty() || isBlank(track.get().artist()) || isBlank(track.get().title())) {
            logger.info("No track currently playing");
            return false;
        }
        logger.info("Now playing: {} - {}", track.get().artist(), track.get().title());
        OptionalDouble bpm = resolveBpm(track.get().artist(), track.get().title());
        if (bpm.isEmpty()) return false;
        consumer.setBpm(bpm.getAsDouble());
        logger.info("Synced tempo consumer to {} BPM", bpm.getAsDouble());
        return true;
    }

    private ResolutionResult writeBack(NormalizedKey key, ResolutionResult result) {
        if (cache != null) {
            boolean stored = guardedBoolean(() -> cache.put(key, result.bpm(), result.source(), result.rawMetadata()));
            if (!stored) {
                logger.warn("Could not cache BPM for {} - {}", key.artistNorm(), key.titleNorm());
            }
        }
        return result;
    }

    private <T> Optional<T> guarded(String tier, Supplier<Optional<T>> call) {
        try {
            Optional<T> result = call.get();
            return result == null ? Optional.empty() : result;
        } catch (RuntimeException e) {
            logger.error("Tier {} failed: {}", tier, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean guardedBoolean(Supplier<Boolean> call) {
        try {
            return Boolean.TRUE.equals(call.get());
        } catch (RuntimeException e) {
            logger.error("Cache write failed: {}", e.getMessage());
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
