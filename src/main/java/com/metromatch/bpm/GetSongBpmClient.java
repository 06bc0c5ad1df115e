package com.metromatch.bpm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the GetSongBPM API.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Phase 1: {@code GET /search/?type=both&lookup=song:<title> artist:<artist>}. The {@code search} member is
 *   either a list of match stubs (the first stub's {@code id} is used) or an object carrying {@code error}
 *   ("no result"), which counts as an empty list. Any other shape is treated as absent.</li>
 *   <li>Phase 2: {@code GET /song/?id=<id>} and read {@code song.tempo}, a number or numeric string.</li>
 *   <li>A missing, non-numeric or implausible tempo yields absent.</li>
 * </ul>
 * <p>
 * Error Handling: timeouts, non-2xx statuses and malformed JSON are caught here and logged; nothing propagates.
 *
 * @author MetroMatch Team
 * @since 1.0
 */
public class GetSongBpmClient implements TempoApiClientInterface {
    private static final Logger logger = LoggerFactory.getLogger(GetSongBpmClient.class);

    private final String apiKey;
    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient client;
    private final RequestPacer pacer;
    private final ObjectMapper mapper = new ObjectMapper();

    public GetSongBpmClient(String apiKey, String baseUrl, Duration timeout, Duration minRequestInterval) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        this.pacer = new RequestPacer(minRequestInterval);
    }

    public GetSongBpmClient(PipelineConfig config) {
        this(config.apiKey(), config.apiBaseUrl(), config.apiTimeout(), config.apiRequestInterval());
    }

    @Override
    public Optional<ResolutionResult> search(String artist, String title) {
        if (artist == null || artist.isBlank() || title == null || title.isBlank()) {
            logger.warn("API search called with blank artist or title: artist={}, title={}", artist, title);
            return Optional.empty();
        }
        String lookup = "song:" + title.toLowerCase(Locale.ROOT) + " artist:" + artist.toLowerCase(Locale.ROOT);
        String url = baseUrl + "/search/?api_key=" + encode(apiKey) + "&type=both&lookup=" + encode(lookup);
        JsonNode root = getJson(url, "search");
        if (root == null) return Optional.empty();

        JsonNode results = root.path("search");
        if (results.isObject()) {
            if (results.has("error")) {
                logger.info("API has no result for {} - {}: {}", artist, title, results.path("error").asText());
            } else {
                logger.warn("Unexpected search payload shape for {} - {}", artist, title);
            }
            return Optional.empty();
        }
        if (!results.isArray()) {
            logger.warn("Unexpected search payload shape for {} - {}", artist, title);
            return Optional.empty();
        }
        if (results.size() == 0) {
            logger.info("API has no result for {} - {}", artist, title);
            return Optional.empty();
        }
        String songId = results.get(0).path("id").asText("");
        if (songId.isBlank()) {
            logger.warn("No song id in first search result for {} - {}", artist, title);
            return Optional.empty();
        }
        logger.debug("Found song id {} for {} - {}", songId, artist, title);
        return getById(songId);
    }

    /**
     * Fetches full song details by GetSongBPM identifier and parses the tempo.
     * @param songId identifier from a search stub
     * @return API-sourced result, or empty when the record has no usable tempo
     */
    public Optional<ResolutionResult> getById(String songId) {
        String url = baseUrl + "/song/?api_key=" + encode(apiKey) + "&id=" + encode(songId);
        JsonNode root = getJson(url, "song");
        if (root == null) return Optional.empty();
        JsonNode song = root.path("song");
        if (!song.isObject()) {
            logger.warn("No song data for id {}", songId);
            return Optional.empty();
        }
        Double tempo = readTempo(song.path("tempo"));
        if (tempo == null) {
            logger.warn("Missing or non-numeric tempo for song id {}", songId);
            return Optional.empty();
        }
        if (!BpmExtractor.isPlausible(tempo)) {
            logger.warn("Discarding implausible API tempo {} for song id {}", tempo, songId);
            return Optional.empty();
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("id", songId);
        metadata.put("artist", textOrNull(song.path("artist").path("name")));
        metadata.put("title", textOrNull(song.path("song_title")));
        metadata.put("provider", "getsongbpm");
        return Optional.of(new ResolutionResult(tempo, BpmSource.API, metadata));
    }

    private JsonNode getJson(String url, String phase) {
        if (!pacer.awaitTurn()) {
            logger.warn("Interrupted while pacing API {} request", phase);
            return null;
        }
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("User-Agent", "MetroMatch/1.0")
                .GET()
                .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            logger.debug("API {} response status: {}", phase, response.statusCode());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                logger.warn("API {} request failed with status {}", phase, response.statusCode());
                return null;
            }
            String body = response.body();
            if (body == null || body.isBlank()) {
                logger.warn("Empty API {} response", phase);
                return null;
            }
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            logger.warn("Invalid JSON in API {} response: {}", phase, e.getMessage());
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("API {} request failed: {}", phase, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("API {} request interrupted", phase);
        }
        return null;
    }

    private static Double readTempo(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return null;
        if (node.isNumber()) return node.asDouble();
        if (node.isTextual()) return Utils.parseDoubleOrNull(node.asText());
        return null;
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
