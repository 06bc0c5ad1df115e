package com.metromatch.bpm.web;

import com.metromatch.bpm.RequestPacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * {@link PageFetcher} over {@link HttpClient}, paced to at most one request per configured interval.
 * Timeouts, DNS failures and malformed URLs are logged and reported as empty.
 */
public class HttpPageFetcher implements PageFetcher {
    private static final Logger logger = LoggerFactory.getLogger(HttpPageFetcher.class);
    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

    private final HttpClient client;
    private final Duration timeout;
    private final RequestPacer pacer;

    public HttpPageFetcher(Duration timeout, Duration minRequestInterval) {
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        this.pacer = new RequestPacer(minRequestInterval);
    }

    @Override
    public Optional<FetchedPage> fetch(String url) {
        if (url == null || url.isBlank()) {
            logger.warn("fetch called with blank URL.");
            return Optional.empty();
        }
        if (!pacer.awaitTurn()) {
            logger.warn("Interrupted while pacing request to {}", url);
            return Optional.empty();
        }
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "text/html,application/xhtml+xml")
                .GET()
                .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            logger.debug("GET {} -> {}", url, response.statusCode());
            return Optional.of(new FetchedPage(response.uri().toString(), response.statusCode(), response.body()));
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Request to {} failed: {}", url, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Request to {} interrupted", url);
        }
        return Optional.empty();
    }
}
