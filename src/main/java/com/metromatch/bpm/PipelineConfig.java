package com.metromatch.bpm;

import java.time.Duration;

/**
 * Immutable configuration of the resolution pipeline. Each tier is present or absent based on these values
 * alone: no DB URL disables the cache, no API key disables the API tier, {@code scraperEnabled=false}
 * disables the web tier.
 * <p>
 * {@link #fromEnvironment()} reads every key from the environment, then from a system property of the same
 * name, then falls back to the defaults of {@link #builder()}.
 *
 * @author MetroMatch Team
 * @since 1.0
 */
public record PipelineConfig(
    String dbUrl,
    String dbUser,
    String dbPassword,
    String apiKey,
    String apiBaseUrl,
    boolean scraperEnabled,
    boolean browserSearchEnabled,
    String siteBaseUrl,
    int maxCatalogPages,
    Duration apiTimeout,
    Duration webTimeout,
    Duration browserTimeout,
    Duration apiRequestInterval,
    Duration scraperRequestInterval
) {
    public static final String DEFAULT_API_BASE_URL = "https://api.getsongbpm.com";
    public static final String DEFAULT_SITE_BASE_URL = "https://songbpm.com";
    public static final int DEFAULT_MAX_CATALOG_PAGES = 15;
    public static final Duration MIN_TIMEOUT = Duration.ofSeconds(1);

    public PipelineConfig {
        if (maxCatalogPages < 1) {
            throw new IllegalArgumentException("maxCatalogPages must be at least 1");
        }
        apiBaseUrl = stripTrailingSlash(apiBaseUrl == null || apiBaseUrl.isBlank() ? DEFAULT_API_BASE_URL : apiBaseUrl);
        siteBaseUrl = stripTrailingSlash(siteBaseUrl == null || siteBaseUrl.isBlank() ? DEFAULT_SITE_BASE_URL : siteBaseUrl);
        apiTimeout = positiveTimeout(apiTimeout, Duration.ofSeconds(10));
        webTimeout = positiveTimeout(webTimeout, Duration.ofSeconds(10));
        browserTimeout = positiveTimeout(browserTimeout, Duration.ofSeconds(15));
        apiRequestInterval = apiRequestInterval == null ? Duration.ZERO : apiRequestInterval;
        scraperRequestInterval = scraperRequestInterval == null ? Duration.ZERO : scraperRequestInterval;
    }

    public boolean cacheConfigured() {
        return dbUrl != null && !dbUrl.isBlank();
    }

    public boolean apiConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code DB_URL}, {@code DB_USER}, {@code DB_PASS}, {@code GETSONGBPM_API_KEY}, {@code GETSONGBPM_BASE_URL},
     * {@code USE_SCRAPER}, {@code USE_BROWSER_SEARCH}, {@code SONGBPM_BASE_URL}, {@code SCRAPER_MAX_CATALOG_PAGES},
     * {@code API_TIMEOUT_SECONDS}, {@code SCRAPER_TIMEOUT_SECONDS}, {@code BROWSER_TIMEOUT_SECONDS},
     * {@code API_RATE_LIMIT} and {@code SCRAPER_RATE_LIMIT}.
     */
    public static PipelineConfig fromEnvironment() {
        return builder()
            .dbUrl(Utils.envOrProp("DB_URL", ""))
            .dbUser(Utils.envOrProp("DB_USER", "postgres"))
            .dbPassword(Utils.envOrProp("DB_PASS", ""))
            .apiKey(Utils.envOrProp("GETSONGBPM_API_KEY", ""))
            .apiBaseUrl(Utils.envOrProp("GETSONGBPM_BASE_URL", DEFAULT_API_BASE_URL))
            .scraperEnabled(Utils.envOrPropBoolean("USE_SCRAPER", true))
            .browserSearchEnabled(Utils.envOrPropBoolean("USE_BROWSER_SEARCH", true))
            .siteBaseUrl(Utils.envOrProp("SONGBPM_BASE_URL", DEFAULT_SITE_BASE_URL))
            .maxCatalogPages(Math.max(1, Utils.envOrPropInt("SCRAPER_MAX_CATALOG_PAGES", DEFAULT_MAX_CATALOG_PAGES)))
            .apiTimeout(Duration.ofSeconds(Utils.envOrPropInt("API_TIMEOUT_SECONDS", 10)))
            .webTimeout(Duration.ofSeconds(Utils.envOrPropInt("SCRAPER_TIMEOUT_SECONDS", 10)))
            .browserTimeout(Duration.ofSeconds(Utils.envOrPropInt("BROWSER_TIMEOUT_SECONDS", 15)))
            .apiRequestInterval(seconds(Utils.envOrPropDouble("API_RATE_LIMIT", 0.5)))
            .scraperRequestInterval(seconds(Utils.envOrPropDouble("SCRAPER_RATE_LIMIT", 1.5)))
            .build();
    }

    /**
     * Null falls back to the default; zero and negative values are raised to one second.
     */
    private static Duration positiveTimeout(Duration value, Duration defaultValue) {
        if (value == null) return defaultValue;
        return value.isZero() || value.isNegative() ? MIN_TIMEOUT : value;
    }

    private static Duration seconds(double value) {
        return value <= 0 ? Duration.ZERO : Duration.ofMillis(Math.round(value * 1000));
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static final class Builder {
        private String dbUrl = "";
        private String dbUser = "postgres";
        private String dbPassword = "";
        private String apiKey = "";
        private String apiBaseUrl = DEFAULT_API_BASE_URL;
        private boolean scraperEnabled = true;
        private boolean browserSearchEnabled = true;
        private String siteBaseUrl = DEFAULT_SITE_BASE_URL;
        private int maxCatalogPages = DEFAULT_MAX_CATALOG_PAGES;
        private Duration apiTimeout = Duration.ofSeconds(10);
        private Duration webTimeout = Duration.ofSeconds(10);
        private Duration browserTimeout = Duration.ofSeconds(15);
        private Duration apiRequestInterval = Duration.ZERO;
        private Duration scraperRequestInterval = Duration.ZERO;

        private Builder() {}

        public Builder dbUrl(String dbUrl) { this.dbUrl = dbUrl; return this; }
        public Builder dbUser(String dbUser) { this.dbUser = dbUser; return this; }
        public Builder dbPassword(String dbPassword) { this.dbPassword = dbPassword; return this; }
        public Builder apiKey(String apiKey) { this.apiKey = apiKey; return this; }
        public Builder apiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; return this; }
        public Builder scraperEnabled(boolean scraperEnabled) { this.scraperEnabled = scraperEnabled; return this; }
        public Builder browserSearchEnabled(boolean browserSearchEnabled) { this.browserSearchEnabled = browserSearchEnabled; return this; }
        public Builder siteBaseUrl(String siteBaseUrl) { this.siteBaseUrl = siteBaseUrl; return this; }
        public Builder maxCatalogPages(int maxCatalogPages) { this.maxCatalogPages = maxCatalogPages; return this; }
        public Builder apiTimeout(Duration apiTimeout) { this.apiTimeout = apiTimeout; return this; }
        public Builder webTimeout(Duration webTimeout) { this.webTimeout = webTimeout; return this; }
        public Builder browserTimeout(Duration browserTimeout) { this.browserTimeout = browserTimeout; return this; }
        public Builder apiRequestInterval(Duration apiRequestInterval) { this.apiRequestInterval = apiRequestInterval; return this; }
        public Builder scraperRequestInterval(Duration scraperRequestInterval) { this.scraperRequestInterval = scraperRequestInterval; return this; }

        public PipelineConfig build() {
            return new PipelineConfig(dbUrl, dbUser, dbPassword, apiKey, apiBaseUrl, scraperEnabled,
                browserSearchEnabled, siteBaseUrl, maxCatalogPages, apiTimeout, webTimeout, browserTimeout,
                apiRequestInterval, scraperRequestInterval);
        }
    }
}
