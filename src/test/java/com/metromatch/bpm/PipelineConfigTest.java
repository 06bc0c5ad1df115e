package com.metromatch.bpm;

import com.metromatch.bpm.web.WebResolutionTier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("SCRAPER_MAX_CATALOG_PAGES");
        System.clearProperty("SCRAPER_RATE_LIMIT");
        System.clearProperty("SONGBPM_BASE_URL");
        System.clearProperty("SCRAPER_TIMEOUT_SECONDS");
        System.clearProperty("BROWSER_TIMEOUT_SECONDS");
    }

    @Test
    void testBuilderDefaults() {
        PipelineConfig config = PipelineConfig.builder().build();
        assertFalse(config.cacheConfigured());
        assertFalse(config.apiConfigured());
        assertTrue(config.scraperEnabled());
        assertEquals(PipelineConfig.DEFAULT_SITE_BASE_URL, config.siteBaseUrl());
        assertEquals(15, config.maxCatalogPages());
        assertEquals(Duration.ZERO, config.scraperRequestInterval());
    }

    @Test
    void testTrailingSlashIsStripped() {
        PipelineConfig config = PipelineConfig.builder()
            .siteBaseUrl("http://localhost:8080/")
            .apiBaseUrl("http://localhost:9090/")
            .apiKey("key")
            .dbUrl("jdbc:postgresql://localhost/bpm")
            .build();
        assertEquals("http://localhost:8080", config.siteBaseUrl());
        assertEquals("http://localhost:9090", config.apiBaseUrl());
        assertTrue(config.apiConfigured());
        assertTrue(config.cacheConfigured());
    }

    @Test
    void testInvalidPageBoundIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.builder().maxCatalogPages(0).build());
    }

    @Test
    void testSystemPropertiesAreRead() {
        System.setProperty("SCRAPER_MAX_CATALOG_PAGES", "4");
        System.setProperty("SCRAPER_RATE_LIMIT", "0.25");
        System.setProperty("SONGBPM_BASE_URL", "http://localhost:1234/");
        PipelineConfig config = PipelineConfig.fromEnvironment();
        assertEquals(4, config.maxCatalogPages());
        assertEquals(Duration.ofMillis(250), config.scraperRequestInterval());
        assertEquals("http://localhost:1234", config.siteBaseUrl());
    }

    @Test
    void testMalformedNumberFallsBackToDefault() {
        System.setProperty("SCRAPER_MAX_CATALOG_PAGES", "lots");
        assertEquals(15, PipelineConfig.fromEnvironment().maxCatalogPages());
    }

    @Test
    void testNonPositiveTimeoutsAreRaisedToMinimum() {
        System.setProperty("SCRAPER_TIMEOUT_SECONDS", "0");
        System.setProperty("BROWSER_TIMEOUT_SECONDS", "-5");
        PipelineConfig config = PipelineConfig.fromEnvironment();
        assertEquals(PipelineConfig.MIN_TIMEOUT, config.webTimeout());
        assertEquals(PipelineConfig.MIN_TIMEOUT, config.browserTimeout());
        assertDoesNotThrow(() -> WebResolutionTier.fromConfig(PipelineConfig.builder()
            .webTimeout(Duration.ZERO).browserSearchEnabled(false).build()));
    }
}
