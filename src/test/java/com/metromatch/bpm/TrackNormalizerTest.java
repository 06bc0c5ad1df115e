package com.metromatch.bpm;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TrackNormalizerTest {

    @Test
    void testNormalizeIgnoresCaseAndWhitespace() {
        assertEquals(TrackNormalizer.normalize("daft punk", "get lucky"),
            TrackNormalizer.normalize("Daft Punk", " Get Lucky "));
        assertEquals(new NormalizedKey("daft punk", "get lucky"),
            TrackNormalizer.normalize("  DAFT   Punk", "Get\tLucky"));
    }

    @Test
    void testNormalizeIsIdempotent() {
        NormalizedKey once = TrackNormalizer.normalize("  The  Weeknd ", "Blinding LIGHTS");
        NormalizedKey twice = TrackNormalizer.normalize(once.artistNorm(), once.titleNorm());
        assertEquals(once, twice);
    }

    @ParameterizedTest
    @CsvSource({
        "Daft Punk, daft-punk",
        "'  Get   Lucky ', get-lucky",
        "AC/DC, acdc",
        "Guns N' Roses, guns-n-roses",
        "Café del Mar, caf-del-mar",
        "'- Odd -- Dashes -', odd-dashes"
    })
    void testSlugify(String input, String expected) {
        assertEquals(expected, TrackNormalizer.slugify(input));
    }

    @Test
    void testStripFeatureClause() {
        assertEquals("Work", TrackNormalizer.stripFeatureClause("Work (feat. Rihanna)"));
        assertEquals("Stay", TrackNormalizer.stripFeatureClause("Stay [ft. Justin Bieber]"));
        assertEquals("Lose Yourself", TrackNormalizer.stripFeatureClause("Lose Yourself"));
        assertEquals("work", TrackNormalizer.plainTitleSlug("Work (Featuring Drake)"));
        assertEquals("work", TrackNormalizer.plainTitleSlug("Work (feat.Drake)"));
        assertEquals("Feature Film (Live)", TrackNormalizer.stripFeatureClause("Feature Film (Live)"));
        assertEquals("Shift (feature edit)", TrackNormalizer.stripFeatureClause("Shift (feature edit)"));
    }

    @Test
    void testSlugVariantsForFeaturedTitle() {
        List<String> variants = TrackNormalizer.slugVariants("Rihanna", "Work (feat. Drake)");
        assertEquals(List.of("work-feat--drake", "work--feat-drake", "work-feat-drake", "work"), variants);
    }

    @Test
    void testSlugVariantsWithoutSpaceAfterFeat() {
        assertEquals(List.of("work-feat--drake", "work--feat-drake", "work-feat-drake", "work"),
            TrackNormalizer.slugVariants("Rihanna", "Work (feat.Drake)"));
    }

    @Test
    void testSlugVariantsWithoutFeatureAreAllPlain() {
        List<String> variants = TrackNormalizer.slugVariants("Daft Punk", "Get Lucky");
        assertEquals(4, variants.size());
        assertTrue(variants.stream().allMatch("get-lucky"::equals));
    }

    @Test
    void testSignificantWordsSkipShortTokens() {
        assertEquals(List.of("all", "you", "need", "love"), TrackNormalizer.significantWords("all-you-need-is-love"));
        assertEquals(List.of(), TrackNormalizer.significantWords(""));
    }

    @Test
    void testTrackQueryRejectsBlankInput() {
        assertThrows(IllegalArgumentException.class, () -> new TrackQuery("", "Title"));
        assertThrows(IllegalArgumentException.class, () -> new TrackQuery("Artist", "   "));
        assertThrows(IllegalArgumentException.class, () -> new TrackQuery(null, "Title"));
        assertEquals("Daft Punk Get Lucky", new TrackQuery("Daft Punk", "Get Lucky").combined());
    }
}
