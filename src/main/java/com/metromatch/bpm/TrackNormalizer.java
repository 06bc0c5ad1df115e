package com.metromatch.bpm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonicalizes (artist, title) pairs into cache keys and derives the URL slugs used by the web tier.
 * <p>
 * Slug rules:
 * <ul>
 *   <li>Lower-cased with {@link Locale#ROOT}; whitespace runs become a single dash.</li>
 *   <li>Characters outside {@code [a-z0-9-]} are dropped, not transliterated ("Café" becomes "caf").</li>
 *   <li>Dash runs collapse to one dash; leading and trailing dashes are trimmed.</li>
 * </ul>
 * Titles carrying a parenthesised featured-artist credit ("Work (feat. Rihanna)") yield several
 * {@linkplain #slugVariants(String, String) variants} because the site is inconsistent about how it
 * renders the credit.
 * <p>
 * All methods are pure and total for non-null input.
 *
 * @author MetroMatch Team
 * @since 1.0
 */
public final class TrackNormalizer {

    private static final Pattern FEATURE_CLAUSE = Pattern.compile(
        "\\s*[(\\[]\\s*(?:featuring|feat\\.|feat\\b|ft\\.|ft\\b)\\s*([^)\\]]*)[)\\]]",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9-]");
    private static final Pattern DASH_RUN = Pattern.compile("-{2,}");

    private TrackNormalizer() {}

    /**
     * Builds the cache key: lower-case, trimmed, inner whitespace collapsed to one space.
     */
    public static NormalizedKey normalize(String artist, String title) {
        return new NormalizedKey(normalizeText(artist), normalizeText(title));
    }

    public static NormalizedKey normalize(TrackQuery query) {
        return normalize(query.artist(), query.title());
    }

    static String normalizeText(String value) {
        if (value == null) return "";
        return WHITESPACE.matcher(value.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    /**
     * Slug of an arbitrary name, e.g. {@code "Daft Punk"} becomes {@code "daft-punk"}.
     */
    public static String slugify(String value) {
        if (value == null) return "";
        String slug = WHITESPACE.matcher(value.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = NON_SLUG.matcher(slug).replaceAll("");
        slug = DASH_RUN.matcher(slug).replaceAll("-");
        return trimDashes(slug);
    }

    public static String artistSlug(String artist) {
        return slugify(artist);
    }

    /**
     * Slug of the title with any featured-artist clause removed.
     */
    public static String plainTitleSlug(String title) {
        return slugify(stripFeatureClause(title));
    }

    /**
     * Removes a parenthesised or bracketed "feat." / "ft." / "featuring" credit from a title.
     */
    public static String stripFeatureClause(String title) {
        if (title == null) return "";
        return FEATURE_CLAUSE.matcher(title).replaceAll("").trim();
    }

    /**
     * Ordered slug variants tried by the slug-variant retry:
     * <ol>
     *   <li>period-joined: {@code work-feat--rihanna} (the period of "feat." rendered as a dash)</li>
     *   <li>double-dash-joined: {@code work--feat-rihanna} (the opening parenthesis rendered as a dash)</li>
     *   <li>single-dash-joined: {@code work-feat-rihanna}</li>
     *   <li>plain: {@code work}</li>
     * </ol>
     * Without a featured credit all four entries equal the plain slug; callers skip URLs they already fetched.
     *
     * @param artist artist name, unused by the title variants but kept for call-site symmetry with URL building
     * @param title raw title
     * @return four slugs in the order above
     */
    public static List<String> slugVariants(String artist, String title) {
        String plain = plainTitleSlug(title);
        String featured = featuredSlug(title);
        List<String> variants = new ArrayList<>(4);
        if (featured.isEmpty()) {
            for (int i = 0; i < 4; i++) variants.add(plain);
            return variants;
        }
        variants.add(plain + "-feat--" + featured);
        variants.add(plain + "--feat-" + featured);
        variants.add(plain + "-feat-" + featured);
        variants.add(plain);
        return variants;
    }

    /**
     * Slug of the featured artist(s), or empty when the title has no credit.
     */
    static String featuredSlug(String title) {
        if (title == null) return "";
        Matcher m = FEATURE_CLAUSE.matcher(title);
        return m.find() ? slugify(m.group(1)) : "";
    }

    /**
     * Dash-delimited tokens of a slug, empty tokens removed.
     */
    public static List<String> slugTokens(String slug) {
        if (slug == null || slug.isBlank()) return List.of();
        return Arrays.stream(slug.split("-"))
            .filter(t -> !t.isEmpty())
            .collect(Collectors.toList());
    }

    /**
     * Title words long enough to count as evidence in candidate scoring (length greater than 2).
     */
    public static List<String> significantWords(String plainSlug) {
        return slugTokens(plainSlug).stream()
            .filter(w -> w.length() > 2)
            .collect(Collectors.toList());
    }

    private static String trimDashes(String slug) {
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') start++;
        while (end > start && slug.charAt(end - 1) == '-') end--;
        return slug.substring(start, end);
    }
}
