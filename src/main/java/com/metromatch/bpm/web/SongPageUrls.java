package com.metromatch.bpm.web;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * URL shapes of the public site.
 * <ul>
 *   <li>song page: {@code /@{artist-slug}/{song-slug}}</li>
 *   <li>catalog listing: {@code /@{artist-slug}}, later pages {@code /@{artist-slug}?after=token}</li>
 *   <li>search: {@code /search?q=free text}</li>
 * </ul>
 */
public class SongPageUrls {
    private final String baseUrl;

    public SongPageUrls(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String songUrl(String artistSlug, String songSlug) {
        return baseUrl + "/@" + artistSlug + "/" + songSlug;
    }

    public String catalogUrl(String artistSlug) {
        return baseUrl + "/@" + artistSlug;
    }

    public String searchUrl(String query) {
        return baseUrl + "/search?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8);
    }

    /**
     * Makes a site-relative href absolute; absolute hrefs are returned unchanged.
     */
    public String toAbsolute(String href) {
        if (href == null) return null;
        if (href.startsWith("http://") || href.startsWith("https://")) return href;
        if (href.startsWith("/")) return baseUrl + href;
        return baseUrl + "/" + href;
    }

    /**
     * Song slug of a link into the artist's namespace, e.g. {@code /@daft-punk/get-lucky} gives {@code get-lucky}.
     * Empty for the artist root, links to other artists and anything that isn't a song page.
     */
    public static Optional<String> songSlugOf(String href, String artistSlug) {
        String path = pathOf(href);
        if (path == null) return Optional.empty();
        String prefix = "/@" + artistSlug.toLowerCase(Locale.ROOT) + "/";
        String lower = path.toLowerCase(Locale.ROOT);
        if (!lower.startsWith(prefix)) return Optional.empty();
        String rest = lower.substring(prefix.length());
        if (rest.endsWith("/")) rest = rest.substring(0, rest.length() - 1);
        if (rest.isEmpty() || rest.contains("/")) return Optional.empty();
        return Optional.of(rest);
    }

    /**
     * True for a link to a later catalog page of the artist: the artist root carrying an {@code after} parameter.
     */
    public static boolean isNextPageLink(String href, String artistSlug) {
        String path = pathOf(href);
        String query = queryOf(href);
        if (path == null || query == null) return false;
        String root = "/@" + artistSlug.toLowerCase(Locale.ROOT);
        String lower = path.toLowerCase(Locale.ROOT);
        if (!lower.equals(root) && !lower.equals(root + "/")) return false;
        for (String param : query.split("&")) {
            if (param.startsWith("after=") && param.length() > "after=".length()) return true;
        }
        return false;
    }

    /**
     * Site-relative path plus query, used as the identity of a link regardless of how it was written.
     */
    public static String pathAndQuery(String href) {
        String path = pathOf(href);
        if (path == null) return href;
        String query = queryOf(href);
        return query == null ? path : path + "?" + query;
    }

    /**
     * Song-page links carry no query or fragment in their identity.
     */
    public static String songPath(String href) {
        String path = pathOf(href);
        return path == null ? href : path;
    }

    private static String pathOf(String href) {
        URI uri = parse(href);
        return uri == null ? null : uri.getRawPath();
    }

    private static String queryOf(String href) {
        URI uri = parse(href);
        return uri == null ? null : uri.getRawQuery();
    }

    private static URI parse(String href) {
        if (href == null || href.isBlank()) return null;
        try {
            return new URI(href.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
