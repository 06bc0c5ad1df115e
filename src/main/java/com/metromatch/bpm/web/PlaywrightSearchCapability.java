package com.metromatch.bpm.web;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitForSelectorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@link RenderedSearchCapability} driven by Playwright and headless Chromium.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Launch a browser and a page scoped to this single call; both are closed on every exit path.</li>
 *   <li>Open the home page and wait for the search input; when it never becomes visible, fall back to the
 *   site's {@code /search?q=} endpoint.</li>
 *   <li>After submitting, wait for the browser to leave the home page, then for a result link shaped like
 *   {@code /@artist/song}; follow the first one and return the rendered HTML with the navigation status.</li>
 * </ul>
 * Timeouts and Playwright failures (including missing browser binaries) are logged and reported as empty.
 *
 * @author MetroMatch Team
 * @since 1.0
 */
public class PlaywrightSearchCapability implements RenderedSearchCapability {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightSearchCapability.class);

    private static final String SEARCH_INPUT = "input[type='search'], input[name='q'], input[placeholder*='Search'], input[placeholder*='search']";
    private static final String ARTIST_LINKS = "a[href*='/@']";
    private static final Pattern SONG_LINK = Pattern.compile("^(?:https?://[^/]+)?/@[^/?#]+/[^/?#]+/?(?:[?#].*)?$");
    private static final String SONG_LINK_PRESENT =
        "() => Array.from(document.querySelectorAll(\"a[href*='/@']\"))"
            + ".some(a => /^\\/@[^\\/?#]+\\/[^\\/?#]+\\/?$/.test(new URL(a.href, location.href).pathname))";

    private final SongPageUrls urls;
    private final double timeoutMs;

    public PlaywrightSearchCapability(SongPageUrls urls, Duration timeout) {
        this.urls = urls;
        this.timeoutMs = timeout.toMillis();
    }

    /**
     * True when the Playwright driver classes are on the classpath.
     */
    public static boolean isSupported() {
        try {
            Class.forName("com.microsoft.playwright.Playwright", false, PlaywrightSearchCapability.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            logger.info("Playwright not available; rendered search disabled: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<FetchedPage> renderFirstResult(String query) {
        if (query == null || query.isBlank()) return Optional.empty();
        logger.debug("Rendered search for '{}'", query);
        try (Playwright playwright = Playwright.create()) {
            Browser browser = playwright.chromium().launch(getDefaultLaunchOptions());
            try {
                Page page = browser.newPage();
                try {
                    page.setDefaultTimeout(timeoutMs);
                    page.setDefaultNavigationTimeout(timeoutMs);
                    submitSearch(page, query);
                    String href = waitForFirstSongLink(page);
                    if (href == null) {
                        logger.info("Rendered search for '{}' returned no song link", query);
                        return Optional.empty();
                    }
                    Response response = page.navigate(urls.toAbsolute(href));
                    int status = response == null ? 200 : response.status();
                    if (status < 200 || status >= 300) {
                        logger.info("Rendered search result {} answered {}", href, status);
                        return Optional.of(new FetchedPage(page.url(), status, ""));
                    }
                    waitForNetworkIdle(page);
                    return Optional.of(new FetchedPage(page.url(), status, page.content()));
                } finally {
                    page.close();
                }
            } finally {
                browser.close();
            }
        } catch (PlaywrightException e) {
            logger.warn("Rendered search for '{}' failed: {}", query, e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Playwright initialization error: {}", e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Submits the query through the search box and waits until the browser has left the home page. When the box
     * never becomes interactive or the submission does not navigate, the search endpoint is opened instead.
     */
    private void submitSearch(Page page, String query) {
        page.navigate(urls.baseUrl());
        String homeUrl = page.url();
        Locator input = page.locator(SEARCH_INPUT).first();
        try {
            input.waitFor(new Locator.WaitForOptions().setState(WaitForSelectorState.VISIBLE).setTimeout(timeoutMs));
            input.fill(query);
            input.press("Enter");
            page.waitForURL(url -> !url.equals(homeUrl), new Page.WaitForURLOptions().setTimeout(timeoutMs));
            logger.debug("Submitted '{}' through the search box", query);
        } catch (PlaywrightException e) {
            logger.debug("Search box submission did not navigate ({}); using search endpoint", e.getMessage());
            page.navigate(urls.searchUrl(query));
        }
    }

    /**
     * Waits until the results page holds a link shaped like a song page, then returns the first such link.
     */
    private String waitForFirstSongLink(Page page) {
        try {
            page.waitForFunction(SONG_LINK_PRESENT, null, new Page.WaitForFunctionOptions().setTimeout(timeoutMs));
        } catch (PlaywrightException e) {
            logger.debug("No song links appeared: {}", e.getMessage());
            return null;
        }
        Locator links = page.locator(ARTIST_LINKS);
        List<String> hrefs = new ArrayList<>();
        int count = links.count();
        for (int i = 0; i < count; i++) {
            hrefs.add(links.nth(i).getAttribute("href"));
        }
        return firstSongLink(hrefs);
    }

    /**
     * First href shaped like {@code /@artist/song}; artist roots and other links are skipped.
     */
    static String firstSongLink(List<String> hrefs) {
        for (String href : hrefs) {
            if (href != null && SONG_LINK.matcher(href.trim()).matches()) return href.trim();
        }
        return null;
    }

    private void waitForNetworkIdle(Page page) {
        try {
            page.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(timeoutMs));
        } catch (PlaywrightException e) {
            logger.debug("Song page did not reach network idle: {}", e.getMessage());
        }
    }

    private BrowserType.LaunchOptions getDefaultLaunchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions();
        options.setHeadless(true);
        options.setTimeout(timeoutMs);
        options.setArgs(Arrays.asList(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--lang=en-US"
        ));
        return options;
    }
}
