package com.metromatch.bpm;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a plausible tempo out of a song page.
 * <p>
 * Strategies, first success wins:
 * <ol>
 *   <li>Every {@code "<n> BPM"} in the visible text, filtered to the plausibility window. Two or more hits return
 *   the second one (the first is usually a genre or category average), one hit returns that hit.</li>
 *   <li>The first text node containing {@code BPM}: its parent's text, then the parent together with its next
 *   sibling element, then the grandparent, each searched for {@code "<n> BPM"} or {@code "BPM <n>"}.</li>
 *   <li>The first {@code [data-tempo], .tempo, #tempo} element: its first number, or its {@code data-tempo} value.</li>
 * </ol>
 * Values outside [{@value #MIN_BPM}, {@value #MAX_BPM}] are discarded, never clamped, and no default is guessed.
 *
 * @author MetroMatch Team
 * @since 1.0
 */
public final class BpmExtractor {
    private static final Logger logger = LoggerFactory.getLogger(BpmExtractor.class);

    public static final double MIN_BPM = 40.0;
    public static final double MAX_BPM = 240.0;

    private static final Pattern NUMBER_BPM = Pattern.compile("(?<![\\d.])(\\d+(?:\\.\\d+)?)\\s*BPM", Pattern.CASE_INSENSITIVE);
    private static final Pattern NEAR_BPM = Pattern.compile(
        "(?<![\\d.])(\\d+(?:\\.\\d+)?)\\s*BPM|BPM\\s*:?\\s*(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");
    private static final String TEMPO_SELECTOR = "[data-tempo], .tempo, #tempo";

    private BpmExtractor() {}

    public static boolean isPlausible(double bpm) {
        return bpm >= MIN_BPM && bpm <= MAX_BPM;
    }

    /**
     * Parses raw HTML and extracts a tempo.
     * @param pageContent HTML of a fetched or rendered page (may be null)
     * @return plausible BPM, or empty
     */
    public static OptionalDouble extractBpm(String pageContent) {
        if (pageContent == null || pageContent.isBlank()) return OptionalDouble.empty();
        return extractBpm(Jsoup.parse(pageContent));
    }

    public static OptionalDouble extractBpm(Document doc) {
        if (doc == null) return OptionalDouble.empty();
        Element body = doc.body();

        OptionalDouble fromText = fromVisibleText(body.text());
        if (fromText.isPresent()) {
            logger.debug("BPM {} found in page text", fromText.getAsDouble());
            return fromText;
        }
        OptionalDouble fromNeighborhood = fromBpmNeighborhood(body);
        if (fromNeighborhood.isPresent()) {
            logger.debug("BPM {} found next to a BPM label", fromNeighborhood.getAsDouble());
            return fromNeighborhood;
        }
        OptionalDouble fromTempo = fromTempoElement(body);
        if (fromTempo.isPresent()) {
            logger.debug("BPM {} found in tempo element", fromTempo.getAsDouble());
        }
        return fromTempo;
    }

    static OptionalDouble fromVisibleText(String text) {
        List<Double> plausible = new ArrayList<>();
        Matcher m = NUMBER_BPM.matcher(text);
        while (m.find()) {
            Double value = Utils.parseDoubleOrNull(m.group(1));
            if (value != null && isPlausible(value)) plausible.add(value);
        }
        if (plausible.isEmpty()) return OptionalDouble.empty();
        return OptionalDouble.of(plausible.size() > 1 ? plausible.get(1) : plausible.get(0));
    }

    static OptionalDouble fromBpmNeighborhood(Element body) {
        TextNode label = firstTextNodeContainingBpm(body);
        if (label == null) return OptionalDouble.empty();
        Node parentNode = label.parent();
        if (!(parentNode instanceof Element parent)) return OptionalDouble.empty();

        List<String> neighborhoods = new ArrayList<>();
        neighborhoods.add(parent.text());
        Element next = parent.nextElementSibling();
        if (next != null) neighborhoods.add(parent.text() + " " + next.text());
        Element grandparent = parent.parent();
        if (grandparent != null) neighborhoods.add(grandparent.text());

        for (String text : neighborhoods) {
            Matcher m = NEAR_BPM.matcher(text);
            while (m.find()) {
                Double value = Utils.parseDoubleOrNull(m.group(1) != null ? m.group(1) : m.group(2));
                if (value != null && isPlausible(value)) return OptionalDouble.of(value);
            }
        }
        return OptionalDouble.empty();
    }

    static OptionalDouble fromTempoElement(Element body) {
        Element tempo = body.selectFirst(TEMPO_SELECTOR);
        if (tempo == null) return OptionalDouble.empty();
        Matcher m = NUMBER.matcher(tempo.text());
        Double value = m.find() ? Utils.parseDoubleOrNull(m.group(1)) : Utils.parseDoubleOrNull(tempo.attr("data-tempo"));
        return value != null && isPlausible(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    private static TextNode firstTextNodeContainingBpm(Node node) {
        for (Node child : node.childNodes()) {
            if (child instanceof TextNode text) {
                if (text.text().toUpperCase(Locale.ROOT).contains("BPM")) return text;
            } else {
                TextNode found = firstTextNodeContainingBpm(child);
                if (found != null) return found;
            }
        }
        return null;
    }
}
