package com.allsets.plays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Re-orders an already annotated sets list by descending play count. No network access: counts
 * are read from the {@code _//_ 2.5k🎧} annotations written by {@link AggregationService}.
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public class SortService {
    private static final Logger logger = LoggerFactory.getLogger(SortService.class);

    private static final Pattern PLAYS = Pattern.compile("([0-9]+(?:\\.[0-9]+)?)([kM]?)" + PlayCountFormatter.PLAYS_MARKER);
    private static final Pattern LINK = Pattern.compile("\\((https?://[^\\s)]+)\\)");

    private record SortedLine(String line, long plays) {}

    /**
     * Reads the list and prints its list items sorted.
     * @throws IOException if the file cannot be read
     */
    public void printSorted(Path path, PrintStream out) throws IOException {
        List<String> lines = SetListParser.readLines(path);
        for (String line : sortLines(lines)) {
            out.println(line);
        }
    }

    /**
     * Keeps trimmed list items, drops repeated links, stable-sorts by count descending.
     */
    public List<String> sortLines(List<String> lines) {
        List<SortedLine> entries = new ArrayList<>();
        Set<String> seenLinks = new HashSet<>();
        for (String ln : lines) {
            String trim = ln.strip();
            if (!trim.startsWith(SetListParser.LIST_MARKER)) continue;
            String link = extractLink(trim);
            if (!link.isEmpty() && !seenLinks.add(link)) {
                logger.debug("Skipping duplicate list line for {}", link);
                continue;
            }
            entries.add(new SortedLine(trim, extractPlays(trim)));
        }
        // List.sort is stable
        entries.sort(Comparator.comparingLong(SortedLine::plays).reversed());
        logger.debug("Sorted {} list items", entries.size());
        List<String> sorted = new ArrayList<>(entries.size());
        for (SortedLine e : entries) sorted.add(e.line());
        return sorted;
    }

    static String extractLink(String line) {
        Matcher m = LINK.matcher(line);
        return m.find() ? m.group(1) : "";
    }

    /**
     * @return The annotated count, or 0 when the line carries none
     */
    static long extractPlays(String line) {
        Matcher m = PLAYS.matcher(line);
        if (!m.find()) return 0;
        try {
            return PlayCountFormatter.parsePlays(m.group(1), m.group(2));
        } catch (NumberFormatException e) {
            logger.debug("Unreadable play count in '{}': {}", line, e.getMessage());
            return 0;
        }
    }
}
