package com.allsets.plays.provider;

import com.allsets.plays.PageFetcherInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last resort: fetches the SoundCloud page and reads {@code playback_count} out of the embedded
 * hydration data. Needs no credentials.
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public class HtmlScrapeStrategy implements SoundCloudStrategy {
    private static final Logger logger = LoggerFactory.getLogger(HtmlScrapeStrategy.class);

    private static final Pattern QUOTED = Pattern.compile("\"playback_count\"\\s*:\\s*([0-9]+)");
    private static final Pattern UNQUOTED = Pattern.compile("playback_count\\s*:\\s*([0-9]+)");

    private final PageFetcherInterface pageFetcher;

    public HtmlScrapeStrategy(PageFetcherInterface pageFetcher) {
        this.pageFetcher = pageFetcher;
    }

    @Override
    public String name() {
        return "html-scrape";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Resolution resolve(String trackUrl) {
        logger.debug("Fetching SoundCloud page for HTML fallback: {}", trackUrl);
        String body;
        try {
            body = pageFetcher.fetch(trackUrl);
        } catch (Exception e) {
            logger.debug("Error fetching SoundCloud page: {}", e.getMessage());
            return Resolution.failed();
        }
        OptionalLong plays = extractPlaybackCount(body);
        if (plays.isPresent()) {
            logger.debug("SoundCloud playback_count (HTML fallback): {}", plays.getAsLong());
            return Resolution.of(plays.getAsLong());
        }
        logger.warn("Could not determine SoundCloud playback_count for {}", trackUrl);
        return Resolution.failed();
    }

    /**
     * Finds the first {@code playback_count}, trying the quoted JSON key before the bare key.
     */
    static OptionalLong extractPlaybackCount(String page) {
        if (page == null || page.isEmpty()) return OptionalLong.empty();
        for (Pattern pattern : new Pattern[]{QUOTED, UNQUOTED}) {
            Matcher m = pattern.matcher(page);
            if (m.find()) {
                try {
                    return OptionalLong.of(Long.parseLong(m.group(1)));
                } catch (NumberFormatException e) {
                    logger.debug("playback_count out of range: {}", m.group(1));
                }
            }
        }
        return OptionalLong.empty();
    }
}
