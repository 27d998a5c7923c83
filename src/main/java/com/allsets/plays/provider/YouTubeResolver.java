package com.allsets.plays.provider;

import com.allsets.plays.PlaysConfig;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpResponse;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code viewCount} from the YouTube Data API. Requires {@code YOUTUBE_API_KEY}.
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public class YouTubeResolver implements PlayCountResolver {
    private static final Logger logger = LoggerFactory.getLogger(YouTubeResolver.class);

    // youtube.com/watch?v=ID or youtube.com/live/ID
    private static final Pattern LONG_FORM = Pattern.compile("youtube\\.com/(?:watch\\?v=|live/)([a-zA-Z0-9_-]+)");
    // youtu.be/ID
    private static final Pattern SHORT_LINK = Pattern.compile("youtu\\.be/([a-zA-Z0-9_-]+)");

    private final PlaysConfig config;
    private final ProviderHttpClient http;

    public YouTubeResolver(PlaysConfig config, ProviderHttpClient http) {
        this.config = config;
        this.http = http;
    }

    @Override
    public String provider() {
        return "YouTube";
    }

    @Override
    public long resolve(String url) {
        logger.debug("Resolving YouTube views for {}", url);
        String apiKey = config.youtubeApiKey();
        if (apiKey.isEmpty()) {
            logger.warn("YouTube API key not set ({}). Skipping {}", PlaysConfig.YOUTUBE_API_KEY, url);
            return 0;
        }
        String videoId = extractVideoId(url);
        if (videoId.isEmpty()) {
            logger.debug("Could not extract YouTube video ID from URL: {}", url);
            return 0;
        }
        String apiUrl = config.youtubeApiBase() + "/videos?part=statistics&id=" + ProviderHttpClient.queryEscape(videoId)
            + "&key=" + ProviderHttpClient.queryEscape(apiKey);
        try {
            HttpResponse<String> response = http.get(apiUrl);
            if (response.statusCode() != 200) {
                logger.debug("YouTube API returned status: {}", response.statusCode());
                return 0;
            }
            JsonNode items = http.readJson(response.body()).path("items");
            if (!items.isArray() || items.size() == 0) {
                logger.debug("No items found for video ID: {}", videoId);
                return 0;
            }
            String viewCount = items.get(0).path("statistics").path("viewCount").asText("");
            long views = Long.parseLong(viewCount.trim());
            logger.debug("YouTube viewCount: {}", views);
            return Math.max(0, views);
        } catch (NumberFormatException e) {
            logger.debug("Error parsing viewCount for {}: {}", videoId, e.getMessage());
            return 0;
        } catch (Exception e) {
            logger.warn("YouTube lookup failed for {}: {}", url, e.getMessage());
            return 0;
        }
    }

    /**
     * Extracts the video identifier, trying the long form before the short link.
     * @return The identifier, or an empty string when neither shape matches
     */
    static String extractVideoId(String url) {
        if (url == null) return "";
        Matcher m = LONG_FORM.matcher(url);
        if (m.find()) return m.group(1);
        m = SHORT_LINK.matcher(url);
        if (m.find()) return m.group(1);
        return "";
    }
}
