package com.allsets.plays;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds hosting-provider URLs in fetched page text.
 * <p>
 * Each provider is an independent scan of the same content; only the first match per provider is
 * kept, and a match ends at the first double quote.
 */
public final class ProviderLinkDetector {
    private ProviderLinkDetector() {}

    static final Pattern MIXCLOUD = Pattern.compile("https://www\\.mixcloud\\.com/[^\"]+");
    static final Pattern SOUNDCLOUD = Pattern.compile("https://soundcloud\\.com/[^\"]+");
    static final Pattern YOUTUBE = Pattern.compile("https://(www\\.)?youtube\\.com/[^\"]+|https://youtu\\.be/[^\"]+");

    public static ProviderLinks detect(String page) {
        return new ProviderLinks(findMixcloud(page), findSoundcloud(page), findYoutube(page));
    }

    public static String findMixcloud(String page) {
        return firstMatch(MIXCLOUD, page);
    }

    public static String findSoundcloud(String page) {
        return firstMatch(SOUNDCLOUD, page);
    }

    public static String findYoutube(String page) {
        return firstMatch(YOUTUBE, page);
    }

    private static String firstMatch(Pattern pattern, String text) {
        if (text == null || text.isEmpty()) return "";
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group() : "";
    }
}
