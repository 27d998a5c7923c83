package com.allsets.plays;

import java.util.Map;
import java.util.function.Function;

/**
 * Configuration values for a plays run.
 * <p>
 * Each value is looked up on every access, first in the process environment and then in the
 * JVM system properties. Missing values are returned as empty strings; callers treat an empty
 * credential as "not configured" and skip the step that needs it.
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public class PlaysConfig {
    public static final String SOUNDCLOUD_OAUTH_TOKEN = "SOUNDCLOUD_OAUTH_TOKEN";
    public static final String SOUNDCLOUD_CLIENT_ID = "SOUNDCLOUD_CLIENT_ID";
    public static final String SOUNDCLOUD_CLIENT_SECRET = "SOUNDCLOUD_CLIENT_SECRET";
    public static final String YOUTUBE_API_KEY = "YOUTUBE_API_KEY";
    public static final String INPUT_FILE = "PLAYS_INPUT_FILE";
    public static final String DEBUG = "PLAYS_DEBUG";
    public static final String MIXCLOUD_API_BASE = "PLAYS_MIXCLOUD_API_BASE";
    public static final String SOUNDCLOUD_API_BASE = "PLAYS_SOUNDCLOUD_API_BASE";
    public static final String YOUTUBE_API_BASE = "PLAYS_YOUTUBE_API_BASE";

    static final String DEFAULT_INPUT_FILE = "../all-sets.md";
    static final String DEFAULT_MIXCLOUD_API_BASE = "https://api.mixcloud.com";
    static final String DEFAULT_SOUNDCLOUD_API_BASE = "https://api.soundcloud.com";
    static final String DEFAULT_YOUTUBE_API_BASE = "https://www.googleapis.com/youtube/v3";

    private final Function<String, String> lookup;

    /**
     * @param lookup resolves a configuration key to its value, or null when unset
     */
    public PlaysConfig(Function<String, String> lookup) {
        this.lookup = lookup == null ? key -> null : lookup;
    }

    /**
     * Configuration backed by environment variables with system properties as fallback.
     */
    public static PlaysConfig fromEnvironment() {
        return new PlaysConfig(PlaysConfig::envOrProp);
    }

    /**
     * Configuration backed by a fixed map, mostly for tests.
     */
    public static PlaysConfig of(Map<String, String> values) {
        return new PlaysConfig(values::get);
    }

    private static String envOrProp(String key) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        return System.getProperty(key);
    }

    private String value(String key, String defaultVal) {
        String v = lookup.apply(key);
        return v == null || v.isBlank() ? defaultVal : v.trim();
    }

    public String soundcloudOauthToken() {
        return value(SOUNDCLOUD_OAUTH_TOKEN, "");
    }

    public String soundcloudClientId() {
        return value(SOUNDCLOUD_CLIENT_ID, "");
    }

    public String soundcloudClientSecret() {
        return value(SOUNDCLOUD_CLIENT_SECRET, "");
    }

    public String youtubeApiKey() {
        return value(YOUTUBE_API_KEY, "");
    }

    public String inputFile() {
        return value(INPUT_FILE, DEFAULT_INPUT_FILE);
    }

    public boolean debug() {
        return Boolean.parseBoolean(value(DEBUG, "false"));
    }

    public String mixcloudApiBase() {
        return stripTrailingSlash(value(MIXCLOUD_API_BASE, DEFAULT_MIXCLOUD_API_BASE));
    }

    public String soundcloudApiBase() {
        return stripTrailingSlash(value(SOUNDCLOUD_API_BASE, DEFAULT_SOUNDCLOUD_API_BASE));
    }

    public String youtubeApiBase() {
        return stripTrailingSlash(value(YOUTUBE_API_BASE, DEFAULT_YOUTUBE_API_BASE));
    }

    private static String stripTrailingSlash(String base) {
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
