package com.allsets.plays.provider;

import com.allsets.plays.PlaysConfig;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpResponse;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code play_count} from the public Mixcloud API ({@code /{user}/{slug}/}).
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public class MixcloudResolver implements PlayCountResolver {
    private static final Logger logger = LoggerFactory.getLogger(MixcloudResolver.class);
    private static final Pattern CLOUDCAST = Pattern.compile("https://www\\.mixcloud\\.com/([^/]+)/([^/?#]+)/?");

    private final PlaysConfig config;
    private final ProviderHttpClient http;

    public MixcloudResolver(PlaysConfig config, ProviderHttpClient http) {
        this.config = config;
        this.http = http;
    }

    @Override
    public String provider() {
        return "Mixcloud";
    }

    @Override
    public long resolve(String url) {
        logger.debug("Resolving Mixcloud plays for {}", url);
        Matcher m = CLOUDCAST.matcher(url == null ? "" : url);
        if (!m.find()) {
            logger.debug("Could not parse Mixcloud URL: {}", url);
            return 0;
        }
        String apiUrl = config.mixcloudApiBase() + "/" + ProviderHttpClient.pathEscape(m.group(1))
            + "/" + ProviderHttpClient.pathEscape(m.group(2)) + "/";
        try {
            HttpResponse<String> response = http.get(apiUrl);
            if (response.statusCode() != 200) {
                logger.debug("Mixcloud API returned status: {}", response.statusCode());
                return 0;
            }
            JsonNode root = http.readJson(response.body());
            long plays = Math.max(0, root.path("play_count").asLong(0));
            logger.debug("Mixcloud play_count: {}", plays);
            return plays;
        } catch (Exception e) {
            logger.warn("Mixcloud lookup failed for {}: {}", url, e.getMessage());
            return 0;
        }
    }
}
