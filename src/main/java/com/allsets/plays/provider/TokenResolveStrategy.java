package com.allsets.plays.provider;

import com.allsets.plays.PlaysConfig;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a track through {@code /resolve} with an {@code Authorization: OAuth <token>} header,
 * using the token from {@code SOUNDCLOUD_OAUTH_TOKEN}.
 * <p>
 * A 302 from {@code /resolve} is followed once with the same header.
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public class TokenResolveStrategy implements SoundCloudStrategy {
    private static final Logger logger = LoggerFactory.getLogger(TokenResolveStrategy.class);

    private final PlaysConfig config;
    private final ProviderHttpClient http;

    public TokenResolveStrategy(PlaysConfig config, ProviderHttpClient http) {
        this.config = config;
        this.http = http;
    }

    @Override
    public String name() {
        return "oauth-token";
    }

    @Override
    public boolean isAvailable() {
        return !config.soundcloudOauthToken().isEmpty();
    }

    @Override
    public Resolution resolve(String trackUrl) {
        logger.debug("Using {}", PlaysConfig.SOUNDCLOUD_OAUTH_TOKEN);
        return resolveWithToken(trackUrl, config.soundcloudOauthToken());
    }

    /**
     * Token-based resolution shared with the client-credentials step.
     */
    Resolution resolveWithToken(String trackUrl, String token) {
        String resolveApi = config.soundcloudApiBase() + "/resolve?url=" + ProviderHttpClient.queryEscape(trackUrl);
        Map<String, String> auth = Map.of("Authorization", "OAuth " + token);
        try {
            HttpResponse<String> response = http.get(resolveApi, auth);
            if (response.statusCode() == 200) {
                return decodePlaybackCount(http, response.body(), "API OAuth");
            }
            if (response.statusCode() == 302) {
                Optional<String> location = ProviderHttpClient.redirectTarget(response);
                if (location.isEmpty()) {
                    logger.debug("Token-resolve redirect without Location header");
                    return Resolution.failed();
                }
                logger.debug("Token-resolve redirected to: {}", location.get());
                HttpResponse<String> redirected = http.get(location.get(), auth);
                if (redirected.statusCode() == 200) {
                    return decodePlaybackCount(http, redirected.body(), "API OAuth redirect");
                }
                logger.debug("Redirected SoundCloud track returned status: {}", redirected.statusCode());
                return Resolution.failed();
            }
            logger.debug("SoundCloud resolve with token returned status: {}", response.statusCode());
            return Resolution.failed();
        } catch (Exception e) {
            logger.debug("Error resolving SoundCloud URL with token: {}", e.getMessage());
            return Resolution.failed();
        }
    }

    /**
     * Decodes {@code playback_count} from a track JSON body; a body that is not JSON fails the step.
     */
    static Resolution decodePlaybackCount(ProviderHttpClient http, String body, String source) {
        try {
            JsonNode track = http.readJson(body);
            long plays = track.path("playback_count").asLong(0);
            logger.debug("SoundCloud playback_count ({}): {}", source, plays);
            return Resolution.of(plays);
        } catch (IOException e) {
            logger.debug("Error decoding SoundCloud track ({}): {}", source, e.getMessage());
            return Resolution.failed();
        }
    }
}
