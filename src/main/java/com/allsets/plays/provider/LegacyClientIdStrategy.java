package com.allsets.plays.provider;

import com.allsets.plays.PlaysConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpResponse;
import java.util.Optional;

/**
 * Resolves a track with {@code client_id} as a query parameter. SoundCloud rejects most bare
 * client ids with 401 nowadays; that is treated as a failed step.
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public class LegacyClientIdStrategy implements SoundCloudStrategy {
    private static final Logger logger = LoggerFactory.getLogger(LegacyClientIdStrategy.class);

    private final PlaysConfig config;
    private final ProviderHttpClient http;

    public LegacyClientIdStrategy(PlaysConfig config, ProviderHttpClient http) {
        this.config = config;
        this.http = http;
    }

    @Override
    public String name() {
        return "client-id";
    }

    @Override
    public boolean isAvailable() {
        return !config.soundcloudClientId().isEmpty();
    }

    @Override
    public Resolution resolve(String trackUrl) {
        String clientId = config.soundcloudClientId();
        String resolveApi = config.soundcloudApiBase() + "/resolve?url=" + ProviderHttpClient.queryEscape(trackUrl)
            + "&client_id=" + ProviderHttpClient.queryEscape(clientId);
        try {
            HttpResponse<String> response = http.get(resolveApi);
            switch (response.statusCode()) {
                case 200:
                    return TokenResolveStrategy.decodePlaybackCount(http, response.body(), "API client_id");
                case 302: {
                    Optional<String> location = ProviderHttpClient.redirectTarget(response);
                    if (location.isEmpty()) {
                        logger.debug("Client-id resolve redirect without Location header");
                        return Resolution.failed();
                    }
                    logger.debug("Redirected to: {}", location.get());
                    HttpResponse<String> redirected = http.get(location.get() + "?client_id=" + ProviderHttpClient.queryEscape(clientId));
                    return TokenResolveStrategy.decodePlaybackCount(http, redirected.body(), "API redirect");
                }
                case 401:
                    logger.warn("SoundCloud resolve returned 401 (invalid client_id). Falling back");
                    return Resolution.failed();
                default:
                    logger.debug("SoundCloud resolve returned status: {}", response.statusCode());
                    return Resolution.failed();
            }
        } catch (Exception e) {
            logger.debug("Error resolving SoundCloud URL with client_id: {}", e.getMessage());
            return Resolution.failed();
        }
    }
}
