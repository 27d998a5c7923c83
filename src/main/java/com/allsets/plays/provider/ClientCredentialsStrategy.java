package com.allsets.plays.provider;

import com.allsets.plays.PlaysConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exchanges {@code SOUNDCLOUD_CLIENT_ID} and {@code SOUNDCLOUD_CLIENT_SECRET} for a bearer token
 * (client-credentials grant) and resolves the track with it.
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public class ClientCredentialsStrategy implements SoundCloudStrategy {
    private static final Logger logger = LoggerFactory.getLogger(ClientCredentialsStrategy.class);

    private final PlaysConfig config;
    private final ProviderHttpClient http;
    private final TokenResolveStrategy tokenResolver;

    public ClientCredentialsStrategy(PlaysConfig config, ProviderHttpClient http, TokenResolveStrategy tokenResolver) {
        this.config = config;
        this.http = http;
        this.tokenResolver = tokenResolver;
    }

    @Override
    public String name() {
        return "client-credentials";
    }

    @Override
    public boolean isAvailable() {
        return !config.soundcloudClientId().isEmpty() && !config.soundcloudClientSecret().isEmpty();
    }

    @Override
    public Resolution resolve(String trackUrl) {
        logger.debug("Attempting OAuth token exchange with client_id+client_secret");
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", config.soundcloudClientId());
        form.put("client_secret", config.soundcloudClientSecret());
        form.put("grant_type", "client_credentials");
        String token;
        try {
            HttpResponse<String> response = http.postForm(config.soundcloudApiBase() + "/oauth2/token", form);
            if (response.statusCode() != 200) {
                logger.debug("Token endpoint returned status: {}", response.statusCode());
                return Resolution.failed();
            }
            token = http.readJson(response.body()).path("access_token").asText("");
        } catch (Exception e) {
            logger.warn("Error requesting SoundCloud token: {}", e.getMessage());
            return Resolution.failed();
        }
        if (token.isEmpty()) {
            logger.debug("Token exchange returned an empty access_token");
            return Resolution.failed();
        }
        logger.debug("Obtained SoundCloud OAuth token via client credentials");
        return tokenResolver.resolveWithToken(trackUrl, token);
    }
}
