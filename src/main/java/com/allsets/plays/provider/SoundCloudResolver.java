package com.allsets.plays.provider;

import com.allsets.plays.PageFetcherInterface;
import com.allsets.plays.PlaysConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Resolves SoundCloud playback counts through an ordered fallback chain:
 * <ol>
 *   <li>{@link TokenResolveStrategy} - configured OAuth token</li>
 *   <li>{@link ClientCredentialsStrategy} - token obtained from client id and secret</li>
 *   <li>{@link LegacyClientIdStrategy} - bare client id as query parameter</li>
 *   <li>{@link HtmlScrapeStrategy} - page text search</li>
 * </ol>
 * A step runs only when its configuration is present; the first step that succeeds ends the chain.
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public class SoundCloudResolver implements PlayCountResolver {
    private static final Logger logger = LoggerFactory.getLogger(SoundCloudResolver.class);

    private final List<SoundCloudStrategy> strategies;

    public SoundCloudResolver(PlaysConfig config, ProviderHttpClient http, PageFetcherInterface pageFetcher) {
        this(defaultChain(config, http, pageFetcher));
    }

    public SoundCloudResolver(List<SoundCloudStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    static List<SoundCloudStrategy> defaultChain(PlaysConfig config, ProviderHttpClient http, PageFetcherInterface pageFetcher) {
        TokenResolveStrategy token = new TokenResolveStrategy(config, http);
        return List.of(
            token,
            new ClientCredentialsStrategy(config, http, token),
            new LegacyClientIdStrategy(config, http),
            new HtmlScrapeStrategy(pageFetcher)
        );
    }

    @Override
    public String provider() {
        return "SoundCloud";
    }

    @Override
    public long resolve(String url) {
        logger.debug("Resolving SoundCloud plays for {}", url);
        for (SoundCloudStrategy strategy : strategies) {
            if (!strategy.isAvailable()) {
                logger.debug("SoundCloud step '{}' not configured, skipping", strategy.name());
                continue;
            }
            Resolution result;
            try {
                result = strategy.resolve(url);
            } catch (RuntimeException e) {
                logger.warn("SoundCloud step '{}' failed for {}: {}", strategy.name(), url, e.getMessage());
                continue;
            }
            if (result.succeeded()) {
                logger.debug("SoundCloud step '{}' resolved {} plays", strategy.name(), result.count());
                return result.count();
            }
            logger.debug("SoundCloud step '{}' failed, trying next", strategy.name());
        }
        logger.warn("Could not determine SoundCloud plays for {}", url);
        return 0;
    }

    List<SoundCloudStrategy> strategies() {
        return strategies;
    }
}
