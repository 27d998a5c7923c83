package com.allsets.plays;

import com.allsets.plays.provider.MixcloudResolver;
import com.allsets.plays.provider.PlayCountResolver;
import com.allsets.plays.provider.ProviderHttpClient;
import com.allsets.plays.provider.SoundCloudResolver;
import com.allsets.plays.provider.YouTubeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Sums provider play counts per set and writes the annotated list.
 * <p>
 * Workflow per entry, strictly sequential:
 * <ul>
 *   <li>Unlinked entries are printed unchanged.</li>
 *   <li>The set page is fetched; on failure the entry is printed linked but without plays.</li>
 *   <li>Provider links are detected on the page and each present provider is resolved.</li>
 *   <li>The summed count is added to the run total and the entry line is printed.</li>
 * </ul>
 * Resolver failures count as 0 and never abort the run.
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public class AggregationService implements AggregationServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(AggregationService.class);

    private final PageFetcherInterface pageFetcher;
    private final PlayCountResolver mixcloud;
    private final PlayCountResolver soundcloud;
    private final PlayCountResolver youtube;

    public AggregationService(PlaysConfig config) {
        this(config, new HttpPageFetcher(), new ProviderHttpClient());
    }

    public AggregationService(PlaysConfig config, PageFetcherInterface pageFetcher, ProviderHttpClient http) {
        this(pageFetcher,
            new MixcloudResolver(config, http),
            new SoundCloudResolver(config, http, pageFetcher),
            new YouTubeResolver(config, http));
    }

    public AggregationService(PageFetcherInterface pageFetcher, PlayCountResolver mixcloud,
                              PlayCountResolver soundcloud, PlayCountResolver youtube) {
        this.pageFetcher = pageFetcher;
        this.mixcloud = mixcloud;
        this.soundcloud = soundcloud;
        this.youtube = youtube;
    }

    @Override
    public RunTotals aggregate(List<SetEntry> entries, PrintStream out) {
        logger.debug("Processing {} unique sets", entries.size());
        long totalPlays = 0;
        long totalSets = 0;
        Set<String> processed = new HashSet<>();
        for (SetEntry entry : entries) {
            if (!processed.add(entry.dedupKey())) continue;
            totalSets++;
            if (!entry.isLinked()) {
                out.println(entry.rawLine());
                continue;
            }
            long plays;
            try {
                plays = resolvePlays(entry);
            } catch (IOException e) {
                logger.warn("Failed to fetch set page {}: {}", entry.link(), e.getMessage());
                out.println(PlayCountFormatter.formatEntry(entry, 0));
                continue;
            }
            totalPlays += plays;
            out.println(PlayCountFormatter.formatEntry(entry, plays));
        }
        out.println();
        out.println(PlayCountFormatter.formatTotalPlays(totalPlays));
        out.println(PlayCountFormatter.formatTotalSets(totalSets));
        logger.info("Aggregated {} plays across {} sets", totalPlays, totalSets);
        return new RunTotals(totalPlays, totalSets);
    }

    @Override
    public long resolvePlays(SetEntry entry) throws IOException {
        String page = pageFetcher.fetch(entry.link());
        ProviderLinks links = ProviderLinkDetector.detect(page);
        if (links.isEmpty()) {
            logger.debug("No provider links on {}", entry.link());
            return 0;
        }
        logger.debug("External links for {} - Mixcloud: {}, SoundCloud: {}, YouTube: {}",
            entry.link(), links.mixcloud(), links.soundcloud(), links.youtube());
        long plays = 0;
        plays += resolveIfPresent(mixcloud, links.mixcloud());
        plays += resolveIfPresent(soundcloud, links.soundcloud());
        plays += resolveIfPresent(youtube, links.youtube());
        return plays;
    }

    private static long resolveIfPresent(PlayCountResolver resolver, String url) {
        if (url.isEmpty()) return 0;
        try {
            return Math.max(0, resolver.resolve(url));
        } catch (RuntimeException e) {
            logger.warn("{} resolver failed for {}: {}", resolver.provider(), url, e.getMessage());
            return 0;
        }
    }
}
