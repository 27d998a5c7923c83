package com.allsets.plays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Fetches pages with the JDK {@link HttpClient}, following redirects the way a browser would.
 * No retries and no timeouts beyond the client defaults.
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public class HttpPageFetcher implements PageFetcherInterface {
    private static final Logger logger = LoggerFactory.getLogger(HttpPageFetcher.class);
    static final String USER_AGENT = "AllSetsPlays/1.0";

    private final HttpClient client;

    public HttpPageFetcher() {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build());
    }

    public HttpPageFetcher(HttpClient client) {
        this.client = client;
    }

    @Override
    public String fetch(String url) throws IOException {
        logger.debug("Fetching URL: {}", url);
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder().uri(URI.create(url)).header("User-Agent", USER_AGENT).GET().build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid URL '" + url + "': " + e.getMessage(), e);
        }
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                logger.warn("Fetching {} returned status {}", url, response.statusCode());
            }
            String body = response.body() == null ? "" : response.body();
            logger.debug("Fetched {} chars from {}", body.length(), url);
            return body;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while fetching " + url);
        }
    }
}
