package com.allsets.plays.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Thin wrapper over the JDK {@link HttpClient} for provider statistics APIs.
 * <p>
 * Redirects are not followed automatically so that callers can see a 302 and decide how to
 * follow it (SoundCloud needs the credential re-applied on the redirect target).
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public class ProviderHttpClient {
    private static final Logger logger = LoggerFactory.getLogger(ProviderHttpClient.class);
    static final String USER_AGENT = "AllSetsPlays/1.0";

    private final HttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();

    public ProviderHttpClient() {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NEVER).build());
    }

    public ProviderHttpClient(HttpClient client) {
        this.client = client;
    }

    /**
     * Sends a GET with optional extra headers.
     */
    public HttpResponse<String> get(String url, Map<String, String> headers) throws IOException {
        HttpRequest.Builder builder = request(url);
        headers.forEach(builder::header);
        return send(builder.GET().build());
    }

    public HttpResponse<String> get(String url) throws IOException {
        return get(url, Map.of());
    }

    /**
     * Sends an {@code application/x-www-form-urlencoded} POST.
     */
    public HttpResponse<String> postForm(String url, Map<String, String> form) throws IOException {
        String body = form.entrySet().stream()
            .map(e -> queryEscape(e.getKey()) + "=" + queryEscape(e.getValue()))
            .collect(Collectors.joining("&"));
        HttpRequest request = request(url)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return send(request);
    }

    /**
     * Parses a JSON body.
     * @throws IOException if the body is not valid JSON
     */
    public JsonNode readJson(String body) throws IOException {
        JsonNode node = mapper.readTree(body == null ? "" : body);
        if (node == null || node.isMissingNode()) {
            throw new IOException("Empty JSON body");
        }
        return node;
    }

    /**
     * Resolves the {@code Location} header of a redirect against the request URI.
     */
    public static Optional<String> redirectTarget(HttpResponse<?> response) {
        return response.headers().firstValue("Location")
            .map(location -> response.uri().resolve(location).toString());
    }

    public static String queryEscape(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    /**
     * Escapes a single path segment; spaces become {@code %20} rather than {@code +}.
     */
    public static String pathEscape(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private HttpRequest.Builder request(String url) throws IOException {
        try {
            return HttpRequest.newBuilder().uri(URI.create(url)).header("User-Agent", USER_AGENT);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid URL '" + url + "': " + e.getMessage(), e);
        }
    }

    private HttpResponse<String> send(HttpRequest request) throws IOException {
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            logger.debug("{} {} -> {}", request.method(), request.uri(), response.statusCode());
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while calling " + request.uri());
        }
    }
}
