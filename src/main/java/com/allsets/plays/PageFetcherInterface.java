package com.allsets.plays;

import java.io.IOException;

/**
 * Interface for retrieving raw page content.
 */
public interface PageFetcherInterface {
    /**
     * Issues a single blocking GET and returns the response body as text.
     * @param url Absolute URL to fetch
     * @return Full response body
     * @throws IOException if the request fails or the body cannot be read
     */
    String fetch(String url) throws IOException;
}
