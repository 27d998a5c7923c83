package com.allsets.plays.provider;

/**
 * Obtains a play or view count for a provider URL.
 * <p>
 * Implementations never throw: any network, status, parse or decode failure yields 0 so that the
 * remaining providers of a set are still counted.
 */
public interface PlayCountResolver {
    /**
     * @return Short provider name used in logs
     */
    String provider();

    /**
     * @param url Provider URL found on the set page
     * @return Non-negative play count, 0 on failure
     */
    long resolve(String url);
}
