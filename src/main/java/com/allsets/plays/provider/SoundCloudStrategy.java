package com.allsets.plays.provider;

/**
 * One step of the SoundCloud fallback chain.
 */
public interface SoundCloudStrategy {
    /**
     * @return Step name used in logs
     */
    String name();

    /**
     * Whether the configuration this step needs is present. Read on every call.
     */
    boolean isAvailable();

    /**
     * Attempts to obtain the playback count. Must not throw.
     * @param trackUrl SoundCloud track URL
     * @return The count with {@code succeeded=true}, or {@link Resolution#failed()}
     */
    Resolution resolve(String trackUrl);
}
