package com.allsets.plays;

/**
 * Provider URLs found on a set page. Each component is an absolute URL or empty.
 */
public record ProviderLinks(String mixcloud, String soundcloud, String youtube) {

    public ProviderLinks {
        mixcloud = mixcloud == null ? "" : mixcloud;
        soundcloud = soundcloud == null ? "" : soundcloud;
        youtube = youtube == null ? "" : youtube;
    }

    public boolean isEmpty() {
        return mixcloud.isEmpty() && soundcloud.isEmpty() && youtube.isEmpty();
    }
}
