package com.allsets.plays;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProviderLinkDetectorTest {

    private static final String SET_PAGE = """
        <html><body>
        <article>
          <p>Recorded live.</p>
          <a href="https://www.mixcloud.com/djname/sunset-session/">Mixcloud</a>
          <a href="https://www.mixcloud.com/djname/other-mix/">Older upload</a>
          <iframe src="https://w.soundcloud.com/player/?url=x"></iframe>
          <a href="https://soundcloud.com/djname/sunset-session">SoundCloud</a>
          <a href="https://youtu.be/dQw4w9WgXcQ">YouTube</a>
        </article>
        </body></html>
        """;

    @Test
    void testFirstMatchPerProviderStopsAtQuote() {
        ProviderLinks links = ProviderLinkDetector.detect(SET_PAGE);
        assertEquals("https://www.mixcloud.com/djname/sunset-session/", links.mixcloud());
        assertEquals("https://soundcloud.com/djname/sunset-session", links.soundcloud());
        assertEquals("https://youtu.be/dQw4w9WgXcQ", links.youtube());
    }

    @Test
    void testYoutubeLongFormWithAndWithoutWww() {
        assertEquals("https://www.youtube.com/watch?v=abc_123",
            ProviderLinkDetector.findYoutube("<a href=\"https://www.youtube.com/watch?v=abc_123\">"));
        assertEquals("https://youtube.com/live/xyz",
            ProviderLinkDetector.findYoutube("<a href=\"https://youtube.com/live/xyz\">"));
    }

    @Test
    void testAbsentProvidersAreEmpty() {
        ProviderLinks links = ProviderLinkDetector.detect("<a href=\"https://soundcloud.com/a/b\">only sc</a>");
        assertEquals("", links.mixcloud());
        assertEquals("https://soundcloud.com/a/b", links.soundcloud());
        assertEquals("", links.youtube());
        assertTrue(ProviderLinkDetector.detect("no links here").isEmpty());
        assertTrue(ProviderLinkDetector.detect(null).isEmpty());
    }

    @Test
    void testPlainHttpIsNotMatched() {
        assertEquals("", ProviderLinkDetector.findMixcloud("\"http://www.mixcloud.com/a/b/\""));
    }
}
