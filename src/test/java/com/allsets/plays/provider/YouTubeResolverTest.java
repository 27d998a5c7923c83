package com.allsets.plays.provider;

import com.allsets.plays.PlaysConfig;
import com.allsets.plays.StubHttpServer;
import com.allsets.plays.StubHttpServer.Reply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class YouTubeResolverTest {

    private StubHttpServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubHttpServer();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private YouTubeResolver resolver(String apiKey) {
        Map<String, String> values = apiKey == null
            ? Map.of(PlaysConfig.YOUTUBE_API_BASE, server.baseUrl())
            : Map.of(PlaysConfig.YOUTUBE_API_BASE, server.baseUrl(), PlaysConfig.YOUTUBE_API_KEY, apiKey);
        return new YouTubeResolver(PlaysConfig.of(values), new ProviderHttpClient());
    }

    @Test
    void testExtractVideoId() {
        assertEquals("abc_123-X", YouTubeResolver.extractVideoId("https://www.youtube.com/watch?v=abc_123-X&t=10"));
        assertEquals("liveId", YouTubeResolver.extractVideoId("https://youtube.com/live/liveId?si=share"));
        assertEquals("short1", YouTubeResolver.extractVideoId("https://youtu.be/short1"));
        assertEquals("", YouTubeResolver.extractVideoId("https://www.youtube.com/@channel"));
    }

    @Test
    void testReadsViewCount() {
        server.route("/videos", Reply.json("{\"items\":[{\"statistics\":{\"viewCount\":\"2500\",\"likeCount\":\"3\"}}]}"));

        assertEquals(2500, resolver("key-1").resolve("https://youtu.be/vid42"));
        assertEquals(1, server.hits("/videos?part=statistics&id=vid42&key=key-1"));
    }

    @Test
    void testMissingKeySkipsRequest() {
        server.route("/videos", Reply.json("{\"items\":[{\"statistics\":{\"viewCount\":\"2500\"}}]}"));

        assertEquals(0, resolver(null).resolve("https://youtu.be/vid42"));
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void testUnrecognisedUrlSkipsRequest() {
        assertEquals(0, resolver("key-1").resolve("https://www.youtube.com/@channel"));
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void testEmptyItemsAndNonNumericCountYieldZero() {
        YouTubeResolver resolver = resolver("key-1");

        server.route("/videos", Reply.json("{\"items\":[]}"));
        assertEquals(0, resolver.resolve("https://youtu.be/none"));

        server.route("/videos", Reply.json("{\"items\":[{\"statistics\":{\"viewCount\":\"lots\"}}]}"));
        assertEquals(0, resolver.resolve("https://youtu.be/weird"));
    }

    @Test
    void testErrorStatusYieldsZero() {
        server.route("/videos", new Reply(403, "{\"error\":{\"code\":403}}", Map.of()));
        assertEquals(0, resolver("bad-key").resolve("https://www.youtube.com/watch?v=vid42"));
    }
}
