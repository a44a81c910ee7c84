package net.spookly.hostpilot.caller;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class UrlBuilderTest {
    @Test
    void buildsAndMemoizesUrls() {
        UrlBuilder builder = new UrlBuilder("https");

        assertEquals("https://h1/a/b", builder.url("h1", "/a/b"));
        assertEquals("https://h1/a/b", builder.url("h1", "/a/b"));
        assertEquals("https://h2/a/b", builder.url("h2", "a/b"));
        assertEquals("https://h2/", builder.url("h2", ""));

        assertEquals(3, builder.size());
    }
}
