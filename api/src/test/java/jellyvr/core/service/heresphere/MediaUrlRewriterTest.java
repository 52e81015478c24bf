package jellyvr.core.service.heresphere;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MediaUrlRewriter")
class MediaUrlRewriterTest {

    private final MediaUrlRewriter rewriter =
            new MediaUrlRewriter("http://jellyfin:8096/", "https://media.example.com");

    @Test
    @DisplayName("should prefix server-relative paths with the external base URL")
    void shouldPrefixRelativePath() {
        assertEquals(
                "https://media.example.com/Items/abc/Download?api_key=t",
                rewriter.rewrite("/Items/abc/Download?api_key=t"));
    }

    @Test
    @DisplayName("should swap the internal base URL for the external one")
    void shouldSwapInternalBase() {
        assertEquals("https://media.example.com/Videos/x/master.m3u8",
                rewriter.rewrite("http://jellyfin:8096/Videos/x/master.m3u8"));
        assertEquals("https://media.example.com?x=1", rewriter.rewrite("http://jellyfin:8096?x=1"));
        assertEquals("https://media.example.com", rewriter.rewrite("http://jellyfin:8096"));
    }

    @Test
    @DisplayName("should leave unrelated URLs untouched")
    void shouldLeaveForeignUrls() {
        assertEquals("https://cdn.example.org/a.jpg", rewriter.rewrite("https://cdn.example.org/a.jpg"));
        assertEquals("http://jellyfin:80960/x", rewriter.rewrite("http://jellyfin:80960/x"));
    }

    @Test
    @DisplayName("should pass through null and empty values")
    void shouldPassThroughEmpty() {
        assertNull(rewriter.rewrite(null));
        assertEquals("", rewriter.rewrite(""));
    }
}
