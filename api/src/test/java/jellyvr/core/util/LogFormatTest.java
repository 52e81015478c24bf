package jellyvr.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LogFormat")
class LogFormatTest {

    @Test
    @DisplayName("should abbreviate long ids for logs")
    void shouldAbbreviateLongIds() {
        assertEquals("abcdefgh...", LogFormat.abbreviate("abcdefghijklmnop"));
    }

    @Test
    @DisplayName("should keep short ids as they are")
    void shouldKeepShortIds() {
        assertEquals("short", LogFormat.abbreviate("short"));
        assertEquals("abcdefgh", LogFormat.abbreviate("abcdefgh"));
    }

    @Test
    @DisplayName("should tolerate a missing id")
    void shouldTolerateNull() {
        assertEquals("null", LogFormat.abbreviate(null));
    }
}
