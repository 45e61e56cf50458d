package io.remindrunr.security;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InputSanitizerTest {

    private final InputSanitizer sanitizer = new InputSanitizer();

    @Test
    void shouldPassThroughNormalText() {
        assertEquals("Hello world", sanitizer.sanitize("Hello world"));
    }

    @Test
    void shouldKeepNullAsNull() {
        assertNull(sanitizer.sanitize(null));
        assertNull(sanitizer.sanitizeTitle(null));
    }

    @Test
    void shouldRemoveControlCharacters() {
        String input = "Hello\u0000World\u0007Test";
        assertEquals("HelloWorldTest", sanitizer.sanitize(input));
    }

    @Test
    void shouldPreserveNewlinesAndTabs() {
        String input = "Line 1\nLine 2\tTabbed";
        assertEquals(input, sanitizer.sanitize(input));
    }

    @Test
    void shouldTruncateLongMessages() {
        String result = sanitizer.sanitize("A".repeat(15_000));
        assertTrue(result.length() < 15_000);
        assertTrue(result.endsWith("[truncated]"));
    }

    @Test
    void shouldFlattenTitleToSingleLine() {
        assertEquals("Team sync now", sanitizer.sanitizeTitle("Team\r\nsync\tnow"));
    }

    @Test
    void shouldTruncateLongTitles() {
        String result = sanitizer.sanitizeTitle("T".repeat(500));
        assertEquals(InputSanitizer.MAX_TITLE_LENGTH + "... [truncated]".length(), result.length());
    }
}
