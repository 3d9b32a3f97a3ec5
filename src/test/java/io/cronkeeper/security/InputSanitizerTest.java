package io.cronkeeper.security;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InputSanitizerTest {

    private final InputSanitizer sanitizer = new InputSanitizer();

    @Test
    void shouldPassThroughNormalText() {
        assertEquals("Hello world", sanitizer.sanitize("Hello world"));
    }

    @Test
    void shouldHandleNull() {
        assertEquals("", sanitizer.sanitize(null));
        assertEquals("", sanitizer.sanitizeName(null));
        assertNull(sanitizer.sanitizeOptional(null));
    }

    @Test
    void shouldRemoveControlCharacters() {
        assertEquals("HelloWorldTest", sanitizer.sanitize("Hello\u0000World\u0007Test"));
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
    void shouldFlattenNamesToSingleLine() {
        assertEquals("Daily report", sanitizer.sanitizeName("  Daily\nreport \u0000"));
    }

    @Test
    void shouldTruncateLongNames() {
        assertEquals(InputSanitizer.MAX_NAME_LENGTH, sanitizer.sanitizeName("n".repeat(500)).length());
    }
}
