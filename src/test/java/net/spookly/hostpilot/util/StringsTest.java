package net.spookly.hostpilot.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {
    @Test
    void escapesTagSeparators() {
        assertEquals("https://h/p-qu-a-eq-1-and-b-eq-2", Strings.escapeTagValue("https://h/p?a=1&b=2"));
        assertEquals("", Strings.escapeTagValue(null));
    }

    @Test
    void blankMeansNullOrWhitespace() {
        assertTrue(Strings.isBlank(null));
        assertTrue(Strings.isBlank(" \t"));
        assertFalse(Strings.isBlank("x"));
    }
}
