// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void escapesLineBreaks() {
        assertEquals("bc1q\\u000aforged", LogSanitizer.sanitize("bc1q\nforged"));
    }

    @Test
    void escapesEscapeSequencesAndNonAscii() {
        assertEquals("\\u001b[31mred", LogSanitizer.sanitize("\u001b[31mred"));
        assertEquals("caf\\u00e9", LogSanitizer.sanitize("café"));
    }

    @Test
    void truncatesToExactMaxLength() {
        String sanitized = LogSanitizer.sanitize("x".repeat(3000));

        assertEquals(LogSanitizer.MAX_LOG_LENGTH, sanitized.length());
        assertEquals("x".repeat(LogSanitizer.MAX_LOG_LENGTH - LogSanitizer.TRUNCATION_SUFFIX.length())
                + LogSanitizer.TRUNCATION_SUFFIX, sanitized);
    }

    @Test
    void doesNotTruncateAtExactLimit() {
        String exactLimit = "y".repeat(LogSanitizer.MAX_LOG_LENGTH);

        assertEquals(exactLimit, LogSanitizer.sanitize(exactLimit));
    }

    @Test
    void truncatesStringJustOverLimit() {
        String sanitized = LogSanitizer.sanitize("z".repeat(LogSanitizer.MAX_LOG_LENGTH + 1));

        assertEquals(LogSanitizer.MAX_LOG_LENGTH, sanitized.length());
        assertTrue(sanitized.endsWith(LogSanitizer.TRUNCATION_SUFFIX));
    }

    @Test
    void countsEscapesTowardsLimit() {
        String sanitized = LogSanitizer.sanitize("\n".repeat(200));

        assertEquals(LogSanitizer.MAX_LOG_LENGTH, sanitized.length());
        assertTrue(sanitized.endsWith(LogSanitizer.TRUNCATION_SUFFIX));
    }

    @Test
    void handlesNull() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }

    @Test
    void leavesAddressesUntouched() {
        String input = "bc1qw508d6qejxtdg4y5r3zarvary0c5xw7kv8f3t4";
        assertEquals(input, LogSanitizer.sanitize(input));
    }
}
