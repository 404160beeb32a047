// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class DecodeResultTest {

    @Test
    void okMapsAndChains() {
        DecodeResult<Integer> result = DecodeResult.ok("abc").map(String::length);

        assertEquals(DecodeResult.ok(3), result);
        assertEquals(DecodeResult.ok(6), result.flatMap(n -> DecodeResult.ok(n * 2)));
        assertEquals(DecodeResult.err(DecodeError.TOO_SHORT),
                result.flatMap(n -> DecodeResult.err(DecodeError.TOO_SHORT)));
        assertTrue(result.isOk());
    }

    @Test
    void errShortCircuits() {
        DecodeResult<String> result = DecodeResult.err(DecodeError.CHECKSUM_MISMATCH);

        DecodeResult<Integer> mapped = result.map(s -> {
            throw new AssertionError("mapper must not run");
        });

        assertFalse(mapped.isOk());
        assertEquals(DecodeError.CHECKSUM_MISMATCH, ((DecodeResult.Err<Integer>) mapped).error());
    }

    @Test
    void orElseThrowUsesFactory() {
        DecodeResult<String> result = DecodeResult.err(DecodeError.MIXED_CASE);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> result.orElseThrow(err -> new IllegalStateException(err.name())));
        assertEquals("MIXED_CASE", e.getMessage());
        assertEquals("ok", DecodeResult.ok("ok").orElseThrow(err -> new IllegalStateException(err.name())));
    }

    @Test
    void rejectsNulls() {
        assertThrows(NullPointerException.class, () -> DecodeResult.ok(null));
        assertThrows(NullPointerException.class, () -> DecodeResult.err(null));
    }

    @Test
    void stagesAreOrdered() {
        assertTrue(DecodeError.INVALID_CHARACTER.stage().compareTo(DecodeError.MIXED_CASE.stage()) < 0);
        assertTrue(DecodeError.MIXED_CASE.stage().compareTo(DecodeError.CHECKSUM_MISMATCH.stage()) < 0);
        assertTrue(DecodeError.CHECKSUM_MISMATCH.stage().compareTo(DecodeError.UNKNOWN_VERSION.stage()) < 0);
        assertEquals(DecodeError.Stage.ALPHABET, DecodeError.NO_SEPARATOR.stage());
    }
}
