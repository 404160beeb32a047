// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import sh.bitcheck.primitives.DecodeError;
import sh.bitcheck.primitives.DecodeResult;

class AddressFormatExceptionTest {

    @Test
    void messageNamesReason() {
        AddressFormatException e = new AddressFormatException(DecodeError.PADDING_ERROR);

        assertEquals(DecodeError.PADDING_ERROR, e.reason());
        assertEquals("PADDING_ERROR: " + DecodeError.PADDING_ERROR.description(), e.getMessage());
    }

    @Test
    void bridgesFromDecodeResult() {
        DecodeResult<String> result = DecodeResult.err(DecodeError.UNKNOWN_VERSION);

        AddressFormatException e = assertThrows(AddressFormatException.class,
                () -> result.orElseThrow(AddressFormatException::new));

        assertEquals(DecodeError.UNKNOWN_VERSION, e.reason());
    }

    @Test
    void allExceptionsShareTheBase() {
        assertInstanceOf(BitcheckException.class, new AddressFormatException(DecodeError.EMPTY));
        assertInstanceOf(BitcheckException.class, new PublicKeyException("bad key"));
        assertInstanceOf(RuntimeException.class, new PublicKeyException("bad key", new IllegalArgumentException()));
    }

    @Test
    void rejectsNullReason() {
        assertThrows(NullPointerException.class, () -> new AddressFormatException(null));
    }
}
