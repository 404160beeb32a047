// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.primitives.bech32;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import sh.bitcheck.primitives.DecodeError;
import sh.bitcheck.primitives.DecodeResult;
import sh.bitcheck.primitives.Hex;

class BitGroupsTest {

    @Test
    void widensTwentyBytesToThirtyTwoGroups() {
        byte[] hash = Hex.decode("751e76e8199196d454941c45d1b3a323f1433bd6");

        byte[] groups = BitGroups.toGroups(hash);

        assertEquals(32, groups.length);
        // 0x75 = 01110 101.. -> first group 14
        assertEquals(14, groups[0]);
        assertArrayEquals(hash, BitGroups.toBytes(groups).orElseThrow(e -> new AssertionError(e)));
    }

    @Test
    void padsLastGroupWithZeros() {
        assertArrayEquals(new byte[] {31, 28}, BitGroups.toGroups(new byte[] {(byte) 0xFF}));
        assertArrayEquals(new byte[0], BitGroups.toGroups(new byte[0]));
    }

    @Test
    void acceptsShortZeroPadding() {
        assertArrayEquals(new byte[] {0}, BitGroups.toBytes(new byte[] {0, 0}).orElseThrow(e -> new AssertionError(e)));
        assertArrayEquals(new byte[] {(byte) 0xFF}, BitGroups.toBytes(new byte[] {31, 28}).orElseThrow(e -> new AssertionError(e)));
    }

    @Test
    void rejectsNonZeroPadding() {
        assertEquals(DecodeResult.err(DecodeError.PADDING_ERROR), BitGroups.toBytes(new byte[] {0, 1}));
        assertEquals(DecodeResult.err(DecodeError.PADDING_ERROR), BitGroups.toBytes(new byte[] {31, 29}));
    }

    @Test
    void rejectsFiveOrMorePaddingBits() {
        assertEquals(DecodeResult.err(DecodeError.PADDING_ERROR), BitGroups.toBytes(new byte[] {0}));
        assertEquals(DecodeResult.err(DecodeError.PADDING_ERROR), BitGroups.toBytes(new byte[] {0, 0, 0}));
    }

    @Test
    void rejectsValuesOutsideFiveBits() {
        assertThrows(IllegalArgumentException.class, () -> BitGroups.toBytes(new byte[] {32}));
    }
}
