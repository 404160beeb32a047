// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.primitives.bech32;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class Bech32ChecksumTest {

    @Test
    void expandsPrefix() {
        // 'b' = 0x62 -> 3, 2 ; 'c' = 0x63 -> 3, 3
        assertArrayEquals(new byte[] {3, 3, 0, 2, 3}, Bech32Checksum.expandHrp("bc"));
    }

    @Test
    void createdChecksumVerifiesOnlyUnderItsVariant() {
        byte[] data = {0, 14, 20, 15, 7, 13, 26, 0, 25, 18, 6, 11, 13, 8, 21, 4};
        for (Bech32Variant variant : Bech32Variant.values()) {
            byte[] checksum = Bech32Checksum.create("bc", data, variant);
            byte[] values = concat(data, checksum);

            assertTrue(Bech32Checksum.verify("bc", values, variant));
            assertEquals(Optional.of(variant), Bech32Checksum.detect("bc", values));
        }
    }

    @Test
    @DisplayName("witness v0 data under the Bech32m constant does not verify as Bech32")
    void variantsAreNotInterchangeable() {
        byte[] v0 = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 17, 18, 19, 20, 21, 22, 23, 24, 25, 26, 27, 28, 29, 30, 31};
        byte[] asBech32m = concat(v0, Bech32Checksum.create("bc", v0, Bech32Variant.BECH32M));
        assertFalse(Bech32Checksum.verify("bc", asBech32m, Bech32Variant.BECH32));

        byte[] v1 = v0.clone();
        v1[0] = 1;
        byte[] asBech32 = concat(v1, Bech32Checksum.create("bc", v1, Bech32Variant.BECH32));
        assertFalse(Bech32Checksum.verify("bc", asBech32, Bech32Variant.BECH32M));
    }

    @Test
    void prefixIsCoveredByChecksum() {
        byte[] data = {1, 2, 3};
        byte[] values = concat(data, Bech32Checksum.create("bc", data, Bech32Variant.BECH32M));

        assertTrue(Bech32Checksum.verify("bc", values, Bech32Variant.BECH32M));
        assertFalse(Bech32Checksum.verify("tb", values, Bech32Variant.BECH32M));
        assertEquals(Optional.empty(), Bech32Checksum.detect("tb", values));
    }

    @Test
    void singleGroupChangeIsDetected() {
        byte[] data = {0, 3, 7, 31, 12, 0, 5};
        byte[] values = concat(data, Bech32Checksum.create("tb", data, Bech32Variant.BECH32));
        for (int i = 0; i < values.length; i++) {
            for (int delta = 1; delta < 32; delta++) {
                byte[] corrupted = values.clone();
                corrupted[i] = (byte) (corrupted[i] ^ delta);
                assertEquals(Optional.empty(), Bech32Checksum.detect("tb", corrupted), "position " + i);
            }
        }
    }

    @Test
    void constants() {
        assertEquals(1, Bech32Variant.BECH32.constant());
        assertEquals(0x2bc830a3, Bech32Variant.BECH32M.constant());
        assertEquals(Bech32Variant.BECH32, Bech32Variant.forWitnessVersion(0));
        assertEquals(Bech32Variant.BECH32M, Bech32Variant.forWitnessVersion(1));
        assertEquals(Bech32Variant.BECH32M, Bech32Variant.forWitnessVersion(16));
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
