// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import sh.bitcheck.primitives.Hex;

/**
 * Tests for Sha256 hashing against known test vectors.
 */
class Sha256Test {

    @Test
    void testEmptyString() {
        final byte[] hash = Sha256.hash(new byte[0]);

        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", Hex.encode(hash));
    }

    @Test
    void testAbc() {
        // NIST test vector
        final byte[] hash = Sha256.hash("abc".getBytes(StandardCharsets.UTF_8));

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", Hex.encode(hash));
    }

    @Test
    void testHelloWorld() {
        final byte[] hash = Sha256.hash("hello world".getBytes(StandardCharsets.UTF_8));

        assertEquals("b94d27b9934d3e08a52e52d7da7dabfac484efe37a5380ee9088f7ace2efcde9", Hex.encode(hash));
    }

    @Test
    void testDoubleHashOfEmptyInput() {
        final byte[] hash = Sha256.doubleHash(new byte[0]);

        assertEquals("5df6e0e2761359d30a8275058e299fcc0381534545f55cf43e41983f5d4c9456", Hex.encode(hash));
    }

    @Test
    void testDoubleHashIsHashOfHash() {
        final byte[] input = "double".getBytes(StandardCharsets.UTF_8);

        assertArrayEquals(Sha256.hash(Sha256.hash(input)), Sha256.doubleHash(input));
    }

    @Test
    void testChecksumIsPrefixOfDoubleHash() {
        final byte[] input = Hex.decode("0062e907b15cbf27d5425399ebf6f0fb50ebb88f18");

        final byte[] checksum = Sha256.checksum(input);

        assertEquals(Sha256.CHECKSUM_LENGTH, checksum.length);
        assertArrayEquals(Arrays.copyOf(Sha256.doubleHash(input), 4), checksum);
    }

    @Test
    void testNullInput() {
        assertThrows(NullPointerException.class, () -> Sha256.hash(null));
        assertThrows(NullPointerException.class, () -> Sha256.doubleHash(null));
        assertThrows(NullPointerException.class, () -> Sha256.checksum(null));
    }

    @Test
    void testCleanupAllowsSubsequentHashing() {
        final byte[] input = "cleanup test".getBytes(StandardCharsets.UTF_8);
        final byte[] hashBefore = Sha256.hash(input);

        assertDoesNotThrow(Sha256::cleanup);

        assertArrayEquals(hashBefore, Sha256.hash(input), "Hash should be same after cleanup");
    }

    @Test
    void testCleanupIdempotent() {
        assertDoesNotThrow(() -> {
            Sha256.cleanup();
            Sha256.cleanup();
        });
    }
}
