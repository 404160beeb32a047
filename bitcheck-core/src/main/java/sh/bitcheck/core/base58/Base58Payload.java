// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.base58;

import java.util.Arrays;
import java.util.Objects;

import sh.bitcheck.primitives.Hex;

/**
 * A Base58Check string split into version byte, payload and checksum.
 *
 * @param version  leading version byte, 0..255
 * @param hash     bytes between the version and the checksum
 * @param checksum trailing four checksum bytes
 * @since 0.1.0
 */
public record Base58Payload(int version, byte[] hash, byte[] checksum) {

    /** Payload length of P2PKH and P2SH addresses. */
    public static final int HASH_LENGTH = 20;

    public Base58Payload {
        if (version < 0 || version > 0xFF) {
            throw new IllegalArgumentException("version must be 0..255, got " + version);
        }
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(checksum, "checksum");
        if (checksum.length != 4) {
            throw new IllegalArgumentException("checksum must be 4 bytes, got " + checksum.length);
        }
        hash = hash.clone();
        checksum = checksum.clone();
    }

    @Override
    public byte[] hash() {
        return hash.clone();
    }

    @Override
    public byte[] checksum() {
        return checksum.clone();
    }

    /**
     * Whether the payload has the 20-byte length of a standard address hash.
     */
    public boolean hasStandardLength() {
        return hash.length == HASH_LENGTH;
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof Base58Payload other
                && version == other.version
                && Arrays.equals(hash, other.hash)
                && Arrays.equals(checksum, other.checksum);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * version + Arrays.hashCode(hash)) + Arrays.hashCode(checksum);
    }

    @Override
    public String toString() {
        return "Base58Payload[version=" + version + ", hash=" + Hex.encode(hash) + "]";
    }
}
