// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.crypto;

import java.util.Objects;

import org.bouncycastle.crypto.digests.RIPEMD160Digest;

/**
 * RIPEMD-160(SHA-256(x)), the 20-byte hash committed to by P2PKH, P2SH and P2WPKH.
 *
 * <p>
 * RIPEMD-160 comes from BouncyCastle; the JDK has no provider for it.
 *
 * @since 0.1.0
 */
public final class Hash160 {

    /** Output length in bytes. */
    public static final int LENGTH = 20;

    private Hash160() {
        // Utility class
    }

    /**
     * Computes RIPEMD-160(SHA-256(input)).
     *
     * @param input the data to hash (a serialized public key or script)
     * @return 20-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");
        return ripemd160(Sha256.hash(input));
    }

    static byte[] ripemd160(final byte[] input) {
        final RIPEMD160Digest digest = new RIPEMD160Digest();
        digest.update(input, 0, input.length);
        final byte[] out = new byte[LENGTH];
        digest.doFinal(out, 0);
        return out;
    }
}
