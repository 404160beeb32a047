// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.primitives.bech32;

import java.util.Objects;
import java.util.Optional;

/**
 * BCH checksum over GF(32) shared by Bech32 and Bech32m.
 *
 * <p>
 * The human-readable prefix is expanded into 5-bit values (high three bits
 * of every character, a zero, then the low five bits of every character),
 * followed by the data groups, and run through {@link #polymod(byte[], byte[])}.
 * A string is valid for a {@link Bech32Variant} iff the residue equals that
 * variant's constant. A residue matching the other variant's constant is a
 * failure, not a fallback.
 *
 * @since 0.1.0
 */
public final class Bech32Checksum {

    /** Number of 5-bit checksum groups at the end of every Bech32 string. */
    public static final int CHECKSUM_LENGTH = 6;

    private static final int[] GENERATORS = {
            0x3b6a57b2, 0x26508e6d, 0x1ea119fa, 0x3d4233dd, 0x2a1462b3
    };

    private Bech32Checksum() {
        // Utility class
    }

    /**
     * Checks the checksum of {@code values} (data followed by the six checksum groups).
     *
     * @param hrp     lowercase human-readable prefix
     * @param values  5-bit data groups including the trailing checksum
     * @param variant the variant the checksum must satisfy
     * @return {@code true} iff the residue equals {@code variant.constant()}
     */
    public static boolean verify(final String hrp, final byte[] values, final Bech32Variant variant) {
        Objects.requireNonNull(variant, "variant");
        return polymod(expandHrp(hrp), values) == variant.constant();
    }

    /**
     * Reports which variant, if any, the checksum satisfies.
     *
     * <p>The two constants are distinct, so at most one variant can match.
     */
    public static Optional<Bech32Variant> detect(final String hrp, final byte[] values) {
        final int residue = polymod(expandHrp(hrp), values);
        for (Bech32Variant variant : Bech32Variant.values()) {
            if (residue == variant.constant()) {
                return Optional.of(variant);
            }
        }
        return Optional.empty();
    }

    /**
     * Computes the six checksum groups for {@code data} under {@code variant}.
     *
     * @param hrp     lowercase human-readable prefix
     * @param data    5-bit data groups, without checksum
     * @param variant checksum variant
     * @return six 5-bit groups
     */
    public static byte[] create(final String hrp, final byte[] data, final Bech32Variant variant) {
        Objects.requireNonNull(variant, "variant");
        final byte[] padded = new byte[data.length + CHECKSUM_LENGTH];
        System.arraycopy(data, 0, padded, 0, data.length);

        final int mod = polymod(expandHrp(hrp), padded) ^ variant.constant();
        final byte[] checksum = new byte[CHECKSUM_LENGTH];
        for (int i = 0; i < CHECKSUM_LENGTH; i++) {
            checksum[i] = (byte) ((mod >>> (5 * (5 - i))) & 31);
        }
        return checksum;
    }

    /**
     * Expands the prefix into the 5-bit values that precede the data in the checksum.
     *
     * @param hrp lowercase human-readable prefix
     * @return {@code 2 * hrp.length() + 1} values
     */
    static byte[] expandHrp(final String hrp) {
        Objects.requireNonNull(hrp, "hrp");
        final int len = hrp.length();
        final byte[] expanded = new byte[len * 2 + 1];
        for (int i = 0; i < len; i++) {
            final int c = hrp.charAt(i) & 0x7F;
            expanded[i] = (byte) (c >>> 5);
            expanded[len + 1 + i] = (byte) (c & 31);
        }
        return expanded;
    }

    /**
     * Runs the generator polynomial over both arrays in sequence, starting from 1.
     */
    static int polymod(final byte[] expandedHrp, final byte[] values) {
        Objects.requireNonNull(values, "values");
        int chk = 1;
        chk = mix(chk, expandedHrp);
        chk = mix(chk, values);
        return chk;
    }

    private static int mix(int chk, final byte[] values) {
        for (byte value : values) {
            final int top = chk >>> 25;
            chk = ((chk & 0x1ffffff) << 5) ^ (value & 31);
            for (int i = 0; i < GENERATORS.length; i++) {
                if (((top >>> i) & 1) == 1) {
                    chk ^= GENERATORS[i];
                }
            }
        }
        return chk;
    }
}
