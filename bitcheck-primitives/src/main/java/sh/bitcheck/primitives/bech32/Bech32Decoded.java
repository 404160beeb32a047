// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.primitives.bech32;

import java.util.Arrays;
import java.util.Objects;

/**
 * A Bech32 string split into its parts. The checksum has not been verified yet.
 *
 * @param hrp      human-readable prefix, lowercased
 * @param data     5-bit data groups between the separator and the checksum
 * @param checksum the six trailing 5-bit checksum groups
 * @since 0.1.0
 */
public record Bech32Decoded(String hrp, byte[] data, byte[] checksum) {

    public Bech32Decoded {
        Objects.requireNonNull(hrp, "hrp");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(checksum, "checksum");
        if (checksum.length != Bech32Checksum.CHECKSUM_LENGTH) {
            throw new IllegalArgumentException(
                    "checksum must be " + Bech32Checksum.CHECKSUM_LENGTH + " groups, got " + checksum.length);
        }
        data = data.clone();
        checksum = checksum.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public byte[] checksum() {
        return checksum.clone();
    }

    /**
     * Data groups followed by checksum groups, the input the checksum engine expects.
     */
    public byte[] values() {
        final byte[] values = Arrays.copyOf(data, data.length + checksum.length);
        System.arraycopy(checksum, 0, values, data.length, checksum.length);
        return values;
    }

    /**
     * Verifies the checksum under {@code variant}.
     */
    public boolean verify(final Bech32Variant variant) {
        return Bech32Checksum.verify(hrp, values(), variant);
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof Bech32Decoded other
                && hrp.equals(other.hrp)
                && Arrays.equals(data, other.data)
                && Arrays.equals(checksum, other.checksum);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * hrp.hashCode() + Arrays.hashCode(data)) + Arrays.hashCode(checksum);
    }

    @Override
    public String toString() {
        return "Bech32Decoded[hrp=" + hrp + ", groups=" + data.length + "]";
    }
}
