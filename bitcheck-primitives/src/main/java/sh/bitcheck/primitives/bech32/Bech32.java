// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.primitives.bech32;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

import sh.bitcheck.primitives.DecodeError;
import sh.bitcheck.primitives.DecodeResult;

/**
 * Bech32 string codec (BIP-173 layout, shared by Bech32m).
 *
 * <p>
 * A string is {@code hrp + '1' + data + checksum}. The separator is the
 * <em>last</em> {@code '1'}: the prefix may itself contain {@code '1'}, the data
 * alphabet never does.
 *
 * <p>
 * {@link #decode(String)} only checks structure and maps characters to 5-bit
 * values. Checksum verification is left to the caller because the variant
 * depends on what the data means.
 *
 * @since 0.1.0
 */
public final class Bech32 {

    /** Data alphabet; the index of a character is its 5-bit value. */
    public static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";

    public static final char SEPARATOR = '1';

    public static final int MAX_LENGTH = 90;
    public static final int MAX_HRP_LENGTH = 83;

    private static final int[] CHARSET_REV = new int[128];

    static {
        Arrays.fill(CHARSET_REV, -1);
        for (int i = 0; i < CHARSET.length(); i++) {
            final char c = CHARSET.charAt(i);
            CHARSET_REV[c] = i;
            CHARSET_REV[Character.toUpperCase(c)] = i;
        }
    }

    private Bech32() {
        // Utility class
    }

    /**
     * Splits a Bech32 string into prefix, data groups and checksum groups.
     *
     * <p>Checks, in order: printable ASCII ({@code INVALID_CHARACTER}), overall
     * length ({@code TOO_LONG}), separator ({@code NO_SEPARATOR}), prefix length
     * ({@code TOO_SHORT}/{@code TOO_LONG}), room for the checksum
     * ({@code TOO_SHORT}), data alphabet ({@code INVALID_CHARACTER}) and finally
     * single case ({@code MIXED_CASE}).
     *
     * @param input the candidate string
     * @return the decoded parts or the first structural error
     * @throws NullPointerException if input is null
     */
    public static DecodeResult<Bech32Decoded> decode(final String input) {
        Objects.requireNonNull(input, "input");
        if (input.isEmpty()) {
            return DecodeResult.err(DecodeError.TOO_SHORT);
        }

        boolean lower = false;
        boolean upper = false;
        for (int i = 0; i < input.length(); i++) {
            final char c = input.charAt(i);
            if (c < 33 || c > 126) {
                return DecodeResult.err(DecodeError.INVALID_CHARACTER);
            }
            if (c >= 'a' && c <= 'z') {
                lower = true;
            } else if (c >= 'A' && c <= 'Z') {
                upper = true;
            }
        }
        if (input.length() > MAX_LENGTH) {
            return DecodeResult.err(DecodeError.TOO_LONG);
        }

        final int pos = input.lastIndexOf(SEPARATOR);
        if (pos < 0) {
            return DecodeResult.err(DecodeError.NO_SEPARATOR);
        }
        if (pos == 0) {
            return DecodeResult.err(DecodeError.TOO_SHORT);
        }
        if (pos > MAX_HRP_LENGTH) {
            return DecodeResult.err(DecodeError.TOO_LONG);
        }
        final int dataLength = input.length() - pos - 1;
        if (dataLength < Bech32Checksum.CHECKSUM_LENGTH) {
            return DecodeResult.err(DecodeError.TOO_SHORT);
        }

        final byte[] values = new byte[dataLength];
        for (int i = 0; i < dataLength; i++) {
            final int v = CHARSET_REV[input.charAt(pos + 1 + i)];
            if (v < 0) {
                return DecodeResult.err(DecodeError.INVALID_CHARACTER);
            }
            values[i] = (byte) v;
        }
        if (lower && upper) {
            return DecodeResult.err(DecodeError.MIXED_CASE);
        }

        final String hrp = input.substring(0, pos).toLowerCase(Locale.ROOT);
        final int split = dataLength - Bech32Checksum.CHECKSUM_LENGTH;
        return DecodeResult.ok(new Bech32Decoded(
                hrp,
                Arrays.copyOfRange(values, 0, split),
                Arrays.copyOfRange(values, split, dataLength)));
    }

    /**
     * Builds a lowercase Bech32 string, appending the checksum for {@code variant}.
     *
     * @param hrp     human-readable prefix (1..83 printable ASCII characters)
     * @param data    5-bit data groups, each 0..31
     * @param variant checksum variant
     * @return the encoded string
     * @throws IllegalArgumentException if the prefix or data is out of range, or
     *                                  the result would exceed {@value #MAX_LENGTH} characters
     */
    public static String encode(final String hrp, final byte[] data, final Bech32Variant variant) {
        Objects.requireNonNull(hrp, "hrp");
        Objects.requireNonNull(data, "data");
        if (hrp.isEmpty() || hrp.length() > MAX_HRP_LENGTH) {
            throw new IllegalArgumentException("hrp length must be 1.." + MAX_HRP_LENGTH + ", got " + hrp.length());
        }
        for (int i = 0; i < hrp.length(); i++) {
            final char c = hrp.charAt(i);
            if (c < 33 || c > 126) {
                throw new IllegalArgumentException("hrp contains a non-printable character at index " + i);
            }
        }
        final int length = hrp.length() + 1 + data.length + Bech32Checksum.CHECKSUM_LENGTH;
        if (length > MAX_LENGTH) {
            throw new IllegalArgumentException("encoded length " + length + " exceeds " + MAX_LENGTH);
        }

        final String lowerHrp = hrp.toLowerCase(Locale.ROOT);
        final byte[] checksum = Bech32Checksum.create(lowerHrp, data, variant);
        final StringBuilder sb = new StringBuilder(length).append(lowerHrp).append(SEPARATOR);
        for (byte value : data) {
            if (value < 0 || value > 31) {
                throw new IllegalArgumentException("data value out of 5-bit range: " + value);
            }
            sb.append(CHARSET.charAt(value));
        }
        for (byte value : checksum) {
            sb.append(CHARSET.charAt(value));
        }
        return sb.toString();
    }
}
