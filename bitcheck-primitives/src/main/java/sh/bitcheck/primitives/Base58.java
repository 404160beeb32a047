// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.primitives;

import java.util.Arrays;
import java.util.Objects;

/**
 * Base58 codec using the Bitcoin alphabet.
 *
 * <p>
 * The alphabet omits {@code 0}, {@code O}, {@code I} and {@code l}. Each
 * leading {@code '1'} stands for one leading zero byte, which is how a
 * {@code 0x00} version byte survives encoding.
 *
 * <p>
 * Decoding never throws for malformed input: it returns a
 * {@link DecodeResult.Err} with {@link DecodeError#EMPTY} or
 * {@link DecodeError#INVALID_CHARACTER}.
 *
 * @since 0.1.0
 */
public final class Base58 {

    static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";

    private static final char ZERO_DIGIT = ALPHABET.charAt(0);
    private static final int[] INDEXES = new int[128];

    static {
        Arrays.fill(INDEXES, -1);
        for (int i = 0; i < ALPHABET.length(); i++) {
            INDEXES[ALPHABET.charAt(i)] = i;
        }
    }

    private Base58() {
        // Utility class
    }

    /**
     * Returns {@code true} if {@code c} belongs to the Bitcoin Base58 alphabet.
     */
    public static boolean isBase58Char(final char c) {
        return c < INDEXES.length && INDEXES[c] >= 0;
    }

    /**
     * Decodes a Base58 string into bytes.
     *
     * <p>The string is read as a big-endian base-58 number and accumulated by
     * multiply-add into a base-256 buffer sized for the worst case
     * ({@code log(58) / log(256)} bytes per character).
     *
     * @param input the Base58 text
     * @return the decoded bytes, or {@code EMPTY} / {@code INVALID_CHARACTER}
     * @throws NullPointerException if input is null
     */
    public static DecodeResult<byte[]> decode(final String input) {
        Objects.requireNonNull(input, "input");
        if (input.isEmpty()) {
            return DecodeResult.err(DecodeError.EMPTY);
        }

        int zeros = 0;
        while (zeros < input.length() && input.charAt(zeros) == ZERO_DIGIT) {
            zeros++;
        }

        final byte[] b256 = new byte[(input.length() - zeros) * 733 / 1000 + 1];
        int length = 0;
        for (int i = zeros; i < input.length(); i++) {
            final char c = input.charAt(i);
            if (!isBase58Char(c)) {
                return DecodeResult.err(DecodeError.INVALID_CHARACTER);
            }
            int carry = INDEXES[c];
            int j = 0;
            for (int k = b256.length - 1; (carry != 0 || j < length) && k >= 0; k--, j++) {
                carry += 58 * (b256[k] & 0xFF);
                b256[k] = (byte) (carry & 0xFF);
                carry >>>= 8;
            }
            length = j;
        }

        int start = b256.length - length;
        while (start < b256.length && b256[start] == 0) {
            start++;
        }

        final byte[] result = new byte[zeros + (b256.length - start)];
        System.arraycopy(b256, start, result, zeros, b256.length - start);
        return DecodeResult.ok(result);
    }

    /**
     * Encodes bytes as Base58, emitting one {@code '1'} per leading zero byte.
     *
     * @param input bytes to encode; an empty array encodes to the empty string
     * @return Base58 text
     * @throws NullPointerException if input is null
     */
    public static String encode(final byte[] input) {
        Objects.requireNonNull(input, "input");

        int zeros = 0;
        while (zeros < input.length && input[zeros] == 0) {
            zeros++;
        }

        final byte[] b58 = new byte[(input.length - zeros) * 138 / 100 + 1];
        int length = 0;
        for (int i = zeros; i < input.length; i++) {
            int carry = input[i] & 0xFF;
            int j = 0;
            for (int k = b58.length - 1; (carry != 0 || j < length) && k >= 0; k--, j++) {
                carry += 256 * (b58[k] & 0xFF);
                b58[k] = (byte) (carry % 58);
                carry /= 58;
            }
            length = j;
        }

        int start = b58.length - length;
        while (start < b58.length && b58[start] == 0) {
            start++;
        }

        final StringBuilder sb = new StringBuilder(zeros + b58.length - start);
        for (int i = 0; i < zeros; i++) {
            sb.append(ZERO_DIGIT);
        }
        for (int i = start; i < b58.length; i++) {
            sb.append(ALPHABET.charAt(b58[i]));
        }
        return sb.toString();
    }
}
