// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.primitives.bech32;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

import sh.bitcheck.primitives.DecodeError;
import sh.bitcheck.primitives.DecodeResult;

/**
 * Regroups bit strings between 8-bit bytes and 5-bit Bech32 groups.
 *
 * <p>Widening to 5-bit groups pads the last group with zero bits. Narrowing
 * back to bytes is strict: a final incomplete group must be shorter than five
 * bits and all zero, otherwise the input is rejected with
 * {@link DecodeError#PADDING_ERROR}.
 *
 * @since 0.1.0
 */
public final class BitGroups {

    private BitGroups() {
        // Utility class
    }

    /**
     * Splits bytes into 5-bit groups, zero-padding the last group.
     */
    public static byte[] toGroups(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        final ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length * 8 / 5 + 1);
        int acc = 0;
        int bits = 0;
        for (byte b : bytes) {
            acc = ((acc << 8) | (b & 0xFF)) & 0xFFF;
            bits += 8;
            while (bits >= 5) {
                bits -= 5;
                out.write((acc >>> bits) & 31);
            }
        }
        if (bits > 0) {
            out.write((acc << (5 - bits)) & 31);
        }
        return out.toByteArray();
    }

    /**
     * Packs 5-bit groups back into bytes.
     *
     * @param groups 5-bit values
     * @return the bytes, or {@code PADDING_ERROR} when leftover bits are too many or non-zero
     */
    public static DecodeResult<byte[]> toBytes(final byte[] groups) {
        Objects.requireNonNull(groups, "groups");
        final ByteArrayOutputStream out = new ByteArrayOutputStream(groups.length * 5 / 8);
        int acc = 0;
        int bits = 0;
        for (byte g : groups) {
            if (g < 0 || g > 31) {
                throw new IllegalArgumentException("group value out of 5-bit range: " + g);
            }
            acc = ((acc << 5) | g) & 0xFFF;
            bits += 5;
            while (bits >= 8) {
                bits -= 8;
                out.write((acc >>> bits) & 0xFF);
            }
        }
        if (bits >= 5 || ((acc << (8 - bits)) & 0xFF) != 0) {
            return DecodeResult.err(DecodeError.PADDING_ERROR);
        }
        return DecodeResult.ok(out.toByteArray());
    }
}
