// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.segwit;

import java.util.Arrays;
import java.util.Objects;

import sh.bitcheck.primitives.Hex;
import sh.bitcheck.primitives.bech32.BitGroups;
import sh.bitcheck.primitives.bech32.Bech32;
import sh.bitcheck.primitives.bech32.Bech32Variant;

/**
 * A witness version and witness program, the content of a native segwit address.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Witness version is 0..16</li>
 * <li>Program is 2..40 bytes</li>
 * <li>Version 0 programs are exactly 20 (P2WPKH) or 32 (P2WSH) bytes</li>
 * </ul>
 *
 * @param witnessVersion witness version, 0..16
 * @param program        witness program bytes
 * @since 0.1.0
 */
public record SegwitProgram(int witnessVersion, byte[] program) {

    public static final int MAX_WITNESS_VERSION = 16;
    public static final int MIN_PROGRAM_LENGTH = 2;
    public static final int MAX_PROGRAM_LENGTH = 40;

    /** Output key length of a taproot (v1) program. */
    public static final int TAPROOT_PROGRAM_LENGTH = 32;

    public SegwitProgram {
        Objects.requireNonNull(program, "program");
        if (witnessVersion < 0 || witnessVersion > MAX_WITNESS_VERSION) {
            throw new IllegalArgumentException("witness version must be 0..16, got " + witnessVersion);
        }
        if (!isValidLength(witnessVersion, program.length)) {
            throw new IllegalArgumentException(
                    "invalid program length " + program.length + " for witness version " + witnessVersion);
        }
        program = program.clone();
    }

    /**
     * Whether a program of {@code length} bytes is allowed for {@code witnessVersion}.
     */
    public static boolean isValidLength(final int witnessVersion, final int length) {
        if (length < MIN_PROGRAM_LENGTH || length > MAX_PROGRAM_LENGTH) {
            return false;
        }
        return witnessVersion != 0 || length == 20 || length == 32;
    }

    @Override
    public byte[] program() {
        return program.clone();
    }

    public int length() {
        return program.length;
    }

    /**
     * Whether this is a version 1 program with a 32-byte output key.
     */
    public boolean isTaproot() {
        return witnessVersion == 1 && program.length == TAPROOT_PROGRAM_LENGTH;
    }

    /**
     * Encodes this program as an address, Bech32 for version 0 and Bech32m otherwise.
     *
     * @param hrp human-readable prefix, e.g. {@code "bc"}
     * @return lowercase address
     */
    public String encode(final String hrp) {
        final byte[] groups = BitGroups.toGroups(program);
        final byte[] data = new byte[groups.length + 1];
        data[0] = (byte) witnessVersion;
        System.arraycopy(groups, 0, data, 1, groups.length);
        return Bech32.encode(hrp, data, Bech32Variant.forWitnessVersion(witnessVersion));
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof SegwitProgram other
                && witnessVersion == other.witnessVersion
                && Arrays.equals(program, other.program);
    }

    @Override
    public int hashCode() {
        return 31 * witnessVersion + Arrays.hashCode(program);
    }

    @Override
    public String toString() {
        return "SegwitProgram[v" + witnessVersion + ", " + Hex.encode(program) + "]";
    }
}
