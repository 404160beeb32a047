// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.segwit;

import java.util.Arrays;
import java.util.Objects;

import sh.bitcheck.primitives.DecodeError;
import sh.bitcheck.primitives.DecodeResult;
import sh.bitcheck.primitives.bech32.BitGroups;

/**
 * Turns the 5-bit data groups of a segwit address into a {@link SegwitProgram}.
 *
 * <p>The caller strips the six checksum groups first. The first group is the
 * witness version; the rest are repacked into bytes with strict padding rules.
 *
 * @since 0.1.0
 */
public final class SegwitProgramExtractor {

    private SegwitProgramExtractor() {
        // Utility class
    }

    /**
     * @param dataGroups witness version group followed by the program groups
     * @return the program, or {@code INVALID_WITNESS_VERSION} (first group outside 0..16), {@code PADDING_ERROR}
     *         or {@code INVALID_PROGRAM_LENGTH}
     */
    public static DecodeResult<SegwitProgram> extract(final byte[] dataGroups) {
        Objects.requireNonNull(dataGroups, "dataGroups");
        if (dataGroups.length == 0) {
            return DecodeResult.err(DecodeError.INVALID_PROGRAM_LENGTH);
        }
        final int version = dataGroups[0];
        if (version < 0 || version > SegwitProgram.MAX_WITNESS_VERSION) {
            return DecodeResult.err(DecodeError.INVALID_WITNESS_VERSION);
        }
        return BitGroups.toBytes(Arrays.copyOfRange(dataGroups, 1, dataGroups.length))
                .flatMap(program -> toProgram(version, program));
    }

    private static DecodeResult<SegwitProgram> toProgram(final int version, final byte[] program) {
        if (!SegwitProgram.isValidLength(version, program.length)) {
            return DecodeResult.err(DecodeError.INVALID_PROGRAM_LENGTH);
        }
        return DecodeResult.ok(new SegwitProgram(version, program));
    }
}
