// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.primitives;

/**
 * Machine-readable reason a decode step rejected its input.
 *
 * <p>
 * Every reason belongs to a {@link Stage} that records how far decoding got
 * before failing. Callers that run several decoders over the same input use
 * the stage to pick the most informative reason.
 *
 * @since 0.1.0
 */
public enum DecodeError {

    EMPTY(Stage.INPUT, "input is empty"),
    TOO_SHORT(Stage.SHAPE, "input or decoded data is too short"),
    TOO_LONG(Stage.SHAPE, "input or decoded data is too long"),
    INVALID_CHARACTER(Stage.ALPHABET, "character outside the encoding alphabet"),
    MIXED_CASE(Stage.SHAPE, "bech32 string mixes upper and lower case"),
    NO_SEPARATOR(Stage.ALPHABET, "bech32 separator '1' is missing"),
    CHECKSUM_MISMATCH(Stage.CHECKSUM, "checksum does not match"),
    UNKNOWN_VERSION(Stage.SEMANTIC, "version byte is not a recognized address type"),
    UNKNOWN_PREFIX(Stage.SEMANTIC, "human-readable prefix belongs to no enabled network"),
    UNSUPPORTED_WITNESS_VERSION(Stage.SEMANTIC, "witness version has no assigned address type"),
    INVALID_WITNESS_VERSION(Stage.SEMANTIC, "witness version is greater than 16"),
    INVALID_PROGRAM_LENGTH(Stage.SEMANTIC, "witness program length is invalid for its version"),
    PADDING_ERROR(Stage.SEMANTIC, "non-zero or excess padding bits in witness program"),
    NOT_RECOGNIZED(Stage.INPUT, "input is neither a Base58Check nor a Bech32 address");

    /**
     * How far a decoder progressed before producing an error. Later stages
     * compare greater.
     */
    public enum Stage {
        /** Nothing could be read from the input at all. */
        INPUT,
        /** The input is not written in this encoding's alphabet. */
        ALPHABET,
        /** The alphabet matched but the shape (length, case) is wrong. */
        SHAPE,
        /** Structurally sound, checksum failed. */
        CHECKSUM,
        /** Checksum passed, the content is not an acceptable address. */
        SEMANTIC
    }

    private final Stage stage;
    private final String description;

    DecodeError(final Stage stage, final String description) {
        this.stage = stage;
        this.description = description;
    }

    public Stage stage() {
        return stage;
    }

    public String description() {
        return description;
    }
}
