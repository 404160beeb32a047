// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.primitives.bech32;

/**
 * The two Bech32 checksum variants.
 *
 * <p>Both share the alphabet, HRP expansion and generator polynomial. They
 * differ only in the constant the final polymod residue must equal.
 *
 * @see <a href="https://github.com/bitcoin/bips/blob/master/bip-0173.mediawiki">BIP-173</a>
 * @see <a href="https://github.com/bitcoin/bips/blob/master/bip-0350.mediawiki">BIP-350</a>
 * @since 0.1.0
 */
public enum Bech32Variant {

    /** BIP-173 checksum, used for witness version 0. */
    BECH32(1),

    /** BIP-350 checksum, used for witness versions 1 through 16. */
    BECH32M(0x2bc830a3);

    private final int constant;

    Bech32Variant(final int constant) {
        this.constant = constant;
    }

    /**
     * The value the polymod of a valid string must equal.
     */
    public int constant() {
        return constant;
    }

    /**
     * The variant a segwit address of the given witness version must use.
     *
     * @param witnessVersion witness version, 0..16
     * @return {@link #BECH32} for version 0, {@link #BECH32M} otherwise
     */
    public static Bech32Variant forWitnessVersion(final int witnessVersion) {
        return witnessVersion == 0 ? BECH32 : BECH32M;
    }
}
