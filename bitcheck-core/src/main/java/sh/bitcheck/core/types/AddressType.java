// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.types;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The address schemes a string can be classified as.
 *
 * <p>{@link #INVALID} is a regular outcome, always paired with a reason on
 * {@link DecodedAddress#reason()}.
 *
 * @since 0.1.0
 */
public enum AddressType {

    /** Pay-to-public-key-hash, Base58Check. */
    P2PKH("p2pkh"),

    /** Pay-to-script-hash, Base58Check. */
    P2SH("p2sh"),

    /** Native segwit witness version 0 (P2WPKH or P2WSH), Bech32. */
    SEGWIT_V0("segwit_v0"),

    /** Witness version 1 with a 32-byte output key, Bech32m. */
    TAPROOT("taproot"),

    INVALID("invalid");

    private final String label;

    AddressType(final String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Whether addresses of this type are written in Bech32/Bech32m.
     */
    public boolean isSegwit() {
        return switch (this) {
            case SEGWIT_V0, TAPROOT -> true;
            case P2PKH, P2SH, INVALID -> false;
        };
    }
}
