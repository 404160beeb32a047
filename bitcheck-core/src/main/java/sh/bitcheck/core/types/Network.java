// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.types;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bitcoin networks and the prefixes that identify their addresses.
 *
 * <p>
 * Testnet and regtest share Base58 version bytes; only their Bech32 prefixes
 * differ. Lookups by version byte return the first matching constant in
 * declaration order.
 *
 * @since 0.1.0
 */
public enum Network {

    MAINNET("bc", 0x00, 0x05),
    TESTNET("tb", 0x6f, 0xc4),
    REGTEST("bcrt", 0x6f, 0xc4);

    private final String hrp;
    private final int p2pkhVersion;
    private final int p2shVersion;

    Network(final String hrp, final int p2pkhVersion, final int p2shVersion) {
        this.hrp = hrp;
        this.p2pkhVersion = p2pkhVersion;
        this.p2shVersion = p2shVersion;
    }

    /** Lowercase Bech32 human-readable prefix. */
    public String hrp() {
        return hrp;
    }

    /** Base58Check version byte of P2PKH addresses. */
    public int p2pkhVersion() {
        return p2pkhVersion;
    }

    /** Base58Check version byte of P2SH addresses. */
    public int p2shVersion() {
        return p2shVersion;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Finds the network whose Bech32 prefix equals {@code hrp}, ignoring case.
     */
    public static Optional<Network> fromHrp(final String hrp) {
        if (hrp == null) {
            return Optional.empty();
        }
        final String lower = hrp.toLowerCase(Locale.ROOT);
        for (Network network : values()) {
            if (network.hrp.equals(lower)) {
                return Optional.of(network);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds a network by its {@link #id()} ({@code mainnet}, {@code testnet}, {@code regtest}).
     */
    public static Optional<Network> fromId(final String id) {
        if (id == null) {
            return Optional.empty();
        }
        final String trimmed = id.trim();
        for (Network network : values()) {
            if (network.id().equalsIgnoreCase(trimmed)) {
                return Optional.of(network);
            }
        }
        return Optional.empty();
    }
}
