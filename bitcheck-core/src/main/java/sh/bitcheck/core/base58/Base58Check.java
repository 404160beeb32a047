// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.base58;

import java.security.MessageDigest;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import sh.bitcheck.core.crypto.Sha256;
import sh.bitcheck.core.types.AddressType;
import sh.bitcheck.core.types.DecodedAddress;
import sh.bitcheck.core.types.Network;
import sh.bitcheck.primitives.Base58;
import sh.bitcheck.primitives.DecodeError;
import sh.bitcheck.primitives.DecodeResult;

/**
 * Base58Check: a version byte and payload followed by the first four bytes
 * of their double SHA-256.
 *
 * <p>
 * {@link #decode(String)} checks only the envelope (alphabet, length,
 * checksum). {@link #validate(String, Set)} additionally maps the version
 * byte to an {@link AddressType} for the given networks and requires the
 * 20-byte hash length of P2PKH and P2SH.
 *
 * <pre>{@code
 * DecodeResult<DecodedAddress> result = Base58Check.validate("1A1zP1eP5QGefi2DMPTfTL5SLmv7DivfNa");
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Base58Check {

    /** Version byte plus checksum; anything shorter cannot be Base58Check. */
    private static final int MIN_DECODED_LENGTH = 1 + Sha256.CHECKSUM_LENGTH;

    private static final Set<Network> MAINNET_ONLY = EnumSet.of(Network.MAINNET);

    private Base58Check() {
        // Utility class
    }

    /**
     * Decodes and verifies the checksum, without interpreting the version byte.
     *
     * @param input Base58Check text
     * @return the split payload, or {@code EMPTY}, {@code INVALID_CHARACTER},
     *         {@code TOO_SHORT} or {@code CHECKSUM_MISMATCH}
     */
    public static DecodeResult<Base58Payload> decode(final String input) {
        return Base58.decode(input).flatMap(Base58Check::split);
    }

    /**
     * Validates a mainnet P2PKH ({@code 0x00}) or P2SH ({@code 0x05}) address.
     *
     * @param input candidate address
     * @return the decoded address, or the first error; any other version byte is {@code UNKNOWN_VERSION}
     */
    public static DecodeResult<DecodedAddress> validate(final String input) {
        return validate(input, MAINNET_ONLY);
    }

    /**
     * Validates a P2PKH or P2SH address of any of the given networks.
     *
     * @param input    candidate address
     * @param networks networks whose version bytes are accepted
     * @return the decoded address, or the first error
     */
    public static DecodeResult<DecodedAddress> validate(final String input, final Set<Network> networks) {
        Objects.requireNonNull(networks, "networks");
        return decode(input).flatMap(payload -> interpret(payload, networks));
    }

    /**
     * Encodes {@code version || payload || checksum} as Base58.
     *
     * @param version version byte, 0..255
     * @param payload payload bytes, usually a 20-byte hash
     * @return Base58Check text
     */
    public static String encode(final int version, final byte[] payload) {
        if (version < 0 || version > 0xFF) {
            throw new IllegalArgumentException("version must be 0..255, got " + version);
        }
        Objects.requireNonNull(payload, "payload");

        final byte[] versioned = new byte[1 + payload.length];
        versioned[0] = (byte) version;
        System.arraycopy(payload, 0, versioned, 1, payload.length);

        final byte[] checksum = Sha256.checksum(versioned);
        final byte[] full = Arrays.copyOf(versioned, versioned.length + checksum.length);
        System.arraycopy(checksum, 0, full, versioned.length, checksum.length);
        return Base58.encode(full);
    }

    private static DecodeResult<Base58Payload> split(final byte[] decoded) {
        if (decoded.length < MIN_DECODED_LENGTH) {
            return DecodeResult.err(DecodeError.TOO_SHORT);
        }
        final int bodyLength = decoded.length - Sha256.CHECKSUM_LENGTH;
        final byte[] versioned = Arrays.copyOf(decoded, bodyLength);
        final byte[] checksum = Arrays.copyOfRange(decoded, bodyLength, decoded.length);

        if (!MessageDigest.isEqual(checksum, Sha256.checksum(versioned))) {
            return DecodeResult.err(DecodeError.CHECKSUM_MISMATCH);
        }
        return DecodeResult.ok(new Base58Payload(
                versioned[0] & 0xFF,
                Arrays.copyOfRange(versioned, 1, versioned.length),
                checksum));
    }

    private static DecodeResult<DecodedAddress> interpret(final Base58Payload payload, final Set<Network> networks) {
        for (Network network : Network.values()) {
            if (!networks.contains(network)) {
                continue;
            }
            final AddressType type;
            if (payload.version() == network.p2pkhVersion()) {
                type = AddressType.P2PKH;
            } else if (payload.version() == network.p2shVersion()) {
                type = AddressType.P2SH;
            } else {
                continue;
            }
            final byte[] hash = payload.hash();
            if (!payload.hasStandardLength()) {
                return DecodeResult.err(
                        hash.length < Base58Payload.HASH_LENGTH ? DecodeError.TOO_SHORT : DecodeError.TOO_LONG);
            }
            return DecodeResult.ok(DecodedAddress.valid(type, payload.version(), hash, network));
        }
        return DecodeResult.err(DecodeError.UNKNOWN_VERSION);
    }
}
