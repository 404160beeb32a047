// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.generate;

import java.util.Objects;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.math.ec.ECPoint;

import sh.bitcheck.core.base58.Base58Check;
import sh.bitcheck.core.crypto.Hash160;
import sh.bitcheck.core.crypto.Sha256;
import sh.bitcheck.core.error.PublicKeyException;
import sh.bitcheck.core.segwit.SegwitProgram;
import sh.bitcheck.core.types.DecodedAddress;
import sh.bitcheck.core.types.Network;

/**
 * Builds addresses from public keys and scripts.
 *
 * <p>
 * Public keys are checked to be points on secp256k1 before they are hashed.
 * P2PKH accepts compressed (33-byte) and uncompressed (65-byte) keys; the
 * segwit forms accept compressed keys only. Taproot takes a 32-byte x-only
 * output key, which must also be the x coordinate of a curve point.
 *
 * <pre>{@code
 * String legacy = AddressFactory.p2pkh(publicKey, Network.MAINNET);  // 1...
 * String segwit = AddressFactory.p2wpkh(publicKey, Network.MAINNET); // bc1q...
 * }</pre>
 *
 * @since 0.1.0
 */
public final class AddressFactory {

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");

    private static final int COMPRESSED_KEY_LENGTH = 33;
    private static final int UNCOMPRESSED_KEY_LENGTH = 65;
    private static final int X_ONLY_KEY_LENGTH = 32;

    private AddressFactory() {
        // Utility class
    }

    /**
     * Pay-to-public-key-hash: Base58Check of the network's P2PKH version and hash160(key).
     *
     * @throws PublicKeyException if the key is not a valid secp256k1 point
     */
    public static String p2pkh(final byte[] publicKey, final Network network) {
        Objects.requireNonNull(network, "network");
        requirePoint(publicKey);
        return Base58Check.encode(network.p2pkhVersion(), Hash160.hash(publicKey));
    }

    /**
     * Pay-to-script-hash: Base58Check of the network's P2SH version and hash160(script).
     */
    public static String p2sh(final byte[] redeemScript, final Network network) {
        Objects.requireNonNull(redeemScript, "redeemScript");
        Objects.requireNonNull(network, "network");
        return Base58Check.encode(network.p2shVersion(), Hash160.hash(redeemScript));
    }

    /**
     * Segwit v0 key hash: witness program is hash160 of a compressed key.
     *
     * @throws PublicKeyException if the key is uncompressed or not a valid point
     */
    public static String p2wpkh(final byte[] publicKey, final Network network) {
        Objects.requireNonNull(network, "network");
        requirePoint(publicKey);
        if (publicKey.length != COMPRESSED_KEY_LENGTH) {
            throw new PublicKeyException("segwit requires a compressed public key, got " + publicKey.length + " bytes");
        }
        return new SegwitProgram(0, Hash160.hash(publicKey)).encode(network.hrp());
    }

    /**
     * Segwit v0 script hash: witness program is SHA-256 of the witness script.
     */
    public static String p2wsh(final byte[] witnessScript, final Network network) {
        Objects.requireNonNull(witnessScript, "witnessScript");
        Objects.requireNonNull(network, "network");
        return new SegwitProgram(0, Sha256.hash(witnessScript)).encode(network.hrp());
    }

    /**
     * Taproot: witness version 1 with the 32-byte x-only output key as program.
     *
     * @throws PublicKeyException if the key is not the x coordinate of a curve point
     */
    public static String p2tr(final byte[] outputKey, final Network network) {
        Objects.requireNonNull(outputKey, "outputKey");
        Objects.requireNonNull(network, "network");
        if (outputKey.length != X_ONLY_KEY_LENGTH) {
            throw new PublicKeyException("taproot output key must be 32 bytes, got " + outputKey.length);
        }
        final byte[] compressed = new byte[COMPRESSED_KEY_LENGTH];
        compressed[0] = 0x02;
        System.arraycopy(outputKey, 0, compressed, 1, X_ONLY_KEY_LENGTH);
        requirePoint(compressed);
        return new SegwitProgram(1, outputKey).encode(network.hrp());
    }

    /**
     * Re-encodes a valid decoded address in canonical form. Bech32 output is lowercase.
     *
     * @throws IllegalArgumentException if the address is invalid
     */
    public static String encode(final DecodedAddress address) {
        Objects.requireNonNull(address, "address");
        if (!address.isValid()) {
            throw new IllegalArgumentException("cannot encode an invalid address: " + address.reason());
        }
        final Network network = address.network();
        return switch (address.type()) {
            case P2PKH, P2SH -> Base58Check.encode(address.version(), address.payload());
            case SEGWIT_V0, TAPROOT -> new SegwitProgram(address.version(), address.payload()).encode(network.hrp());
            case INVALID -> throw new IllegalStateException("unreachable");
        };
    }

    private static void requirePoint(final byte[] publicKey) {
        Objects.requireNonNull(publicKey, "publicKey");
        if (publicKey.length != COMPRESSED_KEY_LENGTH && publicKey.length != UNCOMPRESSED_KEY_LENGTH) {
            throw new PublicKeyException("public key must be 33 or 65 bytes, got " + publicKey.length);
        }
        try {
            final ECPoint point = CURVE_PARAMS.getCurve().decodePoint(publicKey);
            if (point.isInfinity() || !point.isValid()) {
                throw new PublicKeyException("public key is not a valid secp256k1 point");
            }
        } catch (IllegalArgumentException e) {
            throw new PublicKeyException("public key is not a valid secp256k1 point", e);
        }
    }
}
