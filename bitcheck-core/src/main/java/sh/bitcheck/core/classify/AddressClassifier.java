// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.classify;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import sh.bitcheck.core.DebugLogger;
import sh.bitcheck.core.base58.Base58Check;
import sh.bitcheck.core.error.AddressFormatException;
import sh.bitcheck.core.segwit.SegwitProgram;
import sh.bitcheck.core.segwit.SegwitProgramExtractor;
import sh.bitcheck.core.types.AddressType;
import sh.bitcheck.core.types.DecodedAddress;
import sh.bitcheck.core.types.Network;
import sh.bitcheck.primitives.DecodeError;
import sh.bitcheck.primitives.DecodeResult;
import sh.bitcheck.primitives.bech32.Bech32;
import sh.bitcheck.primitives.bech32.Bech32Checksum;
import sh.bitcheck.primitives.bech32.Bech32Decoded;
import sh.bitcheck.primitives.bech32.Bech32Variant;

/**
 * Classifies an address string as P2PKH, P2SH, segwit v0, taproot or invalid.
 *
 * <p>
 * The Base58Check path is tried first. If it does not produce an address, the
 * Bech32 path is tried. The witness version selects the checksum variant:
 * version 0 must verify under Bech32 and every other version under Bech32m.
 * A string checksummed with the other variant is rejected, never accepted
 * under a fallback.
 *
 * <p>
 * When both paths fail, the reported reason comes from the path that got
 * further (see {@link DecodeError.Stage}); ties go to Base58. A Bech32
 * {@code MIXED_CASE} rejection always wins. If neither path got past the
 * alphabet, the input is {@code NOT_RECOGNIZED}. Input longer than
 * {@value Bech32#MAX_LENGTH} characters is {@code TOO_LONG} without decoding.
 *
 * <pre>{@code
 * AddressClassifier classifier = new AddressClassifier();
 *
 * DecodedAddress address = classifier.classify("bc1qw508d6qejxtdg4y5r3zarvary0c5xw7kv8f3t4");
 * address.type();    // SEGWIT_V0
 * address.network(); // MAINNET
 * }</pre>
 *
 * <p>
 * Instances are immutable and safe to share between threads.
 *
 * @since 0.1.0
 */
public final class AddressClassifier {

    private final ClassifierConfig config;

    /**
     * Creates a classifier that accepts mainnet addresses only.
     */
    public AddressClassifier() {
        this(ClassifierConfig.defaults());
    }

    public AddressClassifier(final ClassifierConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public ClassifierConfig config() {
        return config;
    }

    /**
     * Classifies one candidate address. Never throws.
     *
     * @param input candidate address; null and empty are {@code INVALID(EMPTY)}
     * @return a valid address, or {@code INVALID} with the reason
     */
    public DecodedAddress classify(final String input) {
        if (input == null || input.isEmpty()) {
            return reject(input, DecodeError.EMPTY);
        }
        if (input.length() > Bech32.MAX_LENGTH) {
            // Longer than any Base58 or Bech32 address
            return reject(input, DecodeError.TOO_LONG);
        }

        final DecodeResult<DecodedAddress> base58 = Base58Check.validate(input, config.networks());
        if (base58 instanceof DecodeResult.Ok<DecodedAddress> ok) {
            return ok.value();
        }
        final DecodeResult<DecodedAddress> bech32 = classifyBech32(input);
        if (bech32 instanceof DecodeResult.Ok<DecodedAddress> ok) {
            return ok.value();
        }

        final DecodeError base58Error = ((DecodeResult.Err<DecodedAddress>) base58).error();
        final DecodeError bech32Error = ((DecodeResult.Err<DecodedAddress>) bech32).error();
        return reject(input, select(base58Error, bech32Error));
    }

    /**
     * Classifies each input independently, preserving order.
     */
    public List<DecodedAddress> classifyAll(final Collection<String> inputs) {
        Objects.requireNonNull(inputs, "inputs");
        final List<DecodedAddress> results = new ArrayList<>(inputs.size());
        for (String input : inputs) {
            results.add(classify(input));
        }
        return results;
    }

    public boolean isValid(final String input) {
        return classify(input).isValid();
    }

    /**
     * Like {@link #classify(String)}, but throws for invalid input.
     *
     * @throws AddressFormatException carrying the rejection reason
     */
    public DecodedAddress parse(final String input) {
        final DecodedAddress address = classify(input);
        if (!address.isValid()) {
            throw new AddressFormatException(address.reason());
        }
        return address;
    }

    private DecodeResult<DecodedAddress> classifyBech32(final String input) {
        return Bech32.decode(input).flatMap(this::interpretBech32);
    }

    private DecodeResult<DecodedAddress> interpretBech32(final Bech32Decoded decoded) {
        final byte[] data = decoded.data();
        if (data.length == 0) {
            // No witness version to pick a variant from
            if (Bech32Checksum.detect(decoded.hrp(), decoded.values()).isEmpty()) {
                return DecodeResult.err(DecodeError.CHECKSUM_MISMATCH);
            }
            return DecodeResult.err(DecodeError.INVALID_PROGRAM_LENGTH);
        }
        if (!decoded.verify(Bech32Variant.forWitnessVersion(data[0]))) {
            return DecodeResult.err(DecodeError.CHECKSUM_MISMATCH);
        }
        return SegwitProgramExtractor.extract(data)
                .flatMap(program -> toAddress(decoded.hrp(), program));
    }

    private DecodeResult<DecodedAddress> toAddress(final String hrp, final SegwitProgram program) {
        final AddressType type;
        if (program.witnessVersion() == 0) {
            type = AddressType.SEGWIT_V0;
        } else if (program.isTaproot()) {
            type = AddressType.TAPROOT;
        } else {
            return DecodeResult.err(DecodeError.UNSUPPORTED_WITNESS_VERSION);
        }

        final Optional<Network> network = Network.fromHrp(hrp).filter(config::accepts);
        if (network.isEmpty()) {
            return DecodeResult.err(DecodeError.UNKNOWN_PREFIX);
        }
        return DecodeResult.ok(DecodedAddress.valid(
                type, program.witnessVersion(), program.program(), network.get()));
    }

    static DecodeError select(final DecodeError base58Error, final DecodeError bech32Error) {
        // Only a string of valid Bech32 characters reaches the case check
        if (bech32Error == DecodeError.MIXED_CASE) {
            return bech32Error;
        }
        if (base58Error.stage() == DecodeError.Stage.ALPHABET
                && bech32Error.stage() == DecodeError.Stage.ALPHABET) {
            return DecodeError.NOT_RECOGNIZED;
        }
        return bech32Error.stage().compareTo(base58Error.stage()) > 0 ? bech32Error : base58Error;
    }

    private static DecodedAddress reject(final String input, final DecodeError reason) {
        DebugLogger.log("[CLASSIFY] rejected input=%s reason=%s", input, reason);
        return DecodedAddress.invalid(reason);
    }
}
