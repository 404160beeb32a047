// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.types;

import java.util.Arrays;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

import sh.bitcheck.primitives.DecodeError;
import sh.bitcheck.primitives.Hex;

/**
 * The outcome of classifying one address string.
 * <p>
 * A valid result carries the scheme, the version (Base58 version byte or
 * witness version), the payload and the network. An invalid result has type
 * {@link AddressType#INVALID}, version {@code -1}, an empty payload and a
 * non-null {@link #reason()}.
 * <p>
 * The payload is copied on the way in and on the way out; instances never
 * share arrays with callers.
 *
 * @param type    the scheme, or {@code INVALID}
 * @param version Base58 version byte (0..255) or witness version (0..16); {@code -1} when invalid
 * @param payload hash160 for Base58 types, witness program for segwit types
 * @param network network the address belongs to; null when invalid
 * @param reason  why the input was rejected; null when valid
 * @since 0.1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties({"payload"})
@JsonPropertyOrder({"valid", "type", "network", "version", "payloadHex", "reason"})
public record DecodedAddress(
        AddressType type,
        int version,
        byte[] payload,
        @Nullable Network network,
        @Nullable DecodeError reason) {

    private static final byte[] EMPTY = new byte[0];

    public DecodedAddress {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        if (type == AddressType.INVALID) {
            if (reason == null) {
                throw new IllegalArgumentException("invalid address requires a reason");
            }
            if (version != -1 || payload.length != 0 || network != null) {
                throw new IllegalArgumentException("invalid address carries no version, payload or network");
            }
        } else {
            if (reason != null) {
                throw new IllegalArgumentException("valid address cannot carry a reason: " + reason);
            }
            Objects.requireNonNull(network, "network");
            if (version < 0 || version > 0xFF) {
                throw new IllegalArgumentException("version out of range: " + version);
            }
        }
        payload = payload.clone();
    }

    public static DecodedAddress valid(
            final AddressType type, final int version, final byte[] payload, final Network network) {
        return new DecodedAddress(type, version, payload, network, null);
    }

    public static DecodedAddress invalid(final DecodeError reason) {
        return new DecodedAddress(AddressType.INVALID, -1, EMPTY, null, reason);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    @JsonProperty("valid")
    public boolean isValid() {
        return type != AddressType.INVALID;
    }

    /**
     * Lowercase hex of {@link #payload()}.
     */
    @JsonProperty("payloadHex")
    public String payloadHex() {
        return Hex.encode(payload);
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof DecodedAddress other
                && type == other.type
                && version == other.version
                && Arrays.equals(payload, other.payload)
                && network == other.network
                && reason == other.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, version, Arrays.hashCode(payload), network, reason);
    }

    @Override
    public String toString() {
        if (!isValid()) {
            return "DecodedAddress[INVALID, reason=" + reason + "]";
        }
        return "DecodedAddress[" + type + ", network=" + network.id()
                + ", version=" + version + ", payload=" + payloadHex() + "]";
    }
}
