// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.error;

import java.util.Objects;

import sh.bitcheck.primitives.DecodeError;

/**
 * Thrown when a string is required to be a valid address and is not.
 *
 * @since 0.1.0
 */
public final class AddressFormatException extends BitcheckException {

    private final DecodeError reason;

    public AddressFormatException(final DecodeError reason) {
        super(Objects.requireNonNull(reason, "reason").name() + ": " + reason.description());
        this.reason = reason;
    }

    /**
     * The machine-readable reason the address was rejected.
     */
    public DecodeError reason() {
        return reason;
    }
}
