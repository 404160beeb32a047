// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.error;

/**
 * Thrown when a public key is not a valid secp256k1 point, or has a form the
 * requested address type does not accept.
 *
 * @since 0.1.0
 */
public final class PublicKeyException extends BitcheckException {

    public PublicKeyException(final String message) {
        super(message);
    }

    public PublicKeyException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
