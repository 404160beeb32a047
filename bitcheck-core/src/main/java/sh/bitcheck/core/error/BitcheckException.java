// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.error;

/**
 * Base runtime exception for all bitcheck failures.
 *
 * <p>
 * Decoding itself never throws; it reports failures as values. These
 * exceptions surface only from the explicitly throwing conveniences and from
 * address generation.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * BitcheckException
 * ├── {@link AddressFormatException} - a string is not an acceptable address
 * └── {@link PublicKeyException} - a key given to address generation is unusable
 * </pre>
 *
 * <pre>{@code
 * try {
 *     DecodedAddress address = classifier.parse(input);
 * } catch (AddressFormatException e) {
 *     showError(e.reason());
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class BitcheckException extends RuntimeException
        permits AddressFormatException,
        PublicKeyException {

    public BitcheckException(final String message) {
        super(message);
    }

    public BitcheckException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
