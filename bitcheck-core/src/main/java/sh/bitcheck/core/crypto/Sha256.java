// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Objects;

/**
 * SHA-256 and the double SHA-256 used by Base58Check.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * byte[] checksum = Sha256.checksum(versionedPayload); // first 4 bytes of SHA-256(SHA-256(x))
 * }</pre>
 *
 * <h2>ThreadLocal Memory Management</h2>
 *
 * <p>
 * Digest instances are cached per thread. In thread pool environments
 * (servlet containers, executors) call {@link #cleanup()} when a thread is
 * returned to the pool or the application is undeployed, otherwise the cached
 * digest keeps the class loader reachable.
 *
 * <pre>{@code
 * executor.submit(() -> {
 *     try {
 *         return classifier.classify(address);
 *     } finally {
 *         Sha256.cleanup();
 *     }
 * });
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Sha256 {

    /** Length of the Base58Check checksum taken from the double hash. */
    public static final int CHECKSUM_LENGTH = 4;

    private static final String ALGORITHM = "SHA-256";

    private static final ThreadLocal<MessageDigest> DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256
            throw new AssertionError("SHA-256 algorithm not available", e);
        }
    });

    private Sha256() {
        // Utility class
    }

    /**
     * Computes the SHA-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final MessageDigest digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Computes SHA-256(SHA-256(input)).
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] doubleHash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final MessageDigest digest = DIGEST.get();
        digest.reset();
        final byte[] first = digest.digest(input);
        return digest.digest(first);
    }

    /**
     * The Base58Check checksum: the first {@value #CHECKSUM_LENGTH} bytes of {@link #doubleHash}.
     *
     * @param input version byte followed by payload
     * @return 4-byte checksum
     */
    public static byte[] checksum(final byte[] input) {
        return Arrays.copyOf(doubleHash(input), CHECKSUM_LENGTH);
    }

    /**
     * Removes the cached digest instance from the current thread.
     *
     * <p>
     * Safe to call even if the thread has never hashed anything.
     *
     * @see ThreadLocal#remove()
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
