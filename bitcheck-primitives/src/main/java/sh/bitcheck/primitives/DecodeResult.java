// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.primitives;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a decode step.
 * <p>
 * This is a sealed interface with two implementations:
 * <ul>
 *   <li>{@link Ok} - decoding succeeded and carries the value</li>
 *   <li>{@link Err} - decoding failed and carries the {@link DecodeError}</li>
 * </ul>
 * <p>
 * Decoders return this instead of throwing so that a failure is an ordinary,
 * inspectable value. {@link #orElseThrow(Function)} bridges to exception-based
 * callers.
 *
 * <pre>{@code
 * DecodeResult<byte[]> bytes = Base58.decode(input);
 * if (bytes instanceof DecodeResult.Err<byte[]> err) {
 *     return err.error();
 * }
 * }</pre>
 *
 * @param <T> the decoded value type
 * @since 0.1.0
 */
public sealed interface DecodeResult<T> permits DecodeResult.Ok, DecodeResult.Err {

    static <T> DecodeResult<T> ok(final T value) {
        return new Ok<>(value);
    }

    static <T> DecodeResult<T> err(final DecodeError error) {
        return new Err<>(error);
    }

    boolean isOk();

    /**
     * Applies {@code mapper} to a successful value; errors pass through unchanged.
     */
    <R> DecodeResult<R> map(Function<? super T, ? extends R> mapper);

    /**
     * Chains another decode step that may itself fail.
     */
    <R> DecodeResult<R> flatMap(Function<? super T, DecodeResult<R>> mapper);

    /**
     * Returns the value, or throws the exception built from the error.
     *
     * @param exceptionFactory builds the exception for a failed result
     * @param <X>              exception type
     * @return the decoded value
     * @throws X if this result is an {@link Err}
     */
    <X extends Throwable> T orElseThrow(Function<DecodeError, ? extends X> exceptionFactory) throws X;

    /**
     * A successful decode.
     *
     * @param value the decoded value
     */
    record Ok<T>(T value) implements DecodeResult<T> {

        public Ok {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public <R> DecodeResult<R> map(final Function<? super T, ? extends R> mapper) {
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <R> DecodeResult<R> flatMap(final Function<? super T, DecodeResult<R>> mapper) {
            return Objects.requireNonNull(mapper.apply(value), "mapper result");
        }

        @Override
        public <X extends Throwable> T orElseThrow(final Function<DecodeError, ? extends X> exceptionFactory) {
            return value;
        }
    }

    /**
     * A failed decode.
     *
     * @param error why decoding failed
     */
    record Err<T>(DecodeError error) implements DecodeResult<T> {

        public Err {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public <R> DecodeResult<R> map(final Function<? super T, ? extends R> mapper) {
            return new Err<>(error);
        }

        @Override
        public <R> DecodeResult<R> flatMap(final Function<? super T, DecodeResult<R>> mapper) {
            return new Err<>(error);
        }

        @Override
        public <X extends Throwable> T orElseThrow(final Function<DecodeError, ? extends X> exceptionFactory) throws X {
            throw exceptionFactory.apply(error);
        }
    }
}
