package dk.cloudcreate.essentials.micro.kernel.pipeline;

import java.util.*;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The outcome of a computation that may fail: either a {@link Success} carrying a value or
 * a {@link Failure} carrying the error (and optionally the name of the {@link Pipeline} step that failed).<br>
 * A {@link Result} is used to carry errors as values instead of letting exceptions escape:
 * <pre>{@code
 * Result<Integer> result = Result.of(() -> Integer.parseInt(value))
 *                                .map(number -> number * 2);
 * if (result.isFailure()) {
 *     log.warn("Couldn't parse '{}'", value, result.error());
 * }
 * }</pre>
 *
 * @param <T> the type of the success value
 */
public abstract class Result<T> {
    private Result() {
    }

    public static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    public static <T> Result<T> failure(Throwable error) {
        return new Failure<>(error, null);
    }

    public static <T> Result<T> failure(Throwable error, String failedStep) {
        return new Failure<>(error, requireNonNull(failedStep, "No failedStep provided"));
    }

    /**
     * Call the supplier and capture its outcome
     *
     * @param supplier the supplier
     * @param <T>      the type of value
     * @return {@link Success} with the supplied value, or {@link Failure} in case the supplier threw an {@link Exception}
     * (checked exceptions thrown without being declared included) or a non fatal {@link Error}
     */
    public static <T> Result<T> of(Supplier<? extends T> supplier) {
        requireNonNull(supplier, "No supplier provided");
        try {
            return success(supplier.get());
        } catch (Throwable e) {
            return capture(e);
        }
    }

    /**
     * Convert a caught {@link Throwable} into a {@link Failure}.<br>
     * A {@link VirtualMachineError} (such as {@link OutOfMemoryError}) is rethrown as the JVM can't be trusted after it.
     * A captured {@link InterruptedException} re-asserts the interrupt flag of the current thread.
     *
     * @param e the caught throwable
     * @return a {@link Failure} carrying <code>e</code>
     */
    static <T> Result<T> capture(Throwable e) {
        if (e instanceof VirtualMachineError) {
            throw (VirtualMachineError) e;
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        return failure(e);
    }

    public abstract boolean isSuccess();

    public final boolean isFailure() {
        return !isSuccess();
    }

    /**
     * @return the success value
     * @throws IllegalStateException in case this is a {@link Failure}. The failure error is attached as cause
     */
    public abstract T get();

    /**
     * @return the error
     * @throws IllegalStateException in case this is a {@link Success}
     */
    public abstract Throwable error();

    /**
     * @return the name of the pipeline step that failed, or {@link Optional#empty()} for a {@link Success}
     * or a {@link Failure} that didn't originate from a {@link Pipeline} step
     */
    public abstract Optional<String> failedStep();

    /**
     * Transform the success value. If the mapper throws (see {@link #of(Supplier)}) the result is a {@link Failure}
     */
    public abstract <R> Result<R> map(Function<? super T, ? extends R> mapper);

    /**
     * Transform the success value into a new {@link Result}. If the mapper throws (see {@link #of(Supplier)}) the result is a {@link Failure}
     */
    public abstract <R> Result<R> flatMap(Function<? super T, Result<R>> mapper);

    /**
     * Fold this result into a single value
     *
     * @param onSuccess called with the success value
     * @param onFailure called with the error
     */
    public abstract <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super Throwable, ? extends R> onFailure);

    public final Result<T> ifSuccess(Consumer<? super T> consumer) {
        requireNonNull(consumer, "No consumer provided");
        if (isSuccess()) {
            consumer.accept(get());
        }
        return this;
    }

    public final Result<T> ifFailure(Consumer<? super Throwable> consumer) {
        requireNonNull(consumer, "No consumer provided");
        if (isFailure()) {
            consumer.accept(error());
        }
        return this;
    }

    public static final class Success<T> extends Result<T> {
        private final T value;

        private Success(T value) {
            this.value = value;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T get() {
            return value;
        }

        @Override
        public Throwable error() {
            throw new IllegalStateException("A Success doesn't have an error");
        }

        @Override
        public Optional<String> failedStep() {
            return Optional.empty();
        }

        @Override
        public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
            requireNonNull(mapper, "No mapper provided");
            return Result.of(() -> mapper.apply(value));
        }

        @Override
        public <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
            requireNonNull(mapper, "No mapper provided");
            try {
                return requireNonNull(mapper.apply(value), "flatMap mapper returned null");
            } catch (Throwable e) {
                return capture(e);
            }
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super Throwable, ? extends R> onFailure) {
            return requireNonNull(onSuccess, "No onSuccess function provided").apply(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Success)) return false;
            return Objects.equals(value, ((Success<?>) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return "Success{" + value + '}';
        }
    }

    public static final class Failure<T> extends Result<T> {
        private final Throwable error;
        private final String    failedStep;

        private Failure(Throwable error, String failedStep) {
            this.error = requireNonNull(error, "No error provided");
            this.failedStep = failedStep;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T get() {
            throw new IllegalStateException(msg("Result is a Failure{}: {}",
                                                failedStep == null ? "" : " in step '" + failedStep + "'",
                                                error.getMessage()),
                                            error);
        }

        @Override
        public Throwable error() {
            return error;
        }

        @Override
        public Optional<String> failedStep() {
            return Optional.ofNullable(failedStep);
        }

        @SuppressWarnings("unchecked")
        @Override
        public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
            return (Result<R>) this;
        }

        @SuppressWarnings("unchecked")
        @Override
        public <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
            return (Result<R>) this;
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super Throwable, ? extends R> onFailure) {
            return requireNonNull(onFailure, "No onFailure function provided").apply(error);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Failure)) return false;
            var that = (Failure<?>) o;
            return error.equals(that.error) && Objects.equals(failedStep, that.failedStep);
        }

        @Override
        public int hashCode() {
            return Objects.hash(error, failedStep);
        }

        @Override
        public String toString() {
            return "Failure{" +
                    "error=" + error +
                    ", failedStep='" + failedStep + '\'' +
                    '}';
        }
    }
}
