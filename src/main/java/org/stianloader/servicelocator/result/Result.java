package org.stianloader.servicelocator.result;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of a fallible operation: either a success optionally holding a value,
 * or a failure holding a {@link Failure}.
 *
 * <p>Unlike exceptions, results are meant to be inspected. Chained calls such as
 * {@link #then(Consumer)} and {@link #catchError(Consumer)} return the same result,
 * so success and failure handling can be declared inline.
 *
 * @param <T> The type of the value held on success
 */
public final class Result<T> {

    private static final Result<Void> SUCCESS = new Result<>(null, null);

    @Nullable
    private final T value;
    @Nullable
    private final Failure error;

    private Result(@Nullable T value, @Nullable Failure error) {
        this.value = value;
        this.error = error;
    }

    @NotNull
    @Contract(pure = true)
    public static <T> Result<T> success(@Nullable T value) {
        return new Result<>(value, null);
    }

    @NotNull
    @Contract(pure = true)
    public static Result<Void> success() {
        return SUCCESS;
    }

    @NotNull
    @Contract(pure = true, value = "null -> fail; !null -> new")
    public static <T> Result<T> failure(@NotNull Failure error) {
        return new Result<>(null, Objects.requireNonNull(error, "'error' may not be null!"));
    }

    @NotNull
    @Contract(pure = true, value = "null -> fail; !null -> new")
    public static <T> Result<T> failure(@NotNull String message) {
        return failure(Failure.of(message));
    }

    @NotNull
    @Contract(pure = true, value = "null -> fail; !null -> new")
    public static <T> Result<T> failure(@NotNull Throwable cause) {
        return failure(Failure.of(cause));
    }

    /**
     * Creates a failed result out of a list of failures. The list is wrapped in an
     * {@link AggregateFailure} even if it holds a single element.
     *
     * @param errors The failures to aggregate
     * @return The failed result
     */
    @NotNull
    @Contract(pure = true)
    public static <T> Result<T> aggregate(@NotNull List<? extends Failure> errors) {
        return failure(Failure.aggregate(errors));
    }

    public boolean isError() {
        return this.error != null;
    }

    public boolean isSuccess() {
        return this.error == null;
    }

    @Nullable
    public T getValue() {
        return this.value;
    }

    @Nullable
    public Failure getError() {
        return this.error;
    }

    @NotNull
    @Contract(value = "null -> fail; !null -> this")
    public Result<T> then(@NotNull Consumer<? super T> action) {
        if (this.error == null) {
            action.accept(this.value);
        }
        return this;
    }

    @NotNull
    @Contract(value = "null -> fail; !null -> this")
    public Result<T> then(@NotNull Runnable action) {
        if (this.error == null) {
            action.run();
        }
        return this;
    }

    @NotNull
    @Contract(value = "null -> fail; !null -> this")
    public Result<T> catchError(@NotNull Consumer<? super Failure> action) {
        Failure error = this.error;
        if (error != null) {
            action.accept(error);
        }
        return this;
    }

    /**
     * Passes the throwable behind a failed result to the given action. Failures that were
     * not caused by a throwable are presented as an {@link IllegalStateException} carrying the failure message.
     *
     * @param action The action to run on failure
     * @return This result
     */
    @NotNull
    @Contract(value = "null -> fail; !null -> this")
    public Result<T> catchException(@NotNull Consumer<? super Throwable> action) {
        Failure error = this.error;
        if (error != null) {
            action.accept(asThrowable(error));
        }
        return this;
    }

    @NotNull
    @Contract(value = "_, null -> fail; _, !null -> this")
    public <E extends Throwable> Result<T> catchException(@NotNull Class<E> type, @NotNull Consumer<? super E> action) {
        Failure error = this.error;
        if (error != null && type.isInstance(error.getCause())) {
            action.accept(type.cast(error.getCause()));
        }
        return this;
    }

    /**
     * Obtains the value of a successful result, or throws the failure otherwise.
     * Unchecked causes are rethrown as-is, anything else is wrapped in an {@link IllegalStateException}.
     *
     * @return The value, which may be null for {@link #success()}
     */
    @Nullable
    public T orElseThrow() {
        Failure error = this.error;
        if (error == null) {
            return this.value;
        }
        Throwable t = asThrowable(error);
        if (t instanceof RuntimeException) {
            throw (RuntimeException) t;
        } else if (t instanceof java.lang.Error) {
            throw (java.lang.Error) t;
        }
        throw new IllegalStateException(error.getMessage(), t);
    }

    /**
     * Throws the cause of a failed result if it is an instance of the given type.
     * Otherwise this result is returned unchanged.
     *
     * @param type The type of throwable to rethrow
     * @return This result
     * @throws E If the failure was caused by an instance of <code>type</code>
     */
    @NotNull
    public <E extends Throwable> Result<T> orElseThrow(@NotNull Class<E> type) throws E {
        Failure error = this.error;
        if (error != null && type.isInstance(error.getCause())) {
            throw type.cast(error.getCause());
        }
        return this;
    }

    public <R> R map(@NotNull Function<? super Result<T>, ? extends R> fn) {
        return fn.apply(this);
    }

    @Nullable
    public T or(@Nullable T defaultValue) {
        T value = this.value;
        return value != null ? value : defaultValue;
    }

    @NotNull
    private static Throwable asThrowable(@NotNull Failure error) {
        Throwable cause = error.getCause();
        return cause != null ? cause : new IllegalStateException(error.getMessage());
    }

    @Override
    public String toString() {
        Failure error = this.error;
        return error == null ? "Result[success: " + this.value + "]" : "Result[failure: " + error.getMessage() + "]";
    }
}
