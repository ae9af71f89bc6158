package org.stianloader.servicelocator.result;

import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Describes why an operation failed: a human-readable message, optionally the
 * {@link Throwable} that caused the failure and optionally an arbitrary payload
 * that gives additional context (for example when logging the failure).
 */
public class Failure {

    @NotNull
    private final String message;
    @Nullable
    private final Throwable cause;
    @Nullable
    private final Object payload;

    protected Failure(@NotNull String message, @Nullable Throwable cause, @Nullable Object payload) {
        this.message = Objects.requireNonNull(message, "'message' may not be null!");
        this.cause = cause;
        this.payload = payload;
    }

    @NotNull
    @Contract(pure = true, value = "null -> fail; !null -> new")
    public static Failure of(@NotNull String message) {
        return new Failure(message, null, null);
    }

    /**
     * Creates a failure that wraps the given throwable, reusing its message.
     * Throwables without a message are described by their class name instead.
     *
     * @param cause The throwable to wrap
     * @return The created failure
     */
    @NotNull
    @Contract(pure = true, value = "null -> fail; !null -> new")
    public static Failure of(@NotNull Throwable cause) {
        String message = cause.getMessage();
        return new Failure(message == null ? cause.getClass().getName() : message, cause, null);
    }

    @NotNull
    @Contract(pure = true)
    public static Failure of(@NotNull String message, @Nullable Throwable cause, @Nullable Object payload) {
        return new Failure(message, cause, payload);
    }

    @NotNull
    @Contract(pure = true)
    public static Failure withPayload(@NotNull String message, @Nullable Object payload) {
        return new Failure(message, null, payload);
    }

    @NotNull
    @Contract(pure = true)
    public static AggregateFailure aggregate(@NotNull List<? extends Failure> errors) {
        return new AggregateFailure(AggregateFailure.DEFAULT_MESSAGE, errors, null);
    }

    @NotNull
    public String getMessage() {
        return this.message;
    }

    @Nullable
    public Throwable getCause() {
        return this.cause;
    }

    @Nullable
    public Object getPayload() {
        return this.payload;
    }

    /**
     * Checks whether two failures describe the same problem, that is whether
     * their messages are equal when ignoring case.
     *
     * @param other The failure to compare against
     * @return True if the messages match
     */
    @Contract(pure = true)
    public boolean isSimilarTo(@NotNull Failure other) {
        return this.message.equalsIgnoreCase(other.message);
    }

    @Override
    public String toString() {
        return this.message;
    }
}
