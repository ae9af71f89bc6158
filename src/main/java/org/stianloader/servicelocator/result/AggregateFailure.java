package org.stianloader.servicelocator.result;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.Unmodifiable;

/**
 * A {@link Failure} that batches several failures into one value while keeping
 * each of them (and their order) accessible through {@link #getErrors()}.
 */
public class AggregateFailure extends Failure {

    @NotNull
    static final String DEFAULT_MESSAGE = "Multiple errors occurred, see getErrors() for details.";

    @NotNull
    @Unmodifiable
    private final List<Failure> errors;

    public AggregateFailure(@NotNull String message, @NotNull List<? extends Failure> errors, @Nullable Throwable cause) {
        super(message, cause, null);
        this.errors = List.copyOf(errors);
    }

    public AggregateFailure(@NotNull List<? extends Failure> errors) {
        this(DEFAULT_MESSAGE, errors, null);
    }

    @NotNull
    @Unmodifiable
    public List<Failure> getErrors() {
        return this.errors;
    }

    @Override
    @Nullable
    public Object getPayload() {
        return this.errors;
    }
}
