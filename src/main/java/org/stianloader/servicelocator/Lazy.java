package org.stianloader.servicelocator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A value that is computed at most once, on first access, by a supplier.
 * Actions queued through {@link #configure(Consumer)} before the value exists are applied
 * to it right after it was computed and before any caller can observe it.
 *
 * <p>This class is thread safe: concurrent callers of {@link #get()} observe the same value
 * and the supplier is never invoked twice. The supplier and queued actions may call {@link #configure(Consumer)},
 * but must not call {@link #get()}.
 *
 * @param <T> The type of the value
 */
public final class Lazy<T> {

    @NotNull
    private final Supplier<T> supplier;
    @NotNull
    private final List<Consumer<? super T>> pendingConfigurations = new ArrayList<>();
    @NotNull
    private volatile Optional<T> value = Optional.empty();
    @Nullable
    private volatile Throwable failure;
    private boolean initializing;

    public Lazy(@NotNull Supplier<T> supplier) {
        this.supplier = Objects.requireNonNull(supplier, "'supplier' may not be null!");
    }

    /**
     * Obtains the value, computing it first if needed.
     *
     * <p>If the supplier or a queued configuration action threw, the value is never computed again.
     * Instead every later call throws an {@link IllegalStateException} caused by the original failure.
     *
     * @return The value
     */
    @NotNull
    @Contract(pure = false)
    public T get() {
        Optional<T> current = this.value;
        if (current.isPresent()) {
            return current.get();
        }

        synchronized (this) {
            current = this.value;
            if (current.isPresent()) {
                return current.get();
            }

            Throwable t = this.failure;
            if (t != null) {
                throw new IllegalStateException("Previous attempt at initializing the value failed.", t);
            }

            if (this.initializing) {
                throw new IllegalStateException("The value is already being initialized by this thread; the supplier or a configuration action accessed it recursively.");
            }

            this.initializing = true;
            try {
                T val = Objects.requireNonNull(this.supplier.get(), "Supplier returned null");
                // Actions may queue further actions through configure
                while (!this.pendingConfigurations.isEmpty()) {
                    List<Consumer<? super T>> batch = new ArrayList<>(this.pendingConfigurations);
                    this.pendingConfigurations.clear();
                    for (Consumer<? super T> action : batch) {
                        action.accept(val);
                    }
                }
                this.value = Optional.of(val);
                return val;
            } catch (Throwable t2) {
                this.failure = t2;
                if (t2 instanceof Error && !(t2 instanceof AssertionError)) {
                    throw t2;
                }
                throw new IllegalStateException("Attempt at initializing the value failed.", t2);
            } finally {
                this.initializing = false;
                this.pendingConfigurations.clear();
            }
        }
    }

    /**
     * Obtains the value if it was already computed, without computing it.
     *
     * @return The value, or an empty optional if {@link #get()} was not called successfully yet
     */
    @NotNull
    @Contract(pure = true)
    public Optional<T> getIfPresent() {
        return this.value;
    }

    /**
     * Runs an action on the value. If the value was already computed, the action runs immediately on the calling thread,
     * otherwise it is queued until the value is computed by {@link #get()}.
     *
     * @param action The action to run
     * @return This lazy
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public Lazy<T> configure(@NotNull Consumer<? super T> action) {
        Objects.requireNonNull(action, "'action' may not be null!");
        Optional<T> current = this.value;
        if (current.isEmpty()) {
            synchronized (this) {
                current = this.value;
                if (current.isEmpty()) {
                    Throwable t = this.failure;
                    if (t != null) {
                        throw new IllegalStateException("Cannot configure a value that failed to initialize.", t);
                    }
                    this.pendingConfigurations.add(action);
                    return this;
                }
            }
        }
        action.accept(current.get());
        return this;
    }

    public boolean isDone() {
        return this.value.isPresent() || this.failure != null;
    }
}
