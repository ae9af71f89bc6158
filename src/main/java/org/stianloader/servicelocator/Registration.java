package org.stianloader.servicelocator;

import java.util.Objects;
import java.util.function.Supplier;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Records how instances of a service are produced. A registration is exactly one of
 * the {@link Kind kinds}; the accessors of the other kinds return null.
 *
 * @param <T> The service type the registration produces
 */
public final class Registration<T> {

    public enum Kind {
        /**
         * A pre-built object that is returned as-is on every resolution.
         */
        INSTANCE,
        /**
         * A zero-argument factory invoked on every fresh resolution.
         */
        FACTORY,
        /**
         * A concrete type instantiated through its public parameterless constructor on every fresh resolution.
         */
        TYPE
    }

    @NotNull
    private final Kind kind;
    @Nullable
    private final T instance;
    @Nullable
    private final Supplier<? extends T> factory;
    @Nullable
    private final Class<? extends T> implementationType;

    private Registration(@NotNull Kind kind, @Nullable T instance, @Nullable Supplier<? extends T> factory, @Nullable Class<? extends T> implementationType) {
        this.kind = kind;
        this.instance = instance;
        this.factory = factory;
        this.implementationType = implementationType;
    }

    @NotNull
    @Contract(pure = true, value = "null -> fail; !null -> new")
    public static <T> Registration<T> ofInstance(@NotNull T instance) {
        return new Registration<>(Kind.INSTANCE, Objects.requireNonNull(instance, "'instance' may not be null!"), null, null);
    }

    /**
     * Creates a factory registration.
     *
     * @param factory The factory producing the instances
     * @param producedType The type the factory is declared to produce, used for diagnostics only. May be null if unknown.
     * @return The created registration
     */
    @NotNull
    @Contract(pure = true, value = "null, _ -> fail; !null, _ -> new")
    public static <T> Registration<T> ofFactory(@NotNull Supplier<? extends T> factory, @Nullable Class<? extends T> producedType) {
        return new Registration<>(Kind.FACTORY, null, Objects.requireNonNull(factory, "'factory' may not be null!"), producedType);
    }

    @NotNull
    @Contract(pure = true, value = "null -> fail; !null -> new")
    public static <T> Registration<T> ofType(@NotNull Class<? extends T> implementationType) {
        return new Registration<>(Kind.TYPE, null, null, Objects.requireNonNull(implementationType, "'implementationType' may not be null!"));
    }

    @NotNull
    public Kind getKind() {
        return this.kind;
    }

    @Nullable
    public T getInstance() {
        return this.instance;
    }

    @Nullable
    public Supplier<? extends T> getFactory() {
        return this.factory;
    }

    /**
     * Obtains the concrete type of a {@link Kind#TYPE} registration, or the declared
     * produced type of a {@link Kind#FACTORY} registration if one was given.
     *
     * @return The implementation type, or null
     */
    @Nullable
    public Class<? extends T> getImplementationType() {
        return this.implementationType;
    }

    @NotNull
    public String getDisplayString() {
        switch (this.kind) {
        case INSTANCE:
            return "instance of " + Objects.requireNonNull(this.instance).getClass().getName();
        case FACTORY:
            Class<?> produced = this.implementationType;
            return produced == null ? "factory" : "factory of " + produced.getName();
        case TYPE:
            return "type " + Objects.requireNonNull(this.implementationType).getName();
        default:
            return "unknown registration kind " + this.kind;
        }
    }

    @Override
    public String toString() {
        return "Registration[" + this.getDisplayString() + "]";
    }
}
