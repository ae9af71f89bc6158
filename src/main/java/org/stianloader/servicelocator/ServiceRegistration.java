package org.stianloader.servicelocator;

import java.util.Map;
import java.util.function.Supplier;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.Unmodifiable;

/**
 * Stores how instances of service types are produced. At most one {@link Registration}
 * exists per service type.
 *
 * <p>Registrations are not thread safe. They are expected to be populated once, before the first
 * resolution, by a single thread. Concurrent writes or writes racing a resolution need to be
 * synchronized externally.
 *
 * <p>All registration methods reject null arguments with an
 * {@link org.stianloader.servicelocator.error.InvalidRegistrationException}.
 */
public interface ServiceRegistration {

    /**
     * Obtains a point-in-time copy of all registrations, in the order the services were first registered.
     * Later changes to this registration are not reflected by the returned map.
     *
     * @return An unmodifiable snapshot of the registrations
     */
    @NotNull
    @Unmodifiable
    Map<Class<?>, Registration<?>> getRegistrations();

    @Nullable
    <T> Registration<T> getRegistration(@NotNull Class<T> service);

    boolean contains(@NotNull Class<?> service);

    /**
     * Registers a type as its own implementation. Whether the type has a public parameterless
     * constructor is only checked once the service is resolved.
     *
     * @param type The service type, which also is the implementation type
     * @return This registration
     */
    @NotNull
    @Contract(mutates = "this", value = "null -> fail; !null -> this")
    <T> ServiceRegistration addType(@NotNull Class<T> type);

    @NotNull
    @Contract(mutates = "this", value = "null, _ -> fail; _, null -> fail; !null, !null -> this")
    <T> ServiceRegistration addType(@NotNull Class<T> service, @NotNull Class<? extends T> implementation);

    /**
     * Registers a ready-made object under its own runtime class.
     *
     * @param instance The object to return whenever its class is resolved
     * @return This registration
     */
    @NotNull
    @Contract(mutates = "this", value = "null -> fail; !null -> this")
    <T> ServiceRegistration addInstance(@NotNull T instance);

    @NotNull
    @Contract(mutates = "this", value = "null, _ -> fail; _, null -> fail; !null, !null -> this")
    <T> ServiceRegistration addInstance(@NotNull Class<T> service, @NotNull T instance);

    @NotNull
    @Contract(mutates = "this", value = "null, _ -> fail; _, null -> fail; !null, !null -> this")
    <T> ServiceRegistration addFactory(@NotNull Class<T> service, @NotNull Supplier<? extends T> factory);

    @NotNull
    @Contract(mutates = "this")
    <T, I extends T> ServiceRegistration addFactory(@NotNull Class<T> service, @NotNull Class<I> implementation, @NotNull Supplier<I> factory);

    /**
     * Removes the registration of a service, if there is any.
     * Singletons already created from the registration by a scope stay cached in that scope.
     *
     * @param service The service to remove
     * @return True if a registration was removed
     */
    @Contract(mutates = "this")
    boolean remove(@NotNull Class<?> service);
}
