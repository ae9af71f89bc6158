package org.stianloader.servicelocator;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.servicelocator.result.Result;

/**
 * Resolves services out of the {@link ServiceRegistration} it is bound to.
 * Each scope owns its own cache of singletons.
 */
public interface ServiceScope {

    /**
     * Resolves a fresh instance of a service. Instance registrations are returned as-is, factories are invoked
     * and type registrations are instantiated on every call. The singleton cache is neither consulted nor filled.
     *
     * @param service The service to resolve
     * @return The resolved instance
     * @throws org.stianloader.servicelocator.error.InjectionException If the service cannot be resolved
     */
    @NotNull
    <T> T newInstance(@NotNull Class<T> service);

    /**
     * Resolves the singleton instance of a service, creating it through {@link #newInstance(Class)} on the first call.
     * Sequential calls on the same scope return the same object.
     *
     * @param service The service to resolve
     * @return The singleton instance
     * @throws org.stianloader.servicelocator.error.InjectionException If the service cannot be resolved
     */
    @NotNull
    <T> T singleton(@NotNull Class<T> service);

    /**
     * Tries to resolve every registered service once and reports every failure.
     * This method never throws because of a broken registration, but does invoke factories and constructors.
     *
     * @return A successful result, or a result holding an {@link org.stianloader.servicelocator.result.AggregateFailure}
     * with one entry per service that failed to resolve
     */
    @NotNull
    Result<Void> validate();

    @Nullable
    <T> T peekSingleton(@NotNull Class<T> service);

    boolean hasSingleton(@NotNull Class<?> service);

    @NotNull
    ServiceRegistration getRegistration();
}
