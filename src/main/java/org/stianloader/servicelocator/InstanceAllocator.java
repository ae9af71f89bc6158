package org.stianloader.servicelocator;

import org.jetbrains.annotations.NotNull;
import org.stianloader.servicelocator.error.ConstructionFailureException;
import org.stianloader.servicelocator.error.NoValidConstructorException;

/**
 * Creates fresh instances of concrete types for {@link Registration.Kind#TYPE type registrations}.
 */
public interface InstanceAllocator {
    /**
     * Creates a new instance of the given type using its public parameterless constructor.
     *
     * @param type The concrete type to instantiate
     * @return The created instance
     * @throws NoValidConstructorException If the type has no accessible public parameterless constructor or cannot be instantiated at all
     * @throws ConstructionFailureException If the constructor threw
     */
    @NotNull
    <T> T allocate(@NotNull Class<T> type);
}
