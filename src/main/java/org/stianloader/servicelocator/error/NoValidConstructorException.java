package org.stianloader.servicelocator.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when the implementation type of a type registration cannot be instantiated
 * through a public parameterless constructor.
 */
public class NoValidConstructorException extends InjectionException {

    private static final long serialVersionUID = 5526180920133794567L;

    @NotNull
    private final Class<?> implementation;

    public NoValidConstructorException(@NotNull String message, @Nullable Class<?> service, @NotNull Class<?> implementation, @Nullable Throwable cause) {
        super(message, service, cause);
        this.implementation = implementation;
    }

    @NotNull
    public Class<?> getImplementation() {
        return this.implementation;
    }
}
