package org.stianloader.servicelocator.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a stored registration is neither an instance, a factory nor a type registration.
 */
public class InvalidRegistrationShapeException extends InjectionException {

    private static final long serialVersionUID = -4404217829305815770L;

    public InvalidRegistrationShapeException(@NotNull String message, @Nullable Class<?> service) {
        super(message, service);
    }
}
