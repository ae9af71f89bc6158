package org.stianloader.servicelocator.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a registration is rejected at write time, for example because a null
 * value was supplied or the registration would replace an existing one while duplicates are rejected.
 */
public class InvalidRegistrationException extends InjectionException {

    private static final long serialVersionUID = 2958146093751173211L;

    public InvalidRegistrationException(@NotNull String message, @Nullable Class<?> service) {
        super(message, service);
    }
}
