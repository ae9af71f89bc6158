package org.stianloader.servicelocator.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a stored or constructed object is not an instance of the service it was registered under.
 */
public class TypeMismatchException extends InjectionException {

    private static final long serialVersionUID = 6180335745262390134L;

    public TypeMismatchException(@NotNull String message, @Nullable Class<?> service) {
        super(message, service);
    }
}
