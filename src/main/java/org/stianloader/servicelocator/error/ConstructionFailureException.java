package org.stianloader.servicelocator.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a factory or a constructor failed to produce an instance.
 * The original failure is available through {@link #getCause()}.
 */
public class ConstructionFailureException extends InjectionException {

    private static final long serialVersionUID = -1237794420168833019L;

    public ConstructionFailureException(@NotNull String message, @Nullable Class<?> service) {
        super(message, service);
    }

    public ConstructionFailureException(@NotNull String message, @Nullable Class<?> service, @Nullable Throwable cause) {
        super(message, service, cause);
    }
}
