package org.stianloader.servicelocator.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Base type of every failure raised while registering or resolving a service.
 *
 * <p>Resolution methods throw on the first broken registration they encounter. To inspect all broken
 * registrations at once, use {@link org.stianloader.servicelocator.ServiceScope#validate()}.
 */
public class InjectionException extends RuntimeException {

    private static final long serialVersionUID = 8316624861052338213L;

    @Nullable
    private final Class<?> service;

    public InjectionException(@NotNull String message, @Nullable Class<?> service) {
        super(message);
        this.service = service;
    }

    public InjectionException(@NotNull String message, @Nullable Class<?> service, @Nullable Throwable cause) {
        super(message, cause);
        this.service = service;
    }

    /**
     * Obtains the service identifier the failing operation was performed on.
     *
     * @return The service type, or null if the failure is not tied to a single service
     */
    @Nullable
    public Class<?> getService() {
        return this.service;
    }
}
