package org.stianloader.servicelocator.error;

import org.jetbrains.annotations.NotNull;

public class NotRegisteredException extends InjectionException {

    private static final long serialVersionUID = -7150902380632478207L;

    public NotRegisteredException(@NotNull Class<?> service) {
        super("Service '" + service.getName() + "' is not registered", service);
    }
}
