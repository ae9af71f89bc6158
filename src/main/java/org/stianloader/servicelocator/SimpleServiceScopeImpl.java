package org.stianloader.servicelocator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stianloader.servicelocator.error.ConstructionFailureException;
import org.stianloader.servicelocator.error.InjectionException;
import org.stianloader.servicelocator.error.InvalidRegistrationShapeException;
import org.stianloader.servicelocator.error.NoValidConstructorException;
import org.stianloader.servicelocator.error.NotRegisteredException;
import org.stianloader.servicelocator.error.TypeMismatchException;
import org.stianloader.servicelocator.result.Failure;
import org.stianloader.servicelocator.result.Result;

/**
 * Default {@link ServiceScope}. Like the registration it is bound to, this class is not
 * thread safe: the singleton cache is a plain map.
 */
public class SimpleServiceScopeImpl implements ServiceScope {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimpleServiceScopeImpl.class);

    @NotNull
    private final ServiceRegistration registration;
    @NotNull
    private final InstanceAllocator allocator;
    @NotNull
    private final Map<Class<?>, Object> singletons = new HashMap<>();

    public SimpleServiceScopeImpl(@NotNull ServiceRegistration registration) {
        this(registration, ReflectionInstanceAllocator.INSTANCE);
    }

    public SimpleServiceScopeImpl(@NotNull ServiceRegistration registration, @NotNull InstanceAllocator allocator) {
        if (registration == null || allocator == null) {
            throw new IllegalArgumentException("Neither 'registration' nor 'allocator' may be null!");
        }
        this.registration = registration;
        this.allocator = allocator;
    }

    @Override
    @NotNull
    public <T> T newInstance(@NotNull Class<T> service) {
        Registration<T> registered = this.registration.getRegistration(service);
        if (registered == null) {
            throw new NotRegisteredException(service);
        }

        LOGGER.trace("Resolving {} from {}", service.getName(), registered.getDisplayString());

        // Instance registrations take priority over the other kinds
        T instance = registered.getInstance();
        if (registered.getKind() == Registration.Kind.INSTANCE && instance != null) {
            return SimpleServiceScopeImpl.checkType(service, instance, "Registered instance");
        }

        switch (registered.getKind()) {
        case FACTORY:
            Supplier<? extends T> factory = registered.getFactory();
            if (factory != null) {
                return this.invokeFactory(service, factory);
            }
            break;
        case TYPE:
            Class<? extends T> implementation = registered.getImplementationType();
            if (implementation != null) {
                return this.allocate(service, implementation);
            }
            break;
        default:
            break;
        }

        throw new InvalidRegistrationShapeException("Invalid registration of " + service.getName() + ": " + registered.getKind()
            + " registration is neither an instance, a factory nor a type", service);
    }

    @Override
    @NotNull
    public <T> T singleton(@NotNull Class<T> service) {
        Registration<T> registered = this.registration.getRegistration(service);
        if (registered != null && registered.getKind() == Registration.Kind.INSTANCE) {
            T instance = registered.getInstance();
            if (service.isInstance(instance)) {
                return service.cast(instance);
            }
        }

        Object cached = this.singletons.get(service);
        if (cached != null && service.isInstance(cached)) {
            return service.cast(cached);
        }

        T created = this.newInstance(service);
        this.singletons.put(service, created);
        LOGGER.debug("Created singleton of {}", service.getName());
        return created;
    }

    @Override
    @NotNull
    public Result<Void> validate() {
        List<Failure> errors = new ArrayList<>();
        Map<Class<?>, Registration<?>> snapshot = this.registration.getRegistrations();
        for (Class<?> service : snapshot.keySet()) {
            try {
                this.newInstance(service);
            } catch (InjectionException e) {
                LOGGER.warn("Service {} cannot be resolved: {}", service.getName(), e.getMessage());
                errors.add(Failure.of(service.getName() + ": " + e.getMessage(), e, service));
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable t) {
                LOGGER.warn("Service {} cannot be resolved", service.getName(), t);
                errors.add(Failure.of(service.getName() + ": " + t, t, service));
            }
        }

        if (errors.isEmpty()) {
            LOGGER.info("Validated {} registrations", snapshot.size());
            return Result.success();
        }

        LOGGER.info("Validated {} registrations, {} failed", snapshot.size(), errors.size());
        return Result.aggregate(errors);
    }

    @Override
    @Nullable
    public <T> T peekSingleton(@NotNull Class<T> service) {
        Object cached = this.singletons.get(service);
        return service.isInstance(cached) ? service.cast(cached) : null;
    }

    @Override
    public boolean hasSingleton(@NotNull Class<?> service) {
        return this.singletons.containsKey(service);
    }

    @Override
    @NotNull
    public ServiceRegistration getRegistration() {
        return this.registration;
    }

    @NotNull
    private <T> T invokeFactory(@NotNull Class<T> service, @NotNull Supplier<? extends T> factory) {
        Object produced;
        try {
            produced = factory.get();
        } catch (Throwable t) {
            if (t instanceof VirtualMachineError) {
                throw (VirtualMachineError) t;
            }
            throw new ConstructionFailureException("Factory of " + service.getName() + " threw an exception", service, t);
        }

        if (produced == null) {
            throw new ConstructionFailureException("Factory of " + service.getName() + " returned null", service);
        }
        return SimpleServiceScopeImpl.checkType(service, produced, "Factory result");
    }

    @NotNull
    private <T> T allocate(@NotNull Class<T> service, @NotNull Class<?> implementation) {
        Object allocated;
        try {
            allocated = this.allocator.allocate(implementation);
        } catch (NoValidConstructorException e) {
            throw new NoValidConstructorException("Invalid registration of " + service.getName() + ": " + e.getMessage(), service, e.getImplementation(), e.getCause());
        } catch (ConstructionFailureException e) {
            throw new ConstructionFailureException("Unable to construct " + service.getName() + ": " + e.getMessage(), service, e.getCause());
        } catch (InjectionException e) {
            throw e;
        } catch (RuntimeException | LinkageError e) {
            throw new ConstructionFailureException("Allocator failed to construct " + implementation.getName() + " for " + service.getName(), service, e);
        }
        return SimpleServiceScopeImpl.checkType(service, allocated, "Constructed object");
    }

    @NotNull
    private static <T> T checkType(@NotNull Class<T> service, @NotNull Object value, @NotNull String what) {
        if (!service.isInstance(value)) {
            throw new TypeMismatchException("Invalid registration: " + what + " of type " + value.getClass().getName()
                + " is not an instance of " + service.getName(), service);
        }
        return service.cast(value);
    }
}
