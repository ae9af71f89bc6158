package org.stianloader.servicelocator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.Unmodifiable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stianloader.servicelocator.error.InvalidRegistrationException;

public class SimpleServiceRegistrationImpl implements ServiceRegistration {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimpleServiceRegistrationImpl.class);

    @NotNull
    private final Map<Class<?>, Registration<?>> registrations;
    @NotNull
    private final DuplicatePolicy duplicatePolicy;

    public SimpleServiceRegistrationImpl() {
        this(DuplicatePolicy.REPLACE);
    }

    public SimpleServiceRegistrationImpl(@NotNull DuplicatePolicy duplicatePolicy) {
        if (duplicatePolicy == null) {
            throw new IllegalArgumentException("'duplicatePolicy' may not be null!");
        }
        this.registrations = new LinkedHashMap<>();
        this.duplicatePolicy = duplicatePolicy;
    }

    public SimpleServiceRegistrationImpl(@NotNull SimpleServiceRegistrationImpl impl) {
        this.registrations = new LinkedHashMap<>(impl.registrations);
        this.duplicatePolicy = impl.duplicatePolicy;
    }

    @NotNull
    public DuplicatePolicy getDuplicatePolicy() {
        return this.duplicatePolicy;
    }

    @Override
    @NotNull
    @Unmodifiable
    public Map<Class<?>, Registration<?>> getRegistrations() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(this.registrations));
    }

    @Override
    @Nullable
    @SuppressWarnings("unchecked")
    public <T> Registration<T> getRegistration(@NotNull Class<T> service) {
        return (Registration<T>) this.registrations.get(service);
    }

    @Override
    public boolean contains(@NotNull Class<?> service) {
        return this.registrations.containsKey(service);
    }

    @Override
    @NotNull
    public <T> ServiceRegistration addType(@NotNull Class<T> type) {
        return this.addType(type, type);
    }

    @Override
    @NotNull
    public <T> ServiceRegistration addType(@NotNull Class<T> service, @NotNull Class<? extends T> implementation) {
        SimpleServiceRegistrationImpl.requireNonNull(service, "service", null);
        SimpleServiceRegistrationImpl.requireNonNull(implementation, "implementation", service);
        if (!service.isAssignableFrom(implementation)) {
            throw new InvalidRegistrationException("Implementation type '" + implementation.getName() + "' is not assignable to service '" + service.getName() + "'", service);
        }
        return this.put(service, Registration.ofType(implementation));
    }

    @Override
    @NotNull
    @SuppressWarnings("unchecked")
    public <T> ServiceRegistration addInstance(@NotNull T instance) {
        SimpleServiceRegistrationImpl.requireNonNull(instance, "instance", null);
        return this.put((Class<T>) instance.getClass(), Registration.ofInstance(instance));
    }

    @Override
    @NotNull
    public <T> ServiceRegistration addInstance(@NotNull Class<T> service, @NotNull T instance) {
        SimpleServiceRegistrationImpl.requireNonNull(service, "service", null);
        SimpleServiceRegistrationImpl.requireNonNull(instance, "instance", service);
        return this.put(service, Registration.ofInstance(instance));
    }

    @Override
    @NotNull
    public <T> ServiceRegistration addFactory(@NotNull Class<T> service, @NotNull Supplier<? extends T> factory) {
        SimpleServiceRegistrationImpl.requireNonNull(service, "service", null);
        SimpleServiceRegistrationImpl.requireNonNull(factory, "factory", service);
        return this.put(service, Registration.ofFactory(factory, null));
    }

    @Override
    @NotNull
    public <T, I extends T> ServiceRegistration addFactory(@NotNull Class<T> service, @NotNull Class<I> implementation, @NotNull Supplier<I> factory) {
        SimpleServiceRegistrationImpl.requireNonNull(service, "service", null);
        SimpleServiceRegistrationImpl.requireNonNull(implementation, "implementation", service);
        SimpleServiceRegistrationImpl.requireNonNull(factory, "factory", service);
        return this.put(service, Registration.ofFactory(factory, implementation));
    }

    @Override
    public boolean remove(@NotNull Class<?> service) {
        boolean removed = this.registrations.remove(service) != null;
        if (removed) {
            LOGGER.debug("Removed registration of {}", service.getName());
        }
        return removed;
    }

    @NotNull
    private <T> ServiceRegistration put(@NotNull Class<T> service, @NotNull Registration<T> registration) {
        if (this.duplicatePolicy == DuplicatePolicy.REJECT && this.registrations.containsKey(service)) {
            throw new InvalidRegistrationException("Service '" + service.getName() + "' is already registered as " + this.registrations.get(service).getDisplayString(), service);
        }
        Registration<?> previous = this.registrations.put(service, registration);
        if (previous == null) {
            LOGGER.debug("Registered {} as {}", service.getName(), registration.getDisplayString());
        } else {
            LOGGER.debug("Replaced registration of {} ({}) with {}", service.getName(), previous.getDisplayString(), registration.getDisplayString());
        }
        return this;
    }

    private static void requireNonNull(@Nullable Object value, @NotNull String name, @Nullable Class<?> service) {
        if (value == null) {
            throw new InvalidRegistrationException("'" + name + "' may not be null!", service);
        }
    }
}
