package org.stianloader.servicelocator;

import java.util.function.Consumer;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stianloader.servicelocator.result.AggregateFailure;
import org.stianloader.servicelocator.result.Result;

/**
 * Process-wide default {@link ServiceRegistration} and {@link ServiceScope}.
 *
 * <p>Both are created once, on first access, and live until the JVM exits. The registration is meant
 * to be populated at startup (see {@link #configure(Consumer)}) and then only read from.
 *
 * <p>The following system properties are read when the defaults are created:
 * <ul>
 * <li><code>org.stianloader.servicelocator.rejectDuplicates</code>: reject registering a service twice
 * instead of replacing the earlier registration.</li>
 * <li><code>org.stianloader.servicelocator.validateOnFirstAccess</code>: validate the default registration
 * when the default scope is first accessed. Each service that cannot be resolved is logged as a warning.</li>
 * </ul>
 */
public final class ServiceLocator {

    public static final String PROPERTY_REJECT_DUPLICATES = "org.stianloader.servicelocator.rejectDuplicates";
    public static final String PROPERTY_VALIDATE_ON_FIRST_ACCESS = "org.stianloader.servicelocator.validateOnFirstAccess";

    private static final Logger LOGGER = LoggerFactory.getLogger(ServiceLocator.class);

    @NotNull
    private static final Lazy<ServiceRegistration> REGISTRATION = new Lazy<>(ServiceLocator::createRegistration);
    @NotNull
    private static final Lazy<ServiceScope> DEFAULT_SCOPE = new Lazy<>(() -> ServiceLocator.createScope(REGISTRATION.get()));

    private ServiceLocator() {
        throw new AssertionError();
    }

    @NotNull
    public static ServiceRegistration getRegistration() {
        return REGISTRATION.get();
    }

    @NotNull
    public static ServiceScope getDefaultScope() {
        return DEFAULT_SCOPE.get();
    }

    /**
     * Creates a new scope bound to the default registration. The scope has its own singleton cache,
     * so its singletons are distinct from the ones of {@link #getDefaultScope()}.
     *
     * @return The created scope
     */
    @NotNull
    public static ServiceScope createScope() {
        return new SimpleServiceScopeImpl(ServiceLocator.getRegistration());
    }

    /**
     * Runs an action against the default registration. If the registration was not created yet,
     * the action is deferred until it is.
     *
     * @param action The action populating the registration
     */
    public static void configure(@NotNull Consumer<? super ServiceRegistration> action) {
        REGISTRATION.configure(action);
    }

    @NotNull
    public static <T> T newInstance(@NotNull Class<T> service) {
        return ServiceLocator.getDefaultScope().newInstance(service);
    }

    @NotNull
    public static <T> T singleton(@NotNull Class<T> service) {
        return ServiceLocator.getDefaultScope().singleton(service);
    }

    @NotNull
    public static Result<Void> validate() {
        return ServiceLocator.getDefaultScope().validate();
    }

    /**
     * Creates a new, empty registration whose duplicate policy follows the
     * <code>org.stianloader.servicelocator.rejectDuplicates</code> system property.
     * The default registration is created through this method.
     *
     * @return The created registration
     */
    @NotNull
    public static ServiceRegistration createRegistration() {
        DuplicatePolicy policy = Boolean.getBoolean(PROPERTY_REJECT_DUPLICATES) ? DuplicatePolicy.REJECT : DuplicatePolicy.REPLACE;
        LOGGER.debug("Creating service registration (duplicate policy: {})", policy);
        return new SimpleServiceRegistrationImpl(policy);
    }

    /**
     * Creates a new scope bound to the given registration. If the
     * <code>org.stianloader.servicelocator.validateOnFirstAccess</code> system property is set,
     * the registration is validated right away. Validation failures are logged and never thrown.
     * The default scope is created through this method.
     *
     * @param registration The registration to resolve services from
     * @return The created scope
     */
    @NotNull
    public static ServiceScope createScope(@NotNull ServiceRegistration registration) {
        ServiceScope scope = new SimpleServiceScopeImpl(registration);
        if (Boolean.getBoolean(PROPERTY_VALIDATE_ON_FIRST_ACCESS)) {
            scope.validate().catchError(failure -> {
                int count = failure instanceof AggregateFailure ? ((AggregateFailure) failure).getErrors().size() : 1;
                LOGGER.error("{} registered service(s) cannot be resolved", count);
            });
        }
        return scope;
    }
}
