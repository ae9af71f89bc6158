package org.stianloader.servicelocator;

/**
 * Decides what a {@link ServiceRegistration} does when a service is registered a second time.
 */
public enum DuplicatePolicy {
    /**
     * The later registration silently replaces the earlier one.
     */
    REPLACE,
    /**
     * The later registration is rejected with an {@link org.stianloader.servicelocator.error.InvalidRegistrationException}.
     */
    REJECT
}
