package org.stianloader.test.servicelocator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import org.stianloader.servicelocator.InstanceAllocator;
import org.stianloader.servicelocator.ServiceRegistration;
import org.stianloader.servicelocator.ServiceScope;
import org.stianloader.servicelocator.SimpleServiceRegistrationImpl;
import org.stianloader.servicelocator.SimpleServiceScopeImpl;
import org.stianloader.servicelocator.error.ConstructionFailureException;
import org.stianloader.servicelocator.error.NoValidConstructorException;
import org.stianloader.servicelocator.error.NotRegisteredException;
import org.stianloader.servicelocator.error.TypeMismatchException;

public class SimpleServiceScopeImplTest {

    @Test
    public void instanceIsSharedByNewAndSingleton() {
        StubEventLogger logger = new StubEventLogger();
        ServiceScope scope = new SimpleServiceScopeImpl(new SimpleServiceRegistrationImpl().addInstance(EventLogger.class, logger));

        assertSame(logger, scope.newInstance(EventLogger.class));
        assertSame(logger, scope.singleton(EventLogger.class));
        assertSame(logger, scope.newInstance(EventLogger.class));
        // instance registrations are singletons already and never enter the cache
        assertFalse(scope.hasSingleton(EventLogger.class));
    }

    @Test
    public void factoryIsInvokedOnEveryNewInstance() {
        AtomicInteger calls = new AtomicInteger();
        ServiceScope scope = new SimpleServiceScopeImpl(new SimpleServiceRegistrationImpl()
                .addFactory(EventLogger.class, () -> {
                    calls.incrementAndGet();
                    return new StubEventLogger();
                }));

        EventLogger first = scope.newInstance(EventLogger.class);
        EventLogger second = scope.newInstance(EventLogger.class);
        assertEquals(2, calls.get());
        assertNotSame(first, second);
        assertFalse(scope.hasSingleton(EventLogger.class));
    }

    @Test
    public void factoryIsInvokedOnceForSingletons() {
        AtomicInteger calls = new AtomicInteger();
        ServiceScope scope = new SimpleServiceScopeImpl(new SimpleServiceRegistrationImpl()
                .addFactory(EventLogger.class, StubEventLogger.class, () -> {
                    calls.incrementAndGet();
                    return new StubEventLogger();
                }));

        EventLogger first = scope.singleton(EventLogger.class);
        EventLogger second = scope.singleton(EventLogger.class);
        assertSame(first, second);
        assertEquals(1, calls.get());
        assertSame(first, scope.peekSingleton(EventLogger.class));
    }

    @Test
    public void typeRegistrationCreatesFreshInstances() {
        ServiceScope scope = new SimpleServiceScopeImpl(new SimpleServiceRegistrationImpl().addType(CountingService.class));
        int before = CountingService.CONSTRUCTED.get();

        CountingService first = scope.newInstance(CountingService.class);
        CountingService second = scope.newInstance(CountingService.class);
        assertNotSame(first, second);
        assertEquals(before + 2, CountingService.CONSTRUCTED.get());
    }

    @Test
    public void singletonOfTypeRegistration() {
        ServiceScope scope = new SimpleServiceScopeImpl(new SimpleServiceRegistrationImpl().addType(Clock.class, SystemClock.class));
        assertNull(scope.peekSingleton(Clock.class));

        Clock clock = scope.singleton(Clock.class);
        assertTrue(clock instanceof SystemClock);
        assertSame(clock, scope.singleton(Clock.class));
        assertNotSame(clock, scope.newInstance(Clock.class));
        assertTrue(scope.hasSingleton(Clock.class));
    }

    @Test
    public void scopesHaveSeparateSingletonCaches() {
        ServiceRegistration registration = new SimpleServiceRegistrationImpl().addType(Clock.class, SystemClock.class);
        ServiceScope first = new SimpleServiceScopeImpl(registration);
        ServiceScope second = new SimpleServiceScopeImpl(registration);

        assertNotSame(first.singleton(Clock.class), second.singleton(Clock.class));
        assertSame(registration, first.getRegistration());
    }

    @Test
    public void unregisteredServiceFails() {
        ServiceScope scope = new SimpleServiceScopeImpl(new SimpleServiceRegistrationImpl());
        NotRegisteredException e = assertThrows(NotRegisteredException.class, () -> scope.newInstance(Clock.class));
        assertSame(Clock.class, e.getService());
        assertThrows(NotRegisteredException.class, () -> scope.singleton(Clock.class));
        assertFalse(scope.hasSingleton(Clock.class));
    }

    @Test
    public void replacedRegistrationIsResolved() {
        SystemClock first = new SystemClock();
        SystemClock second = new SystemClock();
        ServiceRegistration registration = new SimpleServiceRegistrationImpl().addInstance(Clock.class, first);
        ServiceScope scope = new SimpleServiceScopeImpl(registration);
        assertSame(first, scope.newInstance(Clock.class));

        registration.addInstance(Clock.class, second);
        assertSame(second, scope.newInstance(Clock.class));
        assertSame(second, scope.singleton(Clock.class));

        registration.addFactory(Clock.class, SystemClock::new);
        Clock produced = scope.newInstance(Clock.class);
        assertNotSame(first, produced);
        assertNotSame(second, produced);
    }

    @Test
    public void missingParameterlessConstructor() {
        ServiceScope scope = new SimpleServiceScopeImpl(new SimpleServiceRegistrationImpl().addType(Repository.class, InjectedObject.class));
        NoValidConstructorException e = assertThrows(NoValidConstructorException.class, () -> scope.newInstance(Repository.class));
        assertSame(Repository.class, e.getService());
        assertSame(InjectedObject.class, e.getImplementation());
    }

    @Test
    public void uninstantiableTypes() {
        ServiceScope scope = new SimpleServiceScopeImpl(new SimpleServiceRegistrationImpl()
                .addType(Clock.class)
                .addType(AbstractService.class));
        assertThrows(NoValidConstructorException.class, () -> scope.newInstance(Clock.class));
        assertThrows(NoValidConstructorException.class, () -> scope.newInstance(AbstractService.class));
    }

    @Test
    public void nonPublicTypeIsNotAccessible() {
        ServiceScope scope = new SimpleServiceScopeImpl(new SimpleServiceRegistrationImpl().addType(HiddenService.class));
        assertThrows(NoValidConstructorException.class, () -> scope.newInstance(HiddenService.class));
    }

    @Test
    public void throwingConstructorIsConstructionFailure() {
        ServiceScope scope = new SimpleServiceScopeImpl(new SimpleServiceRegistrationImpl().addType(FailingService.class));
        ConstructionFailureException e = assertThrows(ConstructionFailureException.class, () -> scope.newInstance(FailingService.class));
        assertTrue(e.getCause() instanceof IllegalStateException);
        assertEquals("Failing on purpose", e.getCause().getMessage());
        assertSame(FailingService.class, e.getService());
    }

    @Test
    public void throwingFactoryIsConstructionFailure() {
        IllegalArgumentException failure = new IllegalArgumentException("no logger today");
        ServiceScope scope = new SimpleServiceScopeImpl(new SimpleServiceRegistrationImpl()
                .addFactory(EventLogger.class, () -> {
                    throw failure;
                }));
        ConstructionFailureException e = assertThrows(ConstructionFailureException.class, () -> scope.singleton(EventLogger.class));
        assertSame(failure, e.getCause());
        assertFalse(scope.hasSingleton(EventLogger.class));
    }

    @Test
    public void nullFactoryResultIsConstructionFailure() {
        ServiceScope scope = new SimpleServiceScopeImpl(new SimpleServiceRegistrationImpl().addFactory(EventLogger.class, () -> null));
        assertThrows(ConstructionFailureException.class, () -> scope.newInstance(EventLogger.class));
    }

    @Test
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public void incompatibleObjectsAreTypeMismatches() {
        ServiceRegistration registration = new SimpleServiceRegistrationImpl();
        Class rawClock = Clock.class;
        registration.addInstance(rawClock, "not a clock");
        registration.addFactory(rawClock, EventLogger.class, StubEventLogger::new);
        ServiceScope scope = new SimpleServiceScopeImpl(registration);
        assertThrows(TypeMismatchException.class, () -> scope.newInstance(Clock.class));

        registration.addInstance(rawClock, "still not a clock");
        assertThrows(TypeMismatchException.class, () -> scope.newInstance(Clock.class));
        assertThrows(TypeMismatchException.class, () -> scope.singleton(Clock.class));
    }

    @Test
    public void customAllocatorIsUsedForTypes() {
        InstanceAllocator allocator = new InstanceAllocator() {
            @Override
            @SuppressWarnings("unchecked")
            public <T> T allocate(Class<T> type) {
                if (type == InjectedObject.class) {
                    return (T) new InjectedObject(42);
                }
                throw new IllegalArgumentException(type.getName());
            }
        };
        ServiceScope scope = new SimpleServiceScopeImpl(new SimpleServiceRegistrationImpl().addType(Repository.class, InjectedObject.class), allocator);
        assertEquals(42, scope.newInstance(Repository.class).getId());
    }

    @Test
    public void failingAllocatorIsWrapped() {
        IllegalArgumentException cause = new IllegalArgumentException("No allocation possible");
        ServiceScope scope = new SimpleServiceScopeImpl(new SimpleServiceRegistrationImpl().addType(Clock.class, SystemClock.class), new InstanceAllocator() {
            @Override
            public <T> T allocate(Class<T> type) {
                throw cause;
            }
        });

        ConstructionFailureException e = assertThrows(ConstructionFailureException.class, () -> scope.newInstance(Clock.class));
        assertSame(cause, e.getCause());
        assertSame(Clock.class, e.getService());
        assertThrows(ConstructionFailureException.class, () -> scope.singleton(Clock.class));
        assertFalse(scope.hasSingleton(Clock.class));
    }

    @Test
    public void brokenStaticInitializerIsWrapped() {
        ServiceScope scope = new SimpleServiceScopeImpl(new SimpleServiceRegistrationImpl().addType(BrokenStaticInitService.class));

        for (int i = 0; i < 2; i++) {
            ConstructionFailureException e = assertThrows(ConstructionFailureException.class, () -> scope.newInstance(BrokenStaticInitService.class));
            assertTrue(e.getCause() instanceof LinkageError);
            assertSame(BrokenStaticInitService.class, e.getService());
        }
    }
}
