package org.stianloader.servicelocator;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.jetbrains.annotations.NotNull;
import org.stianloader.servicelocator.error.ConstructionFailureException;
import org.stianloader.servicelocator.error.NoValidConstructorException;

/**
 * Implementation of the {@link InstanceAllocator} interface using
 * reflection. Located constructors are cached per type.
 */
public class ReflectionInstanceAllocator implements InstanceAllocator {

    @NotNull
    public static final ReflectionInstanceAllocator INSTANCE = new ReflectionInstanceAllocator();

    private final Map<Class<?>, Constructor<?>> constructors = new ConcurrentHashMap<>();

    @Override
    @NotNull
    @SuppressWarnings("unchecked")
    public <T> T allocate(@NotNull Class<T> type) {
        Constructor<T> ctor = (Constructor<T>) this.constructors.get(type);
        if (ctor == null) {
            ctor = ReflectionInstanceAllocator.findConstructor(type);
            this.constructors.put(type, ctor);
        }

        try {
            return ctor.newInstance();
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof VirtualMachineError) {
                throw (VirtualMachineError) cause;
            }
            throw new ConstructionFailureException("Constructor of class " + type.getName() + " threw an exception", null, cause);
        } catch (LinkageError e) {
            // ExceptionInInitializerError on the first attempt, NoClassDefFoundError afterwards
            throw new ConstructionFailureException("Class " + type.getName() + " failed to initialize", null, e);
        } catch (InstantiationException | IllegalAccessException | IllegalArgumentException e) {
            throw new NoValidConstructorException("Unable to call the parameterless constructor of class " + type.getName(), null, type, e);
        }
    }

    @NotNull
    private static <T> Constructor<T> findConstructor(@NotNull Class<T> type) {
        if (type.isInterface() || type.isArray() || type.isPrimitive() || Modifier.isAbstract(type.getModifiers())) {
            throw new NoValidConstructorException("Cannot create an instance of " + type + ". It is an interface, abstract class or any other type which cannot be initialized through a constructor.", null, type, null);
        }

        Constructor<T> ctor;
        try {
            ctor = type.getConstructor();
        } catch (NoSuchMethodException e) {
            throw new NoValidConstructorException("Class " + type.getName() + " has no public parameterless constructor", null, type, e);
        }

        if (!Modifier.isPublic(type.getModifiers())) {
            // A public constructor of a non-public class is still unreachable without setAccessible
            throw new NoValidConstructorException("Class " + type.getName() + " is not public; its parameterless constructor is not accessible", null, type, null);
        }
        return ctor;
    }
}
