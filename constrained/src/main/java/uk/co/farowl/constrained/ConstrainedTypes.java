// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.constrained.kernel.ClassConstraints;
import uk.co.farowl.constrained.kernel.CompatibilityRegistry;
import uk.co.farowl.constrained.kernel.ContainerFactory;
import uk.co.farowl.constrained.support.DerivationError;

/**
 * {@code ConstrainedTypes} is the nexus of class-level constraint
 * look-up, compatibility registration and the derivation of container
 * classes at run time. It holds the single instance of each of the
 * kernel objects that do this work, created by the static
 * initialisation of this class.
 * <p>
 * The following system properties are read once, during that
 * initialisation:
 * <dl>
 * <dt>{@value #PREREGISTER_PROPERTY}</dt>
 * <dd>If defined and nothing like "false", or not defined at all, the
 * registry of compatible classes begins with {@code String} and the
 * primitive array classes. (Set "false" to begin with an empty
 * table.)</dd>
 * <dt>{@value #PACKAGE_PROPERTY}</dt>
 * <dd>The package in which derived classes are created (default
 * {@value #DEFAULT_PACKAGE}).</dd>
 * <dt>{@value #DUMP_PROPERTY}</dt>
 * <dd>A directory to which to write the class files of derived
 * classes, so they may be examined with {@code javap}.</dd>
 * </dl>
 */
public final class ConstrainedTypes {

    private ConstrainedTypes() {} // no instances and static members only

    /** Logger for (the public face of) the constrained types. */
    static final Logger logger =
            LoggerFactory.getLogger(ConstrainedTypes.class);

    /** Property that controls pre-registration of host classes. */
    public static final String PREREGISTER_PROPERTY =
            "uk.co.farowl.constrained.preregister";

    /** Property naming the package of derived classes. */
    public static final String PACKAGE_PROPERTY =
            "uk.co.farowl.constrained.derivedPackage";

    /** Property naming a directory for class files. */
    public static final String DUMP_PROPERTY =
            "uk.co.farowl.constrained.dumpClasses";

    /** Package of derived classes if not configured. */
    public static final String DEFAULT_PACKAGE =
            "uk.co.farowl.constrained.derived";

    /**
     * Host classes that are sequences of a single element type by their
     * nature, registered as compatible unless configured otherwise.
     */
    static final List<Class<?>> HOST_SEQUENCES = List.of(String.class,
            boolean[].class, byte[].class, char[].class, short[].class,
            int[].class, long[].class, float[].class, double[].class);

    /** Class-level constraints of each container class. */
    private static final ClassConstraints declarations;

    /** Classes recognised as compatible without implementation. */
    private static final CompatibilityRegistry registry;

    /** Factory for container classes derived at run time. */
    private static final ContainerFactory factory;

    static {
        declarations = new ClassConstraints();
        registry = createRegistry(System.getProperty(PREREGISTER_PROPERTY));
        factory = createFactory(System.getProperty(PACKAGE_PROPERTY),
                System.getProperty(DUMP_PROPERTY));

        logger.atInfo()
                .setMessage("Constrained types ready with {} registered")
                .addArgument(() -> registry.registered().size()).log();
    }

    /**
     * Create the registry of compatible classes, seeded with the
     * {@link #HOST_SEQUENCES} unless the value of
     * {@value #PREREGISTER_PROPERTY} says not to.
     *
     * @param preregister value of the property (or {@code null})
     * @return the new registry
     */
    static CompatibilityRegistry createRegistry(String preregister) {
        CompatibilityRegistry r = new CompatibilityRegistry();
        if (truthy(preregister, true)) {
            for (Class<?> c : HOST_SEQUENCES) { r.register(c); }
        }
        return r;
    }

    /**
     * Create the factory for derived classes from the values of
     * {@value #PACKAGE_PROPERTY} and {@value #DUMP_PROPERTY}.
     *
     * @param derivedPackage package of derived classes (or
     *     {@code null} for the default)
     * @param dump directory for class files (or {@code null})
     * @return the new factory
     */
    static ContainerFactory createFactory(String derivedPackage,
            String dump) {
        return new ContainerFactory(
                derivedPackage == null ? DEFAULT_PACKAGE : derivedPackage,
                "%s$%d", dump == null ? null : Path.of(dump));
    }

    /**
     * Value is nothing like "false", or is {@code null} and the default
     * is {@code true}.
     */
    private static boolean truthy(String value, boolean dflt) {
        return value == null ? dflt : !"false".equals(value.toLowerCase());
    }

    /**
     * The allowed types declared by a container class for all its
     * instances, or {@link AllowedTypes#OPEN} if it declares none. (An
     * instance may still be given explicit constraints when
     * constructed.)
     *
     * @param c a class derived from {@link ConstrainedList}
     * @return declared allowed types
     * @throws IllegalArgumentException if {@code c} is not derived from
     *     {@code ConstrainedList}
     * @throws DerivationError if the declaration is invalid
     */
    public static AllowedTypes declaredTypes(Class<?> c)
            throws IllegalArgumentException, DerivationError {
        if (!ConstrainedList.class.isAssignableFrom(c)) {
            throw new IllegalArgumentException(String.format(
                    "%s is not a constrained container class",
                    c.getName()));
        }
        return declarations.get(c);
    }

    /**
     * Test whether a class satisfies the broad compatibility contract:
     * it implements {@link Constrained}, or has been registered with
     * {@link #register(Class)}.
     *
     * @param c class to test
     * @return whether compatible
     */
    public static boolean isCompatible(Class<?> c) {
        return registry.isCompatible(c);
    }

    /**
     * Register a class as compatible without it implementing
     * {@link Constrained}.
     *
     * @param c class to register
     * @return {@code true} if it was not already registered
     */
    public static boolean register(Class<?> c) {
        return registry.register(c);
    }

    /**
     * Remove a class from the registered compatible classes.
     *
     * @param c class to remove
     * @return {@code true} if it was registered
     */
    public static boolean unregister(Class<?> c) {
        return registry.unregister(c);
    }

    /**
     * A snapshot of the registered compatible classes.
     *
     * @return registered classes (unmodifiable)
     */
    public static Set<Class<?>> registered() {
        return registry.registered();
    }

    /**
     * Find or create a container class derived from
     * {@link ConstrainedList} according to a specification.
     * Specifications that are equal produce the same class.
     *
     * @param spec of the class
     * @return the derived class
     * @throws DerivationError if the class cannot be created
     */
    public static Class<? extends ConstrainedList<?>>
            derive(DerivationSpec spec) throws DerivationError {
        return factory.findOrCreate(spec);
    }

    /**
     * Construct an instance of a container class through its public
     * constructor {@code (Iterable, AllowedTypes)}. This is the way to
     * construct instances of classes created by
     * {@link #derive(DerivationSpec)}.
     *
     * @param <C> the container class
     * @param type the container class
     * @param initial elements of the container
     * @param constraints explicit allowed types (or {@code null})
     * @return the new container
     * @throws ConstraintViolation if the initial elements are refused
     * @throws DerivationError if there is no such constructor
     */
    public static <C extends ConstrainedList<?>> C newInstance(
            Class<C> type, Iterable<?> initial, AllowedTypes constraints)
            throws ConstraintViolation, DerivationError {
        MethodHandle cons;
        try {
            cons = MethodHandles.publicLookup().findConstructor(type,
                    MethodType.methodType(void.class, Iterable.class,
                            AllowedTypes.class));
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new DerivationError(e,
                    "%s has no public constructor (Iterable, AllowedTypes)",
                    type.getName());
        }
        try {
            return type.cast(cons.invoke(initial, constraints));
        } catch (RuntimeException | Error e) {
            // Includes ConstraintViolation: the caller should see it.
            throw e;
        } catch (Throwable t) {
            throw new DerivationError(t, "constructing %s",
                    type.getName());
        }
    }

    /**
     * Construct an instance of a container class through its public
     * constructor {@code (Iterable, AllowedTypes)}, with constraints
     * from the class or inferred from the initial elements.
     *
     * @param <C> the container class
     * @param type the container class
     * @param initial elements of the container
     * @return the new container
     * @throws ConstraintViolation if the initial elements are refused
     * @throws DerivationError if there is no such constructor
     */
    public static <C extends ConstrainedList<?>> C newInstance(
            Class<C> type, Iterable<?> initial)
            throws ConstraintViolation, DerivationError {
        return newInstance(type, initial, null);
    }
}
