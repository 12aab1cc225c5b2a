// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained.kernel;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.constrained.Constrained;

/**
 * A table of Java classes that are to be treated as compatible with
 * constrained containers without being modified to implement
 * {@link Constrained}. These are typically sequence types that are
 * homogeneous by nature, like {@code String} or {@code int[]}.
 * <p>
 * The broad compatibility test {@link #isCompatible(Class)} consults
 * this table and the class hierarchy. The narrow structural test
 * {@link Constrained#conforms(Object)} does not consult it.
 * <p>
 * In normal operation (outside test cases) there is only one instance
 * of this class, owned by {@code ConstrainedTypes}. Instances are
 * protected from concurrent modification by synchronising on the
 * registry.
 */
public class CompatibilityRegistry {

    /** Logger for registry changes. */
    static final Logger logger =
            LoggerFactory.getLogger(CompatibilityRegistry.class);

    /** The registered classes, in order of registration. */
    private final Set<Class<?>> registered = new LinkedHashSet<>();

    /** Create an empty registry. */
    public CompatibilityRegistry() {}

    /**
     * Register a class as compatible.
     *
     * @param c class to register
     * @return {@code true} if it was not already registered
     */
    public synchronized boolean register(Class<?> c) {
        Objects.requireNonNull(c, "registered class");
        boolean added = registered.add(c);
        if (added) {
            logger.atDebug().setMessage("Registered {} as compatible")
                    .addArgument(c::getName).log();
        }
        return added;
    }

    /**
     * Remove a class from the registry. A class that implements
     * {@link Constrained} remains compatible.
     *
     * @param c class to remove
     * @return {@code true} if it was registered
     */
    public synchronized boolean unregister(Class<?> c) {
        boolean removed = registered.remove(c);
        if (removed) {
            logger.atDebug().setMessage("Unregistered {}")
                    .addArgument(c::getName).log();
        }
        return removed;
    }

    /**
     * Test whether a class was explicitly registered.
     *
     * @param c class to test
     * @return whether registered
     */
    public synchronized boolean isRegistered(Class<?> c) {
        return registered.contains(c);
    }

    /**
     * A snapshot of the registered classes, in order of registration.
     *
     * @return the registered classes (unmodifiable)
     */
    public synchronized Set<Class<?>> registered() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(registered));
    }

    /**
     * Test whether a class satisfies the broad compatibility contract:
     * it implements {@link Constrained}, or has been registered.
     *
     * @param c class to test
     * @return whether compatible
     */
    public boolean isCompatible(Class<?> c) {
        return c != null && (Constrained.class.isAssignableFrom(c)
                || isRegistered(c));
    }
}
