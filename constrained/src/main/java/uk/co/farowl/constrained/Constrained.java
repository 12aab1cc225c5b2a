// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained;

/**
 * An object that exposes the set of types it allows as elements. This
 * is the narrow, structural contract: a class may implement it and
 * apply its own checks, without deriving from {@link ConstrainedList}.
 * <p>
 * Note that classes recognised as compatible only because they have
 * been registered with {@link ConstrainedTypes#register(Class)} (such
 * as {@code String}) do not conform to this interface. Use
 * {@link ConstrainedTypes#isCompatible(Class)} for the broader test.
 */
public interface Constrained {

    /**
     * The set of types this object allows as elements.
     *
     * @return the allowed types
     */
    AllowedTypes allowedTypes();

    /**
     * Test whether an object exposes a set of allowed types. This is
     * true of a {@code Constrained} instance that gives a
     * non-{@code null} answer to {@link #allowedTypes()}, and of a
     * {@code Class} that implements {@code Constrained} (since all
     * instances of it expose one). The registry of compatible classes
     * is not consulted.
     *
     * @param obj to test
     * @return whether {@code obj} conforms
     */
    static boolean conforms(Object obj) {
        if (obj instanceof Constrained c) {
            return c.allowedTypes() != null;
        } else if (obj instanceof Class<?> k) {
            return Constrained.class.isAssignableFrom(k);
        } else {
            return false;
        }
    }
}
