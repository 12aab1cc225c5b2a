// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.function.Executable;

/**
 * A base class for unit tests that defines some common convenience
 * functions for which the need recurs.
 */
public class UnitTestSupport {

    /**
     * Shorthand for {@link AllowedTypes#of(Class...)}.
     *
     * @param types allowed classes
     * @return the set
     */
    public static AllowedTypes types(Class<?>... types) {
        return AllowedTypes.of(types);
    }

    /**
     * Assert that an action on a container is refused with the given
     * kind of violation, and that the container (its elements and its
     * allowed types) is unchanged afterwards.
     *
     * @param <V> kind of violation expected
     * @param kind of violation expected
     * @param list the container acted on
     * @param action to perform on {@code list}
     * @return the violation thrown
     */
    public static <V extends Throwable> V assertRefused(Class<V> kind,
            ConstrainedList<?> list, Executable action) {
        List<Object> before = new ArrayList<>(list);
        AllowedTypes allowed = list.allowedTypes();
        V v = assertThrows(kind, action);
        assertEquals(before, list, "elements changed by refused operation");
        assertSame(allowed, list.allowedTypes(),
                "allowed types changed by refused operation");
        return v;
    }

    /**
     * Assert the core invariant: every element of the container is
     * admitted by its allowed types.
     *
     * @param list to check
     */
    public static void assertAllAdmitted(ConstrainedList<?> list) {
        AllowedTypes allowed = list.allowedTypes();
        for (Object e : list) {
            assertTrue(allowed.admits(e), () -> String.format(
                    "%s holds %s outside %s", list, e, allowed));
        }
    }
}
