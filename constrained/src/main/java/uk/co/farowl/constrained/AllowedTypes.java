// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * An immutable set of Java classes, the run-time classes that a
 * constrained container admits as elements. Membership is tested
 * against the exact class of a candidate element, not by
 * assignability: a set containing {@code Number} does not admit an
 * {@code Integer}.
 * <p>
 * Primitive classes are replaced by their wrapper classes, since
 * elements are always objects. The special value {@link #OPEN} stands
 * for a declaration that could not be resolved at class level and is to
 * be resolved by each instance.
 */
public final class AllowedTypes {

    /** The empty set. It admits nothing. */
    public static final AllowedTypes EMPTY =
            new AllowedTypes(Collections.emptySet(), false);

    /**
     * The class-level marker for "not resolved". It admits nothing, and
     * is never the allowed types of a container instance.
     */
    public static final AllowedTypes OPEN =
            new AllowedTypes(Collections.emptySet(), true);

    /** The classes (wrappers for primitives). */
    private final Set<Class<?>> types;

    /** True only in {@link #OPEN}. */
    private final boolean open;

    private AllowedTypes(Set<Class<?>> types, boolean open) {
        this.types = types;
        this.open = open;
    }

    /**
     * Create a set from the classes given. Duplicates collapse.
     *
     * @param types the allowed classes
     * @return the set ({@link #EMPTY} if none given)
     * @throws NullPointerException if any class is {@code null}
     * @throws IllegalArgumentException if {@code void.class} is given
     */
    public static AllowedTypes of(Class<?>... types) {
        return of(Arrays.asList(types));
    }

    /**
     * Create a set from the classes given. Duplicates collapse.
     *
     * @param types the allowed classes
     * @return the set ({@link #EMPTY} if none given)
     * @throws NullPointerException if any class is {@code null}
     * @throws IllegalArgumentException if {@code void.class} is given
     */
    public static AllowedTypes of(Collection<? extends Class<?>> types) {
        Set<Class<?>> s = new LinkedHashSet<>();
        for (Class<?> c : types) {
            Objects.requireNonNull(c, "allowed type");
            s.add(boxed(c));
        }
        return s.isEmpty() ? EMPTY
                : new AllowedTypes(Collections.unmodifiableSet(s), false);
    }

    /**
     * Infer a set as the distinct run-time classes of the elements
     * given. {@code null} elements contribute nothing.
     *
     * @param elements to examine
     * @return the classes found ({@link #EMPTY} if none)
     */
    public static AllowedTypes inferFrom(Iterable<?> elements) {
        Set<Class<?>> s = new LinkedHashSet<>();
        for (Object e : elements) { if (e != null) { s.add(e.getClass()); } }
        return s.isEmpty() ? EMPTY
                : new AllowedTypes(Collections.unmodifiableSet(s), false);
    }

    /**
     * Return the union of this set with another. Neither may be
     * {@link #OPEN}.
     *
     * @param other to combine with this
     * @return the union
     * @throws IllegalStateException if either set is {@link #OPEN}
     */
    public AllowedTypes union(AllowedTypes other) {
        if (open || other.open) {
            throw new IllegalStateException(
                    "an unresolved type set has no union");
        }
        Set<Class<?>> s = new LinkedHashSet<>(types);
        s.addAll(other.types);
        return s.isEmpty() ? EMPTY
                : new AllowedTypes(Collections.unmodifiableSet(s), false);
    }

    /**
     * Test whether an object would be admitted as an element: its exact
     * run-time class is in the set. {@code null} is never admitted.
     *
     * @param element candidate
     * @return whether admitted
     */
    public boolean admits(Object element) {
        return element != null && types.contains(element.getClass());
    }

    /**
     * Test whether a class is a member of the set.
     *
     * @param c class to test (primitive classes test their wrapper)
     * @return whether a member
     */
    public boolean contains(Class<?> c) {
        return c != null && types.contains(boxed(c));
    }

    /** @return whether this is the class-level marker {@link #OPEN}. */
    public boolean isOpen() { return open; }

    /** @return whether the set has no members (true of {@link #OPEN}). */
    public boolean isEmpty() { return types.isEmpty(); }

    /** @return number of classes in the set */
    public int size() { return types.size(); }

    /** @return an unmodifiable view of the classes in the set. */
    public Set<Class<?>> toSet() { return types; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (obj instanceof AllowedTypes other) {
            return open == other.open && types.equals(other.types);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() { return types.hashCode() + (open ? 1 : 0); }

    /**
     * Simple names of the classes, sorted and parenthesised, like
     * {@code (Integer, String)}, or {@code (?)} for {@link #OPEN}.
     */
    @Override
    public String toString() {
        if (open) { return "(?)"; }
        StringJoiner sj = new StringJoiner(", ", "(", ")");
        types.stream().map(Class::getSimpleName)
                .sorted(Comparator.naturalOrder()).forEach(sj::add);
        return sj.toString();
    }

    /**
     * Replace a primitive class by its wrapper.
     *
     * @param c any class
     * @return {@code c} or its wrapper
     * @throws IllegalArgumentException if {@code c} is {@code void}
     */
    public static Class<?> boxed(Class<?> c) {
        if (!c.isPrimitive()) {
            return c;
        } else if (c == int.class) {
            return Integer.class;
        } else if (c == long.class) {
            return Long.class;
        } else if (c == double.class) {
            return Double.class;
        } else if (c == boolean.class) {
            return Boolean.class;
        } else if (c == char.class) {
            return Character.class;
        } else if (c == float.class) {
            return Float.class;
        } else if (c == short.class) {
            return Short.class;
        } else if (c == byte.class) {
            return Byte.class;
        } else {
            throw new IllegalArgumentException(
                    "void is not an element type");
        }
    }
}
