// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained;

import java.util.Objects;

/**
 * A {@code DerivationSpec} is a specification for a container class,
 * derived from {@link ConstrainedList}, to be created at run time by
 * {@link ConstrainedTypes#derive(DerivationSpec)}. It gives a name, and
 * optionally explicit constraints and a type parameter, much as a
 * source declaration would:<pre>
 * &#064;Constraints({Integer.class, Long.class})
 * public class Whole extends ConstrainedList&lt;Number&gt; { ... }
 * </pre> corresponds to<pre>
 * new DerivationSpec("Whole")
 *         .constraints(Integer.class, Long.class)
 *         .typeParameter(Number.class)
 * </pre>
 * The explicit constraints, if given, take precedence over the type
 * parameter in the derived class. With neither, the derived class is
 * open, and each instance resolves its own allowed types.
 * <p>
 * A specification is frozen when first used to derive a class, after
 * which it may not be changed. Frozen specifications that are equal
 * derive the same class.
 */
public class DerivationSpec {

    /** Simple name on which the class name will be based. */
    private final String name;

    /** Explicit constraints (or {@link AllowedTypes#EMPTY}). */
    private AllowedTypes constraints = AllowedTypes.EMPTY;

    /** Type argument to {@code ConstrainedList} or {@code null}. */
    private Class<?> typeParameter;

    /** Whether the specification may still be changed. */
    private boolean frozen;

    /**
     * Begin a specification. The name of the class created will be
     * based on this name, but be made unique.
     *
     * @param name simple name (a Java identifier)
     * @throws IllegalArgumentException if not an identifier
     */
    public DerivationSpec(String name) {
        if (!isIdentifier(name)) {
            throw new IllegalArgumentException(String
                    .format("'%s' is not a valid class name", name));
        }
        this.name = name;
    }

    /** A name is a Java identifier (keywords are not detected). */
    private static boolean isIdentifier(String name) {
        if (name == null || name.isEmpty()
                || !Character.isJavaIdentifierStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!Character.isJavaIdentifierPart(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Set the explicit constraints of the class.
     *
     * @param types allowed classes
     * @return {@code this}
     */
    public DerivationSpec constraints(Class<?>... types) {
        return constraints(AllowedTypes.of(types));
    }

    /**
     * Set the explicit constraints of the class.
     *
     * @param types allowed types
     * @return {@code this}
     */
    public DerivationSpec constraints(AllowedTypes types) {
        checkNotFrozen();
        if (types.isOpen()) {
            throw new IllegalArgumentException(
                    "explicit constraints may not be open");
        }
        this.constraints = types;
        return this;
    }

    /**
     * Set the type argument the class gives to {@code ConstrainedList}.
     * A primitive class means its wrapper.
     *
     * @param type element type
     * @return {@code this}
     */
    public DerivationSpec typeParameter(Class<?> type) {
        checkNotFrozen();
        this.typeParameter = AllowedTypes.boxed(type);
        return this;
    }

    /** @return simple name on which the class name will be based */
    public String getName() { return name; }

    /** @return explicit constraints (empty if none) */
    public AllowedTypes getConstraints() { return constraints; }

    /** @return type argument to {@code ConstrainedList} or {@code null} */
    public Class<?> getTypeParameter() { return typeParameter; }

    /**
     * Prevent further change to this specification.
     *
     * @return {@code this}
     */
    public DerivationSpec freeze() {
        frozen = true;
        return this;
    }

    /** @return whether this specification may no longer be changed */
    public boolean isFrozen() { return frozen; }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException(String.format(
                    "specification of %s is already in use", name));
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (obj instanceof DerivationSpec other) {
            return name.equals(other.name)
                    && constraints.equals(other.constraints)
                    && Objects.equals(typeParameter, other.typeParameter);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, constraints, typeParameter);
    }

    @Override
    public String toString() {
        String t = typeParameter == null ? ""
                : "<" + typeParameter.getSimpleName() + ">";
        String c = constraints.isEmpty() ? "" : " " + constraints;
        return name + t + c;
    }
}
