// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained;

/** A single element's type is not among the allowed types. */
public class ElementTypeViolation extends ConstraintViolation {
    private static final long serialVersionUID = 1L;

    /** Class of the element refused ({@code null} for null). */
    private final Class<?> elementType;

    /**
     * Create for an element refused by a set of allowed types.
     *
     * @param element refused
     * @param allowed types in force
     */
    public ElementTypeViolation(Object element, AllowedTypes allowed) {
        super(allowed, String.format("element of type %s is not one of %s",
                typeName(element), allowed));
        this.elementType = element == null ? null : element.getClass();
    }

    /** @return class of the element refused ({@code null} for null) */
    public Class<?> elementType() { return elementType; }
}
