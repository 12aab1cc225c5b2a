// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained;

/**
 * An argument was not of the expected shape, for example a
 * non-iterable where a batch of elements was expected, or a
 * non-integral repeat count.
 */
public class ArgumentShapeViolation extends ConstraintViolation {
    private static final long serialVersionUID = 1L;

    /** Class of the argument ({@code null} for null). */
    private final Class<?> argumentType;

    /**
     * Create for an argument that is not of the expected shape.
     *
     * @param expected description of the expected shape
     * @param arg actual argument
     */
    public ArgumentShapeViolation(String expected, Object arg) {
        super(null, String.format("expected %s, not %s", expected,
                typeName(arg)));
        this.argumentType = arg == null ? null : arg.getClass();
    }

    /** @return class of the argument ({@code null} for null) */
    public Class<?> argumentType() { return argumentType; }
}
