// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained;

/**
 * An operation on a constrained container was refused because it
 * would have admitted an element whose type is not allowed, or because
 * an argument had the wrong shape. The container is left unchanged. The
 * subclasses distinguish the kinds of refusal.
 */
public abstract class ConstraintViolation extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /** The allowed types in force (may be {@code null}). */
    private final transient AllowedTypes allowed;

    /**
     * Create with a message and the allowed types in force.
     *
     * @param allowed types in force
     * @param msg message
     */
    protected ConstraintViolation(AllowedTypes allowed, String msg) {
        super(msg);
        this.allowed = allowed;
    }

    /**
     * Create with a message, a cause and the allowed types in force.
     *
     * @param allowed types in force
     * @param msg message
     * @param cause of this violation
     */
    protected ConstraintViolation(AllowedTypes allowed, String msg,
            Throwable cause) {
        super(msg, cause);
        this.allowed = allowed;
    }

    /**
     * The allowed types in force when the operation was refused, or
     * {@code null} where they do not bear on it.
     *
     * @return allowed types or {@code null}
     */
    public AllowedTypes allowedTypes() { return allowed; }

    /**
     * Name of the class of an object for a message.
     *
     * @param o the object (may be {@code null})
     * @return simple name of the class of {@code o}, or "null"
     */
    static String typeName(Object o) {
        return o == null ? "null" : o.getClass().getSimpleName();
    }
}
