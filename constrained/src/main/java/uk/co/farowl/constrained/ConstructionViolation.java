// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained;

/**
 * The initial elements of a container did not satisfy the allowed
 * types resolved for it, so no container was produced. The cause is a
 * {@link BatchTypeViolation} identifying the offending elements.
 */
public class ConstructionViolation extends ConstraintViolation {
    private static final long serialVersionUID = 1L;

    /** Class of container that could not be constructed. */
    private final Class<?> containerType;

    /**
     * Create for a container class whose initial elements were refused.
     *
     * @param containerType class being constructed
     * @param cause identifying the refused elements
     */
    public ConstructionViolation(Class<?> containerType,
            BatchTypeViolation cause) {
        super(cause.allowedTypes(),
                String.format("cannot construct %s: %s",
                        containerType.getSimpleName(), cause.getMessage()),
                cause);
        this.containerType = containerType;
    }

    /** @return class of container that could not be constructed */
    public Class<?> containerType() { return containerType; }

    @Override
    public synchronized BatchTypeViolation getCause() {
        return (BatchTypeViolation)super.getCause();
    }
}
