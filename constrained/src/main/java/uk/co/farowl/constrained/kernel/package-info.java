/**
 * The {@code kernel} package contains the internal parts that resolve
 * class-level constraints, keep the compatibility registry and derive
 * container classes at run time.
 * <p>
 * Client programs should reach these through
 * {@code ConstrainedTypes} rather than directly.
 */
package uk.co.farowl.constrained.kernel;
