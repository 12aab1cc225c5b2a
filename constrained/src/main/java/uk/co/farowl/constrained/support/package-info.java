/**
 * The {@code support} package contains classes that support the
 * constrained collections without requiring the type machinery to be
 * initialised. (Specifically, they may be used before
 * {@code ConstrainedTypes} is in working order, and without causing it
 * to initialise.)
 */
package uk.co.farowl.constrained.support;
