/**
 * The {@code constrained} package contains the API of constrained
 * collections: list-like containers that admit only elements whose
 * run-time class is a member of a set of allowed types.
 * <p>
 * The allowed types of an instance are resolved when it is constructed,
 * from (in order of precedence) an explicit argument, a declaration on
 * the class, or the classes of the initial elements.
 */
package uk.co.farowl.constrained;
