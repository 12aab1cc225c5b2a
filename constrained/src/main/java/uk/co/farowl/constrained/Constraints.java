// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declare the allowed types of a container class derived from
 * {@link ConstrainedList}. The declaration takes precedence over the
 * type argument the class gives to {@code ConstrainedList}, and applies
 * to every instance not constructed with explicit constraints. For
 * example:<pre>
 * &#064;Constraints({Integer.class, Long.class})
 * class Whole extends ConstrainedList&lt;Number&gt; { ... }
 * </pre>An empty list of classes is the same as no annotation.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Constraints {

    /** @return the allowed classes (primitives mean their wrappers) */
    Class<?>[] value();
}
