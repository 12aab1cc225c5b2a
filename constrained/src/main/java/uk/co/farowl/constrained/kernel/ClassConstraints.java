// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained.kernel;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.constrained.AllowedTypes;
import uk.co.farowl.constrained.ConstrainedList;
import uk.co.farowl.constrained.Constraints;
import uk.co.farowl.constrained.support.DerivationError;

/**
 * Mapping from a Java class derived from {@link ConstrainedList} to the
 * allowed types declared for all its instances. The value is computed
 * once per class, when first asked for (normally by the first
 * construction of an instance) and cached.
 * <p>
 * The declaration of a class {@code C} is found by examining {@code C}
 * and then each of its ancestors {@code K} in turn, stopping at
 * {@code ConstrainedList}:
 * <ol>
 * <li>if {@code K} carries a non-empty {@link Constraints} annotation,
 * that is the answer;</li>
 * <li>if {@code K} extends a parameterised class, and the type argument
 * that reaches {@code ConstrainedList<T>} is a concrete class, that
 * class alone is the answer;</li>
 * <li>otherwise continue with the superclass.</li>
 * </ol>
 * If no level gives an answer, the answer is {@link AllowedTypes#OPEN}
 * and instances resolve their own allowed types.
 */
public class ClassConstraints extends ClassValue<AllowedTypes> {

    /** Logger for class-level resolution. */
    static final Logger logger =
            LoggerFactory.getLogger(ClassConstraints.class);

    /** The type parameter {@code T} of {@code ConstrainedList<T>}. */
    private static final TypeVariable<?> ELEMENT_PARAMETER =
            ConstrainedList.class.getTypeParameters()[0];

    @Override
    protected AllowedTypes computeValue(Class<?> c) {
        if (!ConstrainedList.class.isAssignableFrom(c)) {
            throw new DerivationError("%s is not derived from %s",
                    c.getName(), ConstrainedList.class.getSimpleName());
        }

        AllowedTypes declared = AllowedTypes.OPEN;

        try {
            for (Class<?> k = c; k != ConstrainedList.class; k =
                    k.getSuperclass()) {
                AllowedTypes t = fromAnnotation(k);
                if (t == null) { t = fromTypeArgument(k); }
                if (t != null) {
                    declared = t;
                    break;
                }
            }
        } catch (TypeNotPresentException e) {
            // A class named in the declaration cannot be loaded
            throw new DerivationError(e, "declaration of %s: %s",
                    c.getName(), e.getMessage());
        }

        logger.atDebug().setMessage("Class {} declares {}")
                .addArgument(c::getName).addArgument(declared).log();
        return declared;
    }

    /**
     * The allowed types given by a {@link Constraints} annotation
     * directly on {@code k}, if it has a non-empty one.
     *
     * @param k class to examine
     * @return the allowed types or {@code null}
     * @throws DerivationError if the annotation is not valid
     */
    private static AllowedTypes fromAnnotation(Class<?> k)
            throws DerivationError {
        Constraints a = k.getDeclaredAnnotation(Constraints.class);
        if (a == null || a.value().length == 0) {
            return null;
        }
        try {
            return AllowedTypes.of(a.value());
        } catch (IllegalArgumentException e) {
            throw new DerivationError(e, "@%s on %s: %s",
                    Constraints.class.getSimpleName(), k.getName(),
                    e.getMessage());
        }
    }

    /**
     * The allowed types given by the type argument that {@code k}
     * (through its generic superclass) binds to the parameter of
     * {@code ConstrainedList}, if that is a concrete type.
     *
     * @param k class to examine
     * @return the allowed types or {@code null}
     */
    private static AllowedTypes fromTypeArgument(Class<?> k) {
        if (!(k.getGenericSuperclass() instanceof ParameterizedType)) {
            // k does not bind any type variable of its superclass
            return null;
        }
        Class<?> element = rawClass(elementTypeSeenFrom(k));
        return element == null ? null : AllowedTypes.of(element);
    }

    /**
     * Walk the generic superclasses from {@code k} up to
     * {@code ConstrainedList}, keeping track of the bindings of type
     * variables, and return what the parameter {@code T} is bound to
     * from the point of view of {@code k}. This may be a type variable
     * of {@code k} or one of its ancestors, if that is as far as the
     * bindings go.
     *
     * @param k class to start from
     * @return the binding of {@code T} seen from {@code k}
     */
    static Type elementTypeSeenFrom(Class<?> k) {
        Map<TypeVariable<?>, Type> bindings = new HashMap<>();
        Class<?> c = k;
        while (c != ConstrainedList.class) {
            Type s = c.getGenericSuperclass();
            Class<?> sc = c.getSuperclass();
            if (s instanceof ParameterizedType p) {
                TypeVariable<?>[] vars = sc.getTypeParameters();
                Type[] args = p.getActualTypeArguments();
                for (int i = 0; i < vars.length; i++) {
                    bindings.put(vars[i], substitute(args[i], bindings));
                }
            }
            c = sc;
        }
        return bindings.getOrDefault(ELEMENT_PARAMETER, ELEMENT_PARAMETER);
    }

    /**
     * Replace a type variable by its binding, if there is one, or the
     * component of a generic array by its binding, if that makes it a
     * class. The arguments of a parameterised type are left alone,
     * since only its raw class matters.
     */
    private static Type substitute(Type t,
            Map<TypeVariable<?>, Type> bindings) {
        if (t instanceof TypeVariable<?> v && bindings.containsKey(v)) {
            return bindings.get(v);
        } else if (t instanceof GenericArrayType g) {
            Type c = substitute(g.getGenericComponentType(), bindings);
            if (c instanceof Class<?> k) { return k.arrayType(); }
        }
        return t;
    }

    /**
     * The class to which a generic type corresponds at run time, if it
     * is concrete enough to have one.
     *
     * @param t generic type
     * @return raw class, or {@code null} for a variable or wildcard
     */
    static Class<?> rawClass(Type t) {
        if (t instanceof Class<?> c) {
            return c;
        } else if (t instanceof ParameterizedType p) {
            return rawClass(p.getRawType());
        } else if (t instanceof GenericArrayType g) {
            Class<?> component = rawClass(g.getGenericComponentType());
            return component == null ? null
                    : component.arrayType();
        } else {
            // TypeVariable or WildcardType
            return null;
        }
    }
}
