// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained;

import java.lang.reflect.Array;
import java.math.BigInteger;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.RandomAccess;
import java.util.function.UnaryOperator;

/**
 * A list that admits only elements whose run-time class is one of a
 * set of {@link AllowedTypes}. The set is resolved when the list is
 * constructed, from (highest precedence first):
 * <ol>
 * <li>an explicit {@code constraints} argument to the constructor,</li>
 * <li>the constraints declared by the class (see
 * {@link ConstrainedTypes#declaredTypes(Class)}), if it declares
 * any,</li>
 * <li>the distinct classes of the initial elements.</li>
 * </ol>
 * The initial elements must all be admitted by the set so resolved, or
 * construction fails with a {@link ConstructionViolation}. Thereafter
 * every operation that adds or replaces elements checks them, and is
 * refused with a {@link ConstraintViolation} if any is not admitted,
 * leaving the list unchanged.
 * <p>
 * A class derived from {@code ConstrainedList} declares its
 * constraints with a {@link Constraints} annotation, or through the
 * type argument it gives:<pre>
 * class StrArray extends ConstrainedList&lt;String&gt; {
 *     StrArray(Iterable&lt;String&gt; initial) { super(initial); }
 * }
 * </pre> The methods that add or replace elements are {@code final},
 * and the constructors of any derived class must pass through one here,
 * so a derived class cannot escape the checks.
 * <p>
 * As well as the {@code java.util.List} API, the class offers the
 * mutating operations of a Python {@code list} ({@link #append(Object)},
 * {@link #insert(int, Object)}, {@link #extend(Object)},
 * {@link #__iadd__(Object)}, {@link #__imul__(Object)} and
 * {@link #__setitem__(Object, Object)}) which accept arguments of any
 * type and apply the same checks.
 * <p>
 * A {@code ConstrainedList} is not safe for concurrent modification:
 * callers that share one between threads must synchronise.
 *
 * @param <T> the Java type of elements
 */
public class ConstrainedList<T> extends AbstractList<T>
        implements Constrained, RandomAccess {

    /** The elements. */
    private final ArrayList<T> data;

    /** The types allowed in this list. */
    private final AllowedTypes allowed;

    /**
     * Construct a list from initial contents, with constraints declared
     * by the class or inferred from the contents.
     *
     * @param initial elements of the list
     * @throws ConstructionViolation if an element is not allowed
     * @throws ArgumentShapeViolation if {@code initial} is {@code null}
     */
    public ConstrainedList(Iterable<? extends T> initial)
            throws ConstructionViolation, ArgumentShapeViolation {
        this(initial, null, 0);
    }

    /**
     * Construct a list from initial contents, with explicit
     * constraints. If {@code constraints} is {@code null} or empty, the
     * constraints are those declared by the class, or inferred from the
     * contents.
     *
     * @param initial elements of the list
     * @param constraints allowed types (or {@code null})
     * @throws ConstructionViolation if an element is not allowed
     * @throws ArgumentShapeViolation if {@code initial} is {@code null}
     */
    public ConstrainedList(Iterable<? extends T> initial,
            AllowedTypes constraints)
            throws ConstructionViolation, ArgumentShapeViolation {
        this(initial, constraints, 0);
    }

    /**
     * Construct a list from initial contents, with explicit constraints
     * and a minimum initial capacity. If {@code constraints} is
     * {@code null} or empty, the constraints are those declared by the
     * class, or inferred from the contents.
     * <p>
     * Note that if the constraints have to be inferred from contents
     * that are empty, the list will have {@link AllowedTypes#EMPTY} as
     * its allowed types, and will refuse every element offered later.
     *
     * @param initial elements of the list
     * @param constraints allowed types (or {@code null})
     * @param initialCapacity of the storage
     * @throws ConstructionViolation if an element is not allowed
     * @throws ArgumentShapeViolation if {@code initial} is {@code null}
     */
    public ConstrainedList(Iterable<? extends T> initial,
            AllowedTypes constraints, int initialCapacity)
            throws ConstructionViolation, ArgumentShapeViolation {
        if (initial == null) {
            throw new ArgumentShapeViolation("an iterable of elements",
                    null);
        }
        List<T> batch = snapshot(initial);
        AllowedTypes a = resolve(constraints,
                ConstrainedTypes.declaredTypes(getClass()), batch);
        BatchTypeViolation bv = BatchTypeViolation.check(batch, a);
        if (bv != null) { throw new ConstructionViolation(getClass(), bv); }
        this.allowed = a;
        this.data = new ArrayList<>(Math.max(initialCapacity, batch.size()));
        this.data.addAll(batch);
    }

    /**
     * Construct a list (with inferred constraints) from the elements
     * given.
     *
     * @param <T> the Java type of elements
     * @param elements of the list
     * @return the list
     */
    @SafeVarargs
    public static <T> ConstrainedList<T> of(T... elements) {
        return new ConstrainedList<>(Arrays.asList(elements));
    }

    /**
     * Choose the allowed types of a new instance.
     *
     * @param explicit constraints given to the constructor (or
     *     {@code null})
     * @param declared constraints of the class (possibly
     *     {@link AllowedTypes#OPEN})
     * @param batch initial contents
     * @return the allowed types
     */
    static AllowedTypes resolve(AllowedTypes explicit,
            AllowedTypes declared, List<?> batch) {
        if (explicit != null && !explicit.isEmpty()) {
            return explicit;
        } else if (!declared.isOpen()) {
            return declared;
        } else {
            return AllowedTypes.inferFrom(batch);
        }
    }

    @Override
    public final AllowedTypes allowedTypes() { return allowed; }

    // AbstractList methods ------------------------------------------

    @Override
    public T get(int index) { return data.get(index); }

    @Override
    public int size() { return data.size(); }

    @Override
    public final T set(int index, T element)
            throws ElementTypeViolation {
        checkElement(element);
        return data.set(index, element);
    }

    @Override
    public final boolean add(T element) throws ElementTypeViolation {
        checkElement(element);
        modCount++;
        return data.add(element);
    }

    @Override
    public final void add(int index, T element)
            throws ElementTypeViolation {
        checkElement(element);
        data.add(index, element);
        modCount++;
    }

    @Override
    public final boolean addAll(Collection<? extends T> c)
            throws BatchTypeViolation, ArgumentShapeViolation {
        List<T> batch = checkedBatch(c);
        modCount++;
        return data.addAll(batch);
    }

    @Override
    public final boolean addAll(int index, Collection<? extends T> c)
            throws BatchTypeViolation, ArgumentShapeViolation {
        List<T> batch = checkedBatch(c);
        boolean changed = data.addAll(index, batch);
        modCount++;
        return changed;
    }

    @Override
    public T remove(int index) {
        T element = data.remove(index);
        modCount++;
        return element;
    }

    @Override
    public void clear() {
        data.clear();
        modCount++;
    }

    @Override
    public void sort(Comparator<? super T> c) {
        data.sort(c);
        modCount++;
    }

    /**
     * {@inheritDoc}
     * <p>
     * All the replacements are checked before any is made, so that if
     * one is not allowed, the list is unchanged.
     *
     * @throws BatchTypeViolation if any replacement is not allowed
     */
    @Override
    public final void replaceAll(UnaryOperator<T> operator)
            throws BatchTypeViolation {
        List<T> replacements = new ArrayList<>(data.size());
        for (T e : data) { replacements.add(operator.apply(e)); }
        checkBatch(replacements);
        for (int i = 0; i < replacements.size(); i++) {
            data.set(i, replacements.get(i));
        }
    }

    // Python list API -----------------------------------------------

    /**
     * Append one element.
     *
     * @param element to append
     * @throws ElementTypeViolation if the element is not allowed
     */
    @SuppressWarnings("unchecked")
    public final void append(Object element) throws ElementTypeViolation {
        checkElement(element);
        data.add((T)element);
        modCount++;
    }

    /**
     * Insert one element before the given index. A negative index
     * counts from the end, and an index outside the list means the
     * nearer end, as in Python.
     *
     * @param index before which to insert
     * @param element to insert
     * @throws ElementTypeViolation if the element is not allowed
     */
    @SuppressWarnings("unchecked")
    public final void insert(int index, Object element)
            throws ElementTypeViolation {
        checkElement(element);
        int n = data.size();
        if (index < 0) { index = Math.max(0, index + n); }
        data.add(Math.min(index, n), (T)element);
        modCount++;
    }

    /**
     * Append all the elements of an {@code Iterable} or an array.
     *
     * @param other source of elements
     * @throws BatchTypeViolation if any element is not allowed
     * @throws ArgumentShapeViolation if {@code other} is not iterable
     */
    public final void extend(Object other)
            throws BatchTypeViolation, ArgumentShapeViolation {
        List<T> batch = checkedBatch(other);
        data.addAll(batch);
        modCount++;
    }

    /**
     * In-place concatenation {@code self += other}.
     *
     * @param other source of elements
     * @return {@code this}
     * @throws BatchTypeViolation if any element is not allowed
     * @throws ArgumentShapeViolation if {@code other} is not iterable
     */
    public final ConstrainedList<T> __iadd__(Object other)
            throws BatchTypeViolation, ArgumentShapeViolation {
        extend(other);
        return this;
    }

    /**
     * In-place repetition {@code self *= n}. A count of zero or less
     * empties the list. An empty list stays empty whatever the count.
     *
     * @param n number of repetitions (an integer)
     * @return {@code this}
     * @throws ArgumentShapeViolation if {@code n} is not an integer
     * @throws ArithmeticException if the result would be too large
     */
    public final ConstrainedList<T> __imul__(Object n)
            throws ArgumentShapeViolation, ArithmeticException {
        long count = integral(n, "an integer repeat count");
        if (count <= 0) {
            clear();
        } else if (count > 1 && !data.isEmpty()) {
            int size = data.size();
            data.ensureCapacity(
                    Math.multiplyExact(size, Math.toIntExact(count)));
            List<T> copy = new ArrayList<>(data);
            for (long i = 1; i < count; i++) { data.addAll(copy); }
            modCount++;
        }
        return this;
    }

    /**
     * Indexed assignment {@code self[index] = value}. A negative index
     * counts from the end.
     *
     * @param index of the element to replace
     * @param value new value
     * @throws ArgumentShapeViolation if {@code index} is not an integer
     * @throws ElementTypeViolation if the value is not allowed
     * @throws IndexOutOfBoundsException if index is out of range
     */
    @SuppressWarnings("unchecked")
    public final void __setitem__(Object index, Object value)
            throws ArgumentShapeViolation, ElementTypeViolation {
        int i = checkedIndex(index);
        checkElement(value);
        data.set(i, (T)value);
    }

    /**
     * Indexed access {@code self[index]}. A negative index counts from
     * the end.
     *
     * @param index of the element
     * @return the element
     * @throws ArgumentShapeViolation if {@code index} is not an integer
     * @throws IndexOutOfBoundsException if index is out of range
     */
    public T __getitem__(Object index) throws ArgumentShapeViolation {
        return data.get(checkedIndex(index));
    }

    // Guards --------------------------------------------------------

    /**
     * Check that one element is admitted.
     *
     * @param element to check
     * @throws ElementTypeViolation if not
     */
    private void checkElement(Object element)
            throws ElementTypeViolation {
        if (!allowed.admits(element)) {
            throw new ElementTypeViolation(element, allowed);
        }
    }

    /**
     * Check that every element of a batch is admitted.
     *
     * @param batch to check
     * @throws BatchTypeViolation if not
     */
    private void checkBatch(List<?> batch) throws BatchTypeViolation {
        BatchTypeViolation bv = BatchTypeViolation.check(batch, allowed);
        if (bv != null) { throw bv; }
    }

    /**
     * Copy the elements of an argument that should be a batch of
     * elements, and check that every element is admitted. The copy
     * makes it safe to extend a list by itself.
     *
     * @param arg an {@code Iterable} or array
     * @return the elements of {@code arg}
     * @throws BatchTypeViolation if any element is not admitted
     * @throws ArgumentShapeViolation if {@code arg} is not a batch
     */
    @SuppressWarnings("unchecked")
    private List<T> checkedBatch(Object arg)
            throws BatchTypeViolation, ArgumentShapeViolation {
        List<Object> batch;
        if (arg instanceof Iterable<?> iterable) {
            batch = ConstrainedList.<Object> snapshot(iterable);
        } else if (arg != null && arg.getClass().isArray()) {
            int n = Array.getLength(arg);
            batch = new ArrayList<>(n);
            for (int i = 0; i < n; i++) { batch.add(Array.get(arg, i)); }
        } else {
            throw new ArgumentShapeViolation(
                    "an iterable or array of elements", arg);
        }
        checkBatch(batch);
        return (List<T>)batch;
    }

    /**
     * Convert an index argument, which must be an integer, to a valid
     * index into the list, allowing negative values to count from the
     * end.
     *
     * @param index argument
     * @return index in range
     * @throws ArgumentShapeViolation if {@code index} is not an integer
     * @throws IndexOutOfBoundsException if index is out of range
     */
    private int checkedIndex(Object index)
            throws ArgumentShapeViolation, IndexOutOfBoundsException {
        long i = integral(index, "an integer index");
        int n = data.size();
        if (i < 0) { i += n; }
        if (i < 0 || i >= n) {
            throw new IndexOutOfBoundsException(String.format(
                    "index %s out of range for length %d", index, n));
        }
        return (int)i;
    }

    /**
     * Convert an argument that must be an integer to {@code long},
     * saturating big values.
     *
     * @param n argument
     * @param expected description for the error
     * @return value of {@code n}
     * @throws ArgumentShapeViolation if {@code n} is not an integer
     */
    private static long integral(Object n, String expected)
            throws ArgumentShapeViolation {
        if (n instanceof Integer || n instanceof Long
                || n instanceof Short || n instanceof Byte) {
            return ((Number)n).longValue();
        } else if (n instanceof BigInteger b) {
            if (b.bitLength() < Long.SIZE) {
                return b.longValue();
            } else {
                return b.signum() < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
            }
        } else {
            throw new ArgumentShapeViolation(expected, n);
        }
    }

    /**
     * Take the elements of an {@code Iterable} into a new list,
     * iterating it exactly once.
     *
     * @param <E> type of elements
     * @param source of elements
     * @return a new list
     */
    private static <E> List<E> snapshot(Iterable<? extends E> source) {
        if (source instanceof Collection) {
            return new ArrayList<>((Collection<? extends E>)source);
        }
        List<E> list = new ArrayList<>();
        for (E e : source) { list.add(e); }
        return list;
    }
}
