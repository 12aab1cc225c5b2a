// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * One or more elements of a batch have types not among the allowed
 * types. The whole batch was refused: none of it was committed.
 */
public class BatchTypeViolation extends ConstraintViolation {
    private static final long serialVersionUID = 1L;

    /** Messages name at most this many offenders. */
    private static final int MAX_LISTED = 5;

    /** Positions in the batch of the elements refused. */
    private final List<Integer> indices;

    /** Classes of the elements refused, parallel to {@link #indices}. */
    private final transient List<Class<?>> types;

    /** Number of elements in the batch. */
    private final int batchSize;

    /**
     * Create for a batch refused by a set of allowed types.
     *
     * @param batch the elements offered
     * @param allowed types in force
     * @return the violation, or {@code null} if every element is allowed
     */
    static BatchTypeViolation check(List<?> batch, AllowedTypes allowed) {
        List<Integer> bad = null;
        for (int i = 0; i < batch.size(); i++) {
            if (!allowed.admits(batch.get(i))) {
                if (bad == null) { bad = new ArrayList<>(); }
                bad.add(i);
            }
        }
        return bad == null ? null
                : new BatchTypeViolation(batch, bad, allowed);
    }

    private BatchTypeViolation(List<?> batch, List<Integer> indices,
            AllowedTypes allowed) {
        super(allowed, message(batch, indices, allowed));
        this.indices = Collections.unmodifiableList(indices);
        List<Class<?>> t = new ArrayList<>(indices.size());
        for (int i : indices) {
            Object e = batch.get(i);
            t.add(e == null ? null : e.getClass());
        }
        this.types = Collections.unmodifiableList(t);
        this.batchSize = batch.size();
    }

    private static String message(List<?> batch, List<Integer> indices,
            AllowedTypes allowed) {
        StringJoiner sj = new StringJoiner(", ");
        int n = 0;
        for (int i : indices) {
            if (n++ == MAX_LISTED) {
                sj.add("...");
                break;
            }
            sj.add(typeName(batch.get(i)) + " at " + i);
        }
        return String.format("%d of %d elements are not one of %s: %s",
                indices.size(), batch.size(), allowed, sj);
    }

    /** @return positions in the batch of the elements refused */
    public List<Integer> offendingIndices() { return indices; }

    /**
     * @return classes of the elements refused (parallel to
     *     {@link #offendingIndices()}, {@code null} for null)
     */
    public List<Class<?>> offendingTypes() { return types; }

    /** @return number of elements in the batch offered */
    public int batchSize() { return batchSize; }
}
