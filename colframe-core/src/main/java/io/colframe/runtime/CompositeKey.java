package io.colframe.runtime;

/**
 * Fixed-arity tuple of typed key components, the unit of sorting, grouping and
 * joining.
 * <p>
 * Implementations are immutable and equal iff all components are equal. Their
 * order is not intrinsic: it comes from the comparator of the {@link KeyPlan}
 * that built them, since the same Java type (an {@code Integer}) orders
 * differently for Int32 and UInt32 columns.
 */
public interface CompositeKey {

    int arity();

    /**
     * Component at {@code index}, boxed.
     */
    Object get(int index);
}
