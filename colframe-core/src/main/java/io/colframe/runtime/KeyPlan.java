package io.colframe.runtime;

import io.colframe.core.ColumnType;
import io.colframe.storage.DataFrameView;

import java.util.Comparator;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Typed code path for one tuple of key column types: orders view rows by their
 * keys, materialises composite keys from a view, orders them and labels them.
 * <p>
 * Plans are resolved from runtime column types by the dispatcher and do not bind
 * to particular columns or views, so one plan serves every view whose key columns
 * have the same types.
 *
 * @param <K> the composite key type ({@link Key1}, {@link Key2} or {@link Key3})
 */
public interface KeyPlan<K extends CompositeKey> {

    List<ColumnType> columnTypes();

    default int arity() {
        return columnTypes().size();
    }

    /**
     * Order of view rows by their keys, read into primitive arrays once.
     *
     * @throws IllegalArgumentException if the key columns do not match the plan's types
     */
    RowOrder rowOrder(DataFrameView view, int[] keyColumns);

    /**
     * Reads the key of one view row at a time, for callers that need key objects
     * for a few rows only.
     *
     * @throws IllegalArgumentException if the key columns do not match the plan's types
     */
    IntFunction<K> keyReader(DataFrameView view, int[] keyColumns);

    /**
     * One key per view row, indexed by view row.
     *
     * @throws IllegalArgumentException if the key columns do not match the plan's types
     */
    K[] materialize(DataFrameView view, int[] keyColumns);

    /**
     * Ascending lexicographic order over keys built by this plan.
     */
    Comparator<K> comparator();

    /**
     * Label each key component with its column and rendered value.
     */
    GroupKey[] labels(K key, DataFrameView view, int[] keyColumns);
}
