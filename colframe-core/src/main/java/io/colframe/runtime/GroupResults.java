package io.colframe.runtime;

import io.colframe.storage.DataFrame;
import io.colframe.storage.DataFrameView;

import java.util.Iterator;

/**
 * Lazy sequence of groups produced by a group-by.
 * <p>
 * Single pass: {@link #iterator()} may be called once. Groups are computed while
 * the caller advances, so stopping early skips the rest of the scan. The
 * aggregation methods consume the sequence.
 *
 * @param <K> the key type
 */
public final class GroupResults<K> implements Iterable<Group<K>> {
    private final DataFrameView view;
    private final int[] keyColumns;
    private Iterator<Group<K>> groups;

    GroupResults(DataFrameView view, int[] keyColumns, Iterator<Group<K>> groups) {
        this.view = view;
        this.keyColumns = keyColumns.clone();
        this.groups = groups;
    }

    /**
     * The grouped view.
     */
    public DataFrameView view() {
        return view;
    }

    public int[] keyColumns() {
        return keyColumns.clone();
    }

    /**
     * The group sequence.
     *
     * @throws IllegalStateException if the sequence was already consumed
     */
    @Override
    public Iterator<Group<K>> iterator() {
        if (groups == null) {
            throw new IllegalStateException("Group results can only be iterated once");
        }
        var result = groups;
        groups = null;
        return result;
    }

    public DataFrame count() {
        return aggregate(Aggregation.COUNT);
    }

    public DataFrame sum() {
        return aggregate(Aggregation.SUM);
    }

    public DataFrame min() {
        return aggregate(Aggregation.MIN);
    }

    public DataFrame max() {
        return aggregate(Aggregation.MAX);
    }

    public DataFrame mean() {
        return aggregate(Aggregation.MEAN);
    }

    /**
     * One row per group: key columns first, then every other non-vector column of
     * the view reduced by {@code aggregation}.
     */
    public DataFrame aggregate(Aggregation aggregation) {
        return new GroupAggregator(view, keyColumns, aggregation).aggregate(iterator());
    }
}
