package io.colframe.runtime;

import io.colframe.runtime.dispatch.KeyDispatcher;
import io.colframe.runtime.dispatch.KeyUsage;
import io.colframe.storage.DataFrameView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.IntFunction;

/**
 * Sort-based grouping.
 * <p>
 * Groups are maximal runs of equal keys in a permutation that is already sorted
 * by those keys; the engine never groups unsorted data. With {@code sort=false}
 * the view's own row order is taken as sorted.
 */
public final class DataFrameGrouping {

    private static final Logger LOG = LoggerFactory.getLogger(DataFrameGrouping.class);

    private DataFrameGrouping() {
    }

    /**
     * Partition a sorted permutation into groups, lazily.
     *
     * @param view    the grouped view
     * @param order   permutation of view rows, sorted by {@code keys}
     * @param keys    one key per view row
     * @param labeler labels for a group's key
     * @return single-pass iterator over the groups, in permutation order
     */
    public static <K> Iterator<Group<K>> groupBy(DataFrameView view, int[] order, K[] keys,
            Function<? super K, GroupKey[]> labeler) {
        if (order.length != view.rowCount() || keys.length != view.rowCount()) {
            throw new IllegalArgumentException("order (" + order.length + ") and keys (" + keys.length
                    + ") must both have one entry per view row (" + view.rowCount() + ")");
        }
        return new GroupIterator<>(view, order, (left, right) -> Objects.equals(keys[left], keys[right]),
                row -> keys[row], labeler);
    }

    /**
     * Partition a permutation sorted by a row order into groups, lazily. Key
     * objects are read only for the first row of each group.
     *
     * @param view     the grouped view
     * @param order    permutation of view rows, sorted by {@code rowOrder}
     * @param rowOrder order of view rows by key, {@code 0} for equal keys
     * @param keyAt    key of a view row
     * @param labeler  labels for a group's key
     */
    public static <K> Iterator<Group<K>> groupBy(DataFrameView view, int[] order, RowOrder rowOrder,
            IntFunction<? extends K> keyAt, Function<? super K, GroupKey[]> labeler) {
        if (order.length != view.rowCount()) {
            throw new IllegalArgumentException("order (" + order.length + ") must have one entry per view row ("
                    + view.rowCount() + ")");
        }
        return new GroupIterator<>(view, order, (left, right) -> rowOrder.compare(left, right) == 0, keyAt,
                labeler);
    }

    /**
     * Group a view with a resolved key plan.
     */
    public static <K extends CompositeKey> GroupResults<K> groupBy(DataFrameView view, int[] keyColumns, boolean sort,
            KeyPlan<K> plan) {
        var columns = keyColumns.clone();
        var rowOrder = plan.rowOrder(view, columns);
        var order = DataFrameSorting.identity(view.rowCount());
        if (sort) {
            DataFrameSorting.sort(view, order, rowOrder, true);
        }
        Iterator<Group<K>> groups = groupBy(view, order, rowOrder, plan.keyReader(view, columns),
                key -> plan.labels(key, view, columns));
        return new GroupResults<>(view, keyColumns, groups);
    }

    /**
     * Group a view by key columns of any scalar kinds.
     *
     * @throws io.colframe.core.UnsupportedShapeException for vector key columns or more than three keys
     * @throws io.colframe.core.UnsupportedKindException  for key columns of kinds with no order
     */
    public static GroupResults<?> groupBy(DataFrameView view, int[] keyColumns, boolean sort,
            KeyDispatcher dispatcher) {
        var plan = dispatcher.resolve(view, keyColumns, KeyUsage.GROUP_BY);
        LOG.debug("Grouping {} rows with {} sort={}", view.rowCount(), plan, sort);
        return groupBy(view, keyColumns, sort, plan);
    }
}
