package io.colframe.runtime;

import io.colframe.core.ColumnType;
import io.colframe.core.SchemaMismatchException;
import io.colframe.runtime.dispatch.KeyDispatcher;
import io.colframe.runtime.dispatch.KeyUsage;
import io.colframe.storage.Column;
import io.colframe.storage.Columns;
import io.colframe.storage.DataFrame;
import io.colframe.storage.DataFrameView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Sort-merge equi-join of two frame views on up to three key columns.
 * <p>
 * Both sides are sorted and grouped by their keys, then the group sequences are
 * merged. Each step of the merge emits one partial frame: a left-only group with
 * the right columns filled with missing values, a right-only group filled the
 * other way, or the cross product of a matching pair of groups. {@link #join}
 * concatenates those partial frames.
 * <p>
 * Output columns are all left columns then all right columns. Each side's names
 * get that side's suffix; right names still colliding with a left name or an
 * earlier right name get the collision suffix appended until unique.
 * <p>
 * Fill values come from {@link io.colframe.core.MissingValues#sentinelMissing},
 * so a Bool column that has to be filled fails the join at that point.
 */
public final class DataFrameJoining {

    private static final Logger LOG = LoggerFactory.getLogger(DataFrameJoining.class);

    private static final GroupKey[] NO_LABELS = new GroupKey[0];

    private final KeyDispatcher dispatcher;
    private final String collisionSuffix;

    public DataFrameJoining(KeyDispatcher dispatcher, String collisionSuffix) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher required");
        }
        if (collisionSuffix == null || collisionSuffix.isEmpty()) {
            throw new IllegalArgumentException("collisionSuffix must not be empty");
        }
        this.dispatcher = dispatcher;
        this.collisionSuffix = collisionSuffix;
    }

    /**
     * Join two views into a new frame.
     *
     * @param left        left input
     * @param right       right input
     * @param leftKeys    key column indices of the left view
     * @param rightKeys   key column indices of the right view, pairwise matching {@code leftKeys}
     * @param leftSuffix  appended to every left column name, null for none
     * @param rightSuffix appended to every right column name, null for none
     * @param strategy    which unmatched groups to keep
     * @param sort        false if both views are already in ascending key order
     * @return the joined frame; with no output rows it still has every output column
     * @throws SchemaMismatchException                    if the key columns differ in count or type
     * @throws io.colframe.core.UnsupportedShapeException if there are no keys, more than three, or vector keys
     * @throws io.colframe.core.UnsupportedKindException  if a key column kind has no order
     */
    public DataFrame join(DataFrameView left, DataFrameView right, int[] leftKeys, int[] rightKeys,
            String leftSuffix, String rightSuffix, JoinStrategy strategy, boolean sort) {
        var names = JoinColumnNames.of(checkInput(left, "left"), checkInput(right, "right"),
                leftSuffix, rightSuffix, collisionSuffix);
        var partitions = joinPartitions(left, right, leftKeys, rightKeys, names, strategy, sort);
        var frames = new ArrayList<DataFrame>();
        var rows = 0L;
        while (partitions.hasNext()) {
            var frame = partitions.next();
            rows += frame.rowCount();
            frames.add(frame);
        }
        LOG.debug("{} join of {} and {} rows produced {} partitions, {} rows", strategy,
                left.rowCount(), right.rowCount(), frames.size(), rows);
        if (frames.isEmpty()) {
            return emptyResult(left, right, names);
        }
        return DataFrame.concat(frames);
    }

    /**
     * The partial frames {@link #join} concatenates, produced lazily in key order.
     * Validation happens before this method returns.
     */
    public Iterator<DataFrame> joinPartitions(DataFrameView left, DataFrameView right, int[] leftKeys,
            int[] rightKeys, String leftSuffix, String rightSuffix, JoinStrategy strategy, boolean sort) {
        var names = JoinColumnNames.of(checkInput(left, "left"), checkInput(right, "right"),
                leftSuffix, rightSuffix, collisionSuffix);
        return joinPartitions(left, right, leftKeys, rightKeys, names, strategy, sort);
    }

    private Iterator<DataFrame> joinPartitions(DataFrameView left, DataFrameView right, int[] leftKeys,
            int[] rightKeys, JoinColumnNames names, JoinStrategy strategy, boolean sort) {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy required");
        }
        var plan = resolve(left, right, leftKeys, rightKeys);
        return merge(plan, left, right, leftKeys.clone(), rightKeys.clone(), names, strategy, sort);
    }

    private KeyPlan<?> resolve(DataFrameView left, DataFrameView right, int[] leftKeys, int[] rightKeys) {
        if (leftKeys == null || rightKeys == null) {
            throw new IllegalArgumentException("key columns required");
        }
        if (leftKeys.length != rightKeys.length) {
            throw new SchemaMismatchException("Join needs the same number of key columns on both sides, got "
                    + leftKeys.length + " left and " + rightKeys.length + " right");
        }
        var plan = dispatcher.resolve(left, leftKeys, KeyUsage.JOIN);
        for (var i = 0; i < leftKeys.length; i++) {
            ColumnType leftType = left.columnType(leftKeys[i]);
            ColumnType rightType = right.columnType(rightKeys[i]);
            if (!leftType.equals(rightType)) {
                throw new SchemaMismatchException("Join key " + i + " has type " + leftType + " on the left ('"
                        + left.columnName(leftKeys[i]) + "') and " + rightType + " on the right ('"
                        + right.columnName(rightKeys[i]) + "')");
            }
        }
        return plan;
    }

    private static <K extends CompositeKey> Iterator<DataFrame> merge(KeyPlan<K> plan, DataFrameView left,
            DataFrameView right, int[] leftKeys, int[] rightKeys, JoinColumnNames names, JoinStrategy strategy,
            boolean sort) {
        Iterator<Group<K>> leftGroups = groups(plan, left, leftKeys, sort);
        Iterator<Group<K>> rightGroups = groups(plan, right, rightKeys, sort);
        return new MergeJoinIterator<>(left, right, leftGroups, rightGroups, plan.comparator(), strategy, names);
    }

    private static <K extends CompositeKey> Iterator<Group<K>> groups(KeyPlan<K> plan, DataFrameView view,
            int[] keyColumns, boolean sort) {
        var rowOrder = plan.rowOrder(view, keyColumns);
        var order = DataFrameSorting.identity(view.rowCount());
        if (sort) {
            DataFrameSorting.sort(view, order, rowOrder, true);
        }
        return DataFrameGrouping.groupBy(view, order, rowOrder, plan.keyReader(view, keyColumns), key -> NO_LABELS);
    }

    private static DataFrame emptyResult(DataFrameView left, DataFrameView right, JoinColumnNames names) {
        var columns = new ArrayList<Column>(left.columnCount() + right.columnCount());
        addEmpty(columns, left, names.left());
        addEmpty(columns, right, names.right());
        return new DataFrame(columns);
    }

    private static void addEmpty(List<Column> columns, DataFrameView view, String[] names) {
        for (var c = 0; c < names.length; c++) {
            columns.add(Columns.fromValues(names[c], view.columnType(c), new Object[0]));
        }
    }

    private static DataFrameView checkInput(DataFrameView view, String side) {
        if (view == null) {
            throw new IllegalArgumentException(side + " view required");
        }
        return view;
    }
}
