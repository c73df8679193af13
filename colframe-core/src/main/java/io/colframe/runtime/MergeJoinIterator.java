package io.colframe.runtime;

import io.colframe.core.ColumnType;
import io.colframe.core.MissingValues;
import io.colframe.storage.Columns;
import io.colframe.storage.DataFrame;
import io.colframe.storage.DataFrameView;
import io.colframe.storage.MultiplyStrategy;

import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Merge of two group sequences sorted by the same key order, producing one
 * partial frame per emitted group or group pair.
 * <p>
 * The side with the smaller key advances; an exhausted side compares greater than
 * any key so the other side drains. Single pass, not thread-safe.
 */
final class MergeJoinIterator<K> implements Iterator<DataFrame> {
    private final Iterator<Group<K>> leftGroups;
    private final Iterator<Group<K>> rightGroups;
    private final Comparator<K> comparator;
    private final JoinStrategy strategy;
    private final JoinColumnNames names;
    private final ColumnType[] leftTypes;
    private final ColumnType[] rightTypes;

    private Group<K> leftGroup;
    private Group<K> rightGroup;
    private DataFrame pending;

    MergeJoinIterator(DataFrameView left, DataFrameView right, Iterator<Group<K>> leftGroups,
            Iterator<Group<K>> rightGroups, Comparator<K> comparator, JoinStrategy strategy, JoinColumnNames names) {
        this.leftGroups = leftGroups;
        this.rightGroups = rightGroups;
        this.comparator = comparator;
        this.strategy = strategy;
        this.names = names;
        this.leftTypes = types(left);
        this.rightTypes = types(right);
        this.leftGroup = nextOrNull(leftGroups);
        this.rightGroup = nextOrNull(rightGroups);
    }

    @Override
    public boolean hasNext() {
        if (pending == null) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public DataFrame next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        var frame = pending;
        pending = null;
        return frame;
    }

    private DataFrame advance() {
        while (leftGroup != null || rightGroup != null) {
            int cmp;
            if (leftGroup == null) {
                cmp = 1;
            } else if (rightGroup == null) {
                cmp = -1;
            } else {
                cmp = comparator.compare(leftGroup.key(), rightGroup.key());
            }

            if (cmp < 0) {
                var group = leftGroup;
                leftGroup = nextOrNull(leftGroups);
                if (strategy.keepsLeftOnly()) {
                    return leftOnly(group);
                }
            } else if (cmp > 0) {
                var group = rightGroup;
                rightGroup = nextOrNull(rightGroups);
                if (strategy.keepsRightOnly()) {
                    return rightOnly(group);
                }
            } else {
                var leftMatch = leftGroup;
                var rightMatch = rightGroup;
                leftGroup = nextOrNull(leftGroups);
                rightGroup = nextOrNull(rightGroups);
                return matched(leftMatch, rightMatch);
            }
        }
        return null;
    }

    private DataFrame leftOnly(Group<K> group) {
        var frame = group.view().copy();
        frame.renameColumns(names.left());
        fill(frame, names.right(), rightTypes);
        return frame;
    }

    private DataFrame rightOnly(Group<K> group) {
        var frame = group.view().copy();
        frame.renameColumns(names.right());
        fill(frame, names.left(), leftTypes);
        frame.orderColumns(names.all());
        return frame;
    }

    // pair k is (left row k % nLeft, right row k / nLeft)
    private DataFrame matched(Group<K> left, Group<K> right) {
        var frame = left.view().copy().multiply(right.size(), MultiplyStrategy.BLOCK);
        frame.renameColumns(names.left());
        var rightPart = right.view().copy().multiply(left.size(), MultiplyStrategy.ROW);
        var rightNames = names.right();
        for (var c = 0; c < rightNames.length; c++) {
            frame.addColumn(rightPart.column(c).rename(rightNames[c]));
        }
        return frame;
    }

    private static void fill(DataFrame frame, String[] names, ColumnType[] types) {
        var rows = frame.rowCount();
        for (var c = 0; c < names.length; c++) {
            frame.addColumn(Columns.filled(names[c], types[c], rows, MissingValues.sentinelMissing(types[c])));
        }
    }

    private static ColumnType[] types(DataFrameView view) {
        var types = new ColumnType[view.columnCount()];
        for (var c = 0; c < types.length; c++) {
            types[c] = view.columnType(c);
        }
        return types;
    }

    private static <K> Group<K> nextOrNull(Iterator<Group<K>> groups) {
        return groups.hasNext() ? groups.next() : null;
    }
}
