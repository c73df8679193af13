package io.colframe.runtime;

import io.colframe.storage.DataFrameView;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Function;
import java.util.function.IntFunction;

/**
 * Run-length partitioning of a sorted permutation into groups, produced one group
 * per {@link #next()} call.
 * <p>
 * A single forward scan: rows whose key equals the key of the run's first row
 * extend the current run, a different key closes the run and starts a new one.
 * The key object of a run is read once, from its first row. Not thread-safe.
 */
final class GroupIterator<K> implements Iterator<Group<K>> {
    private final DataFrameView view;
    private final int[] order;
    private final SameKey sameKey;
    private final IntFunction<? extends K> keyAt;
    private final Function<? super K, GroupKey[]> labeler;

    private int position;
    private int[] run = new int[16];
    private int runSize;
    private Group<K> pending;

    GroupIterator(DataFrameView view, int[] order, SameKey sameKey, IntFunction<? extends K> keyAt,
            Function<? super K, GroupKey[]> labeler) {
        this.view = view;
        this.order = order;
        this.sameKey = sameKey;
        this.keyAt = keyAt;
        this.labeler = labeler;
    }

    /**
     * Key equality of two view rows.
     */
    @FunctionalInterface
    interface SameKey {
        boolean test(int leftRow, int rightRow);
    }

    @Override
    public boolean hasNext() {
        if (pending == null) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public Group<K> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        var group = pending;
        pending = null;
        return group;
    }

    private Group<K> advance() {
        while (position < order.length) {
            var row = order[position];
            if (runSize > 0 && !sameKey.test(run[0], row)) {
                var group = emit();
                append(row);
                position++;
                return group;
            }
            append(row);
            position++;
        }
        return runSize > 0 ? emit() : null;
    }

    private void append(int row) {
        if (runSize == run.length) {
            run = Arrays.copyOf(run, run.length * 2);
        }
        run[runSize++] = row;
    }

    private Group<K> emit() {
        var rows = Arrays.copyOf(run, runSize);
        runSize = 0;
        K key = keyAt.apply(rows[0]);
        return new Group<>(key, labeler.apply(key), rows, view.view(rows));
    }
}
