package io.colframe.runtime;

import io.colframe.storage.DataFrameView;

/**
 * One maximal run of equal keys in a sorted permutation.
 *
 * @param key    the run's key
 * @param labels one label per key column
 * @param rows   rows of the grouped view in the run, in permutation order
 * @param view   view over those rows, sharing the grouped view's columns
 * @param <K>    the key type
 */
public record Group<K>(K key, GroupKey[] labels, int[] rows, DataFrameView view) {

    public int size() {
        return rows.length;
    }
}
