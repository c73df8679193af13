package io.colframe.runtime;

import io.colframe.runtime.dispatch.KeyDispatcher;
import io.colframe.runtime.dispatch.KeyUsage;
import io.colframe.storage.DataFrameView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;

/**
 * Sorting of frame views by up to three key columns.
 * <p>
 * Sorting produces a permutation of view rows and never moves column data. The
 * order is the lexicographic key order, reversed as a whole for descending
 * sorts, with the row index as final tie-breaker so equal keys keep their row
 * order in both directions.
 */
public final class DataFrameSorting {

    private static final Logger LOG = LoggerFactory.getLogger(DataFrameSorting.class);

    private DataFrameSorting() {
    }

    /**
     * Sort a permutation by pre-materialised keys.
     *
     * @param view       the view the keys were read from
     * @param order      permutation of {@code 0..N-1} sorted in place, or null to start from the identity
     * @param keys       one key per view row
     * @param comparator ascending order of keys
     * @param ascending  false to reverse the key order
     * @return the sorted permutation ({@code order} itself when it was given)
     */
    public static <K> int[] sort(DataFrameView view, int[] order, K[] keys, Comparator<? super K> comparator,
            boolean ascending) {
        if (keys.length != view.rowCount()) {
            throw new IllegalArgumentException("keys length " + keys.length + " does not match row count "
                    + view.rowCount());
        }
        return sort(view, order, (left, right) -> comparator.compare(keys[left], keys[right]), ascending);
    }

    /**
     * Sort a permutation by a row order.
     *
     * @param order     permutation of {@code 0..N-1} sorted in place, or null to start from the identity
     * @param rowOrder  ascending order of view rows
     * @param ascending false to reverse the key order
     * @return the sorted permutation ({@code order} itself when it was given)
     */
    public static int[] sort(DataFrameView view, int[] order, RowOrder rowOrder, boolean ascending) {
        var rowCount = view.rowCount();
        if (order == null) {
            order = identity(rowCount);
        } else if (order.length != rowCount) {
            throw new IllegalArgumentException("order length " + order.length + " does not match row count " + rowCount);
        }
        if (order.length > 1) {
            var rows = ascending ? rowOrder : reverse(rowOrder);
            introSort(order, rows, 0, order.length - 1, 2 * log2(order.length));
        }
        return order;
    }

    /**
     * Sort the identity permutation of a view with a resolved plan. No key objects
     * are created.
     */
    public static int[] sort(DataFrameView view, int[] keyColumns, KeyPlan<?> plan, boolean ascending) {
        return sort(view, null, plan.rowOrder(view, keyColumns), ascending);
    }

    /**
     * Sort a view by key columns of any supported kinds, vectors included.
     *
     * @return the permutation of view rows
     */
    public static int[] sort(DataFrameView view, int[] keyColumns, boolean ascending, KeyDispatcher dispatcher) {
        var plan = dispatcher.resolve(view, keyColumns, KeyUsage.SORT);
        LOG.debug("Sorting {} rows with {} ascending={}", view.rowCount(), plan, ascending);
        return sort(view, keyColumns, plan, ascending);
    }

    static int[] identity(int rowCount) {
        var order = new int[rowCount];
        for (var i = 0; i < rowCount; i++) {
            order[i] = i;
        }
        return order;
    }

    private static RowOrder reverse(RowOrder rowOrder) {
        return (left, right) -> rowOrder.compare(right, left);
    }

    private static int log2(int n) {
        return 31 - Integer.numberOfLeadingZeros(n);
    }

    /**
     * Hoare quicksort with a median-of-three pivot. Recurses into the smaller
     * partition only and switches to heapsort once {@code depth} partitioning
     * rounds are used up, so the stack stays logarithmic and the worst case is
     * {@code O(n log n)}.
     */
    private static void introSort(int[] order, RowOrder rows, int low, int high, int depth) {
        while (low < high) {
            if (depth-- == 0) {
                heapSort(order, rows, low, high);
                return;
            }
            var pivot = medianOfThree(order, rows, low, low + ((high - low) >>> 1), high);
            var i = low;
            var j = high;

            while (i <= j) {
                while (compareRows(order[i], pivot, rows) < 0) {
                    i++;
                }
                while (compareRows(order[j], pivot, rows) > 0) {
                    j--;
                }
                if (i <= j) {
                    swap(order, i, j);
                    i++;
                    j--;
                }
            }

            if (j - low < high - i) {
                if (low < j) {
                    introSort(order, rows, low, j, depth);
                }
                low = i;
            } else {
                if (i < high) {
                    introSort(order, rows, i, high, depth);
                }
                high = j;
            }
        }
    }

    private static int medianOfThree(int[] order, RowOrder rows, int a, int b, int c) {
        var x = order[a];
        var y = order[b];
        var z = order[c];
        if (compareRows(x, y, rows) < 0) {
            if (compareRows(y, z, rows) < 0) {
                return y;
            }
            return compareRows(x, z, rows) < 0 ? z : x;
        }
        if (compareRows(x, z, rows) < 0) {
            return x;
        }
        return compareRows(y, z, rows) < 0 ? z : y;
    }

    private static void heapSort(int[] order, RowOrder rows, int low, int high) {
        var size = high - low + 1;
        for (var root = size / 2 - 1; root >= 0; root--) {
            siftDown(order, rows, low, root, size);
        }
        for (var end = size - 1; end > 0; end--) {
            swap(order, low, low + end);
            siftDown(order, rows, low, 0, end);
        }
    }

    private static void siftDown(int[] order, RowOrder rows, int base, int root, int size) {
        while (true) {
            var child = 2 * root + 1;
            if (child >= size) {
                return;
            }
            if (child + 1 < size && compareRows(order[base + child], order[base + child + 1], rows) < 0) {
                child++;
            }
            if (compareRows(order[base + root], order[base + child], rows) >= 0) {
                return;
            }
            swap(order, base + root, base + child);
            root = child;
        }
    }

    // Row index breaks ties, so no two distinct rows compare equal.
    private static int compareRows(int left, int right, RowOrder rows) {
        if (left == right) {
            return 0;
        }
        var cmp = rows.compare(left, right);
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(left, right);
    }

    private static void swap(int[] arr, int i, int j) {
        var tmp = arr[i];
        arr[i] = arr[j];
        arr[j] = tmp;
    }
}
