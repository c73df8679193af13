package io.colframe.runtime;

/**
 * Order of view rows by key values read once per row into primitive arrays.
 * <p>
 * Rows are compared by index, so sorting and run detection never box a key
 * component. Two rows compare as {@code 0} exactly when their keys are equal.
 */
@FunctionalInterface
public interface RowOrder {

    int compare(int leftRow, int rightRow);

    /**
     * Compare by the first order, then by the next ones on ties.
     */
    static RowOrder lexicographic(RowOrder... orders) {
        if (orders.length == 0) {
            throw new IllegalArgumentException("at least one row order required");
        }
        if (orders.length == 1) {
            return orders[0];
        }
        if (orders.length == 2) {
            var first = orders[0];
            var second = orders[1];
            return (left, right) -> {
                var cmp = first.compare(left, right);
                return cmp != 0 ? cmp : second.compare(left, right);
            };
        }
        var copy = orders.clone();
        return (left, right) -> {
            for (var order : copy) {
                var cmp = order.compare(left, right);
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        };
    }
}
