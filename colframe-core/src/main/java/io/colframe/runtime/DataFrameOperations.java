package io.colframe.runtime;

import io.colframe.core.ColframeConfiguration;
import io.colframe.runtime.dispatch.KeyDispatcher;
import io.colframe.storage.DataFrame;
import io.colframe.storage.DataFrameView;

import java.util.Comparator;
import java.util.Iterator;
import java.util.function.Function;

/**
 * Entry point for sorting, grouping and joining frame views.
 * <p>
 * Key columns are given as view column indices and may be of any supported kind;
 * the matching typed code path is resolved from their runtime types on each call.
 * Operations that take no {@code sort} flag or join suffixes use the configured
 * defaults.
 *
 * <pre>
 * DataFrameOperations ops = DataFrameOperations.defaults();
 * DataFrame joined = ops.join(orders.view(), customers.view(), new int[]{0}, new int[]{0}, JoinStrategy.LEFT);
 * </pre>
 */
public final class DataFrameOperations {
    private final ColframeConfiguration configuration;
    private final KeyDispatcher dispatcher;
    private final DataFrameJoining joining;

    public DataFrameOperations(ColframeConfiguration configuration) {
        this(configuration, KeyHandlerRegistry.getDefault());
    }

    public DataFrameOperations(ColframeConfiguration configuration, KeyHandlerRegistry registry) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.configuration = configuration;
        this.dispatcher = new KeyDispatcher(registry, configuration.planCacheEnabled());
        this.joining = new DataFrameJoining(dispatcher, configuration.collisionSuffix());
    }

    public static DataFrameOperations defaults() {
        return new DataFrameOperations(ColframeConfiguration.defaults());
    }

    public ColframeConfiguration configuration() {
        return configuration;
    }

    public KeyDispatcher dispatcher() {
        return dispatcher;
    }

    // Sort

    public <K> int[] sort(DataFrameView view, int[] order, K[] keys, Comparator<? super K> comparator,
            boolean ascending) {
        return DataFrameSorting.sort(view, order, keys, comparator, ascending);
    }

    /**
     * Permutation of view rows ordering them by the key columns.
     */
    public int[] sort(DataFrameView view, int[] keyColumns, boolean ascending) {
        return DataFrameSorting.sort(view, keyColumns, ascending, dispatcher);
    }

    /**
     * A copy of the frame with its rows in key order.
     */
    public DataFrame sortFrame(DataFrame frame, int[] keyColumns, boolean ascending) {
        return frame.take(sort(frame.view(), keyColumns, ascending));
    }

    /**
     * A view over the same rows in key order. No column data is copied.
     */
    public DataFrameView sortView(DataFrameView view, int[] keyColumns, boolean ascending) {
        return view.view(sort(view, keyColumns, ascending));
    }

    // Group-by

    public <K> Iterator<Group<K>> groupBy(DataFrameView view, int[] order, K[] keys,
            Function<? super K, GroupKey[]> labeler) {
        return DataFrameGrouping.groupBy(view, order, keys, labeler);
    }

    public GroupResults<?> groupBy(DataFrameView view, int[] keyColumns) {
        return groupBy(view, keyColumns, configuration.sortBeforeGrouping());
    }

    public GroupResults<?> groupBy(DataFrameView view, int[] keyColumns, boolean sort) {
        return DataFrameGrouping.groupBy(view, keyColumns, sort, dispatcher);
    }

    // Join

    public DataFrame join(DataFrameView left, DataFrameView right, int[] leftKeys, int[] rightKeys,
            JoinStrategy strategy) {
        return join(left, right, leftKeys, rightKeys, configuration.leftSuffix(), configuration.rightSuffix(),
                strategy, configuration.sortBeforeGrouping());
    }

    public DataFrame join(DataFrameView left, DataFrameView right, int[] leftKeys, int[] rightKeys,
            String leftSuffix, String rightSuffix, JoinStrategy strategy, boolean sort) {
        return joining.join(left, right, leftKeys, rightKeys, leftSuffix, rightSuffix, strategy, sort);
    }

    public Iterator<DataFrame> joinPartitions(DataFrameView left, DataFrameView right, int[] leftKeys,
            int[] rightKeys, String leftSuffix, String rightSuffix, JoinStrategy strategy, boolean sort) {
        return joining.joinPartitions(left, right, leftKeys, rightKeys, leftSuffix, rightSuffix, strategy, sort);
    }
}
