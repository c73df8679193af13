package io.colframe.runtime;

import io.colframe.core.ColframeConfiguration;
import io.colframe.core.ColumnType;
import io.colframe.core.UnsupportedKindException;
import io.colframe.runtime.handler.IntKeyHandler;
import io.colframe.storage.DataFrame;
import io.colframe.storage.DataFrameView;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataFrameOperationsTest {

    private static DataFrame people() {
        return DataFrame.builder()
                .addString("city", "Oslo", "Lima", "Oslo", "Bern")
                .addInt("age", 40, 25, 31, 52)
                .build();
    }

    @Test
    void sortFrameCopiesRowsInKeyOrder() {
        DataFrameOperations ops = DataFrameOperations.defaults();
        DataFrame frame = people();

        DataFrame sorted = ops.sortFrame(frame, new int[]{0, 1}, true);

        assertThat(sorted).isNotSameAs(frame);
        assertThat(sorted.toString()).isEqualTo("city,age\nBern,52\nLima,25\nOslo,31\nOslo,40");
        assertThat(frame.get(0, 0)).isEqualTo("Oslo");
    }

    @Test
    void sortViewReordersWithoutCopying() {
        DataFrameOperations ops = DataFrameOperations.defaults();
        DataFrame frame = people();

        DataFrameView sorted = ops.sortView(frame.view(), new int[]{1}, false);

        assertThat(sorted.source()).isSameAs(frame);
        assertThat(sorted.sourceRows()).containsExactly(3, 0, 2, 1);
    }

    @Test
    void typedSortDelegatesToEngine() {
        DataFrameOperations ops = DataFrameOperations.defaults();
        DataFrameView view = people().view();

        int[] order = ops.sort(view, null, new Integer[]{4, 3, 2, 1}, Comparator.<Integer>naturalOrder(), true);

        assertThat(order).containsExactly(3, 2, 1, 0);
    }

    @Test
    void groupByUsesConfiguredSortFlag() {
        DataFrameView view = people().view();
        DataFrameOperations sorting = DataFrameOperations.defaults();
        DataFrameOperations presorted = new DataFrameOperations(ColframeConfiguration.builder()
                .sortBeforeGrouping(false)
                .build());

        assertThat(count(sorting.groupBy(view, new int[]{0}))).isEqualTo(3);
        assertThat(count(presorted.groupBy(view, new int[]{0}))).isEqualTo(4);
    }

    @Test
    void typedGroupByDelegatesToEngine() {
        DataFrameOperations ops = DataFrameOperations.defaults();
        DataFrameView view = people().view();

        Iterator<Group<Boolean>> groups = ops.groupBy(view, new int[]{1, 3, 0, 2},
                new Boolean[]{true, false, true, false}, key -> new GroupKey[0]);

        assertThat(groups.next().rows()).containsExactly(1, 3);
        assertThat(groups.next().key()).isTrue();
    }

    @Test
    void joinUsesConfiguredSuffixes() {
        DataFrameOperations ops = new DataFrameOperations(ColframeConfiguration.builder()
                .rightSuffix("_r")
                .collisionSuffix("_again")
                .build());
        DataFrameView left = DataFrame.builder().addString("city", "Oslo").addInt("age_r", 1).build().view();
        DataFrameView right = DataFrame.builder().addString("city", "Oslo").addInt("age", 2).build().view();

        DataFrame result = ops.join(left, right, new int[]{0}, new int[]{0}, JoinStrategy.INNER);

        assertThat(result.columnNames()).containsExactly("city", "age_r", "city_r", "age_r_again");
    }

    @Test
    void joinPartitionsAreLazyFrames() {
        DataFrameOperations ops = DataFrameOperations.defaults();
        DataFrameView left = people().view();
        DataFrameView right = DataFrame.builder().addString("city", "Oslo", "Rome").build().view();

        Iterator<DataFrame> partitions = ops.joinPartitions(left, right, new int[]{0}, new int[]{0}, "", "",
                JoinStrategy.INNER, true);

        DataFrame first = partitions.next();
        assertThat(first.rowCount()).isEqualTo(2);
        assertThat(first.columnType(2)).isEqualTo(ColumnType.STRING);
        assertThat(partitions.hasNext()).isFalse();
    }

    @Test
    void fullJoinOverloadPassesEveryArgument() {
        DataFrameOperations ops = DataFrameOperations.defaults();
        DataFrameView left = people().view();
        DataFrameView right = DataFrame.builder().addString("city", "Oslo", "Rome").build().view();

        DataFrame result = ops.join(left, right, new int[]{0}, new int[]{0}, "_l", "", JoinStrategy.RIGHT, true);

        assertThat(result.columnNames()).containsExactly("city_l", "age_l", "city");
        assertThat(result.rowCount()).isEqualTo(3);
        assertThat(result.get(2, 1)).isEqualTo(Integer.MIN_VALUE);
        assertThat(result.get(2, 2)).isEqualTo("Rome");
    }

    @Test
    void customRegistryLimitsSupportedKinds() {
        KeyHandlerRegistry registry = KeyHandlerRegistry.empty();
        registry.registerHandler(new IntKeyHandler());
        DataFrameOperations ops = new DataFrameOperations(ColframeConfiguration.defaults(), registry);

        assertThat(ops.sort(people().view(), new int[]{1}, true)).containsExactly(1, 2, 0, 3);
        assertThatThrownBy(() -> ops.sort(people().view(), new int[]{0}, true))
                .isInstanceOf(UnsupportedKindException.class);
    }

    @Test
    void planCacheFollowsConfiguration() {
        DataFrameOperations cached = DataFrameOperations.defaults();
        DataFrameOperations uncached = new DataFrameOperations(ColframeConfiguration.builder()
                .planCacheEnabled(false)
                .build());

        cached.sort(people().view(), new int[]{0}, true);
        uncached.sort(people().view(), new int[]{0}, true);

        assertThat(cached.dispatcher().cachedPlanCount()).isEqualTo(1);
        assertThat(uncached.dispatcher().cachedPlanCount()).isZero();
        assertThat(cached.configuration()).isSameAs(ColframeConfiguration.defaults());
    }

    private static int count(GroupResults<?> results) {
        List<Object> keys = new ArrayList<>();
        for (Group<?> group : results) {
            keys.add(group.key());
        }
        return keys.size();
    }
}
