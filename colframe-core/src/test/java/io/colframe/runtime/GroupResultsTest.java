package io.colframe.runtime;

import io.colframe.core.ColumnType;
import io.colframe.core.TypeCodes;
import io.colframe.runtime.dispatch.KeyDispatcher;
import io.colframe.storage.DataFrame;
import io.colframe.storage.DataFrameView;
import io.colframe.storage.ShortColumn;
import io.colframe.storage.VectorColumn;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GroupResultsTest {

    private final KeyDispatcher dispatcher = KeyDispatcher.defaultDispatcher();

    private static DataFrameView sales() {
        return DataFrame.builder()
                .addInt("k", 1, 2, 1, 2, 1)
                .addInt("i", 1, 2, 3, 4, 5)
                .addUInt("u", -1, 2, 1, 4, 1)
                .addLong("l", 10L, 20L, 30L, 40L, 50L)
                .addDouble("d", 1.0, 2.0, 3.0, 4.0, 5.5)
                .addBoolean("b", true, false, false, false, true)
                .addString("s", "a", null, "b", "c", null)
                .add(VectorColumn.of("v", TypeCodes.TYPE_INT, new int[]{1}, null, null, null, null))
                .build()
                .view();
    }

    private GroupResults<?> groupByKey() {
        return DataFrameGrouping.groupBy(sales(), new int[]{0}, true, dispatcher);
    }

    @Test
    void exposesGroupedViewAndKeyColumns() {
        DataFrameView view = sales();
        GroupResults<?> results = DataFrameGrouping.groupBy(view, new int[]{6, 0}, true, dispatcher);

        int[] keyColumns = results.keyColumns();
        keyColumns[0] = 1;

        assertThat(results.view()).isSameAs(view);
        assertThat(results.keyColumns()).containsExactly(6, 0);
    }

    @Test
    void countReplacesValueColumnsWithRowCounts() {
        DataFrame counts = groupByKey().count();

        assertThat(counts.columnNames()).containsExactly("k", "i", "u", "l", "d", "b", "s");
        assertThat(counts.rowCount()).isEqualTo(2);
        assertThat(counts.columnType(0)).isEqualTo(ColumnType.INT);
        assertThat(counts.columnType(6)).isEqualTo(ColumnType.LONG);
        assertThat(counts.get(0, 0)).isEqualTo(1);
        assertThat(counts.get(0, 1)).isEqualTo(3L);
        assertThat(counts.get(1, 6)).isEqualTo(2L);
    }

    @Test
    void sumKeepsColumnKinds() {
        DataFrame sums = groupByKey().sum();

        assertThat(sums.get(0, 1)).isEqualTo(9);
        assertThat(sums.get(1, 1)).isEqualTo(6);
        assertThat(sums.get(0, 2)).isEqualTo(1);
        assertThat(sums.get(0, 3)).isEqualTo(90L);
        assertThat(sums.get(0, 4)).isEqualTo(9.5);
        assertThat(sums.get(0, 5)).isEqualTo(true);
        assertThat(sums.get(1, 5)).isEqualTo(false);
        assertThat(sums.get(0, 6)).isEqualTo("ab");
        assertThat(sums.get(1, 6)).isEqualTo("c");
        assertThat(sums.columnType(2)).isEqualTo(ColumnType.UINT);
    }

    @Test
    void minAndMaxUseKindOrder() {
        DataFrame min = groupByKey().min();
        DataFrame max = DataFrameGrouping.groupBy(sales(), new int[]{0}, true, dispatcher).max();

        assertThat(min.get(0, 1)).isEqualTo(1);
        assertThat(max.get(0, 1)).isEqualTo(5);
        assertThat(min.get(0, 2)).isEqualTo(1);
        assertThat(max.get(0, 2)).isEqualTo(-1);
        assertThat(min.get(0, 5)).isEqualTo(false);
        assertThat(max.get(0, 5)).isEqualTo(true);
        assertThat(min.get(0, 6)).isNull();
        assertThat(max.get(0, 6)).isEqualTo("b");
        assertThat(max.get(1, 6)).isEqualTo("c");
    }

    @Test
    void meanTurnsNumbersIntoDoubles() {
        DataFrame mean = groupByKey().mean();

        assertThat(mean.columnType(1)).isEqualTo(ColumnType.DOUBLE);
        assertThat(mean.columnType(3)).isEqualTo(ColumnType.DOUBLE);
        assertThat((Double) mean.get(0, 1)).isEqualTo(3.0);
        assertThat((Double) mean.get(1, 3)).isEqualTo(30.0);
        assertThat((Double) mean.get(0, 2)).isCloseTo(4294967297.0 / 3, within(1e-6));
        assertThat((Double) mean.get(0, 4)).isCloseTo(9.5 / 3, within(1e-12));
    }

    @Test
    void meanOfNonNumericColumnsIsDefaultValue() {
        DataFrame mean = groupByKey().mean();

        assertThat(mean.columnType(5)).isEqualTo(ColumnType.BOOLEAN);
        assertThat(mean.get(0, 5)).isEqualTo(false);
        assertThat(mean.columnType(6)).isEqualTo(ColumnType.STRING);
        assertThat(mean.get(0, 6)).isNull();
    }

    @Test
    void multiColumnKeysComeFirst() {
        DataFrame counts = DataFrameGrouping.groupBy(sales(), new int[]{5, 0}, true, dispatcher)
                .aggregate(Aggregation.COUNT);

        assertThat(counts.columnNames()).startsWith("b", "k", "i");
        assertThat(counts.rowCount()).isEqualTo(3);
        assertThat(counts.get(0, 0)).isEqualTo(false);
        assertThat(counts.get(0, 1)).isEqualTo(1);
        assertThat(counts.get(0, 2)).isEqualTo(1L);
        assertThat(counts.get(1, 1)).isEqualTo(2);
        assertThat(counts.get(1, 2)).isEqualTo(2L);
        assertThat(counts.get(2, 0)).isEqualTo(true);
        assertThat(counts.get(2, 2)).isEqualTo(2L);
    }

    @Test
    void int16ValuesCanBeAggregated() {
        DataFrameView view = DataFrame.builder()
                .addInt("k", 1, 1, 2)
                .add(ShortColumn.of("h", (short) 3, (short) -4, (short) 7))
                .build()
                .view();

        DataFrame sums = DataFrameGrouping.groupBy(view, new int[]{0}, true, dispatcher).sum();
        DataFrame min = DataFrameGrouping.groupBy(view, new int[]{0}, true, dispatcher).min();

        assertThat(sums.get(0, 1)).isEqualTo((short) -1);
        assertThat(min.get(0, 1)).isEqualTo((short) -4);
        assertThat(sums.columnType(1)).isEqualTo(ColumnType.SHORT);
    }

    @Test
    void emptyInputKeepsOutputColumns() {
        DataFrameView view = DataFrame.builder().addInt("k").addDouble("d").build().view();

        DataFrame sums = DataFrameGrouping.groupBy(view, new int[]{0}, true, dispatcher).sum();

        assertThat(sums.rowCount()).isZero();
        assertThat(sums.columnNames()).containsExactly("k", "d");
    }
}
