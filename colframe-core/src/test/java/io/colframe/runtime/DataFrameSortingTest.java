package io.colframe.runtime;

import io.colframe.core.TypeCodes;
import io.colframe.core.UnsupportedKindException;
import io.colframe.core.UnsupportedShapeException;
import io.colframe.runtime.dispatch.KeyDispatcher;
import io.colframe.runtime.dispatch.KeyPlans;
import io.colframe.runtime.handler.IntKeyHandler;
import io.colframe.runtime.handler.StringKeyHandler;
import io.colframe.storage.DataFrame;
import io.colframe.storage.DataFrameView;
import io.colframe.storage.ShortColumn;
import io.colframe.storage.VectorColumn;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataFrameSortingTest {

    private final KeyDispatcher dispatcher = KeyDispatcher.defaultDispatcher();

    @Test
    void typedSortStartsFromIdentityWhenOrderIsNull() {
        DataFrameView view = DataFrame.builder().addInt("a", 3, 1, 2).build().view();
        Integer[] keys = {3, 1, 2};

        int[] order = DataFrameSorting.sort(view, null, keys, Comparator.<Integer>naturalOrder(), true);

        assertThat(order).containsExactly(1, 2, 0);
    }

    @Test
    void typedSortSortsGivenOrderInPlace() {
        DataFrameView view = DataFrame.builder().addInt("a", 3, 1, 2).build().view();
        Integer[] keys = {3, 1, 2};
        int[] order = {2, 0, 1};

        int[] result = DataFrameSorting.sort(view, order, keys, Comparator.<Integer>naturalOrder(), false);

        assertThat(result).isSameAs(order);
        assertThat(order).containsExactly(0, 2, 1);
    }

    @Test
    void typedSortRejectsWrongLengths() {
        DataFrameView view = DataFrame.builder().addInt("a", 3, 1).build().view();

        assertThatThrownBy(() -> DataFrameSorting.sort(view, null, new Integer[]{1},
                Comparator.<Integer>naturalOrder(), true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DataFrameSorting.sort(view, new int[]{0}, new Integer[]{1, 2},
                Comparator.<Integer>naturalOrder(), true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equalKeysKeepRowOrderInBothDirections() {
        DataFrameView view = DataFrame.builder().addInt("a", 2, 1, 2, 1).build().view();

        assertThat(DataFrameSorting.sort(view, new int[]{0}, true, dispatcher)).containsExactly(1, 3, 0, 2);
        assertThat(DataFrameSorting.sort(view, new int[]{0}, false, dispatcher)).containsExactly(0, 2, 1, 3);
    }

    @Test
    void multiColumnSortIsLexicographic() {
        DataFrameView view = DataFrame.builder()
                .addInt("a", 1, 0, 1, 0)
                .addString("b", "b", "z", "a", null)
                .build()
                .view();

        assertThat(DataFrameSorting.sort(view, new int[]{0, 1}, true, dispatcher)).containsExactly(3, 1, 2, 0);
        assertThat(DataFrameSorting.sort(view, new int[]{1, 0}, true, dispatcher)).containsExactly(3, 2, 0, 1);
    }

    @Test
    void descendingReversesTheWholeKey() {
        DataFrameView view = DataFrame.builder()
                .addInt("a", 1, 0, 1, 0)
                .addLong("b", 5L, 6L, 7L, 8L)
                .build()
                .view();

        assertThat(DataFrameSorting.sort(view, new int[]{0, 1}, false, dispatcher)).containsExactly(2, 0, 3, 1);
    }

    @Test
    void threeKeyColumnsAreSupported() {
        DataFrameView view = DataFrame.builder()
                .addBoolean("a", true, false, true, false)
                .addUInt("b", 1, 1, -1, 1)
                .addDouble("c", 2.0, 1.0, 0.0, 0.5)
                .build()
                .view();

        assertThat(DataFrameSorting.sort(view, new int[]{0, 1, 2}, true, dispatcher)).containsExactly(3, 1, 0, 2);
    }

    @Test
    void nanSortsLastAndUnsignedSortsUnsigned() {
        DataFrameView floats = DataFrame.builder().addFloat("f", Float.NaN, 1f, -1f).build().view();
        DataFrameView uints = DataFrame.builder().addUInt("u", -1, 1, 0).build().view();

        assertThat(DataFrameSorting.sort(floats, new int[]{0}, true, dispatcher)).containsExactly(2, 1, 0);
        assertThat(DataFrameSorting.sort(uints, new int[]{0}, true, dispatcher)).containsExactly(2, 1, 0);
    }

    @Test
    void vectorColumnsCanBeSorted() {
        DataFrameView view = DataFrame.builder()
                .add(VectorColumn.of("v", TypeCodes.TYPE_INT, new int[]{3}, null, new int[]{1, 2}, new int[]{0}))
                .build()
                .view();

        assertThat(DataFrameSorting.sort(view, new int[]{0}, true, dispatcher)).containsExactly(1, 3, 0, 2);
    }

    @Test
    void sortIndexesViewRows() {
        DataFrameView view = DataFrame.builder().addInt("a", 5, 4, 3, 2).build().view(new int[]{3, 0, 1});

        assertThat(DataFrameSorting.sort(view, new int[]{0}, false, dispatcher)).containsExactly(1, 2, 0);
    }

    @Test
    void sortingSortedViewGivesIdentity() {
        DataFrameView view = DataFrame.builder()
                .addString("s", "c", "a", "b", "a")
                .addInt("i", 1, 2, 3, 4)
                .build()
                .view();
        int[] order = DataFrameSorting.sort(view, new int[]{0}, true, dispatcher);

        int[] again = DataFrameSorting.sort(view.view(order), new int[]{0}, true, dispatcher);

        assertThat(again).containsExactly(0, 1, 2, 3);
    }

    @Test
    void planSortOrdersRowsByPrimitiveRowOrder() {
        DataFrameView view = DataFrame.builder().addInt("a", 2, 1, 2).addString("b", "x", "y", null).build().view();
        KeyPlan<Key2<Integer, String>> plan = KeyPlans.plan(new IntKeyHandler(), new StringKeyHandler());

        int[] order = DataFrameSorting.sort(view, new int[]{0, 1}, plan, true);

        assertThat(order).containsExactly(1, 2, 0);
        assertThat(plan.rowOrder(view, new int[]{0, 1}).compare(2, 0)).isNegative();
        assertThat(plan.keyReader(view, new int[]{0, 1}).apply(0)).isEqualTo(new Key2<>(2, "x"));
    }

    @Test
    void emptyViewSortsToEmptyPermutation() {
        DataFrameView view = DataFrame.builder().addInt("a").build().view();

        assertThat(DataFrameSorting.sort(view, new int[]{0}, true, dispatcher)).isEmpty();
    }

    @Test
    void resultIsSortedPermutationOfRandomRows() {
        Random random = new Random(42);
        int rows = 500;
        int[] a = new int[rows];
        String[] b = new String[rows];
        for (int i = 0; i < rows; i++) {
            a[i] = random.nextInt(10);
            b[i] = random.nextInt(8) == 0 ? null : String.valueOf((char) ('a' + random.nextInt(5)));
        }
        DataFrameView view = DataFrame.builder().addInt("a", a).addString("b", b).build().view();

        int[] order = DataFrameSorting.sort(view, new int[]{0, 1}, true, dispatcher);

        assertThat(order).hasSize(rows);
        int[] rowsSeen = order.clone();
        Arrays.sort(rowsSeen);
        assertThat(rowsSeen).isEqualTo(DataFrameSorting.identity(rows));
        for (int i = 1; i < rows; i++) {
            int prev = order[i - 1];
            int cur = order[i];
            int cmp = Integer.compare(a[prev], a[cur]);
            if (cmp == 0) {
                cmp = StringOrder.compare(b[prev], b[cur]);
            }
            assertThat(cmp).isLessThanOrEqualTo(0);
            if (cmp == 0) {
                assertThat(prev).isLessThan(cur);
            }
        }
    }

    @Test
    void moreThanThreeKeysFailsBeforeSorting() {
        DataFrameView view = DataFrame.builder()
                .addInt("a", 1).addInt("b", 1).addInt("c", 1).addInt("d", 1)
                .build()
                .view();

        assertThatThrownBy(() -> DataFrameSorting.sort(view, new int[]{0, 1, 2, 3}, true, dispatcher))
                .isInstanceOf(UnsupportedShapeException.class)
                .hasMessage("Sort is not implemented for 4 columns, at most 3 key columns are supported");
    }

    @Test
    void unorderedKindFailsBeforeSorting() {
        DataFrameView view = DataFrame.builder().add(ShortColumn.of("h", (short) 2, (short) 1)).build().view();

        assertThatThrownBy(() -> DataFrameSorting.sort(view, new int[]{0}, true, dispatcher))
                .isInstanceOf(UnsupportedKindException.class);
    }

    @Test
    void adversarialComparatorSortsWithoutDeepRecursion() {
        int rows = 40_000;
        DataFrameView view = DataFrame.builder().addInt("a", new int[rows]).build().view();
        Integer[] keys = IntStream.range(0, rows).boxed().toArray(Integer[]::new);
        QuicksortAdversary adversary = new QuicksortAdversary(rows);

        int[] order = DataFrameSorting.sort(view, null, keys, adversary, true);

        assertPermutation(order, rows);
        for (int i = 1; i < rows; i++) {
            assertThat(adversary.value(order[i - 1])).isLessThanOrEqualTo(adversary.value(order[i]));
        }
    }

    @Test
    void largeOrganPipeAndConstantColumnsSort() {
        int rows = 200_000;
        int[] pipe = new int[rows];
        int[] constant = new int[rows];
        for (int i = 0; i < rows; i++) {
            pipe[i] = i < rows / 2 ? i : rows - i;
            constant[i] = 7;
        }
        DataFrameView view = DataFrame.builder().addInt("pipe", pipe).addInt("constant", constant).build().view();

        int[] byPipe = DataFrameSorting.sort(view, new int[]{0}, false, dispatcher);
        int[] byConstant = DataFrameSorting.sort(view, new int[]{1}, true, dispatcher);

        assertPermutation(byPipe, rows);
        for (int i = 1; i < rows; i++) {
            assertThat(pipe[byPipe[i - 1]]).isGreaterThanOrEqualTo(pipe[byPipe[i]]);
        }
        assertThat(byConstant).isEqualTo(DataFrameSorting.identity(rows));
    }

    private static void assertPermutation(int[] order, int rows) {
        int[] rowsSeen = order.clone();
        Arrays.sort(rowsSeen);
        assertThat(rowsSeen).isEqualTo(DataFrameSorting.identity(rows));
    }

    /**
     * McIlroy's adversary: values are fixed lazily so that each pivot ends up
     * near an extreme of its partition.
     */
    private static final class QuicksortAdversary implements Comparator<Integer> {
        private final int[] values;
        private final int gas;
        private int solid;
        private int candidate;

        QuicksortAdversary(int size) {
            values = new int[size];
            gas = size;
            Arrays.fill(values, gas);
        }

        int value(int row) {
            return values[row];
        }

        @Override
        public int compare(Integer left, Integer right) {
            int x = left;
            int y = right;
            if (values[x] == gas && values[y] == gas) {
                if (x == candidate) {
                    values[x] = solid++;
                } else {
                    values[y] = solid++;
                }
            }
            if (values[x] == gas) {
                candidate = x;
            } else if (values[y] == gas) {
                candidate = y;
            }
            return Integer.compare(values[x], values[y]);
        }
    }
}
