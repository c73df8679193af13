package io.colframe.storage;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataFrameViewTest {

    private final DataFrame frame = DataFrame.builder()
            .addInt("a", 10, 20, 30, 40)
            .addString("b", "w", "x", "y", "z")
            .build();

    @Test
    void fullViewMapsRowsOneToOne() {
        DataFrameView view = frame.view();

        assertThat(view.source()).isSameAs(frame);
        assertThat(view.rowCount()).isEqualTo(4);
        assertThat(view.sourceRows()).containsExactly(0, 1, 2, 3);
        assertThat(view.get(3, 1)).isEqualTo("z");
    }

    @Test
    void subViewComposesOntoSourceFrame() {
        DataFrameView outer = frame.view(new int[]{3, 1, 2});
        DataFrameView inner = outer.view(new int[]{2, 0});

        assertThat(inner.source()).isSameAs(frame);
        assertThat(inner.sourceRows()).containsExactly(2, 3);
        assertThat(inner.get(0, 0)).isEqualTo(30);
        assertThat(inner.get(1, 1)).isEqualTo("z");
    }

    @Test
    void viewColumnsAreSourceColumns() {
        DataFrameView view = frame.view(new int[]{1});

        assertThat(view.column(0)).isSameAs(frame.column(0));
        assertThat(view.column(0).get(view.sourceRow(0))).isEqualTo(20);
    }

    @Test
    void outOfRangeRowsAreRejected() {
        assertThatThrownBy(() -> frame.view(new int[]{4}))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> frame.view(new int[]{0, 1}).view(new int[]{2}))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void outOfRangeColumnIsRejected() {
        assertThatThrownBy(() -> frame.view().columnType(2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void copyMaterialisesRowsAndSelectedColumns() {
        DataFrame copy = frame.select("b").view(new int[]{3, 0}).copy();

        assertThat(copy.columnNames()).containsExactly("b");
        assertThat(copy.rowCount()).isEqualTo(2);
        assertThat(copy.get(0, 0)).isEqualTo("z");
        assertThat(copy.get(1, 0)).isEqualTo("w");
    }

    @Test
    void emptyViewHasNoRows() {
        DataFrameView view = frame.view(new int[0]);

        assertThat(view.rowCount()).isZero();
        assertThat(view.copy().columnNames()).containsExactly("a", "b");
    }
}
