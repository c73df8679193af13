package io.colframe.runtime;

import io.colframe.core.TypeCodes;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VectorKeyTest {

    @Test
    void missingCellSortsFirst() {
        VectorKey missing = new VectorKey(TypeCodes.TYPE_INT, null);
        VectorKey empty = new VectorKey(TypeCodes.TYPE_INT, new int[0]);

        assertThat(VectorKey.compare(missing, empty)).isNegative();
        assertThat(VectorKey.compare(missing, new VectorKey(TypeCodes.TYPE_INT, null))).isZero();
    }

    @Test
    void shorterVectorSortsFirst() {
        VectorKey shorter = new VectorKey(TypeCodes.TYPE_LONG, new long[]{9L});
        VectorKey longer = new VectorKey(TypeCodes.TYPE_LONG, new long[]{1L, 1L});

        assertThat(VectorKey.compare(shorter, longer)).isNegative();
    }

    @Test
    void itemsCompareInItemKindOrder() {
        assertThat(VectorKey.compare(new VectorKey(TypeCodes.TYPE_UINT, new int[]{-1}),
                new VectorKey(TypeCodes.TYPE_UINT, new int[]{1}))).isPositive();
        assertThat(VectorKey.compare(new VectorKey(TypeCodes.TYPE_INT, new int[]{-1}),
                new VectorKey(TypeCodes.TYPE_INT, new int[]{1}))).isNegative();
        assertThat(VectorKey.compare(new VectorKey(TypeCodes.TYPE_STRING, new String[]{null, "b"}),
                new VectorKey(TypeCodes.TYPE_STRING, new String[]{"a", "a"}))).isNegative();
        assertThat(VectorKey.compare(new VectorKey(TypeCodes.TYPE_BOOLEAN, new boolean[]{true}),
                new VectorKey(TypeCodes.TYPE_BOOLEAN, new boolean[]{false}))).isPositive();
    }

    @Test
    void equalityIsByContent() {
        VectorKey first = new VectorKey(TypeCodes.TYPE_DOUBLE, new double[]{1.0, Double.NaN});
        VectorKey second = new VectorKey(TypeCodes.TYPE_DOUBLE, new double[]{1.0, Double.NaN});

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(VectorKey.compare(first, second)).isZero();
        assertThat(first).isNotEqualTo(new VectorKey(TypeCodes.TYPE_DOUBLE, new double[]{1.0}));
    }
}
