package io.colframe.runtime;

import io.colframe.core.ColumnType;
import io.colframe.core.MissingValues;
import io.colframe.core.TypeCodes;
import io.colframe.storage.Column;
import io.colframe.storage.Columns;
import io.colframe.storage.DataFrame;
import io.colframe.storage.DataFrameView;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Reduces each group to one row.
 */
final class GroupAggregator {
    private final DataFrameView view;
    private final int[] keyColumns;
    private final int[] valueColumns;
    private final Aggregation aggregation;

    GroupAggregator(DataFrameView view, int[] keyColumns, Aggregation aggregation) {
        this.view = view;
        this.keyColumns = keyColumns;
        this.aggregation = aggregation;
        this.valueColumns = valueColumns(view, keyColumns);
    }

    private static int[] valueColumns(DataFrameView view, int[] keyColumns) {
        var values = new ArrayList<Integer>();
        for (var c = 0; c < view.columnCount(); c++) {
            if (!contains(keyColumns, c) && !view.columnType(c).isVector()) {
                values.add(c);
            }
        }
        return values.stream().mapToInt(Integer::intValue).toArray();
    }

    private static boolean contains(int[] values, int value) {
        for (var v : values) {
            if (v == value) {
                return true;
            }
        }
        return false;
    }

    <K> DataFrame aggregate(Iterator<Group<K>> groups) {
        var keyValues = new ArrayList<List<Object>>();
        var aggregated = new ArrayList<List<Object>>();
        for (var i = 0; i < keyColumns.length; i++) {
            keyValues.add(new ArrayList<>());
        }
        for (var i = 0; i < valueColumns.length; i++) {
            aggregated.add(new ArrayList<>());
        }
        while (groups.hasNext()) {
            var group = groups.next();
            var labels = group.labels();
            for (var i = 0; i < keyColumns.length; i++) {
                keyValues.get(i).add(labels[i].value());
            }
            for (var i = 0; i < valueColumns.length; i++) {
                aggregated.get(i).add(reduce(group.view(), valueColumns[i]));
            }
        }

        var columns = new ArrayList<Column>(keyColumns.length + valueColumns.length);
        for (var i = 0; i < keyColumns.length; i++) {
            columns.add(Columns.fromValues(view.columnName(keyColumns[i]), view.columnType(keyColumns[i]),
                    keyValues.get(i).toArray()));
        }
        for (var i = 0; i < valueColumns.length; i++) {
            var c = valueColumns[i];
            columns.add(Columns.fromValues(view.columnName(c), outputType(view.columnType(c)),
                    aggregated.get(i).toArray()));
        }
        return new DataFrame(columns);
    }

    private ColumnType outputType(ColumnType type) {
        if (aggregation == Aggregation.COUNT) {
            return ColumnType.LONG;
        }
        if (aggregation == Aggregation.MEAN && TypeCodes.isNumeric(type.typeCode())) {
            return ColumnType.DOUBLE;
        }
        return type;
    }

    private Object reduce(DataFrameView group, int columnIndex) {
        var column = group.column(columnIndex);
        var rows = group.sourceRows();
        return switch (aggregation) {
            case COUNT -> (long) rows.length;
            case SUM -> sum(column, rows);
            case MIN -> extreme(column, rows, -1);
            case MAX -> extreme(column, rows, 1);
            case MEAN -> mean(column, rows);
        };
    }

    private static Object sum(Column column, int[] rows) {
        switch (column.typeCode()) {
            case TypeCodes.TYPE_BOOLEAN: {
                for (var row : rows) {
                    if ((Boolean) column.get(row)) {
                        return true;
                    }
                }
                return false;
            }
            case TypeCodes.TYPE_INT:
            case TypeCodes.TYPE_UINT: {
                var sum = 0;
                for (var row : rows) {
                    sum += (Integer) column.get(row);
                }
                return sum;
            }
            case TypeCodes.TYPE_LONG: {
                var sum = 0L;
                for (var row : rows) {
                    sum += (Long) column.get(row);
                }
                return sum;
            }
            case TypeCodes.TYPE_FLOAT: {
                var sum = 0f;
                for (var row : rows) {
                    sum += (Float) column.get(row);
                }
                return sum;
            }
            case TypeCodes.TYPE_DOUBLE: {
                var sum = 0d;
                for (var row : rows) {
                    sum += (Double) column.get(row);
                }
                return sum;
            }
            case TypeCodes.TYPE_SHORT: {
                short sum = 0;
                for (var row : rows) {
                    sum += (Short) column.get(row);
                }
                return sum;
            }
            case TypeCodes.TYPE_STRING: {
                StringBuilder text = null;
                for (var row : rows) {
                    var value = (String) column.get(row);
                    if (value != null) {
                        text = text == null ? new StringBuilder(value) : text.append(value);
                    }
                }
                return text == null ? null : text.toString();
            }
            default:
                throw new IllegalStateException("No sum for column type " + column.type());
        }
    }

    private static Object extreme(Column column, int[] rows, int direction) {
        var comparator = order(column.type());
        var best = column.get(rows[0]);
        for (var i = 1; i < rows.length; i++) {
            var value = column.get(rows[i]);
            if (comparator.compare(value, best) * direction > 0) {
                best = value;
            }
        }
        return best;
    }

    private static Comparator<Object> order(ColumnType type) {
        if (type.typeCode() == TypeCodes.TYPE_SHORT) {
            return (left, right) -> Short.compare((Short) left, (Short) right);
        }
        KeyHandler<Object> handler = KeyHandlerRegistry.getDefault().getHandler(type);
        if (handler == null) {
            throw new IllegalStateException("No order for column type " + type);
        }
        return handler;
    }

    private static Object mean(Column column, int[] rows) {
        var type = column.type();
        if (!TypeCodes.isNumeric(type.typeCode())) {
            return MissingValues.missingOrDefault(type);
        }
        var unsigned = type.typeCode() == TypeCodes.TYPE_UINT;
        var sum = 0d;
        for (var row : rows) {
            var value = (Number) column.get(row);
            sum += unsigned ? Integer.toUnsignedLong(value.intValue()) : value.doubleValue();
        }
        return sum / rows.length;
    }
}
