package io.colframe.storage;

import io.colframe.core.ColumnType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An ordered set of named columns sharing one row count: the column arena that
 * views index into.
 * <p>
 * Column data is immutable. The column set itself may be changed with
 * {@link #addColumn(Column)}, {@link #renameColumns(String[])} and
 * {@link #orderColumns(String[])}, which are meant for frames still being assembled;
 * views created earlier keep referring to the column positions they were built with.
 */
public final class DataFrame {
    private final List<Column> columns;
    private final Map<String, Integer> columnIndexByName;
    private int rowCount;

    public DataFrame(List<? extends Column> columns) {
        if (columns == null) {
            throw new IllegalArgumentException("columns required");
        }
        this.columns = new ArrayList<>(columns.size());
        this.columnIndexByName = new HashMap<>(columns.size());
        this.rowCount = -1;
        for (var column : columns) {
            addColumn(column);
        }
        if (rowCount < 0) {
            rowCount = 0;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Concatenate frames row-wise. Columns are matched by name against the first
     * frame and must have the same type in every frame. The result is always a new
     * frame, also for a single input.
     */
    public static DataFrame concat(List<DataFrame> frames) {
        if (frames == null || frames.isEmpty()) {
            throw new IllegalArgumentException("frames required");
        }
        var first = frames.get(0);
        if (frames.size() == 1) {
            return new DataFrame(first.columns);
        }
        for (var frame : frames) {
            if (frame.columnCount() != first.columnCount()) {
                throw new IllegalArgumentException("Frames to concatenate have different columns: "
                        + first.columnNames() + " and " + frame.columnNames());
            }
        }
        var result = new ArrayList<Column>(first.columnCount());
        for (var c = 0; c < first.columnCount(); c++) {
            var name = first.columnName(c);
            var parts = new ArrayList<Column>(frames.size());
            for (var frame : frames) {
                var column = frame.column(name);
                if (column == null) {
                    throw new IllegalArgumentException("Column '" + name + "' is missing from a frame to concatenate");
                }
                parts.add(column);
            }
            result.add(Columns.concat(name, first.columnType(c), parts));
        }
        return new DataFrame(result);
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    public Column column(int index) {
        return columns.get(index);
    }

    /**
     * Column by name, or {@code null} if absent.
     */
    public Column column(String name) {
        var index = columnIndexByName.get(name);
        return index == null ? null : columns.get(index);
    }

    /**
     * Column position by name, or {@code -1} if absent.
     */
    public int columnIndex(String name) {
        var index = columnIndexByName.get(name);
        return index == null ? -1 : index;
    }

    public String columnName(int index) {
        return columns.get(index).name();
    }

    public ColumnType columnType(int index) {
        return columns.get(index).type();
    }

    public List<String> columnNames() {
        var names = new ArrayList<String>(columns.size());
        for (var column : columns) {
            names.add(column.name());
        }
        return Collections.unmodifiableList(names);
    }

    public List<Column> columns() {
        return Collections.unmodifiableList(columns);
    }

    public Object get(int row, int column) {
        return columns.get(column).get(row);
    }

    /**
     * Append a column. Its length must match the frame's row count and its name
     * must be new.
     *
     * @return the position of the added column
     */
    public int addColumn(Column column) {
        if (column == null) {
            throw new IllegalArgumentException("column required");
        }
        if (columnIndexByName.containsKey(column.name())) {
            throw new IllegalArgumentException("Column '" + column.name() + "' already exists");
        }
        if (rowCount >= 0 && column.size() != rowCount) {
            throw new IllegalArgumentException("Column '" + column.name() + "' has " + column.size()
                    + " rows, frame has " + rowCount);
        }
        rowCount = column.size();
        columns.add(column);
        columnIndexByName.put(column.name(), columns.size() - 1);
        return columns.size() - 1;
    }

    /**
     * Rename all columns at once, by position.
     */
    public void renameColumns(String[] names) {
        if (names == null || names.length != columns.size()) {
            throw new IllegalArgumentException("names length must match column count " + columns.size());
        }
        if (Arrays.stream(names).distinct().count() != names.length) {
            throw new IllegalArgumentException("Duplicate column names: " + Arrays.toString(names));
        }
        columnIndexByName.clear();
        for (var i = 0; i < names.length; i++) {
            columns.set(i, columns.get(i).rename(names[i]));
            columnIndexByName.put(names[i], i);
        }
    }

    /**
     * Reorder columns to follow the given name sequence, which must name every
     * column exactly once.
     */
    public void orderColumns(String[] names) {
        if (names == null || names.length != columns.size()) {
            throw new IllegalArgumentException("names length must match column count " + columns.size());
        }
        var reordered = new ArrayList<Column>(names.length);
        for (var name : names) {
            var column = column(name);
            if (column == null) {
                throw new IllegalArgumentException("Unknown column '" + name + "'");
            }
            reordered.add(column);
        }
        columns.clear();
        columnIndexByName.clear();
        for (var column : reordered) {
            if (columnIndexByName.put(column.name(), columns.size()) != null) {
                throw new IllegalArgumentException("Column '" + column.name() + "' listed twice");
            }
            columns.add(column);
        }
    }

    /**
     * Copy the given rows, in order, into a new frame.
     */
    public DataFrame take(int[] rows) {
        var taken = new ArrayList<Column>(columns.size());
        for (var column : columns) {
            taken.add(column.take(rows));
        }
        return new DataFrame(taken);
    }

    /**
     * Repeat rows {@code times} times following the strategy.
     *
     * @throws ArithmeticException if the repeated row count does not fit an {@code int}
     */
    public DataFrame multiply(int times, MultiplyStrategy strategy) {
        if (times < 0) {
            throw new IllegalArgumentException("times must not be negative: " + times);
        }
        var rows = new int[Math.multiplyExact(rowCount, times)];
        var pos = 0;
        if (strategy == MultiplyStrategy.BLOCK) {
            for (var t = 0; t < times; t++) {
                for (var row = 0; row < rowCount; row++) {
                    rows[pos++] = row;
                }
            }
        } else {
            for (var row = 0; row < rowCount; row++) {
                for (var t = 0; t < times; t++) {
                    rows[pos++] = row;
                }
            }
        }
        return take(rows);
    }

    public DataFrameView view() {
        return new DataFrameView(this, null, allColumns());
    }

    /**
     * A view over a subset of rows. The array is not copied.
     */
    public DataFrameView view(int[] rows) {
        return new DataFrameView(this, rows, allColumns());
    }

    /**
     * A view restricted to the named columns, in the given order.
     */
    public DataFrameView select(String... names) {
        var indices = new int[names.length];
        for (var i = 0; i < names.length; i++) {
            indices[i] = columnIndex(names[i]);
            if (indices[i] < 0) {
                throw new IllegalArgumentException("Unknown column '" + names[i] + "'");
            }
        }
        return new DataFrameView(this, null, indices);
    }

    private int[] allColumns() {
        var indices = new int[columns.size()];
        for (var i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        return indices;
    }

    /**
     * Header line of column names followed by one comma separated line per row.
     */
    @Override
    public String toString() {
        var text = new StringBuilder(String.join(",", columnNames()));
        for (var row = 0; row < rowCount; row++) {
            text.append('\n');
            for (var c = 0; c < columns.size(); c++) {
                if (c > 0) {
                    text.append(',');
                }
                var column = columns.get(c);
                text.append(Columns.render(column.type(), column.get(row)));
            }
        }
        return text.toString();
    }

    public static final class Builder {
        private final List<Column> columns = new ArrayList<>();

        private Builder() {
        }

        public Builder add(Column column) {
            columns.add(column);
            return this;
        }

        public Builder addBoolean(String name, boolean... values) {
            return add(BooleanColumn.of(name, values));
        }

        public Builder addInt(String name, int... values) {
            return add(IntColumn.of(name, values));
        }

        public Builder addUInt(String name, int... values) {
            return add(IntColumn.unsigned(name, values));
        }

        public Builder addLong(String name, long... values) {
            return add(LongColumn.of(name, values));
        }

        public Builder addFloat(String name, float... values) {
            return add(FloatColumn.of(name, values));
        }

        public Builder addDouble(String name, double... values) {
            return add(DoubleColumn.of(name, values));
        }

        public Builder addString(String name, String... values) {
            return add(StringColumn.of(name, values));
        }

        public DataFrame build() {
            return new DataFrame(columns);
        }
    }
}
