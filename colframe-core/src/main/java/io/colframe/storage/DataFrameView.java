package io.colframe.storage;

import io.colframe.core.ColumnType;

import java.util.ArrayList;
import java.util.List;

/**
 * A read-only view over a {@link DataFrame}: a shared reference to the frame's
 * columns plus an optional row-index array and a column subset.
 * <p>
 * Views never copy column data. Row {@code i} of the view is row
 * {@link #sourceRow(int)} of the source frame. Sub-views compose their index
 * arrays onto the source frame, so every view derived from a frame indexes that
 * frame directly.
 */
public final class DataFrameView {
    private final DataFrame source;
    private final int[] rows;
    private final int[] columns;

    DataFrameView(DataFrame source, int[] rows, int[] columns) {
        if (source == null) {
            throw new IllegalArgumentException("source required");
        }
        if (rows != null) {
            for (var row : rows) {
                if (row < 0 || row >= source.rowCount()) {
                    throw new IndexOutOfBoundsException("row " + row + " out of range for frame of "
                            + source.rowCount() + " rows");
                }
            }
        }
        this.source = source;
        this.rows = rows;
        this.columns = columns;
    }

    public DataFrame source() {
        return source;
    }

    public int rowCount() {
        return rows == null ? source.rowCount() : rows.length;
    }

    public int columnCount() {
        return columns.length;
    }

    /**
     * Row of the source frame behind view row {@code row}.
     */
    public int sourceRow(int row) {
        return rows == null ? row : rows[row];
    }

    /**
     * Source frame rows of this view, in view order.
     */
    public int[] sourceRows() {
        if (rows != null) {
            return rows.clone();
        }
        var all = new int[source.rowCount()];
        for (var i = 0; i < all.length; i++) {
            all[i] = i;
        }
        return all;
    }

    /**
     * Source column behind view column {@code index}; index it with {@link #sourceRow(int)}.
     */
    public Column column(int index) {
        return source.column(columns[checkColumn(index)]);
    }

    public String columnName(int index) {
        return column(index).name();
    }

    public ColumnType columnType(int index) {
        return column(index).type();
    }

    public List<String> columnNames() {
        var names = new ArrayList<String>(columns.length);
        for (var i = 0; i < columns.length; i++) {
            names.add(columnName(i));
        }
        return names;
    }

    public Object get(int row, int column) {
        return column(column).get(sourceRow(row));
    }

    /**
     * A sub-view over view rows {@code rows}; the result indexes the source frame.
     */
    public DataFrameView view(int[] rows) {
        var mapped = new int[rows.length];
        for (var i = 0; i < rows.length; i++) {
            if (rows[i] < 0 || rows[i] >= rowCount()) {
                throw new IndexOutOfBoundsException("row " + rows[i] + " out of range for view of "
                        + rowCount() + " rows");
            }
            mapped[i] = sourceRow(rows[i]);
        }
        return new DataFrameView(source, mapped, columns);
    }

    /**
     * Materialise the view into a new frame holding only its rows and columns.
     */
    public DataFrame copy() {
        var sourceRows = sourceRows();
        var copied = new ArrayList<Column>(columns.length);
        for (var i = 0; i < columns.length; i++) {
            copied.add(column(i).take(sourceRows));
        }
        return new DataFrame(copied);
    }

    private int checkColumn(int index) {
        if (index < 0 || index >= columns.length) {
            throw new IllegalArgumentException("column index " + index + " out of range for view of "
                    + columns.length + " columns");
        }
        return index;
    }

    @Override
    public String toString() {
        return copy().toString();
    }
}
