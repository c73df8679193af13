package io.colframe.storage;

import io.colframe.core.ColumnType;

abstract class AbstractColumn implements Column {
    private final String name;
    private final ColumnType type;

    AbstractColumn(String name, ColumnType type) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name required");
        }
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
        this.name = name;
        this.type = type;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ColumnType type() {
        return type;
    }

    final void checkRow(int row) {
        if (row < 0 || row >= size()) {
            throw new IndexOutOfBoundsException("row " + row + " out of range for column '" + name + "' of size " + size());
        }
    }

    @Override
    public String toString() {
        return name + ":" + type + "[" + size() + "]";
    }
}
