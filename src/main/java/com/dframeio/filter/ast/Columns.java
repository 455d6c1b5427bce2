package com.dframeio.filter.ast;

final class Columns {

    private Columns() {
    }

    static String requireName(String column) {
        if (column == null || column.isEmpty()) {
            throw new IllegalArgumentException("Column name cannot be null or empty");
        }
        return column;
    }
}
