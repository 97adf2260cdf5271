package com.fintech.gaps.storage;

import com.fintech.gaps.domain.Column;
import com.fintech.gaps.domain.ColumnType;
import com.fintech.gaps.domain.TimestampFormat;

/**
 * Text rendering of cells for the text formats.
 */
final class CellText {

    private CellText() {
    }

    /** Cell as text; empty for missing cells, timestamps in the column's own layout. */
    static String render(Column column, int row) {
        Object value = column.get(row);
        if (value == null) {
            return "";
        }
        if (column.type() == ColumnType.TIMESTAMP) {
            return timestampFormat(column).format((Long) value);
        }
        return value.toString();
    }

    static TimestampFormat timestampFormat(Column column) {
        return column.timestampFormat() != null ? column.timestampFormat() : TimestampFormat.ISO_INSTANT;
    }
}
