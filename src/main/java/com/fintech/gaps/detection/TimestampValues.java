package com.fintech.gaps.detection;

import com.fintech.gaps.domain.Column;
import com.fintech.gaps.domain.TimestampFormat;

/**
 * Reads a timestamp column cell by cell into epoch millis.
 *
 * <p>Cells that cannot be read as timestamps come back as null rather than
 * throwing; callers decide whether to drop or reject them.
 */
public final class TimestampValues {

    private TimestampValues() {
    }

    /**
     * Parses every cell of a column. The column's own format is tried first for
     * text cells, then the general detection order.
     *
     * @return epoch millis per row, null where a cell is missing or unparseable
     */
    public static Long[] parse(Column column) {
        Long[] out = new Long[column.size()];
        TimestampFormat format = column.timestampFormat();
        for (int row = 0; row < out.length; row++) {
            Object value = column.get(row);
            Long millis = null;
            if (value instanceof String text && format != null) {
                millis = format.parse(text);
            }
            out[row] = millis != null ? millis : TimestampFormat.toEpochMillis(value);
        }
        return out;
    }

    /** Number of cells that did not parse. */
    public static int countUnparseable(Long[] parsed) {
        int count = 0;
        for (Long value : parsed) {
            if (value == null) {
                count++;
            }
        }
        return count;
    }
}
