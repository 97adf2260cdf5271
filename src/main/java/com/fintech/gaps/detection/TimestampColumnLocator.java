package com.fintech.gaps.detection;

import com.fintech.gaps.domain.Column;
import com.fintech.gaps.domain.ColumnType;
import com.fintech.gaps.domain.TimeSeriesTable;
import com.fintech.gaps.domain.TimestampField;
import com.fintech.gaps.domain.TimestampFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Finds the field holding a table's timestamps.
 *
 * <p>Search order:
 * <ol>
 *   <li>a timestamp index</li>
 *   <li>a column with a conventional name ({@link #CONVENTIONAL_NAMES})</li>
 *   <li>the first TIMESTAMP-typed column</li>
 *   <li>the first string column whose leading non-null values all parse as timestamps</li>
 * </ol>
 */
public class TimestampColumnLocator {

    private static final Logger log = LoggerFactory.getLogger(TimestampColumnLocator.class);

    /** Names tried in order before falling back to a scan by type. */
    public static final List<String> CONVENTIONAL_NAMES = List.of(
        "timestamp", "time", "date", "datetime", "dt", "ts",
        "Timestamp", "Time", "Date", "DateTime", "Datetime", "DT", "TS",
        "TIMESTAMP", "TIME", "DATE", "DATETIME"
    );

    /** Leading non-null values sampled when probing a string column. */
    static final int SAMPLE_SIZE = 10;

    public TimestampField locate(TimeSeriesTable table) {
        if (table == null) {
            return TimestampField.none();
        }

        if (table.hasTimestampIndex()) {
            return TimestampField.index(table.index().name());
        }

        for (String name : CONVENTIONAL_NAMES) {
            if (table.hasColumn(name)) {
                return TimestampField.column(name);
            }
        }

        for (Column column : table.columns()) {
            if (column.type() == ColumnType.TIMESTAMP) {
                return TimestampField.column(column.name());
            }
        }

        for (Column column : table.columns()) {
            if (column.type() == ColumnType.STRING && looksTemporal(column)) {
                log.debug("Timestamp column found by content scan: {}", column.name());
                return TimestampField.column(column.name());
            }
        }

        return TimestampField.none();
    }

    private boolean looksTemporal(Column column) {
        int sampled = 0;
        for (int row = 0; row < column.size() && sampled < SAMPLE_SIZE; row++) {
            Object value = column.get(row);
            if (value == null) {
                continue;
            }
            if (TimestampFormat.detect(value.toString()) == null) {
                return false;
            }
            sampled++;
        }
        return sampled > 0;
    }
}
