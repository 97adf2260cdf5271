package com.fintech.gaps.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * In-memory table: an ordered schema of typed columns with equal row counts,
 * plus an optional timestamp index that is not part of the column list.
 *
 * <p>Ownership is exclusive: whichever component holds a table may read it, and
 * components that produce a modified table return a new instance instead of
 * mutating the one they were handed.
 *
 * <p>Attributes carry file-level layout hints (JSON layout, materialized index
 * name) from a reader through repair to the matching writer.
 */
public final class TimeSeriesTable {

    /** Name of the column that was the timestamp index before materialization. */
    public static final String ATTR_INDEX_COLUMN = "index.column";

    private final List<Column> columns;
    private final Column index;
    private final Map<String, String> attributes;

    private TimeSeriesTable(List<Column> columns, Column index, Map<String, String> attributes) {
        this.columns = columns;
        this.index = index;
        this.attributes = attributes;
        validate();
    }

    public static TimeSeriesTable of(List<Column> columns) {
        return new TimeSeriesTable(new ArrayList<>(columns), null, new LinkedHashMap<>());
    }

    public static TimeSeriesTable of(List<Column> columns, Column index, Map<String, String> attributes) {
        return new TimeSeriesTable(new ArrayList<>(columns), index, new LinkedHashMap<>(attributes));
    }

    /** Table with no columns and no rows. */
    public static TimeSeriesTable empty() {
        return of(List.of());
    }

    public int rowCount() {
        if (!columns.isEmpty()) {
            return columns.get(0).size();
        }
        return index != null ? index.size() : 0;
    }

    public int columnCount() {
        return columns.size();
    }

    public List<Column> columns() {
        return Collections.unmodifiableList(columns);
    }

    public Column column(int position) {
        return columns.get(position);
    }

    /**
     * Schema lookup by exact name.
     *
     * @return position of the column, empty if the schema has no such column
     */
    public OptionalInt columnIndex(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(name)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    public boolean hasColumn(String name) {
        return columnIndex(name).isPresent();
    }

    /** @throws IllegalArgumentException if the schema has no such column */
    public Column column(String name) {
        return columns.get(columnIndex(name)
            .orElseThrow(() -> new IllegalArgumentException("No column named '" + name + "'")));
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::name).toList();
    }

    public boolean hasTimestampIndex() {
        return index != null;
    }

    public Column index() {
        return index;
    }

    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    /** Returns a copy carrying one more attribute. */
    public TimeSeriesTable withAttribute(String key, String value) {
        TimeSeriesTable copy = copy();
        copy.attributes.put(key, value);
        return copy;
    }

    /**
     * Turns the timestamp index into an ordinary leading column so detection and
     * repair can treat it like any other timestamp field. The column keeps the
     * index name and is recorded in {@link #ATTR_INDEX_COLUMN} so writers can put
     * it back where it came from.
     *
     * @throws IllegalStateException if the table has no timestamp index
     */
    public TimeSeriesTable materializeIndex() {
        if (index == null) {
            throw new IllegalStateException("Table has no timestamp index to materialize");
        }
        List<Column> materialized = new ArrayList<>(columns.size() + 1);
        materialized.add(index.copy());
        columns.forEach(c -> materialized.add(c.copy()));
        Map<String, String> attrs = new LinkedHashMap<>(attributes);
        attrs.put(ATTR_INDEX_COLUMN, index.name());
        return new TimeSeriesTable(materialized, null, attrs);
    }

    /** Name of the materialized index column, or null. */
    public String materializedIndexName() {
        return attributes.get(ATTR_INDEX_COLUMN);
    }

    /**
     * Reverses {@link #materializeIndex()}: the recorded column leaves the column
     * list and becomes the timestamp index again. Tables without a materialized
     * index are returned as a copy.
     */
    public TimeSeriesTable restoreIndex() {
        String indexName = materializedIndexName();
        if (indexName == null || !hasColumn(indexName)) {
            return copy();
        }
        List<Column> remaining = new ArrayList<>(columns.size() - 1);
        Column restored = null;
        for (Column column : columns) {
            if (restored == null && column.name().equals(indexName)) {
                restored = column.copy();
            } else {
                remaining.add(column.copy());
            }
        }
        Map<String, String> attrs = new LinkedHashMap<>(attributes);
        attrs.remove(ATTR_INDEX_COLUMN);
        return new TimeSeriesTable(remaining, restored, attrs);
    }

    /**
     * Returns a copy with rows reordered.
     *
     * @param order source row for each output row
     */
    public TimeSeriesTable reorder(int[] order) {
        TimeSeriesTable out = emptyLike();
        Column reorderedIndex = index != null ? index.emptyCopy() : null;
        for (int row : order) {
            out.appendRowFrom(this, row);
            if (reorderedIndex != null) {
                reorderedIndex.add(index.get(row));
            }
        }
        return new TimeSeriesTable(out.columns, reorderedIndex, out.attributes);
    }

    /** Copy of rows {@code [from, to)}; the index, if any, is sliced alongside. */
    public TimeSeriesTable slice(int from, int to) {
        int[] order = new int[to - from];
        for (int i = 0; i < order.length; i++) {
            order[i] = from + i;
        }
        return reorder(order);
    }

    public Object value(int row, int column) {
        return columns.get(column).get(row);
    }

    /** Deep copy of columns, index and attributes. */
    public TimeSeriesTable copy() {
        List<Column> copied = new ArrayList<>(columns.size());
        columns.forEach(c -> copied.add(c.copy()));
        return new TimeSeriesTable(copied, index != null ? index.copy() : null, new LinkedHashMap<>(attributes));
    }

    /** Same schema and attributes, zero rows. The index, if any, is dropped. */
    public TimeSeriesTable emptyLike() {
        List<Column> empty = new ArrayList<>(columns.size());
        columns.forEach(c -> empty.add(c.emptyCopy()));
        return new TimeSeriesTable(empty, null, new LinkedHashMap<>(attributes));
    }

    /** Appends one row copied from another table with the same schema. */
    public void appendRowFrom(TimeSeriesTable source, int row) {
        for (int c = 0; c < columns.size(); c++) {
            columns.get(c).add(source.value(row, c));
        }
    }

    /** Appends a row of all-null cells. */
    public void appendEmptyRow() {
        columns.forEach(c -> c.add(null));
    }

    /** Appends a row given in schema order. */
    public void appendRow(Object... values) {
        if (values.length != columns.size()) {
            throw new IllegalArgumentException(
                "Row has " + values.length + " values but schema has " + columns.size() + " columns");
        }
        for (int c = 0; c < columns.size(); c++) {
            columns.get(c).add(values[c]);
        }
    }

    private void validate() {
        int rows = -1;
        for (Column column : columns) {
            Objects.requireNonNull(column, "Column cannot be null");
            if (rows >= 0 && column.size() != rows) {
                throw new IllegalArgumentException(
                    "Column '" + column.name() + "' has " + column.size() + " rows, expected " + rows);
            }
            rows = column.size();
        }
        if (index != null && rows >= 0 && index.size() != rows) {
            throw new IllegalArgumentException(
                "Index has " + index.size() + " rows, expected " + rows);
        }
    }

    @Override
    public String toString() {
        return "TimeSeriesTable{rows=" + rowCount() + ", columns=" + columnNames()
            + (index != null ? ", index=" + index.name() : "") + "}";
    }
}
