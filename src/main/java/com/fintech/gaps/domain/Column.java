package com.fintech.gaps.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, typed column buffer. Null cells mark missing values.
 *
 * <p>Not thread-safe. A column belongs to exactly one {@link TimeSeriesTable}.
 */
public final class Column {

    private final String name;
    private final ColumnType type;
    private final TimestampFormat timestampFormat;
    private final ArrayList<Object> values;

    public Column(String name, ColumnType type) {
        this(name, type, null, 16);
    }

    public Column(String name, ColumnType type, TimestampFormat timestampFormat) {
        this(name, type, timestampFormat, 16);
    }

    private Column(String name, ColumnType type, TimestampFormat timestampFormat, int capacity) {
        this.name = Objects.requireNonNull(name, "Column name cannot be null");
        this.type = Objects.requireNonNull(type, "Column type cannot be null");
        this.timestampFormat = timestampFormat;
        this.values = new ArrayList<>(capacity);
    }

    public String name() {
        return name;
    }

    public ColumnType type() {
        return type;
    }

    /** Layout the column was read in; null for non-temporal or binary-typed columns. */
    public TimestampFormat timestampFormat() {
        return timestampFormat;
    }

    public boolean isNumeric() {
        return type.isNumeric();
    }

    public int size() {
        return values.size();
    }

    public Object get(int row) {
        return values.get(row);
    }

    public boolean isNull(int row) {
        return values.get(row) == null;
    }

    public void add(Object value) {
        values.add(checked(value));
    }

    public void set(int row, Object value) {
        values.set(row, checked(value));
    }

    /** Numeric view of a cell: NaN for null or non-numeric cells. */
    public double getDouble(int row) {
        Object value = values.get(row);
        return value instanceof Number number ? number.doubleValue() : Double.NaN;
    }

    /**
     * Stores a numeric value in the column's own representation.
     * NaN clears the cell; LONG columns round to the nearest integer.
     */
    public void setDouble(int row, double value) {
        if (Double.isNaN(value)) {
            values.set(row, null);
        } else if (type == ColumnType.LONG || type == ColumnType.TIMESTAMP) {
            values.set(row, Math.round(value));
        } else if (type == ColumnType.DOUBLE) {
            values.set(row, value);
        } else {
            throw new IllegalStateException("Column '" + name + "' of type " + type + " is not numeric");
        }
    }

    /** Copies every cell into a double array, NaN marking missing cells. */
    public double[] toDoubleArray() {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = getDouble(i);
        }
        return out;
    }

    public long nullCount() {
        return values.stream().filter(Objects::isNull).count();
    }

    /** Returns a column with the same name, type and format but no cells. */
    public Column emptyCopy() {
        return new Column(name, type, timestampFormat, Math.max(16, values.size()));
    }

    public Column copy() {
        Column copy = emptyCopy();
        copy.values.addAll(values);
        return copy;
    }

    /** Returns the same cells under a different name. */
    public Column renamed(String newName) {
        Column copy = new Column(newName, type, timestampFormat, Math.max(16, values.size()));
        copy.values.addAll(values);
        return copy;
    }

    public List<Object> values() {
        return Collections.unmodifiableList(values);
    }

    private Object checked(Object value) {
        if (!type.accepts(value)) {
            throw new IllegalArgumentException(
                "Column '" + name + "' of type " + type + " cannot hold " + value.getClass().getSimpleName()
            );
        }
        return value;
    }

    @Override
    public String toString() {
        return name + ":" + type + "[" + values.size() + "]";
    }
}
