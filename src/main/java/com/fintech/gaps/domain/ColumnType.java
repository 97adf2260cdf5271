package com.fintech.gaps.domain;

/**
 * Value types a table column can carry. Each type has exactly one Java representation:
 * TIMESTAMP and LONG hold {@link Long} (timestamps as epoch millis), DOUBLE holds
 * {@link Double}, BOOLEAN holds {@link Boolean} and STRING holds {@link String}.
 */
public enum ColumnType {

    TIMESTAMP(Long.class),
    LONG(Long.class),
    DOUBLE(Double.class),
    BOOLEAN(Boolean.class),
    STRING(String.class);

    private final Class<?> javaType;

    ColumnType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> javaType() {
        return javaType;
    }

    /** Numeric columns are the ones interpolation strategies operate on. */
    public boolean isNumeric() {
        return this == LONG || this == DOUBLE;
    }

    /** Returns true for null or a value of this type's Java representation. */
    public boolean accepts(Object value) {
        return value == null || javaType.isInstance(value);
    }
}
