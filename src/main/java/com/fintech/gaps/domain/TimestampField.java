package com.fintech.gaps.domain;

/**
 * Where a table keeps its timestamps.
 *
 * @param kind index, named column, or none found
 * @param name column name; the index name for {@link Kind#INDEX}; null for {@link Kind#NONE}
 */
public record TimestampField(Kind kind, String name) {

    public enum Kind {
        INDEX,
        COLUMN,
        NONE
    }

    public static TimestampField index(String name) {
        return new TimestampField(Kind.INDEX, name);
    }

    public static TimestampField column(String name) {
        return new TimestampField(Kind.COLUMN, name);
    }

    public static TimestampField none() {
        return new TimestampField(Kind.NONE, null);
    }

    public boolean isFound() {
        return kind != Kind.NONE;
    }
}
