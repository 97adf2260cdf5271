package com.fintech.gaps.storage;

import com.fintech.gaps.domain.Column;
import com.fintech.gaps.domain.ColumnType;
import com.fintech.gaps.domain.TimestampFormat;

import java.util.List;
import java.util.Locale;

/**
 * Builds a typed column from loosely typed cells read out of a text format.
 *
 * <p>Types are tried narrowest first: LONG, DOUBLE, BOOLEAN, TIMESTAMP, STRING.
 * A column is TIMESTAMP only if every non-null cell parses in the same layout;
 * otherwise it stays STRING and remembers the layout of its first parseable cell
 * so rows inserted later are rendered consistently.
 */
final class ColumnInference {

    private ColumnInference() {
    }

    /**
     * @param name column name
     * @param cells raw cells: null, String, Long, Double or Boolean
     * @param coerceText true to read numbers and booleans out of text cells (CSV)
     */
    static Column infer(String name, List<Object> cells, boolean coerceText) {
        ColumnType type = inferType(cells, coerceText);
        TimestampFormat format = type == ColumnType.TIMESTAMP || type == ColumnType.STRING
            ? commonFormat(cells, type == ColumnType.TIMESTAMP)
            : null;

        Column column = new Column(name, type, format);
        for (Object cell : cells) {
            column.add(convert(cell, type, format));
        }
        return column;
    }

    private static ColumnType inferType(List<Object> cells, boolean coerceText) {
        boolean allLong = true;
        boolean allDouble = true;
        boolean allBoolean = true;
        boolean allText = true;
        boolean any = false;

        for (Object cell : cells) {
            if (cell == null) {
                continue;
            }
            any = true;
            allLong &= cell instanceof Long || (coerceText && cell instanceof String s && parseLong(s) != null);
            allDouble &= cell instanceof Number || (coerceText && cell instanceof String s && parseDouble(s) != null);
            allBoolean &= cell instanceof Boolean || (coerceText && cell instanceof String s && parseBoolean(s) != null);
            allText &= cell instanceof String;
        }

        if (!any) {
            return ColumnType.STRING;
        }
        if (allLong) {
            return ColumnType.LONG;
        }
        if (allDouble) {
            return ColumnType.DOUBLE;
        }
        if (allBoolean) {
            return ColumnType.BOOLEAN;
        }
        if (allText && commonFormat(cells, true) != null) {
            return ColumnType.TIMESTAMP;
        }
        return ColumnType.STRING;
    }

    /**
     * Layout shared by the text cells.
     *
     * @param strict true to require every cell to match, false to take the first match
     */
    static TimestampFormat commonFormat(List<Object> cells, boolean strict) {
        TimestampFormat format = null;
        for (Object cell : cells) {
            if (cell == null) {
                continue;
            }
            String text = cell.toString();
            if (format == null) {
                format = TimestampFormat.detect(text);
                if (format == null && strict) {
                    return null;
                }
                if (format != null && !strict) {
                    return format;
                }
            } else if (format.parse(text) == null) {
                return null;
            }
        }
        return format;
    }

    private static Object convert(Object cell, ColumnType type, TimestampFormat format) {
        if (cell == null) {
            return null;
        }
        return switch (type) {
            case LONG -> cell instanceof Long l ? l : parseLong(cell.toString());
            case DOUBLE -> cell instanceof Number n ? n.doubleValue() : parseDouble(cell.toString());
            case BOOLEAN -> cell instanceof Boolean b ? b : parseBoolean(cell.toString());
            case TIMESTAMP -> format.parse(cell.toString());
            case STRING -> cell.toString();
        };
    }

    static Long parseLong(String text) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Double parseDouble(String text) {
        String trimmed = text.trim();
        if (trimmed.equalsIgnoreCase("nan")) {
            return null;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Boolean parseBoolean(String text) {
        String lower = text.trim().toLowerCase(Locale.ROOT);
        if (lower.equals("true")) {
            return Boolean.TRUE;
        }
        if (lower.equals("false")) {
            return Boolean.FALSE;
        }
        return null;
    }
}
