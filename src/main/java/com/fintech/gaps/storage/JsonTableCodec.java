package com.fintech.gaps.storage;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.gaps.domain.Column;
import com.fintech.gaps.domain.ColumnType;
import com.fintech.gaps.domain.TimeSeriesTable;
import com.fintech.gaps.domain.TimestampFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON tables in either of two layouts.
 *
 * <ul>
 *   <li>{@code records}: {@code [{"col": v, ...}, ...]}, one object per row</li>
 *   <li>{@code columns}: {@code {"col": {"<key>": v, ...}, ...}}, one object per
 *       column keyed by row label. When every label is a timestamp the labels
 *       become the table's timestamp index.</li>
 * </ul>
 *
 * <p>The layout read is kept in {@link #ATTR_LAYOUT} and used again on write.
 */
public class JsonTableCodec implements TableCodec {

    private static final Logger log = LoggerFactory.getLogger(JsonTableCodec.class);

    public static final String ATTR_LAYOUT = "json.layout";
    public static final String LAYOUT_RECORDS = "records";
    public static final String LAYOUT_COLUMNS = "columns";

    /** Name given to an index read from row labels. */
    public static final String INDEX_NAME = "index";

    // integer labels at or above this are epoch millis (after March 1973), below it row numbers
    static final long EPOCH_MILLIS_LABEL_FLOOR = 100_000_000_000L;

    private final ObjectMapper objectMapper;

    public JsonTableCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public TableFormat format() {
        return TableFormat.JSON;
    }

    @Override
    public TimeSeriesTable read(Path path) throws IOException {
        JsonNode root = objectMapper.readTree(path.toFile());
        TimeSeriesTable table;
        if (root == null || root.isMissingNode() || root.isNull()) {
            table = TimeSeriesTable.empty();
        } else if (root.isArray()) {
            table = readRecords(root);
        } else if (root.isObject()) {
            table = readColumns(root);
        } else {
            throw new IOException("Unsupported JSON layout in " + path.getFileName()
                + ": expected an array of records or an object of columns");
        }
        log.debug("Read JSON: file={}, layout={}, rows={}, index={}",
                 path.getFileName(), table.attribute(ATTR_LAYOUT), table.rowCount(), table.hasTimestampIndex());
        return table;
    }

    private TimeSeriesTable readRecords(JsonNode root) throws IOException {
        Map<String, List<Object>> cells = new LinkedHashMap<>();
        int row = 0;
        for (JsonNode record : root) {
            if (!record.isObject()) {
                throw new IOException("Record " + row + " is not a JSON object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                List<Object> column = cells.computeIfAbsent(field.getKey(), k -> new ArrayList<>());
                // columns first seen in a later record are null for earlier rows
                while (column.size() < row) {
                    column.add(null);
                }
                column.add(scalar(field.getValue()));
            }
            row++;
            for (List<Object> column : cells.values()) {
                while (column.size() < row) {
                    column.add(null);
                }
            }
        }

        List<Column> columns = new ArrayList<>(cells.size());
        cells.forEach((name, values) -> columns.add(ColumnInference.infer(name, values, false)));
        return TimeSeriesTable.of(columns, null, Map.of(ATTR_LAYOUT, LAYOUT_RECORDS));
    }

    private TimeSeriesTable readColumns(JsonNode root) throws IOException {
        Set<String> labels = new LinkedHashSet<>();
        Iterator<Map.Entry<String, JsonNode>> columnsIt = root.fields();
        while (columnsIt.hasNext()) {
            Map.Entry<String, JsonNode> column = columnsIt.next();
            if (!column.getValue().isObject()) {
                throw new IOException("Column '" + column.getKey() + "' is not a JSON object of row labels");
            }
            column.getValue().fieldNames().forEachRemaining(labels::add);
        }

        List<Column> columns = new ArrayList<>();
        root.fields().forEachRemaining(entry -> {
            List<Object> values = new ArrayList<>(labels.size());
            for (String label : labels) {
                values.add(scalar(entry.getValue().get(label)));
            }
            columns.add(ColumnInference.infer(entry.getKey(), values, false));
        });

        Column index = labelIndex(new ArrayList<>(labels));
        return TimeSeriesTable.of(columns, index, Map.of(ATTR_LAYOUT, LAYOUT_COLUMNS));
    }

    /** Timestamp index from row labels, or null when the labels are not all timestamps. */
    static Column labelIndex(List<String> labels) {
        if (labels.isEmpty()) {
            return null;
        }
        TimestampFormat format = epochMillisLabels(labels)
            ? TimestampFormat.EPOCH_MILLIS
            : ColumnInference.commonFormat(new ArrayList<>(labels), true);
        if (format == null) {
            return null;
        }
        Column index = new Column(INDEX_NAME, ColumnType.TIMESTAMP, format);
        labels.forEach(label -> index.add(format.parse(label)));
        return index;
    }

    private static boolean epochMillisLabels(List<String> labels) {
        for (String label : labels) {
            Long value = ColumnInference.parseLong(label);
            if (value == null || value < EPOCH_MILLIS_LABEL_FLOOR) {
                return false;
            }
        }
        return true;
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }

    @Override
    public void write(TimeSeriesTable table, Path path) throws IOException {
        String layout = table.attribute(ATTR_LAYOUT);
        if (layout == null) {
            layout = table.hasTimestampIndex() ? LAYOUT_COLUMNS : LAYOUT_RECORDS;
        }
        try (OutputStream out = Files.newOutputStream(path);
             JsonGenerator generator = objectMapper.getFactory().createGenerator(out)) {
            if (LAYOUT_COLUMNS.equals(layout)) {
                writeColumns(table, generator);
            } else {
                writeRecords(table.hasTimestampIndex() ? table.materializeIndex() : table, generator);
            }
        }
        log.debug("Wrote JSON: file={}, layout={}, rows={}", path.getFileName(), layout, table.rowCount());
    }

    private void writeRecords(TimeSeriesTable table, JsonGenerator generator) throws IOException {
        generator.writeStartArray();
        for (int r = 0; r < table.rowCount(); r++) {
            generator.writeStartObject();
            for (Column column : table.columns()) {
                generator.writeFieldName(column.name());
                writeCell(column, r, generator);
            }
            generator.writeEndObject();
        }
        generator.writeEndArray();
    }

    private void writeColumns(TimeSeriesTable table, JsonGenerator generator) throws IOException {
        String[] labels = new String[table.rowCount()];
        for (int r = 0; r < labels.length; r++) {
            labels[r] = table.hasTimestampIndex() ? CellText.render(table.index(), r) : Integer.toString(r);
        }
        generator.writeStartObject();
        for (Column column : table.columns()) {
            generator.writeObjectFieldStart(column.name());
            for (int r = 0; r < labels.length; r++) {
                generator.writeFieldName(labels[r]);
                writeCell(column, r, generator);
            }
            generator.writeEndObject();
        }
        generator.writeEndObject();
    }

    private static void writeCell(Column column, int row, JsonGenerator generator) throws IOException {
        Object value = column.get(row);
        if (value == null) {
            generator.writeNull();
            return;
        }
        switch (column.type()) {
            case LONG -> generator.writeNumber((Long) value);
            case DOUBLE -> generator.writeNumber((Double) value);
            case BOOLEAN -> generator.writeBoolean((Boolean) value);
            case TIMESTAMP -> {
                if (CellText.timestampFormat(column) == TimestampFormat.EPOCH_MILLIS) {
                    generator.writeNumber((Long) value);
                } else {
                    generator.writeString(CellText.render(column, row));
                }
            }
            case STRING -> generator.writeString(value.toString());
        }
    }
}
