package com.fintech.gaps.storage;

import com.fintech.gaps.domain.Column;
import com.fintech.gaps.domain.ColumnType;
import com.fintech.gaps.domain.TimeSeriesTable;
import com.fintech.gaps.domain.TimestampFormat;
import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.LocalInputFile;
import org.apache.parquet.io.LocalOutputFile;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.RecordReader;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.TimeUnit;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Type;
import org.apache.parquet.schema.Types;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flat Parquet files through parquet-hadoop's example {@link Group} model.
 *
 * <p>Type mapping:
 * <ul>
 *   <li>INT64/INT32 with a timestamp or date annotation: TIMESTAMP, held as epoch millis</li>
 *   <li>other INT64/INT32: LONG</li>
 *   <li>DOUBLE/FLOAT: DOUBLE</li>
 *   <li>BOOLEAN: BOOLEAN</li>
 *   <li>BINARY: STRING (UTF-8)</li>
 * </ul>
 * The physical type and timestamp unit of each column are kept in table attributes
 * so the file is written back with the schema it was read with.
 *
 * <p>A column named {@value #PANDAS_INDEX} is the index pandas writes for an
 * unnamed index; it is loaded as the table's timestamp index.
 */
public class ParquetTableCodec implements TableCodec {

    private static final Logger log = LoggerFactory.getLogger(ParquetTableCodec.class);

    public static final String PANDAS_INDEX = "__index_level_0__";

    static final String ATTR_PHYSICAL = "parquet.physical.";
    static final String ATTR_UNIT = "parquet.unit.";

    private final CompressionCodecName compression;

    public ParquetTableCodec() {
        this(CompressionCodecName.UNCOMPRESSED);
    }

    public ParquetTableCodec(CompressionCodecName compression) {
        this.compression = compression;
    }

    @Override
    public TableFormat format() {
        return TableFormat.PARQUET;
    }

    @Override
    public TimeSeriesTable read(Path path) throws IOException {
        try (ParquetFileReader reader = ParquetFileReader.open(new LocalInputFile(path))) {
            MessageType schema = reader.getFooter().getFileMetaData().getSchema();
            Map<String, String> attributes = new LinkedHashMap<>();
            List<Column> columns = new ArrayList<>(schema.getFieldCount());
            for (Type field : schema.getFields()) {
                columns.add(newColumn(field, attributes));
            }

            MessageColumnIO columnIO = new ColumnIOFactory().getColumnIO(schema);
            PageReadStore rowGroup;
            while ((rowGroup = reader.readNextRowGroup()) != null) {
                RecordReader<Group> records = columnIO.getRecordReader(rowGroup, new GroupRecordConverter(schema));
                for (long r = 0; r < rowGroup.getRowCount(); r++) {
                    Group group = records.read();
                    for (int c = 0; c < columns.size(); c++) {
                        columns.get(c).add(cell(group, c, schema.getType(c).asPrimitiveType()));
                    }
                }
            }

            Column index = null;
            List<Column> data = new ArrayList<>(columns.size());
            for (Column column : columns) {
                if (column.name().equals(PANDAS_INDEX) && column.type() == ColumnType.TIMESTAMP) {
                    index = column;
                } else {
                    data.add(column);
                }
            }
            TimeSeriesTable table = TimeSeriesTable.of(data, index, attributes);
            log.debug("Read Parquet: file={}, rows={}, columns={}, index={}",
                     path.getFileName(), table.rowCount(), data, index != null);
            return table;
        }
    }

    private Column newColumn(Type field, Map<String, String> attributes) throws IOException {
        if (!field.isPrimitive() || field.isRepetition(Type.Repetition.REPEATED)) {
            throw new IOException("Unsupported nested or repeated Parquet column: " + field.getName());
        }
        PrimitiveType primitive = field.asPrimitiveType();
        PrimitiveTypeName physical = primitive.getPrimitiveTypeName();
        LogicalTypeAnnotation logical = primitive.getLogicalTypeAnnotation();
        String name = field.getName();
        attributes.put(ATTR_PHYSICAL + name, physical.name());

        if (logical instanceof LogicalTypeAnnotation.TimestampLogicalTypeAnnotation timestamp) {
            attributes.put(ATTR_UNIT + name, timestamp.getUnit().name());
            return new Column(name, ColumnType.TIMESTAMP, TimestampFormat.ISO_LOCAL_DATE_TIME);
        }
        if (logical instanceof LogicalTypeAnnotation.DateLogicalTypeAnnotation) {
            attributes.put(ATTR_UNIT + name, "DAYS");
            return new Column(name, ColumnType.TIMESTAMP, TimestampFormat.ISO_LOCAL_DATE);
        }
        return switch (physical) {
            case INT64, INT32 -> new Column(name, ColumnType.LONG);
            case DOUBLE, FLOAT -> new Column(name, ColumnType.DOUBLE);
            case BOOLEAN -> new Column(name, ColumnType.BOOLEAN);
            case BINARY -> new Column(name, ColumnType.STRING);
            default -> throw new IOException("Unsupported Parquet type " + physical + " for column " + name);
        };
    }

    private static Object cell(Group group, int field, PrimitiveType type) {
        if (group.getFieldRepetitionCount(field) == 0) {
            return null;
        }
        LogicalTypeAnnotation logical = type.getLogicalTypeAnnotation();
        return switch (type.getPrimitiveTypeName()) {
            case INT64 -> {
                long raw = group.getLong(field, 0);
                yield logical instanceof LogicalTypeAnnotation.TimestampLogicalTypeAnnotation ts
                    ? toMillis(raw, ts.getUnit())
                    : raw;
            }
            case INT32 -> {
                long raw = group.getInteger(field, 0);
                yield logical instanceof LogicalTypeAnnotation.DateLogicalTypeAnnotation
                    ? raw * 86_400_000L
                    : raw;
            }
            case DOUBLE -> group.getDouble(field, 0);
            case FLOAT -> (double) group.getFloat(field, 0);
            case BOOLEAN -> group.getBoolean(field, 0);
            case BINARY -> group.getBinary(field, 0).toStringUsingUTF8();
            default -> throw new IllegalStateException("Unsupported Parquet type " + type);
        };
    }

    static long toMillis(long raw, TimeUnit unit) {
        return switch (unit) {
            case MILLIS -> raw;
            case MICROS -> Math.floorDiv(raw, 1_000L);
            case NANOS -> Math.floorDiv(raw, 1_000_000L);
        };
    }

    static long fromMillis(long millis, TimeUnit unit) {
        return switch (unit) {
            case MILLIS -> millis;
            case MICROS -> millis * 1_000L;
            case NANOS -> millis * 1_000_000L;
        };
    }

    @Override
    public void write(TimeSeriesTable table, Path path) throws IOException {
        List<Column> columns = new ArrayList<>(table.columns());
        if (table.hasTimestampIndex()) {
            columns.add(table.index().renamed(PANDAS_INDEX));
        }
        MessageType schema = schemaFor(columns, table);
        SimpleGroupFactory groups = new SimpleGroupFactory(schema);

        try (ParquetWriter<Group> writer = ExampleParquetWriter.builder(new LocalOutputFile(path))
                .withType(schema)
                .withCompressionCodec(compression)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .build()) {
            for (int r = 0; r < table.rowCount(); r++) {
                Group group = groups.newGroup();
                for (int c = 0; c < columns.size(); c++) {
                    appendCell(group, columns.get(c), r, schema.getType(c).asPrimitiveType());
                }
                writer.write(group);
            }
        }
        log.debug("Wrote Parquet: file={}, rows={}, compression={}", path.getFileName(), table.rowCount(), compression);
    }

    private static MessageType schemaFor(List<Column> columns, TimeSeriesTable table) {
        Types.MessageTypeBuilder builder = Types.buildMessage();
        for (Column column : columns) {
            String physical = table.attribute(ATTR_PHYSICAL + column.name());
            String unit = table.attribute(ATTR_UNIT + column.name());
            switch (column.type()) {
                case TIMESTAMP -> {
                    if ("DAYS".equals(unit)) {
                        builder.optional(PrimitiveTypeName.INT32)
                            .as(LogicalTypeAnnotation.dateType()).named(column.name());
                    } else {
                        TimeUnit timeUnit = unit != null ? TimeUnit.valueOf(unit) : TimeUnit.MILLIS;
                        builder.optional(PrimitiveTypeName.INT64)
                            .as(LogicalTypeAnnotation.timestampType(true, timeUnit)).named(column.name());
                    }
                }
                case LONG -> builder.optional(
                    "INT32".equals(physical) ? PrimitiveTypeName.INT32 : PrimitiveTypeName.INT64).named(column.name());
                case DOUBLE -> builder.optional(
                    "FLOAT".equals(physical) ? PrimitiveTypeName.FLOAT : PrimitiveTypeName.DOUBLE).named(column.name());
                case BOOLEAN -> builder.optional(PrimitiveTypeName.BOOLEAN).named(column.name());
                case STRING -> builder.optional(PrimitiveTypeName.BINARY)
                    .as(LogicalTypeAnnotation.stringType()).named(column.name());
            }
        }
        return builder.named("table");
    }

    private static void appendCell(Group group, Column column, int row, PrimitiveType type) {
        Object value = column.get(row);
        if (value == null) {
            return;
        }
        String name = column.name();
        LogicalTypeAnnotation logical = type.getLogicalTypeAnnotation();
        switch (type.getPrimitiveTypeName()) {
            case INT64 -> {
                long v = ((Number) value).longValue();
                group.append(name, logical instanceof LogicalTypeAnnotation.TimestampLogicalTypeAnnotation ts
                    ? fromMillis(v, ts.getUnit())
                    : v);
            }
            case INT32 -> {
                long v = ((Number) value).longValue();
                group.append(name, (int) (logical instanceof LogicalTypeAnnotation.DateLogicalTypeAnnotation
                    ? Math.floorDiv(v, 86_400_000L)
                    : v));
            }
            case DOUBLE -> group.append(name, ((Number) value).doubleValue());
            case FLOAT -> group.append(name, ((Number) value).floatValue());
            case BOOLEAN -> group.append(name, (Boolean) value);
            case BINARY -> group.append(name, value.toString());
            default -> throw new IllegalStateException("Unsupported Parquet type " + type);
        }
    }
}
