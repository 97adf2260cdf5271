package com.fintech.gaps.storage;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fintech.gaps.domain.Column;
import com.fintech.gaps.domain.TimeSeriesTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Comma-separated files with a header row, read and written through Jackson's CSV module.
 *
 * <p>Empty cells and {@code NaN} are missing values. Column types are inferred
 * from the cells; see {@link ColumnInference}.
 */
public class CsvTableCodec implements TableCodec {

    private static final Logger log = LoggerFactory.getLogger(CsvTableCodec.class);

    private final CsvMapper mapper;

    public CsvTableCodec() {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    }

    @Override
    public TableFormat format() {
        return TableFormat.CSV;
    }

    @Override
    public TimeSeriesTable read(Path path) throws IOException {
        List<String> header = null;
        List<List<Object>> cells = new ArrayList<>();

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<String[]> rows = mapper.readerFor(String[].class)
                 .with(CsvSchema.emptySchema())
                 .readValues(reader)) {
            int line = 0;
            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                line++;
                if (header == null) {
                    header = List.of(row);
                    header.forEach(h -> cells.add(new ArrayList<>()));
                    continue;
                }
                if (row.length == 1 && row[0].isEmpty()) {
                    continue;
                }
                if (row.length > header.size()) {
                    throw new IOException("Line " + line + " of " + path.getFileName() + " has "
                        + row.length + " cells but the header has " + header.size());
                }
                for (int c = 0; c < header.size(); c++) {
                    cells.get(c).add(c < row.length ? cellValue(row[c]) : null);
                }
            }
        }

        if (header == null) {
            return TimeSeriesTable.empty();
        }
        List<Column> columns = new ArrayList<>(header.size());
        for (int c = 0; c < header.size(); c++) {
            columns.add(ColumnInference.infer(header.get(c), cells.get(c), true));
        }
        TimeSeriesTable table = TimeSeriesTable.of(columns);
        log.debug("Read CSV: file={}, rows={}, columns={}", path.getFileName(), table.rowCount(), columns);
        return table;
    }

    @Override
    public void write(TimeSeriesTable source, Path path) throws IOException {
        // CSV has no index; an index is written as the leading column
        TimeSeriesTable table = source.hasTimestampIndex() ? source.materializeIndex() : source;
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             SequenceWriter rows = mapper.writerFor(String[].class)
                 .with(CsvSchema.emptySchema())
                 .writeValues(writer)) {
            rows.write(table.columnNames().toArray(new String[0]));
            String[] row = new String[table.columnCount()];
            for (int r = 0; r < table.rowCount(); r++) {
                for (int c = 0; c < row.length; c++) {
                    row[c] = CellText.render(table.column(c), r);
                }
                rows.write(row);
            }
        }
        log.debug("Wrote CSV: file={}, rows={}", path.getFileName(), table.rowCount());
    }

    private static Object cellValue(String raw) {
        if (raw == null || raw.isEmpty() || raw.equalsIgnoreCase("nan")) {
            return null;
        }
        return raw;
    }
}
