package com.fintech.gaps.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.gaps.TestTables;
import com.fintech.gaps.domain.ColumnType;
import com.fintech.gaps.domain.TimeSeriesTable;
import com.fintech.gaps.domain.TimestampFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static com.fintech.gaps.TestTables.HOUR;
import static com.fintech.gaps.TestTables.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonTableCodec}.
 *
 * Test Strategy:
 * - Records layout: an array of row objects
 * - Columns layout: column name to row label to value, labels becoming an index
 * - Layout preserved across a write
 */
@DisplayName("JsonTableCodec Tests")
class JsonTableCodecTest {

    @TempDir
    Path tempDir;

    private JsonTableCodec codec;

    @BeforeEach
    void setUp() {
        codec = new JsonTableCodec(new ObjectMapper());
    }

    @Test
    @DisplayName("Should read the records layout with typed columns")
    void testReadRecords() throws IOException {
        Path file = write("records.json", """
            [
              {"timestamp": "2024-01-01T00:00:00Z", "price": 1.5, "volume": 10, "ok": true},
              {"timestamp": "2024-01-01T01:00:00Z", "price": null, "volume": 20},
              {"timestamp": "2024-01-01T02:00:00Z", "price": 2.5, "volume": 30, "ok": false}
            ]
            """);

        TimeSeriesTable table = codec.read(file);

        assertThat(table.attribute(JsonTableCodec.ATTR_LAYOUT)).isEqualTo(JsonTableCodec.LAYOUT_RECORDS);
        assertThat(table.hasTimestampIndex()).isFalse();
        assertThat(table.column("timestamp").type()).isEqualTo(ColumnType.TIMESTAMP);
        assertThat(table.column("timestamp").values()).containsExactly(T0, T0 + HOUR, T0 + 2 * HOUR);
        assertThat(table.column("price").values()).containsExactly(1.5, null, 2.5);
        assertThat(table.column("volume").type()).isEqualTo(ColumnType.LONG);
        assertThat(table.column("ok").values()).containsExactly(true, null, false);
    }

    @Test
    @DisplayName("Epoch millisecond row labels should become a timestamp index")
    void testReadColumnsWithEpochLabels() throws IOException {
        Path file = write("columns.json",
            "{\"price\": {\"" + T0 + "\": 1.0, \"" + (T0 + HOUR) + "\": 2.0}}");

        TimeSeriesTable table = codec.read(file);

        assertThat(table.attribute(JsonTableCodec.ATTR_LAYOUT)).isEqualTo(JsonTableCodec.LAYOUT_COLUMNS);
        assertThat(table.hasTimestampIndex()).isTrue();
        assertThat(table.index().timestampFormat()).isEqualTo(TimestampFormat.EPOCH_MILLIS);
        assertThat(table.index().values()).containsExactly(T0, T0 + HOUR);
        assertThat(table.column("price").values()).containsExactly(1.0, 2.0);
    }

    @Test
    @DisplayName("Textual timestamp row labels should become a timestamp index")
    void testReadColumnsWithTextLabels() throws IOException {
        Path file = write("columns.json", """
            {"price": {"2024-01-01T00:00:00": 1.0, "2024-01-01T01:00:00": 2.0}}
            """);

        TimeSeriesTable table = codec.read(file);

        assertThat(table.index().values()).containsExactly(T0, T0 + HOUR);
        assertThat(table.index().timestampFormat()).isEqualTo(TimestampFormat.ISO_LOCAL_DATE_TIME);
    }

    @Test
    @DisplayName("Row-number labels should not become an index")
    void testReadColumnsWithRowNumbers() throws IOException {
        Path file = write("columns.json", """
            {"timestamp": {"0": "2024-01-01T00:00:00Z", "1": "2024-01-01T01:00:00Z"}, "price": {"0": 1.0}}
            """);

        TimeSeriesTable table = codec.read(file);

        assertThat(table.hasTimestampIndex()).isFalse();
        assertThat(table.column("price").values()).containsExactly(1.0, null);
    }

    @Test
    @DisplayName("Columns layout with an index should survive a write")
    void testColumnsRoundTrip() throws IOException {
        TimeSeriesTable original = codec.read(write("columns.json",
            "{\"price\": {\"" + T0 + "\": 1.0, \"" + (T0 + 2 * HOUR) + "\": 3.0}}"));
        Path out = tempDir.resolve("out.json");

        codec.write(original, out);
        TimeSeriesTable reread = codec.read(out);

        assertThat(reread.attribute(JsonTableCodec.ATTR_LAYOUT)).isEqualTo(JsonTableCodec.LAYOUT_COLUMNS);
        assertThat(reread.index().values()).isEqualTo(original.index().values());
        assertThat(reread.column("price").values()).isEqualTo(original.column("price").values());
    }

    @Test
    @DisplayName("Records layout should be written back as records")
    void testRecordsRoundTrip() throws IOException {
        TimeSeriesTable table = TestTables.hourly(4, Set.of(1)).withAttribute(
            JsonTableCodec.ATTR_LAYOUT, JsonTableCodec.LAYOUT_RECORDS);
        Path out = tempDir.resolve("out.json");

        codec.write(table, out);
        TimeSeriesTable reread = codec.read(out);

        assertThat(Files.readString(out)).startsWith("[");
        assertThat(reread.column("timestamp").values()).isEqualTo(table.column("timestamp").values());
        assertThat(reread.column("symbol").values()).isEqualTo(List.of("BTC", "BTC", "BTC"));
    }

    @Test
    @DisplayName("Scalar documents should be rejected")
    void testUnsupportedLayout() throws IOException {
        Path file = write("scalar.json", "42");

        assertThatThrownBy(() -> codec.read(file)).isInstanceOf(IOException.class);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
