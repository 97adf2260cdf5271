package com.fintech.gaps.domain;

import com.fintech.gaps.TestTables;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimeSeriesTable Tests")
class TimeSeriesTableTest {

    @Test
    @DisplayName("Should reject columns of unequal length")
    void testValidation() {
        Column a = new Column("a", ColumnType.LONG);
        Column b = new Column("b", ColumnType.LONG);
        a.add(1L);

        assertThatThrownBy(() -> TimeSeriesTable.of(List.of(a, b)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'b'");
    }

    @Test
    @DisplayName("Columns should reject values of the wrong type")
    void testColumnTypeCheck() {
        Column price = new Column("price", ColumnType.DOUBLE);

        assertThatThrownBy(() -> price.add("abc")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Materializing and restoring the index should round-trip")
    void testMaterializeIndex() {
        TimeSeriesTable indexed = TestTables.hourlyIndexed(5, Set.of());

        TimeSeriesTable flat = indexed.materializeIndex();
        TimeSeriesTable restored = flat.restoreIndex();

        assertThat(flat.hasTimestampIndex()).isFalse();
        assertThat(flat.columnNames()).containsExactly("index", "price", "volume", "symbol");
        assertThat(flat.materializedIndexName()).isEqualTo("index");
        assertThat(restored.hasTimestampIndex()).isTrue();
        assertThat(restored.index().values()).isEqualTo(indexed.index().values());
        assertThat(restored.columnNames()).containsExactly("price", "volume", "symbol");
        assertThat(restored.materializedIndexName()).isNull();
    }

    @Test
    @DisplayName("Reordering should return a copy and leave the source alone")
    void testReorder() {
        TimeSeriesTable table = TestTables.hourly(3);

        TimeSeriesTable reversed = table.reorder(new int[] {2, 1, 0});

        assertThat(reversed.column("price").values()).containsExactly(102.0, 101.0, 100.0);
        assertThat(table.column("price").values()).containsExactly(100.0, 101.0, 102.0);
    }

    @Test
    @DisplayName("Copies should be independent of the original")
    void testCopy() {
        TimeSeriesTable table = TestTables.hourly(3);

        TimeSeriesTable copy = table.copy();
        copy.column("price").set(0, null);

        assertThat(table.column("price").get(0)).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Slicing should take a half-open row range")
    void testSlice() {
        TimeSeriesTable slice = TestTables.hourly(10).slice(3, 6);

        assertThat(slice.rowCount()).isEqualTo(3);
        assertThat(slice.column("price").values()).containsExactly(103.0, 104.0, 105.0);
    }
}
