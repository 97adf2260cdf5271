package com.fintech.gaps.storage;

import com.fintech.gaps.domain.TimeSeriesTable;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads and writes tables in one on-disk format.
 *
 * <p>Implementations keep the column set, column order and column types of a
 * file they read, and use {@link TimeSeriesTable#attributes()} to carry layout
 * details from {@link #read(Path)} to {@link #write(TimeSeriesTable, Path)} so a
 * file written back looks like the file that was read.
 */
public interface TableCodec {

    TableFormat format();

    /**
     * Loads a whole file into memory.
     *
     * @param path file to read
     * @return typed table
     * @throws IOException if the file cannot be read or is not valid in this format
     */
    TimeSeriesTable read(Path path) throws IOException;

    /**
     * Writes a table, replacing any existing file at {@code path}.
     *
     * @param table table to write
     * @param path target file
     * @throws IOException if the file cannot be written
     */
    void write(TimeSeriesTable table, Path path) throws IOException;
}
