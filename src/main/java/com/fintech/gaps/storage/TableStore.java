package com.fintech.gaps.storage;

import com.fintech.gaps.domain.GapRepairException;
import com.fintech.gaps.domain.RepairErrorType;
import com.fintech.gaps.domain.TimeSeriesTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and saves tables, picking the codec from the file extension.
 *
 * <p>Saves never leave a partial file at the target path: the table is written
 * to a temporary sibling file that is then moved over the target.
 */
public class TableStore {

    private static final Logger log = LoggerFactory.getLogger(TableStore.class);

    private final Map<TableFormat, TableCodec> codecs = new EnumMap<>(TableFormat.class);

    public TableStore(List<TableCodec> codecs) {
        codecs.forEach(codec -> this.codecs.put(codec.format(), codec));
    }

    /** True if the file has an extension this store can read and write. */
    public boolean supports(Path path) {
        return TableFormat.fromPath(path).map(codecs::containsKey).orElse(false);
    }

    /**
     * @throws GapRepairException {@link RepairErrorType#UNSUPPORTED_FORMAT} for unknown extensions,
     *         {@link RepairErrorType#LOAD_FAILURE} when the file cannot be read
     */
    public TimeSeriesTable load(Path path) {
        TableCodec codec = codecFor(path);
        if (!Files.isRegularFile(path)) {
            throw new GapRepairException(RepairErrorType.LOAD_FAILURE, "File not found: " + path);
        }
        try {
            TimeSeriesTable table = codec.read(path);
            log.debug("Loaded {}: rows={}, columns={}", path, table.rowCount(), table.columnCount());
            return table;
        } catch (IOException | RuntimeException e) {
            throw new GapRepairException(RepairErrorType.LOAD_FAILURE,
                "Failed to load " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes a table over {@code path} in the format its extension names.
     *
     * @throws GapRepairException {@link RepairErrorType#UNSUPPORTED_FORMAT} for unknown extensions,
     *         {@link RepairErrorType#WRITE_FAILURE} when the file cannot be written; the
     *         original file is then unchanged
     */
    public void save(TimeSeriesTable table, Path path) {
        TableCodec codec = codecFor(path);
        Path temp = temporarySibling(path);
        try {
            codec.write(table, temp);
            moveOver(temp, path);
            log.debug("Saved {}: rows={}", path, table.rowCount());
        } catch (IOException | RuntimeException e) {
            discard(temp);
            throw new GapRepairException(RepairErrorType.WRITE_FAILURE,
                "Failed to write " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private TableCodec codecFor(Path path) {
        TableCodec codec = TableFormat.fromPath(path).map(codecs::get).orElse(null);
        if (codec == null) {
            throw new GapRepairException(RepairErrorType.UNSUPPORTED_FORMAT,
                "Unsupported file format: '." + TableFormat.extensionOf(path)
                    + "'. Supported formats: parquet, csv, json");
        }
        return codec;
    }

    static Path temporarySibling(Path path) {
        String name = path.getFileName().toString();
        return path.resolveSibling("." + name + ".tmp-" + System.nanoTime());
    }

    private static void moveOver(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
        }
    }
}
