package com.fintech.gaps.storage;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * On-disk table formats, keyed by file extension.
 */
public enum TableFormat {

    PARQUET("parquet"),
    CSV("csv"),
    JSON("json");

    private final String extension;

    TableFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /** Format for a file, by its lower-cased extension. */
    public static Optional<TableFormat> fromPath(Path path) {
        String ext = extensionOf(path);
        for (TableFormat format : values()) {
            if (format.extension.equals(ext)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /** Lower-cased extension without the dot, or an empty string. */
    public static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /** File name without its extension. */
    public static String stemOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }
}
