package com.fintech.gaps.storage;

import com.fintech.gaps.domain.BackupRecord;
import com.fintech.gaps.domain.GapRepairException;
import com.fintech.gaps.domain.RepairErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Byte-for-byte snapshots of data files, taken before they are overwritten.
 *
 * <p>Layout: {@code <dir>/backups/<stem>_backup_<yyyyMMdd_HHmmss>.<ext>}. Backups
 * are never overwritten and never deleted here; a second backup of the same file
 * within one second fails and the caller decides whether to retry.
 */
public class BackupStore {

    private static final Logger log = LoggerFactory.getLogger(BackupStore.class);

    public static final String DEFAULT_DIRECTORY = "backups";

    private static final DateTimeFormatter STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final String directoryName;

    public BackupStore(Clock clock) {
        this(clock, DEFAULT_DIRECTORY);
    }

    public BackupStore(Clock clock, String directoryName) {
        this.clock = clock;
        this.directoryName = directoryName;
    }

    /**
     * Copies a file into the sibling backup directory.
     *
     * @throws GapRepairException with {@link RepairErrorType#BACKUP_FAILURE} if the copy fails
     *         or a backup with the same name already exists
     */
    public BackupRecord backup(Path path) {
        Instant now = clock.instant();
        Path target = backupPathFor(path, now);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(path, target, StandardCopyOption.COPY_ATTRIBUTES);
            log.info("Backup created: {} -> {}", path.getFileName(), target);
            return new BackupRecord(path, target, now);
        } catch (FileAlreadyExistsException e) {
            throw new GapRepairException(RepairErrorType.BACKUP_FAILURE,
                "Backup already exists: " + target, e);
        } catch (IOException e) {
            throw new GapRepairException(RepairErrorType.BACKUP_FAILURE,
                "Failed to back up " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Copies a backup back over its original path. The backup is kept.
     *
     * @return true if the original was restored
     */
    public boolean restore(BackupRecord record) {
        try {
            Files.copy(record.backupPath(), record.originalPath(),
                StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            log.info("Restored {} from {}", record.originalPath().getFileName(), record.backupPath());
            return true;
        } catch (IOException e) {
            log.error("Failed to restore {} from {}: {}",
                     record.originalPath(), record.backupPath(), e.getMessage());
            return false;
        }
    }

    /** Where a backup of {@code path} taken at {@code at} is stored. */
    public Path backupPathFor(Path path, Instant at) {
        Path absolute = path.toAbsolutePath();
        String fileName = absolute.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String suffix = dot <= 0 ? "" : fileName.substring(dot);
        String name = TableFormat.stemOf(absolute) + "_backup_" + STAMP.format(at) + suffix;
        return absolute.resolveSibling(directoryName).resolve(name);
    }
}
