package com.fintech.gaps.domain;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A byte-for-byte snapshot of a dataset file taken before it was modified.
 * Backups are never deleted by the engine; retention is an external policy.
 *
 * @param originalPath file that was snapshotted
 * @param backupPath location of the snapshot
 * @param createdAt when the snapshot was taken
 */
public record BackupRecord(Path originalPath, Path backupPath, Instant createdAt) {
}
