package com.fintech.gaps.domain;

/**
 * Failure categories surfaced in a {@link RepairResult}.
 */
public enum RepairErrorType {

    /** File extension is not parquet, csv or json. */
    UNSUPPORTED_FORMAT,

    /** File could not be read or parsed. */
    LOAD_FAILURE,

    /** Neither a timestamp column nor a datetime index was found. */
    NO_TIMESTAMP_FIELD,

    /** A grid strategy was asked for but some timestamps cannot be parsed. */
    MALFORMED_TIMESTAMPS,

    /** Strategy id is not recognised. */
    UNKNOWN_STRATEGY,

    /** Memory headroom could not be secured even after reclamation. */
    INSUFFICIENT_MEMORY,

    /** A single field could not be repaired; recorded as a diagnostic, never fatal. */
    FIELD_REPAIR_FAILURE,

    /** Backup could not be created; fatal only when backups are required. */
    BACKUP_FAILURE,

    /** Repaired data could not be persisted; the original file is untouched. */
    WRITE_FAILURE,

    /** Anything not classified above. */
    INTERNAL_ERROR
}
