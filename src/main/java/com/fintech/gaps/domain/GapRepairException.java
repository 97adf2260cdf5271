package com.fintech.gaps.domain;

/**
 * Fatal, per-call failure raised by engine components. The orchestrator converts
 * it into a failed {@link RepairResult} at the file boundary.
 */
public class GapRepairException extends RuntimeException {

    private final RepairErrorType errorType;

    public GapRepairException(RepairErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public GapRepairException(RepairErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public RepairErrorType getErrorType() {
        return errorType;
    }
}
