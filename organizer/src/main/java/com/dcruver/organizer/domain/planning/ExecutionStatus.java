package com.dcruver.organizer.domain.planning;

public enum ExecutionStatus {
    COMPLETED,
    FAILED,
    SKIPPED
}
