package com.planner.exception;

/**
 * Exception thrown when an import payload is malformed.
 * The store is never touched when this is thrown.
 */
public class SnapshotFormatException extends PlannerException {

    public SnapshotFormatException(String message) {
        super(message);
    }

    public SnapshotFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
