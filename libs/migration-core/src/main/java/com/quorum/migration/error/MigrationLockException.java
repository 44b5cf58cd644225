package com.quorum.migration.error;

/** Thrown when the migration lock cannot be obtained, or is lost while a run holds it. */
public class MigrationLockException extends MigrationException {

    public MigrationLockException(String message) {
        super(message);
    }

    public MigrationLockException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.LOCK_UNAVAILABLE;
    }
}
