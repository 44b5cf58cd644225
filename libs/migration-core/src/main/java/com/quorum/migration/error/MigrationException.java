package com.quorum.migration.error;

/**
 * Base type of every failure raised by the migration engine and its collaborators.
 *
 * <p>Unchecked: a migration failure is fatal to the run and is meant to abort application
 * startup. Callers that need to react to a specific condition switch on {@link #kind()}.
 */
public abstract class MigrationException extends RuntimeException {

    protected MigrationException(String message) {
        super(message);
    }

    protected MigrationException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Returns the failure classification. */
    public abstract FailureKind kind();
}
