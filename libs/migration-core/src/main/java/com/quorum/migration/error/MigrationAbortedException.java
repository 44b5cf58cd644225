package com.quorum.migration.error;

/** Thrown when a run is cancelled between two scripts. */
public class MigrationAbortedException extends MigrationException {

    public MigrationAbortedException(String reason) {
        super(reason);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.ABORTED;
    }
}
