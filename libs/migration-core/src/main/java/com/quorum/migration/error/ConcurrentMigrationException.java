package com.quorum.migration.error;

/** Thrown when another instance recorded a version this instance has just applied. */
public class ConcurrentMigrationException extends MigrationException {

    private final int version;

    public ConcurrentMigrationException(int version) {
        super("Migration %d was recorded by another instance while this instance applied it"
                .formatted(version));
        this.version = version;
    }

    public int version() {
        return version;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.CONCURRENT_MIGRATION;
    }
}
