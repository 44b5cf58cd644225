package com.quorum.migration.error;

/** Thrown when an applied script was edited after it ran. */
public class ChecksumMismatchException extends MigrationException {

    private final int version;
    private final String appliedChecksum;
    private final String currentChecksum;

    public ChecksumMismatchException(int version, String appliedChecksum, String currentChecksum) {
        super("Migration %d changed after it was applied: recorded checksum %s, current checksum %s"
                .formatted(version, appliedChecksum, currentChecksum));
        this.version = version;
        this.appliedChecksum = appliedChecksum;
        this.currentChecksum = currentChecksum;
    }

    public int version() {
        return version;
    }

    public String appliedChecksum() {
        return appliedChecksum;
    }

    public String currentChecksum() {
        return currentChecksum;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.CHECKSUM_MISMATCH;
    }
}
