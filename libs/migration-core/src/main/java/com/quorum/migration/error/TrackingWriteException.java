package com.quorum.migration.error;

/**
 * Thrown when a script's schema change reached agreement but its tracking row could not be
 * written.
 *
 * <p>The cluster now carries the change while the tracking table says otherwise. Insert the row
 * by hand after checking the schema; the engine never retries the write.
 */
public class TrackingWriteException extends MigrationException {

    private final int version;

    public TrackingWriteException(int version, Throwable cause) {
        super("Migration %d applied but could not be recorded in the tracking table: %s"
                        .formatted(version, cause.getMessage()),
                cause);
        this.version = version;
    }

    public int version() {
        return version;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.TRACKING_WRITE_FAILED;
    }
}
