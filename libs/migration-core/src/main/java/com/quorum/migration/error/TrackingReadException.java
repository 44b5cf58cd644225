package com.quorum.migration.error;

/**
 * Thrown when the tracking table exists but reading it failed for a reason other than the
 * cluster being unreachable, typically a table whose columns differ from the expected layout.
 */
public class TrackingReadException extends MigrationException {

    private final String table;

    public TrackingReadException(String table, Throwable cause) {
        super("Could not read tracking table %s: %s".formatted(table, cause.getMessage()), cause);
        this.table = table;
    }

    /** Qualified name of the tracking table. */
    public String table() {
        return table;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.TRACKING_READ_FAILED;
    }
}
