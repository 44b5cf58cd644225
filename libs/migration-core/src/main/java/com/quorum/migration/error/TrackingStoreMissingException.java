package com.quorum.migration.error;

/**
 * Thrown when the tracking table (or its keyspace) does not exist.
 *
 * <p>The table is created by the bootstrap script with version {@code 1}. Registering that script
 * first, or creating the table by hand, resolves the condition.
 */
public class TrackingStoreMissingException extends MigrationException {

    private final String keyspace;
    private final String table;

    public TrackingStoreMissingException(String keyspace, String table, Throwable cause) {
        super("Tracking table %s.%s does not exist; register the bootstrap script (version 1) or create it manually"
                        .formatted(keyspace, table),
                cause);
        this.keyspace = keyspace;
        this.table = table;
    }

    public String keyspace() {
        return keyspace;
    }

    public String table() {
        return table;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.TRACKING_STORE_MISSING;
    }
}
