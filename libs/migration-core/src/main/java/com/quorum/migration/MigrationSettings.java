package com.quorum.migration;

import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable settings for one migration run against one keyspace.
 *
 * <p>Optional values fall back to defaults in the compact constructor, so a record built with
 * nulls is always usable. Use {@link #builder(String)} rather than the canonical constructor.
 *
 * @param keyspace target keyspace, also home of the tracking and lock tables
 * @param trackingTable name of the table recording applied versions
 * @param lockTable name of the table holding the migration lease
 * @param replication CQL replication map used to create the keyspace during bootstrap, or null
 *     when the keyspace is managed outside the migrations
 * @param consistencyLevel consistency level for tracking reads and writes
 * @param agreementTimeout how long to wait for schema agreement after each statement
 * @param agreementPollInterval pause between two schema agreement checks
 * @param lockEnabled whether to serialize concurrent runs with the lease table
 * @param lockTimeout how long to wait for another instance to release the lease
 * @param lockTtl lifetime of a lease left behind by a crashed instance; the engine renews it
 *     before each script
 * @param lockPollInterval pause between two lease attempts
 * @param runTimeout overall budget for a run, checked between scripts; {@link Duration#ZERO}
 *     disables it
 * @param validateChecksums whether to fail when an applied script changed afterwards
 */
public record MigrationSettings(
        String keyspace,
        String trackingTable,
        String lockTable,
        String replication,
        String consistencyLevel,
        Duration agreementTimeout,
        Duration agreementPollInterval,
        boolean lockEnabled,
        Duration lockTimeout,
        Duration lockTtl,
        Duration lockPollInterval,
        Duration runTimeout,
        boolean validateChecksums) {

    /** Version reserved for the script that creates the tracking table. */
    public static final int BOOTSTRAP_VERSION = 1;

    public static final String DEFAULT_TRACKING_TABLE = "schema_migrations";
    public static final String DEFAULT_LOCK_TABLE = "schema_migration_lock";
    public static final String DEFAULT_CONSISTENCY_LEVEL = "LOCAL_QUORUM";
    public static final Duration DEFAULT_AGREEMENT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_AGREEMENT_POLL_INTERVAL = Duration.ofMillis(200);
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofMinutes(2);
    public static final Duration DEFAULT_LOCK_TTL = Duration.ofMinutes(10);
    public static final Duration DEFAULT_LOCK_POLL_INTERVAL = Duration.ofMillis(500);

    private static final Pattern CQL_IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_]{0,47}");

    public MigrationSettings {
        requireIdentifier("keyspace", keyspace);
        trackingTable = trackingTable == null || trackingTable.isBlank()
                ? DEFAULT_TRACKING_TABLE : trackingTable;
        lockTable = lockTable == null || lockTable.isBlank() ? DEFAULT_LOCK_TABLE : lockTable;
        requireIdentifier("trackingTable", trackingTable);
        requireIdentifier("lockTable", lockTable);
        if (trackingTable.equalsIgnoreCase(lockTable)) {
            throw new IllegalArgumentException("trackingTable and lockTable must differ");
        }
        if (replication != null && replication.isBlank()) {
            replication = null;
        }
        consistencyLevel = consistencyLevel == null || consistencyLevel.isBlank()
                ? DEFAULT_CONSISTENCY_LEVEL : consistencyLevel.toUpperCase();
        agreementTimeout = positiveOrDefault(agreementTimeout, DEFAULT_AGREEMENT_TIMEOUT);
        agreementPollInterval = positiveOrDefault(agreementPollInterval, DEFAULT_AGREEMENT_POLL_INTERVAL);
        lockTimeout = positiveOrDefault(lockTimeout, DEFAULT_LOCK_TIMEOUT);
        lockTtl = positiveOrDefault(lockTtl, DEFAULT_LOCK_TTL);
        lockPollInterval = positiveOrDefault(lockPollInterval, DEFAULT_LOCK_POLL_INTERVAL);
        runTimeout = runTimeout == null || runTimeout.isNegative() ? Duration.ZERO : runTimeout;
        if (lockTtl.compareTo(Duration.ofSeconds(1)) < 0) {
            throw new IllegalArgumentException("lockTtl must be at least one second");
        }
    }

    /** Starts a builder with defaults for everything but the keyspace. */
    public static Builder builder(String keyspace) {
        return new Builder(keyspace);
    }

    /** Settings with all defaults for the given keyspace. */
    public static MigrationSettings forKeyspace(String keyspace) {
        return builder(keyspace).build();
    }

    /** Returns true when a run budget is configured. */
    public boolean hasRunTimeout() {
        return !runTimeout.isZero();
    }

    /** Keyspace-qualified tracking table name. */
    public String qualifiedTrackingTable() {
        return keyspace + "." + trackingTable;
    }

    /** Keyspace-qualified lock table name. */
    public String qualifiedLockTable() {
        return keyspace + "." + lockTable;
    }

    private static void requireIdentifier(String name, String value) {
        if (value == null || !CQL_IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException(
                    "%s must be an unquoted CQL identifier, got '%s'".formatted(name, value));
        }
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }

    /** Fluent builder for {@link MigrationSettings}. */
    public static final class Builder {

        private final String keyspace;
        private String trackingTable;
        private String lockTable;
        private String replication;
        private String consistencyLevel;
        private Duration agreementTimeout;
        private Duration agreementPollInterval;
        private boolean lockEnabled = true;
        private Duration lockTimeout;
        private Duration lockTtl;
        private Duration lockPollInterval;
        private Duration runTimeout;
        private boolean validateChecksums = true;

        private Builder(String keyspace) {
            this.keyspace = Objects.requireNonNull(keyspace, "keyspace must not be null");
        }

        /** Tracking table name; null keeps {@link #DEFAULT_TRACKING_TABLE}. */
        public Builder trackingTable(String trackingTable) {
            this.trackingTable = trackingTable;
            return this;
        }

        /** Lease table name; null keeps {@link #DEFAULT_LOCK_TABLE}. */
        public Builder lockTable(String lockTable) {
            this.lockTable = lockTable;
            return this;
        }

        /** e.g. {@code {'class': 'SimpleStrategy', 'replication_factor': 1}}. */
        public Builder replication(String replication) {
            this.replication = replication;
            return this;
        }

        /** Name of a {@code DefaultConsistencyLevel} used for tracking reads and writes. */
        public Builder consistencyLevel(String consistencyLevel) {
            this.consistencyLevel = consistencyLevel;
            return this;
        }

        /** Maximum wait for schema agreement after each statement. */
        public Builder agreementTimeout(Duration agreementTimeout) {
            this.agreementTimeout = agreementTimeout;
            return this;
        }

        /** Pause between two schema agreement checks. */
        public Builder agreementPollInterval(Duration agreementPollInterval) {
            this.agreementPollInterval = agreementPollInterval;
            return this;
        }

        /** False runs without the lease table, for single-instance deployments. */
        public Builder lockEnabled(boolean lockEnabled) {
            this.lockEnabled = lockEnabled;
            return this;
        }

        /** Maximum wait for the lease before the run fails. */
        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        /** Lease lifetime, refreshed before each script. Must exceed the longest single script. */
        public Builder lockTtl(Duration lockTtl) {
            this.lockTtl = lockTtl;
            return this;
        }

        /** Pause between two attempts to take the lease. */
        public Builder lockPollInterval(Duration lockPollInterval) {
            this.lockPollInterval = lockPollInterval;
            return this;
        }

        /** Overall budget, checked between scripts; null or zero for none. */
        public Builder runTimeout(Duration runTimeout) {
            this.runTimeout = runTimeout;
            return this;
        }

        /** Whether an applied script whose checksum changed fails the run. */
        public Builder validateChecksums(boolean validateChecksums) {
            this.validateChecksums = validateChecksums;
            return this;
        }

        /** Builds the settings, replacing unset and non-positive values with the defaults. */
        public MigrationSettings build() {
            return new MigrationSettings(
                    keyspace,
                    trackingTable,
                    lockTable,
                    replication,
                    consistencyLevel,
                    agreementTimeout,
                    agreementPollInterval,
                    lockEnabled,
                    lockTimeout,
                    lockTtl,
                    lockPollInterval,
                    runTimeout,
                    validateChecksums);
        }
    }
}
