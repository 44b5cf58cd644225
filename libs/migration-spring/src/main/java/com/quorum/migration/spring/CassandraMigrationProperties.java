package com.quorum.migration.spring;

import com.quorum.migration.MigrationSettings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration of the Cassandra migration run performed at startup.
 *
 * <p>Bound from {@code quorum.cassandra.migration.*}. Bean Validation rejects a missing keyspace
 * when the context starts. Unset durations and table names fall back to the
 * {@link MigrationSettings} defaults.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * quorum:
 *   cassandra:
 *     migration:
 *       keyspace: books
 *       locations: classpath:db/cassandra/migration
 *       replication: "{'class': 'SimpleStrategy', 'replication_factor': 1}"
 *       agreement-timeout: 30s
 *       lock-timeout: 2m
 *       lock-poll-interval: 1s
 * }</pre>
 *
 * @param enabled whether to migrate at startup
 * @param keyspace target keyspace
 * @param locations where to look for {@code V<n>__<description>.cql} files
 * @param bootstrapTrackingTable whether to add the script creating the tracking and lock tables
 *     as version 1
 * @param trackingTable tracking table name
 * @param lockTable lease table name
 * @param replication replication map used to create the keyspace during bootstrap; unset leaves
 *     keyspace creation to operators
 * @param consistencyLevel consistency level for tracking reads and writes
 * @param agreementTimeout maximum wait for schema agreement after each statement
 * @param agreementPollInterval pause between schema agreement checks
 * @param lockEnabled whether concurrent instances are serialized with the lease table
 * @param lockTimeout maximum wait for the lease
 * @param lockPollInterval pause between two attempts to take the lease
 * @param lockTtl lifetime of a lease left behind by a crashed instance
 * @param runTimeout overall budget of the run, unset for none
 * @param validateChecksums whether an applied script that changed afterwards fails the run
 */
@Validated
@ConfigurationProperties(prefix = CassandraMigrationProperties.PREFIX)
public record CassandraMigrationProperties(
        @DefaultValue("true") boolean enabled,
        @NotBlank String keyspace,
        @DefaultValue(CassandraMigrationProperties.DEFAULT_LOCATION) @NotEmpty List<String> locations,
        @DefaultValue("true") boolean bootstrapTrackingTable,
        String trackingTable,
        String lockTable,
        String replication,
        String consistencyLevel,
        Duration agreementTimeout,
        Duration agreementPollInterval,
        @DefaultValue("true") boolean lockEnabled,
        Duration lockTimeout,
        Duration lockPollInterval,
        Duration lockTtl,
        Duration runTimeout,
        @DefaultValue("true") boolean validateChecksums) {

    public static final String PREFIX = "quorum.cassandra.migration";

    public static final String DEFAULT_LOCATION = "classpath:db/cassandra/migration";

    /** Converts to the settings understood by the engine. */
    public MigrationSettings toSettings() {
        return MigrationSettings.builder(keyspace)
                .trackingTable(trackingTable)
                .lockTable(lockTable)
                .replication(replication)
                .consistencyLevel(consistencyLevel)
                .agreementTimeout(agreementTimeout)
                .agreementPollInterval(agreementPollInterval)
                .lockEnabled(lockEnabled)
                .lockTimeout(lockTimeout)
                .lockPollInterval(lockPollInterval)
                .lockTtl(lockTtl)
                .runTimeout(runTimeout)
                .validateChecksums(validateChecksums)
                .build();
    }
}
