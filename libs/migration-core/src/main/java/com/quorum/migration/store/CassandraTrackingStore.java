package com.quorum.migration.store;

import com.datastax.oss.driver.api.core.ConsistencyLevel;
import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DefaultConsistencyLevel;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.datastax.oss.driver.api.core.servererrors.InvalidQueryException;
import com.quorum.migration.MigrationSettings;
import com.quorum.migration.error.ConnectivityException;
import com.quorum.migration.error.DriverFailures;
import com.quorum.migration.error.TrackingReadException;
import com.quorum.migration.error.TrackingStoreMissingException;
import com.quorum.migration.script.MigrationScript;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TrackingStore} backed by a table in the target keyspace:
 *
 * <pre>{@code
 * CREATE TABLE <keyspace>.schema_migrations (
 *     version int PRIMARY KEY,
 *     description text,
 *     applied_at timestamp,
 *     checksum text)
 * }</pre>
 *
 * <p>Rows are written with a lightweight transaction ({@code IF NOT EXISTS}), which is what keeps
 * two instances from both recording the same version.
 *
 * <p>A rejected read is reported as a missing table only when the table is absent from the
 * driver's schema metadata and the coordinator's message names an unknown table or keyspace. A
 * table that exists with the wrong columns fails with {@link TrackingReadException} instead, so
 * the engine never runs the bootstrap script over it.
 */
public final class CassandraTrackingStore implements TrackingStore {

    private static final Logger log = LoggerFactory.getLogger(CassandraTrackingStore.class);

    private final CqlSession session;
    private final MigrationSettings settings;
    private final ConsistencyLevel consistencyLevel;

    /**
     * Creates a store on an open session.
     *
     * @param session session used for every read and write; not closed by the store
     * @param settings supplies the keyspace, the table names and the read/write consistency level
     */
    public CassandraTrackingStore(CqlSession session, MigrationSettings settings) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.consistencyLevel = DefaultConsistencyLevel.valueOf(settings.consistencyLevel());
    }

    /**
     * Reads every tracking row, sorted by version.
     *
     * @throws TrackingStoreMissingException if the table or its keyspace does not exist
     * @throws ConnectivityException if the cluster is unreachable or the read timed out
     * @throws TrackingReadException if the table exists but the read was rejected
     */
    @Override
    public List<TrackingRecord> getAppliedRecords() {
        SimpleStatement select = SimpleStatement.builder(
                        "SELECT version, description, applied_at, checksum FROM " + settings.qualifiedTrackingTable())
                .setConsistencyLevel(consistencyLevel)
                .build();
        ResultSet rows;
        try {
            rows = session.execute(select);
        } catch (InvalidQueryException e) {
            if (isMissingTable(e)) {
                throw new TrackingStoreMissingException(settings.keyspace(), settings.trackingTable(), e);
            }
            throw new TrackingReadException(settings.qualifiedTrackingTable(), e);
        } catch (DriverException e) {
            if (DriverFailures.isConnectivity(e) || DriverFailures.isTimeout(e)) {
                throw new ConnectivityException("Cluster unreachable or unresponsive while reading "
                        + settings.qualifiedTrackingTable(), e);
            }
            throw new TrackingReadException(settings.qualifiedTrackingTable(), e);
        }
        List<TrackingRecord> records = new ArrayList<>();
        for (Row row : rows.all()) {
            records.add(new TrackingRecord(
                    row.getInt("version"),
                    Objects.requireNonNullElse(row.getString("description"), ""),
                    Objects.requireNonNullElse(row.getInstant("applied_at"), Instant.EPOCH),
                    row.getString("checksum")));
        }
        records.sort(Comparator.comparingInt(TrackingRecord::version));
        log.debug("Read {} tracking row(s) from {}", records.size(), settings.qualifiedTrackingTable());
        return records;
    }

    /**
     * Inserts the row unless one exists for the version, at {@code SERIAL} serial consistency.
     *
     * @return false if the version was already recorded
     * @throws ConnectivityException if the cluster is unreachable
     */
    @Override
    public boolean recordApplied(TrackingRecord record) {
        SimpleStatement insert = SimpleStatement.builder(
                        "INSERT INTO " + settings.qualifiedTrackingTable()
                                + " (version, description, applied_at, checksum) VALUES (?, ?, ?, ?) IF NOT EXISTS")
                .addPositionalValues(record.version(), record.description(), record.appliedAt(), record.checksum())
                .setConsistencyLevel(consistencyLevel)
                .setSerialConsistencyLevel(DefaultConsistencyLevel.SERIAL)
                .build();
        try {
            boolean applied = session.execute(insert).wasApplied();
            if (!applied) {
                log.warn("Tracking row for version {} already exists in {}", record.version(), settings.qualifiedTrackingTable());
            }
            return applied;
        } catch (DriverException e) {
            if (DriverFailures.isConnectivity(e)) {
                throw new ConnectivityException("Cluster unreachable while recording version " + record.version(), e);
            }
            throw e;
        }
    }

    @Override
    public MigrationScript bootstrapScript() {
        String keyspace = settings.keyspace();
        return MigrationScript.of(
                MigrationSettings.BOOTSTRAP_VERSION,
                "initialize migration tracking",
                context -> {
                    if (settings.replication() != null) {
                        context.execute("CREATE KEYSPACE IF NOT EXISTS " + keyspace
                                + " WITH replication = " + settings.replication());
                    }
                    context.execute("CREATE TABLE IF NOT EXISTS " + settings.qualifiedTrackingTable()
                            + " (version int PRIMARY KEY, description text, applied_at timestamp, checksum text)");
                    context.execute("CREATE TABLE IF NOT EXISTS " + settings.qualifiedLockTable()
                            + " (name text PRIMARY KEY, owner text, acquired_at timestamp)");
                });
    }

    private boolean isMissingTable(InvalidQueryException e) {
        boolean present = session.getMetadata()
                .getKeyspace(settings.keyspace())
                .flatMap(keyspace -> keyspace.getTable(settings.trackingTable()))
                .isPresent();
        if (present) {
            return false;
        }
        String message = Objects.requireNonNullElse(e.getMessage(), "").toLowerCase(Locale.ROOT);
        return message.contains("unconfigured table") || message.contains("does not exist");
    }
}
