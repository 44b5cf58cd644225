package com.quorum.migration.lock;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DefaultConsistencyLevel;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.quorum.migration.MigrationSettings;
import com.quorum.migration.error.MigrationLockException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MigrationLock} implemented as a lease row written with a lightweight transaction.
 *
 * <p>Acquire inserts {@code (name, owner)} with {@code IF NOT EXISTS USING TTL}; release deletes
 * it with {@code IF owner = ?}. The TTL bounds how long a crashed instance can block others.
 *
 * <p>Renewal rewrites both cells with a fresh TTL under {@code IF owner = ?}. A renewal that does
 * not apply means the row expired and possibly went to another instance, so the holder must stop.
 */
public final class CassandraMigrationLock implements MigrationLock {

    /** Row key of the lease; one lease per keyspace. */
    public static final String LOCK_NAME = "schema";

    private static final Logger log = LoggerFactory.getLogger(CassandraMigrationLock.class);

    private final CqlSession session;
    private final MigrationSettings settings;
    private final String owner;
    private final Clock clock;

    /**
     * Creates a lock whose owner id is a random UUID.
     *
     * @param session session used for the lease row; not closed by the lock
     * @param settings supplies the lock table, timeout, poll interval and TTL
     */
    public CassandraMigrationLock(CqlSession session, MigrationSettings settings) {
        this(session, settings, UUID.randomUUID().toString(), Clock.systemUTC());
    }

    /**
     * @param owner value written to the {@code owner} column; must differ between instances
     * @param clock source of {@code acquired_at}
     */
    public CassandraMigrationLock(CqlSession session, MigrationSettings settings, String owner, Clock clock) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /** Owner id written to the lease row. */
    public String owner() {
        return owner;
    }

    @Override
    public Lease acquire() {
        long deadline = System.nanoTime() + settings.lockTimeout().toNanos();
        int attempts = 0;
        while (true) {
            attempts++;
            if (tryInsert()) {
                log.info("Acquired migration lock on {} as {} (attempt {})", settings.qualifiedLockTable(), owner, attempts);
                return new Lease() {
                    @Override
                    public void renew() {
                        CassandraMigrationLock.this.renew();
                    }

                    @Override
                    public void release() {
                        CassandraMigrationLock.this.release();
                    }
                };
            }
            if (System.nanoTime() - deadline >= 0) {
                throw new MigrationLockException("Could not acquire migration lock on %s within %d ms after %d attempt(s)"
                        .formatted(settings.qualifiedLockTable(), settings.lockTimeout().toMillis(), attempts));
            }
            pause(settings.lockPollInterval());
        }
    }

    private boolean tryInsert() {
        SimpleStatement insert = SimpleStatement.builder(
                        "INSERT INTO " + settings.qualifiedLockTable()
                                + " (name, owner, acquired_at) VALUES (?, ?, ?) IF NOT EXISTS USING TTL ?")
                .addPositionalValues(LOCK_NAME, owner, clock.instant(), ttlSeconds(settings.lockTtl()))
                .setSerialConsistencyLevel(DefaultConsistencyLevel.SERIAL)
                .build();
        ResultSet result;
        try {
            result = session.execute(insert);
        } catch (DriverException e) {
            throw new MigrationLockException("Could not write migration lock on " + settings.qualifiedLockTable(), e);
        }
        if (result.wasApplied()) {
            return true;
        }
        Row holder = result.one();
        if (holder != null) {
            log.info("Migration lock on {} is held by {}, waiting", settings.qualifiedLockTable(), holder.getString("owner"));
        }
        return false;
    }

    private void renew() {
        SimpleStatement update = SimpleStatement.builder(
                        "UPDATE " + settings.qualifiedLockTable()
                                + " USING TTL ? SET owner = ?, acquired_at = ? WHERE name = ? IF owner = ?")
                .addPositionalValues(ttlSeconds(settings.lockTtl()), owner, clock.instant(), LOCK_NAME, owner)
                .setSerialConsistencyLevel(DefaultConsistencyLevel.SERIAL)
                .build();
        ResultSet result;
        try {
            result = session.execute(update);
        } catch (DriverException e) {
            throw new MigrationLockException("Could not renew migration lock on " + settings.qualifiedLockTable(), e);
        }
        if (!result.wasApplied()) {
            throw new MigrationLockException("Migration lock on %s is no longer held by %s; the lease expired"
                    .formatted(settings.qualifiedLockTable(), owner));
        }
        log.debug("Renewed migration lock on {} for {} s", settings.qualifiedLockTable(), ttlSeconds(settings.lockTtl()));
    }

    private void release() {
        SimpleStatement delete = SimpleStatement.builder(
                        "DELETE FROM " + settings.qualifiedLockTable() + " WHERE name = ? IF owner = ?")
                .addPositionalValues(LOCK_NAME, owner)
                .setSerialConsistencyLevel(DefaultConsistencyLevel.SERIAL)
                .build();
        try {
            if (session.execute(delete).wasApplied()) {
                log.info("Released migration lock on {}", settings.qualifiedLockTable());
            } else {
                log.warn("Migration lock on {} was no longer held by {}; the lease expired during the run",
                        settings.qualifiedLockTable(), owner);
            }
        } catch (DriverException e) {
            // the row expires with its TTL
            log.warn("Could not release migration lock on {}; it expires in at most {} s",
                    settings.qualifiedLockTable(), ttlSeconds(settings.lockTtl()), e);
        }
    }

    private static void pause(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MigrationLockException("Interrupted while waiting for the migration lock", e);
        }
    }

    private static int ttlSeconds(Duration ttl) {
        return (int) Math.min(Integer.MAX_VALUE, ttl.toSeconds());
    }
}
