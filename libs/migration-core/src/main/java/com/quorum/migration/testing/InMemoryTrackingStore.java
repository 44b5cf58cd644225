package com.quorum.migration.testing;

import com.quorum.migration.MigrationSettings;
import com.quorum.migration.error.TrackingStoreMissingException;
import com.quorum.migration.script.MigrationScript;
import com.quorum.migration.store.TrackingRecord;
import com.quorum.migration.store.TrackingStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A thread-safe {@link TrackingStore} held in memory.
 *
 * <p>{@link #recordApplied(TrackingRecord)} is an atomic put-if-absent, like the conditional
 * insert of the Cassandra store. Tests can start from a missing table and inject read or write
 * failures. Placed in {@code src/main/java} for cross-module test use.
 */
public final class InMemoryTrackingStore implements TrackingStore {

    private final String keyspace;
    private final ConcurrentSkipListMap<Integer, TrackingRecord> records = new ConcurrentSkipListMap<>();
    private final AtomicBoolean present;
    private final AtomicReference<RuntimeException> readFailure = new AtomicReference<>();
    private final Map<Integer, RuntimeException> writeFailures = new ConcurrentSkipListMap<>();
    private final AtomicInteger reads = new AtomicInteger();

    private InMemoryTrackingStore(String keyspace, boolean present) {
        this.keyspace = keyspace;
        this.present = new AtomicBoolean(present);
    }

    /** A store whose tracking table already exists and is empty. */
    public static InMemoryTrackingStore initialized(String keyspace) {
        return new InMemoryTrackingStore(keyspace, true);
    }

    /** A store whose tracking table does not exist yet; the bootstrap script creates it. */
    public static InMemoryTrackingStore missing(String keyspace) {
        return new InMemoryTrackingStore(keyspace, false);
    }

    @Override
    public List<TrackingRecord> getAppliedRecords() {
        reads.incrementAndGet();
        RuntimeException failure = readFailure.get();
        if (failure != null) {
            throw failure;
        }
        if (!present.get()) {
            throw new TrackingStoreMissingException(keyspace, MigrationSettings.DEFAULT_TRACKING_TABLE, null);
        }
        return new ArrayList<>(records.values());
    }

    @Override
    public boolean recordApplied(TrackingRecord record) {
        RuntimeException failure = writeFailures.get(record.version());
        if (failure != null) {
            throw failure;
        }
        if (!present.get()) {
            throw new TrackingStoreMissingException(keyspace, MigrationSettings.DEFAULT_TRACKING_TABLE, null);
        }
        return records.putIfAbsent(record.version(), record) == null;
    }

    @Override
    public MigrationScript bootstrapScript() {
        return MigrationScript.of(MigrationSettings.BOOTSTRAP_VERSION, "initialize migration tracking", context -> {
            context.execute("CREATE TABLE IF NOT EXISTS ${keyspace}." + MigrationSettings.DEFAULT_TRACKING_TABLE
                    + " (version int PRIMARY KEY, description text, applied_at timestamp, checksum text)");
            present.set(true);
        });
    }

    /** Pre-populates a record, as if applied by an earlier run. */
    public InMemoryTrackingStore withRecord(TrackingRecord record) {
        present.set(true);
        records.put(record.version(), record);
        return this;
    }

    /** Makes every subsequent read fail with the given exception; null clears it. */
    public InMemoryTrackingStore failReads(RuntimeException failure) {
        readFailure.set(failure);
        return this;
    }

    /** Makes recording the given version fail with the given exception. */
    public InMemoryTrackingStore failWrite(int version, RuntimeException failure) {
        writeFailures.put(version, failure);
        return this;
    }

    /** Number of {@link #getAppliedRecords()} calls so far, failed ones included. */
    public int reads() {
        return reads.get();
    }

    public boolean isPresent() {
        return present.get();
    }

    /** Recorded versions in ascending order. */
    public List<Integer> versions() {
        return List.copyOf(records.keySet());
    }

    public List<TrackingRecord> records() {
        return List.copyOf(records.values());
    }
}
