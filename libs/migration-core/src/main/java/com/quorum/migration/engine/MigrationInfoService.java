package com.quorum.migration.engine;

import com.quorum.migration.script.MigrationResources;
import com.quorum.migration.script.MigrationScript;
import com.quorum.migration.store.TrackingRecord;
import com.quorum.migration.store.TrackingStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Read-only view comparing a registry with what the tracking store says was applied.
 *
 * <p>Backs status endpoints, health checks and operator tooling; it never changes the schema.
 */
public class MigrationInfoService {

    /** Standing of one version. */
    public enum State {
        /** Recorded in the tracking store and unchanged in the registry. */
        APPLIED,
        /** In the registry, not recorded. */
        PENDING,
        /** Recorded with a checksum that differs from the registry script. */
        CHECKSUM_MISMATCH,
        /** Recorded, but no script in the registry has that version. */
        UNKNOWN
    }

    /**
     * Status of a single migration version.
     *
     * @param version migration version
     * @param description script description, or the recorded one for unknown versions
     * @param state standing of the version
     * @param appliedAt when it was recorded, null if pending
     * @param checksum checksum of the registry script, or the recorded one for unknown versions
     */
    public record MigrationInfo(int version, String description, State state, Instant appliedAt, String checksum) {}

    /**
     * Overall status of a keyspace.
     *
     * @param keyspace target keyspace
     * @param appliedMigrations number of recorded versions
     * @param pendingMigrations number of registry versions not recorded
     * @param currentVersion highest recorded version, null if none
     */
    public record MigrationStatus(String keyspace, int appliedMigrations, int pendingMigrations, Integer currentVersion) {

        public boolean upToDate() {
            return pendingMigrations == 0;
        }
    }

    private final TrackingStore trackingStore;
    private final String keyspace;

    /**
     * @param trackingStore store to read the applied versions from
     * @param keyspace keyspace named in the returned status
     */
    public MigrationInfoService(TrackingStore trackingStore, String keyspace) {
        this.trackingStore = Objects.requireNonNull(trackingStore, "trackingStore must not be null");
        this.keyspace = Objects.requireNonNull(keyspace, "keyspace must not be null");
    }

    /** One entry per registry version and per recorded version unknown to the registry. */
    public List<MigrationInfo> info(MigrationResources resources) {
        Map<Integer, TrackingRecord> recorded = new TreeMap<>();
        trackingStore.getAppliedRecords().forEach(r -> recorded.put(r.version(), r));

        List<MigrationInfo> infos = new ArrayList<>();
        for (MigrationScript script : resources) {
            TrackingRecord record = recorded.remove(script.version());
            if (record == null) {
                infos.add(new MigrationInfo(script.version(), script.description(), State.PENDING, null, script.checksum()));
            } else {
                boolean drifted = script.checksum() != null && record.checksum() != null
                        && !script.checksum().equals(record.checksum());
                infos.add(new MigrationInfo(script.version(), script.description(),
                        drifted ? State.CHECKSUM_MISMATCH : State.APPLIED, record.appliedAt(), script.checksum()));
            }
        }
        recorded.values().forEach(r ->
                infos.add(new MigrationInfo(r.version(), r.description(), State.UNKNOWN, r.appliedAt(), r.checksum())));
        infos.sort(Comparator.comparingInt(MigrationInfo::version));
        return infos;
    }

    /** Counts applied and pending versions. Reads the tracking store once. */
    public MigrationStatus status(MigrationResources resources) {
        return status(info(resources));
    }

    /**
     * Summarizes entries already returned by {@link #info(MigrationResources)}, for callers that
     * need both views without reading the tracking store twice.
     */
    public MigrationStatus status(List<MigrationInfo> infos) {
        int pending = (int) infos.stream().filter(i -> i.state() == State.PENDING).count();
        List<MigrationInfo> applied = infos.stream().filter(i -> i.state() != State.PENDING).toList();
        Integer current = applied.isEmpty() ? null : applied.get(applied.size() - 1).version();
        return new MigrationStatus(keyspace, applied.size(), pending, current);
    }
}
