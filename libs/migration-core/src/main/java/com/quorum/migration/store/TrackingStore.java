package com.quorum.migration.store;

import com.quorum.migration.error.ConnectivityException;
import com.quorum.migration.error.TrackingStoreMissingException;
import com.quorum.migration.script.MigrationScript;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Persistent record, inside the target keyspace, of the versions applied so far.
 *
 * <p>The store is owned by the cluster, not by the application: it survives restarts and is
 * shared by every instance migrating the same keyspace.
 */
public interface TrackingStore {

    /**
     * Returns every tracking row, ordered by version.
     *
     * @throws ConnectivityException if the cluster is unreachable
     * @throws TrackingStoreMissingException if the tracking table does not exist
     */
    List<TrackingRecord> getAppliedRecords();

    /**
     * Returns the applied versions.
     *
     * @throws ConnectivityException if the cluster is unreachable
     * @throws TrackingStoreMissingException if the tracking table does not exist
     */
    default Set<Integer> getAppliedVersions() {
        Set<Integer> versions = new TreeSet<>();
        getAppliedRecords().forEach(r -> versions.add(r.version()));
        return versions;
    }

    /**
     * Inserts the row for a version only if no row exists for it yet.
     *
     * <p>Call only after every statement of the script reached schema agreement.
     *
     * @return true if this call created the row, false if another instance recorded the version
     *     first
     */
    boolean recordApplied(TrackingRecord record);

    /**
     * The initialize script, version {@link com.quorum.migration.MigrationSettings#BOOTSTRAP_VERSION},
     * that creates the tracking table. Its statements are idempotent.
     */
    MigrationScript bootstrapScript();
}
