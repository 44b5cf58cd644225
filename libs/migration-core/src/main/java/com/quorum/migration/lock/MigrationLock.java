package com.quorum.migration.lock;

import com.quorum.migration.error.MigrationLockException;

/**
 * Cluster-wide mutual exclusion for migration runs.
 *
 * <p>The engine applies scripts only while holding a lease, so two instances starting at the same
 * time never run the same DDL. The conditional insert in the tracking store remains the final
 * guard.
 *
 * <p>Leases may expire. The engine renews its lease before every script, so a run longer than the
 * lease duration keeps it as long as no single script outlasts it.
 */
public interface MigrationLock {

    /**
     * Blocks until the lease is obtained.
     *
     * @throws MigrationLockException if the lease cannot be obtained in time
     */
    Lease acquire();

    /** A lock that is always granted, for deployments with a single instance. */
    static MigrationLock none() {
        return () -> () -> {};
    }

    /** A held lease. Closing it releases it. */
    @FunctionalInterface
    interface Lease extends AutoCloseable {

        void release();

        /**
         * Extends the lease. Leases that never expire do nothing.
         *
         * @throws MigrationLockException if the lease was lost or could not be extended
         */
        default void renew() {}

        @Override
        default void close() {
            release();
        }
    }
}
