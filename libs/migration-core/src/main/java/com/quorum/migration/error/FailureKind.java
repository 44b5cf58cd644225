package com.quorum.migration.error;

/**
 * Classification of every way a migration run can fail.
 *
 * <p>The kind is part of each {@link MigrationException} message so that a failed application
 * startup tells the operator what went wrong without reading a stack trace.
 */
public enum FailureKind {
    /** The cluster could not be reached. Nothing was applied by the failing call. */
    CONNECTIVITY,

    /** The tracking table does not exist and the registry has no bootstrap script. */
    TRACKING_STORE_MISSING,

    /** The tracking table exists but could not be read. */
    TRACKING_READ_FAILED,

    /** The coordinator rejected a statement. The statement did not apply. */
    EXECUTION_ERROR,

    /** A statement was accepted but the cluster did not reconverge in time. Effect unknown. */
    AGREEMENT_TIMEOUT,

    /** A multi-statement script failed after at least one of its statements applied. */
    PARTIAL_MIGRATION,

    /** A script action failed by itself, not through one of its statements. */
    SCRIPT_ERROR,

    /** The schema change applied but its tracking row could not be written. */
    TRACKING_WRITE_FAILED,

    /** Another instance recorded the same version first. */
    CONCURRENT_MIGRATION,

    /** An applied script no longer matches the checksum it was applied with. */
    CHECKSUM_MISMATCH,

    /** The migration lock could not be obtained. */
    LOCK_UNAVAILABLE,

    /** The run was cancelled between two scripts. */
    ABORTED,

    /** Two scripts in one registry share a version. */
    DUPLICATE_VERSION
}
