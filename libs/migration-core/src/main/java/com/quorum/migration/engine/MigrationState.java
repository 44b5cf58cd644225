package com.quorum.migration.engine;

/**
 * Phases of one migration run.
 *
 * <pre>
 * INIT -> LOADING_STATE -> COMPUTING_PENDING -> APPLYING -> DONE
 *                                                  \-> FAILED
 * </pre>
 *
 * <p>A run with nothing pending goes from {@code COMPUTING_PENDING} straight to {@code DONE}.
 */
public enum MigrationState {
    INIT,
    LOADING_STATE,
    COMPUTING_PENDING,
    APPLYING,
    DONE,
    FAILED
}
