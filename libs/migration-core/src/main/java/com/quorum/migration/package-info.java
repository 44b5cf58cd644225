/**
 * Cassandra schema migrations with cluster schema-agreement tracking.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.quorum.migration.script}: versioned scripts and the immutable registry
 *   <li>{@link com.quorum.migration.agreement}: statement execution that waits for schema
 *       agreement
 *   <li>{@link com.quorum.migration.store}: the tracking table inside the target keyspace
 *   <li>{@link com.quorum.migration.lock}: the lease that serializes concurrent runs
 *   <li>{@link com.quorum.migration.engine}: orchestration, reporting and status
 *   <li>{@link com.quorum.migration.error}: the failure taxonomy
 * </ul>
 *
 * <p>Every component receives the already-connected {@code CqlSession} as a constructor argument;
 * nothing here opens or closes sessions.
 */
package com.quorum.migration;
