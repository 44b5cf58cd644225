/**
 * Spring Boot integration: binds {@code quorum.cassandra.migration.*} and migrates the keyspace
 * during context startup, on the {@code CqlSession} provided by Spring Boot's Cassandra support.
 */
package com.quorum.migration.spring;
