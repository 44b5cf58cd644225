package com.quorum.migration.agreement;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.DriverTimeoutException;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.datastax.oss.driver.api.core.cql.Statement;
import com.quorum.migration.MigrationSettings;
import com.quorum.migration.error.ConnectivityException;
import com.quorum.migration.error.DriverFailures;
import com.quorum.migration.error.SchemaAgreementTimeoutException;
import com.quorum.migration.error.SchemaExecutionException;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SchemaChangeExecutor} on a live {@link CqlSession}.
 *
 * <p>After a statement succeeds the driver has already waited for agreement up to its own
 * {@code schema-agreement.timeout}; {@link com.datastax.oss.driver.api.core.cql.ExecutionInfo#isSchemaInAgreement()}
 * tells whether that wait succeeded. If not, the executor keeps polling
 * {@link CqlSession#checkSchemaAgreement()} until the configured timeout, measured from the moment
 * the statement was issued.
 */
public final class CassandraSchemaAgreementExecutor implements SchemaChangeExecutor {

    private static final Logger log = LoggerFactory.getLogger(CassandraSchemaAgreementExecutor.class);

    private final CqlSession session;
    private final Duration timeout;
    private final Duration pollInterval;

    public CassandraSchemaAgreementExecutor(CqlSession session, MigrationSettings settings) {
        this(session, settings.agreementTimeout(), settings.agreementPollInterval());
    }

    public CassandraSchemaAgreementExecutor(CqlSession session, Duration timeout, Duration pollInterval) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
    }

    @Override
    public void executeWithAgreement(Statement<?> statement) {
        String cql = describe(statement);
        long started = System.nanoTime();
        ResultSet resultSet;
        try {
            resultSet = session.execute(statement);
        } catch (DriverTimeoutException e) {
            throw new SchemaAgreementTimeoutException(
                    cql, since(started), "client timed out waiting for the coordinator, the statement may have applied", e);
        } catch (DriverException e) {
            if (DriverFailures.isConnectivity(e)) {
                throw new ConnectivityException("Cluster unreachable while executing: " + cql, e);
            }
            throw new SchemaExecutionException(cql, e);
        }
        if (resultSet.getExecutionInfo().isSchemaInAgreement()) {
            log.debug("Schema agreement reached with the statement response after {} ms", since(started).toMillis());
            return;
        }
        awaitAgreement(cql, started);
    }

    private void awaitAgreement(String cql, long started) {
        long deadline = started + timeout.toNanos();
        int polls = 0;
        while (true) {
            polls++;
            boolean agreed;
            try {
                agreed = session.checkSchemaAgreement();
            } catch (DriverException e) {
                throw new SchemaAgreementTimeoutException(
                        cql, since(started), "agreement check failed: " + e.getMessage(), e);
            }
            if (agreed) {
                log.debug("Schema agreement reached after {} poll(s), {} ms", polls, since(started).toMillis());
                return;
            }
            if (System.nanoTime() - deadline >= 0) {
                ClusterAgreementState state =
                        ClusterAgreementState.capture(session.getMetadata(), polls, since(started));
                log.error("Schema agreement timeout: {}", state.describe());
                throw new SchemaAgreementTimeoutException(cql, state.elapsed(), state.describe());
            }
            log.debug("Schema not in agreement yet (poll {}), retrying in {} ms", polls, pollInterval.toMillis());
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SchemaAgreementTimeoutException(
                        cql, since(started), "interrupted while waiting for schema agreement", e);
            }
        }
    }

    static String describe(Statement<?> statement) {
        if (statement instanceof SimpleStatement simple) {
            return simple.getQuery();
        }
        if (statement instanceof BoundStatement bound) {
            return bound.getPreparedStatement().getQuery();
        }
        return String.valueOf(statement);
    }

    private static Duration since(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
