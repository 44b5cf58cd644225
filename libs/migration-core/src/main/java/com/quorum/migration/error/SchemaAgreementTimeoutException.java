package com.quorum.migration.error;

import java.time.Duration;

/**
 * Thrown when a statement was accepted by the coordinator but the cluster did not report a single
 * schema version before the timeout.
 *
 * <p>The statement may or may not have reached every node. The script it belongs to is never
 * recorded as applied and must not be re-run without checking the cluster first.
 */
public class SchemaAgreementTimeoutException extends MigrationException {

    private final String statement;
    private final Duration waited;

    public SchemaAgreementTimeoutException(String statement, Duration waited, String detail) {
        this(statement, waited, detail, null);
    }

    public SchemaAgreementTimeoutException(
            String statement, Duration waited, String detail, Throwable cause) {
        super("Schema agreement not reached after %d ms for statement: %s (%s)"
                        .formatted(waited.toMillis(), statement, detail),
                cause);
        this.statement = statement;
        this.waited = waited;
    }

    public String statement() {
        return statement;
    }

    public Duration waited() {
        return waited;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.AGREEMENT_TIMEOUT;
    }
}
