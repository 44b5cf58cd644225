package com.quorum.migration.error;

/**
 * Thrown when statement {@code N} of a multi-statement script fails after statements
 * {@code 1..N-1} applied.
 *
 * <p>DDL is not transactional: the earlier statements stay in place and the script is not
 * recorded. Statement indexes are 1-based.
 */
public class PartialMigrationException extends MigrationException {

    private final int version;
    private final int lastSuccessfulStatement;

    public PartialMigrationException(int version, int lastSuccessfulStatement, Throwable cause) {
        super("Migration %d failed on statement %d after %d statement(s) applied; manual remediation required: %s"
                        .formatted(
                                version,
                                lastSuccessfulStatement + 1,
                                lastSuccessfulStatement,
                                cause.getMessage()),
                cause);
        this.version = version;
        this.lastSuccessfulStatement = lastSuccessfulStatement;
    }

    public int version() {
        return version;
    }

    /** 1-based index of the last statement that reached agreement. */
    public int lastSuccessfulStatement() {
        return lastSuccessfulStatement;
    }

    /** 1-based index of the statement that failed. */
    public int failedStatement() {
        return lastSuccessfulStatement + 1;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.PARTIAL_MIGRATION;
    }
}
