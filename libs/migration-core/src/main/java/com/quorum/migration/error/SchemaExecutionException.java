package com.quorum.migration.error;

/** Thrown when the coordinator rejects a schema statement. The statement did not apply. */
public class SchemaExecutionException extends MigrationException {

    private final String statement;

    public SchemaExecutionException(String statement, Throwable cause) {
        super("Statement rejected by the cluster: %s (%s)".formatted(statement, cause.getMessage()), cause);
        this.statement = statement;
    }

    public String statement() {
        return statement;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.EXECUTION_ERROR;
    }
}
