package com.quorum.migration.error;

/**
 * Wraps an error raised by a script action itself rather than by one of its statements.
 *
 * <p>Statements the action issued before failing stay applied; {@link #completedStatements()}
 * says how many.
 */
public class MigrationScriptException extends MigrationException {

    private final int version;
    private final int completedStatements;

    public MigrationScriptException(int version, Throwable cause) {
        this(version, 0, cause);
    }

    public MigrationScriptException(int version, int completedStatements, Throwable cause) {
        super(message(version, completedStatements, cause), cause);
        this.version = version;
        this.completedStatements = completedStatements;
    }

    private static String message(int version, int completedStatements, Throwable cause) {
        if (completedStatements == 0) {
            return "Migration %d failed before issuing any statement: %s".formatted(version, cause.getMessage());
        }
        return "Migration %d failed after %d statement(s) had applied; the schema is partially migrated: %s"
                .formatted(version, completedStatements, cause.getMessage());
    }

    public int version() {
        return version;
    }

    /** Statements that reached agreement before the action failed. */
    public int completedStatements() {
        return completedStatements;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.SCRIPT_ERROR;
    }
}
