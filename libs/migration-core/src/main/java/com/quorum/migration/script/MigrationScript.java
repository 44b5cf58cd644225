package com.quorum.migration.script;

/**
 * A versioned unit of schema change.
 *
 * <p>Versions are positive, unique within a {@link MigrationResources} registry and define the
 * order of application. Once a version is recorded in the tracking table the engine never runs it
 * again against that keyspace.
 */
public interface MigrationScript {

    int version();

    String description();

    /**
     * Checksum of the script's content, compared against the recorded one to detect edits made
     * after the script was applied. Null disables the comparison for this script.
     */
    default String checksum() {
        return null;
    }

    /**
     * Issues the script's statements. Each {@link MigrationContext#execute(String)} call returns
     * only once the cluster agrees on the resulting schema.
     */
    void apply(MigrationContext context) throws Exception;

    /** Creates a code-defined script without checksum. */
    static MigrationScript of(int version, String description, MigrationAction action) {
        return new CodeMigrationScript(version, description, null, action);
    }

    /** Creates a code-defined script whose edits are detected through the given checksum. */
    static MigrationScript of(int version, String description, String checksum, MigrationAction action) {
        return new CodeMigrationScript(version, description, checksum, action);
    }
}
