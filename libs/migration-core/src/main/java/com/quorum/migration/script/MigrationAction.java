package com.quorum.migration.script;

/** Body of a code-defined migration. */
@FunctionalInterface
public interface MigrationAction {

    /**
     * Issues the schema changes of one migration through the given context.
     *
     * @param context statement sink bound to the target keyspace
     * @throws Exception any failure aborts the run
     */
    void apply(MigrationContext context) throws Exception;
}
