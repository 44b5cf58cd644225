package com.quorum.migration.script;

import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.datastax.oss.driver.api.core.cql.Statement;
import com.quorum.migration.agreement.SchemaChangeExecutor;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Statement sink handed to a {@link MigrationScript} while it is applied.
 *
 * <p>Every statement goes through the {@link SchemaChangeExecutor}, so a call returns only after
 * the cluster agreed on the new schema. The context counts the statements that completed, which
 * lets the engine report how far a multi-statement script got before failing.
 *
 * <p>{@code ${keyspace}} in CQL text is replaced with the target keyspace.
 */
public final class MigrationContext {

    /** Placeholder substituted with the target keyspace. */
    public static final String KEYSPACE_PLACEHOLDER = "${keyspace}";

    private static final Logger log = LoggerFactory.getLogger(MigrationContext.class);

    private final int version;
    private final String keyspace;
    private final SchemaChangeExecutor executor;
    private int completedStatements;
    private boolean statementFailed;

    public MigrationContext(int version, String keyspace, SchemaChangeExecutor executor) {
        this.version = version;
        this.keyspace = Objects.requireNonNull(keyspace, "keyspace must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /** Executes CQL text, after placeholder substitution, and waits for schema agreement. */
    public void execute(String cql) {
        execute(SimpleStatement.newInstance(resolve(cql)));
    }

    /** Executes a statement and waits for schema agreement. */
    public void execute(Statement<?> statement) {
        int index = completedStatements + 1;
        log.debug("Migration {} statement {}: {}", version, index, statement);
        try {
            executor.executeWithAgreement(statement);
        } catch (RuntimeException e) {
            statementFailed = true;
            throw e;
        }
        completedStatements = index;
    }

    /** Replaces {@value #KEYSPACE_PLACEHOLDER} with the target keyspace. */
    public String resolve(String cql) {
        return cql.replace(KEYSPACE_PLACEHOLDER, keyspace);
    }

    public int version() {
        return version;
    }

    public String keyspace() {
        return keyspace;
    }

    /** Number of statements that reached agreement so far. */
    public int completedStatements() {
        return completedStatements;
    }

    /** True once a statement issued through this context has thrown. */
    public boolean statementFailed() {
        return statementFailed;
    }
}
