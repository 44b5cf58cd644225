package com.quorum.migration.agreement;

import com.datastax.oss.driver.api.core.cql.Statement;
import com.quorum.migration.error.ConnectivityException;
import com.quorum.migration.error.SchemaAgreementTimeoutException;
import com.quorum.migration.error.SchemaExecutionException;

/** Issues schema-changing statements and blocks until the cluster agrees on the result. */
public interface SchemaChangeExecutor {

    /**
     * Executes one statement and waits until every known node reports the same schema version.
     *
     * @throws SchemaExecutionException if the coordinator rejected the statement; it did not apply
     * @throws SchemaAgreementTimeoutException if the statement was accepted but the cluster did not
     *     reconverge in time; its effect is unknown
     * @throws ConnectivityException if no node could be reached
     */
    void executeWithAgreement(Statement<?> statement);
}
