package com.quorum.migration.error;

import com.datastax.oss.driver.api.core.AllNodesFailedException;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.DriverTimeoutException;
import com.datastax.oss.driver.api.core.connection.ClosedConnectionException;
import com.datastax.oss.driver.api.core.servererrors.ReadTimeoutException;
import com.datastax.oss.driver.api.core.servererrors.UnavailableException;
import com.datastax.oss.driver.api.core.servererrors.WriteTimeoutException;

/** Classifies driver exceptions for the migration error taxonomy. */
public final class DriverFailures {

    private DriverFailures() {}

    /**
     * True when the failure means the cluster could not be reached rather than that it refused
     * the request. Covers {@code NoNodeAvailableException}, a subtype of
     * {@link AllNodesFailedException}.
     */
    public static boolean isConnectivity(DriverException e) {
        return e instanceof AllNodesFailedException
                || e instanceof ClosedConnectionException
                || e instanceof UnavailableException;
    }

    /**
     * True when the client or the replicas did not answer in time. For a read this carries no
     * side effect; for a write the outcome is unknown.
     */
    public static boolean isTimeout(DriverException e) {
        return e instanceof DriverTimeoutException
                || e instanceof ReadTimeoutException
                || e instanceof WriteTimeoutException;
    }
}
