package com.quorum.migration.error;

/** Thrown when no node of the cluster could serve a request. Never retried by the engine. */
public class ConnectivityException extends MigrationException {

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.CONNECTIVITY;
    }
}
