package com.quorum.migration.error;

import java.util.List;

/**
 * Outcome of a run that stopped while applying scripts.
 *
 * <p>Carries the version that failed, the last version that was applied successfully (this run or
 * earlier) and the versions this run managed to apply before stopping. The underlying failure is
 * the {@link #getCause() cause}; its {@link MigrationException#kind() kind} is reported by
 * {@link #kind()}.
 */
public class MigrationFailedException extends MigrationException {

    private final int failedVersion;
    private final Integer lastAppliedVersion;
    private final List<Integer> appliedVersions;
    private final FailureKind kind;

    public MigrationFailedException(
            int failedVersion,
            Integer lastAppliedVersion,
            List<Integer> appliedVersions,
            MigrationException cause) {
        super("Migration of version %d failed (%s); last applied version: %s; applied this run: %s; cause: %s"
                        .formatted(
                                failedVersion,
                                cause.kind(),
                                lastAppliedVersion == null ? "none" : lastAppliedVersion,
                                appliedVersions,
                                cause.getMessage()),
                cause);
        this.failedVersion = failedVersion;
        this.lastAppliedVersion = lastAppliedVersion;
        this.appliedVersions = List.copyOf(appliedVersions);
        this.kind = cause.kind();
    }

    public int failedVersion() {
        return failedVersion;
    }

    /** Highest version known applied when the run stopped, or null if none. */
    public Integer lastAppliedVersion() {
        return lastAppliedVersion;
    }

    /** Versions applied by this run before the failure, in order. */
    public List<Integer> appliedVersions() {
        return appliedVersions;
    }

    @Override
    public MigrationException getCause() {
        return (MigrationException) super.getCause();
    }

    @Override
    public FailureKind kind() {
        return kind;
    }
}
