package com.quorum.migration.engine;

import java.time.Duration;
import java.util.List;

/**
 * Result of a successful run.
 *
 * @param appliedVersions versions applied by this run, in application order
 * @param skippedVersions versions that were pending when the run started but had been applied by
 *     another instance by the time this one held the lock
 * @param elapsed wall-clock duration of the run
 */
public record MigrationReport(List<Integer> appliedVersions, List<Integer> skippedVersions, Duration elapsed) {

    public MigrationReport {
        appliedVersions = List.copyOf(appliedVersions);
        skippedVersions = List.copyOf(skippedVersions);
    }

    /** A run that found nothing to do. */
    public static MigrationReport empty() {
        return new MigrationReport(List.of(), List.of(), Duration.ZERO);
    }

    /** Returns true if the run changed the schema. */
    public boolean hasApplied() {
        return !appliedVersions.isEmpty();
    }
}
