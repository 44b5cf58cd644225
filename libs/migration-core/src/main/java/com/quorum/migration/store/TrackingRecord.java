package com.quorum.migration.store;

import java.time.Instant;
import java.util.Objects;

/**
 * One applied migration, as stored in the tracking table.
 *
 * @param version applied version
 * @param description description of the script at the time it ran
 * @param appliedAt when the tracking row was written
 * @param checksum script checksum at the time it ran, or null
 */
public record TrackingRecord(int version, String description, Instant appliedAt, String checksum) {

    public TrackingRecord {
        if (version <= 0) {
            throw new IllegalArgumentException("version must be positive");
        }
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(appliedAt, "appliedAt must not be null");
    }
}
