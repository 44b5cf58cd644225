package com.quorum.migration.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.quorum.migration.engine.MigrationInfoService.MigrationInfo;
import com.quorum.migration.engine.MigrationInfoService.State;
import com.quorum.migration.script.MigrationResources;
import com.quorum.migration.script.MigrationScript;
import com.quorum.migration.store.TrackingRecord;
import com.quorum.migration.testing.InMemoryTrackingStore;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests how {@link MigrationInfoService} compares a registry with the recorded versions. */
@DisplayName("MigrationInfoService")
class MigrationInfoServiceTest {

    private static final Instant APPLIED_AT = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryTrackingStore store;
    private MigrationInfoService service;

    @BeforeEach
    void setUp() {
        store = InMemoryTrackingStore.initialized("books");
        service = new MigrationInfoService(store, "books");
    }

    private static MigrationScript script(int version, String checksum) {
        return MigrationScript.of(version, "migration " + version, checksum, context -> {});
    }

    @Nested
    @DisplayName("info")
    class Info {

        @Test
        @DisplayName("classifies every version")
        void classifies() {
            store.withRecord(new TrackingRecord(1, "migration 1", APPLIED_AT, "a"))
                    .withRecord(new TrackingRecord(2, "migration 2", APPLIED_AT, "old"))
                    .withRecord(new TrackingRecord(9, "dropped script", APPLIED_AT, "z"));
            var resources = MigrationResources.of(script(1, "a"), script(2, "new"), script(3, "c"));

            var infos = service.info(resources);

            assertThat(infos).extracting(MigrationInfo::version).containsExactly(1, 2, 3, 9);
            assertThat(infos).extracting(MigrationInfo::state)
                    .containsExactly(State.APPLIED, State.CHECKSUM_MISMATCH, State.PENDING, State.UNKNOWN);
            assertThat(infos.get(2).appliedAt()).isNull();
            assertThat(infos.get(3).description()).isEqualTo("dropped script");
        }

        @Test
        @DisplayName("does not flag scripts without checksum")
        void noChecksum() {
            store.withRecord(new TrackingRecord(1, "migration 1", APPLIED_AT, "a"));

            var infos = service.info(MigrationResources.of(script(1, null)));

            assertThat(infos).singleElement().extracting(MigrationInfo::state).isEqualTo(State.APPLIED);
        }
    }

    @Nested
    @DisplayName("status")
    class Status {

        @Test
        @DisplayName("counts applied and pending versions")
        void counts() {
            store.withRecord(new TrackingRecord(1, "migration 1", APPLIED_AT, null))
                    .withRecord(new TrackingRecord(2, "migration 2", APPLIED_AT, null));

            var status = service.status(MigrationResources.of(script(1, null), script(2, null), script(3, null)));

            assertThat(status.keyspace()).isEqualTo("books");
            assertThat(status.appliedMigrations()).isEqualTo(2);
            assertThat(status.pendingMigrations()).isEqualTo(1);
            assertThat(status.currentVersion()).isEqualTo(2);
            assertThat(status.upToDate()).isFalse();
        }

        @Test
        @DisplayName("has no current version before the first migration")
        void emptyKeyspace() {
            var status = service.status(MigrationResources.empty());

            assertThat(status.currentVersion()).isNull();
            assertThat(status.upToDate()).isTrue();
        }

        @Test
        @DisplayName("summarizes entries already read without another store read")
        void fromInfos() {
            store.withRecord(new TrackingRecord(1, "migration 1", APPLIED_AT, null));
            var infos = service.info(MigrationResources.of(script(1, null), script(2, null)));

            var status = service.status(infos);

            assertThat(store.reads()).isEqualTo(1);
            assertThat(status.appliedMigrations()).isEqualTo(1);
            assertThat(status.pendingMigrations()).isEqualTo(1);
            assertThat(status.currentVersion()).isEqualTo(1);
        }
    }
}
