package com.quorum.migration.engine;

import com.quorum.migration.error.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Objects;

/**
 * Micrometer instrumentation of migration runs. Every meter is tagged with the keyspace.
 *
 * <ul>
 *   <li>{@value #SCRIPTS_APPLIED} : counter of applied scripts
 *   <li>{@value #SCRIPTS_FAILED} : counter of failed scripts, tagged with the failure kind
 *   <li>{@value #SCRIPT_DURATION} : timer per applied script, tagged with the version
 * </ul>
 */
public final class MigrationMetrics {

    public static final String SCRIPTS_APPLIED = "quorum.migration.scripts.applied";
    public static final String SCRIPTS_FAILED = "quorum.migration.scripts.failed";
    public static final String SCRIPT_DURATION = "quorum.migration.script.duration";

    public static final String TAG_KEYSPACE = "keyspace";
    public static final String TAG_VERSION = "version";
    public static final String TAG_KIND = "kind";

    private final MeterRegistry registry;
    private final String keyspace;

    public MigrationMetrics(MeterRegistry registry, String keyspace) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.keyspace = Objects.requireNonNull(keyspace, "keyspace must not be null");
    }

    /** Metrics kept in a private in-memory registry. */
    public static MigrationMetrics inMemory(String keyspace) {
        return new MigrationMetrics(new SimpleMeterRegistry(), keyspace);
    }

    Timer.Sample start() {
        return Timer.start(registry);
    }

    void applied(int version, Timer.Sample sample) {
        sample.stop(Timer.builder(SCRIPT_DURATION)
                .description("Time to apply one migration script, agreement waits included")
                .tags(TAG_KEYSPACE, keyspace, TAG_VERSION, String.valueOf(version))
                .register(registry));
        Counter.builder(SCRIPTS_APPLIED)
                .description("Migration scripts applied")
                .tag(TAG_KEYSPACE, keyspace)
                .register(registry)
                .increment();
    }

    void failed(FailureKind kind) {
        Counter.builder(SCRIPTS_FAILED)
                .description("Migration scripts that failed")
                .tags(TAG_KEYSPACE, keyspace, TAG_KIND, kind.name())
                .register(registry)
                .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
