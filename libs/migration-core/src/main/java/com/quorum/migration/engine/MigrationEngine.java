package com.quorum.migration.engine;

import com.datastax.oss.driver.api.core.CqlSession;
import com.quorum.migration.MigrationSettings;
import com.quorum.migration.agreement.CassandraSchemaAgreementExecutor;
import com.quorum.migration.agreement.SchemaChangeExecutor;
import com.quorum.migration.error.ChecksumMismatchException;
import com.quorum.migration.error.ConcurrentMigrationException;
import com.quorum.migration.error.ConnectivityException;
import com.quorum.migration.error.MigrationAbortedException;
import com.quorum.migration.error.MigrationException;
import com.quorum.migration.error.MigrationFailedException;
import com.quorum.migration.error.MigrationLockException;
import com.quorum.migration.error.MigrationScriptException;
import com.quorum.migration.error.PartialMigrationException;
import com.quorum.migration.error.TrackingReadException;
import com.quorum.migration.error.TrackingStoreMissingException;
import com.quorum.migration.error.TrackingWriteException;
import com.quorum.migration.lock.CassandraMigrationLock;
import com.quorum.migration.lock.MigrationLock;
import com.quorum.migration.script.MigrationContext;
import com.quorum.migration.script.MigrationResources;
import com.quorum.migration.script.MigrationScript;
import com.quorum.migration.store.CassandraTrackingStore;
import com.quorum.migration.store.TrackingRecord;
import com.quorum.migration.store.TrackingStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the pending scripts of a registry to one keyspace.
 *
 * <p>A run reads the tracking store, computes the versions it has not seen, and applies them one at
 * a time in ascending order: run the script through the {@link SchemaChangeExecutor}, then record
 * it. The first failure stops the run; later scripts are never attempted and nothing is retried.
 *
 * <p>Concurrent instances are serialized by the {@link MigrationLock}. Once the lock is held the
 * applied set is read again, so versions another instance applied in the meantime are skipped.
 * The lease is renewed before every script; a lost lease stops the run. The tracking store's
 * conditional insert catches anything the lock missed.
 *
 * <p>Every failure after the run entered {@link MigrationState#APPLYING} ends in
 * {@link MigrationState#FAILED} and surfaces as a {@link MigrationFailedException}, whatever the
 * collaborator threw.
 *
 * <p>On a keyspace without a tracking table the run bootstraps it, provided the registry starts
 * with the {@link MigrationSettings#BOOTSTRAP_VERSION bootstrap version}. That script runs before
 * the lock is taken, since the lock table does not exist yet; its statements are idempotent.
 *
 * <p>The engine receives every collaborator, the session included, through its constructor and
 * never opens a connection by itself.
 */
public final class MigrationEngine {

    private static final Logger log = LoggerFactory.getLogger(MigrationEngine.class);

    private final TrackingStore trackingStore;
    private final SchemaChangeExecutor executor;
    private final MigrationLock lock;
    private final MigrationSettings settings;
    private final MigrationMetrics metrics;
    private final Clock clock;
    private volatile MigrationState state = MigrationState.INIT;

    /**
     * Creates an engine with in-memory metrics and the system UTC clock.
     *
     * @param trackingStore source of the applied set and sink for new records
     * @param executor runs each statement and waits for schema agreement
     * @param lock serializes runs across instances; {@link MigrationLock#none()} for a single one
     * @param settings run settings
     */
    public MigrationEngine(
            TrackingStore trackingStore,
            SchemaChangeExecutor executor,
            MigrationLock lock,
            MigrationSettings settings) {
        this(trackingStore, executor, lock, settings, MigrationMetrics.inMemory(settings.keyspace()), Clock.systemUTC());
    }

    /**
     * Creates an engine with explicit metrics and clock.
     *
     * @param metrics receives run, failure and per-version timings
     * @param clock source of the {@code applied_at} timestamp of each record
     */
    public MigrationEngine(
            TrackingStore trackingStore,
            SchemaChangeExecutor executor,
            MigrationLock lock,
            MigrationSettings settings,
            MigrationMetrics metrics,
            Clock clock) {
        this.trackingStore = Objects.requireNonNull(trackingStore, "trackingStore must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.lock = Objects.requireNonNull(lock, "lock must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Wires the Cassandra implementations of every collaborator on an already-connected session.
     *
     * @param session live session; the engine does not close it
     * @param settings run settings
     * @param meterRegistry registry receiving the migration meters
     */
    public static MigrationEngine create(CqlSession session, MigrationSettings settings, MeterRegistry meterRegistry) {
        Objects.requireNonNull(session, "session must not be null");
        MigrationLock lock = settings.lockEnabled() ? new CassandraMigrationLock(session, settings) : MigrationLock.none();
        return new MigrationEngine(
                new CassandraTrackingStore(session, settings),
                new CassandraSchemaAgreementExecutor(session, settings),
                lock,
                settings,
                new MigrationMetrics(meterRegistry, settings.keyspace()),
                Clock.systemUTC());
    }

    /** Phase of the current or last run. */
    public MigrationState state() {
        return state;
    }

    /** Store the engine reads and records to; shared with {@link MigrationInfoService}. */
    public TrackingStore trackingStore() {
        return trackingStore;
    }

    /** Settings the engine was created with. */
    public MigrationSettings settings() {
        return settings;
    }

    /**
     * Applies every pending script of the registry.
     *
     * @return the versions applied by this run, empty if the keyspace was up to date
     * @throws ConnectivityException if the tracking store cannot be read; propagated as is
     * @throws TrackingStoreMissingException if there is no tracking table and the registry does not
     *     start with the bootstrap script; propagated as is
     * @throws ChecksumMismatchException if an applied script was edited afterwards
     * @throws MigrationFailedException if a script could not be applied or recorded
     */
    public MigrationReport migrate(MigrationResources resources) {
        Objects.requireNonNull(resources, "resources must not be null");
        long started = System.nanoTime();
        Run run = new Run(started);

        transition(MigrationState.LOADING_STATE);
        List<TrackingRecord> records = loadRecords(resources, run);
        if (settings.validateChecksums()) {
            validateChecksums(resources, records);
        }

        transition(MigrationState.COMPUTING_PENDING);
        TreeSet<Integer> applied = new TreeSet<>();
        records.forEach(r -> applied.add(r.version()));
        warnUnknownVersions(resources, applied);
        run.lastApplied = applied.isEmpty() ? null : applied.last();
        List<MigrationScript> pending = resources.scripts().stream()
                .filter(s -> !applied.contains(s.version()))
                .toList();
        if (pending.isEmpty()) {
            transition(MigrationState.DONE);
            log.info("Keyspace {} is up to date ({} migration(s) applied, current version {})",
                    settings.keyspace(), applied.size(), run.lastApplied);
            return MigrationReport.empty();
        }
        warnOutOfOrder(pending, run.lastApplied);
        log.info("{} pending migration(s) for keyspace {}: {}", pending.size(), settings.keyspace(),
                pending.stream().map(MigrationScript::version).toList());

        transition(MigrationState.APPLYING);
        try {
            applyPending(pending, run);
        } catch (MigrationFailedException e) {
            transition(MigrationState.FAILED);
            throw e;
        }

        transition(MigrationState.DONE);
        MigrationReport report = new MigrationReport(run.applied, run.skipped, Duration.ofNanos(System.nanoTime() - started));
        log.info("Migrated keyspace {} to version {}: applied {}, skipped {} in {} ms", settings.keyspace(),
                run.lastApplied, report.appliedVersions(), report.skippedVersions(), report.elapsed().toMillis());
        return report;
    }

    private List<TrackingRecord> loadRecords(MigrationResources resources, Run run) {
        try {
            return trackingStore.getAppliedRecords();
        } catch (TrackingStoreMissingException e) {
            if (resources.isEmpty() || resources.first().version() != MigrationSettings.BOOTSTRAP_VERSION) {
                throw e;
            }
            log.info("No tracking table in keyspace {}; bootstrapping it with migration {} - {}",
                    settings.keyspace(), resources.first().version(), resources.first().description());
            run.bootstrapping = true;
            return List.of();
        }
    }

    private void validateChecksums(MigrationResources resources, List<TrackingRecord> records) {
        for (TrackingRecord record : records) {
            resources.find(record.version()).ifPresent(script -> {
                if (script.checksum() != null && record.checksum() != null
                        && !script.checksum().equals(record.checksum())) {
                    throw new ChecksumMismatchException(record.version(), record.checksum(), script.checksum());
                }
            });
        }
    }

    private void warnUnknownVersions(MigrationResources resources, Set<Integer> applied) {
        for (Integer version : applied) {
            if (resources.find(version).isEmpty()) {
                log.warn("Version {} is recorded in {} but not part of the registry",
                        version, settings.qualifiedTrackingTable());
            }
        }
    }

    private void warnOutOfOrder(List<MigrationScript> pending, Integer lastApplied) {
        if (lastApplied == null) {
            return;
        }
        pending.stream()
                .filter(s -> s.version() < lastApplied)
                .forEach(s -> log.warn("Migration {} is older than the current version {}; applying it out of order",
                        s.version(), lastApplied));
    }

    private void applyPending(List<MigrationScript> pending, Run run) {
        List<MigrationScript> remaining = pending;
        if (run.bootstrapping) {
            apply(pending.get(0), run);
            remaining = pending.subList(1, pending.size());
        }
        if (remaining.isEmpty()) {
            return;
        }

        MigrationLock.Lease lease;
        try {
            lease = lock.acquire();
        } catch (RuntimeException e) {
            throw run.fail(remaining.get(0).version(), lockFailure("Could not acquire migration lock", e));
        }
        try {
            Set<Integer> appliedNow;
            try {
                appliedNow = trackingStore.getAppliedVersions();
            } catch (MigrationException e) {
                throw run.fail(remaining.get(0).version(), e);
            } catch (RuntimeException e) {
                throw run.fail(remaining.get(0).version(),
                        new TrackingReadException(settings.qualifiedTrackingTable(), e));
            }
            for (MigrationScript script : remaining) {
                if (appliedNow.contains(script.version())) {
                    log.info("Migration {} was applied by another instance; skipping", script.version());
                    run.skipped.add(script.version());
                    run.advance(script.version());
                    continue;
                }
                checkNotAborted(script, run);
                renew(lease, script, run);
                apply(script, run);
            }
        } finally {
            release(lease);
        }
    }

    private void release(MigrationLock.Lease lease) {
        try {
            lease.release();
        } catch (RuntimeException e) {
            log.warn("Could not release the migration lock of keyspace {}; it is freed when the lease expires",
                    settings.keyspace(), e);
        }
    }

    private void apply(MigrationScript script, Run run) {
        int version = script.version();
        boolean bootstrap = run.bootstrapping && version == MigrationSettings.BOOTSTRAP_VERSION;
        log.info("Applying migration {} - {}", version, script.description());
        MigrationContext context = new MigrationContext(version, settings.keyspace(), executor);
        Timer.Sample sample = metrics.start();
        try {
            script.apply(context);
        } catch (Exception e) {
            throw run.fail(version, classify(version, context, e));
        }

        TrackingRecord record = new TrackingRecord(version, script.description(), clock.instant(), script.checksum());
        boolean recorded;
        try {
            recorded = trackingStore.recordApplied(record);
        } catch (RuntimeException e) {
            throw run.fail(version, new TrackingWriteException(version, e));
        }
        if (!recorded) {
            if (bootstrap) {
                log.info("Tracking store was bootstrapped concurrently by another instance");
                run.skipped.add(version);
                run.advance(version);
                return;
            }
            throw run.fail(version, new ConcurrentMigrationException(version));
        }
        metrics.applied(version, sample);
        run.applied.add(version);
        run.advance(version);
        log.info("Applied migration {} ({} statement(s))", version, context.completedStatements());
    }

    private void renew(MigrationLock.Lease lease, MigrationScript next, Run run) {
        try {
            lease.renew();
        } catch (RuntimeException e) {
            throw run.fail(next.version(), lockFailure("Could not renew migration lock", e));
        }
    }

    private static MigrationException lockFailure(String message, RuntimeException e) {
        if (e instanceof MigrationException migrationException) {
            return migrationException;
        }
        return new MigrationLockException(message + ": " + e.getMessage(), e);
    }

    /**
     * Partial only when a statement failed after earlier ones applied. An action that throws on
     * its own is a script error, carrying the number of statements it left applied.
     */
    private static MigrationException classify(int version, MigrationContext context, Exception e) {
        int completed = context.completedStatements();
        if (context.statementFailed() && completed > 0) {
            return new PartialMigrationException(version, completed, e);
        }
        if (completed == 0 && e instanceof MigrationException migrationException) {
            return migrationException;
        }
        return new MigrationScriptException(version, completed, e);
    }

    private void checkNotAborted(MigrationScript next, Run run) {
        if (Thread.currentThread().isInterrupted()) {
            throw run.fail(next.version(), new MigrationAbortedException(
                    "Run interrupted before migration " + next.version()));
        }
        if (settings.hasRunTimeout()
                && System.nanoTime() - run.started >= settings.runTimeout().toNanos()) {
            throw run.fail(next.version(), new MigrationAbortedException(
                    "Run timeout of %d ms elapsed before migration %d"
                            .formatted(settings.runTimeout().toMillis(), next.version())));
        }
    }

    private void transition(MigrationState next) {
        log.debug("Migration run for keyspace {}: {} -> {}", settings.keyspace(), state, next);
        state = next;
    }

    /** Mutable bookkeeping of one run. */
    private final class Run {

        private final long started;
        private final List<Integer> applied = new ArrayList<>();
        private final List<Integer> skipped = new ArrayList<>();
        private Integer lastApplied;
        private boolean bootstrapping;

        private Run(long started) {
            this.started = started;
        }

        private void advance(int version) {
            if (lastApplied == null || version > lastApplied) {
                lastApplied = version;
            }
        }

        private MigrationFailedException fail(int version, MigrationException cause) {
            metrics.failed(cause.kind());
            MigrationFailedException failure = new MigrationFailedException(version, lastApplied, applied, cause);
            log.error("Migration of keyspace {} stopped at version {} ({}); applied this run: {}",
                    settings.keyspace(), version, cause.kind(), applied, cause);
            return failure;
        }
    }
}
