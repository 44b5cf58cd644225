package com.quorum.migration.spring;

import com.quorum.migration.engine.MigrationEngine;
import com.quorum.migration.engine.MigrationReport;
import com.quorum.migration.script.MigrationResourcesProvider;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;

/**
 * Migrates the keyspace while the application context is being refreshed.
 *
 * <p>Beans that depend on this one see the schema at its latest version. A failed migration
 * propagates and aborts the startup.
 */
public class CassandraMigrationInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(CassandraMigrationInitializer.class);

    private final MigrationEngine engine;
    private final MigrationResourcesProvider resourcesProvider;
    private volatile MigrationReport report;

    public CassandraMigrationInitializer(MigrationEngine engine, MigrationResourcesProvider resourcesProvider) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.resourcesProvider = Objects.requireNonNull(resourcesProvider, "resourcesProvider must not be null");
    }

    @Override
    public void afterPropertiesSet() {
        log.info("Running Cassandra migrations for keyspace {}", engine.settings().keyspace());
        report = engine.migrate(resourcesProvider.load());
    }

    /** Outcome of the startup run, null before it happened. */
    public MigrationReport report() {
        return report;
    }
}
