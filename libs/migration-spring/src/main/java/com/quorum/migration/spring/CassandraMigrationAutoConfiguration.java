package com.quorum.migration.spring;

import com.datastax.oss.driver.api.core.CqlSession;
import com.quorum.migration.MigrationSettings;
import com.quorum.migration.engine.MigrationEngine;
import com.quorum.migration.engine.MigrationInfoService;
import com.quorum.migration.script.MigrationResourcesProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.cassandra.CassandraAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternUtils;

/**
 * Runs the Cassandra migrations of the application when the context starts.
 *
 * <p>Applied after Spring Boot's {@link CassandraAutoConfiguration} and wired on the
 * {@link CqlSession} it exposes; this configuration never opens a session itself. Every bean
 * backs off when the application defines its own.
 *
 * <h2>Bean Names</h2>
 *
 * <ul>
 *   <li>{@link #ENGINE_BEAN}: the {@link MigrationEngine}
 *   <li>{@link #INITIALIZER_BEAN}: the startup run
 * </ul>
 *
 * <p>Disable with {@code quorum.cassandra.migration.enabled=false}.
 *
 * @see CassandraMigrationProperties
 */
@AutoConfiguration(after = CassandraAutoConfiguration.class)
@ConditionalOnClass(CqlSession.class)
@ConditionalOnProperty(prefix = CassandraMigrationProperties.PREFIX, name = "enabled", havingValue = "true",
        matchIfMissing = true)
@EnableConfigurationProperties(CassandraMigrationProperties.class)
public class CassandraMigrationAutoConfiguration {

    /** Name of the {@link MigrationEngine} bean. */
    public static final String ENGINE_BEAN = "cassandraMigrationEngine";

    /** Name of the bean that runs the migrations at startup. */
    public static final String INITIALIZER_BEAN = "cassandraMigrationInitializer";

    /** Engine settings derived from {@code quorum.cassandra.migration.*}. */
    @Bean
    @ConditionalOnMissingBean
    public MigrationSettings cassandraMigrationSettings(CassandraMigrationProperties properties) {
        return properties.toSettings();
    }

    /**
     * Engine on the application's session. Meters go to the application's registry when there is
     * one.
     */
    @Bean(name = ENGINE_BEAN)
    @ConditionalOnMissingBean
    public MigrationEngine cassandraMigrationEngine(
            CqlSession session, MigrationSettings settings, ObjectProvider<MeterRegistry> meterRegistry) {
        return MigrationEngine.create(session, settings, meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    /**
     * Loads {@code V<n>__<description>.cql} files from the configured locations. The tracking
     * table's bootstrap script is added as version 1 unless
     * {@code bootstrap-tracking-table} is false.
     */
    @Bean
    @ConditionalOnMissingBean
    public MigrationResourcesProvider cassandraMigrationResourcesProvider(
            CassandraMigrationProperties properties, MigrationEngine engine, ResourceLoader resourceLoader) {
        return new ClasspathCqlMigrationResourcesProvider(
                ResourcePatternUtils.getResourcePatternResolver(resourceLoader),
                properties.locations(),
                properties.bootstrapTrackingTable() ? engine.trackingStore().bootstrapScript() : null);
    }

    /** Read-only status view sharing the engine's tracking store. */
    @Bean
    @ConditionalOnMissingBean
    public MigrationInfoService cassandraMigrationInfoService(MigrationEngine engine) {
        return new MigrationInfoService(engine.trackingStore(), engine.settings().keyspace());
    }

    /**
     * Runs the engine while the context starts. A failed run fails the startup, so the
     * application never serves traffic on a schema it does not expect.
     */
    @Bean(name = INITIALIZER_BEAN)
    @ConditionalOnMissingBean
    public CassandraMigrationInitializer cassandraMigrationInitializer(
            MigrationEngine engine, MigrationResourcesProvider resourcesProvider) {
        return new CassandraMigrationInitializer(engine, resourcesProvider);
    }
}
