package com.quorum.migration.spring;

import com.quorum.migration.script.CqlMigrationScript;
import com.quorum.migration.script.CqlScriptName;
import com.quorum.migration.script.MigrationResources;
import com.quorum.migration.script.MigrationResourcesProvider;
import com.quorum.migration.script.MigrationScript;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;

/**
 * Loads {@code V<version>__<description>.cql} files from Spring resource locations.
 *
 * <p>{@code classpath:} locations are searched in every classpath root, so scripts may live in
 * a library jar as well as in the application. The same version found twice fails the load.
 */
public class ClasspathCqlMigrationResourcesProvider implements MigrationResourcesProvider {

    private static final Logger log = LoggerFactory.getLogger(ClasspathCqlMigrationResourcesProvider.class);

    private final ResourcePatternResolver resolver;
    private final List<String> locations;
    private final MigrationScript bootstrapScript;

    /**
     * @param resolver resolves location patterns
     * @param locations directories to scan, e.g. {@code classpath:db/cassandra/migration}
     * @param bootstrapScript script added as the first version, or null
     */
    public ClasspathCqlMigrationResourcesProvider(
            ResourcePatternResolver resolver, List<String> locations, MigrationScript bootstrapScript) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.locations = List.copyOf(locations);
        this.bootstrapScript = bootstrapScript;
    }

    @Override
    public MigrationResources load() {
        MigrationResources.Builder builder = MigrationResources.builder();
        if (bootstrapScript != null) {
            builder.add(bootstrapScript);
        }
        for (String location : locations) {
            String pattern = pattern(location);
            Resource[] resources;
            try {
                resources = resolver.getResources(pattern);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot scan migration location " + location, e);
            }
            if (resources.length == 0) {
                log.warn("No migration scripts found in {}", location);
            }
            for (Resource resource : resources) {
                builder.add(CqlMigrationScript.fromSource(resource.getFilename(), read(resource)));
            }
        }
        MigrationResources loaded = builder.build();
        log.info("Loaded {} migration(s) from {}: {}", loaded.size(), locations, loaded.versions());
        return loaded;
    }

    static String pattern(String location) {
        String base = location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
        if (base.startsWith(ResourcePatternResolver.CLASSPATH_URL_PREFIX)) {
            base = ResourcePatternResolver.CLASSPATH_ALL_URL_PREFIX
                    + base.substring(ResourcePatternResolver.CLASSPATH_URL_PREFIX.length());
        }
        return base + "/*" + CqlScriptName.SUFFIX;
    }

    private static String read(Resource resource) {
        try {
            return resource.getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read migration script " + resource.getDescription(), e);
        }
    }
}
