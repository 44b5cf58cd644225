package com.quorum.migration.script;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@code V<version>__<description>.cql} files from a filesystem directory (not recursive).
 *
 * <p>When a bootstrap script is supplied it is added to the registry, so the tracking table gets
 * created on a fresh keyspace.
 */
public final class DirectoryCqlMigrationResourcesProvider implements MigrationResourcesProvider {

    private static final Logger log = LoggerFactory.getLogger(DirectoryCqlMigrationResourcesProvider.class);

    private final Path directory;
    private final MigrationScript bootstrapScript;

    public DirectoryCqlMigrationResourcesProvider(Path directory) {
        this(directory, null);
    }

    public DirectoryCqlMigrationResourcesProvider(Path directory, MigrationScript bootstrapScript) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.bootstrapScript = bootstrapScript;
    }

    @Override
    public MigrationResources load() {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Migration directory does not exist: " + directory);
        }
        MigrationResources.Builder builder = MigrationResources.builder();
        if (bootstrapScript != null) {
            builder.add(bootstrapScript);
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(CqlScriptName.SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list migration directory " + directory, e);
        }
        for (Path file : files) {
            builder.add(CqlMigrationScript.fromSource(file.getFileName().toString(), read(file)));
        }
        MigrationResources resources = builder.build();
        log.info("Loaded {} migration(s) from {}: {}", resources.size(), directory, resources.versions());
        return resources;
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read migration file " + file, e);
        }
    }
}
