package com.quorum.migration.script;

/**
 * Strategy that produces the registry for a run: an explicit list, a directory scan, a classpath
 * scan. The engine only ever sees the resulting {@link MigrationResources}.
 */
@FunctionalInterface
public interface MigrationResourcesProvider {

    MigrationResources load();
}
