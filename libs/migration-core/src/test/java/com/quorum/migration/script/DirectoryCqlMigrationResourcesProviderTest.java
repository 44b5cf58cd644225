package com.quorum.migration.script;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.quorum.migration.error.DuplicateVersionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Loads versioned CQL files from a temporary directory. */
@DisplayName("DirectoryCqlMigrationResourcesProvider")
class DirectoryCqlMigrationResourcesProviderTest {

    @TempDir
    Path directory;

    @Test
    @DisplayName("loads .cql files ordered by version and ignores other files")
    void loadsScripts() throws IOException {
        Files.writeString(directory.resolve("V10__add_index.cql"), "CREATE INDEX ON t (v);");
        Files.writeString(directory.resolve("V2__create_table.cql"), "CREATE TABLE t (k int PRIMARY KEY, v text);");
        Files.writeString(directory.resolve("README.md"), "not a migration");

        var resources = new DirectoryCqlMigrationResourcesProvider(directory).load();

        assertThat(resources.versions()).containsExactly(2, 10);
        assertThat(resources.find(2)).get().extracting(MigrationScript::description).isEqualTo("create table");
    }

    @Test
    @DisplayName("adds the bootstrap script when given one")
    void addsBootstrap() throws IOException {
        Files.writeString(directory.resolve("V2__create_table.cql"), "CREATE TABLE t (k int PRIMARY KEY);");
        var bootstrap = MigrationScript.of(1, "initialize migration tracking", context -> {});

        var resources = new DirectoryCqlMigrationResourcesProvider(directory, bootstrap).load();

        assertThat(resources.versions()).containsExactly(1, 2);
        assertThat(resources.first()).isSameAs(bootstrap);
    }

    @Test
    @DisplayName("fails on two files with the same version")
    void failsOnDuplicates() throws IOException {
        Files.writeString(directory.resolve("V2__one.cql"), "CREATE TABLE a (k int PRIMARY KEY);");
        Files.writeString(directory.resolve("V02__two.cql"), "CREATE TABLE b (k int PRIMARY KEY);");

        assertThatThrownBy(() -> new DirectoryCqlMigrationResourcesProvider(directory).load())
                .isInstanceOf(DuplicateVersionException.class);
    }

    @Test
    @DisplayName("fails when the directory does not exist")
    void failsOnMissingDirectory() {
        var missing = directory.resolve("nope");

        assertThatThrownBy(() -> new DirectoryCqlMigrationResourcesProvider(missing).load())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not exist");
    }
}
