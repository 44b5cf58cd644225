package com.quorum.migration.script;

import java.util.List;
import java.util.Objects;

/**
 * A migration defined as CQL text, one or more statements separated by {@code ;}.
 *
 * <p>The checksum is the SHA-256 of the source text, so editing an applied file is detected on
 * the next run.
 */
public final class CqlMigrationScript implements MigrationScript {

    private final int version;
    private final String description;
    private final List<String> statements;
    private final String checksum;

    public CqlMigrationScript(int version, String description, List<String> statements, String checksum) {
        MigrationResources.requirePositive(version);
        this.version = version;
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.statements = List.copyOf(statements);
        this.checksum = checksum;
        if (this.statements.isEmpty()) {
            throw new IllegalArgumentException("Migration %d contains no statements".formatted(version));
        }
    }

    /**
     * Builds a script from a {@code V<version>__<description>.cql} file name and its content.
     *
     * @throws IllegalArgumentException if the name is malformed or the content has no statements
     */
    public static CqlMigrationScript fromSource(String fileName, String source) {
        CqlScriptName name = CqlScriptName.parse(fileName);
        return new CqlMigrationScript(
                name.version(), name.description(), CqlScriptParser.parse(source), Checksums.sha256(source));
    }

    @Override
    public int version() {
        return version;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public String checksum() {
        return checksum;
    }

    public List<String> statements() {
        return statements;
    }

    @Override
    public void apply(MigrationContext context) {
        for (String statement : statements) {
            context.execute(statement);
        }
    }

    @Override
    public String toString() {
        return "V" + version + " " + description + " (" + statements.size() + " statement(s))";
    }
}
