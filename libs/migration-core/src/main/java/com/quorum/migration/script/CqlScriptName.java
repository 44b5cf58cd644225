package com.quorum.migration.script;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Version and description encoded in a CQL migration file name.
 *
 * <p>Format: {@code V<version>__<description>.cql}, e.g. {@code V2__create_books_table.cql}.
 * Underscores in the description become spaces.
 *
 * @param version positive migration version
 * @param description human-readable description
 */
public record CqlScriptName(int version, String description) {

    /** File suffix of CQL migrations. */
    public static final String SUFFIX = ".cql";

    private static final Pattern FILE_NAME = Pattern.compile("V(\\d+)__(\\w+)\\.cql");

    /**
     * Parses a file name (without directory).
     *
     * @throws IllegalArgumentException if the name does not follow the convention
     */
    public static CqlScriptName parse(String fileName) {
        Matcher matcher = FILE_NAME.matcher(fileName);
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                    "Migration file '%s' does not match V<version>__<description>.cql".formatted(fileName));
        }
        int version;
        try {
            version = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Migration file '%s' has an out of range version".formatted(fileName), e);
        }
        if (version <= 0) {
            throw new IllegalArgumentException("Migration file '%s' must have a positive version".formatted(fileName));
        }
        return new CqlScriptName(version, matcher.group(2).replace('_', ' ').strip());
    }
}
