package com.quorum.migration.error;

/** Thrown while building a registry that contains two scripts with the same version. */
public class DuplicateVersionException extends MigrationException {

    private final int version;

    public DuplicateVersionException(int version, String firstDescription, String secondDescription) {
        super("Duplicate migration version %d: '%s' and '%s'"
                .formatted(version, firstDescription, secondDescription));
        this.version = version;
    }

    public int version() {
        return version;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.DUPLICATE_VERSION;
    }
}
