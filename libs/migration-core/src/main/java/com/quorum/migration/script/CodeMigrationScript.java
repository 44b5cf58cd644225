package com.quorum.migration.script;

import java.util.Objects;

record CodeMigrationScript(int version, String description, String checksum, MigrationAction action)
        implements MigrationScript {

    CodeMigrationScript {
        MigrationResources.requirePositive(version);
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(action, "action must not be null");
    }

    @Override
    public void apply(MigrationContext context) throws Exception {
        action.apply(context);
    }

    @Override
    public String toString() {
        return "V" + version + " " + description;
    }
}
