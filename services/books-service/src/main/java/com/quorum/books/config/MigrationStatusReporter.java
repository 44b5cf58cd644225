package com.quorum.books.config;

import com.quorum.migration.engine.MigrationInfoService;
import com.quorum.migration.engine.MigrationInfoService.MigrationInfo;
import com.quorum.migration.engine.MigrationInfoService.MigrationStatus;
import com.quorum.migration.engine.MigrationInfoService.State;
import com.quorum.migration.script.MigrationResourcesProvider;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Logs the schema status of the keyspace once the application has started. */
@Component
public class MigrationStatusReporter implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(MigrationStatusReporter.class);

    private final MigrationInfoService infoService;
    private final MigrationResourcesProvider resourcesProvider;
    private final BooksServiceProperties properties;

    public MigrationStatusReporter(
            MigrationInfoService infoService,
            MigrationResourcesProvider resourcesProvider,
            BooksServiceProperties properties) {
        this.infoService = infoService;
        this.resourcesProvider = resourcesProvider;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        report();
    }

    /** Logs the status and returns it. */
    public MigrationStatus report() {
        List<MigrationInfo> infos = infoService.info(resourcesProvider.load());
        MigrationStatus status = infoService.status(infos);
        log.info("{} ({}): keyspace {} at version {}, {} applied, {} pending",
                properties.name(), properties.environment(), status.keyspace(), status.currentVersion(),
                status.appliedMigrations(), status.pendingMigrations());
        for (MigrationInfo info : infos) {
            if (info.state() == State.CHECKSUM_MISMATCH || info.state() == State.UNKNOWN) {
                log.warn("Migration {} - {} is {}", info.version(), info.description(), info.state());
            }
        }
        return status;
    }
}
