package org.operaton.fitjourney.migration;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Brings the store to the current layout when the application starts.
 * Missing tables and indexes are created; a failure there aborts startup.
 * Upgrades of existing tables are delegated to the {@link MigrationRunner} and never abort startup.
 */
@Component
@Slf4j
public class SchemaManager {

    private final JdbcTemplate jdbcTemplate;
    private final MigrationRunner migrationRunner;

    @Getter
    private MigrationReport lastReport;

    public SchemaManager(DataSource dataSource, MigrationRunner migrationRunner) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.migrationRunner = migrationRunner;
    }

    @PostConstruct
    public void initialize() {
        log.info("Checking store schema");
        StoreSchema.TABLES.forEach(jdbcTemplate::execute);
        lastReport = migrationRunner.run();
        StoreSchema.INDEXES.forEach(jdbcTemplate::execute);
        if (lastReport.hasFailures()) {
            log.warn("Store opened with failed migrations: {}", lastReport.failed());
        }
    }
}
