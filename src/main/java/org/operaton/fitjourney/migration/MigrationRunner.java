package org.operaton.fitjourney.migration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the ordered {@link SchemaMigration} steps against the store.
 * Each step runs in its own transaction. A failing step is rolled back, logged and skipped;
 * the remaining steps still run.
 */
@Component
@Slf4j
public class MigrationRunner {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final List<SchemaMigration> steps;

    public MigrationRunner(DataSource dataSource, List<SchemaMigration> steps) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.steps = List.copyOf(steps);
    }

    public MigrationReport run() {
        SchemaInspector inspector = new SchemaInspector(jdbcTemplate);
        List<String> applied = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (SchemaMigration step : steps) {
            try {
                if (!step.isApplicable(inspector)) {
                    skipped.add(step.name());
                    continue;
                }
                transactionTemplate.executeWithoutResult(status -> step.apply(jdbcTemplate, inspector));
                applied.add(step.name());
                log.info("Applied schema migration {}", step.name());
            } catch (RuntimeException e) {
                failed.add(step.name());
                log.warn("Schema migration {} failed, continuing with the schema reached so far", step.name(), e);
            }
        }

        log.info("Schema migrations complete: {} applied, {} skipped, {} failed",
                applied.size(), skipped.size(), failed.size());
        return new MigrationReport(applied, skipped, failed);
    }
}
