package org.operaton.fitjourney.migration.steps;

import org.operaton.fitjourney.migration.SchemaInspector;
import org.operaton.fitjourney.migration.SchemaMigration;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Retry bookkeeping for the sync transport.
 */
@Component
@Order(5)
public class AddSyncQueueRetryColumns implements SchemaMigration {

    @Override
    public String name() {
        return "add-sync-queue-retry-columns";
    }

    @Override
    public boolean isApplicable(SchemaInspector schema) {
        return schema.isMissingColumn("sync_queue", "retry_count")
                || schema.isMissingColumn("sync_queue", "last_error");
    }

    @Override
    public void apply(JdbcTemplate jdbcTemplate, SchemaInspector schema) {
        if (!schema.hasColumn("sync_queue", "retry_count")) {
            jdbcTemplate.execute("ALTER TABLE sync_queue ADD COLUMN retry_count INTEGER DEFAULT 0");
        }
        if (!schema.hasColumn("sync_queue", "last_error")) {
            jdbcTemplate.execute("ALTER TABLE sync_queue ADD COLUMN last_error TEXT");
        }
    }
}
