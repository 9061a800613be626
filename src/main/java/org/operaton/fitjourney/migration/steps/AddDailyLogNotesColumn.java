package org.operaton.fitjourney.migration.steps;

import org.operaton.fitjourney.migration.SchemaInspector;
import org.operaton.fitjourney.migration.SchemaMigration;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
@Order(1)
public class AddDailyLogNotesColumn implements SchemaMigration {

    @Override
    public String name() {
        return "add-daily-log-notes";
    }

    @Override
    public boolean isApplicable(SchemaInspector schema) {
        return schema.isMissingColumn("daily_log", "notes");
    }

    @Override
    public void apply(JdbcTemplate jdbcTemplate, SchemaInspector schema) {
        jdbcTemplate.execute("ALTER TABLE daily_log ADD COLUMN notes TEXT");
    }
}
