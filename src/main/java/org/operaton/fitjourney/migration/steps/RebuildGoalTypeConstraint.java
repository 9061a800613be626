package org.operaton.fitjourney.migration.steps;

import lombok.extern.slf4j.Slf4j;
import org.operaton.fitjourney.migration.SchemaInspector;
import org.operaton.fitjourney.migration.SchemaMigration;
import org.operaton.fitjourney.migration.StoreSchema;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Widens the goal type CHECK constraint to admit WeightTarget.
 * SQLite cannot alter a CHECK in place, so the table is renamed, recreated and repopulated.
 * The old table is dropped only after every row has been copied.
 */
@Component
@Order(4)
@Slf4j
public class RebuildGoalTypeConstraint implements SchemaMigration {

    static final String BACKUP_TABLE = "goal_old";

    @Override
    public String name() {
        return "rebuild-goal-type-constraint";
    }

    @Override
    public boolean isApplicable(SchemaInspector schema) {
        return schema.tableSql("goal")
                .map(sql -> !sql.contains("'WeightTarget'"))
                .orElse(false);
    }

    @Override
    public void apply(JdbcTemplate jdbcTemplate, SchemaInspector schema) {
        jdbcTemplate.execute("ALTER TABLE goal RENAME TO " + BACKUP_TABLE);
        jdbcTemplate.execute(StoreSchema.CREATE_GOAL);

        Set<String> legacyColumns = schema.columnNames(BACKUP_TABLE);
        String columns = StoreSchema.GOAL_COLUMNS.stream()
                .filter(legacyColumns::contains)
                .collect(Collectors.joining(", "));
        jdbcTemplate.execute("INSERT INTO goal (" + columns + ") SELECT " + columns + " FROM " + BACKUP_TABLE);

        long before = schema.rowCount(BACKUP_TABLE);
        long after = schema.rowCount("goal");
        if (before != after) {
            throw new IllegalStateException(
                    "Goal rebuild copied " + after + " of " + before + " rows, keeping the original table");
        }

        jdbcTemplate.execute("DROP TABLE " + BACKUP_TABLE);
        jdbcTemplate.execute(StoreSchema.INDEX_GOAL_USER);
        log.info("Rebuilt goal table with {} rows", after);
    }
}
