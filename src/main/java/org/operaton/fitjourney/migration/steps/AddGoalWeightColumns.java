package org.operaton.fitjourney.migration.steps;

import org.operaton.fitjourney.migration.SchemaInspector;
import org.operaton.fitjourney.migration.SchemaMigration;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Adds the WeightTarget baseline and the achievement date to goals.
 * Goals already achieved get their end date as achievement date.
 */
@Component
@Order(3)
public class AddGoalWeightColumns implements SchemaMigration {

    @Override
    public String name() {
        return "add-goal-weight-columns";
    }

    @Override
    public boolean isApplicable(SchemaInspector schema) {
        return schema.isMissingColumn("goal", "starting_weight")
                || schema.isMissingColumn("goal", "achieved_date");
    }

    @Override
    public void apply(JdbcTemplate jdbcTemplate, SchemaInspector schema) {
        if (!schema.hasColumn("goal", "starting_weight")) {
            jdbcTemplate.execute("ALTER TABLE goal ADD COLUMN starting_weight REAL");
            jdbcTemplate.update(
                    "UPDATE goal SET starting_weight = current_progress " +
                    "WHERE type = 'WeightTarget' AND starting_weight IS NULL");
        }
        if (!schema.hasColumn("goal", "achieved_date")) {
            jdbcTemplate.execute("ALTER TABLE goal ADD COLUMN achieved_date TEXT");
            jdbcTemplate.update(
                    "UPDATE goal SET achieved_date = end_date " +
                    "WHERE achieved = 1 AND achieved_date IS NULL");
        }
    }
}
