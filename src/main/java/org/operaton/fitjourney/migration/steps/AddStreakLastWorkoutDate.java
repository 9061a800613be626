package org.operaton.fitjourney.migration.steps;

import lombok.extern.slf4j.Slf4j;
import org.operaton.fitjourney.migration.SchemaInspector;
import org.operaton.fitjourney.migration.SchemaMigration;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Adds the workout-only activity date to the streak table and fills it from the
 * latest workout entry in each user's daily log.
 */
@Component
@Order(2)
@Slf4j
public class AddStreakLastWorkoutDate implements SchemaMigration {

    @Override
    public String name() {
        return "add-streak-last-workout-date";
    }

    @Override
    public boolean isApplicable(SchemaInspector schema) {
        return schema.isMissingColumn("streak", "last_workout_date");
    }

    @Override
    public void apply(JdbcTemplate jdbcTemplate, SchemaInspector schema) {
        jdbcTemplate.execute("ALTER TABLE streak ADD COLUMN last_workout_date TEXT");
        int backfilled = jdbcTemplate.update(
                "UPDATE streak SET last_workout_date = (" +
                "  SELECT MAX(d.date) FROM daily_log d " +
                "  WHERE d.user_id = streak.user_id AND d.activity_type = 'workout'" +
                ") WHERE last_workout_date IS NULL");
        log.debug("Backfilled last_workout_date for {} streak rows", backfilled);
    }
}
