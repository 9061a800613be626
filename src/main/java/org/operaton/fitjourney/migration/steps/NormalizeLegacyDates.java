package org.operaton.fitjourney.migration.steps;

import lombok.extern.slf4j.Slf4j;
import org.operaton.fitjourney.migration.SchemaInspector;
import org.operaton.fitjourney.migration.SchemaMigration;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * First-version stores wrote date-only fields as full date-times ({@code 2024-03-15T00:00:00.000}).
 * Range queries and per-day lookups compare text, so those values are cut back to the day.
 */
@Component
@Order(6)
@Slf4j
public class NormalizeLegacyDates implements SchemaMigration {

    private static final int DAY_LENGTH = "yyyy-MM-dd".length();

    static final List<DateColumn> DATE_COLUMNS = List.of(
            new DateColumn("workout", "date"),
            new DateColumn("daily_log", "date"),
            new DateColumn("goal", "start_date"),
            new DateColumn("goal", "end_date"),
            new DateColumn("goal", "achieved_date"),
            new DateColumn("streak", "last_activity_date"),
            new DateColumn("streak", "last_workout_date"),
            new DateColumn("milestone", "date")
    );

    @Override
    public String name() {
        return "normalize-legacy-dates";
    }

    @Override
    public boolean isApplicable(SchemaInspector schema) {
        return DATE_COLUMNS.stream()
                .filter(column -> column.existsIn(schema))
                .anyMatch(column -> schema.countLongerThan(column.table(), column.column(), DAY_LENGTH) > 0);
    }

    @Override
    public void apply(JdbcTemplate jdbcTemplate, SchemaInspector schema) {
        for (DateColumn column : DATE_COLUMNS) {
            if (!column.existsIn(schema)) {
                continue;
            }
            int updated = jdbcTemplate.update(
                    "UPDATE " + column.table() + " SET " + column.column() + " = substr(" + column.column() + ", 1, ?) " +
                    "WHERE length(" + column.column() + ") > ?",
                    DAY_LENGTH, DAY_LENGTH);
            if (updated > 0) {
                log.info("Cut {} values of {}.{} back to the day", updated, column.table(), column.column());
            }
        }
    }

    record DateColumn(String table, String column) {

        boolean existsIn(SchemaInspector schema) {
            return schema.hasColumn(table, column);
        }
    }
}
