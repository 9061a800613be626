package org.operaton.fitjourney.migration;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * One additive schema upgrade step.
 * Implementations must report themselves as not applicable once applied, so reruns are no-ops.
 */
public interface SchemaMigration {

    /**
     * Stable step name used in logs and in the {@link MigrationReport}.
     */
    String name();

    boolean isApplicable(SchemaInspector schema);

    /**
     * Apply the step. Runs inside its own transaction; throwing rolls the step back.
     */
    void apply(JdbcTemplate jdbcTemplate, SchemaInspector schema);
}
