package org.operaton.fitjourney.migration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.operaton.fitjourney.migration.steps.AddDailyLogNotesColumn;
import org.operaton.fitjourney.migration.steps.AddGoalWeightColumns;
import org.operaton.fitjourney.migration.steps.AddStreakLastWorkoutDate;
import org.operaton.fitjourney.migration.steps.AddSyncQueueRetryColumns;
import org.operaton.fitjourney.migration.steps.NormalizeLegacyDates;
import org.operaton.fitjourney.migration.steps.RebuildGoalTypeConstraint;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Upgrades a store created with the first schema version and checks that data survives.
 */
class MigrationRunnerTest {

    private static final List<String> LEGACY_SCHEMA = List.of(
            """
            CREATE TABLE users (
              user_id    TEXT PRIMARY KEY,
              first_name TEXT NOT NULL,
              last_name  TEXT NOT NULL
            )""",
            """
            CREATE TABLE exercise (
              exercise_id  INTEGER PRIMARY KEY AUTOINCREMENT,
              name         TEXT NOT NULL,
              muscle_group TEXT,
              description  TEXT
            )""",
            """
            CREATE TABLE workout (
              workout_id INTEGER PRIMARY KEY AUTOINCREMENT,
              user_id    TEXT NOT NULL,
              date       DATE NOT NULL,
              duration   INTEGER,
              notes      TEXT,
              FOREIGN KEY (user_id) REFERENCES users(user_id)
            )""",
            """
            CREATE TABLE goal (
              goal_id          INTEGER PRIMARY KEY AUTOINCREMENT,
              user_id          TEXT NOT NULL,
              type             TEXT NOT NULL CHECK (type IN ('ExerciseTarget','WorkoutFrequency')),
              exercise_id      INTEGER,
              target_value     REAL,
              start_date       DATE NOT NULL,
              end_date         DATE NOT NULL,
              achieved         BOOLEAN DEFAULT FALSE,
              current_progress REAL DEFAULT 0,
              FOREIGN KEY (user_id) REFERENCES users(user_id),
              FOREIGN KEY (exercise_id) REFERENCES exercise(exercise_id),
              CHECK (
                (type = 'ExerciseTarget' AND exercise_id IS NOT NULL) OR
                (type = 'WorkoutFrequency' AND exercise_id IS NULL)
              )
            )""",
            """
            CREATE TABLE daily_log (
              daily_log_id  INTEGER PRIMARY KEY AUTOINCREMENT,
              user_id       TEXT NOT NULL,
              date          DATE NOT NULL,
              activity_type TEXT NOT NULL CHECK (activity_type IN ('workout','rest')),
              FOREIGN KEY (user_id) REFERENCES users(user_id),
              UNIQUE (user_id, date)
            )""",
            """
            CREATE TABLE streak (
              user_id            TEXT PRIMARY KEY,
              current_streak     INT DEFAULT 0,
              longest_streak     INT DEFAULT 0,
              last_activity_date DATE,
              FOREIGN KEY (user_id) REFERENCES users(user_id)
            )""",
            """
            CREATE TABLE sync_queue (
              id         INTEGER PRIMARY KEY AUTOINCREMENT,
              table_name TEXT NOT NULL,
              record_id  TEXT NOT NULL,
              operation  TEXT NOT NULL,
              timestamp  INTEGER NOT NULL,
              synced     BOOLEAN DEFAULT FALSE,
              UNIQUE(table_name, record_id, operation)
            )""",
            "CREATE INDEX idx_goal_user ON goal(user_id)"
    );

    @TempDir
    Path tempDir;

    private SQLiteDataSource dataSource;
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("legacy.db"));
        jdbcTemplate = new JdbcTemplate(dataSource);

        LEGACY_SCHEMA.forEach(jdbcTemplate::execute);
        jdbcTemplate.update("INSERT INTO users (user_id, first_name, last_name) VALUES ('u1', 'Ada', 'Lovelace')");
        jdbcTemplate.update("INSERT INTO exercise (name, muscle_group) VALUES ('Bench Press', 'Chest')");
        jdbcTemplate.update("INSERT INTO goal (user_id, type, exercise_id, target_value, start_date, end_date, achieved, current_progress) "
                + "VALUES ('u1', 'ExerciseTarget', 1, 100, '2024-01-01', '2024-02-01', 1, 100)");
        jdbcTemplate.update("INSERT INTO goal (user_id, type, target_value, start_date, end_date, current_progress) "
                + "VALUES ('u1', 'WorkoutFrequency', 12, '2024-03-01T00:00:00.000', '2024-03-31T00:00:00.000', 4)");
        jdbcTemplate.update("INSERT INTO workout (user_id, date, duration) VALUES ('u1', '2024-03-05T00:00:00.000', 45)");
        jdbcTemplate.update("INSERT INTO workout (user_id, date, duration) VALUES ('u1', '2024-03-31T00:00:00.000', 30)");
        jdbcTemplate.update("INSERT INTO daily_log (user_id, date, activity_type) VALUES ('u1', '2024-03-04', 'workout')");
        jdbcTemplate.update("INSERT INTO daily_log (user_id, date, activity_type) VALUES ('u1', '2024-03-05T00:00:00.000', 'workout')");
        jdbcTemplate.update("INSERT INTO daily_log (user_id, date, activity_type) VALUES ('u1', '2024-03-06', 'rest')");
        jdbcTemplate.update("INSERT INTO streak (user_id, current_streak, longest_streak, last_activity_date) "
                + "VALUES ('u1', 3, 5, '2024-03-06T00:00:00.000')");
    }

    @Test
    @DisplayName("Should upgrade a first-version store and keep every row")
    void run_ShouldUpgradeLegacyStore() {
        // When
        MigrationReport report = newRunner().run();

        // Then
        assertFalse(report.hasFailures(), () -> "Failed steps: " + report.failed());
        assertThat(report.applied()).containsExactly(
                "add-daily-log-notes",
                "add-streak-last-workout-date",
                "add-goal-weight-columns",
                "rebuild-goal-type-constraint",
                "add-sync-queue-retry-columns",
                "normalize-legacy-dates");

        SchemaInspector inspector = new SchemaInspector(jdbcTemplate);
        assertTrue(inspector.hasColumn("daily_log", "notes"));
        assertTrue(inspector.hasColumn("sync_queue", "retry_count"));
        assertTrue(inspector.hasColumn("sync_queue", "last_error"));
        assertFalse(inspector.tableExists("goal_old"));
        assertEquals(2, inspector.rowCount("goal"));
        assertEquals(3, inspector.rowCount("daily_log"));

        assertEquals("2024-03-05", jdbcTemplate.queryForObject(
                "SELECT last_workout_date FROM streak WHERE user_id = 'u1'", String.class));
        assertEquals("2024-02-01", jdbcTemplate.queryForObject(
                "SELECT achieved_date FROM goal WHERE type = 'ExerciseTarget'", String.class));
        assertNull(jdbcTemplate.queryForObject(
                "SELECT achieved_date FROM goal WHERE type = 'WorkoutFrequency'", String.class));
        assertEquals(4.0, jdbcTemplate.queryForObject(
                "SELECT current_progress FROM goal WHERE type = 'WorkoutFrequency'", Double.class));
    }

    @Test
    @DisplayName("Should cut date-time values in date columns back to the day")
    void run_ShouldNormalizeLegacyDateTimes() {
        // When
        newRunner().run();

        // Then
        assertEquals(List.of("2024-03-05", "2024-03-31"), jdbcTemplate.queryForList(
                "SELECT date FROM workout ORDER BY workout_id", String.class));
        assertEquals("2024-03-05", jdbcTemplate.queryForObject(
                "SELECT date FROM daily_log WHERE activity_type = 'workout' AND date > '2024-03-04'", String.class));
        assertEquals("2024-03-06", jdbcTemplate.queryForObject(
                "SELECT last_activity_date FROM streak WHERE user_id = 'u1'", String.class));
        assertEquals("2024-03-31", jdbcTemplate.queryForObject(
                "SELECT end_date FROM goal WHERE type = 'WorkoutFrequency'", String.class));

        // The last day of a range now matches by text comparison
        assertEquals(2, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM workout WHERE user_id = 'u1' AND date >= ? AND date <= ?",
                Integer.class, "2024-03-01", "2024-03-31"));
    }

    @Test
    @DisplayName("Should admit WeightTarget goals after the rebuild")
    void run_ShouldWidenGoalTypeConstraint() {
        newRunner().run();

        int inserted = jdbcTemplate.update("INSERT INTO goal (user_id, type, target_value, start_date, end_date, starting_weight) "
                + "VALUES ('u1', 'WeightTarget', 80, '2024-03-01', '2024-06-01', 90)");

        assertEquals(1, inserted);
        assertTrue(new SchemaInspector(jdbcTemplate).tableSql("goal").orElseThrow().contains("'WeightTarget'"));
        assertEquals(1, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM sqlite_master WHERE type = 'index' AND name = 'idx_goal_user'", Integer.class));
    }

    @Test
    @DisplayName("Should skip every step on a store that is already current")
    void run_Twice_ShouldBeNoOp() {
        newRunner().run();

        MigrationReport second = newRunner().run();

        assertTrue(second.applied().isEmpty());
        assertEquals(6, second.skipped().size());
        assertFalse(second.hasFailures());
    }

    @Test
    @DisplayName("Should roll back a failing step and still run the following ones")
    void run_WithFailingStep_ShouldContinue() {
        // Given
        SchemaMigration broken = new SchemaMigration() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public boolean isApplicable(SchemaInspector schema) {
                return true;
            }

            @Override
            public void apply(JdbcTemplate template, SchemaInspector schema) {
                template.execute("CREATE TABLE half_done (id INTEGER)");
                throw new IllegalStateException("boom");
            }
        };
        List<SchemaMigration> steps = new ArrayList<>();
        steps.add(broken);
        steps.add(new AddDailyLogNotesColumn());

        // When
        MigrationReport report = new MigrationRunner(dataSource, steps).run();

        // Then
        assertEquals(List.of("broken"), report.failed());
        assertEquals(List.of("add-daily-log-notes"), report.applied());
        assertFalse(new SchemaInspector(jdbcTemplate).tableExists("half_done"));
    }

    private MigrationRunner newRunner() {
        return new MigrationRunner(dataSource, List.of(
                new AddDailyLogNotesColumn(),
                new AddStreakLastWorkoutDate(),
                new AddGoalWeightColumns(),
                new RebuildGoalTypeConstraint(),
                new AddSyncQueueRetryColumns(),
                new NormalizeLegacyDates()));
    }
}
