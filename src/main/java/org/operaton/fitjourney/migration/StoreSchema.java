package org.operaton.fitjourney.migration;

import java.util.List;

/**
 * DDL of the current store layout. Every statement is idempotent.
 * Parent tables come before the tables referencing them.
 */
public final class StoreSchema {

    public static final String CREATE_USERS = """
            CREATE TABLE IF NOT EXISTS users (
              user_id           TEXT PRIMARY KEY,
              first_name        TEXT NOT NULL,
              last_name         TEXT NOT NULL,
              height_cm         REAL CHECK (height_cm > 0),
              registration_date TEXT DEFAULT CURRENT_TIMESTAMP,
              last_login        TEXT
            )""";

    public static final String CREATE_USER_METRICS = """
            CREATE TABLE IF NOT EXISTS user_metrics (
              metric_id   INTEGER PRIMARY KEY AUTOINCREMENT,
              user_id     TEXT NOT NULL,
              weight_kg   REAL NOT NULL CHECK (weight_kg > 0),
              measured_at TEXT NOT NULL DEFAULT CURRENT_TIMESTAMP,
              FOREIGN KEY (user_id) REFERENCES users(user_id)
            )""";

    public static final String CREATE_EXERCISE = """
            CREATE TABLE IF NOT EXISTS exercise (
              exercise_id  INTEGER PRIMARY KEY AUTOINCREMENT,
              name         TEXT NOT NULL,
              muscle_group TEXT,
              description  TEXT
            )""";

    public static final String CREATE_WORKOUT = """
            CREATE TABLE IF NOT EXISTS workout (
              workout_id INTEGER PRIMARY KEY AUTOINCREMENT,
              user_id    TEXT NOT NULL,
              date       TEXT NOT NULL,
              duration   INTEGER CHECK (duration IS NULL OR duration > 0),
              notes      TEXT,
              FOREIGN KEY (user_id) REFERENCES users(user_id)
            )""";

    public static final String CREATE_WORKOUT_EXERCISE = """
            CREATE TABLE IF NOT EXISTS workout_exercise (
              workout_exercise_id INTEGER PRIMARY KEY AUTOINCREMENT,
              workout_id          INTEGER NOT NULL,
              exercise_id         INTEGER NOT NULL,
              FOREIGN KEY (workout_id) REFERENCES workout(workout_id),
              FOREIGN KEY (exercise_id) REFERENCES exercise(exercise_id)
            )""";

    public static final String CREATE_WORKOUT_SET = """
            CREATE TABLE IF NOT EXISTS workout_set (
              workout_set_id      INTEGER PRIMARY KEY AUTOINCREMENT,
              workout_exercise_id INTEGER NOT NULL,
              set_number          INTEGER NOT NULL CHECK (set_number > 0),
              reps                INTEGER CHECK (reps IS NULL OR reps >= 0),
              weight              REAL,
              FOREIGN KEY (workout_exercise_id) REFERENCES workout_exercise(workout_exercise_id),
              UNIQUE (workout_exercise_id, set_number)
            )""";

    public static final String CREATE_GOAL = """
            CREATE TABLE IF NOT EXISTS goal (
              goal_id          INTEGER PRIMARY KEY AUTOINCREMENT,
              user_id          TEXT NOT NULL,
              type             TEXT NOT NULL CHECK (type IN ('ExerciseTarget','WorkoutFrequency','WeightTarget')),
              exercise_id      INTEGER,
              target_value     REAL,
              start_date       TEXT NOT NULL,
              end_date         TEXT NOT NULL,
              achieved         INTEGER NOT NULL DEFAULT 0 CHECK (achieved IN (0, 1, 2)),
              current_progress REAL NOT NULL DEFAULT 0,
              starting_weight  REAL,
              achieved_date    TEXT,
              FOREIGN KEY (user_id) REFERENCES users(user_id),
              FOREIGN KEY (exercise_id) REFERENCES exercise(exercise_id),
              CHECK (
                (type = 'ExerciseTarget' AND exercise_id IS NOT NULL) OR
                (type IN ('WorkoutFrequency','WeightTarget') AND exercise_id IS NULL)
              )
            )""";

    /**
     * Columns of the current goal table, in declaration order.
     */
    public static final List<String> GOAL_COLUMNS = List.of(
            "goal_id", "user_id", "type", "exercise_id", "target_value", "start_date", "end_date",
            "achieved", "current_progress", "starting_weight", "achieved_date");

    public static final String CREATE_DAILY_LOG = """
            CREATE TABLE IF NOT EXISTS daily_log (
              daily_log_id  INTEGER PRIMARY KEY AUTOINCREMENT,
              user_id       TEXT NOT NULL,
              date          TEXT NOT NULL,
              activity_type TEXT NOT NULL CHECK (activity_type IN ('workout','rest')),
              notes         TEXT,
              FOREIGN KEY (user_id) REFERENCES users(user_id),
              UNIQUE (user_id, date)
            )""";

    public static final String CREATE_STREAK = """
            CREATE TABLE IF NOT EXISTS streak (
              user_id            TEXT PRIMARY KEY,
              current_streak     INTEGER NOT NULL DEFAULT 0 CHECK (current_streak >= 0),
              longest_streak     INTEGER NOT NULL DEFAULT 0 CHECK (longest_streak >= 0),
              last_activity_date TEXT,
              last_workout_date  TEXT,
              FOREIGN KEY (user_id) REFERENCES users(user_id)
            )""";

    public static final String CREATE_NOTIFICATION = """
            CREATE TABLE IF NOT EXISTS notification (
              notification_id INTEGER PRIMARY KEY AUTOINCREMENT,
              user_id         TEXT NOT NULL,
              type            TEXT NOT NULL CHECK (type IN ('GoalProgress','NewStreak','Milestone')),
              message         TEXT NOT NULL,
              timestamp       TEXT NOT NULL DEFAULT CURRENT_TIMESTAMP,
              is_read         INTEGER NOT NULL DEFAULT 0,
              FOREIGN KEY (user_id) REFERENCES users(user_id)
            )""";

    public static final String CREATE_MILESTONE = """
            CREATE TABLE IF NOT EXISTS milestone (
              milestone_id INTEGER PRIMARY KEY AUTOINCREMENT,
              user_id      TEXT NOT NULL,
              type         TEXT NOT NULL CHECK (type IN ('PersonalBest','LongestStreak','GoalAchieved')),
              exercise_id  INTEGER,
              value        REAL,
              date         TEXT NOT NULL,
              FOREIGN KEY (user_id) REFERENCES users(user_id),
              FOREIGN KEY (exercise_id) REFERENCES exercise(exercise_id)
            )""";

    public static final String CREATE_SYNC_QUEUE = """
            CREATE TABLE IF NOT EXISTS sync_queue (
              id          INTEGER PRIMARY KEY AUTOINCREMENT,
              table_name  TEXT NOT NULL,
              record_id   TEXT NOT NULL,
              operation   TEXT NOT NULL CHECK (operation IN ('INSERT','UPDATE','DELETE')),
              timestamp   INTEGER NOT NULL,
              synced      INTEGER NOT NULL DEFAULT 0,
              retry_count INTEGER DEFAULT 0,
              last_error  TEXT,
              UNIQUE (table_name, record_id, operation)
            )""";

    public static final String INDEX_GOAL_USER =
            "CREATE INDEX IF NOT EXISTS idx_goal_user ON goal(user_id)";

    public static final List<String> TABLES = List.of(
            CREATE_USERS,
            CREATE_USER_METRICS,
            CREATE_EXERCISE,
            CREATE_WORKOUT,
            CREATE_WORKOUT_EXERCISE,
            CREATE_WORKOUT_SET,
            CREATE_GOAL,
            CREATE_DAILY_LOG,
            CREATE_STREAK,
            CREATE_NOTIFICATION,
            CREATE_MILESTONE,
            CREATE_SYNC_QUEUE
    );

    public static final List<String> INDEXES = List.of(
            "CREATE INDEX IF NOT EXISTS idx_workout_user_date ON workout(user_id, date)",
            "CREATE INDEX IF NOT EXISTS idx_workout_exercise_workout ON workout_exercise(workout_id)",
            "CREATE INDEX IF NOT EXISTS idx_workout_set_parent ON workout_set(workout_exercise_id)",
            INDEX_GOAL_USER,
            "CREATE INDEX IF NOT EXISTS idx_milestone_user ON milestone(user_id)"
    );

    private StoreSchema() {
    }
}
