package org.operaton.fitjourney.model.converter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.fitjourney.model.entity.DailyLog;
import org.operaton.fitjourney.model.entity.Goal;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the text and integer encodings used in the SQLite store.
 */
class StorageConverterTest {

    private final IsoDateTimeConverter dateTimeConverter = new IsoDateTimeConverter();
    private final IsoDateConverter dateConverter = new IsoDateConverter();
    private final GoalKindConverter goalKindConverter = new GoalKindConverter();
    private final ActivityKindConverter activityKindConverter = new ActivityKindConverter();
    private final GoalStateConverter goalStateConverter = new GoalStateConverter();

    @Test
    @DisplayName("Should read SQLite CURRENT_TIMESTAMP values")
    void readsSqliteTimestampDefault() {
        assertEquals(LocalDateTime.of(2024, 3, 15, 7, 45, 12),
                dateTimeConverter.convertToEntityAttribute("2024-03-15 07:45:12"));
        assertEquals(LocalDateTime.of(2024, 3, 15, 0, 0),
                dateTimeConverter.convertToEntityAttribute("2024-03-15"));
        assertNull(dateTimeConverter.convertToEntityAttribute(" "));
    }

    @Test
    @DisplayName("Should store dates as ISO text")
    void storesIsoDates() {
        assertEquals("2024-02-29", dateConverter.convertToDatabaseColumn(LocalDate.of(2024, 2, 29)));
        assertEquals(LocalDate.of(2024, 2, 29), dateConverter.convertToEntityAttribute("2024-02-29"));
    }

    @Test
    @DisplayName("Should map enums to the labels used by the CHECK constraints")
    void mapsStorageLabels() {
        assertEquals("WeightTarget", goalKindConverter.convertToDatabaseColumn(Goal.GoalKind.WEIGHT_TARGET));
        assertEquals(Goal.GoalKind.WORKOUT_FREQUENCY, goalKindConverter.convertToEntityAttribute("WorkoutFrequency"));
        assertEquals("rest", activityKindConverter.convertToDatabaseColumn(DailyLog.ActivityKind.REST));
        assertThrows(IllegalArgumentException.class, () -> activityKindConverter.convertToEntityAttribute("nap"));
    }

    @Test
    @DisplayName("Should encode goal states as integer codes")
    void encodesGoalStates() {
        assertEquals(0, goalStateConverter.convertToDatabaseColumn(Goal.GoalState.ACTIVE));
        assertEquals(2, goalStateConverter.convertToDatabaseColumn(Goal.GoalState.EXPIRED));
        assertEquals(Goal.GoalState.ACHIEVED, goalStateConverter.convertToEntityAttribute(1));
    }
}
