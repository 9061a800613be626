package org.operaton.fitjourney.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.fitjourney.config.MutableClock;
import org.operaton.fitjourney.config.StoreTestConfiguration;
import org.operaton.fitjourney.model.entity.DailyLog;
import org.operaton.fitjourney.model.entity.Milestone;
import org.operaton.fitjourney.model.entity.Notification;
import org.operaton.fitjourney.model.entity.Streak;
import org.operaton.fitjourney.model.entity.User;
import org.operaton.fitjourney.model.entity.Workout;
import org.operaton.fitjourney.repository.DailyLogRepository;
import org.operaton.fitjourney.repository.MilestoneRepository;
import org.operaton.fitjourney.repository.WorkoutRepository;
import org.operaton.fitjourney.service.NotificationService;
import org.operaton.fitjourney.service.StreakService;
import org.operaton.fitjourney.service.UserService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(StoreTestConfiguration.class)
class StreakIntegrationTest {

    private static final String USER_ID = "user-streak";
    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    @Autowired
    private StoreTestConfiguration.StoreCleaner storeCleaner;

    @Autowired
    private MutableClock clock;

    @Autowired
    private UserService userService;

    @Autowired
    private StreakService streakService;

    @Autowired
    private NotificationService notificationService;

    @Autowired
    private DailyLogRepository dailyLogRepository;

    @Autowired
    private MilestoneRepository milestoneRepository;

    @Autowired
    private WorkoutRepository workoutRepository;

    @BeforeEach
    void setUp() {
        storeCleaner.clean();
        userService.signIn(User.builder().id(USER_ID).firstName("Grace").lastName("Hopper").build());
    }

    @Test
    @DisplayName("Should count three consecutive days as a streak of three")
    void consecutiveDays_ShouldExtendStreak() {
        streakService.logWorkout(USER_ID, DAY);
        streakService.logWorkout(USER_ID, DAY.plusDays(1));
        Streak streak = streakService.logWorkout(USER_ID, DAY.plusDays(2));

        assertEquals(3, streak.getCurrentStreak());
        assertEquals(3, streak.getLongestStreak());
        assertEquals(DAY.plusDays(2), streak.getLastActivityDate());
    }

    @Test
    @DisplayName("Should restart at one after a gap and keep the longest streak")
    void gap_ShouldResetCurrentStreak() {
        streakService.logWorkout(USER_ID, DAY);
        streakService.logWorkout(USER_ID, DAY.plusDays(1));
        Streak streak = streakService.logWorkout(USER_ID, DAY.plusDays(3));

        assertEquals(1, streak.getCurrentStreak());
        assertEquals(2, streak.getLongestStreak());
    }

    @Test
    @DisplayName("Should count rest days as activity")
    void restDay_ShouldKeepStreakAlive() {
        streakService.logWorkout(USER_ID, DAY);
        streakService.logRest(USER_ID, DAY.plusDays(1));
        Streak streak = streakService.logWorkout(USER_ID, DAY.plusDays(2));

        assertEquals(3, streak.getCurrentStreak());
        assertEquals(DAY.plusDays(2), streak.getLastWorkoutDate());
    }

    @Test
    @DisplayName("Should never downgrade a workout day to rest")
    void restAfterWorkoutOnSameDay_ShouldKeepWorkout() {
        streakService.logWorkout(USER_ID, DAY);
        Streak streak = streakService.logRest(USER_ID, DAY);

        DailyLog dailyLog = dailyLogRepository.findByUserIdAndDate(USER_ID, DAY).orElseThrow();
        assertEquals(DailyLog.ActivityKind.WORKOUT, dailyLog.getActivityKind());
        assertEquals(1, streak.getCurrentStreak());
        assertEquals(1, dailyLogRepository.findByUserIdOrderByDateDesc(USER_ID).size());
    }

    @Test
    @DisplayName("Should upgrade a rest day to workout")
    void workoutAfterRestOnSameDay_ShouldUpgrade() {
        streakService.logRest(USER_ID, DAY);
        Streak streak = streakService.logWorkout(USER_ID, DAY);

        DailyLog dailyLog = dailyLogRepository.findByUserIdAndDate(USER_ID, DAY).orElseThrow();
        assertEquals(DailyLog.ActivityKind.WORKOUT, dailyLog.getActivityKind());
        assertEquals(1, streak.getCurrentStreak());
        assertEquals(DAY, streak.getLastWorkoutDate());
    }

    @Test
    @DisplayName("Should reset the current streak when the last activity is older than yesterday")
    void dailyCheck_ShouldBreakStaleStreak() {
        // Given
        streakService.logWorkout(USER_ID, DAY);
        streakService.logWorkout(USER_ID, DAY.plusDays(1));
        clock.setToday(DAY.plusDays(4));

        // When
        Streak streak = streakService.performDailyStreakCheck(USER_ID);

        // Then
        assertEquals(0, streak.getCurrentStreak());
        assertEquals(2, streak.getLongestStreak());
    }

    @Test
    @DisplayName("Should keep the streak when the last activity was yesterday")
    void dailyCheck_ShouldKeepStreakFromYesterday() {
        streakService.logWorkout(USER_ID, DAY);
        clock.setToday(DAY.plusDays(1));

        Streak streak = streakService.performDailyStreakCheck(USER_ID);

        assertEquals(1, streak.getCurrentStreak());
    }

    @Test
    @DisplayName("Should create a zeroed streak on first access")
    void getUserStreak_ShouldCreateEmptyRow() {
        Streak streak = streakService.getUserStreak(USER_ID);

        assertEquals(0, streak.getCurrentStreak());
        assertEquals(0, streak.getLongestStreak());
        assertNull(streak.getLastActivityDate());
    }

    @Test
    @DisplayName("Should record one milestone and one notification when reaching seven days")
    void sevenDayStreak_ShouldCreateMilestoneOnce() {
        // When
        for (int i = 0; i < 7; i++) {
            streakService.logWorkout(USER_ID, DAY.plusDays(i));
        }
        streakService.logRest(USER_ID, DAY.plusDays(6));

        // Then
        List<Milestone> milestones = milestoneRepository.findByUserIdAndKindOrderByDateDescIdDesc(
                USER_ID, Milestone.MilestoneKind.LONGEST_STREAK);
        assertEquals(1, milestones.size());
        assertEquals(7.0, milestones.get(0).getValue());

        List<Notification> notifications = notificationService.getNotifications(USER_ID);
        assertEquals(1, notifications.size());
        assertEquals(Notification.NotificationKind.NEW_STREAK, notifications.get(0).getKind());
        assertEquals("7-day streak achieved! Keep it up!", notifications.get(0).getMessage());
    }

    @Test
    @DisplayName("Should create workout logs for workout days without touching the streak")
    void regenerateDailyLogs_ShouldOnlyCreateMissingLogs() {
        // Given
        streakService.logRest(USER_ID, DAY);
        workoutRepository.save(Workout.builder().userId(USER_ID).date(DAY).build());
        workoutRepository.save(Workout.builder().userId(USER_ID).date(DAY.plusDays(2)).build());

        // When
        int changed = streakService.regenerateDailyLogs(DAY, DAY.plusDays(5));

        // Then
        assertEquals(2, changed);
        assertEquals(DailyLog.ActivityKind.WORKOUT,
                dailyLogRepository.findByUserIdAndDate(USER_ID, DAY).orElseThrow().getActivityKind());
        assertTrue(dailyLogRepository.findByUserIdAndDate(USER_ID, DAY.plusDays(2)).isPresent());
        assertEquals(1, streakService.getUserStreak(USER_ID).getCurrentStreak());
        assertEquals(0, streakService.regenerateDailyLogs(DAY, DAY.plusDays(5)));
    }
}
