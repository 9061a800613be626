package org.operaton.fitjourney.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fitjourney.exception.NotLoggedInException;
import org.operaton.fitjourney.exception.ValidationException;
import org.operaton.fitjourney.model.entity.ChangeQueueEntry.SyncOperation;
import org.operaton.fitjourney.model.entity.DailyLog;
import org.operaton.fitjourney.model.entity.DailyLog.ActivityKind;
import org.operaton.fitjourney.model.entity.Milestone;
import org.operaton.fitjourney.model.entity.Streak;
import org.operaton.fitjourney.model.entity.Workout;
import org.operaton.fitjourney.repository.DailyLogRepository;
import org.operaton.fitjourney.repository.StreakRepository;
import org.operaton.fitjourney.repository.WorkoutRepository;
import org.operaton.fitjourney.security.CurrentUserProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maintains the per-user streak from daily activity logs.
 * <p>
 * Rest days count as activity. A day logged as workout is never downgraded to rest.
 * The counters are updated incrementally, never by scanning the full history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StreakService {

    private final DailyLogRepository dailyLogRepository;
    private final StreakRepository streakRepository;
    private final WorkoutRepository workoutRepository;
    private final MilestoneService milestoneService;
    private final NotificationService notificationService;
    private final ChangeQueueService changeQueueService;
    private final CurrentUserProvider currentUserProvider;
    private final Clock clock;

    @Value("${fitjourney.streak.milestones:7,30}")
    private Set<Integer> streakMilestones;

    @Transactional
    public Streak logWorkout(LocalDate date) {
        return logActivity(currentUserProvider.requireUserId(), date, ActivityKind.WORKOUT);
    }

    @Transactional
    public Streak logRest(LocalDate date) {
        return logActivity(currentUserProvider.requireUserId(), date, ActivityKind.REST);
    }

    @Transactional
    public Streak logWorkout(String userId, LocalDate date) {
        return logActivity(userId, date, ActivityKind.WORKOUT);
    }

    @Transactional
    public Streak logRest(String userId, LocalDate date) {
        return logActivity(userId, date, ActivityKind.REST);
    }

    /**
     * Upsert the daily log for (user, date) and advance the streak, in one transaction.
     *
     * @param userId the user
     * @param date the activity day
     * @param kind workout or rest
     * @return the updated streak
     */
    @Transactional
    public Streak logActivity(String userId, LocalDate date, ActivityKind kind) {
        if (userId == null) {
            throw new NotLoggedInException();
        }
        if (date == null) {
            throw new ValidationException("Activity date is required");
        }

        Optional<DailyLog> existing = dailyLogRepository.findByUserIdAndDate(userId, date);
        DailyLog dailyLog = existing.orElseGet(() -> DailyLog.builder()
                .userId(userId)
                .date(date)
                .activityKind(kind)
                .build());
        if (kind == ActivityKind.WORKOUT) {
            dailyLog.setActivityKind(ActivityKind.WORKOUT);
        }
        dailyLog = dailyLogRepository.save(dailyLog);

        Optional<Streak> stored = streakRepository.findById(userId);
        Streak streak = stored.orElseGet(() -> emptyStreak(userId));
        int before = streak.getCurrentStreak();
        advance(streak, date, kind);
        streak = streakRepository.save(streak);

        int current = streak.getCurrentStreak();
        if (current != before && streakMilestones.contains(current)) {
            milestoneService.recordMilestone(userId, Milestone.MilestoneKind.LONGEST_STREAK, null, (double) current);
            notificationService.createStreakMilestoneNotification(userId, current);
        }

        changeQueueService.enqueue(ChangeQueueService.TABLE_DAILY_LOG, dailyLog.getId(),
                existing.isPresent() ? SyncOperation.UPDATE : SyncOperation.INSERT);
        changeQueueService.enqueue(ChangeQueueService.TABLE_STREAK, userId,
                stored.isPresent() ? SyncOperation.UPDATE : SyncOperation.INSERT);

        log.debug("Logged {} on {} for user {}: current={}, longest={}",
                kind.getLabel(), date, userId, current, streak.getLongestStreak());
        return streak;
    }

    /**
     * Apply one activity day to the counters.
     * A day earlier than the last activity only records the workout date and leaves the counters alone.
     */
    static void advance(Streak streak, LocalDate date, ActivityKind kind) {
        LocalDate last = streak.getLastActivityDate();

        if (last == null) {
            streak.setCurrentStreak(1);
        } else if (date.isBefore(last)) {
            updateWorkoutDate(streak, date, kind);
            return;
        } else if (date.equals(last)) {
            if (streak.getCurrentStreak() == 0) {
                streak.setCurrentStreak(1);
            }
        } else if (date.equals(last.plusDays(1))) {
            streak.setCurrentStreak(streak.getCurrentStreak() + 1);
        } else {
            streak.setCurrentStreak(1);
        }

        streak.setLongestStreak(Math.max(streak.getLongestStreak(), streak.getCurrentStreak()));
        streak.setLastActivityDate(date);
        updateWorkoutDate(streak, date, kind);
    }

    private static void updateWorkoutDate(Streak streak, LocalDate date, ActivityKind kind) {
        if (kind == ActivityKind.WORKOUT
                && (streak.getLastWorkoutDate() == null || date.isAfter(streak.getLastWorkoutDate()))) {
            streak.setLastWorkoutDate(date);
        }
    }

    /**
     * Streak of the signed-in user. A zeroed row is created on first access.
     */
    @Transactional
    public Streak getUserStreak() {
        return getUserStreak(currentUserProvider.requireUserId());
    }

    @Transactional
    public Streak getUserStreak(String userId) {
        return streakRepository.findById(userId).orElseGet(() -> {
            Streak created = streakRepository.save(emptyStreak(userId));
            changeQueueService.enqueue(ChangeQueueService.TABLE_STREAK, userId, SyncOperation.INSERT);
            return created;
        });
    }

    @Transactional
    public Streak performDailyStreakCheck() {
        return performDailyStreakCheck(currentUserProvider.requireUserId());
    }

    /**
     * Reset the current streak when the last activity is more than one day old.
     * The longest streak is kept.
     */
    @Transactional
    public Streak performDailyStreakCheck(String userId) {
        Streak streak = getUserStreak(userId);
        LocalDate last = streak.getLastActivityDate();
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);

        if (last != null && last.isBefore(yesterday) && streak.getCurrentStreak() > 0) {
            log.info("Streak of user {} broken after {} days (last activity {})",
                    userId, streak.getCurrentStreak(), last);
            streak.setCurrentStreak(0);
            streak = streakRepository.save(streak);
            changeQueueService.enqueue(ChangeQueueService.TABLE_STREAK, userId, SyncOperation.UPDATE);
        }
        return streak;
    }

    /**
     * Daily logs inside [start, end], newest first.
     */
    @Transactional(readOnly = true)
    public List<DailyLog> getDailyLogHistory(LocalDate start, LocalDate end) {
        return dailyLogRepository.findByUserIdAndDateBetweenOrderByDateDesc(
                currentUserProvider.requireUserId(), start, end);
    }

    /**
     * Make sure every day with a workout inside [start, end] has a workout log.
     * Streak counters are not touched.
     *
     * @return number of logs created or upgraded
     */
    @Transactional
    public int regenerateDailyLogs(LocalDate start, LocalDate end) {
        String userId = currentUserProvider.requireUserId();
        Set<LocalDate> workoutDays = new TreeSet<>();
        for (Workout workout : workoutRepository.findByUserIdAndDateBetweenOrderByDateAsc(userId, start, end)) {
            workoutDays.add(workout.getDate());
        }

        int changed = 0;
        for (LocalDate day : workoutDays) {
            Optional<DailyLog> existing = dailyLogRepository.findByUserIdAndDate(userId, day);
            if (existing.isPresent() && existing.get().getActivityKind() == ActivityKind.WORKOUT) {
                continue;
            }
            DailyLog dailyLog = existing.orElseGet(() -> DailyLog.builder().userId(userId).date(day).build());
            dailyLog.setActivityKind(ActivityKind.WORKOUT);
            dailyLog = dailyLogRepository.save(dailyLog);
            changeQueueService.enqueue(ChangeQueueService.TABLE_DAILY_LOG, dailyLog.getId(),
                    existing.isPresent() ? SyncOperation.UPDATE : SyncOperation.INSERT);
            changed++;
        }

        log.info("Regenerated {} daily logs for user {} between {} and {}", changed, userId, start, end);
        return changed;
    }

    private static Streak emptyStreak(String userId) {
        return Streak.builder()
                .userId(userId)
                .currentStreak(0)
                .longestStreak(0)
                .build();
    }
}
