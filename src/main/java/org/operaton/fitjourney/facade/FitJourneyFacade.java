package org.operaton.fitjourney.facade;

import lombok.RequiredArgsConstructor;
import org.operaton.fitjourney.config.AsyncConfiguration;
import org.operaton.fitjourney.exception.RecordNotFoundException;
import org.operaton.fitjourney.model.dto.CreateGoalRequest;
import org.operaton.fitjourney.model.dto.ExerciseEntry;
import org.operaton.fitjourney.model.dto.PersonalBestDTO;
import org.operaton.fitjourney.model.dto.WorkoutDetails;
import org.operaton.fitjourney.model.dto.WriteOutcome;
import org.operaton.fitjourney.model.entity.BodyWeightMeasurement;
import org.operaton.fitjourney.model.entity.DailyLog;
import org.operaton.fitjourney.model.entity.Exercise;
import org.operaton.fitjourney.model.entity.Goal;
import org.operaton.fitjourney.model.entity.Milestone;
import org.operaton.fitjourney.model.entity.Notification;
import org.operaton.fitjourney.model.entity.Streak;
import org.operaton.fitjourney.model.entity.User;
import org.operaton.fitjourney.model.entity.Workout;
import org.operaton.fitjourney.security.CurrentUserProvider;
import org.operaton.fitjourney.service.BodyWeightService;
import org.operaton.fitjourney.service.ExerciseService;
import org.operaton.fitjourney.service.GoalService;
import org.operaton.fitjourney.service.MilestoneService;
import org.operaton.fitjourney.service.NotificationService;
import org.operaton.fitjourney.service.StreakService;
import org.operaton.fitjourney.service.UserService;
import org.operaton.fitjourney.service.WorkoutLedgerService;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous entry point for the app's UI layer.
 * <p>
 * Writes run one at a time on the store write executor; reads run on the default executor.
 * A failed future after a write means the commit state is unknown and the caller should re-query.
 */
@Component
@RequiredArgsConstructor
public class FitJourneyFacade {

    private final CurrentUserProvider currentUserProvider;
    private final UserService userService;
    private final ExerciseService exerciseService;
    private final WorkoutLedgerService workoutLedgerService;
    private final GoalService goalService;
    private final StreakService streakService;
    private final BodyWeightService bodyWeightService;
    private final NotificationService notificationService;
    private final MilestoneService milestoneService;

    @Async(AsyncConfiguration.STORE_WRITE_EXECUTOR)
    public CompletableFuture<User> signIn(User profile) {
        return CompletableFuture.completedFuture(userService.signIn(profile));
    }

    @Async
    public CompletableFuture<Optional<User>> getCurrentUser() {
        return CompletableFuture.completedFuture(
                currentUserProvider.currentUserId().flatMap(userService::getUser));
    }

    @Async
    public CompletableFuture<List<Exercise>> getAllExercises() {
        return CompletableFuture.completedFuture(exerciseService.getAllExercises());
    }

    @Async
    public CompletableFuture<List<Exercise>> getExercisesByMuscleGroup(String muscleGroup) {
        return CompletableFuture.completedFuture(exerciseService.getExercisesByMuscleGroup(muscleGroup));
    }

    @Async(AsyncConfiguration.STORE_WRITE_EXECUTOR)
    public CompletableFuture<WriteOutcome<Long>> saveCompleteWorkout(LocalDate date, Integer duration,
                                                                      String notes, List<ExerciseEntry> exercises) {
        String userId = currentUserProvider.requireUserId();
        return CompletableFuture.completedFuture(
                workoutLedgerService.saveCompleteWorkout(userId, date, duration, notes, exercises));
    }

    @Async(AsyncConfiguration.STORE_WRITE_EXECUTOR)
    public CompletableFuture<WriteOutcome<Long>> updateWorkout(Long workoutId, LocalDate date,
                                                                Integer duration, String notes) {
        requireOwnWorkout(workoutId);
        return CompletableFuture.completedFuture(workoutLedgerService.updateWorkout(workoutId, date, duration, notes));
    }

    @Async(AsyncConfiguration.STORE_WRITE_EXECUTOR)
    public CompletableFuture<WriteOutcome<Long>> deleteWorkout(Long workoutId) {
        requireOwnWorkout(workoutId);
        return CompletableFuture.completedFuture(workoutLedgerService.deleteWorkout(workoutId));
    }

    @Async
    public CompletableFuture<List<Workout>> getWorkouts() {
        return CompletableFuture.completedFuture(
                workoutLedgerService.getWorkoutsForUser(currentUserProvider.requireUserId()));
    }

    @Async
    public CompletableFuture<Optional<WorkoutDetails>> getWorkoutDetails(Long workoutId) {
        String userId = currentUserProvider.requireUserId();
        return CompletableFuture.completedFuture(workoutLedgerService.getWorkoutDetails(workoutId)
                .filter(details -> details.getWorkout().getUserId().equals(userId)));
    }

    @Async
    public CompletableFuture<List<PersonalBestDTO>> getPersonalBests() {
        return CompletableFuture.completedFuture(
                workoutLedgerService.getAllPersonalBests(currentUserProvider.requireUserId()));
    }

    @Async(AsyncConfiguration.STORE_WRITE_EXECUTOR)
    public CompletableFuture<Goal> createGoal(CreateGoalRequest request) {
        return CompletableFuture.completedFuture(goalService.createGoal(request));
    }

    @Async(AsyncConfiguration.STORE_WRITE_EXECUTOR)
    public CompletableFuture<Goal> updateGoal(Long goalId, Double targetValue, LocalDate endDate) {
        return CompletableFuture.completedFuture(goalService.updateGoal(goalId, targetValue, endDate));
    }

    @Async(AsyncConfiguration.STORE_WRITE_EXECUTOR)
    public CompletableFuture<Boolean> deleteGoal(Long goalId) {
        return CompletableFuture.completedFuture(goalService.deleteGoal(goalId));
    }

    @Async
    public CompletableFuture<List<Goal>> getActiveGoals() {
        return CompletableFuture.completedFuture(goalService.getActiveGoals());
    }

    @Async
    public CompletableFuture<List<Goal>> getCompletedGoals() {
        return CompletableFuture.completedFuture(goalService.getCompletedGoals());
    }

    @Async(AsyncConfiguration.STORE_WRITE_EXECUTOR)
    public CompletableFuture<Streak> logRest(LocalDate date) {
        return CompletableFuture.completedFuture(streakService.logRest(date));
    }

    /**
     * Runs on the write executor because the first access creates the streak row.
     */
    @Async(AsyncConfiguration.STORE_WRITE_EXECUTOR)
    public CompletableFuture<Streak> getStreak() {
        return CompletableFuture.completedFuture(streakService.getUserStreak());
    }

    @Async
    public CompletableFuture<List<DailyLog>> getDailyLogHistory(LocalDate start, LocalDate end) {
        return CompletableFuture.completedFuture(streakService.getDailyLogHistory(start, end));
    }

    @Async(AsyncConfiguration.STORE_WRITE_EXECUTOR)
    public CompletableFuture<BodyWeightMeasurement> logBodyWeight(double weightKg, LocalDate date) {
        return CompletableFuture.completedFuture(bodyWeightService.logBodyWeight(weightKg, date));
    }

    @Async
    public CompletableFuture<List<Notification>> getNotifications() {
        return CompletableFuture.completedFuture(
                notificationService.getNotifications(currentUserProvider.requireUserId()));
    }

    @Async(AsyncConfiguration.STORE_WRITE_EXECUTOR)
    public CompletableFuture<Boolean> markNotificationAsRead(Long notificationId) {
        return CompletableFuture.completedFuture(
                notificationService.markAsRead(notificationId, currentUserProvider.requireUserId()));
    }

    @Async
    public CompletableFuture<List<Milestone>> getMilestones() {
        return CompletableFuture.completedFuture(
                milestoneService.getMilestones(currentUserProvider.requireUserId()));
    }

    private void requireOwnWorkout(Long workoutId) {
        String userId = currentUserProvider.requireUserId();
        workoutLedgerService.getWorkout(workoutId)
                .filter(workout -> workout.getUserId().equals(userId))
                .orElseThrow(() -> new RecordNotFoundException("workout", workoutId));
    }
}
