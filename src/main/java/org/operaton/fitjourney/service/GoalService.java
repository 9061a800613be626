package org.operaton.fitjourney.service;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fitjourney.exception.RecordNotFoundException;
import org.operaton.fitjourney.exception.ValidationException;
import org.operaton.fitjourney.model.dto.CreateGoalRequest;
import org.operaton.fitjourney.model.entity.BodyWeightMeasurement;
import org.operaton.fitjourney.model.entity.ChangeQueueEntry.SyncOperation;
import org.operaton.fitjourney.model.entity.Goal;
import org.operaton.fitjourney.model.entity.Goal.GoalKind;
import org.operaton.fitjourney.model.entity.Goal.GoalState;
import org.operaton.fitjourney.model.entity.Milestone;
import org.operaton.fitjourney.model.entity.Workout;
import org.operaton.fitjourney.repository.BodyWeightRepository;
import org.operaton.fitjourney.repository.ExerciseRepository;
import org.operaton.fitjourney.repository.GoalRepository;
import org.operaton.fitjourney.repository.WorkoutRepository;
import org.operaton.fitjourney.security.CurrentUserProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Goal engine: creation, progress tracking and the Active → Achieved | Expired state machine.
 * <p>
 * Progress sources per kind:
 * <ul>
 *   <li>ExerciseTarget: heaviest weight lifted for the bound exercise</li>
 *   <li>WorkoutFrequency: number of workouts dated inside [start, end]</li>
 *   <li>WeightTarget: latest body-weight measurement</li>
 * </ul>
 * Every achievement writes the goal, a GoalAchieved milestone and a notification in one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GoalService {

    private final GoalRepository goalRepository;
    private final WorkoutRepository workoutRepository;
    private final ExerciseRepository exerciseRepository;
    private final BodyWeightRepository bodyWeightRepository;
    private final MilestoneService milestoneService;
    private final NotificationService notificationService;
    private final ChangeQueueService changeQueueService;
    private final CurrentUserProvider currentUserProvider;
    private final Validator validator;
    private final Clock clock;

    @Value("${fitjourney.goals.near-completion-ratio:0.9}")
    private double nearCompletionRatio;

    @Value("${fitjourney.goals.expiring-within-days:3}")
    private int expiringWithinDays;

    /**
     * Create a goal for the signed-in user.
     *
     * @param request the goal definition
     * @return the stored goal, possibly already achieved
     * @throws ValidationException if the request is inconsistent
     */
    @Transactional
    public Goal createGoal(CreateGoalRequest request) {
        String userId = currentUserProvider.requireUserId();
        validate(request);

        Goal goal = Goal.builder()
                .userId(userId)
                .kind(request.getKind())
                .exerciseId(request.getExerciseId())
                .targetValue(request.getTargetValue())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .state(GoalState.ACTIVE)
                .currentProgress(request.getCurrentProgress() != null ? request.getCurrentProgress() : 0)
                .build();

        if (goal.getKind() == GoalKind.WEIGHT_TARGET) {
            double startingWeight = resolveStartingWeight(userId, request);
            goal.setStartingValue(startingWeight);
            if (request.getCurrentProgress() == null) {
                goal.setCurrentProgress(startingWeight);
            }
        }
        recomputeProgress(goal);

        Goal saved = goalRepository.save(goal);
        changeQueueService.enqueue(ChangeQueueService.TABLE_GOAL, saved.getId(), SyncOperation.INSERT);
        log.info("Created {} goal {} for user {} (target {}, ends {})",
                saved.getKind(), saved.getId(), userId, saved.getTargetValue(), saved.getEndDate());

        evaluate(saved);
        return saved;
    }

    @Transactional
    public Goal createStrengthGoal(Long exerciseId, double currentWeight, double targetWeight, LocalDate targetDate) {
        return createGoal(CreateGoalRequest.builder()
                .kind(GoalKind.EXERCISE_TARGET)
                .exerciseId(exerciseId)
                .targetValue(targetWeight)
                .startDate(LocalDate.now(clock))
                .endDate(targetDate)
                .currentProgress(currentWeight)
                .build());
    }

    /**
     * Create a body-weight goal. The current weight is also logged as a measurement
     * and becomes the baseline that decides between loss and gain.
     */
    @Transactional
    public Goal createWeightGoal(double currentWeight, double targetWeight, LocalDate targetDate) {
        String userId = currentUserProvider.requireUserId();
        if (currentWeight <= 0) {
            throw new ValidationException("Current weight must be positive");
        }

        BodyWeightMeasurement measurement = bodyWeightRepository.save(BodyWeightMeasurement.builder()
                .userId(userId)
                .weightKg(currentWeight)
                .measuredAt(LocalDateTime.now(clock))
                .build());
        changeQueueService.enqueue(ChangeQueueService.TABLE_USER_METRICS, measurement.getId(), SyncOperation.INSERT);

        return createGoal(CreateGoalRequest.builder()
                .kind(GoalKind.WEIGHT_TARGET)
                .targetValue(targetWeight)
                .startDate(LocalDate.now(clock))
                .endDate(targetDate)
                .currentProgress(currentWeight)
                .startingValue(currentWeight)
                .build());
    }

    @Transactional
    public Goal createFrequencyGoal(int targetWorkouts, LocalDate endDate) {
        return createGoal(CreateGoalRequest.builder()
                .kind(GoalKind.WORKOUT_FREQUENCY)
                .targetValue((double) targetWorkouts)
                .startDate(LocalDate.now(clock))
                .endDate(endDate)
                .build());
    }

    /**
     * Change target and end date of an active goal. A null argument leaves that field unchanged.
     * Progress is recomputed when the target changes.
     *
     * @throws RecordNotFoundException if the goal does not exist for the signed-in user
     * @throws ValidationException if the goal is no longer active or the new values are invalid
     */
    @Transactional
    public Goal updateGoal(Long goalId, Double targetValue, LocalDate endDate) {
        Goal goal = findOwnGoal(goalId)
                .orElseThrow(() -> new RecordNotFoundException("goal", goalId));
        if (!goal.isActive()) {
            throw new ValidationException("Only active goals can be edited, goal " + goalId + " is " + goal.getState());
        }
        if (targetValue != null && targetValue < 0) {
            throw new ValidationException("Target value must not be negative");
        }
        if (endDate != null && endDate.isBefore(goal.getStartDate())) {
            throw new ValidationException("End date must not be before start date");
        }

        boolean targetChanged = targetValue != null && !Objects.equals(goal.getTargetValue(), targetValue);
        if (targetValue != null) {
            goal.setTargetValue(targetValue);
        }
        if (endDate != null) {
            goal.setEndDate(endDate);
        }
        if (targetChanged || goal.getKind() == GoalKind.WORKOUT_FREQUENCY) {
            recomputeProgress(goal);
        }

        Goal saved = goalRepository.save(goal);
        changeQueueService.enqueue(ChangeQueueService.TABLE_GOAL, goalId, SyncOperation.UPDATE);
        evaluate(saved);
        return saved;
    }

    /**
     * @return true if the goal existed and was deleted
     */
    @Transactional
    public boolean deleteGoal(Long goalId) {
        return findOwnGoal(goalId)
                .map(goal -> {
                    goalRepository.delete(goal);
                    changeQueueService.enqueue(ChangeQueueService.TABLE_GOAL, goalId, SyncOperation.DELETE);
                    log.info("Deleted goal {}", goalId);
                    return true;
                })
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public Optional<Goal> getGoal(Long goalId) {
        return findOwnGoal(goalId);
    }

    @Transactional(readOnly = true)
    public List<Goal> getAllGoals() {
        return goalRepository.findByUserIdOrderByEndDateAsc(currentUserProvider.requireUserId());
    }

    @Transactional(readOnly = true)
    public List<Goal> getActiveGoals() {
        return goalRepository.findByUserIdAndStateOrderByEndDateAsc(currentUserProvider.requireUserId(), GoalState.ACTIVE);
    }

    @Transactional(readOnly = true)
    public List<Goal> getCompletedGoals() {
        return goalRepository.findCompleted(currentUserProvider.requireUserId(), GoalState.ACHIEVED);
    }

    /**
     * Active goals whose completion ratio reached the configured threshold.
     */
    @Transactional(readOnly = true)
    public List<Goal> getNearCompletionGoals() {
        return getActiveGoals().stream()
                .filter(goal -> completionRatio(goal) >= nearCompletionRatio)
                .toList();
    }

    /**
     * Active goals ending between today and the configured number of days from now.
     */
    @Transactional(readOnly = true)
    public List<Goal> getExpiringGoals() {
        LocalDate today = LocalDate.now(clock);
        LocalDate horizon = today.plusDays(expiringWithinDays);
        return getActiveGoals().stream()
                .filter(goal -> !goal.getEndDate().isBefore(today) && !goal.getEndDate().isAfter(horizon))
                .toList();
    }

    /**
     * Completion between 0 and 1. A missing or zero target counts as complete.
     */
    public double completionRatio(Goal goal) {
        Double target = goal.getTargetValue();
        if (goal.getKind() == GoalKind.WEIGHT_TARGET && target != null && target > 0) {
            double start = goal.getStartingValue() != null ? goal.getStartingValue() : goal.getCurrentProgress();
            return calculateWeightGoalPercentage(start, goal.getCurrentProgress(), target);
        }
        if (target == null || target == 0) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, goal.getCurrentProgress() / target));
    }

    /**
     * Completion of a body-weight goal between 0 and 1.
     * Loss and gain goals measure the distance covered from the start weight.
     * Maintenance goals (target equals start) lose 20 percentage points per percent of deviation.
     */
    public double calculateWeightGoalPercentage(double startWeight, double currentWeight, double targetWeight) {
        if (targetWeight < startWeight) {
            if (currentWeight <= targetWeight) {
                return 1.0;
            }
            return clamp((startWeight - currentWeight) / (startWeight - targetWeight));
        }
        if (targetWeight > startWeight) {
            if (currentWeight >= targetWeight) {
                return 1.0;
            }
            return clamp((currentWeight - startWeight) / (targetWeight - startWeight));
        }
        if (currentWeight == targetWeight) {
            return 1.0;
        }
        double deviation = Math.abs(currentWeight - targetWeight) / targetWeight;
        return clamp(1.0 - deviation * 20);
    }

    /**
     * Re-count workouts for every active WorkoutFrequency goal of the workout's owner.
     */
    @Transactional
    public void onWorkoutSaved(Workout workout) {
        refreshFrequencyGoals(workout.getUserId());
    }

    /**
     * Same recount as {@link #onWorkoutSaved(Workout)}, so progress drops with the deleted workout.
     * Achieved goals stay achieved.
     */
    @Transactional
    public void onWorkoutDeleted(Workout workout) {
        refreshFrequencyGoals(workout.getUserId());
    }

    /**
     * Set progress of every active ExerciseTarget goal bound to the exercise to the new best.
     */
    @Transactional
    public void onPersonalBest(String userId, Long exerciseId, double newMaxWeight) {
        List<Goal> goals = goalRepository.findByUserIdAndStateAndKindAndExerciseId(
                userId, GoalState.ACTIVE, GoalKind.EXERCISE_TARGET, exerciseId);
        for (Goal goal : goals) {
            goal.setCurrentProgress(newMaxWeight);
            saveProgress(goal);
            evaluate(goal);
        }
        log.debug("Personal best {} for exercise {} applied to {} goals", newMaxWeight, exerciseId, goals.size());
    }

    /**
     * Move every active WeightTarget goal to the latest measurement.
     */
    @Transactional
    public void onBodyWeightLogged(String userId) {
        List<Goal> goals = goalRepository.findByUserIdAndStateAndKind(userId, GoalState.ACTIVE, GoalKind.WEIGHT_TARGET);
        for (Goal goal : goals) {
            recomputeProgress(goal);
            saveProgress(goal);
            evaluate(goal);
        }
    }

    @Transactional
    public void performDailyMaintenance() {
        performDailyMaintenance(currentUserProvider.requireUserId());
    }

    /**
     * Expire active goals past their end date and refresh progress of the others.
     *
     * @return number of goals expired
     */
    @Transactional
    public int performDailyMaintenance(String userId) {
        LocalDate today = LocalDate.now(clock);
        List<Goal> active = goalRepository.findByUserIdAndStateOrderByEndDateAsc(userId, GoalState.ACTIVE);
        int expired = 0;

        for (Goal goal : active) {
            if (today.isAfter(goal.getEndDate())) {
                goal.setState(GoalState.EXPIRED);
                goalRepository.save(goal);
                changeQueueService.enqueue(ChangeQueueService.TABLE_GOAL, goal.getId(), SyncOperation.UPDATE);
                expired++;
                log.info("Goal {} of user {} expired on {}", goal.getId(), userId, goal.getEndDate());
                continue;
            }
            recomputeProgress(goal);
            saveProgress(goal);
            evaluate(goal);
        }

        log.debug("Goal maintenance for user {}: {} active, {} expired", userId, active.size(), expired);
        return expired;
    }

    private void refreshFrequencyGoals(String userId) {
        List<Goal> goals = goalRepository.findByUserIdAndStateAndKind(userId, GoalState.ACTIVE, GoalKind.WORKOUT_FREQUENCY);
        for (Goal goal : goals) {
            goal.setCurrentProgress(countWorkouts(goal));
            saveProgress(goal);
            evaluate(goal);
        }
    }

    private void recomputeProgress(Goal goal) {
        switch (goal.getKind()) {
            case EXERCISE_TARGET -> {
                Double max = workoutRepository.findMaxWeight(goal.getUserId(), goal.getExerciseId());
                if (max != null) {
                    goal.setCurrentProgress(max);
                }
            }
            case WORKOUT_FREQUENCY -> goal.setCurrentProgress(countWorkouts(goal));
            case WEIGHT_TARGET -> bodyWeightRepository
                    .findFirstByUserIdOrderByMeasuredAtDescIdDesc(goal.getUserId())
                    .ifPresent(latest -> goal.setCurrentProgress(latest.getWeightKg()));
        }
    }

    /**
     * Baseline of a weight goal: the explicit starting value, else the declared current weight,
     * else the latest logged measurement.
     */
    private double resolveStartingWeight(String userId, CreateGoalRequest request) {
        if (request.getStartingValue() != null) {
            return request.getStartingValue();
        }
        if (request.getCurrentProgress() != null) {
            return request.getCurrentProgress();
        }
        return bodyWeightRepository.findFirstByUserIdOrderByMeasuredAtDescIdDesc(userId)
                .map(BodyWeightMeasurement::getWeightKg)
                .orElseThrow(() -> new ValidationException("WeightTarget goals need a starting weight or a logged body weight"));
    }

    private double countWorkouts(Goal goal) {
        return workoutRepository.countInDateRange(goal.getUserId(), goal.getStartDate(), goal.getEndDate());
    }

    private void saveProgress(Goal goal) {
        goalRepository.save(goal);
        changeQueueService.enqueue(ChangeQueueService.TABLE_GOAL, goal.getId(), SyncOperation.UPDATE);
    }

    /**
     * Achieve the goal if its progress satisfies the target. No-op for terminal goals
     * and for goals already past their end date.
     */
    private void evaluate(Goal goal) {
        if (!goal.isActive()) {
            return;
        }
        LocalDate today = LocalDate.now(clock);
        if (today.isAfter(goal.getEndDate())) {
            return;
        }
        if (isSatisfied(goal, today)) {
            markAchieved(goal, today);
        }
    }

    boolean isSatisfied(Goal goal, LocalDate today) {
        Double target = goal.getTargetValue();
        double progress = goal.getCurrentProgress();
        if (target == null || target == 0) {
            return progress >= 0;
        }
        if (goal.getKind() != GoalKind.WEIGHT_TARGET) {
            return progress >= target;
        }

        double start = goal.getStartingValue() != null ? goal.getStartingValue() : progress;
        if (target < start) {
            return progress <= target;
        }
        if (target > start) {
            return progress >= target;
        }
        // Maintenance: judged on the end date
        return !today.isBefore(goal.getEndDate()) && progress == target;
    }

    private void markAchieved(Goal goal, LocalDate today) {
        goal.setState(GoalState.ACHIEVED);
        goal.setAchievedDate(today);
        goalRepository.save(goal);

        milestoneService.recordMilestone(goal.getUserId(), Milestone.MilestoneKind.GOAL_ACHIEVED,
                goal.getExerciseId(), goal.getTargetValue());
        notificationService.createGoalAchievedNotification(goal.getUserId());
        changeQueueService.enqueue(ChangeQueueService.TABLE_GOAL, goal.getId(), SyncOperation.UPDATE);

        log.info("Goal {} of user {} achieved with progress {}", goal.getId(), goal.getUserId(), goal.getCurrentProgress());
    }

    private Optional<Goal> findOwnGoal(Long goalId) {
        String userId = currentUserProvider.requireUserId();
        return goalRepository.findById(goalId).filter(goal -> goal.getUserId().equals(userId));
    }

    private void validate(CreateGoalRequest request) {
        Set<ConstraintViolation<CreateGoalRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining(", ")));
        }

        boolean exerciseTarget = request.getKind() == GoalKind.EXERCISE_TARGET;
        if (exerciseTarget && request.getExerciseId() == null) {
            throw new ValidationException("ExerciseTarget goals require an exercise");
        }
        if (!exerciseTarget && request.getExerciseId() != null) {
            throw new ValidationException(request.getKind().getLabel() + " goals must not reference an exercise");
        }
        if (exerciseTarget && !exerciseRepository.existsById(request.getExerciseId())) {
            throw new ValidationException("Unknown exercise " + request.getExerciseId());
        }
        if (request.getEndDate().isBefore(request.getStartDate())) {
            throw new ValidationException("End date must not be before start date");
        }
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
