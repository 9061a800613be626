package org.operaton.fitjourney.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fitjourney.exception.NotLoggedInException;
import org.operaton.fitjourney.exception.RecordNotFoundException;
import org.operaton.fitjourney.exception.ValidationException;
import org.operaton.fitjourney.model.dto.ExerciseEntry;
import org.operaton.fitjourney.model.dto.PersonalBestDTO;
import org.operaton.fitjourney.model.dto.SetEntry;
import org.operaton.fitjourney.model.dto.WorkoutDetails;
import org.operaton.fitjourney.model.dto.WriteOutcome;
import org.operaton.fitjourney.model.dto.WriteOutcome.SecondaryFailure;
import org.operaton.fitjourney.model.entity.ChangeQueueEntry.SyncOperation;
import org.operaton.fitjourney.model.entity.Exercise;
import org.operaton.fitjourney.model.entity.Milestone;
import org.operaton.fitjourney.model.entity.Workout;
import org.operaton.fitjourney.model.entity.WorkoutExercise;
import org.operaton.fitjourney.model.entity.WorkoutSet;
import org.operaton.fitjourney.repository.ExerciseRepository;
import org.operaton.fitjourney.repository.UserRepository;
import org.operaton.fitjourney.repository.WorkoutExerciseRepository;
import org.operaton.fitjourney.repository.WorkoutRepository;
import org.operaton.fitjourney.repository.WorkoutSetRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Composite write path for a workout with its exercises and sets.
 * <p>
 * The rows are written in one transaction. Derived effects (personal bests, sync queue,
 * goal progress, streak) run after the commit; a failing effect is reported in the
 * returned {@link WriteOutcome} and never undoes the saved workout.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkoutLedgerService {

    public static final String STEP_PERSONAL_BEST = "personal-best";
    public static final String STEP_CHANGE_QUEUE = "change-queue";
    public static final String STEP_GOAL_PROGRESS = "goal-progress";
    public static final String STEP_STREAK = "streak";

    private final WorkoutRepository workoutRepository;
    private final WorkoutExerciseRepository workoutExerciseRepository;
    private final WorkoutSetRepository workoutSetRepository;
    private final ExerciseRepository exerciseRepository;
    private final UserRepository userRepository;
    private final MilestoneService milestoneService;
    private final GoalService goalService;
    private final StreakService streakService;
    private final ChangeQueueService changeQueueService;
    private final TransactionTemplate transactionTemplate;

    /**
     * Record a completed workout.
     *
     * @param userId    owner of the workout
     * @param date      workout day
     * @param duration  minutes; null or 0 means unspecified
     * @param notes     optional notes
     * @param exercises exercises with their sets
     * @return the new workout id plus any follow-up step that failed
     * @throws NotLoggedInException    if no user id is given
     * @throws RecordNotFoundException if the user does not exist
     * @throws ValidationException     if the payload is invalid; nothing is written
     */
    public WriteOutcome<Long> saveCompleteWorkout(String userId, LocalDate date, Integer duration,
                                                  String notes, List<ExerciseEntry> exercises) {
        if (userId == null || userId.isBlank()) {
            throw new NotLoggedInException();
        }
        List<ExerciseEntry> entries = exercises != null ? exercises : List.of();
        validate(date, duration, entries);
        if (!userRepository.existsById(userId)) {
            throw new RecordNotFoundException("users", userId);
        }

        Map<Long, Double> maxWeights = new LinkedHashMap<>();
        Workout workout = transactionTemplate.execute(status ->
                insertWorkout(userId, date, duration, notes, entries, maxWeights));

        List<SecondaryFailure> failures = new ArrayList<>();
        maxWeights.forEach((exerciseId, maxWeight) ->
                runStep(failures, STEP_PERSONAL_BEST,
                        () -> checkPersonalBest(userId, workout.getId(), exerciseId, maxWeight)));
        enqueue(failures, workout.getId(), SyncOperation.INSERT);
        runStep(failures, STEP_GOAL_PROGRESS, () -> goalService.onWorkoutSaved(workout));
        runStep(failures, STEP_STREAK, () -> streakService.logWorkout(userId, workout.getDate()));

        log.info("Saved workout {} for user {} on {} with {} exercises ({} follow-up failures)",
                workout.getId(), userId, date, entries.size(), failures.size());
        return new WriteOutcome<>(workout.getId(), failures);
    }

    private Workout insertWorkout(String userId, LocalDate date, Integer duration, String notes,
                                  List<ExerciseEntry> entries, Map<Long, Double> maxWeights) {
        Workout workout = workoutRepository.save(Workout.builder()
                .userId(userId)
                .date(date)
                .duration(normalizeDuration(duration))
                .notes(notes)
                .build());

        for (ExerciseEntry entry : entries) {
            WorkoutExercise workoutExercise = workoutExerciseRepository.save(WorkoutExercise.builder()
                    .workoutId(workout.getId())
                    .exerciseId(entry.getExerciseId())
                    .build());

            for (SetEntry set : entry.getSets()) {
                workoutSetRepository.save(WorkoutSet.builder()
                        .workoutExerciseId(workoutExercise.getId())
                        .setNumber(set.getSetNumber())
                        .reps(set.getReps())
                        .weight(set.getWeight())
                        .build());

                if (set.getWeight() != null && set.getWeight() > 0) {
                    maxWeights.merge(entry.getExerciseId(), set.getWeight(), Math::max);
                }
            }
        }
        return workout;
    }

    /**
     * Compare the heaviest weight of this workout with every other workout of the user.
     * A strictly higher value is a new personal best.
     */
    private void checkPersonalBest(String userId, Long workoutId, Long exerciseId, double newMax) {
        Double previous = workoutRepository.findMaxWeightExcludingWorkout(userId, exerciseId, workoutId);
        if (previous != null && newMax <= previous) {
            return;
        }
        milestoneService.recordMilestone(userId, Milestone.MilestoneKind.PERSONAL_BEST, exerciseId, newMax);
        goalService.onPersonalBest(userId, exerciseId, newMax);
        log.info("New personal best for user {} on exercise {}: {} (previous {})", userId, exerciseId, newMax, previous);
    }

    /**
     * Delete a workout with all its exercises and sets.
     *
     * @throws RecordNotFoundException if the workout does not exist
     */
    public WriteOutcome<Long> deleteWorkout(Long workoutId) {
        Workout workout = transactionTemplate.execute(status -> {
            Workout existing = workoutRepository.findById(workoutId)
                    .orElseThrow(() -> new RecordNotFoundException("workout", workoutId));
            int sets = workoutSetRepository.deleteByWorkoutId(workoutId);
            int workoutExercises = workoutExerciseRepository.deleteByWorkoutId(workoutId);
            workoutRepository.delete(existing);
            log.debug("Deleting workout {}: {} exercises, {} sets", workoutId, workoutExercises, sets);
            return existing;
        });

        List<SecondaryFailure> failures = new ArrayList<>();
        enqueue(failures, workoutId, SyncOperation.DELETE);
        runStep(failures, STEP_GOAL_PROGRESS, () -> goalService.onWorkoutDeleted(workout));

        log.info("Deleted workout {} of user {}", workoutId, workout.getUserId());
        return new WriteOutcome<>(workoutId, failures);
    }

    /**
     * Change date, duration and notes of a workout. Exercises and sets are kept.
     *
     * @throws RecordNotFoundException if the workout does not exist
     */
    public WriteOutcome<Long> updateWorkout(Long workoutId, LocalDate date, Integer duration, String notes) {
        validate(date, duration, List.of());
        Workout workout = transactionTemplate.execute(status -> {
            Workout existing = workoutRepository.findById(workoutId)
                    .orElseThrow(() -> new RecordNotFoundException("workout", workoutId));
            existing.setDate(date);
            existing.setDuration(normalizeDuration(duration));
            existing.setNotes(notes);
            return workoutRepository.save(existing);
        });

        List<SecondaryFailure> failures = new ArrayList<>();
        enqueue(failures, workoutId, SyncOperation.UPDATE);
        runStep(failures, STEP_GOAL_PROGRESS, () -> goalService.onWorkoutSaved(workout));
        return new WriteOutcome<>(workoutId, failures);
    }

    @Transactional(readOnly = true)
    public Optional<Workout> getWorkout(Long workoutId) {
        return workoutRepository.findById(workoutId);
    }

    @Transactional(readOnly = true)
    public List<Workout> getWorkoutsForUser(String userId) {
        return workoutRepository.findByUserIdOrderByDateDescIdDesc(userId);
    }

    @Transactional(readOnly = true)
    public List<Workout> getWorkoutsForDate(String userId, LocalDate date) {
        return workoutRepository.findByUserIdAndDateOrderByIdAsc(userId, date);
    }

    /**
     * The workout with its exercises and their sets ordered by set number.
     */
    @Transactional(readOnly = true)
    public Optional<WorkoutDetails> getWorkoutDetails(Long workoutId) {
        return workoutRepository.findById(workoutId).map(workout -> {
            List<WorkoutExercise> workoutExercises = workoutExerciseRepository.findByWorkoutIdOrderByIdAsc(workoutId);
            Map<Long, Exercise> catalog = exerciseRepository.findAllById(
                            workoutExercises.stream().map(WorkoutExercise::getExerciseId).collect(Collectors.toSet()))
                    .stream()
                    .collect(Collectors.toMap(Exercise::getId, Function.identity()));

            List<WorkoutDetails.PerformedExercise> performed = workoutExercises.stream()
                    .map(we -> WorkoutDetails.PerformedExercise.builder()
                            .workoutExerciseId(we.getId())
                            .exercise(catalog.get(we.getExerciseId()))
                            .sets(workoutSetRepository.findByWorkoutExerciseIdOrderBySetNumberAsc(we.getId()))
                            .build())
                    .toList();
            return WorkoutDetails.builder().workout(workout).exercises(performed).build();
        });
    }

    /**
     * Sum of reps × weight over all sets that have both values.
     */
    @Transactional(readOnly = true)
    public double calculateWorkoutVolume(Long workoutId) {
        return workoutSetRepository.findByWorkoutId(workoutId).stream()
                .filter(set -> set.getReps() != null && set.getWeight() != null)
                .mapToDouble(set -> set.getReps() * set.getWeight())
                .sum();
    }

    @Transactional(readOnly = true)
    public Optional<Double> getPersonalBestWeight(String userId, Long exerciseId) {
        return Optional.ofNullable(workoutRepository.findMaxWeight(userId, exerciseId));
    }

    @Transactional(readOnly = true)
    public long countWorkoutsInDateRange(String userId, LocalDate start, LocalDate end) {
        return workoutRepository.countInDateRange(userId, start, end);
    }

    @Transactional(readOnly = true)
    public List<PersonalBestDTO> getAllPersonalBests(String userId) {
        return workoutRepository.findPersonalBests(userId);
    }

    private void validate(LocalDate date, Integer duration, List<ExerciseEntry> entries) {
        if (date == null) {
            throw new ValidationException("Workout date is required");
        }
        if (duration != null && duration < 0) {
            throw new ValidationException("Duration must not be negative");
        }

        Set<Long> exerciseIds = new HashSet<>();
        for (ExerciseEntry entry : entries) {
            if (entry == null || entry.getExerciseId() == null) {
                throw new ValidationException("Exercise id is required");
            }
            if (entry.getSets() == null) {
                throw new ValidationException("Sets are required for exercise " + entry.getExerciseId());
            }
            exerciseIds.add(entry.getExerciseId());

            Set<Integer> setNumbers = new HashSet<>();
            for (SetEntry set : entry.getSets()) {
                if (set == null) {
                    throw new ValidationException("Empty set entry for exercise " + entry.getExerciseId());
                }
                if (set.getSetNumber() <= 0) {
                    throw new ValidationException("Set numbers must be positive, got " + set.getSetNumber());
                }
                if (!setNumbers.add(set.getSetNumber())) {
                    throw new ValidationException("Duplicate set number " + set.getSetNumber()
                            + " for exercise " + entry.getExerciseId());
                }
                if (set.getReps() != null && set.getReps() < 0) {
                    throw new ValidationException("Reps must not be negative");
                }
            }
        }

        for (Long exerciseId : exerciseIds) {
            if (!exerciseRepository.existsById(exerciseId)) {
                throw new ValidationException("Unknown exercise " + exerciseId);
            }
        }
    }

    private static Integer normalizeDuration(Integer duration) {
        return duration == null || duration == 0 ? null : duration;
    }

    private void enqueue(List<SecondaryFailure> failures, Long workoutId, SyncOperation operation) {
        if (!changeQueueService.enqueue(ChangeQueueService.TABLE_WORKOUT, workoutId, operation)) {
            failures.add(new SecondaryFailure(STEP_CHANGE_QUEUE, "Could not queue " + operation + " of workout " + workoutId));
        }
    }

    private void runStep(List<SecondaryFailure> failures, String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            failures.add(new SecondaryFailure(step, e.getMessage()));
            log.warn("Follow-up step '{}' failed after workout write", step, e);
        }
    }
}
