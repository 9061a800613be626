package org.operaton.fitjourney.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fitjourney.model.entity.Exercise;
import org.operaton.fitjourney.repository.ExerciseRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the exercise catalog and its one-time seeding.
 * The catalog is reference data and is never queued for sync.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExerciseService {

    static final List<Exercise> CATALOG = List.of(
            exercise("Bench Press", "Chest", "Lie on a flat bench and press the barbell upward until arms are extended."),
            exercise("Incline Dumbbell Press", "Chest", "Press dumbbells upward on an inclined bench to target upper chest."),
            exercise("Chest Fly", "Chest", "Lie on a bench and bring dumbbells together in an arc motion."),
            exercise("Push-Up", "Chest", "Lower your body to the ground and push back up using your arms."),
            exercise("Deadlift", "Back", "Lift a barbell from the ground to hip level, keeping your back straight."),
            exercise("Pull-Up", "Back", "Hang from a bar and pull your body up until your chin clears the bar."),
            exercise("Bent Over Row", "Back", "Bend forward and pull a barbell toward your lower chest."),
            exercise("Lat Pulldown", "Back", "Pull a cable bar down to your chest while seated."),
            exercise("Squat", "Legs", "Lower your body by bending your knees and hips, then return to standing."),
            exercise("Leg Press", "Legs", "Push a weighted platform away from you using your legs."),
            exercise("Leg Extension", "Legs", "Extend your legs against resistance while seated."),
            exercise("Leg Curl", "Legs", "Curl your legs against resistance while lying face down."),
            exercise("Shoulder Press", "Shoulders", "Press weights overhead from shoulder height."),
            exercise("Lateral Raise", "Shoulders", "Raise dumbbells out to the sides until arms are parallel to the floor."),
            exercise("Front Raise", "Shoulders", "Raise dumbbells in front of you to shoulder height."),
            exercise("Bicep Curl", "Biceps", "Curl dumbbells or a barbell toward your shoulders."),
            exercise("Hammer Curl", "Biceps", "Curl dumbbells with palms facing each other."),
            exercise("Tricep Extension", "Triceps", "Extend a weight overhead by straightening your arms."),
            exercise("Tricep Dip", "Triceps", "Lower and raise your body using parallel bars or a bench."),
            exercise("Crunch", "Abs", "Lie on your back and curl your upper body toward your knees."),
            exercise("Plank", "Abs", "Hold a push-up position with your body in a straight line."),
            exercise("Leg Raise", "Abs", "Lie on your back and raise your legs toward the ceiling.")
    );

    private final ExerciseRepository exerciseRepository;

    /**
     * Insert the predefined catalog when the exercise table is empty.
     *
     * @return number of exercises inserted
     */
    @Transactional
    public int seedCatalogIfEmpty() {
        if (exerciseRepository.count() > 0) {
            log.debug("Exercise catalog already present, skipping seed");
            return 0;
        }
        List<Exercise> seeded = CATALOG.stream()
                .map(e -> exercise(e.getName(), e.getMuscleGroup(), e.getDescription()))
                .toList();
        exerciseRepository.saveAll(seeded);
        log.info("Seeded {} exercises", seeded.size());
        return seeded.size();
    }

    @Transactional(readOnly = true)
    public List<Exercise> getAllExercises() {
        return exerciseRepository.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public List<Exercise> getExercisesByMuscleGroup(String muscleGroup) {
        return exerciseRepository.findByMuscleGroupOrderByNameAsc(muscleGroup);
    }

    @Transactional(readOnly = true)
    public List<String> getAllMuscleGroups() {
        return exerciseRepository.findDistinctMuscleGroups();
    }

    @Transactional(readOnly = true)
    public Optional<Exercise> getExercise(Long exerciseId) {
        return exerciseRepository.findById(exerciseId);
    }

    private static Exercise exercise(String name, String muscleGroup, String description) {
        return Exercise.builder()
                .name(name)
                .muscleGroup(muscleGroup)
                .description(description)
                .build();
    }
}
