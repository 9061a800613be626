package org.operaton.fitjourney.repository;

import org.operaton.fitjourney.model.dto.PersonalBestDTO;
import org.operaton.fitjourney.model.entity.Workout;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for Workout entity and the weight aggregates derived from its sets.
 */
@Repository
public interface WorkoutRepository extends JpaRepository<Workout, Long> {

    /**
     * Find all workouts of a user, newest first.
     */
    List<Workout> findByUserIdOrderByDateDescIdDesc(String userId);

    List<Workout> findByUserIdAndDateOrderByIdAsc(String userId, LocalDate date);

    List<Workout> findByUserIdAndDateBetweenOrderByDateAsc(String userId, LocalDate start, LocalDate end);

    /**
     * Count workouts of a user with a date inside [start, end], both inclusive.
     */
    @Query("SELECT COUNT(w) FROM Workout w " +
           "WHERE w.userId = :userId " +
           "AND w.date >= :start " +
           "AND w.date <= :end")
    long countInDateRange(
            @Param("userId") String userId,
            @Param("start") LocalDate start,
            @Param("end") LocalDate end
    );

    /**
     * Heaviest weight a user has lifted for an exercise, ignoring one workout.
     * Used to compare a freshly saved workout against everything recorded before it.
     */
    @Query("SELECT MAX(s.weight) FROM WorkoutSet s, WorkoutExercise we, Workout w " +
           "WHERE s.workoutExerciseId = we.id " +
           "AND we.workoutId = w.id " +
           "AND w.userId = :userId " +
           "AND we.exerciseId = :exerciseId " +
           "AND w.id <> :excludedWorkoutId")
    Double findMaxWeightExcludingWorkout(
            @Param("userId") String userId,
            @Param("exerciseId") Long exerciseId,
            @Param("excludedWorkoutId") Long excludedWorkoutId
    );

    @Query("SELECT MAX(s.weight) FROM WorkoutSet s, WorkoutExercise we, Workout w " +
           "WHERE s.workoutExerciseId = we.id " +
           "AND we.workoutId = w.id " +
           "AND w.userId = :userId " +
           "AND we.exerciseId = :exerciseId")
    Double findMaxWeight(@Param("userId") String userId, @Param("exerciseId") Long exerciseId);

    /**
     * Heaviest weight per exercise for a user, heaviest first.
     */
    @Query("SELECT new org.operaton.fitjourney.model.dto.PersonalBestDTO(e.id, e.name, MAX(s.weight)) " +
           "FROM WorkoutSet s, WorkoutExercise we, Workout w, Exercise e " +
           "WHERE s.workoutExerciseId = we.id " +
           "AND we.workoutId = w.id " +
           "AND we.exerciseId = e.id " +
           "AND w.userId = :userId " +
           "AND s.weight IS NOT NULL " +
           "GROUP BY e.id, e.name " +
           "ORDER BY MAX(s.weight) DESC")
    List<PersonalBestDTO> findPersonalBests(@Param("userId") String userId);

    @Modifying
    @Query("DELETE FROM Workout w WHERE w.userId = :userId")
    int deleteByUserId(@Param("userId") String userId);
}
