package org.operaton.fitjourney.repository;

import org.operaton.fitjourney.model.entity.WorkoutSet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WorkoutSetRepository extends JpaRepository<WorkoutSet, Long> {

    List<WorkoutSet> findByWorkoutExerciseIdOrderBySetNumberAsc(Long workoutExerciseId);

    /**
     * All sets of a workout, across its exercises.
     */
    @Query("SELECT s FROM WorkoutSet s, WorkoutExercise we " +
           "WHERE s.workoutExerciseId = we.id AND we.workoutId = :workoutId " +
           "ORDER BY we.id, s.setNumber")
    List<WorkoutSet> findByWorkoutId(@Param("workoutId") Long workoutId);

    @Modifying
    @Query("DELETE FROM WorkoutSet s WHERE s.workoutExerciseId IN " +
           "(SELECT we.id FROM WorkoutExercise we WHERE we.workoutId = :workoutId)")
    int deleteByWorkoutId(@Param("workoutId") Long workoutId);

    @Modifying
    @Query("DELETE FROM WorkoutSet s WHERE s.workoutExerciseId IN " +
           "(SELECT we.id FROM WorkoutExercise we, Workout w " +
           "WHERE we.workoutId = w.id AND w.userId = :userId)")
    int deleteByUserId(@Param("userId") String userId);
}
