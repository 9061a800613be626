package org.operaton.fitjourney.repository;

import org.operaton.fitjourney.model.entity.WorkoutExercise;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WorkoutExerciseRepository extends JpaRepository<WorkoutExercise, Long> {

    List<WorkoutExercise> findByWorkoutIdOrderByIdAsc(Long workoutId);

    long countByWorkoutId(Long workoutId);

    @Modifying
    @Query("DELETE FROM WorkoutExercise we WHERE we.workoutId = :workoutId")
    int deleteByWorkoutId(@Param("workoutId") Long workoutId);

    @Modifying
    @Query("DELETE FROM WorkoutExercise we WHERE we.workoutId IN " +
           "(SELECT w.id FROM Workout w WHERE w.userId = :userId)")
    int deleteByUserId(@Param("userId") String userId);
}
