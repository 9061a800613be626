package org.operaton.fitjourney.repository;

import org.operaton.fitjourney.model.entity.Exercise;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the exercise catalog.
 */
@Repository
public interface ExerciseRepository extends JpaRepository<Exercise, Long> {

    List<Exercise> findAllByOrderByNameAsc();

    List<Exercise> findByMuscleGroupOrderByNameAsc(String muscleGroup);

    /**
     * Distinct muscle groups in alphabetical order.
     */
    @Query("SELECT DISTINCT e.muscleGroup FROM Exercise e ORDER BY e.muscleGroup")
    List<String> findDistinctMuscleGroups();
}
