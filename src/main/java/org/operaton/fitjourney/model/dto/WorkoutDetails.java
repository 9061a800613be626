package org.operaton.fitjourney.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.fitjourney.model.entity.Exercise;
import org.operaton.fitjourney.model.entity.Workout;
import org.operaton.fitjourney.model.entity.WorkoutSet;

import java.util.List;

/**
 * A workout with its exercises and their sets ordered by set number.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkoutDetails {

    private Workout workout;
    private List<PerformedExercise> exercises;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PerformedExercise {
        private Long workoutExerciseId;
        private Exercise exercise;
        private List<WorkoutSet> sets;
    }
}
