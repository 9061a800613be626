package org.operaton.fitjourney.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Join row between a workout and an exercise. Owns its {@link WorkoutSet} rows.
 */
@Entity
@Table(name = "workout_exercise")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkoutExercise {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "workout_exercise_id")
    private Long id;

    @Column(name = "workout_id", nullable = false)
    private Long workoutId;

    @Column(name = "exercise_id", nullable = false)
    private Long exerciseId;
}
