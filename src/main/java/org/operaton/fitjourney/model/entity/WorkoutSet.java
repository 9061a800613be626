package org.operaton.fitjourney.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * One set of an exercise within a workout. Set numbers are positive and unique per parent.
 */
@Entity
@Table(name = "workout_set",
       uniqueConstraints = @UniqueConstraint(columnNames = {"workout_exercise_id", "set_number"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkoutSet {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "workout_set_id")
    private Long id;

    @Column(name = "workout_exercise_id", nullable = false)
    private Long workoutExerciseId;

    @Column(name = "set_number", nullable = false)
    private Integer setNumber;

    private Integer reps;

    private Double weight;
}
