package org.operaton.fitjourney.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.operaton.fitjourney.model.converter.IsoDateConverter;

import java.time.LocalDate;

/**
 * A completed workout on a given day. Owns its {@link WorkoutExercise} rows.
 */
@Entity
@Table(name = "workout", indexes = {
    @Index(name = "idx_workout_user_date", columnList = "user_id, date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Workout {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "workout_id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Convert(converter = IsoDateConverter.class)
    @Column(nullable = false)
    private LocalDate date;

    /**
     * Duration in minutes. Null means unspecified; zero is never stored.
     */
    private Integer duration;

    private String notes;
}
