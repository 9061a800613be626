package org.operaton.fitjourney.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.operaton.fitjourney.model.converter.IsoDateConverter;

import java.time.LocalDate;

/**
 * Running streak counters, one row per user.
 */
@Entity
@Table(name = "streak")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Streak {

    @Id
    @Column(name = "user_id")
    private String userId;

    @Column(name = "current_streak", nullable = false)
    private int currentStreak;

    @Column(name = "longest_streak", nullable = false)
    private int longestStreak;

    @Convert(converter = IsoDateConverter.class)
    @Column(name = "last_activity_date")
    private LocalDate lastActivityDate;

    @Convert(converter = IsoDateConverter.class)
    @Column(name = "last_workout_date")
    private LocalDate lastWorkoutDate;
}
