package org.operaton.fitjourney.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.operaton.fitjourney.model.converter.GoalKindConverter;
import org.operaton.fitjourney.model.converter.GoalStateConverter;
import org.operaton.fitjourney.model.converter.IsoDateConverter;
import org.operaton.fitjourney.model.converter.StorageLabel;

import java.time.LocalDate;

/**
 * Entity representing a user goal.
 * A goal starts {@link GoalState#ACTIVE} and moves exactly once to either
 * {@link GoalState#ACHIEVED} or {@link GoalState#EXPIRED}.
 */
@Entity
@Table(name = "goal")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Goal {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "goal_id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Convert(converter = GoalKindConverter.class)
    @Column(name = "type", nullable = false)
    private GoalKind kind;

    /**
     * Required for ExerciseTarget goals, null for every other kind.
     */
    @Column(name = "exercise_id")
    private Long exerciseId;

    @Column(name = "target_value")
    private Double targetValue;

    @Convert(converter = IsoDateConverter.class)
    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Convert(converter = IsoDateConverter.class)
    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Convert(converter = GoalStateConverter.class)
    @Column(name = "achieved", nullable = false)
    @Builder.Default
    private GoalState state = GoalState.ACTIVE;

    @Column(name = "current_progress", nullable = false)
    @Builder.Default
    private double currentProgress = 0;

    /**
     * Baseline body weight for WeightTarget goals; decides loss vs. gain direction.
     */
    @Column(name = "starting_weight")
    private Double startingValue;

    @Convert(converter = IsoDateConverter.class)
    @Column(name = "achieved_date")
    private LocalDate achievedDate;

    public boolean isActive() {
        return state == GoalState.ACTIVE;
    }

    /**
     * Goal kinds and their stored labels.
     */
    public enum GoalKind implements StorageLabel {
        /** Lift a target weight on one exercise */
        EXERCISE_TARGET("ExerciseTarget"),
        /** Complete a number of workouts between start and end date */
        WORKOUT_FREQUENCY("WorkoutFrequency"),
        /** Reach a body weight */
        WEIGHT_TARGET("WeightTarget");

        private final String label;

        GoalKind(String label) {
            this.label = label;
        }

        @Override
        public String getLabel() {
            return label;
        }
    }

    /**
     * Achievement state, stored as 0/1/2.
     */
    public enum GoalState {
        ACTIVE(0),
        ACHIEVED(1),
        EXPIRED(2);

        private final int code;

        GoalState(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }

        public static GoalState fromCode(int code) {
            for (GoalState state : values()) {
                if (state.code == code) {
                    return state;
                }
            }
            throw new IllegalArgumentException("Unknown goal state code: " + code);
        }
    }
}
