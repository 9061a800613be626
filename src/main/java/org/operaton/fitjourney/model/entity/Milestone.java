package org.operaton.fitjourney.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.operaton.fitjourney.model.converter.IsoDateConverter;
import org.operaton.fitjourney.model.converter.MilestoneKindConverter;
import org.operaton.fitjourney.model.converter.StorageLabel;

import java.time.LocalDate;

/**
 * Append-only achievement record.
 */
@Entity
@Table(name = "milestone")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Milestone {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "milestone_id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Convert(converter = MilestoneKindConverter.class)
    @Column(name = "type", nullable = false)
    private MilestoneKind kind;

    @Column(name = "exercise_id")
    private Long exerciseId;

    private Double value;

    @Convert(converter = IsoDateConverter.class)
    @Column(nullable = false)
    private LocalDate date;

    public enum MilestoneKind implements StorageLabel {
        PERSONAL_BEST("PersonalBest"),
        LONGEST_STREAK("LongestStreak"),
        GOAL_ACHIEVED("GoalAchieved");

        private final String label;

        MilestoneKind(String label) {
            this.label = label;
        }

        @Override
        public String getLabel() {
            return label;
        }
    }
}
