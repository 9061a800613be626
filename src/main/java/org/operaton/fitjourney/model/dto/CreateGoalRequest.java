package org.operaton.fitjourney.model.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.fitjourney.model.entity.Goal;

import java.time.LocalDate;

/**
 * Request DTO for creating a goal of any kind.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateGoalRequest {

    @NotNull(message = "Goal kind is required")
    private Goal.GoalKind kind;

    /**
     * Required for ExerciseTarget, must be null otherwise.
     */
    private Long exerciseId;

    @PositiveOrZero(message = "Target value must not be negative")
    private Double targetValue;

    @NotNull(message = "Start date is required")
    private LocalDate startDate;

    @NotNull(message = "End date is required")
    private LocalDate endDate;

    private Double startingValue;

    @PositiveOrZero(message = "Current progress must not be negative")
    private Double currentProgress;
}
