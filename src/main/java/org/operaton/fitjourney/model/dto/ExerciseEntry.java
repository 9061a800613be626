package org.operaton.fitjourney.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * An exercise performed in a workout together with its sets.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExerciseEntry {

    private Long exerciseId;

    @Builder.Default
    private List<SetEntry> sets = new ArrayList<>();

    public static ExerciseEntry of(Long exerciseId, SetEntry... sets) {
        return new ExerciseEntry(exerciseId, new ArrayList<>(List.of(sets)));
    }
}
