package org.operaton.fitjourney.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Heaviest weight a user has lifted for one exercise.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PersonalBestDTO {

    private Long exerciseId;
    private String exerciseName;
    private Double maxWeight;
}
