package org.operaton.fitjourney.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One set inside a workout save request. Reps and weight are optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SetEntry {

    private int setNumber;
    private Integer reps;
    private Double weight;
}
