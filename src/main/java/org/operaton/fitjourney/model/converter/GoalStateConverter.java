package org.operaton.fitjourney.model.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.operaton.fitjourney.model.entity.Goal;

/**
 * Stores {@link Goal.GoalState} as its integer code (Active=0, Achieved=1, Expired=2).
 */
@Converter
public class GoalStateConverter implements AttributeConverter<Goal.GoalState, Integer> {

    @Override
    public Integer convertToDatabaseColumn(Goal.GoalState attribute) {
        return attribute != null ? attribute.getCode() : null;
    }

    @Override
    public Goal.GoalState convertToEntityAttribute(Integer dbData) {
        return dbData != null ? Goal.GoalState.fromCode(dbData) : null;
    }
}
