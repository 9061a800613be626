package org.operaton.fitjourney.model.converter;

import jakarta.persistence.Converter;
import org.operaton.fitjourney.model.entity.Goal;

@Converter
public class GoalKindConverter extends LabeledEnumConverter<Goal.GoalKind> {

    public GoalKindConverter() {
        super(Goal.GoalKind.class);
    }
}
