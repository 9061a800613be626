package org.operaton.fitjourney.model.converter;

import jakarta.persistence.Converter;
import org.operaton.fitjourney.model.entity.Milestone;

@Converter
public class MilestoneKindConverter extends LabeledEnumConverter<Milestone.MilestoneKind> {

    public MilestoneKindConverter() {
        super(Milestone.MilestoneKind.class);
    }
}
