package org.operaton.fitjourney.model.converter;

import jakarta.persistence.Converter;
import org.operaton.fitjourney.model.entity.DailyLog;

@Converter
public class ActivityKindConverter extends LabeledEnumConverter<DailyLog.ActivityKind> {

    public ActivityKindConverter() {
        super(DailyLog.ActivityKind.class);
    }
}
