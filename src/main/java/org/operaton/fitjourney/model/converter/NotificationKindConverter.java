package org.operaton.fitjourney.model.converter;

import jakarta.persistence.Converter;
import org.operaton.fitjourney.model.entity.Notification;

@Converter
public class NotificationKindConverter extends LabeledEnumConverter<Notification.NotificationKind> {

    public NotificationKindConverter() {
        super(Notification.NotificationKind.class);
    }
}
