package org.operaton.fitjourney.model.converter;

import jakarta.persistence.Converter;
import org.operaton.fitjourney.model.entity.ChangeQueueEntry;

@Converter
public class SyncOperationConverter extends LabeledEnumConverter<ChangeQueueEntry.SyncOperation> {

    public SyncOperationConverter() {
        super(ChangeQueueEntry.SyncOperation.class);
    }
}
