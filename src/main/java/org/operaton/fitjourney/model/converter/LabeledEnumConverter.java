package org.operaton.fitjourney.model.converter;

import jakarta.persistence.AttributeConverter;

/**
 * Maps an enum to its storage label and back.
 * Unknown labels fail loudly so a corrupted row is never silently reinterpreted.
 */
public abstract class LabeledEnumConverter<E extends Enum<E> & StorageLabel> implements AttributeConverter<E, String> {

    private final Class<E> type;

    protected LabeledEnumConverter(Class<E> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(E attribute) {
        return attribute != null ? attribute.getLabel() : null;
    }

    @Override
    public E convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.getLabel().equals(dbData)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " label: " + dbData);
    }
}
