package org.operaton.fitjourney.model.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Stores timestamps as ISO-8601 local date-time strings.
 * SQLite's {@code CURRENT_TIMESTAMP} default ({@code yyyy-MM-dd HH:mm:ss}) is accepted on read.
 */
@Converter
public class IsoDateTimeConverter implements AttributeConverter<LocalDateTime, String> {

    @Override
    public String convertToDatabaseColumn(LocalDateTime attribute) {
        return attribute != null ? attribute.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME) : null;
    }

    @Override
    public LocalDateTime convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        String normalized = dbData.replace(' ', 'T');
        if (normalized.length() == 10) {
            normalized = normalized + "T00:00:00";
        }
        return LocalDateTime.parse(normalized, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
