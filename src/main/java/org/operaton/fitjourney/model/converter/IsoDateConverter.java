package org.operaton.fitjourney.model.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Stores date-only fields as canonical ISO-8601 day strings ({@code yyyy-MM-dd}).
 * Older rows written with a time part ({@code 2025-03-01T00:00:00.000}) are read back as their day.
 */
@Converter
public class IsoDateConverter implements AttributeConverter<LocalDate, String> {

    @Override
    public String convertToDatabaseColumn(LocalDate attribute) {
        return attribute != null ? attribute.format(DateTimeFormatter.ISO_LOCAL_DATE) : null;
    }

    @Override
    public LocalDate convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        String day = dbData.length() > 10 ? dbData.substring(0, 10) : dbData;
        return LocalDate.parse(day, DateTimeFormatter.ISO_LOCAL_DATE);
    }
}
