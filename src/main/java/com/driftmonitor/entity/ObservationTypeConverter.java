package com.driftmonitor.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class ObservationTypeConverter implements AttributeConverter<ObservationType, String> {

    @Override
    public String convertToDatabaseColumn(ObservationType attribute) {
        return attribute == null ? null : attribute.columnValue();
    }

    @Override
    public ObservationType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : ObservationType.fromColumnValue(dbData);
    }
}
