package com.yoursp.xerosync.model.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class JobTypeConverter implements AttributeConverter<JobType, String> {

    @Override
    public String convertToDatabaseColumn(JobType attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public JobType convertToEntityAttribute(String dbData) {
        return dbData != null ? JobType.fromValue(dbData) : null;
    }
}
