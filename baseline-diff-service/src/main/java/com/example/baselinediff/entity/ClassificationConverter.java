package com.example.baselinediff.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class ClassificationConverter implements AttributeConverter<Classification, String> {

    @Override
    public String convertToDatabaseColumn(Classification attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public Classification convertToEntityAttribute(String dbData) {
        return dbData != null ? Classification.fromValue(dbData) : null;
    }
}
