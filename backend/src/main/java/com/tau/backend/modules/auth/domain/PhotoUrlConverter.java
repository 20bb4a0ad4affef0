package com.tau.backend.modules.auth.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class PhotoUrlConverter implements AttributeConverter<PhotoUrl, String> {

    @Override
    public String convertToDatabaseColumn(PhotoUrl attribute) {
        return attribute == null ? null : attribute.asString();
    }

    @Override
    public PhotoUrl convertToEntityAttribute(String dbData) {
        return dbData == null ? null : PhotoUrl.of(dbData);
    }
}
