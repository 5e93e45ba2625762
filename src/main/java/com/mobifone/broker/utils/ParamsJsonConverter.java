package com.mobifone.broker.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class ParamsJsonConverter implements AttributeConverter<Map<String, String>, String> {
    private static final ObjectMapper om = new ObjectMapper();
    private static final TypeReference<Map<String, String>> TYPE = new TypeReference<>(){};

    @Override
    public String convertToDatabaseColumn(Map<String, String> attribute) {
        try {
            if (attribute == null || attribute.isEmpty()) return null;
            return om.writeValueAsString(attribute);
        } catch (Exception e) {
            throw new IllegalStateException("Cannot write params to JSON", e);
        }
    }

    @Override
    public Map<String, String> convertToEntityAttribute(String dbData) {
        try {
            if (dbData == null || dbData.isBlank()) return new LinkedHashMap<>();
            return om.readValue(dbData, TYPE);
        } catch (Exception e) {
            throw new IllegalStateException("Cannot read params from JSON", e);
        }
    }
}
