package com.mobifone.broker.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobifone.broker.entity.enumeration.ClientOs;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Stores a set of client OSes as a JSON array; an empty set means "any OS". */
@Converter
public class ClientOsSetConverter implements AttributeConverter<Set<ClientOs>, String> {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<ClientOs>> TYPE = new TypeReference<>(){};

    @Override
    public String convertToDatabaseColumn(Set<ClientOs> attribute) {
        try {
            return attribute == null || attribute.isEmpty() ? null : MAPPER.writeValueAsString(attribute);
        } catch (Exception e) {
            throw new IllegalStateException("Cannot write client OS set to JSON", e);
        }
    }

    @Override
    public Set<ClientOs> convertToEntityAttribute(String dbData) {
        try {
            if (dbData == null || dbData.isBlank()) return EnumSet.noneOf(ClientOs.class);
            List<ClientOs> values = MAPPER.readValue(dbData, TYPE);
            return values.isEmpty() ? EnumSet.noneOf(ClientOs.class) : EnumSet.copyOf(values);
        } catch (Exception e) {
            throw new IllegalStateException("Cannot read client OS set from JSON", e);
        }
    }
}
