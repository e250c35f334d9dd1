package com.example.rota.breaks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Stores a tier list as a JSON array column.
 */
@Converter
public class BreakTiersConverter implements AttributeConverter<List<BreakTier>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<BreakTier>> TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<BreakTier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(tiers);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize break tiers", e);
        }
    }

    @Override
    public List<BreakTier> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored break tiers are not valid JSON", e);
        }
    }
}
