package com.premiergroup.ad_delivery_engine.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Map;
import java.util.TreeMap;

/**
 * Bucket-to-count maps (rollup breakdowns) as sorted JSON text.
 */
@Converter
public class JsonCountsConverter implements AttributeConverter<Map<String, Long>, String> {

    private static final TypeReference<TreeMap<String, Long>> TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(Map<String, Long> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return "{}";
        }
        try {
            return JsonMapConverter.MAPPER.writeValueAsString(new TreeMap<>(attribute));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize breakdown", e);
        }
    }

    @Override
    public Map<String, Long> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new TreeMap<>();
        }
        try {
            return JsonMapConverter.MAPPER.readValue(dbData, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot read breakdown column", e);
        }
    }
}
