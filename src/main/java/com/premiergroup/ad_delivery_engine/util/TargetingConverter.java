package com.premiergroup.ad_delivery_engine.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.premiergroup.ad_delivery_engine.entity.Targeting;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class TargetingConverter implements AttributeConverter<Targeting, String> {

    @Override
    public String convertToDatabaseColumn(Targeting attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return JsonMapConverter.MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize targeting", e);
        }
    }

    @Override
    public Targeting convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new Targeting();
        }
        try {
            return JsonMapConverter.MAPPER.readValue(dbData, Targeting.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot read targeting column", e);
        }
    }
}
