package com.fintech.paymentengine.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON text encoding for small string maps stored in columns.
 */
public final class JsonConverters {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private JsonConverters() {
    }

    public static String write(Map<String, String> map) {
        if (map == null || map.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise map column", e);
        }
    }

    public static Map<String, String> read(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return MAPPER.readValue(json, STRING_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot deserialise map column", e);
        }
    }

    @Converter
    public static class ExtraConverter implements AttributeConverter<TransactionExtra, String> {

        @Override
        public String convertToDatabaseColumn(TransactionExtra attribute) {
            return attribute == null ? null : write(attribute.asMap());
        }

        @Override
        public TransactionExtra convertToEntityAttribute(String dbData) {
            return new TransactionExtra(read(dbData));
        }
    }
}
