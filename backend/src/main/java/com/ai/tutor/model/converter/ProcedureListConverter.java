package com.ai.tutor.model.converter;

import com.ai.tutor.dto.ProcedureDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/** Stores procedure descriptors as a JSON array in a TEXT column. */
@Slf4j
@Converter
public class ProcedureListConverter implements AttributeConverter<List<ProcedureDescriptor>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<ProcedureDescriptor>> LIST_TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<ProcedureDescriptor> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize procedures: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public List<ProcedureDescriptor> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return MAPPER.readValue(dbData, LIST_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize procedures: {}", e.getMessage());
            return new ArrayList<>();
        }
    }
}
