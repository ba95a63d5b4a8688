package com.cadence.model.converter;

import com.cadence.model.WorkflowGraph;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class WorkflowGraphConverter implements AttributeConverter<WorkflowGraph, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(WorkflowGraph attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Workflow graph is not serializable", e);
        }
    }

    @Override
    public WorkflowGraph convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(dbData, WorkflowGraph.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored workflow graph is unreadable", e);
        }
    }
}
