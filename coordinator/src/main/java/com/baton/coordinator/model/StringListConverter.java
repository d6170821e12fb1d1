package com.baton.coordinator.model;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class StringListConverter extends JsonColumnConverter<String> {
    public StringListConverter() {
        super(new TypeReference<>() {});
    }
}
