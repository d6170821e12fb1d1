package com.baton.coordinator.model;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class ScopeItemListConverter extends JsonColumnConverter<ScopeItem> {
    public ScopeItemListConverter() {
        super(new TypeReference<>() {});
    }
}
