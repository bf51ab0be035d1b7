package com.zerotrust.access.persistence.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;
import java.util.Map;

@Converter
public class JsonListConverter extends JsonAttributeConverter<List<Map<String, Object>>> {

    public JsonListConverter() {
        super(new TypeReference<>() {
        });
    }
}
