package com.example.jsoncatalog.model;

import com.example.jsoncatalog.model.ir.FieldInfo;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class FieldInfoMapConverter extends JacksonAttributeConverter<Map<String, FieldInfo>> {

    public FieldInfoMapConverter() {
        super(new TypeReference<>() {});
    }
}
