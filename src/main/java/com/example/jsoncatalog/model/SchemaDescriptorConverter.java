package com.example.jsoncatalog.model;

import com.example.jsoncatalog.model.ir.SchemaDescriptor;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class SchemaDescriptorConverter extends JacksonAttributeConverter<SchemaDescriptor> {

    public SchemaDescriptorConverter() {
        super(new TypeReference<>() {});
    }
}
