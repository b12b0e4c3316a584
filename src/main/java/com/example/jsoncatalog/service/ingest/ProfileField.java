package com.example.jsoncatalog.service.ingest;

import com.example.jsoncatalog.model.ir.JsonValueType;
import com.example.jsoncatalog.model.ir.SchemaField;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ProfileField(String name,
                           JsonValueType type,
                           boolean required,
                           boolean nullable,
                           @JsonProperty("enum") @JsonInclude(JsonInclude.Include.ALWAYS) List<String> enumValues,
                           boolean nested,
                           boolean array) {

    static ProfileField from(SchemaField field) {
        return new ProfileField(field.getName(), field.getType(), !field.isNullable(), field.isNullable(),
                field.getEnumValues(), field.isNested(), field.isArray());
    }
}
