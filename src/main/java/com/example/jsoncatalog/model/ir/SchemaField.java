package com.example.jsoncatalog.model.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchemaField {
    private String name;
    private String columnName; // sanitized relational column
    private JsonValueType type; // dominant type, see SchemaGeneratorService.dominantType
    private boolean nullable;
    private boolean nested;
    private boolean array;

    // Reserved for value enumeration detection, always null for now
    @JsonProperty("enum")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private List<String> enumValues;
}
