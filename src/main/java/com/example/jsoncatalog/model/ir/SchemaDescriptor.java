package com.example.jsoncatalog.model.ir;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchemaDescriptor {
    private String tableName;
    private String ddl;
    private JsonNode jsonSchema;
    private List<SchemaField> fields = new ArrayList<>();
}
